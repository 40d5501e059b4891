package work.flowgraph.engine.telemetry;

import java.io.IOException;
import java.util.List;

/**
 * Destination of flushed usage records. A thrown exception makes the collector keep the records for the
 * next flush.
 */
@FunctionalInterface
public interface UsageSink {
    void send(String apiKey, List<UsageRecord> records) throws IOException;
}
