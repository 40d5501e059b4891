package work.flowgraph.engine.config;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * Usage reporting: where records go, how often they are flushed and how many payloads may wait in the
 * queue. {@code apiKey} may be {@code null}; records without a key are dropped by the collector.
 */
public record TelemetrySettings(
    boolean enabled,
    URI endpoint,
    String apiKey,
    Duration flushInterval,
    int queueSize,
    boolean optOut
) {
    public static final URI DEFAULT_ENDPOINT = URI.create("https://api.roboflow.com/usage/inference");
    public static final Duration DEFAULT_FLUSH_INTERVAL = Duration.ofSeconds(10);
    public static final int DEFAULT_QUEUE_SIZE = 10;

    public TelemetrySettings {
        Objects.requireNonNull(endpoint, "endpoint");
        Objects.requireNonNull(flushInterval, "flushInterval");
        if (flushInterval.isZero() || flushInterval.isNegative()) {
            throw new IllegalArgumentException("telemetry.flush_interval must be positive");
        }
        if (queueSize < 1) {
            throw new IllegalArgumentException("telemetry.queue_size must be at least 1");
        }
    }

    public static TelemetrySettings defaults() {
        return new TelemetrySettings(false, DEFAULT_ENDPOINT, null, DEFAULT_FLUSH_INTERVAL, DEFAULT_QUEUE_SIZE, false);
    }
}
