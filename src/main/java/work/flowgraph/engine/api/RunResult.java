package work.flowgraph.engine.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Outcome of {@link WorkflowEngine#run(RunConfiguration)}, usable by the CLI and embedding apps.
 */
public record RunResult(Status status, Map<String, Object> metadata, Instant startedAt, Instant finishedAt) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public RunResult {
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static RunResult success(Map<String, Object> metadata, Instant startedAt) {
        return new RunResult(Status.SUCCESS, metadata, startedAt, Instant.now());
    }

    public static RunResult partial(Map<String, Object> metadata, Instant startedAt) {
        return new RunResult(Status.PARTIAL, metadata, startedAt, Instant.now());
    }

    public static RunResult failure(Map<String, Object> error, Map<String, Object> metadata, Instant startedAt) {
        Map<String, Object> meta = new LinkedHashMap<>(metadata);
        meta.putIfAbsent("error", error);
        return new RunResult(Status.FAILURE, meta, startedAt, Instant.now());
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("status", status.name().toLowerCase(Locale.ROOT));
        serializable.put("metadata", metadata);
        serializable.put("startedAt", startedAt.toString());
        serializable.put("finishedAt", finishedAt.toString());
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (Exception ex) {
            return "{\"status\":\"error\",\"message\":\"" + ex.getMessage() + "\"}";
        }
    }

    public enum Status {
        SUCCESS(0),
        PARTIAL(0),
        FAILURE(1);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
