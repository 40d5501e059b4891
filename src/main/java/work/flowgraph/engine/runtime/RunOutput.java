package work.flowgraph.engine.runtime;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of a run: workflow outputs in declaration order. Batched outputs are lists with one entry per
 * batch item. Under the isolate policy {@link #failures()} lists the steps that failed or were skipped,
 * and outputs that depend on them are absent.
 */
public final class RunOutput {
    private final Map<String, Object> values;
    private final Map<String, String> failures;
    private final int batchSize;
    private final Duration duration;

    RunOutput(Map<String, Object> values, Map<String, String> failures, int batchSize, Duration duration) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        this.failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
        this.batchSize = batchSize;
        this.duration = duration;
    }

    public Map<String, Object> values() {
        return values;
    }

    public Object get(String name) {
        return values.get(name);
    }

    public boolean has(String name) {
        return values.containsKey(name);
    }

    /**
     * Failed or skipped steps mapped to the reason, in the order they were recorded.
     */
    public Map<String, String> failures() {
        return failures;
    }

    public boolean isPartial() {
        return !failures.isEmpty();
    }

    public int batchSize() {
        return batchSize;
    }

    public Duration duration() {
        return duration;
    }

    @Override
    public String toString() {
        return "RunOutput" + values + (failures.isEmpty() ? "" : " failures=" + failures);
    }
}
