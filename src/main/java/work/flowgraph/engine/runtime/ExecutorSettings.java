package work.flowgraph.engine.runtime;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Engine-wide execution policy: failure handling, how many block invocations may run at once, and an
 * optional deadline for a whole run.
 */
public record ExecutorSettings(FailurePolicy failurePolicy, int maxConcurrency, Optional<Duration> runTimeout) {
    public ExecutorSettings {
        Objects.requireNonNull(failurePolicy, "failurePolicy");
        Objects.requireNonNull(runTimeout, "runTimeout");
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be at least 1: " + maxConcurrency);
        }
    }

    public static ExecutorSettings defaults() {
        return new ExecutorSettings(FailurePolicy.FAIL_FAST, Runtime.getRuntime().availableProcessors(), Optional.empty());
    }

    public ExecutorSettings withFailurePolicy(FailurePolicy policy) {
        return new ExecutorSettings(policy, maxConcurrency, runTimeout);
    }

    public ExecutorSettings withMaxConcurrency(int concurrency) {
        return new ExecutorSettings(failurePolicy, concurrency, runTimeout);
    }

    public ExecutorSettings withRunTimeout(Duration timeout) {
        return new ExecutorSettings(failurePolicy, maxConcurrency, Optional.ofNullable(timeout));
    }
}
