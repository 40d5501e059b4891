package work.flowgraph.engine.api;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import work.flowgraph.engine.runtime.FailurePolicy;

/**
 * One run request: the workflow, its inputs as a JSON object and optional per-run overrides of the
 * engine's execution settings.
 */
public record RunConfiguration(
    WorkflowTarget target,
    String inputPayload,
    Optional<FailurePolicy> failurePolicy,
    Optional<Integer> maxConcurrency,
    Optional<Duration> timeout,
    LogLevel logLevel
) {
    public RunConfiguration {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(inputPayload, "inputPayload");
        Objects.requireNonNull(failurePolicy, "failurePolicy");
        Objects.requireNonNull(maxConcurrency, "maxConcurrency");
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(logLevel, "logLevel");
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean overridesExecution() {
        return failurePolicy.isPresent() || maxConcurrency.isPresent() || timeout.isPresent();
    }

    public static final class Builder {
        private WorkflowTarget target;
        private String inputPayload = "{}";
        private Optional<FailurePolicy> failurePolicy = Optional.empty();
        private Optional<Integer> maxConcurrency = Optional.empty();
        private Optional<Duration> timeout = Optional.empty();
        private LogLevel logLevel = LogLevel.WARN;

        public Builder target(WorkflowTarget target) {
            this.target = target;
            return this;
        }

        public Builder inputPayload(String inputPayload) {
            this.inputPayload = inputPayload;
            return this;
        }

        public Builder failurePolicy(Optional<FailurePolicy> failurePolicy) {
            this.failurePolicy = failurePolicy;
            return this;
        }

        public Builder maxConcurrency(Optional<Integer> maxConcurrency) {
            this.maxConcurrency = maxConcurrency;
            return this;
        }

        public Builder timeout(Optional<Duration> timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public RunConfiguration build() {
            return new RunConfiguration(target, inputPayload, failurePolicy, maxConcurrency, timeout, logLevel);
        }
    }
}
