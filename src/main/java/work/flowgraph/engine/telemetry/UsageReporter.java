package work.flowgraph.engine.telemetry;

/**
 * Receives one usage event per finished run. Implementations must not block the caller for long and must
 * tolerate concurrent calls.
 */
@FunctionalInterface
public interface UsageReporter {
    UsageReporter NOOP = usage -> {};

    void recordWorkflowRun(WorkflowRunUsage usage);
}
