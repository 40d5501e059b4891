package work.flowgraph.engine.telemetry;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * What one run consumed: the steps of the plan, how many batch items it processed and when it ran.
 * {@code workflowId} is {@code null} for ad-hoc specifications.
 */
public record WorkflowRunUsage(
    List<String> stepDescriptors,
    String workflowId,
    int processedItems,
    Instant startedAt,
    Instant finishedAt
) {
    public WorkflowRunUsage {
        stepDescriptors = List.copyOf(stepDescriptors);
        Objects.requireNonNull(startedAt, "startedAt");
        Objects.requireNonNull(finishedAt, "finishedAt");
    }

    public Duration duration() {
        return Duration.between(startedAt, finishedAt);
    }
}
