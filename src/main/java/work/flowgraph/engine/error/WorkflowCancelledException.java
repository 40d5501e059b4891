package work.flowgraph.engine.error;

/**
 * The run was cancelled or exceeded its timeout before producing outputs.
 */
public final class WorkflowCancelledException extends WorkflowException {
    public WorkflowCancelledException(String message) {
        super("workflow_cancelled", message);
    }
}
