package work.flowgraph.engine.error;

public final class WorkflowSourceException extends WorkflowException {
    public WorkflowSourceException(String message) {
        super("workflow_source_failed", message);
    }

    public WorkflowSourceException(String message, Throwable cause) {
        super("workflow_source_failed", message, cause);
    }
}
