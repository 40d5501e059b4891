package work.flowgraph.engine.error;

/**
 * The specification source answered, but without the expected {@code workflow.config.specification} structure.
 */
public final class MalformedWorkflowResponseException extends WorkflowException {
    public MalformedWorkflowResponseException(String message) {
        super("malformed_workflow_response", message);
    }

    public MalformedWorkflowResponseException(String message, Throwable cause) {
        super("malformed_workflow_response", message, cause);
    }
}
