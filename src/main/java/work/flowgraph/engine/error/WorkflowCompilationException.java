package work.flowgraph.engine.error;

/**
 * Raised while turning a specification into a plan. No partial plan exists when one of these is thrown.
 */
public abstract class WorkflowCompilationException extends WorkflowException {
    protected WorkflowCompilationException(String code, String message) {
        super(code, message);
    }

    protected WorkflowCompilationException(String code, String message, Throwable cause) {
        super(code, message, cause);
    }
}
