package work.flowgraph.engine.error;

/**
 * Root of every failure raised by the engine. Carries a stable machine-readable code next to the message.
 */
public class WorkflowException extends RuntimeException {
    private final String code;

    public WorkflowException(String code, String message) {
        super(message);
        this.code = code;
    }

    public WorkflowException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() {
        return code;
    }
}
