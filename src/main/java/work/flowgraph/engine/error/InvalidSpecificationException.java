package work.flowgraph.engine.error;

/**
 * Structural problem in the raw specification (duplicate names, unknown block type, missing fields...).
 */
public final class InvalidSpecificationException extends WorkflowCompilationException {
    public InvalidSpecificationException(String message) {
        super("invalid_specification", message);
    }

    public InvalidSpecificationException(String message, Throwable cause) {
        super("invalid_specification", message, cause);
    }
}
