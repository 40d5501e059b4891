package work.flowgraph.engine.error;

public final class InvalidRuntimeInputException extends WorkflowException {
    public InvalidRuntimeInputException(String message) {
        super("invalid_runtime_input", message);
    }
}
