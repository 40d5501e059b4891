package work.flowgraph.engine.error;

/**
 * A block failed while executing a step.
 */
public final class StepExecutionException extends WorkflowException {
    private final String stepName;

    public StepExecutionException(String stepName, Throwable cause) {
        super("step_execution_failed", "Step '" + stepName + "' failed: " + rootMessage(cause), cause);
        this.stepName = stepName;
    }

    public StepExecutionException(String stepName, String message) {
        super("step_execution_failed", "Step '" + stepName + "' failed: " + message);
        this.stepName = stepName;
    }

    public String stepName() {
        return stepName;
    }

    private static String rootMessage(Throwable cause) {
        if (cause == null) {
            return "unknown error";
        }
        var message = cause.getMessage();
        return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
    }
}
