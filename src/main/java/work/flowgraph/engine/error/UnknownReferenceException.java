package work.flowgraph.engine.error;

/**
 * A selector points at an input, step or step output that the specification does not declare.
 */
public final class UnknownReferenceException extends WorkflowCompilationException {
    private final String stepName;
    private final String selector;

    public UnknownReferenceException(String stepName, String selector, String reason) {
        super("unknown_reference", "Unknown reference " + selector + " used by " + describe(stepName) + ": " + reason);
        this.stepName = stepName;
        this.selector = selector;
    }

    private static String describe(String stepName) {
        return stepName == null ? "workflow outputs" : "step '" + stepName + "'";
    }

    /**
     * Consumer step, or {@code null} when the reference comes from the workflow outputs section.
     */
    public String stepName() {
        return stepName;
    }

    public String selector() {
        return selector;
    }
}
