package work.flowgraph.engine.error;

/**
 * The executor looked up a value that the planner promised would be present. Indicates a defect.
 */
public final class UnresolvedValueException extends WorkflowException {
    public UnresolvedValueException(String stepName, String selector) {
        super("unresolved_value", "Value for " + selector + " is not available to step '" + stepName + "'");
    }
}
