package work.flowgraph.engine.error;

/**
 * A value uses the reserved {@code $inputs.} / {@code $steps.} prefix but is not a well-formed selector.
 */
public final class MalformedSelectorException extends WorkflowCompilationException {
    private final String field;
    private final String selector;

    public MalformedSelectorException(String field, String selector, String reason) {
        super("malformed_selector", "Malformed selector '" + selector + "' in field '" + field + "': " + reason);
        this.field = field;
        this.selector = selector;
    }

    public String field() {
        return field;
    }

    public String selector() {
        return selector;
    }
}
