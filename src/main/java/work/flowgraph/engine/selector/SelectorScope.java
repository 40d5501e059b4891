package work.flowgraph.engine.selector;

/**
 * What a selector points at.
 */
public enum SelectorScope {
    INPUT("$inputs"),
    STEP_OUTPUT("$steps");

    private final String prefix;

    SelectorScope(String prefix) {
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }
}
