package work.flowgraph.engine.error;

import java.util.List;

/**
 * Step dependencies form a cycle. {@link #cycle()} lists the steps in dependency order.
 */
public final class CyclicWorkflowException extends WorkflowCompilationException {
    private final List<String> cycle;

    public CyclicWorkflowException(List<String> cycle) {
        super("cyclic_workflow", "Workflow contains a cycle: " + String.join(" -> ", cycle) + " -> " + cycle.get(0));
        this.cycle = List.copyOf(cycle);
    }

    public List<String> cycle() {
        return cycle;
    }
}
