package work.flowgraph.engine.compiler;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import work.flowgraph.engine.error.CyclicWorkflowException;
import work.flowgraph.engine.error.UnknownReferenceException;
import work.flowgraph.engine.selector.FieldValue;
import work.flowgraph.engine.selector.SelectorScope;

/**
 * Collects selectors into a {@link DependencyGraph}, rejecting dangling references and cycles.
 */
public final class DependencyGraphBuilder {
    private DependencyGraphBuilder() {}

    /**
     * @param manifests     parsed steps in declaration order
     * @param inputNames    declared workflow inputs
     * @param stepOutputs   declared output names per step
     * @param workflowOutputs selectors of the workflow outputs section, only checked for dangling references
     */
    public static DependencyGraph build(
        List<StepManifest> manifests,
        Set<String> inputNames,
        Map<String, Set<String>> stepOutputs,
        List<FieldValue.Selector> workflowOutputs
    ) {
        var steps = new ArrayList<String>(manifests.size());
        var edges = new LinkedHashMap<String, List<DependencyGraph.Edge>>();
        for (var manifest : manifests) {
            steps.add(manifest.name());
            var stepEdges = new ArrayList<DependencyGraph.Edge>();
            for (var field : manifest.fields().entrySet()) {
                for (var selector : field.getValue().selectors()) {
                    checkReference(manifest.name(), selector, inputNames, stepOutputs);
                    stepEdges.add(new DependencyGraph.Edge(selector, manifest.name(), field.getKey()));
                }
            }
            edges.put(manifest.name(), stepEdges);
        }
        for (var selector : workflowOutputs) {
            checkReference(null, selector, inputNames, stepOutputs);
        }
        var graph = new DependencyGraph(steps, edges);
        detectCycles(graph);
        return graph;
    }

    private static void checkReference(
        String consumer,
        FieldValue.Selector selector,
        Set<String> inputNames,
        Map<String, Set<String>> stepOutputs
    ) {
        if (selector.scope() == SelectorScope.INPUT) {
            if (!inputNames.contains(selector.name())) {
                throw new UnknownReferenceException(consumer, selector.text(), "no input named '" + selector.name() + "'");
            }
            return;
        }
        var outputs = stepOutputs.get(selector.name());
        if (outputs == null) {
            throw new UnknownReferenceException(consumer, selector.text(), "no step named '" + selector.name() + "'");
        }
        if (!outputs.contains(selector.output())) {
            throw new UnknownReferenceException(
                consumer,
                selector.text(),
                "step '" + selector.name() + "' declares no output '" + selector.output() + "'"
            );
        }
    }

    private static void detectCycles(DependencyGraph graph) {
        var state = new HashMap<String, VisitState>();
        var stack = new ArrayList<String>();
        for (var step : graph.steps()) {
            if (!state.containsKey(step)) {
                visit(graph, step, state, stack);
            }
        }
    }

    private static void visit(DependencyGraph graph, String step, Map<String, VisitState> state, List<String> stack) {
        state.put(step, VisitState.IN_PROGRESS);
        stack.add(step);
        for (var consumer : graph.consumersOf(step)) {
            var consumerState = state.get(consumer);
            if (consumerState == VisitState.IN_PROGRESS) {
                throw new CyclicWorkflowException(canonicalCycle(stack.subList(stack.indexOf(consumer), stack.size())));
            }
            if (consumerState == null) {
                visit(graph, consumer, state, stack);
            }
        }
        stack.remove(stack.size() - 1);
        state.put(step, VisitState.DONE);
    }

    /**
     * Rotates the cycle to start at its smallest step name so reports do not depend on declaration order.
     */
    static List<String> canonicalCycle(List<String> cycle) {
        int start = 0;
        for (int i = 1; i < cycle.size(); i++) {
            if (cycle.get(i).compareTo(cycle.get(start)) < 0) {
                start = i;
            }
        }
        var rotated = new ArrayList<String>(cycle.size());
        for (int i = 0; i < cycle.size(); i++) {
            rotated.add(cycle.get((start + i) % cycle.size()));
        }
        return rotated;
    }

    private enum VisitState {
        IN_PROGRESS,
        DONE
    }
}
