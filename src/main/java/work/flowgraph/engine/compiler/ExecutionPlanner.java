package work.flowgraph.engine.compiler;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import work.flowgraph.engine.block.Block;
import work.flowgraph.engine.block.OutputSpec;
import work.flowgraph.engine.error.KindMismatchException;
import work.flowgraph.engine.kind.Kind;
import work.flowgraph.engine.kind.Kinds;
import work.flowgraph.engine.selector.SelectorScope;
import work.flowgraph.engine.spec.InputDefinition;

/**
 * Layers the dependency graph into levels and checks kind compatibility of every edge.
 * <p>
 * Level 0 holds steps without producers; level k holds steps whose producers all sit in levels
 * below k. Inside a level steps keep their declaration order.
 */
public final class ExecutionPlanner {
    private ExecutionPlanner() {}

    public static List<List<CompiledStep>> plan(
        DependencyGraph graph,
        Map<String, StepManifest> manifests,
        Map<String, Block> blocks,
        Map<String, InputDefinition> inputs
    ) {
        var remaining = new ArrayList<>(graph.steps());
        var placed = new HashSet<String>();
        var levels = new ArrayList<List<CompiledStep>>();
        while (!remaining.isEmpty()) {
            var levelIndex = levels.size();
            var level = new ArrayList<CompiledStep>();
            for (var step : remaining) {
                if (placed.containsAll(graph.producersOf(step))) {
                    checkKinds(graph, step, blocks, inputs);
                    level.add(new CompiledStep(manifests.get(step), blocks.get(step), graph.producersOf(step), levelIndex));
                }
            }
            if (level.isEmpty()) {
                throw new IllegalStateException("Unable to schedule steps " + remaining + "; dependency graph is not acyclic");
            }
            for (var step : level) {
                placed.add(step.name());
                remaining.remove(step.name());
            }
            levels.add(level);
        }
        return levels;
    }

    private static void checkKinds(DependencyGraph graph, String step, Map<String, Block> blocks, Map<String, InputDefinition> inputs) {
        var accepted = blocks.get(step).fields();
        for (var edge : graph.edgesInto(step)) {
            var fieldSpec = accepted.get(edge.field());
            if (fieldSpec == null) {
                continue;
            }
            var produced = producedKinds(edge, blocks, inputs);
            if (!Kinds.compatible(produced, fieldSpec.kinds())) {
                throw new KindMismatchException(
                    edge.selector().text(),
                    produced,
                    "step '" + step + "' field '" + edge.field() + "'",
                    fieldSpec.kinds()
                );
            }
        }
    }

    private static Set<Kind> producedKinds(DependencyGraph.Edge edge, Map<String, Block> blocks, Map<String, InputDefinition> inputs) {
        var selector = edge.selector();
        if (selector.hasProperty()) {
            return Kinds.any();
        }
        if (selector.scope() == SelectorScope.INPUT) {
            return inputs.get(selector.name()).kinds();
        }
        for (OutputSpec output : blocks.get(selector.name()).declareOutputs()) {
            if (output.name().equals(selector.output())) {
                return output.kinds();
            }
        }
        return Kinds.any();
    }

    static Map<String, StepManifest> index(List<StepManifest> manifests) {
        var index = new LinkedHashMap<String, StepManifest>();
        for (var manifest : manifests) {
            index.put(manifest.name(), manifest);
        }
        return index;
    }
}
