package work.flowgraph.engine.compiler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import work.flowgraph.engine.selector.FieldValue;
import work.flowgraph.engine.spec.InputDefinition;
import work.flowgraph.engine.telemetry.ResourceIds;

/**
 * Immutable, validated execution plan. Safe to share between concurrent runs.
 */
public final class CompiledPlan {
    private final List<List<CompiledStep>> levels;
    private final Map<String, CompiledStep> stepsByName;
    private final List<InputDefinition> inputs;
    private final List<CompiledOutput> outputs;
    private final List<String> stepDescriptors;
    private final String specificationHash;

    CompiledPlan(
        List<List<CompiledStep>> levels,
        List<InputDefinition> inputs,
        List<CompiledOutput> outputs,
        List<String> stepDescriptors,
        String specificationHash
    ) {
        var frozen = new ArrayList<List<CompiledStep>>(levels.size());
        var byName = new LinkedHashMap<String, CompiledStep>();
        for (var level : levels) {
            frozen.add(List.copyOf(level));
            for (var step : level) {
                byName.put(step.name(), step);
            }
        }
        this.levels = Collections.unmodifiableList(frozen);
        this.stepsByName = Collections.unmodifiableMap(byName);
        this.inputs = List.copyOf(inputs);
        this.outputs = List.copyOf(outputs);
        this.stepDescriptors = List.copyOf(stepDescriptors);
        this.specificationHash = specificationHash;
    }

    public List<List<CompiledStep>> levels() {
        return levels;
    }

    /**
     * Steps in execution order (level by level, declaration order inside a level).
     */
    public List<CompiledStep> steps() {
        return List.copyOf(stepsByName.values());
    }

    public Optional<CompiledStep> step(String name) {
        return Optional.ofNullable(stepsByName.get(name));
    }

    public List<InputDefinition> inputs() {
        return inputs;
    }

    public List<CompiledOutput> outputs() {
        return outputs;
    }

    /**
     * {@code type:name} of every step in declaration order.
     */
    public List<String> stepDescriptors() {
        return stepDescriptors;
    }

    public String specificationHash() {
        return specificationHash;
    }

    /**
     * Identifier used for usage reporting when the workflow has no stored id.
     */
    public String resourceId() {
        return ResourceIds.forSteps(stepDescriptors);
    }

    /**
     * Level structure as step names, handy for comparing plans.
     */
    public List<List<String>> levelNames() {
        var names = new ArrayList<List<String>>(levels.size());
        for (var level : levels) {
            names.add(level.stream().map(CompiledStep::name).toList());
        }
        return names;
    }

    public record CompiledOutput(String name, FieldValue.Selector selector) {}
}
