package work.flowgraph.engine.compiler;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.flowgraph.engine.block.Block;
import work.flowgraph.engine.block.BlockRegistry;
import work.flowgraph.engine.error.InvalidSpecificationException;
import work.flowgraph.engine.selector.FieldValue;
import work.flowgraph.engine.selector.SelectorParser;
import work.flowgraph.engine.shared.Hashing;
import work.flowgraph.engine.spec.InputDefinition;
import work.flowgraph.engine.spec.SpecificationValidator;
import work.flowgraph.engine.spec.StepDefinition;
import work.flowgraph.engine.spec.WorkflowSpecification;

/**
 * validate → parse selectors → build graph → plan levels. Compilation has no side effects beyond
 * instantiating the blocks of the new plan.
 */
public final class WorkflowCompiler {
    private static final Logger log = LoggerFactory.getLogger(WorkflowCompiler.class);

    private final BlockRegistry registry;

    public WorkflowCompiler(BlockRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public CompiledPlan compile(WorkflowSpecification spec) {
        SpecificationValidator.validateStructure(spec);

        var blocks = new LinkedHashMap<String, Block>();
        var manifests = new ArrayList<StepManifest>();
        var stepOutputs = new LinkedHashMap<String, Set<String>>();
        for (var step : spec.steps()) {
            var block = instantiate(step);
            SpecificationValidator.validateStep(step, block);
            blocks.put(step.name(), block);
            manifests.add(parseStep(step, block));
            var outputs = new LinkedHashSet<String>();
            block.declareOutputs().forEach(output -> outputs.add(output.name()));
            stepOutputs.put(step.name(), outputs);
        }

        var inputs = new LinkedHashMap<String, InputDefinition>();
        spec.inputs().forEach(input -> inputs.put(input.name(), input));

        var outputs = new ArrayList<CompiledPlan.CompiledOutput>();
        for (var output : spec.outputs()) {
            var selector = SelectorParser.parseSelector("outputs." + output.name(), output.selector());
            outputs.add(new CompiledPlan.CompiledOutput(output.name(), selector));
        }

        var graph = DependencyGraphBuilder.build(
            manifests,
            inputs.keySet(),
            stepOutputs,
            outputs.stream().map(CompiledPlan.CompiledOutput::selector).toList()
        );
        var levels = ExecutionPlanner.plan(graph, ExecutionPlanner.index(manifests), blocks, inputs);

        var descriptors = manifests.stream().map(StepManifest::descriptor).toList();
        var plan = new CompiledPlan(levels, spec.inputs(), outputs, descriptors, Hashing.specificationHash(spec.document()));
        log.debug("Compiled workflow {} into {} level(s): {}", plan.specificationHash(), levels.size(), plan.levelNames());
        return plan;
    }

    private Block instantiate(StepDefinition step) {
        var entry = registry.get(step.type())
            .orElseThrow(() -> new InvalidSpecificationException(
                "Step '" + step.name() + "' uses unknown block type '" + step.type() + "'"
            ));
        var block = entry.factory().create();
        if (block == null) {
            throw new IllegalStateException("Factory for block type '" + step.type() + "' returned null");
        }
        return block;
    }

    private static StepManifest parseStep(StepDefinition step, Block block) {
        Map<String, FieldValue> fields = new LinkedHashMap<>();
        for (var spec : block.fields().values()) {
            if (step.fields().containsKey(spec.name())) {
                fields.put(spec.name(), SelectorParser.parse(step.name() + "." + spec.name(), step.fields().get(spec.name())));
            } else {
                fields.put(spec.name(), new FieldValue.Literal(spec.defaultValue()));
            }
        }
        return new StepManifest(step.type(), step.name(), fields, block.acceptsBatchInput());
    }
}
