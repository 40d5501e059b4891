package work.flowgraph.engine.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.flowgraph.engine.error.InvalidRuntimeInputException;
import work.flowgraph.engine.selector.FieldValue;
import work.flowgraph.engine.selector.SelectorScope;
import work.flowgraph.engine.spec.InputDefinition;

/**
 * Per-run registry of batch-shaped values keyed by {@code (scope, name)}.
 * <p>
 * Only the executor thread commits, and it commits a step's outputs as one immutable map, so readers
 * either see all outputs of a step or none of them.
 */
public final class ExecutionContext {
    private static final Logger log = LoggerFactory.getLogger(ExecutionContext.class);

    private final Map<String, BatchValue> inputs;
    private final Map<String, Map<String, BatchValue>> stepOutputs = new ConcurrentHashMap<>();
    private final int batchSize;

    private ExecutionContext(Map<String, BatchValue> inputs, int batchSize) {
        this.inputs = Collections.unmodifiableMap(inputs);
        this.batchSize = batchSize;
    }

    /**
     * Binds runtime values to declared inputs. Image inputs become batches (a single value is a batch
     * of one), parameters are broadcast; every batch must have the same size.
     */
    public static ExecutionContext bind(List<InputDefinition> declared, Map<String, Object> runtimeInputs) {
        var provided = runtimeInputs == null ? Map.<String, Object>of() : runtimeInputs;
        var bound = new LinkedHashMap<String, BatchValue>();
        Integer batchSize = null;
        String batchOwner = null;
        for (var input : declared) {
            Object raw;
            if (provided.containsKey(input.name())) {
                raw = provided.get(input.name());
            } else if (input.hasDefault()) {
                raw = input.defaultValue();
            } else {
                throw new InvalidRuntimeInputException("Missing value for workflow input '" + input.name() + "'");
            }
            if (!input.batchOriented()) {
                bound.put(input.name(), BatchValue.broadcast(raw));
                continue;
            }
            var batch = raw instanceof List<?> list ? BatchValue.batch(list) : BatchValue.batch(Collections.singletonList(raw));
            if (batchSize == null) {
                batchSize = batch.size();
                batchOwner = input.name();
            } else if (batchSize != batch.size()) {
                throw new InvalidRuntimeInputException(
                    "Input '" + input.name() + "' has " + batch.size() + " item(s) but '" + batchOwner + "' has " + batchSize
                );
            }
            bound.put(input.name(), batch);
        }
        for (var name : provided.keySet()) {
            if (!bound.containsKey(name)) {
                log.debug("Ignoring runtime input '{}' that the workflow does not declare", name);
            }
        }
        return new ExecutionContext(bound, batchSize == null ? 1 : batchSize);
    }

    /**
     * Items processed by the run: the size of the image batch, or 1 when the workflow has no batch input.
     */
    public int batchSize() {
        return batchSize;
    }

    /**
     * Value behind a selector's socket (its property accessor is ignored here).
     */
    public Optional<BatchValue> lookup(FieldValue.Selector selector) {
        if (selector.scope() == SelectorScope.INPUT) {
            return Optional.ofNullable(inputs.get(selector.name()));
        }
        var outputs = stepOutputs.get(selector.name());
        if (outputs == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(outputs.get(selector.output()));
    }

    public boolean hasCommitted(String step) {
        return stepOutputs.containsKey(step);
    }

    void commit(String step, Map<String, BatchValue> outputs) {
        var frozen = Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
        if (stepOutputs.putIfAbsent(step, frozen) != null) {
            throw new IllegalStateException("Outputs of step '" + step + "' were already committed");
        }
    }
}
