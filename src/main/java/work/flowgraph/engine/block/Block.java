package work.flowgraph.engine.block;

import java.util.List;
import java.util.Map;

/**
 * Capability contract every step implementation fulfils.
 * <p>
 * Instances are created once per compiled step and shared by every run of the plan, so
 * {@link #run(Map)} may be called concurrently and must not keep per-call state.
 * Implementations never see the execution context: they receive resolved field values and
 * return one value per declared output.
 */
public interface Block {

    /**
     * Accepted fields keyed by name, with the kinds each one accepts.
     */
    Map<String, FieldSpec> fields();

    List<OutputSpec> declareOutputs();

    /**
     * When {@code true} the block is invoked once per run with batched fields passed as lists and
     * must return a list (one entry per batch item) for every declared output. Otherwise the
     * executor invokes it once per batch item.
     */
    default boolean acceptsBatchInput() {
        return false;
    }

    Map<String, Object> run(Map<String, Object> fields) throws Exception;
}
