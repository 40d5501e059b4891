package work.flowgraph.engine.demo;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import work.flowgraph.engine.block.Block;
import work.flowgraph.engine.block.FieldSpec;
import work.flowgraph.engine.block.OutputSpec;

/**
 * Trivial blocks shipped with the engine so specifications can be run without external plugins.
 */
public final class DemoBlocks {
    public static final String ECHO = "Echo";
    public static final String CONSTANT = "Constant";

    private DemoBlocks() {}

    /**
     * Returns its {@code value} field unchanged as the {@code value} output.
     */
    public static final class Echo implements Block {
        @Override
        public Map<String, FieldSpec> fields() {
            return Map.of("value", FieldSpec.required("value"));
        }

        @Override
        public List<OutputSpec> declareOutputs() {
            return List.of(OutputSpec.of("value"));
        }

        @Override
        public Map<String, Object> run(Map<String, Object> fields) {
            return singleton("value", fields.get("value"));
        }
    }

    /**
     * Produces its literal {@code value} field, broadcast to the whole batch.
     */
    public static final class Constant implements Block {
        @Override
        public Map<String, FieldSpec> fields() {
            return Map.of("value", FieldSpec.optional("value", null));
        }

        @Override
        public List<OutputSpec> declareOutputs() {
            return List.of(OutputSpec.of("value"));
        }

        @Override
        public Map<String, Object> run(Map<String, Object> fields) {
            return singleton("value", fields.get("value"));
        }
    }

    // Map.of rejects null values, blocks may legitimately produce null
    private static Map<String, Object> singleton(String key, Object value) {
        var map = new HashMap<String, Object>();
        map.put(key, value);
        return Collections.unmodifiableMap(map);
    }
}
