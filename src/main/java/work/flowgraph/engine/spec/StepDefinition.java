package work.flowgraph.engine.spec;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Raw step entry: block type, unique name and the remaining keys as unparsed field values.
 */
public record StepDefinition(String type, String name, Map<String, Object> fields) {
    public StepDefinition {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(name, "name");
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }
}
