package work.flowgraph.engine.compiler;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import work.flowgraph.engine.selector.FieldValue;

/**
 * A step after selector parsing: every field is a typed {@link FieldValue}.
 */
public record StepManifest(String type, String name, Map<String, FieldValue> fields, boolean declaresBatchInput) {
    public StepManifest {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(name, "name");
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public String descriptor() {
        return type + ":" + name;
    }
}
