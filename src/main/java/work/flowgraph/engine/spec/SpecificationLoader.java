package work.flowgraph.engine.spec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import work.flowgraph.engine.error.InvalidSpecificationException;
import work.flowgraph.engine.kind.Kind;
import work.flowgraph.engine.kind.Kinds;

/**
 * Loads specification documents (JSON or YAML file, JSON string, or an already decoded map).
 */
public final class SpecificationLoader {
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private SpecificationLoader() {}

    public static WorkflowSpecification loadFromFile(Path path) {
        try (var in = Files.newInputStream(path)) {
            Map<String, Object> document = YAML_MAPPER.readValue(in, MAP_TYPE);
            return fromMap(document);
        } catch (IOException ex) {
            throw new InvalidSpecificationException("Failed to read specification: " + path, ex);
        }
    }

    public static WorkflowSpecification fromJson(String json) {
        try {
            return fromMap(JSON_MAPPER.readValue(json, MAP_TYPE));
        } catch (JsonProcessingException ex) {
            throw new InvalidSpecificationException("Specification is not valid JSON: " + ex.getOriginalMessage(), ex);
        }
    }

    public static WorkflowSpecification fromMap(Map<String, Object> document) {
        if (document == null) {
            throw new InvalidSpecificationException("Specification document is empty");
        }
        var inputs = new ArrayList<InputDefinition>();
        for (var entry : objectList(document, "inputs")) {
            inputs.add(toInput(entry));
        }
        var steps = new ArrayList<StepDefinition>();
        for (var entry : objectList(document, "steps")) {
            steps.add(toStep(entry));
        }
        var outputs = new ArrayList<OutputDefinition>();
        for (var entry : objectList(document, "outputs")) {
            outputs.add(toOutput(entry));
        }
        return new WorkflowSpecification(inputs, steps, outputs, document);
    }

    private static InputDefinition toInput(Map<String, Object> entry) {
        var type = requiredString(entry, "type", "input");
        var name = requiredString(entry, "name", "input");
        boolean image = InputDefinition.isImageType(type);
        if (!image && !InputDefinition.isParameterType(type)) {
            throw new InvalidSpecificationException("Input '" + name + "' has unsupported type '" + type + "'");
        }
        Set<Kind> kinds = entry.containsKey("kind")
            ? parseKinds(entry.get("kind"), "input '" + name + "'")
            : (image ? Set.of(Kinds.IMAGE) : Kinds.any());
        boolean hasDefault = entry.containsKey("default_value");
        return new InputDefinition(type, name, kinds, image, hasDefault, entry.get("default_value"));
    }

    private static StepDefinition toStep(Map<String, Object> entry) {
        var type = requiredString(entry, "type", "step");
        var name = requiredString(entry, "name", "step");
        var fields = new LinkedHashMap<String, Object>();
        for (var field : entry.entrySet()) {
            if ("type".equals(field.getKey()) || "name".equals(field.getKey())) continue;
            fields.put(field.getKey(), field.getValue());
        }
        return new StepDefinition(type, name, fields);
    }

    private static OutputDefinition toOutput(Map<String, Object> entry) {
        var name = requiredString(entry, "name", "output");
        var selector = entry.get("selector");
        if (!(selector instanceof String str) || str.isBlank()) {
            throw new InvalidSpecificationException("Output '" + name + "' must declare a selector");
        }
        var type = entry.get("type") instanceof String t ? t : null;
        return new OutputDefinition(type, name, str);
    }

    static Set<Kind> parseKinds(Object raw, String owner) {
        var names = new ArrayList<String>();
        if (raw instanceof String str) {
            names.add(str);
        } else if (raw instanceof List<?> list) {
            for (var item : list) {
                if (item instanceof Map<?, ?> map && map.get("name") != null) {
                    names.add(String.valueOf(map.get("name")));
                } else {
                    names.add(String.valueOf(item));
                }
            }
        } else {
            throw new InvalidSpecificationException("Kind of " + owner + " must be a name or a list of names");
        }
        var kinds = new LinkedHashSet<Kind>();
        for (var kindName : names) {
            kinds.add(Kinds.lookup(kindName)
                .orElseThrow(() -> new InvalidSpecificationException("Unknown kind '" + kindName + "' declared by " + owner)));
        }
        return kinds.isEmpty() ? Kinds.any() : kinds;
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> objectList(Map<String, Object> document, String key) {
        var raw = document.get(key);
        if (raw == null) {
            return List.of();
        }
        if (!(raw instanceof List<?> list)) {
            throw new InvalidSpecificationException("'" + key + "' must be a list");
        }
        var entries = new ArrayList<Map<String, Object>>();
        for (var item : list) {
            if (!(item instanceof Map<?, ?> map)) {
                throw new InvalidSpecificationException("Every entry of '" + key + "' must be an object: " + item);
            }
            entries.add((Map<String, Object>) map);
        }
        return entries;
    }

    private static String requiredString(Map<String, Object> entry, String key, String owner) {
        var value = entry.get(key);
        if (!(value instanceof String str) || str.isBlank()) {
            throw new InvalidSpecificationException("Every " + owner + " must declare a non-blank '" + key + "': " + entry);
        }
        return str.trim();
    }
}
