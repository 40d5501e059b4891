package work.flowgraph.engine.spec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.flowgraph.engine.support.EngineTestSupport.entry;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;
import work.flowgraph.engine.error.InvalidSpecificationException;
import work.flowgraph.engine.kind.Kinds;

class SpecificationLoaderTest {
    @Test
    void loadsYamlFile() {
        var spec = SpecificationLoader.loadFromFile(Path.of("src", "test", "resources", "workflows", "detect-and-render.yaml"));

        assertEquals(2, spec.inputs().size());
        var image = spec.inputs().get(0);
        assertTrue(image.batchOriented());
        assertEquals(Set.of(Kinds.IMAGE), image.kinds());

        var confidence = spec.inputs().get(1);
        assertFalse(confidence.batchOriented());
        assertTrue(confidence.hasDefault());
        assertEquals(0.4, confidence.defaultValue());
        assertEquals(Set.of(Kinds.FLOAT_ZERO_TO_ONE), confidence.kinds());

        assertEquals(List.of("det", "viz"), spec.steps().stream().map(StepDefinition::name).toList());
        assertEquals(Map.of("image", "$inputs.image", "confidence", "$inputs.confidence"), spec.steps().get(0).fields());
        assertEquals("JsonField", spec.outputs().get(1).type());
    }

    @Test
    void loadsJsonString() {
        var spec = SpecificationLoader.fromJson(
            "{\"inputs\":[{\"type\":\"InferenceParameter\",\"name\":\"p\"}],\"steps\":[],\"outputs\":[]}"
        );
        assertEquals(Kinds.any(), spec.inputs().get(0).kinds());
        assertFalse(spec.inputs().get(0).hasDefault());
    }

    @Test
    void rejectsUnknownInputTypeAndKind() {
        var badType = entry("inputs", List.of(entry("type", "WorkflowVideo", "name", "v")));
        assertThrows(InvalidSpecificationException.class, () -> SpecificationLoader.fromMap(badType));

        var badKind = entry("inputs", List.of(entry("type", "WorkflowParameter", "name", "p", "kind", List.of("nonsense"))));
        var error = assertThrows(InvalidSpecificationException.class, () -> SpecificationLoader.fromMap(badKind));
        assertTrue(error.getMessage().contains("nonsense"));
    }

    @Test
    void acceptsKindObjects() {
        var kinds = SpecificationLoader.parseKinds(List.of(Map.of("name", "detections"), "image"), "test");
        assertEquals(Set.of(Kinds.OBJECT_DETECTIONS, Kinds.IMAGE), kinds);
    }

    @Test
    void rejectsMalformedSections() {
        assertThrows(InvalidSpecificationException.class, () -> SpecificationLoader.fromMap(entry("steps", "not a list")));
        assertThrows(InvalidSpecificationException.class, () -> SpecificationLoader.fromMap(entry("steps", List.of(entry("type", "X")))));
        assertThrows(InvalidSpecificationException.class, () -> SpecificationLoader.fromMap(entry("outputs", List.of(entry("name", "o")))));
        assertThrows(InvalidSpecificationException.class, () -> SpecificationLoader.fromJson("{not json"));
    }

    @Test
    void reportsJsonSyntaxErrors() {
        var error = assertThrows(InvalidSpecificationException.class, () -> SpecificationLoader.fromJson("{\"steps\": [}"));
        assertTrue(error.getMessage().startsWith("Specification is not valid JSON: "), error.getMessage());
        assertInstanceOf(JsonProcessingException.class, error.getCause());
    }
}
