package work.flowgraph.engine.telemetry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.flowgraph.engine.shared.Hashing;

class ResourceIdsTest {
    @Test
    void detailsListStepsInOrder() {
        assertEquals("{\"steps\": [\"Detector:det\", \"Renderer:viz\"]}", ResourceIds.details(List.of("Detector:det", "Renderer:viz")));
        assertEquals("{\"steps\": []}", ResourceIds.details(List.of()));
    }

    @Test
    void detailsEscapeNonAscii() {
        assertEquals("{\"steps\": [\"Caf\\u00e9:\\\"x\\\"\"]}", ResourceIds.details(List.of("Café:\"x\"")));
    }

    @Test
    void detailsKeepDeleteCharacterAsIs() {
        assertEquals("{\"steps\": [\"Odd:a\u007fb\"]}", ResourceIds.details(List.of("Odd:a\u007fb")));
    }

    @Test
    void idIsShortPrefixOfDetailsHash() {
        var steps = List.of("Detector:det");
        var id = ResourceIds.forSteps(steps);
        assertEquals(5, id.length());
        assertEquals(Hashing.sha256Hex("{\"steps\": [\"Detector:det\"]}").substring(0, 5), id);
        assertNotEquals(id, ResourceIds.forSteps(List.of("Detector:other")));
    }

    @Test
    void storedWorkflowIdWins() {
        assertEquals("my-workflow", ResourceIds.resolve("my-workflow", List.of("Detector:det")));
        assertEquals(ResourceIds.forSteps(List.of("Detector:det")), ResourceIds.resolve(" ", List.of("Detector:det")));
        assertEquals(ResourceIds.forSteps(List.of("Detector:det")), ResourceIds.resolve(null, List.of("Detector:det")));
    }
}
