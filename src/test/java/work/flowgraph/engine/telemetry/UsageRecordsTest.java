package work.flowgraph.engine.telemetry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class UsageRecordsTest {
    private static UsageRecord record(String resourceId, long start, long stop, long frames, double sourceDuration) {
        return new UsageRecord(
            "key", "workflows", resourceId, null, "session", start, stop, frames,
            UsageRecords.fps(frames, sourceDuration), sourceDuration, false, false
        );
    }

    @Test
    void mergeSumsWorkAndWidensTheWindow() {
        var merged = UsageRecords.merge(record("wf", 100, 200, 4, 2.0), record("wf", 50, 150, 6, 3.0));

        assertEquals(50, merged.timestampStart());
        assertEquals(200, merged.timestampStop());
        assertEquals(10, merged.processedFrames());
        assertEquals(5.0, merged.sourceDuration());
        assertEquals(2.0, merged.fps());
    }

    @Test
    void mergeIsCommutative() {
        var first = new UsageRecord("key", "workflows", "wf", "{\"steps\": []}", "s1", 1, 2, 3, 1.5, 2.0, false, true);
        var second = new UsageRecord("key", "workflows", "wf", null, "s2", 3, 4, 5, 2.5, 2.0, true, false);

        var forward = UsageRecords.merge(first, second);
        assertEquals(forward, UsageRecords.merge(second, first));
        assertEquals("s1", forward.execSessionId());
        assertEquals("{\"steps\": []}", forward.resourceDetails());
        assertTrue(forward.hosted());
        assertTrue(forward.enterprise());
    }

    @Test
    void refusesToMergeDifferentResources() {
        assertThrows(IllegalArgumentException.class, () -> UsageRecords.merge(record("a", 0, 1, 1, 1), record("b", 0, 1, 1, 1)));
    }

    @Test
    void zipFoldsPayloadsPerKey() {
        var a = record("wf", 0, 10, 1, 1.0);
        var b = record("wf", 5, 20, 2, 1.0);
        var other = record("other", 0, 1, 1, 1.0);

        var zipped = UsageRecords.zip(List.of(
            Map.of("key", Map.of(a.aggregationKey(), a)),
            Map.of("key", Map.of(b.aggregationKey(), b, other.aggregationKey(), other)),
            Map.of("second-key", Map.of(a.aggregationKey(), a))
        ));

        assertEquals(2, zipped.size());
        assertEquals(3, zipped.get("key").get("workflows:wf").processedFrames());
        assertEquals(1, zipped.get("key").get("workflows:other").processedFrames());
        assertEquals(a, zipped.get("second-key").get("workflows:wf"));
    }

    @Test
    void fpsIsRoundedAndZeroWithoutDuration() {
        assertEquals(3.33, UsageRecords.fps(10, 3.0));
        assertEquals(0.0, UsageRecords.fps(10, 0));
    }
}
