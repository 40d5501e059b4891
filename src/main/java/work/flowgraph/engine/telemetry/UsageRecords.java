package work.flowgraph.engine.telemetry;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Merging of usage records and payloads. Merging is associative and commutative, so payloads can be
 * folded in any order.
 */
public final class UsageRecords {
    private UsageRecords() {}

    public static UsageRecord merge(UsageRecord first, UsageRecord second) {
        if (!Objects.equals(first.resourceId(), second.resourceId())) {
            throw new IllegalArgumentException(
                "Cannot merge usage for different resource ids: " + first.resourceId() + " and " + second.resourceId()
            );
        }
        long frames = first.processedFrames() + second.processedFrames();
        double sourceDuration = first.sourceDuration() + second.sourceDuration();
        return new UsageRecord(
            pick(first.apiKey(), second.apiKey()),
            pick(first.category(), second.category()),
            first.resourceId(),
            pick(first.resourceDetails(), second.resourceDetails()),
            pick(first.execSessionId(), second.execSessionId()),
            Math.min(first.timestampStart(), second.timestampStart()),
            Math.max(first.timestampStop(), second.timestampStop()),
            frames,
            fps(frames, sourceDuration),
            sourceDuration,
            first.hosted() || second.hosted(),
            first.enterprise() || second.enterprise()
        );
    }

    /**
     * Folds payloads ({@code apiKey -> aggregation key -> record}) into one payload.
     */
    public static Map<String, Map<String, UsageRecord>> zip(List<Map<String, Map<String, UsageRecord>>> payloads) {
        var merged = new LinkedHashMap<String, Map<String, UsageRecord>>();
        for (var payload : payloads) {
            for (var byKey : payload.entrySet()) {
                var target = merged.computeIfAbsent(byKey.getKey(), key -> new LinkedHashMap<>());
                for (var record : byKey.getValue().entrySet()) {
                    target.merge(record.getKey(), record.getValue(), UsageRecords::merge);
                }
            }
        }
        return merged;
    }

    static double fps(long frames, double sourceDuration) {
        if (sourceDuration <= 0) {
            return 0;
        }
        return Math.round(frames / sourceDuration * 100.0) / 100.0;
    }

    private static String pick(String first, String second) {
        if (first == null) {
            return second;
        }
        if (second == null) {
            return first;
        }
        return first.compareTo(second) <= 0 ? first : second;
    }
}
