package work.flowgraph.engine.shared;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * Parses configuration durations such as {@code 250ms}, {@code 30s}, {@code 2m} or {@code 1h}.
 * A bare number is read as milliseconds.
 */
public final class DurationParser {
    private DurationParser() {}

    public static Optional<Duration> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String trimmed = raw.trim().toLowerCase(Locale.ROOT);
        long multiplier = 1L;
        if (trimmed.endsWith("ms")) {
            trimmed = trimmed.substring(0, trimmed.length() - 2);
        } else if (trimmed.endsWith("s")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 1_000L;
        } else if (trimmed.endsWith("m")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 60_000L;
        } else if (trimmed.endsWith("h")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 3_600_000L;
        }
        long value;
        try {
            value = Long.parseLong(trimmed.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid duration: " + raw, ex);
        }
        if (value < 0) {
            throw new IllegalArgumentException("Duration must not be negative: " + raw);
        }
        return Optional.of(Duration.ofMillis(value * multiplier));
    }
}
