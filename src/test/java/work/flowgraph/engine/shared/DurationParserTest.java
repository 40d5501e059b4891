package work.flowgraph.engine.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class DurationParserTest {
    @Test
    void parsesSeconds() {
        Optional<Duration> duration = DurationParser.parse("30s");
        assertTrue(duration.isPresent());
        assertEquals(Duration.ofSeconds(30), duration.get());
    }

    @Test
    void parsesMinutesAndHours() {
        assertEquals(Duration.ofMinutes(2), DurationParser.parse("2m").orElseThrow());
        assertEquals(Duration.ofHours(1), DurationParser.parse(" 1H ").orElseThrow());
    }

    @Test
    void parsesMilliseconds() {
        assertEquals(Duration.ofMillis(250), DurationParser.parse("250ms").orElseThrow());
        assertEquals(Duration.ofMillis(1500), DurationParser.parse("1500").orElseThrow());
        assertEquals(Duration.ZERO, DurationParser.parse("0").orElseThrow());
    }

    @Test
    void blankMeansAbsent() {
        assertTrue(DurationParser.parse(null).isEmpty());
        assertTrue(DurationParser.parse("  ").isEmpty());
    }

    @Test
    void rejectsGarbageAndNegativeValues() {
        assertThrows(IllegalArgumentException.class, () -> DurationParser.parse("soon"));
        assertThrows(IllegalArgumentException.class, () -> DurationParser.parse("1.5s"));
        assertThrows(IllegalArgumentException.class, () -> DurationParser.parse("-5s"));
    }
}
