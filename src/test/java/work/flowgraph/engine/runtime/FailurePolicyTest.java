package work.flowgraph.engine.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class FailurePolicyTest {
    @Test
    void parsesPolicyNames() {
        assertEquals(FailurePolicy.FAIL_FAST, FailurePolicy.from("fail-fast"));
        assertEquals(FailurePolicy.ISOLATE, FailurePolicy.from("ISOLATE"));
        assertEquals(FailurePolicy.FAIL_FAST, FailurePolicy.from(" "));
        assertThrows(IllegalArgumentException.class, () -> FailurePolicy.from("retry"));
    }

    @Test
    void settingsRejectNonPositiveConcurrency() {
        assertThrows(IllegalArgumentException.class, () -> ExecutorSettings.defaults().withMaxConcurrency(0));
        var settings = ExecutorSettings.defaults().withRunTimeout(Duration.ofSeconds(3));
        assertEquals(Duration.ofSeconds(3), settings.runTimeout().orElseThrow());
        assertEquals(FailurePolicy.FAIL_FAST, settings.failurePolicy());
    }
}
