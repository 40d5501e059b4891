package work.flowgraph.engine.error;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ErrorReportsTest {
    @Test
    void stepFailuresNameTheStep() {
        var report = ErrorReports.describe(new StepExecutionException("det", new IllegalStateException("model unavailable")));
        assertEquals(
            Map.of("code", "step_execution_failed", "message", "Step 'det' failed: model unavailable", "step", "det"),
            report
        );
    }

    @Test
    void workflowErrorsKeepTheirCode() {
        var report = ErrorReports.describe(new CyclicWorkflowException(List.of("a", "b")));
        assertEquals("cyclic_workflow", report.get("code"));
        assertEquals("Workflow contains a cycle: a -> b -> a", report.get("message"));
    }

    @Test
    void otherErrorsAreUnexpected() {
        assertEquals(Map.of("code", "unexpected_error", "message", "NullPointerException"), ErrorReports.describe(new NullPointerException()));
        assertEquals("unexpected_error", ErrorReports.describe(null).get("code"));
    }
}
