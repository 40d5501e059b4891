package work.flowgraph.engine.error;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns failures into small {@code {code, message[, step]}} maps for run results.
 */
public final class ErrorReports {
    private ErrorReports() {}

    public static Map<String, Object> describe(Throwable error) {
        if (error instanceof StepExecutionException se) {
            var map = toMap(se.code(), se.getMessage());
            map.put("step", se.stepName());
            return map;
        }
        if (error instanceof WorkflowException we) {
            return toMap(we.code(), we.getMessage());
        }
        if (error == null) {
            return toMap("unexpected_error", "Unexpected error");
        }
        var message = error.getMessage() != null && !error.getMessage().isBlank()
            ? error.getMessage()
            : error.getClass().getSimpleName();
        return toMap("unexpected_error", message);
    }

    private static Map<String, Object> toMap(String code, String message) {
        var map = new LinkedHashMap<String, Object>();
        map.put("code", code);
        map.put("message", message);
        return map;
    }
}
