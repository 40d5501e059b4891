package work.flowgraph.engine.runtime;

import java.util.Locale;

/**
 * What happens to a run when a step fails.
 */
public enum FailurePolicy {
    /**
     * Abort the run on the first failing step; no outputs are produced. Default.
     */
    FAIL_FAST,
    /**
     * Mark the failing step and every transitive dependent as failed, finish independent branches and
     * report the outputs they reach.
     */
    ISOLATE;

    public static FailurePolicy from(String value) {
        if (value == null || value.isBlank()) {
            return FAIL_FAST;
        }
        var normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return FailurePolicy.valueOf(normalized);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported failure policy: " + value + " (expected fail-fast or isolate)");
        }
    }
}
