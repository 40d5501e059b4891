package work.flowgraph.engine.telemetry;

import java.util.List;
import work.flowgraph.engine.shared.Hashing;

/**
 * Short identifiers for workflows that have no stored id.
 * <p>
 * The id is the first five hex characters of the SHA-256 of the resource details
 * {@code {"steps": ["type:name", ...]}}, serialised with {@code ", "} separators and ASCII escapes so
 * that ids match the ones produced by the hosted platform.
 */
public final class ResourceIds {
    private static final int LENGTH = 5;

    private ResourceIds() {}

    public static String resolve(String workflowId, List<String> stepDescriptors) {
        if (workflowId != null && !workflowId.isBlank()) {
            return workflowId;
        }
        return forSteps(stepDescriptors);
    }

    public static String forSteps(List<String> stepDescriptors) {
        return Hashing.sha256Hex(details(stepDescriptors)).substring(0, LENGTH);
    }

    /**
     * Resource details document for a workflow made of {@code stepDescriptors}.
     */
    public static String details(List<String> stepDescriptors) {
        var builder = new StringBuilder("{\"steps\": [");
        for (int i = 0; i < stepDescriptors.size(); i++) {
            if (i > 0) {
                builder.append(", ");
            }
            quote(stepDescriptors.get(i), builder);
        }
        return builder.append("]}").toString();
    }

    private static void quote(String value, StringBuilder out) {
        out.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> out.append("\\\"");
                case '\\' -> out.append("\\\\");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                case '\b' -> out.append("\\b");
                case '\f' -> out.append("\\f");
                default -> {
                    if (c < 0x20 || c > 0x7f) {
                        out.append(String.format("\\u%04x", (int) c));
                    } else {
                        out.append(c);
                    }
                }
            }
        }
        out.append('"');
    }
}
