package work.flowgraph.engine.kind;

import java.util.Collection;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Named data-type tag attached to step inputs and outputs.
 */
public record Kind(String name, String description) {
    public Kind {
        Objects.requireNonNull(name, "name");
        description = description == null ? "" : description;
    }

    public boolean isWildcard() {
        return Kinds.WILDCARD_NAME.equals(name);
    }

    /**
     * Sorted, bracketed rendering of a kind set, e.g. {@code [detections, image]}.
     */
    public static String names(Collection<Kind> kinds) {
        if (kinds == null || kinds.isEmpty()) {
            return "[]";
        }
        return kinds.stream().map(Kind::name).sorted().collect(Collectors.joining(", ", "[", "]"));
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof Kind kind && kind.name.equals(name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
