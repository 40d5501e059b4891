package work.flowgraph.engine.block;

import java.util.Objects;
import java.util.Set;
import work.flowgraph.engine.kind.Kind;
import work.flowgraph.engine.kind.Kinds;

/**
 * One accepted step field: the kinds a selector bound to it may carry, and whether it must be present.
 */
public record FieldSpec(String name, Set<Kind> kinds, boolean required, Object defaultValue) {
    public FieldSpec {
        Objects.requireNonNull(name, "name");
        kinds = kinds == null || kinds.isEmpty() ? Kinds.any() : Set.copyOf(kinds);
    }

    public static FieldSpec required(String name, Kind... kinds) {
        return new FieldSpec(name, Kinds.of(kinds), true, null);
    }

    public static FieldSpec optional(String name, Object defaultValue, Kind... kinds) {
        return new FieldSpec(name, Kinds.of(kinds), false, defaultValue);
    }
}
