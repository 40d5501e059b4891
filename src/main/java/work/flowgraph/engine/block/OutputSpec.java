package work.flowgraph.engine.block;

import java.util.Objects;
import java.util.Set;
import work.flowgraph.engine.kind.Kind;
import work.flowgraph.engine.kind.Kinds;

public record OutputSpec(String name, Set<Kind> kinds) {
    public OutputSpec {
        Objects.requireNonNull(name, "name");
        kinds = kinds == null || kinds.isEmpty() ? Kinds.any() : Set.copyOf(kinds);
    }

    public static OutputSpec of(String name, Kind... kinds) {
        return new OutputSpec(name, Kinds.of(kinds));
    }
}
