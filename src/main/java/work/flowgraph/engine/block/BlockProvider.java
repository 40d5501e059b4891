package work.flowgraph.engine.block;

import java.util.List;

/**
 * SPI for pluggable blocks. Implementations are discovered via {@link java.util.ServiceLoader}
 * (META-INF/services/work.flowgraph.engine.block.BlockProvider) when a registry is built with
 * {@link BlockRegistry#discover()}.
 */
public interface BlockProvider {

    /**
     * Type identifier used by the {@code type} key of specification steps.
     */
    String blockType();

    /**
     * Alternative identifiers accepted for the same block (e.g. legacy names).
     */
    default List<String> aliases() {
        return List.of();
    }

    Block createBlock();

    /**
     * Whether this provider should be registered. Override to skip optional blocks whose environment is missing.
     */
    default boolean isEnabled() {
        return true;
    }
}
