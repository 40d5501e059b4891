package work.flowgraph.engine.block;

/**
 * Creates block instances for a registered type.
 */
@FunctionalInterface
public interface BlockFactory {
    Block create();
}
