package work.flowgraph.engine.demo;

import java.util.List;
import work.flowgraph.engine.block.Block;
import work.flowgraph.engine.block.BlockProvider;

public final class ConstantBlockProvider implements BlockProvider {
    @Override
    public String blockType() {
        return DemoBlocks.CONSTANT;
    }

    @Override
    public List<String> aliases() {
        return List.of("demo/constant@v1");
    }

    @Override
    public Block createBlock() {
        return new DemoBlocks.Constant();
    }
}
