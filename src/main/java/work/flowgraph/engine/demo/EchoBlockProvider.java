package work.flowgraph.engine.demo;

import java.util.List;
import work.flowgraph.engine.block.Block;
import work.flowgraph.engine.block.BlockProvider;

public final class EchoBlockProvider implements BlockProvider {
    @Override
    public String blockType() {
        return DemoBlocks.ECHO;
    }

    @Override
    public List<String> aliases() {
        return List.of("demo/echo@v1");
    }

    @Override
    public Block createBlock() {
        return new DemoBlocks.Echo();
    }
}
