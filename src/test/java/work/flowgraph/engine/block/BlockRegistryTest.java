package work.flowgraph.engine.block;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.flowgraph.engine.demo.DemoBlocks;
import work.flowgraph.engine.support.EngineTestSupport;

class BlockRegistryTest {
    @Test
    void discoversBundledProviders() {
        var registry = BlockRegistry.discover();

        assertTrue(registry.contains(DemoBlocks.ECHO));
        assertTrue(registry.contains(DemoBlocks.CONSTANT));
        assertInstanceOf(DemoBlocks.Echo.class, registry.get(DemoBlocks.ECHO).orElseThrow().factory().create());
    }

    @Test
    void aliasesResolveToTheSameEntry() {
        var registry = BlockRegistry.discover();

        assertSame(registry.get("Echo").orElseThrow(), registry.get("demo/echo@v1").orElseThrow());
        assertEquals(DemoBlocks.CONSTANT, registry.get("demo/constant@v1").orElseThrow().type());
    }

    @Test
    void factoriesBuildFreshInstances() {
        var registry = BlockRegistry.builder().register("Detector", EngineTestSupport::detector).build();
        var factory = registry.get("Detector").orElseThrow().factory();

        assertNotSame(factory.create(), factory.create());
        assertFalse(registry.get("Renderer").isPresent());
    }

    @Test
    void rejectsDuplicateTypesAndAliases() {
        var builder = BlockRegistry.builder().register("Detector", EngineTestSupport::detector, "det@v1");

        assertThrows(IllegalStateException.class, () -> builder.register("Detector", EngineTestSupport::renderer));
        assertThrows(IllegalStateException.class, () -> builder.register("Renderer", EngineTestSupport::renderer, "det@v1"));
        assertThrows(IllegalArgumentException.class, () -> builder.register(" ", EngineTestSupport::renderer));
    }

    @Test
    void registersProvidersWithTheirAliases() {
        var provider = new BlockProvider() {
            @Override
            public String blockType() {
                return "Shout";
            }

            @Override
            public List<String> aliases() {
                return List.of("demo/shout@v1");
            }

            @Override
            public Block createBlock() {
                return new DemoBlocks.Echo();
            }
        };
        var registry = BlockRegistry.builder().register(provider).build();

        assertEquals(List.of("Shout", "demo/shout@v1"), List.copyOf(registry.types()));
        assertTrue(BlockRegistry.builder().build().types().isEmpty());
    }

    @Test
    void demoBlocksTolerateNullValues() throws Exception {
        var output = new DemoBlocks.Constant().run(new HashMap<>());
        assertTrue(output.containsKey("value"));
        assertNull(output.get("value"));
        assertEquals(Map.of("value", "x"), new DemoBlocks.Echo().run(Map.of("value", "x")));
    }
}
