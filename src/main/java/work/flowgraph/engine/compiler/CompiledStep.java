package work.flowgraph.engine.compiler;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import work.flowgraph.engine.block.Block;

/**
 * A scheduled step: its manifest, the block instance serving it, the steps it reads from and its level.
 */
public record CompiledStep(StepManifest manifest, Block block, Set<String> producerStepNames, int levelIndex) {
    public CompiledStep {
        Objects.requireNonNull(manifest, "manifest");
        Objects.requireNonNull(block, "block");
        producerStepNames = Collections.unmodifiableSet(new LinkedHashSet<>(producerStepNames));
    }

    public String name() {
        return manifest.name();
    }
}
