package work.flowgraph.engine.block;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable mapping from block type identifiers to factories. Built once at startup.
 */
public final class BlockRegistry {
    private static final Logger log = LoggerFactory.getLogger(BlockRegistry.class);

    private final Map<String, Entry> entries;

    private BlockRegistry(Map<String, Entry> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Registry holding every enabled {@link BlockProvider} found on the class path.
     */
    public static BlockRegistry discover() {
        return builder().discover().build();
    }

    public Optional<Entry> get(String type) {
        return type == null ? Optional.empty() : Optional.ofNullable(entries.get(type));
    }

    public boolean contains(String type) {
        return type != null && entries.containsKey(type);
    }

    public Set<String> types() {
        return entries.keySet();
    }

    public record Entry(String type, BlockFactory factory) {}

    public static final class Builder {
        private final Map<String, Entry> entries = new LinkedHashMap<>();

        private Builder() {}

        public Builder register(String type, BlockFactory factory, String... aliases) {
            if (type == null || type.isBlank()) {
                throw new IllegalArgumentException("Block type must not be blank");
            }
            if (factory == null) {
                throw new IllegalArgumentException("Block factory must not be null for type " + type);
            }
            var entry = new Entry(type, factory);
            put(type, entry);
            for (var alias : aliases) {
                put(alias, entry);
            }
            return this;
        }

        public Builder register(BlockProvider provider) {
            return register(provider.blockType(), provider::createBlock, provider.aliases().toArray(String[]::new));
        }

        public Builder discover() {
            return discover(Thread.currentThread().getContextClassLoader());
        }

        public Builder discover(ClassLoader loader) {
            for (var provider : ServiceLoader.load(BlockProvider.class, loader)) {
                if (!provider.isEnabled()) {
                    log.debug("Skipping disabled block provider {}", provider.blockType());
                    continue;
                }
                register(provider);
                log.debug("Registered block {} from {}", provider.blockType(), provider.getClass().getName());
            }
            return this;
        }

        private void put(String key, Entry entry) {
            if (entries.putIfAbsent(key, entry) != null) {
                throw new IllegalStateException("Block type already registered: " + key);
            }
        }

        public BlockRegistry build() {
            return new BlockRegistry(entries);
        }
    }
}
