package work.flowgraph.engine.compiler;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.flowgraph.engine.shared.Hashing;
import work.flowgraph.engine.spec.WorkflowSpecification;

/**
 * Bounded LRU of compiled plans keyed by specification hash. Compile failures are never cached.
 */
public final class PlanCache {
    private static final Logger log = LoggerFactory.getLogger(PlanCache.class);
    public static final int DEFAULT_CAPACITY = 64;

    private final WorkflowCompiler compiler;
    private final Map<String, CompiledPlan> plans;

    public PlanCache(WorkflowCompiler compiler) {
        this(compiler, DEFAULT_CAPACITY);
    }

    public PlanCache(WorkflowCompiler compiler, int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Plan cache capacity must be positive: " + capacity);
        }
        this.compiler = Objects.requireNonNull(compiler, "compiler");
        this.plans = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, CompiledPlan> eldest) {
                return size() > capacity;
            }
        };
    }

    public CompiledPlan get(WorkflowSpecification spec) {
        var key = Hashing.specificationHash(spec.document());
        synchronized (plans) {
            var cached = plans.get(key);
            if (cached != null) {
                log.debug("Plan cache hit for {}", key);
                return cached;
            }
        }
        var compiled = compiler.compile(spec);
        synchronized (plans) {
            var raced = plans.putIfAbsent(key, compiled);
            return raced != null ? raced : compiled;
        }
    }

    public int size() {
        synchronized (plans) {
            return plans.size();
        }
    }

    public void clear() {
        synchronized (plans) {
            plans.clear();
        }
    }
}
