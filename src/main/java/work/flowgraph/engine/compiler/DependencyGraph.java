package work.flowgraph.engine.compiler;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import work.flowgraph.engine.selector.FieldValue;
import work.flowgraph.engine.selector.SelectorScope;

/**
 * Resolved selectors of every step, seen as directed edges producer → consumer.
 */
public final class DependencyGraph {
    private final List<String> steps;
    private final Map<String, List<Edge>> edgesByConsumer;
    private final Map<String, Set<String>> producers;
    private final Map<String, Set<String>> consumers;

    DependencyGraph(List<String> steps, Map<String, List<Edge>> edgesByConsumer) {
        this.steps = List.copyOf(steps);
        var frozenEdges = new LinkedHashMap<String, List<Edge>>();
        var producerMap = new LinkedHashMap<String, Set<String>>();
        var consumerMap = new LinkedHashMap<String, Set<String>>();
        for (var step : steps) {
            producerMap.put(step, new LinkedHashSet<>());
            consumerMap.put(step, new LinkedHashSet<>());
        }
        for (var step : steps) {
            var edges = edgesByConsumer.getOrDefault(step, List.of());
            frozenEdges.put(step, List.copyOf(edges));
            for (var edge : edges) {
                if (edge.fromStep()) {
                    producerMap.get(step).add(edge.producerStep());
                    consumerMap.get(edge.producerStep()).add(step);
                }
            }
        }
        this.edgesByConsumer = Collections.unmodifiableMap(frozenEdges);
        producerMap.replaceAll((key, value) -> Collections.unmodifiableSet(value));
        consumerMap.replaceAll((key, value) -> Collections.unmodifiableSet(value));
        this.producers = Collections.unmodifiableMap(producerMap);
        this.consumers = Collections.unmodifiableMap(consumerMap);
    }

    public List<String> steps() {
        return steps;
    }

    public List<Edge> edgesInto(String step) {
        return edgesByConsumer.getOrDefault(step, List.of());
    }

    public Set<String> producersOf(String step) {
        return producers.getOrDefault(step, Set.of());
    }

    public Set<String> consumersOf(String step) {
        return consumers.getOrDefault(step, Set.of());
    }

    /**
     * One selector occurrence: {@code consumer.field} reads {@code selector}.
     */
    public record Edge(FieldValue.Selector selector, String consumer, String field) {
        public boolean fromStep() {
            return selector.scope() == SelectorScope.STEP_OUTPUT;
        }

        public String producerStep() {
            return fromStep() ? selector.name() : null;
        }
    }
}
