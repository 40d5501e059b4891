package work.flowgraph.engine.runtime;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import work.flowgraph.engine.error.StepExecutionException;
import work.flowgraph.engine.error.UnresolvedValueException;
import work.flowgraph.engine.selector.FieldValue;

/**
 * Turns parsed step fields into concrete values read from an {@link ExecutionContext}.
 */
final class FieldResolver {
    private FieldResolver() {}

    static Map<String, BatchValue> resolve(String step, Map<String, FieldValue> fields, ExecutionContext context) {
        var resolved = new LinkedHashMap<String, BatchValue>();
        for (var entry : fields.entrySet()) {
            resolved.put(entry.getKey(), resolve(step, entry.getValue(), context));
        }
        return resolved;
    }

    static BatchValue resolve(String step, FieldValue value, ExecutionContext context) {
        if (value instanceof FieldValue.Literal literal) {
            return BatchValue.broadcast(literal.value());
        }
        if (value instanceof FieldValue.Selector selector) {
            var found = context.lookup(selector.socket())
                .orElseThrow(() -> new UnresolvedValueException(step, selector.text()));
            if (!selector.hasProperty()) {
                return found;
            }
            return found.map(item -> readProperty(step, selector, item));
        }
        if (value instanceof FieldValue.ListValue list) {
            var items = new ArrayList<BatchValue>(list.items().size());
            for (var item : list.items()) {
                items.add(resolve(step, item, context));
            }
            return combine(step, items, FieldResolver::itemsAsList);
        }
        if (value instanceof FieldValue.MapValue map) {
            var keys = new ArrayList<>(map.entries().keySet());
            var items = new ArrayList<BatchValue>(keys.size());
            for (var key : keys) {
                items.add(resolve(step, map.entries().get(key), context));
            }
            return combine(step, items, values -> {
                var result = new LinkedHashMap<String, Object>();
                for (int i = 0; i < keys.size(); i++) {
                    result.put(keys.get(i), values.get(i));
                }
                return result;
            });
        }
        throw new IllegalStateException("Unsupported field value " + value);
    }

    /**
     * Size of the batch the fields span, or {@code -1} when every field is broadcast.
     */
    static int batchSize(String step, Map<String, BatchValue> fields) {
        int size = -1;
        for (var value : fields.values()) {
            if (!value.isBatched()) {
                continue;
            }
            if (size < 0) {
                size = value.size();
            } else if (size != value.size()) {
                throw new StepExecutionException(step, "fields span batches of different sizes (" + size + " and " + value.size() + ")");
            }
        }
        return size;
    }

    /**
     * Field values seen by batch item {@code index}.
     */
    static Map<String, Object> item(Map<String, BatchValue> fields, int index) {
        var values = new LinkedHashMap<String, Object>();
        for (var entry : fields.entrySet()) {
            values.put(entry.getKey(), entry.getValue().get(index));
        }
        return values;
    }

    /**
     * Field values for a batch-capable block: batched fields as lists, broadcast ones as plain values.
     */
    static Map<String, Object> whole(Map<String, BatchValue> fields) {
        var values = new LinkedHashMap<String, Object>();
        for (var entry : fields.entrySet()) {
            values.put(entry.getKey(), entry.getValue().toOutput());
        }
        return values;
    }

    static Object readProperty(String step, FieldValue.Selector selector, Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Map<?, ?> map) {
            return map.get(selector.property());
        }
        throw new StepExecutionException(
            step,
            "cannot read property '" + selector.property() + "' of " + value.getClass().getSimpleName() + " behind " + selector.socket()
        );
    }

    private static Object itemsAsList(List<Object> values) {
        return new ArrayList<>(values);
    }

    private static BatchValue combine(String step, List<BatchValue> parts, Function<List<Object>, Object> assemble) {
        int size = -1;
        for (var part : parts) {
            if (!part.isBatched()) {
                continue;
            }
            if (size < 0) {
                size = part.size();
            } else if (size != part.size()) {
                throw new StepExecutionException(step, "nested values span batches of different sizes (" + size + " and " + part.size() + ")");
            }
        }
        if (size < 0) {
            var values = new ArrayList<>(parts.size());
            for (var part : parts) {
                values.add(part.value());
            }
            return BatchValue.broadcast(assemble.apply(values));
        }
        var items = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            var values = new ArrayList<>(parts.size());
            for (var part : parts) {
                values.add(part.get(i));
            }
            items.add(assemble.apply(values));
        }
        return BatchValue.batch(items);
    }
}
