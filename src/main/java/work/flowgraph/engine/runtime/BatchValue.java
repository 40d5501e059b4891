package work.flowgraph.engine.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Value stored in the execution context: either one value broadcast to the whole batch or one entry per
 * batch item.
 */
public final class BatchValue {
    private final boolean batched;
    private final Object value;
    private final List<Object> items;

    private BatchValue(boolean batched, Object value, List<Object> items) {
        this.batched = batched;
        this.value = value;
        this.items = items;
    }

    public static BatchValue broadcast(Object value) {
        return new BatchValue(false, value, List.of());
    }

    public static BatchValue batch(List<?> items) {
        return new BatchValue(true, null, Collections.unmodifiableList(new ArrayList<>(items)));
    }

    public boolean isBatched() {
        return batched;
    }

    /**
     * Number of batch items, or {@code -1} for broadcast values.
     */
    public int size() {
        return batched ? items.size() : -1;
    }

    /**
     * Value seen by batch item {@code index}.
     */
    public Object get(int index) {
        return batched ? items.get(index) : value;
    }

    public Object value() {
        if (batched) {
            throw new IllegalStateException("Batched value has no single value");
        }
        return value;
    }

    public List<Object> items() {
        if (!batched) {
            throw new IllegalStateException("Broadcast value has no items");
        }
        return items;
    }

    /**
     * Applies {@code mapper} to the single value or to every item, keeping the shape.
     */
    public BatchValue map(UnaryOperator<Object> mapper) {
        if (!batched) {
            return broadcast(mapper.apply(value));
        }
        var mapped = new ArrayList<>(items.size());
        for (var item : items) {
            mapped.add(mapper.apply(item));
        }
        return batch(mapped);
    }

    /**
     * Shape reported to callers: a list for batches, the plain value otherwise.
     */
    public Object toOutput() {
        return batched ? items : value;
    }

    @Override
    public String toString() {
        return batched ? "BatchValue[batch of " + items.size() + "]" : "BatchValue[broadcast]";
    }
}
