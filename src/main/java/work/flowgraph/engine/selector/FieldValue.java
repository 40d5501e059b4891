package work.flowgraph.engine.selector;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Parsed step field: a literal, a selector, or a list/map nesting further field values.
 * Built once by {@link SelectorParser}; everything downstream switches on the concrete record.
 */
public interface FieldValue {

    /**
     * All selectors contained in this value, in document order.
     */
    default List<Selector> selectors() {
        var collected = new ArrayList<Selector>();
        collectSelectors(this, collected);
        return collected;
    }

    private static void collectSelectors(FieldValue value, List<Selector> target) {
        if (value instanceof Selector selector) {
            target.add(selector);
        } else if (value instanceof ListValue list) {
            for (var item : list.items()) {
                collectSelectors(item, target);
            }
        } else if (value instanceof MapValue map) {
            for (var item : map.entries().values()) {
                collectSelectors(item, target);
            }
        }
    }

    record Literal(Object value) implements FieldValue {}

    /**
     * Reference to {@code $inputs.<name>[.<property>]} or {@code $steps.<name>.<output>[.<property>]}.
     * {@code output} is {@code null} for input selectors, {@code property} is {@code null} when absent.
     * {@code raw} keeps the text the selector was parsed from and takes no part in equality.
     */
    record Selector(SelectorScope scope, String name, String output, String property, String raw) implements FieldValue {
        public Selector {
            Objects.requireNonNull(scope, "scope");
            Objects.requireNonNull(name, "name");
            if (scope == SelectorScope.STEP_OUTPUT) {
                Objects.requireNonNull(output, "output");
            }
        }

        public Selector(SelectorScope scope, String name, String output, String property) {
            this(scope, name, output, property, null);
        }

        public static Selector input(String name) {
            return new Selector(SelectorScope.INPUT, name, null, null);
        }

        public static Selector stepOutput(String step, String output) {
            return new Selector(SelectorScope.STEP_OUTPUT, step, output, null);
        }

        public boolean hasProperty() {
            return property != null;
        }

        /**
         * The selector without its property accessor, i.e. the socket it reads from.
         */
        public Selector socket() {
            return hasProperty() ? new Selector(scope, name, output, null) : this;
        }

        /**
         * The selector as written in the document, or its canonical form when built in code.
         */
        public String text() {
            return raw != null ? raw : canonical();
        }

        private String canonical() {
            var builder = new StringBuilder(scope.prefix()).append('.').append(name);
            if (output != null) {
                builder.append('.').append(output);
            }
            if (property != null) {
                builder.append('.').append(property);
            }
            return builder.toString();
        }

        @Override
        public boolean equals(Object other) {
            return other instanceof Selector that
                && scope == that.scope
                && name.equals(that.name)
                && Objects.equals(output, that.output)
                && Objects.equals(property, that.property);
        }

        @Override
        public int hashCode() {
            return Objects.hash(scope, name, output, property);
        }

        @Override
        public String toString() {
            return text();
        }
    }

    record ListValue(List<FieldValue> items) implements FieldValue {
        public ListValue {
            items = List.copyOf(items);
        }
    }

    record MapValue(Map<String, FieldValue> entries) implements FieldValue {
        public MapValue {
            entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        }
    }
}
