package work.flowgraph.engine.selector;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import work.flowgraph.engine.error.MalformedSelectorException;

/**
 * Converts raw field values into {@link FieldValue} trees.
 */
public final class SelectorParser {
    private static final Pattern NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_\\-]*");

    private SelectorParser() {}

    public static FieldValue parse(String field, Object raw) {
        if (raw instanceof String str) {
            return isReserved(str) ? parseSelector(field, str) : new FieldValue.Literal(str);
        }
        if (raw instanceof List<?> list) {
            var items = new ArrayList<FieldValue>(list.size());
            for (int i = 0; i < list.size(); i++) {
                items.add(parse(field + "[" + i + "]", list.get(i)));
            }
            return new FieldValue.ListValue(items);
        }
        if (raw instanceof Map<?, ?> map) {
            var entries = new LinkedHashMap<String, FieldValue>();
            for (var entry : map.entrySet()) {
                var key = String.valueOf(entry.getKey());
                entries.put(key, parse(field + "." + key, entry.getValue()));
            }
            return new FieldValue.MapValue(entries);
        }
        return new FieldValue.Literal(raw);
    }

    /**
     * Parses a value that must be a selector (workflow outputs).
     */
    public static FieldValue.Selector parseSelector(String field, String raw) {
        if (raw == null || !isReserved(raw)) {
            throw new MalformedSelectorException(field, String.valueOf(raw), "expected $inputs.<name> or $steps.<step>.<output>");
        }
        var trimmed = raw.trim();
        var parts = trimmed.split("\\.", -1);
        for (int i = 1; i < parts.length; i++) {
            if (!NAME.matcher(parts[i]).matches()) {
                throw new MalformedSelectorException(field, raw, "invalid segment '" + parts[i] + "'");
            }
        }
        if (SelectorScope.INPUT.prefix().equals(parts[0])) {
            if (parts.length < 2 || parts.length > 3) {
                throw new MalformedSelectorException(field, raw, "expected $inputs.<name>[.<property>]");
            }
            return new FieldValue.Selector(SelectorScope.INPUT, parts[1], null, parts.length == 3 ? parts[2] : null, raw);
        }
        if (SelectorScope.STEP_OUTPUT.prefix().equals(parts[0])) {
            if (parts.length < 3 || parts.length > 4) {
                throw new MalformedSelectorException(field, raw, "expected $steps.<step>.<output>[.<property>]");
            }
            return new FieldValue.Selector(SelectorScope.STEP_OUTPUT, parts[1], parts[2], parts.length == 4 ? parts[3] : null, raw);
        }
        throw new MalformedSelectorException(field, raw, "unknown selector scope '" + parts[0] + "'");
    }

    /**
     * True for strings carrying a reserved selector prefix, well-formed or not.
     */
    public static boolean isReserved(String value) {
        if (value == null) {
            return false;
        }
        var trimmed = value.trim();
        return startsWithScope(trimmed, SelectorScope.INPUT) || startsWithScope(trimmed, SelectorScope.STEP_OUTPUT);
    }

    private static boolean startsWithScope(String value, SelectorScope scope) {
        var prefix = scope.prefix();
        return value.startsWith(prefix) && (value.length() == prefix.length() || value.charAt(prefix.length()) == '.');
    }
}
