package work.flowgraph.engine.kind;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Catalog of known kinds plus the compatibility rule used by the planner.
 */
public final class Kinds {
    static final String WILDCARD_NAME = "*";

    private static final Map<String, Kind> CATALOG = new ConcurrentHashMap<>();

    public static final Kind WILDCARD = builtin(WILDCARD_NAME, "Accepts or produces any kind");
    public static final Kind IMAGE = builtin("image", "Image");
    public static final Kind OBJECT_DETECTIONS = builtin("detections", "Object detection predictions");
    public static final Kind INSTANCE_SEGMENTATION = builtin("instance_segmentation", "Instance segmentation predictions");
    public static final Kind KEYPOINTS = builtin("keypoints", "Keypoint detection predictions");
    public static final Kind BAR_CODE_DETECTIONS = builtin("bar_code_detections", "Bar code detections");
    public static final Kind QR_CODE_DETECTIONS = builtin("qr_code_detections", "QR code detections");
    public static final Kind CLASSIFICATION = builtin("classification", "Classification predictions");
    public static final Kind STRING = builtin("string", "String value");
    public static final Kind INTEGER = builtin("integer", "Integer value");
    public static final Kind FLOAT = builtin("float", "Float value");
    public static final Kind FLOAT_ZERO_TO_ONE = builtin("float_zero_to_one", "Float in range [0.0, 1.0]");
    public static final Kind BOOLEAN = builtin("boolean", "Boolean flag");
    public static final Kind DICTIONARY = builtin("dictionary", "Dictionary");
    public static final Kind LIST_OF_VALUES = builtin("list_of_values", "List of values of any type");
    public static final Kind MODEL_ID = builtin("roboflow_model_id", "Model identifier");

    private Kinds() {}

    private static Kind builtin(String name, String description) {
        var kind = new Kind(name, description);
        CATALOG.put(name, kind);
        return kind;
    }

    /**
     * Adds a kind to the catalog. Registering an existing name returns the existing kind.
     */
    public static Kind register(String name, String description) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Kind name must not be blank");
        }
        return CATALOG.computeIfAbsent(name.trim(), key -> new Kind(key, description));
    }

    public static Optional<Kind> lookup(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(CATALOG.get(name.trim()));
    }

    public static Set<Kind> of(Kind... kinds) {
        var set = new LinkedHashSet<Kind>();
        for (var kind : kinds) {
            set.add(kind);
        }
        return Set.copyOf(set);
    }

    public static Set<Kind> any() {
        return Set.of(WILDCARD);
    }

    /**
     * An edge is valid when either side contains the wildcard or both sets intersect.
     */
    public static boolean compatible(Collection<Kind> produced, Collection<Kind> accepted) {
        if (containsWildcard(produced) || containsWildcard(accepted)) {
            return true;
        }
        for (var kind : produced) {
            if (accepted.contains(kind)) {
                return true;
            }
        }
        return false;
    }

    private static boolean containsWildcard(Collection<Kind> kinds) {
        if (kinds == null || kinds.isEmpty()) {
            return true;
        }
        for (var kind : kinds) {
            if (kind.isWildcard()) {
                return true;
            }
        }
        return false;
    }
}
