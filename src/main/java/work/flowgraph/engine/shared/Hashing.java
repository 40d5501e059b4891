package work.flowgraph.engine.shared;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;

/**
 * SHA-256 helpers for plan cache keys and telemetry resource ids.
 */
public final class Hashing {
    private static final ObjectMapper CANONICAL = new ObjectMapper()
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    private Hashing() {}

    public static String sha256Hex(String payload) {
        try {
            var digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(payload.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 is not available", ex);
        }
    }

    /**
     * JSON rendering with map keys sorted, so equal documents hash equally regardless of key order.
     */
    public static String canonicalJson(Object document) {
        try {
            return CANONICAL.writeValueAsString(document);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Document cannot be serialized to JSON: " + ex.getOriginalMessage(), ex);
        }
    }

    public static String specificationHash(Map<String, Object> document) {
        return sha256Hex(canonicalJson(document));
    }
}
