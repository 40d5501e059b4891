package work.flowgraph.engine.source;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Raw workflow responses stored under {@code <cacheDir>/workflow/<workspace>/<workflow>.json}.
 */
final class WorkflowResponseCache {
    private static final Logger log = LoggerFactory.getLogger(WorkflowResponseCache.class);
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final Pattern UNSAFE = Pattern.compile("[^A-Za-z0-9._-]");

    private final Path root;

    WorkflowResponseCache(Path cacheDir) {
        this.root = cacheDir.resolve("workflow");
    }

    Path path(String workspaceId, String workflowId) {
        return root.resolve(sanitize(workspaceId)).resolve(sanitize(workflowId) + ".json");
    }

    void store(String workspaceId, String workflowId, String body) {
        var target = path(workspaceId, workflowId);
        try {
            Files.createDirectories(target.getParent());
            Files.writeString(target, body);
        } catch (IOException ex) {
            log.warn("Could not cache workflow response at {}: {}", target, ex.getMessage());
        }
    }

    /**
     * Cached response, if any. A file that cannot be read as JSON is deleted.
     */
    Optional<Map<String, Object>> load(String workspaceId, String workflowId) {
        var file = path(workspaceId, workflowId);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(JSON.readValue(file.toFile(), new TypeReference<Map<String, Object>>() {}));
        } catch (IOException ex) {
            log.warn("Discarding unreadable cached workflow response {}: {}", file, ex.getMessage());
            delete(workspaceId, workflowId);
            return Optional.empty();
        }
    }

    void delete(String workspaceId, String workflowId) {
        var file = path(workspaceId, workflowId);
        try {
            Files.deleteIfExists(file);
        } catch (IOException ex) {
            log.warn("Could not delete cached workflow response {}: {}", file, ex.getMessage());
        }
    }

    static String sanitize(String segment) {
        if (segment == null || segment.isEmpty()) {
            return "_";
        }
        var safe = UNSAFE.matcher(segment).replaceAll("_");
        return safe.chars().allMatch(c -> c == '.') ? safe.replace('.', '_') : safe;
    }
}
