package work.flowgraph.engine.source;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.flowgraph.engine.config.SourceSettings;
import work.flowgraph.engine.error.MalformedWorkflowResponseException;
import work.flowgraph.engine.error.WorkflowSourceException;

class HttpWorkflowSpecificationSourceTest {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final Map<String, Object> SPECIFICATION = Map.of(
        "version", "1.0",
        "inputs", List.of(Map.of("type", "WorkflowImage", "name", "image")),
        "steps", List.of(),
        "outputs", List.of()
    );

    @TempDir
    Path cacheDir;

    private HttpServer server;
    private final AtomicReference<Integer> status = new AtomicReference<>(200);
    private final AtomicReference<String> body = new AtomicReference<>();
    private final AtomicReference<URI> lastRequest = new AtomicReference<>();

    @BeforeEach
    void startServer() throws IOException {
        body.set(responseFor(SPECIFICATION));
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", exchange -> {
            lastRequest.set(exchange.getRequestURI());
            var bytes = body.get().getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(status.get(), bytes.length);
            try (var out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
        server.start();
    }

    @AfterEach
    void stopServer() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    void fetchesAndCachesSpecification() {
        var source = source("secret");

        var specification = source.fetch("my-workspace", "detect");

        assertEquals(SPECIFICATION, specification);
        assertEquals("/api/my-workspace/workflows/detect", lastRequest.get().getPath());
        assertEquals("api_key=secret", lastRequest.get().getQuery());
        assertTrue(Files.isRegularFile(cacheDir.resolve("workflow/my-workspace/detect.json")));
    }

    @Test
    void omitsBlankApiKey() {
        var source = source(" ");
        assertEquals(URI.create(baseUrl() + "/ws/workflows/wf"), source.requestUri("ws", "wf"));
    }

    @Test
    void mapsHttpErrors() {
        var source = source("secret");

        status.set(401);
        var unauthorized = assertThrows(WorkflowSourceException.class, () -> source.fetch("ws", "wf"));
        assertTrue(unauthorized.getMessage().startsWith("Unauthorized access to workflow ws/wf"));

        status.set(404);
        var missing = assertThrows(WorkflowSourceException.class, () -> source.fetch("ws", "wf"));
        assertEquals("Workflow ws/wf not found", missing.getMessage());

        status.set(500);
        var broken = assertThrows(WorkflowSourceException.class, () -> source.fetch("ws", "wf"));
        assertTrue(broken.getMessage().contains("HTTP 500"));
        assertFalse(Files.exists(cacheDir.resolve("workflow/ws/wf.json")));
    }

    @Test
    void rejectsMalformedResponses() {
        var source = source("secret");

        body.set("not json");
        assertThrows(MalformedWorkflowResponseException.class, () -> source.fetch("ws", "wf"));

        body.set("{\"workflow\": {\"config\": \"{broken\"}}");
        assertThrows(MalformedWorkflowResponseException.class, () -> source.fetch("ws", "wf"));

        body.set("{\"workflow\": {\"config\": \"{}\"}}");
        assertThrows(MalformedWorkflowResponseException.class, () -> source.fetch("ws", "wf"));

        body.set("{\"unexpected\": true}");
        assertThrows(MalformedWorkflowResponseException.class, () -> source.fetch("ws", "wf"));
    }

    @Test
    void fallsBackToCacheWhenUnreachable() {
        var source = source("secret");
        source.fetch("ws", "wf");
        server.stop(0);
        server = null;

        assertEquals(SPECIFICATION, source.fetch("ws", "wf"));
        var error = assertThrows(WorkflowSourceException.class, () -> source.fetch("ws", "never-fetched"));
        assertTrue(error.getMessage().contains("no cached copy exists"));
    }

    @Test
    void discardsCorruptCacheEntries() throws IOException {
        var source = source("secret");
        var cached = cacheDir.resolve("workflow/ws/wf.json");
        Files.createDirectories(cached.getParent());
        Files.writeString(cached, "{corrupt");
        server.stop(0);
        server = null;

        assertThrows(WorkflowSourceException.class, () -> source.fetch("ws", "wf"));
        assertFalse(Files.exists(cached));
    }

    @Test
    void sanitizesCacheSegments() {
        assertEquals("a_b", WorkflowResponseCache.sanitize("a/b"));
        assertEquals("__", WorkflowResponseCache.sanitize(".."));
        assertEquals("_", WorkflowResponseCache.sanitize(""));
        assertEquals("v1.2-x", WorkflowResponseCache.sanitize("v1.2-x"));
    }

    private HttpWorkflowSpecificationSource source(String apiKey) {
        return new HttpWorkflowSpecificationSource(new SourceSettings(URI.create(baseUrl()), apiKey, cacheDir));
    }

    private String baseUrl() {
        return "http://127.0.0.1:" + server.getAddress().getPort() + "/api";
    }

    private static String responseFor(Map<String, Object> specification) throws IOException {
        var config = JSON.writeValueAsString(Map.of("specification", specification));
        return JSON.writeValueAsString(Map.of("workflow", Map.of("config", config)));
    }
}
