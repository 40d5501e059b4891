package work.flowgraph.engine.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.flowgraph.engine.config.SourceSettings;
import work.flowgraph.engine.error.MalformedWorkflowResponseException;
import work.flowgraph.engine.error.WorkflowSourceException;

/**
 * Fetches stored workflows from the platform API.
 * <p>
 * Successful responses are cached on disk; when the API cannot be reached the cached response is used
 * instead. The specification itself travels as a JSON string under {@code workflow.config}.
 */
public final class HttpWorkflowSpecificationSource implements WorkflowSpecificationSource {
    private static final Logger log = LoggerFactory.getLogger(HttpWorkflowSpecificationSource.class);
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final Duration TIMEOUT = Duration.ofSeconds(30);

    private final SourceSettings settings;
    private final HttpClient client;
    private final WorkflowResponseCache cache;

    public HttpWorkflowSpecificationSource(SourceSettings settings) {
        this(settings, HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build());
    }

    public HttpWorkflowSpecificationSource(SourceSettings settings, HttpClient client) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.client = Objects.requireNonNull(client, "client");
        this.cache = new WorkflowResponseCache(settings.cacheDir());
    }

    @Override
    public Map<String, Object> fetch(String workspaceId, String workflowId) {
        if (workspaceId == null || workspaceId.isBlank() || workflowId == null || workflowId.isBlank()) {
            throw new IllegalArgumentException("workspaceId and workflowId are required");
        }
        var uri = requestUri(workspaceId, workflowId);
        Map<String, Object> response;
        try {
            response = download(uri, workspaceId, workflowId);
        } catch (IOException ex) {
            log.warn("Workflow source unreachable ({}), trying cached response", ex.getMessage());
            response = cache.load(workspaceId, workflowId)
                .orElseThrow(() -> new WorkflowSourceException(
                    "Could not reach workflow source for " + workspaceId + "/" + workflowId + " and no cached copy exists",
                    ex
                ));
        }
        return extractSpecification(response);
    }

    URI requestUri(String workspaceId, String workflowId) {
        var base = settings.apiBaseUrl().toString();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        var url = new StringBuilder(base)
            .append('/').append(encode(workspaceId))
            .append("/workflows/").append(encode(workflowId));
        if (settings.apiKey() != null && !settings.apiKey().isBlank()) {
            url.append("?api_key=").append(encode(settings.apiKey()));
        }
        return URI.create(url.toString());
    }

    private Map<String, Object> download(URI uri, String workspaceId, String workflowId) throws IOException {
        var request = HttpRequest.newBuilder(uri).timeout(TIMEOUT).GET().build();
        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new WorkflowSourceException("Interrupted while fetching workflow " + workspaceId + "/" + workflowId, ex);
        }
        int status = response.statusCode();
        if (status == 401) {
            throw new WorkflowSourceException("Unauthorized access to workflow " + workspaceId + "/" + workflowId + ": check the API key");
        }
        if (status == 404) {
            throw new WorkflowSourceException("Workflow " + workspaceId + "/" + workflowId + " not found");
        }
        if (status >= 400) {
            throw new WorkflowSourceException("Workflow source answered HTTP " + status + " for " + workspaceId + "/" + workflowId);
        }
        Map<String, Object> parsed;
        try {
            parsed = JSON.readValue(response.body(), MAP_TYPE);
        } catch (JsonProcessingException ex) {
            throw new MalformedWorkflowResponseException("Workflow source returned a body that is not a JSON object", ex);
        }
        cache.store(workspaceId, workflowId, response.body());
        log.debug("Fetched workflow {}/{}", workspaceId, workflowId);
        return parsed;
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> extractSpecification(Map<String, Object> response) {
        if (response == null || !(response.get("workflow") instanceof Map<?, ?> workflow) || !workflow.containsKey("config")) {
            throw new MalformedWorkflowResponseException("Could not find workflow specification in API response");
        }
        if (!(workflow.get("config") instanceof String config)) {
            throw new MalformedWorkflowResponseException("Could not decode workflow specification in API response");
        }
        Map<String, Object> decoded;
        try {
            decoded = JSON.readValue(config, MAP_TYPE);
        } catch (JsonProcessingException ex) {
            throw new MalformedWorkflowResponseException("Could not decode workflow specification in API response", ex);
        }
        if (decoded == null || !(decoded.get("specification") instanceof Map<?, ?> specification)) {
            throw new MalformedWorkflowResponseException("Workflow specification not found in API response");
        }
        return (Map<String, Object>) specification;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
