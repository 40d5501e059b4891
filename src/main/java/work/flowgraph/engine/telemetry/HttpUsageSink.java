package work.flowgraph.engine.telemetry;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Posts usage records as a JSON array to the usage endpoint, authenticated with the record's API key.
 */
public final class HttpUsageSink implements UsageSink {
    private static final Logger log = LoggerFactory.getLogger(HttpUsageSink.class);
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(1);

    private final URI endpoint;
    private final HttpClient client;
    private final Duration timeout;

    public HttpUsageSink(URI endpoint) {
        this(endpoint, HttpClient.newBuilder().connectTimeout(DEFAULT_TIMEOUT).build(), DEFAULT_TIMEOUT);
    }

    public HttpUsageSink(URI endpoint, HttpClient client, Duration timeout) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.client = Objects.requireNonNull(client, "client");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    @Override
    public void send(String apiKey, List<UsageRecord> records) throws IOException {
        var body = JSON.writeValueAsString(records);
        log.debug("Offloading {} usage record(s) to {}", records.size(), endpoint);
        var request = HttpRequest.newBuilder(endpoint)
            .timeout(timeout)
            .header("Content-Type", "application/json")
            .header("Authorization", "Bearer " + apiKey)
            .POST(HttpRequest.BodyPublishers.ofString(body))
            .build();
        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while sending usage to " + endpoint, ex);
        }
        if (response.statusCode() != 200) {
            throw new IOException("Usage endpoint answered HTTP " + response.statusCode());
        }
    }
}
