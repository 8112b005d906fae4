package villagecompute.wpautomation.integration.research;

import java.io.IOException;
import java.math.BigDecimal;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import villagecompute.wpautomation.api.types.ArticleContentType;
import villagecompute.wpautomation.exceptions.ConfigurationException;
import villagecompute.wpautomation.exceptions.RemoteServiceException;

/**
 * Client for the external research service that writes a full article from a topic.
 *
 * <p>
 * The service is called with {@code POST <research.base-url>} and body {@code {"context": "<topic>"}}. It may take
 * several minutes, hence the long {@code research.timeout-seconds}. A usable response carries {@code output.title},
 * {@code output.excerpt} and {@code output.content}.
 */
@ApplicationScoped
public class ResearchApiClient {

    private static final Logger LOG = Logger.getLogger(ResearchApiClient.class);

    public static final String MODEL_NAME = "research-api";

    private final ObjectMapper objectMapper;
    private final boolean enabled;
    private final String baseUrl;
    private final String token;
    private final Duration timeout;
    private final HttpClient httpClient;

    @Inject
    public ResearchApiClient(ObjectMapper objectMapper,
            @ConfigProperty(
                    name = "research.enabled",
                    defaultValue = "false") boolean enabled,
            @ConfigProperty(
                    name = "research.base-url") Optional<String> baseUrl,
            @ConfigProperty(
                    name = "research.token") Optional<String> token,
            @ConfigProperty(
                    name = "research.timeout-seconds",
                    defaultValue = "300") int timeoutSeconds) {
        this.objectMapper = objectMapper;
        this.enabled = enabled;
        this.baseUrl = baseUrl.filter(url -> !url.isBlank()).orElse(null);
        this.token = token.filter(value -> !value.isBlank()).orElse(null);
        this.timeout = Duration.ofSeconds(timeoutSeconds);
        this.httpClient = HttpClient.newBuilder().followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(Duration.ofSeconds(10)).build();
    }

    /**
     * Whether the research service is switched on and has an endpoint.
     */
    public boolean isConfigured() {
        return enabled && baseUrl != null;
    }

    /**
     * Asks the research service for an article on {@code topic}.
     *
     * @throws ConfigurationException
     *             if the client is not configured
     * @throws RemoteServiceException
     *             on transport errors, non-200 responses or an incomplete payload
     */
    public ArticleContentType research(String topic) {
        if (!isConfigured()) {
            throw new ConfigurationException("Research API not configured or disabled");
        }

        String body;
        try {
            body = objectMapper.writeValueAsString(Map.of("context", topic));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize research request", e);
        }

        HttpRequest.Builder builder = HttpRequest.newBuilder().uri(URI.create(baseUrl)).timeout(timeout)
                .header("Content-Type", "application/json").POST(HttpRequest.BodyPublishers.ofString(body));
        if (token != null) {
            builder.header("Authorization", "Bearer " + token);
        }

        LOG.infof("Requesting research article for topic \"%s\"", topic);
        long started = System.currentTimeMillis();
        HttpResponse<String> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new RemoteServiceException("Research API request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteServiceException("Research API request interrupted", e);
        }

        if (response.statusCode() != 200) {
            throw new RemoteServiceException("Research API returned status " + response.statusCode(),
                    response.statusCode());
        }

        JsonNode output;
        try {
            output = objectMapper.readTree(response.body()).path("output");
        } catch (JsonProcessingException e) {
            throw new RemoteServiceException("Invalid response from Research API", e);
        }

        String title = textOrNull(output, "title");
        String excerpt = textOrNull(output, "excerpt");
        String content = textOrNull(output, "content");
        if (title == null || excerpt == null || content == null) {
            throw new RemoteServiceException("Invalid response from Research API");
        }

        LOG.infof("Research article received in %dms: \"%s\"", System.currentTimeMillis() - started, title);
        return new ArticleContentType(title, excerpt, content, 0, BigDecimal.ZERO, MODEL_NAME);
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isTextual() && !value.asText().isBlank() ? value.asText() : null;
    }
}
