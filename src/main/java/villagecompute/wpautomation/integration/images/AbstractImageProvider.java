package villagecompute.wpautomation.integration.images;

import java.io.IOException;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.jboss.logging.Logger;

import villagecompute.wpautomation.exceptions.RateLimitException;
import villagecompute.wpautomation.exceptions.RemoteServiceException;

/**
 * Shared HTTP plumbing for the image providers: one client per provider, JSON responses, status mapping.
 */
abstract class AbstractImageProvider implements ImageSearchProvider {

    private static final Logger LOG = Logger.getLogger(AbstractImageProvider.class);

    protected final ObjectMapper objectMapper;
    protected final String baseUrl;
    protected final Duration timeout;
    private final HttpClient httpClient;

    protected AbstractImageProvider(ObjectMapper objectMapper, String baseUrl, int timeoutSeconds) {
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.timeout = Duration.ofSeconds(timeoutSeconds);
        this.httpClient = HttpClient.newBuilder().followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(Duration.ofSeconds(5)).build();
    }

    protected JsonNode send(HttpRequest request) {
        HttpResponse<String> response;
        try {
            long started = System.currentTimeMillis();
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            LOG.debugf("%s %s -> %d (%dms)", name(), request.uri().getPath(), response.statusCode(),
                    System.currentTimeMillis() - started);
        } catch (IOException e) {
            throw new RemoteServiceException(name() + " API is not responding: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteServiceException(name() + " search interrupted", e);
        }

        int status = response.statusCode();
        if (status == 429) {
            throw new RateLimitException(name() + " API rate limit exceeded");
        }
        if (status == 401 || status == 403) {
            throw new RemoteServiceException("Invalid " + name() + " API key", status);
        }
        if (status < 200 || status >= 300) {
            throw new RemoteServiceException(name() + " API error: HTTP " + status, status);
        }

        try {
            return objectMapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new RemoteServiceException(name() + " returned an unreadable response", e);
        }
    }

    protected static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    protected static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    protected static String firstNonNull(String... values) {
        for (String value : values) {
            if (value != null) {
                return value;
            }
        }
        return null;
    }
}
