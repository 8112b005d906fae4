package villagecompute.wpautomation.integration.wordpress;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import villagecompute.wpautomation.api.types.PublishResultType;
import villagecompute.wpautomation.api.types.WordPressTermType;
import villagecompute.wpautomation.data.models.Site;
import villagecompute.wpautomation.exceptions.ConfigurationException;
import villagecompute.wpautomation.exceptions.RateLimitException;
import villagecompute.wpautomation.exceptions.RemoteServiceException;

/**
 * HTTP client for the WordPress REST API ({@code /wp-json/wp/v2}).
 *
 * <p>
 * Authentication is HTTP basic with the site's username and application password. WordPress displays application
 * passwords in space-separated groups, so all whitespace is removed before use.
 *
 * <h2>Endpoints</h2>
 * <ul>
 * <li>{@code GET /categories?per_page=100}</li>
 * <li>{@code GET /tags?search=}, {@code POST /tags}</li>
 * <li>{@code POST /media} (raw body, 5 minute timeout)</li>
 * <li>{@code POST /posts}, {@code POST /posts/{id}}, {@code DELETE /posts/{id}}</li>
 * </ul>
 *
 * Non-2xx responses raise {@link RemoteServiceException} carrying the status and the response body; 429 raises
 * {@link RateLimitException}.
 */
@ApplicationScoped
public class WordPressClient {

    private static final Logger LOG = Logger.getLogger(WordPressClient.class);

    public static final String USER_AGENT = "WordPress-Manager/1.0";
    private static final String API_PATH = "/wp-json/wp/v2";
    private static final int MAX_ERROR_BODY = 500;

    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;
    private final Duration mediaTimeout;
    private final Duration downloadTimeout;
    private final HttpClient httpClient;

    /**
     * An image fetched for upload.
     */
    public record DownloadedImage(byte[] data, String contentType) {
    }

    @Inject
    public WordPressClient(ObjectMapper objectMapper,
            @ConfigProperty(
                    name = "wordpress.timeout-seconds",
                    defaultValue = "30") int timeoutSeconds,
            @ConfigProperty(
                    name = "wordpress.media-timeout-seconds",
                    defaultValue = "300") int mediaTimeoutSeconds,
            @ConfigProperty(
                    name = "wordpress.download-timeout-seconds",
                    defaultValue = "60") int downloadTimeoutSeconds) {
        this.objectMapper = objectMapper;
        this.requestTimeout = Duration.ofSeconds(timeoutSeconds);
        this.mediaTimeout = Duration.ofSeconds(mediaTimeoutSeconds);
        this.downloadTimeout = Duration.ofSeconds(downloadTimeoutSeconds);
        this.httpClient = HttpClient.newBuilder().followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(Duration.ofSeconds(10)).build();
    }

    public List<WordPressTermType> listCategories(Site site) {
        JsonNode body = send(site, request(site, "/categories?per_page=100", requestTimeout).GET().build());
        return terms(body);
    }

    public Optional<WordPressTermType> findTag(Site site, String name) {
        JsonNode body = send(site, request(site, "/tags?search=" + encode(name), requestTimeout).GET().build());
        List<WordPressTermType> found = terms(body);
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    public WordPressTermType createTag(Site site, String name) {
        JsonNode body = send(site, request(site, "/tags", requestTimeout).header("Content-Type", "application/json")
                .POST(json(Map.of("name", name))).build());
        return new WordPressTermType(body.path("id").asLong(), body.path("name").asText(name));
    }

    /**
     * Fetches an image from an arbitrary URL, without site credentials.
     */
    public DownloadedImage downloadImage(String imageUrl) {
        HttpRequest request = HttpRequest.newBuilder().uri(URI.create(imageUrl)).timeout(downloadTimeout)
                .header("User-Agent", USER_AGENT).GET().build();
        HttpResponse<byte[]> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (IOException e) {
            throw new RemoteServiceException("Failed to download image " + imageUrl + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteServiceException("Interrupted while downloading image " + imageUrl, e);
        }
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new RemoteServiceException("Image download returned HTTP " + response.statusCode(),
                    response.statusCode());
        }
        String contentType = response.headers().firstValue("Content-Type").map(value -> value.split(";")[0].trim())
                .filter(value -> !value.isBlank()).orElse("image/jpeg");
        return new DownloadedImage(response.body(), contentType);
    }

    /**
     * Uploads raw image bytes to the media library.
     *
     * @return the new media id
     */
    public long uploadMedia(Site site, DownloadedImage image, String filename) {
        HttpRequest request = request(site, "/media", mediaTimeout).header("Content-Type", image.contentType())
                .header("Content-Disposition", "attachment; filename=\"" + filename + "\"")
                .POST(HttpRequest.BodyPublishers.ofByteArray(image.data())).build();
        return send(site, request).path("id").asLong();
    }

    public PublishResultType createPost(Site site, Map<String, Object> fields) {
        JsonNode body = send(site, request(site, "/posts", requestTimeout).header("Content-Type", "application/json")
                .POST(json(fields)).build());
        Object featured = fields.get("featured_media");
        return new PublishResultType(body.path("id").asLong(), body.path("link").asText(null),
                featured instanceof Number number ? number.longValue() : null);
    }

    public void updatePost(Site site, long postId, Map<String, Object> fields) {
        send(site, request(site, "/posts/" + postId, requestTimeout).header("Content-Type", "application/json")
                .POST(json(fields)).build());
    }

    public void deletePost(Site site, long postId, boolean force) {
        String path = "/posts/" + postId + (force ? "?force=true" : "");
        send(site, request(site, path, requestTimeout).DELETE().build());
    }

    private HttpRequest.Builder request(Site site, String path, Duration timeout) {
        if (!site.hasCredentials()) {
            throw new ConfigurationException("WordPress credentials missing for site " + site.id);
        }
        String baseUrl = site.url.endsWith("/") ? site.url.substring(0, site.url.length() - 1) : site.url;
        String password = site.wpApplicationPassword.replaceAll("\\s", "");
        String credentials = Base64.getEncoder()
                .encodeToString((site.wpUsername + ":" + password).getBytes(StandardCharsets.UTF_8));
        return HttpRequest.newBuilder().uri(URI.create(baseUrl + API_PATH + path)).timeout(timeout)
                .header("Authorization", "Basic " + credentials).header("User-Agent", USER_AGENT)
                .header("Accept", "application/json");
    }

    private JsonNode send(Site site, HttpRequest request) {
        HttpResponse<String> response;
        long started = System.currentTimeMillis();
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new RemoteServiceException("WordPress request to " + site.url + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteServiceException("WordPress request to " + site.url + " interrupted", e);
        }
        LOG.debugf("WordPress %s %s -> %d (%dms)", request.method(), request.uri().getPath(), response.statusCode(),
                System.currentTimeMillis() - started);

        int status = response.statusCode();
        if (status == 429) {
            throw new RateLimitException("WordPress rate limit exceeded for " + site.url);
        }
        if (status < 200 || status >= 300) {
            String body = response.body() == null ? "" : response.body();
            if (body.length() > MAX_ERROR_BODY) {
                body = body.substring(0, MAX_ERROR_BODY);
            }
            throw new RemoteServiceException("WordPress API error " + status + ": " + body, status);
        }
        try {
            return response.body() == null || response.body().isBlank() ? objectMapper.createObjectNode()
                    : objectMapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new RemoteServiceException("WordPress returned an unreadable response from " + site.url, e);
        }
    }

    private HttpRequest.BodyPublisher json(Object payload) {
        try {
            return HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(payload));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize WordPress request", e);
        }
    }

    private static List<WordPressTermType> terms(JsonNode body) {
        List<WordPressTermType> terms = new ArrayList<>();
        if (body.isArray()) {
            for (JsonNode term : body) {
                terms.add(new WordPressTermType(term.path("id").asLong(), term.path("name").asText("")));
            }
        }
        return terms;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
