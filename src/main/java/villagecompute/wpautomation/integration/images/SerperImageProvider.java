package villagecompute.wpautomation.integration.images;

import java.net.URI;
import java.net.http.HttpRequest;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.config.inject.ConfigProperty;

import villagecompute.wpautomation.api.types.ImageCandidateType;
import villagecompute.wpautomation.api.types.ImageSearchQueryType;

/**
 * Google Images through serper.dev ({@code POST /images}, {@code X-API-KEY}).
 *
 * <p>
 * Results come from arbitrary sites, so the license is reported as "check source".
 */
@ApplicationScoped
public class SerperImageProvider extends AbstractImageProvider {

    public static final String NAME = "serper";

    private final String apiKey;

    @Inject
    public SerperImageProvider(ObjectMapper objectMapper,
            @ConfigProperty(
                    name = "images.serper.api-key") Optional<String> apiKey,
            @ConfigProperty(
                    name = "images.serper.base-url",
                    defaultValue = "https://google.serper.dev") String baseUrl,
            @ConfigProperty(
                    name = "images.timeout-seconds",
                    defaultValue = "30") int timeoutSeconds) {
        super(objectMapper, baseUrl, timeoutSeconds);
        this.apiKey = apiKey.filter(key -> !key.isBlank()).orElse(null);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isEnabled() {
        return apiKey != null;
    }

    @Override
    public List<ImageCandidateType> search(ImageSearchQueryType query) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("q", query.query());
        payload.put("num", query.perPage());
        payload.put("start", (Math.max(query.page(), 1) - 1) * query.perPage());

        String json;
        try {
            json = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize Serper request", e);
        }

        HttpRequest request = HttpRequest.newBuilder().uri(URI.create(baseUrl + "/images")).timeout(timeout)
                .header("X-API-KEY", apiKey).header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json)).build();
        JsonNode body = send(request);

        List<ImageCandidateType> results = new ArrayList<>();
        for (JsonNode image : body.path("images")) {
            String imageUrl = text(image, "imageUrl");
            results.add(new ImageCandidateType(imageUrl, firstNonNull(text(image, "thumbnailUrl"), imageUrl),
                    image.path("imageWidth").asInt(0), image.path("imageHeight").asInt(0),
                    firstNonNull(text(image, "source"), "Unknown"), "Various (check source)",
                    firstNonNull(text(image, "title"), "Google Image"), text(image, "snippet"), NAME));
        }
        return results;
    }
}
