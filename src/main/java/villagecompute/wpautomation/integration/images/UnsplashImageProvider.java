package villagecompute.wpautomation.integration.images;

import java.net.URI;
import java.net.http.HttpRequest;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.config.inject.ConfigProperty;

import villagecompute.wpautomation.api.types.ImageCandidateType;
import villagecompute.wpautomation.api.types.ImageSearchQueryType;

/**
 * Unsplash photo search ({@code GET /search/photos}, {@code Client-ID} authorization).
 */
@ApplicationScoped
public class UnsplashImageProvider extends AbstractImageProvider {

    public static final String NAME = "unsplash";

    private final String accessKey;

    @Inject
    public UnsplashImageProvider(ObjectMapper objectMapper,
            @ConfigProperty(
                    name = "images.unsplash.access-key") Optional<String> accessKey,
            @ConfigProperty(
                    name = "images.unsplash.base-url",
                    defaultValue = "https://api.unsplash.com") String baseUrl,
            @ConfigProperty(
                    name = "images.timeout-seconds",
                    defaultValue = "30") int timeoutSeconds) {
        super(objectMapper, baseUrl, timeoutSeconds);
        this.accessKey = accessKey.filter(key -> !key.isBlank()).orElse(null);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isEnabled() {
        return accessKey != null;
    }

    @Override
    public List<ImageCandidateType> search(ImageSearchQueryType query) {
        StringBuilder url = new StringBuilder(baseUrl).append("/search/photos?query=").append(encode(query.query()))
                .append("&page=").append(query.page()).append("&per_page=").append(query.perPage());
        if (query.orientation() != null) {
            // Unsplash calls square "squarish"
            String orientation = "square".equals(query.orientation()) ? "squarish" : query.orientation();
            url.append("&orientation=").append(encode(orientation));
        }
        if (query.color() != null) {
            url.append("&color=").append(encode(query.color()));
        }

        HttpRequest request = HttpRequest.newBuilder().uri(URI.create(url.toString())).timeout(timeout)
                .header("Authorization", "Client-ID " + accessKey).header("Accept-Version", "v1").GET().build();
        JsonNode body = send(request);

        List<ImageCandidateType> results = new ArrayList<>();
        for (JsonNode photo : body.path("results")) {
            String description = text(photo, "description");
            String title = firstNonNull(description, text(photo, "alt_description"), "Unsplash photo");
            results.add(new ImageCandidateType(text(photo.path("urls"), "regular"), text(photo.path("urls"), "thumb"),
                    photo.path("width").asInt(), photo.path("height").asInt(), text(photo.path("user"), "name"),
                    "Unsplash License", title, description, NAME));
        }
        return results;
    }
}
