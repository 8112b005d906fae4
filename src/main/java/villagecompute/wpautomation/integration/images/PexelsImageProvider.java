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
 * Pexels photo search ({@code GET /search}, raw key in {@code Authorization}).
 */
@ApplicationScoped
public class PexelsImageProvider extends AbstractImageProvider {

    public static final String NAME = "pexels";

    private final String apiKey;

    @Inject
    public PexelsImageProvider(ObjectMapper objectMapper,
            @ConfigProperty(
                    name = "images.pexels.api-key") Optional<String> apiKey,
            @ConfigProperty(
                    name = "images.pexels.base-url",
                    defaultValue = "https://api.pexels.com/v1") String baseUrl,
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
        StringBuilder url = new StringBuilder(baseUrl).append("/search?query=").append(encode(query.query()))
                .append("&page=").append(query.page()).append("&per_page=").append(query.perPage());
        if (query.orientation() != null) {
            url.append("&orientation=").append(encode(query.orientation()));
        }
        if (query.color() != null) {
            url.append("&color=").append(encode(query.color()));
        }

        HttpRequest request = HttpRequest.newBuilder().uri(URI.create(url.toString())).timeout(timeout)
                .header("Authorization", apiKey).GET().build();
        JsonNode body = send(request);

        List<ImageCandidateType> results = new ArrayList<>();
        for (JsonNode photo : body.path("photos")) {
            String alt = text(photo, "alt");
            results.add(new ImageCandidateType(text(photo.path("src"), "original"), text(photo.path("src"), "medium"),
                    photo.path("width").asInt(), photo.path("height").asInt(), text(photo, "photographer"),
                    "Pexels License", alt, alt, NAME));
        }
        return results;
    }
}
