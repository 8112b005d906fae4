package villagecompute.wpautomation.integration.images;

import java.net.URI;
import java.net.http.HttpRequest;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.config.inject.ConfigProperty;

import villagecompute.wpautomation.api.types.ImageCandidateType;
import villagecompute.wpautomation.api.types.ImageSearchQueryType;

/**
 * Openverse Creative Commons search ({@code GET /images/}). Keyless, so it must be switched on explicitly.
 */
@ApplicationScoped
public class OpenverseImageProvider extends AbstractImageProvider {

    public static final String NAME = "openverse";

    private final boolean enabled;

    @Inject
    public OpenverseImageProvider(ObjectMapper objectMapper,
            @ConfigProperty(
                    name = "images.openverse.enabled",
                    defaultValue = "false") boolean enabled,
            @ConfigProperty(
                    name = "images.openverse.base-url",
                    defaultValue = "https://api.openverse.org/v1") String baseUrl,
            @ConfigProperty(
                    name = "images.timeout-seconds",
                    defaultValue = "30") int timeoutSeconds) {
        super(objectMapper, baseUrl, timeoutSeconds);
        this.enabled = enabled;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public List<ImageCandidateType> search(ImageSearchQueryType query) {
        String url = baseUrl + "/images/?q=" + encode(query.query()) + "&page=" + query.page() + "&page_size="
                + query.perPage();
        HttpRequest request = HttpRequest.newBuilder().uri(URI.create(url)).timeout(timeout).GET().build();
        JsonNode body = send(request);

        List<ImageCandidateType> results = new ArrayList<>();
        for (JsonNode image : body.path("results")) {
            String imageUrl = text(image, "url");
            results.add(new ImageCandidateType(imageUrl, firstNonNull(text(image, "thumbnail"), imageUrl),
                    image.path("width").asInt(0), image.path("height").asInt(0),
                    firstNonNull(text(image, "creator"), "Unknown"), firstNonNull(text(image, "license"), "Unknown"),
                    firstNonNull(text(image, "title"), "Openverse image"), text(image, "description"), NAME));
        }
        return results;
    }
}
