package villagecompute.wpautomation.integration.images;

import java.util.List;

import villagecompute.wpautomation.api.types.ImageCandidateType;
import villagecompute.wpautomation.api.types.ImageSearchQueryType;

/**
 * A stock or web image search backend.
 */
public interface ImageSearchProvider {

    /**
     * Provider key ("pexels", "unsplash", "openverse", "serper").
     */
    String name();

    /**
     * Whether the provider has what it needs (API key or explicit opt-in) to be queried.
     */
    boolean isEnabled();

    /**
     * Runs one search.
     *
     * @throws villagecompute.wpautomation.exceptions.RemoteServiceException
     *             if the provider rejects the request or cannot be reached
     */
    List<ImageCandidateType> search(ImageSearchQueryType query);
}
