package villagecompute.wpautomation.api.types;

/**
 * One image returned by a search provider.
 */
public record ImageCandidateType(String url, String thumbnailUrl, int width, int height, String photographer,
        String license, String title, String description, String provider) {

    /**
     * Alt text for the image: title, then description, then a generic label.
     */
    public String altText() {
        if (title != null && !title.isBlank()) {
            return title;
        }
        if (description != null && !description.isBlank()) {
            return description;
        }
        return "Article image";
    }
}
