package villagecompute.wpautomation.api.types;

/**
 * Query sent to each image-search provider.
 *
 * @param query
 *            search phrase
 * @param page
 *            1-based page
 * @param perPage
 *            results per page
 * @param orientation
 *            optional orientation filter (landscape, portrait, square)
 * @param color
 *            optional dominant color filter
 */
public record ImageSearchQueryType(String query, int page, int perPage, String orientation, String color) {

    public static ImageSearchQueryType of(String query, int page, int perPage) {
        return new ImageSearchQueryType(query, page, perPage, null, null);
    }
}
