package villagecompute.wpautomation.api.types;

/**
 * Remote post created by the publish adapter.
 *
 * @param postId
 *            WordPress post id
 * @param link
 *            public permalink
 * @param featuredMediaId
 *            uploaded media id, {@code null} when no featured image was attached
 */
public record PublishResultType(long postId, String link, Long featuredMediaId) {
}
