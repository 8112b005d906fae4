package villagecompute.wpautomation.api.types;

/**
 * Result of probing a feed URL before it is saved.
 *
 * @param valid
 *            whether the URL returned a parseable feed
 * @param title
 *            feed title when valid
 * @param itemCount
 *            number of items when valid
 * @param error
 *            reason when not valid
 */
public record FeedValidationType(boolean valid, String title, int itemCount, String error) {

    public static FeedValidationType valid(String title, int itemCount) {
        return new FeedValidationType(true, title, itemCount, null);
    }

    public static FeedValidationType invalid(String error) {
        return new FeedValidationType(false, null, 0, error);
    }
}
