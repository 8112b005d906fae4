package villagecompute.wpautomation.api.types;

import java.time.Instant;
import java.util.List;

/**
 * A parsed syndication feed with its items in document order.
 */
public record FeedType(String title, String description, String link, String language, Instant lastBuildDate,
        List<FeedItemType> items) {
}
