package villagecompute.wpautomation.api.types;

import java.time.Instant;
import java.util.List;

/**
 * One normalized entry of an RSS or Atom feed.
 *
 * @param title
 *            item title ("Untitled" when the feed omits it)
 * @param link
 *            canonical article URL, used as the dedup key for feed-sourced jobs
 * @param publishedAt
 *            published or updated date, {@code null} when the feed has neither
 * @param description
 *            plain-text summary, HTML stripped, at most 500 characters
 * @param content
 *            full body ({@code content:encoded} or Atom content), falling back to the raw description
 * @param author
 *            author name when present
 * @param categories
 *            category names in feed order
 * @param guid
 *            guid or Atom id, falling back to the link
 */
public record FeedItemType(String title, String link, Instant publishedAt, String description, String content,
        String author, List<String> categories, String guid) {
}
