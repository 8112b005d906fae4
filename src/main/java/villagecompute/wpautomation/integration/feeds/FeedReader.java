package villagecompute.wpautomation.integration.feeds;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import com.rometools.rome.feed.synd.SyndCategory;
import com.rometools.rome.feed.synd.SyndContent;
import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.io.FeedException;
import com.rometools.rome.io.SyndFeedInput;
import com.rometools.rome.io.XmlReader;

import jakarta.enterprise.context.ApplicationScoped;

import org.jboss.logging.Logger;
import org.jsoup.Jsoup;

import villagecompute.wpautomation.api.types.FeedItemType;
import villagecompute.wpautomation.api.types.FeedType;
import villagecompute.wpautomation.api.types.FeedValidationType;
import villagecompute.wpautomation.exceptions.FeedReadException;

/**
 * Fetches RSS and Atom feeds and normalizes them into {@link FeedType}.
 *
 * <p>
 * <b>Fetch:</b> HTTP GET with a 15 second request timeout, redirects followed, and a fixed {@code User-Agent} so feed
 * hosts can identify the reader. Any non-2xx status, transport error or unparseable document raises
 * {@link FeedReadException}.
 *
 * <p>
 * <b>Normalization (per item):</b>
 * <ul>
 * <li>title defaults to "Untitled"</li>
 * <li>link falls back to the guid when that is an absolute http(s) URL</li>
 * <li>description has HTML stripped and is capped at {@value #MAX_DESCRIPTION_LENGTH} characters</li>
 * <li>content prefers {@code content:encoded} / Atom content, then the raw description</li>
 * <li>publishedAt falls back to the updated date, then {@code null}</li>
 * </ul>
 * Items keep document order; the reader holds no state between calls.
 */
@ApplicationScoped
public class FeedReader {

    private static final Logger LOG = Logger.getLogger(FeedReader.class);

    public static final String USER_AGENT = "WordPress-Manager/1.0 RSS Reader";
    static final int MAX_DESCRIPTION_LENGTH = 500;
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(15);
    private static final String ACCEPT = "application/rss+xml, application/atom+xml, application/xml, text/xml";

    private final HttpClient httpClient;

    public FeedReader() {
        this.httpClient = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5))
                .followRedirects(HttpClient.Redirect.NORMAL).build();
    }

    /**
     * Fetches and parses the feed at {@code feedUrl}.
     *
     * @throws FeedReadException
     *             if the feed cannot be fetched or parsed
     */
    public FeedType read(String feedUrl) {
        URI uri;
        try {
            uri = URI.create(feedUrl);
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new FeedReadException("Invalid feed URL: " + feedUrl, e);
        }

        HttpRequest request = HttpRequest.newBuilder().uri(uri).timeout(REQUEST_TIMEOUT)
                .header("User-Agent", USER_AGENT).header("Accept", ACCEPT).GET().build();

        LOG.debugf("Fetching feed %s", feedUrl);
        HttpResponse<InputStream> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
        } catch (IOException e) {
            throw new FeedReadException("Failed to fetch feed " + feedUrl + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FeedReadException("Interrupted while fetching feed " + feedUrl, e);
        }

        try (InputStream body = response.body()) {
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                throw new FeedReadException(String.format("HTTP %d: %s", response.statusCode(), feedUrl));
            }
            FeedType feed = parse(body);
            LOG.debugf("Parsed %d items from %s", feed.items().size(), feedUrl);
            return feed;
        } catch (IOException e) {
            throw new FeedReadException("Failed to read feed " + feedUrl + ": " + e.getMessage(), e);
        }
    }

    /**
     * Parses an RSS or Atom document.
     *
     * @throws FeedReadException
     *             if the document is not a feed
     */
    public FeedType parse(InputStream document) {
        SyndFeed feed;
        try {
            feed = new SyndFeedInput().build(new XmlReader(document));
        } catch (FeedException | IOException | IllegalArgumentException e) {
            throw new FeedReadException("Failed to parse feed: " + e.getMessage(), e);
        }

        List<FeedItemType> items = new ArrayList<>();
        for (SyndEntry entry : feed.getEntries()) {
            items.add(toItem(entry));
        }
        return new FeedType(blankToNull(feed.getTitle()), blankToNull(feed.getDescription()),
                blankToNull(feed.getLink()), blankToNull(feed.getLanguage()), toInstant(feed.getPublishedDate()),
                items);
    }

    /**
     * Finds the item of {@code feedUrl} whose link or guid equals {@code articleUrl}.
     */
    public Optional<FeedItemType> findItem(String feedUrl, String articleUrl) {
        return read(feedUrl).items().stream()
                .filter(item -> Objects.equals(item.link(), articleUrl) || Objects.equals(item.guid(), articleUrl))
                .findFirst();
    }

    /**
     * Checks {@code feedUrl} without throwing.
     */
    public FeedValidationType validate(String feedUrl) {
        try {
            FeedType feed = read(feedUrl);
            return FeedValidationType.valid(feed.title(), feed.items().size());
        } catch (FeedReadException e) {
            LOG.debugf("Feed validation failed for %s: %s", feedUrl, e.getMessage());
            return FeedValidationType.invalid(e.getMessage());
        }
    }

    private FeedItemType toItem(SyndEntry entry) {
        String title = blankToNull(entry.getTitle());
        String guid = blankToNull(entry.getUri());
        String link = blankToNull(entry.getLink());
        if (link == null && guid != null && (guid.startsWith("http://") || guid.startsWith("https://"))) {
            link = guid;
        }

        String rawDescription = entry.getDescription() != null ? blankToNull(entry.getDescription().getValue())
                : null;
        String content = extractContent(entry);

        List<String> categories = new ArrayList<>();
        for (SyndCategory category : entry.getCategories()) {
            if (category.getName() != null && !category.getName().isBlank()) {
                categories.add(category.getName().trim());
            }
        }

        Instant publishedAt = toInstant(entry.getPublishedDate());
        if (publishedAt == null) {
            publishedAt = toInstant(entry.getUpdatedDate());
        }

        return new FeedItemType(title != null ? title : "Untitled", link, publishedAt, stripHtml(rawDescription),
                content != null ? content : rawDescription, blankToNull(entry.getAuthor()), categories,
                guid != null ? guid : link);
    }

    private String extractContent(SyndEntry entry) {
        for (SyndContent syndContent : entry.getContents()) {
            String value = blankToNull(syndContent.getValue());
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    static String stripHtml(String html) {
        if (html == null) {
            return null;
        }
        String text = Jsoup.parse(html).text().replaceAll("\\s+", " ").trim();
        return text.length() > MAX_DESCRIPTION_LENGTH ? text.substring(0, MAX_DESCRIPTION_LENGTH) : text;
    }

    private static Instant toInstant(Date date) {
        return date == null ? null : date.toInstant();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
