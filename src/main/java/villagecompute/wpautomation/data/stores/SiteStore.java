package villagecompute.wpautomation.data.stores;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import villagecompute.wpautomation.data.models.RssFeed;
import villagecompute.wpautomation.data.models.Site;

/**
 * Read access to the sites and feeds managed by the dashboard.
 */
public interface SiteStore {

    Optional<Site> findSite(UUID siteId);

    Optional<RssFeed> findFeed(UUID feedId);

    /**
     * Stamps the outcome of a feed read; {@code error} is {@code null} on success.
     */
    void recordFeedFetch(UUID feedId, Instant fetchedAt, String error);
}
