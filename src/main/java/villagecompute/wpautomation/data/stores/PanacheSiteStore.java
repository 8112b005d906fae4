package villagecompute.wpautomation.data.stores;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import io.quarkus.narayana.jta.QuarkusTransaction;

import jakarta.enterprise.context.ApplicationScoped;

import villagecompute.wpautomation.data.models.RssFeed;
import villagecompute.wpautomation.data.models.Site;

/**
 * {@link SiteStore} backed by {@code wordpress_sites} and {@code rss_feeds}.
 */
@ApplicationScoped
public class PanacheSiteStore implements SiteStore {

    @Override
    public Optional<Site> findSite(UUID siteId) {
        return QuarkusTransaction.requiringNew().call(() -> Site.<Site>findByIdOptional(siteId));
    }

    @Override
    public Optional<RssFeed> findFeed(UUID feedId) {
        return QuarkusTransaction.requiringNew().call(() -> RssFeed.<RssFeed>findByIdOptional(feedId));
    }

    @Override
    public void recordFeedFetch(UUID feedId, Instant fetchedAt, String error) {
        QuarkusTransaction.requiringNew().run(() -> {
            RssFeed feed = RssFeed.findById(feedId);
            if (feed != null) {
                feed.lastFetchedAt = fetchedAt;
                feed.lastError = error;
                feed.updatedAt = Instant.now();
                feed.persist();
            }
        });
    }
}
