package villagecompute.wpautomation.testing;

import java.time.Instant;
import java.util.UUID;

import villagecompute.wpautomation.data.models.AutomationSchedule;
import villagecompute.wpautomation.data.models.AutomationSchedule.ScheduleType;
import villagecompute.wpautomation.data.models.RssFeed;
import villagecompute.wpautomation.data.models.Site;

/**
 * Factory methods for unsaved test entities.
 *
 * <p>
 * Unit tests put the results into the in-memory stores; {@code @QuarkusTest} classes persist them inside a
 * transaction.
 */
public final class TestFixtures {

    public static final String SITE_URL = "https://blog.example.com";
    public static final String WP_USERNAME = "editor";
    public static final String WP_APPLICATION_PASSWORD = "abcd efgh ijkl mnop";

    private TestFixtures() {
    }

    public static Site site(UUID userId) {
        return site(userId, SITE_URL);
    }

    public static Site site(UUID userId, String url) {
        Site site = new Site();
        site.id = UUID.randomUUID();
        site.userId = userId;
        site.name = "Example Blog";
        site.url = url;
        site.wpUsername = WP_USERNAME;
        site.wpApplicationPassword = WP_APPLICATION_PASSWORD;
        site.createdAt = Instant.now();
        site.updatedAt = site.createdAt;
        return site;
    }

    public static RssFeed feed(UUID userId, String url) {
        RssFeed feed = new RssFeed();
        feed.id = UUID.randomUUID();
        feed.userId = userId;
        feed.name = "Example Feed";
        feed.url = url;
        feed.isActive = true;
        feed.createdAt = Instant.now();
        feed.updatedAt = feed.createdAt;
        return feed;
    }

    /**
     * An active hourly schedule reading {@code feed} into {@code site}.
     */
    public static AutomationSchedule schedule(Site site, RssFeed feed) {
        AutomationSchedule schedule = new AutomationSchedule();
        schedule.id = UUID.randomUUID();
        schedule.userId = site.userId;
        schedule.siteId = site.id;
        schedule.rssFeedId = feed != null ? feed.id : null;
        schedule.name = "Hourly digest";
        schedule.scheduleType = ScheduleType.HOURLY;
        schedule.cronExpression = ScheduleType.HOURLY.getCanonicalExpression();
        schedule.timezone = "UTC";
        schedule.isActive = true;
        schedule.createdAt = Instant.now();
        schedule.updatedAt = schedule.createdAt;
        return schedule;
    }
}
