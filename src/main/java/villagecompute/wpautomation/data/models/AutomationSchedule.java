package villagecompute.wpautomation.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import io.quarkus.panache.common.Parameters;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.NamedQuery;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Panache entity for a user-defined automation policy: when to read a feed, how many items to take, and whether the
 * resulting articles are published automatically.
 *
 * <p>
 * Exactly one trigger representation is in effect: {@link ScheduleType#ONCE} uses {@code scheduledFor}, the named
 * intervals resolve to a canonical cron expression, and {@link ScheduleType#CUSTOM} carries {@code cronExpression}.
 *
 * <p>
 * Counters ({@code totalRuns}, {@code successfulRuns}, {@code failedRuns}) and {@code lastRunAt}/{@code nextRunAt} are
 * only written by the dispatcher after a firing.
 */
@Entity
@Table(
        name = "automation_schedules")
@NamedQuery(
        name = AutomationSchedule.QUERY_FIND_ACTIVE,
        query = "FROM AutomationSchedule WHERE isActive = true ORDER BY createdAt ASC")
@NamedQuery(
        name = AutomationSchedule.QUERY_FIND_BY_USER,
        query = "FROM AutomationSchedule WHERE userId = :userId ORDER BY createdAt DESC")
@NamedQuery(
        name = AutomationSchedule.QUERY_FIND_ACTIVE_FOR_FEED,
        query = "FROM AutomationSchedule WHERE userId = :userId AND rssFeedId = :rssFeedId AND isActive = true "
                + "ORDER BY createdAt ASC")
public class AutomationSchedule extends PanacheEntityBase {

    public static final String QUERY_FIND_ACTIVE = "AutomationSchedule.findActive";
    public static final String QUERY_FIND_BY_USER = "AutomationSchedule.findByUser";
    public static final String QUERY_FIND_ACTIVE_FOR_FEED = "AutomationSchedule.findActiveForFeed";

    public static final int DEFAULT_MAX_ARTICLES = 20;
    public static final String PUBLISH_STATUS_DRAFT = "draft";
    public static final String PUBLISH_STATUS_PUBLISH = "publish";

    @Id
    @GeneratedValue
    public UUID id;

    @Column(
            name = "user_id",
            nullable = false)
    public UUID userId;

    @Column(
            name = "site_id",
            nullable = false)
    public UUID siteId;

    @Column(
            name = "rss_feed_id")
    public UUID rssFeedId;

    @Column(
            nullable = false)
    public String name;

    @Column(
            columnDefinition = "TEXT")
    public String description;

    @Column(
            name = "schedule_type",
            nullable = false)
    @Enumerated(EnumType.STRING)
    public ScheduleType scheduleType;

    @Column(
            name = "cron_expression")
    public String cronExpression;

    @Column(
            nullable = false)
    public String timezone;

    @Column(
            name = "scheduled_for")
    public Instant scheduledFor;

    @Column(
            name = "auto_publish",
            nullable = false)
    public boolean autoPublish;

    @Column(
            name = "publish_status",
            nullable = false)
    public String publishStatus = PUBLISH_STATUS_DRAFT;

    @Column(
            name = "max_articles")
    public Integer maxArticles;

    @Column(
            name = "is_active",
            nullable = false)
    public boolean isActive = true;

    @Column(
            name = "last_run_at")
    public Instant lastRunAt;

    @Column(
            name = "next_run_at")
    public Instant nextRunAt;

    @Column(
            name = "total_runs",
            nullable = false)
    public int totalRuns;

    @Column(
            name = "successful_runs",
            nullable = false)
    public int successfulRuns;

    @Column(
            name = "failed_runs",
            nullable = false)
    public int failedRuns;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    @Column(
            name = "updated_at",
            nullable = false)
    public Instant updatedAt;

    /**
     * Trigger kinds. Named intervals carry their canonical 5-field cron expression.
     */
    public enum ScheduleType {
        ONCE(null),
        EVERY_5_MIN("*/5 * * * *"),
        EVERY_10_MIN("*/10 * * * *"),
        EVERY_30_MIN("*/30 * * * *"),
        HOURLY("0 * * * *"),
        EVERY_2_HOURS("0 */2 * * *"),
        EVERY_6_HOURS("0 */6 * * *"),
        EVERY_12_HOURS("0 */12 * * *"),
        DAILY("0 8 * * *"),
        WEEKLY("0 8 * * 1"),
        CUSTOM(null);

        private final String canonicalExpression;

        ScheduleType(String canonicalExpression) {
            this.canonicalExpression = canonicalExpression;
        }

        /**
         * Returns the fixed cron expression for named intervals, or {@code null} for ONCE and CUSTOM.
         */
        public String getCanonicalExpression() {
            return canonicalExpression;
        }
    }

    /**
     * Items taken per firing, defaulting to {@value #DEFAULT_MAX_ARTICLES} when unset or non-positive.
     */
    public int effectiveMaxArticles() {
        return maxArticles == null || maxArticles <= 0 ? DEFAULT_MAX_ARTICLES : maxArticles;
    }

    /**
     * Success rate in whole percent, 0 when the schedule has never run.
     */
    public long successRate() {
        return totalRuns == 0 ? 0 : Math.round((double) successfulRuns / totalRuns * 100);
    }

    public static List<AutomationSchedule> findActive() {
        return find("#" + QUERY_FIND_ACTIVE).list();
    }

    public static List<AutomationSchedule> findByUser(UUID userId) {
        return find("#" + QUERY_FIND_BY_USER, Parameters.with("userId", userId)).list();
    }

    public static Optional<AutomationSchedule> findActiveForFeed(UUID userId, UUID rssFeedId) {
        return find("#" + QUERY_FIND_ACTIVE_FOR_FEED, Parameters.with("userId", userId).and("rssFeedId", rssFeedId))
                .firstResultOptional();
    }
}
