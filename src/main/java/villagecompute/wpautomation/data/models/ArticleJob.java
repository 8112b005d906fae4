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
import jakarta.persistence.UniqueConstraint;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import villagecompute.wpautomation.api.types.GenerationRequestType.RewriteStyle;
import villagecompute.wpautomation.exceptions.InvalidStateTransitionException;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Panache entity for one unit of automation work: a single article generated from a feed item or a topic, optionally
 * published to the owner's WordPress site.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code id} (UUID, PK) - Primary identifier</li>
 * <li>{@code user_id}, {@code site_id} (UUID) - Owner and target site</li>
 * <li>{@code source_type} (TEXT) - RSS or TOPIC</li>
 * <li>{@code rss_feed_id}, {@code schedule_id} (UUID) - Feed and schedule that seeded the job (RSS only)</li>
 * <li>{@code topic}, {@code source_url}, {@code source_title} (TEXT) - Source reference</li>
 * <li>{@code rewrite_style} (TEXT) - How a hand-picked feed item is rewritten; {@code null} for schedule jobs</li>
 * <li>{@code status} (TEXT) - {@link JobStatus} value</li>
 * <li>{@code generated_*}, {@code categories}, {@code tags}, {@code seo_*} - Pipeline output</li>
 * <li>{@code wp_post_id}, {@code published_at} - Remote post once published</li>
 * <li>{@code error_message} (TEXT) - Verbatim error text when FAILED</li>
 * <li>{@code ai_model}, {@code tokens_used}, {@code ai_cost} - Generation accounting</li>
 * </ul>
 *
 * <p>
 * Feed-sourced jobs are unique per {@code (user_id, rss_feed_id, source_url)} whatever their status, so an item that
 * once failed is never enqueued again by a schedule firing.
 *
 * @see villagecompute.wpautomation.data.stores.ArticleJobStore
 * @see villagecompute.wpautomation.jobs.ArticleJobWorker
 */
@Entity
@Table(
        name = "automation_jobs",
        uniqueConstraints = @UniqueConstraint(
                name = "uq_automation_jobs_feed_source",
                columnNames = {"user_id", "rss_feed_id", "source_url"}))
@NamedQuery(
        name = ArticleJob.QUERY_FIND_BY_FEED_SOURCE,
        query = "FROM ArticleJob WHERE userId = :userId AND rssFeedId = :rssFeedId AND sourceUrl = :sourceUrl")
@NamedQuery(
        name = ArticleJob.QUERY_FIND_PENDING,
        query = "FROM ArticleJob WHERE status = :status ORDER BY createdAt ASC, id ASC")
public class ArticleJob extends PanacheEntityBase {

    public static final String QUERY_FIND_BY_FEED_SOURCE = "ArticleJob.findByFeedSource";
    public static final String QUERY_FIND_PENDING = "ArticleJob.findPending";

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
            name = "source_type",
            nullable = false)
    @Enumerated(EnumType.STRING)
    public SourceType sourceType;

    @Column(
            name = "rss_feed_id")
    public UUID rssFeedId;

    @Column(
            name = "schedule_id")
    public UUID scheduleId;

    @Column(
            name = "topic",
            columnDefinition = "TEXT")
    public String topic;

    @Column(
            name = "source_url",
            length = 2048)
    public String sourceUrl;

    @Column(
            name = "source_title",
            length = 1024)
    public String sourceTitle;

    @Column(
            name = "rewrite_style")
    @Enumerated(EnumType.STRING)
    public RewriteStyle rewriteStyle;

    @Column(
            name = "status",
            nullable = false)
    @Enumerated(EnumType.STRING)
    public JobStatus status;

    @Column(
            name = "generated_title",
            length = 1024)
    public String generatedTitle;

    @Column(
            name = "generated_content",
            columnDefinition = "TEXT")
    public String generatedContent;

    @Column(
            name = "generated_excerpt",
            columnDefinition = "TEXT")
    public String generatedExcerpt;

    @Column(
            name = "categories")
    @JdbcTypeCode(SqlTypes.JSON)
    public List<String> categories;

    @Column(
            name = "tags")
    @JdbcTypeCode(SqlTypes.JSON)
    public List<String> tags;

    @Column(
            name = "seo_description",
            length = 512)
    public String seoDescription;

    @Column(
            name = "seo_keywords")
    @JdbcTypeCode(SqlTypes.JSON)
    public List<String> seoKeywords;

    @Column(
            name = "featured_image_url",
            length = 2048)
    public String featuredImageUrl;

    @Column(
            name = "degraded",
            nullable = false)
    public boolean degraded;

    @Column(
            name = "auto_publish",
            nullable = false)
    public boolean autoPublish;

    @Column(
            name = "publish_status")
    public String publishStatus;

    @Column(
            name = "wp_post_id")
    public Long wpPostId;

    @Column(
            name = "published_at")
    public Instant publishedAt;

    @Column(
            name = "error_message",
            columnDefinition = "TEXT")
    public String errorMessage;

    @Column(
            name = "ai_model")
    public String aiModel;

    @Column(
            name = "tokens_used",
            nullable = false)
    public int tokensUsed;

    @Column(
            name = "ai_cost",
            precision = 12,
            scale = 6)
    public BigDecimal aiCost;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    @Column(
            name = "updated_at",
            nullable = false)
    public Instant updatedAt;

    /**
     * Where the article source came from.
     */
    public enum SourceType {
        /**
         * A feed item discovered by a schedule firing.
         */
        RSS,

        /**
         * Free text supplied directly by the user.
         */
        TOPIC
    }

    /**
     * Job lifecycle statuses. Names are persisted verbatim.
     */
    public enum JobStatus {
        PENDING,
        GENERATING,
        GENERATED,
        PUBLISHING,
        PUBLISHED,
        FAILED;

        /**
         * Returns the statuses reachable from this one.
         *
         * <p>
         * FAILED is reachable from every non-terminal state. FAILED itself only leads back to PENDING, which happens
         * on an explicit user retry.
         */
        public Set<JobStatus> allowedTargets() {
            return switch (this) {
                case PENDING -> EnumSet.of(GENERATING, FAILED);
                case GENERATING -> EnumSet.of(GENERATED, FAILED);
                case GENERATED -> EnumSet.of(PUBLISHING, FAILED);
                case PUBLISHING -> EnumSet.of(PUBLISHED, FAILED);
                case FAILED -> EnumSet.of(PENDING);
                case PUBLISHED -> EnumSet.noneOf(JobStatus.class);
            };
        }

        public boolean canTransitionTo(JobStatus target) {
            return allowedTargets().contains(target);
        }

        /**
         * Whether a worker is actively driving a job in this status.
         */
        public boolean isInFlight() {
            return this == GENERATING || this == PUBLISHING;
        }
    }

    /**
     * Creates an unsaved PENDING job for a feed item.
     */
    public static ArticleJob forFeedItem(UUID userId, UUID siteId, UUID rssFeedId, UUID scheduleId, String sourceUrl,
            String sourceTitle) {
        ArticleJob job = newJob(userId, siteId, SourceType.RSS);
        job.rssFeedId = rssFeedId;
        job.scheduleId = scheduleId;
        job.sourceUrl = sourceUrl;
        job.sourceTitle = sourceTitle;
        return job;
    }

    /**
     * Creates an unsaved PENDING job for a feed item the user picked by hand. Unlike schedule jobs it carries its own
     * rewrite style and publish options.
     */
    public static ArticleJob forSelectedFeedItem(UUID userId, UUID siteId, UUID rssFeedId, String sourceUrl,
            String sourceTitle, RewriteStyle rewriteStyle, boolean autoPublish, String publishStatus) {
        ArticleJob job = forFeedItem(userId, siteId, rssFeedId, null, sourceUrl, sourceTitle);
        job.rewriteStyle = rewriteStyle;
        job.autoPublish = autoPublish;
        job.publishStatus = publishStatus;
        return job;
    }

    /**
     * Creates an unsaved PENDING job for a user-supplied topic.
     */
    public static ArticleJob forTopic(UUID userId, UUID siteId, String topic, boolean autoPublish,
            String publishStatus) {
        ArticleJob job = newJob(userId, siteId, SourceType.TOPIC);
        job.topic = topic;
        job.sourceTitle = topic;
        job.autoPublish = autoPublish;
        job.publishStatus = publishStatus;
        return job;
    }

    private static ArticleJob newJob(UUID userId, UUID siteId, SourceType sourceType) {
        ArticleJob job = new ArticleJob();
        job.userId = userId;
        job.siteId = siteId;
        job.sourceType = sourceType;
        job.status = JobStatus.PENDING;
        job.tokensUsed = 0;
        job.createdAt = Instant.now();
        job.updatedAt = job.createdAt;
        return job;
    }

    /**
     * Moves this job to {@code target}, stamping {@code updatedAt}.
     *
     * @throws InvalidStateTransitionException
     *             if the lifecycle does not allow the change
     */
    public void applyTransition(JobStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new InvalidStateTransitionException(
                    String.format("Job %s cannot move from %s to %s", id, status, target));
        }
        this.status = target;
        this.updatedAt = Instant.now();
    }

    /**
     * Whether the publish decision comes from this job rather than from a schedule: topic jobs and hand-picked feed
     * items.
     */
    public boolean hasOwnPublishOptions() {
        return sourceType == SourceType.TOPIC || (scheduleId == null && rewriteStyle != null);
    }

    /**
     * Text fed to the generation pipeline: the topic for topic jobs, the item title for feed jobs.
     */
    public String generationInput() {
        if (sourceType == SourceType.TOPIC) {
            return topic;
        }
        return sourceTitle != null && !sourceTitle.isBlank() ? sourceTitle : sourceUrl;
    }

    public static Optional<ArticleJob> findByFeedSource(UUID userId, UUID rssFeedId, String sourceUrl) {
        return find("#" + QUERY_FIND_BY_FEED_SOURCE,
                Parameters.with("userId", userId).and("rssFeedId", rssFeedId).and("sourceUrl", sourceUrl))
                .firstResultOptional();
    }

    public static Optional<ArticleJob> findOldestPending() {
        return find("#" + QUERY_FIND_PENDING, Parameters.with("status", JobStatus.PENDING)).firstResultOptional();
    }
}
