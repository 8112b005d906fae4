package villagecompute.wpautomation.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Panache entity for a ready-made post queued for publication at a fixed time.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code scheduled_for} (TIMESTAMPTZ) - UTC instant of the local time the user picked in {@code timezone}</li>
 * <li>{@code categories}, {@code tags} (JSON) - WordPress term ids, sent as-is</li>
 * <li>{@code featured_media_id} (BIGINT) - media library id, {@code null} for none</li>
 * <li>{@code attempts}, {@code last_error} - Publish attempts since the last reschedule</li>
 * <li>{@code wp_post_id}, {@code published_at} - Set once the post is live</li>
 * </ul>
 *
 * @see villagecompute.wpautomation.services.ScheduledPostService
 */
@Entity
@Table(
        name = "scheduled_posts",
        indexes = @Index(
                name = "idx_scheduled_posts_due",
                columnList = "status, scheduled_for"))
public class ScheduledPost extends PanacheEntityBase {

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
            nullable = false,
            length = 500)
    public String title;

    @Column(
            nullable = false,
            columnDefinition = "TEXT")
    public String content;

    @Column(
            columnDefinition = "TEXT")
    public String excerpt;

    @Column(
            name = "categories")
    @JdbcTypeCode(SqlTypes.JSON)
    public List<Long> categoryIds;

    @Column(
            name = "tags")
    @JdbcTypeCode(SqlTypes.JSON)
    public List<Long> tagIds;

    @Column(
            name = "featured_media_id")
    public Long featuredMediaId;

    @Column(
            name = "scheduled_for",
            nullable = false)
    public Instant scheduledFor;

    @Column(
            nullable = false,
            length = 64)
    public String timezone;

    @Column(
            nullable = false)
    @Enumerated(EnumType.STRING)
    public PostStatus status;

    @Column(
            nullable = false)
    public int attempts;

    @Column(
            name = "last_error",
            columnDefinition = "TEXT")
    public String lastError;

    @Column(
            name = "wp_post_id")
    public Long wpPostId;

    @Column(
            name = "published_at")
    public Instant publishedAt;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    @Column(
            name = "updated_at",
            nullable = false)
    public Instant updatedAt;

    /**
     * PENDING posts are due once {@code scheduledFor} has passed. PUBLISHING marks a claimed post; PUBLISHED is final.
     */
    public enum PostStatus {
        PENDING,
        PUBLISHING,
        PUBLISHED,
        FAILED,
        CANCELLED
    }
}
