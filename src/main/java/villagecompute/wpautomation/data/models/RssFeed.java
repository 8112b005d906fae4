package villagecompute.wpautomation.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.UUID;

/**
 * A syndication feed registered by a user as an automation source.
 *
 * <p>
 * {@code lastFetchedAt} and {@code lastError} are stamped by the schedule dispatcher after each read so the dashboard
 * can show feed health.
 */
@Entity
@Table(
        name = "rss_feeds")
public class RssFeed extends PanacheEntityBase {

    @Id
    @GeneratedValue
    public UUID id;

    @Column(
            name = "user_id",
            nullable = false)
    public UUID userId;

    @Column(
            nullable = false)
    public String name;

    @Column(
            nullable = false,
            length = 2048)
    public String url;

    @Column(
            name = "is_active",
            nullable = false)
    public boolean isActive = true;

    @Column(
            name = "last_fetched_at")
    public Instant lastFetchedAt;

    @Column(
            name = "last_error",
            columnDefinition = "TEXT")
    public String lastError;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    @Column(
            name = "updated_at",
            nullable = false)
    public Instant updatedAt;
}
