package villagecompute.wpautomation.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.UUID;

/**
 * Panache entity for one batch action applied to many WordPress posts.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code target_ids} (TEXT) - JSON array of remote post ids, in processing order</li>
 * <li>{@code payload} (TEXT) - JSON of the action payload, tagged with {@code type}</li>
 * <li>{@code errors} (TEXT) - JSON array of per-item errors, {@code null} when none</li>
 * <li>{@code total_items}, {@code processed_items}, {@code success_count}, {@code failure_count} - Progress</li>
 * </ul>
 *
 * <p>
 * Once processing has started, {@code processedItems == successCount + failureCount} and
 * {@code processedItems <= totalItems} hold at every persisted point. COMPLETED and FAILED are final.
 *
 * @see villagecompute.wpautomation.services.BulkOperationService
 */
@Entity
@Table(
        name = "bulk_operations")
public class BulkOperation extends PanacheEntityBase {

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
            name = "target_type",
            nullable = false)
    @Enumerated(EnumType.STRING)
    public TargetType targetType;

    @Column(
            nullable = false)
    @Enumerated(EnumType.STRING)
    public BulkAction action;

    @Column(
            name = "target_ids",
            nullable = false,
            columnDefinition = "TEXT")
    public String targetIdsJson;

    @Column(
            name = "payload",
            columnDefinition = "TEXT")
    public String payloadJson;

    @Column(
            nullable = false)
    @Enumerated(EnumType.STRING)
    public OperationStatus status;

    @Column(
            name = "total_items",
            nullable = false)
    public int totalItems;

    @Column(
            name = "processed_items",
            nullable = false)
    public int processedItems;

    @Column(
            name = "success_count",
            nullable = false)
    public int successCount;

    @Column(
            name = "failure_count",
            nullable = false)
    public int failureCount;

    @Column(
            name = "errors",
            columnDefinition = "TEXT")
    public String errorsJson;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    @Column(
            name = "started_at")
    public Instant startedAt;

    @Column(
            name = "completed_at")
    public Instant completedAt;

    @Column(
            name = "updated_at",
            nullable = false)
    public Instant updatedAt;

    public enum TargetType {
        POST
    }

    /**
     * Batch actions. Each maps to exactly one remote call per target id.
     */
    public enum BulkAction {
        PUBLISH,
        UNPUBLISH,
        DELETE,
        UPDATE_METADATA
    }

    public enum OperationStatus {
        PENDING,
        PROCESSING,
        COMPLETED,
        FAILED;

        public boolean isFinal() {
            return this == COMPLETED || this == FAILED;
        }
    }
}
