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
 * History row written once per schedule firing.
 */
@Entity
@Table(
        name = "automation_executions")
public class AutomationExecution extends PanacheEntityBase {

    @Id
    @GeneratedValue
    public UUID id;

    @Column(
            name = "schedule_id",
            nullable = false)
    public UUID scheduleId;

    @Column(
            name = "user_id",
            nullable = false)
    public UUID userId;

    @Column(
            name = "started_at",
            nullable = false)
    public Instant startedAt;

    @Column(
            name = "completed_at")
    public Instant completedAt;

    @Column(
            nullable = false)
    @Enumerated(EnumType.STRING)
    public ExecutionStatus status;

    @Column(
            name = "items_found",
            nullable = false)
    public int itemsFound;

    @Column(
            name = "jobs_created",
            nullable = false)
    public int jobsCreated;

    @Column(
            name = "duplicates_skipped",
            nullable = false)
    public int duplicatesSkipped;

    @Column(
            name = "items_failed",
            nullable = false)
    public int itemsFailed;

    @Column(
            name = "error_message",
            columnDefinition = "TEXT")
    public String errorMessage;

    public enum ExecutionStatus {
        SUCCESS,
        FAILED
    }
}
