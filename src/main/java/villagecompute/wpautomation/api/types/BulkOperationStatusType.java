package villagecompute.wpautomation.api.types;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import villagecompute.wpautomation.data.models.BulkOperation.BulkAction;
import villagecompute.wpautomation.data.models.BulkOperation.OperationStatus;

/**
 * Progress view of a bulk operation with its per-item errors decoded.
 */
public record BulkOperationStatusType(UUID id, BulkAction action, OperationStatus status, int totalItems,
        int processedItems, int successCount, int failureCount, List<BulkItemErrorType> errors, Instant createdAt,
        Instant startedAt, Instant completedAt) {

    /**
     * Percentage of targets processed, 0-100.
     */
    public int progressPercent() {
        return totalItems == 0 ? 0 : (int) Math.round((double) processedItems / totalItems * 100);
    }
}
