package villagecompute.wpautomation.data.stores;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

import villagecompute.wpautomation.data.models.BulkOperation;
import villagecompute.wpautomation.data.models.BulkOperation.OperationStatus;

/**
 * Persistence for bulk operations. Only the bulk engine's worker calls {@link #update}.
 */
public interface BulkOperationStore {

    BulkOperation create(BulkOperation operation);

    Optional<BulkOperation> findById(UUID id);

    Optional<BulkOperation> findForOwner(UUID userId, UUID id);

    List<BulkOperation> listForOwner(UUID userId, int page, int size);

    List<BulkOperation> listByStatus(OperationStatus status);

    BulkOperation update(UUID id, Consumer<BulkOperation> mutation);
}
