package villagecompute.wpautomation.data.stores;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.panache.common.Page;
import io.quarkus.panache.common.Parameters;
import io.quarkus.panache.common.Sort;

import jakarta.enterprise.context.ApplicationScoped;

import villagecompute.wpautomation.data.models.BulkOperation;
import villagecompute.wpautomation.data.models.BulkOperation.OperationStatus;
import villagecompute.wpautomation.exceptions.InvalidStateTransitionException;
import villagecompute.wpautomation.exceptions.ResourceNotFoundException;

/**
 * {@link BulkOperationStore} backed by the {@code bulk_operations} table.
 */
@ApplicationScoped
public class PanacheBulkOperationStore implements BulkOperationStore {

    @Override
    public BulkOperation create(BulkOperation operation) {
        QuarkusTransaction.requiringNew().run(operation::persist);
        return operation;
    }

    @Override
    public Optional<BulkOperation> findById(UUID id) {
        return QuarkusTransaction.requiringNew().call(() -> BulkOperation.<BulkOperation>findByIdOptional(id));
    }

    @Override
    public Optional<BulkOperation> findForOwner(UUID userId, UUID id) {
        return findById(id).filter(operation -> operation.userId.equals(userId));
    }

    @Override
    public List<BulkOperation> listForOwner(UUID userId, int page, int size) {
        return QuarkusTransaction.requiringNew()
                .call(() -> BulkOperation.<BulkOperation>find("userId = :userId", Sort.descending("createdAt"),
                        Parameters.with("userId", userId)).page(Page.of(page, size)).list());
    }

    @Override
    public List<BulkOperation> listByStatus(OperationStatus status) {
        return QuarkusTransaction.requiringNew().call(() -> BulkOperation
                .<BulkOperation>find("status", Sort.ascending("createdAt"), status).list());
    }

    @Override
    public BulkOperation update(UUID id, Consumer<BulkOperation> mutation) {
        return QuarkusTransaction.requiringNew().call(() -> {
            BulkOperation operation = BulkOperation.<BulkOperation>findByIdOptional(id)
                    .orElseThrow(() -> new ResourceNotFoundException("Bulk operation not found: " + id));
            if (operation.status.isFinal()) {
                throw new InvalidStateTransitionException(
                        "Bulk operation " + id + " is already " + operation.status);
            }
            mutation.accept(operation);
            operation.updatedAt = Instant.now();
            operation.persist();
            return operation;
        });
    }
}
