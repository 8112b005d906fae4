package villagecompute.wpautomation.testing;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

import villagecompute.wpautomation.data.models.BulkOperation;
import villagecompute.wpautomation.data.models.BulkOperation.OperationStatus;
import villagecompute.wpautomation.data.stores.BulkOperationStore;
import villagecompute.wpautomation.exceptions.InvalidStateTransitionException;
import villagecompute.wpautomation.exceptions.ResourceNotFoundException;

/**
 * Map-backed {@link BulkOperationStore} for unit tests.
 *
 * <p>
 * Keeps a copy of every persisted state so tests can check the progress counters item by item.
 */
public class InMemoryBulkOperationStore implements BulkOperationStore {

    private final Map<UUID, BulkOperation> operations = new ConcurrentHashMap<>();
    private final List<BulkOperation> history = new CopyOnWriteArrayList<>();

    @Override
    public BulkOperation create(BulkOperation operation) {
        if (operation.id == null) {
            operation.id = UUID.randomUUID();
        }
        operations.put(operation.id, operation);
        history.add(snapshot(operation));
        return operation;
    }

    @Override
    public Optional<BulkOperation> findById(UUID id) {
        return Optional.ofNullable(operations.get(id));
    }

    @Override
    public Optional<BulkOperation> findForOwner(UUID userId, UUID id) {
        return findById(id).filter(operation -> operation.userId.equals(userId));
    }

    @Override
    public List<BulkOperation> listForOwner(UUID userId, int page, int size) {
        return operations.values().stream().filter(operation -> operation.userId.equals(userId))
                .sorted(Comparator.comparing((BulkOperation operation) -> operation.createdAt).reversed())
                .skip((long) page * size).limit(size).toList();
    }

    @Override
    public List<BulkOperation> listByStatus(OperationStatus status) {
        return operations.values().stream().filter(operation -> operation.status == status)
                .sorted(Comparator.comparing(operation -> operation.createdAt)).toList();
    }

    @Override
    public synchronized BulkOperation update(UUID id, Consumer<BulkOperation> mutation) {
        BulkOperation operation = findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Bulk operation not found: " + id));
        if (operation.status.isFinal()) {
            throw new InvalidStateTransitionException("Bulk operation " + id + " is already " + operation.status);
        }
        mutation.accept(operation);
        operation.updatedAt = Instant.now();
        history.add(snapshot(operation));
        return operation;
    }

    /**
     * Every persisted state of {@code id}, oldest first.
     */
    public List<BulkOperation> history(UUID id) {
        return new ArrayList<>(history.stream().filter(operation -> operation.id.equals(id)).toList());
    }

    private static BulkOperation snapshot(BulkOperation source) {
        BulkOperation copy = new BulkOperation();
        copy.id = source.id;
        copy.userId = source.userId;
        copy.siteId = source.siteId;
        copy.targetType = source.targetType;
        copy.action = source.action;
        copy.targetIdsJson = source.targetIdsJson;
        copy.payloadJson = source.payloadJson;
        copy.status = source.status;
        copy.totalItems = source.totalItems;
        copy.processedItems = source.processedItems;
        copy.successCount = source.successCount;
        copy.failureCount = source.failureCount;
        copy.errorsJson = source.errorsJson;
        copy.createdAt = source.createdAt;
        copy.startedAt = source.startedAt;
        copy.completedAt = source.completedAt;
        copy.updatedAt = source.updatedAt;
        return copy;
    }
}
