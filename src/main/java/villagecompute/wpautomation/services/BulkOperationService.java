package villagecompute.wpautomation.services;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import io.quarkus.runtime.Startup;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import villagecompute.wpautomation.api.types.BulkActionPayloadType;
import villagecompute.wpautomation.api.types.BulkItemErrorType;
import villagecompute.wpautomation.api.types.BulkOperationStatusType;
import villagecompute.wpautomation.data.models.BulkOperation;
import villagecompute.wpautomation.data.models.BulkOperation.BulkAction;
import villagecompute.wpautomation.data.models.BulkOperation.OperationStatus;
import villagecompute.wpautomation.data.models.BulkOperation.TargetType;
import villagecompute.wpautomation.data.models.Site;
import villagecompute.wpautomation.data.stores.BulkOperationStore;
import villagecompute.wpautomation.data.stores.SiteStore;
import villagecompute.wpautomation.exceptions.ConfigurationException;
import villagecompute.wpautomation.exceptions.ResourceNotFoundException;
import villagecompute.wpautomation.exceptions.ValidationException;
import villagecompute.wpautomation.observability.LoggingConfig;

/**
 * Applies one action to many WordPress posts in the background.
 *
 * <p>
 * {@link #submit} persists a PENDING operation and returns its id at once. Operations run one at a time on a
 * single-thread executor in submission order. Each target id gets exactly one remote call; a failing item is recorded
 * in the operation's error list and the loop continues. Progress is persisted after every item so
 * {@link #getStatus} can be polled while the operation runs.
 *
 * <p>
 * <b>Action to remote call:</b>
 * <ul>
 * <li>PUBLISH / UNPUBLISH - update the post status ({@code publish} / {@code draft} unless the payload says
 * otherwise)</li>
 * <li>DELETE - delete the post, to the trash unless {@code force}</li>
 * <li>UPDATE_METADATA - partial update of categories, tags and status</li>
 * </ul>
 *
 * <p>
 * On startup, operations left PENDING are queued again and operations caught PROCESSING are failed.
 */
@ApplicationScoped
@Startup
public class BulkOperationService {

    private static final Logger LOG = Logger.getLogger(BulkOperationService.class);

    public static final String INTERRUPTED_MESSAGE = "Interrupted by shutdown";
    static final int MAX_PAGE_SIZE = 100;

    private static final TypeReference<List<Long>> TARGET_IDS = new TypeReference<>() {
    };
    private static final TypeReference<List<BulkItemErrorType>> ERRORS = new TypeReference<>() {
    };

    @Inject
    BulkOperationStore operationStore;

    @Inject
    SiteStore siteStore;

    @Inject
    WordPressPublishService publishService;

    @Inject
    ObjectMapper objectMapper;

    @Inject
    Clock clock;

    @Inject
    MeterRegistry meterRegistry;

    @Inject
    Tracer tracer;

    @ConfigProperty(
            name = "automation.bulk.item-delay-ms",
            defaultValue = "1000")
    long itemDelayMillis;

    ExecutorService executor;

    @PostConstruct
    void start() {
        executor = Executors.newSingleThreadExecutor(
                new ThreadFactoryBuilder().setNameFormat("bulk-operation-%d").setDaemon(true).build());
        recover();
    }

    @PreDestroy
    void stop() {
        executor.shutdownNow();
    }

    /**
     * Queues {@code action} for every id in {@code targetIds}.
     *
     * @param payload
     *            action payload; may be {@code null} for PUBLISH, UNPUBLISH and DELETE
     * @return the id of the PENDING operation
     * @throws ValidationException
     *             if the targets are empty or not positive, or the payload does not fit the action
     * @throws ResourceNotFoundException
     *             if the site does not exist or belongs to another user
     */
    public UUID submit(UUID userId, UUID siteId, BulkAction action, List<Long> targetIds,
            BulkActionPayloadType payload) {
        if (action == null) {
            throw new ValidationException("Bulk action is required");
        }
        List<Long> targets = normalizeTargets(targetIds);
        BulkActionPayloadType effectivePayload = resolvePayload(action, payload);
        siteStore.findSite(siteId).filter(site -> site.userId.equals(userId))
                .orElseThrow(() -> new ResourceNotFoundException("Site not found: " + siteId));

        BulkOperation operation = new BulkOperation();
        operation.userId = userId;
        operation.siteId = siteId;
        operation.targetType = TargetType.POST;
        operation.action = action;
        operation.targetIdsJson = toJson(targets);
        operation.payloadJson = toJson(effectivePayload);
        operation.status = OperationStatus.PENDING;
        operation.totalItems = targets.size();
        operation.createdAt = clock.instant();
        operation.updatedAt = operation.createdAt;

        BulkOperation saved = operationStore.create(operation);
        LOG.infof("User %s queued bulk %s of %d posts on site %s (operation %s)", userId, action, targets.size(),
                siteId, saved.id);
        enqueue(saved.id);
        return saved.id;
    }

    public BulkOperationStatusType getStatus(UUID userId, UUID operationId) {
        BulkOperation operation = operationStore.findForOwner(userId, operationId)
                .orElseThrow(() -> new ResourceNotFoundException("Bulk operation not found: " + operationId));
        return toStatus(operation);
    }

    public List<BulkOperationStatusType> list(UUID userId, int page, int size) {
        int pageSize = Math.max(1, Math.min(size, MAX_PAGE_SIZE));
        return operationStore.listForOwner(userId, Math.max(0, page), pageSize).stream().map(this::toStatus)
                .toList();
    }

    /**
     * Re-queues PENDING operations and fails PROCESSING ones.
     *
     * @return number of operations queued again
     */
    int recover() {
        for (BulkOperation interrupted : operationStore.listByStatus(OperationStatus.PROCESSING)) {
            try {
                operationStore.update(interrupted.id, op -> {
                    op.status = OperationStatus.FAILED;
                    op.completedAt = clock.instant();
                    op.errorsJson = appendError(op, INTERRUPTED_MESSAGE);
                });
                LOG.warnf("Bulk operation %s was interrupted at %d/%d items, marked failed", interrupted.id,
                        interrupted.processedItems, interrupted.totalItems);
            } catch (RuntimeException e) {
                LOG.errorf(e, "Failed to mark interrupted bulk operation %s: %s", interrupted.id, e.getMessage());
            }
        }

        List<BulkOperation> pending = operationStore.listByStatus(OperationStatus.PENDING);
        pending.forEach(operation -> enqueue(operation.id));
        if (!pending.isEmpty()) {
            LOG.infof("Re-queued %d pending bulk operations", pending.size());
        }
        return pending.size();
    }

    private void enqueue(UUID operationId) {
        try {
            executor.execute(() -> process(operationId));
        } catch (RejectedExecutionException e) {
            LOG.errorf(e, "Bulk executor rejected operation %s, it stays PENDING until restart", operationId);
        }
    }

    void process(UUID operationId) {
        Optional<BulkOperation> found = operationStore.findById(operationId);
        if (found.isEmpty() || found.get().status != OperationStatus.PENDING) {
            LOG.debugf("Bulk operation %s is no longer pending, skipping", operationId);
            return;
        }
        BulkOperation operation = found.get();

        Span span = tracer.spanBuilder("bulk_operation.process")
                .setAttribute("bulk_operation_id", operationId.toString())
                .setAttribute("action", operation.action.name()).setAttribute("total_items", operation.totalItems)
                .startSpan();
        try (Scope scope = span.makeCurrent()) {
            LoggingConfig.enrichWithTraceContext();
            LoggingConfig.setBulkOperationId(operationId);
            LoggingConfig.setUserId(operation.userId);

            operationStore.update(operationId, op -> {
                op.status = OperationStatus.PROCESSING;
                op.startedAt = clock.instant();
            });
            LOG.infof("Processing bulk %s of %d posts", operation.action, operation.totalItems);

            Site site = siteStore.findSite(operation.siteId).filter(Site::hasCredentials)
                    .orElseThrow(() -> new ConfigurationException("WordPress credentials not configured for site "
                            + operation.siteId));
            List<Long> targets = objectMapper.readValue(operation.targetIdsJson, TARGET_IDS);
            BulkActionPayloadType payload = operation.payloadJson == null ? resolvePayload(operation.action, null)
                    : objectMapper.readValue(operation.payloadJson, BulkActionPayloadType.class);

            List<BulkItemErrorType> errors = applyToTargets(operationId, site, targets, payload);

            String errorsJson = errors.isEmpty() ? null : toJson(errors);
            BulkOperation completed = operationStore.update(operationId, op -> {
                op.status = OperationStatus.COMPLETED;
                op.completedAt = clock.instant();
                op.errorsJson = errorsJson;
            });
            span.setAttribute("success_count", completed.successCount);
            span.setAttribute("failure_count", completed.failureCount);
            LOG.infof("Bulk operation completed: %d succeeded, %d failed", completed.successCount,
                    completed.failureCount);
        } catch (JsonProcessingException | RuntimeException e) {
            LOG.errorf(e, "Bulk operation %s failed: %s", operationId, e.getMessage());
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, e.getMessage() != null ? e.getMessage() : e.getClass().getName());
            failOperation(operationId, e);
        } finally {
            span.end();
            LoggingConfig.clearMDC();
        }
    }

    private List<BulkItemErrorType> applyToTargets(UUID operationId, Site site, List<Long> targets,
            BulkActionPayloadType payload) {
        List<BulkItemErrorType> errors = new ArrayList<>();
        for (int i = 0; i < targets.size(); i++) {
            long postId = targets.get(i);
            boolean succeeded;
            try {
                apply(site, postId, payload);
                succeeded = true;
                countItem("success");
            } catch (RuntimeException e) {
                succeeded = false;
                errors.add(new BulkItemErrorType(postId, errorText(e)));
                countItem("failure");
                LOG.warnf("Bulk item %d failed: %s", postId, e.getMessage());
            }

            boolean itemSucceeded = succeeded;
            String progressErrors = errors.isEmpty() ? null : toJson(errors);
            operationStore.update(operationId, op -> {
                op.processedItems++;
                if (itemSucceeded) {
                    op.successCount++;
                } else {
                    op.failureCount++;
                }
                op.errorsJson = progressErrors;
            });

            if (i < targets.size() - 1) {
                pause();
            }
        }
        return errors;
    }

    private void apply(Site site, long postId, BulkActionPayloadType payload) {
        if (payload instanceof BulkActionPayloadType.StatusChange change) {
            publishService.updatePost(site, postId, Map.of("status", change.status()));
        } else if (payload instanceof BulkActionPayloadType.Delete delete) {
            publishService.deletePost(site, postId, delete.force());
        } else if (payload instanceof BulkActionPayloadType.PublishMetadataUpdate update) {
            publishService.updatePost(site, postId, metadataFields(update));
        } else {
            throw new ValidationException("Unsupported bulk payload: " + payload);
        }
    }

    static Map<String, Object> metadataFields(BulkActionPayloadType.PublishMetadataUpdate update) {
        Map<String, Object> fields = new LinkedHashMap<>();
        if (update.categories() != null && !update.categories().isEmpty()) {
            fields.put("categories", update.categories());
        }
        if (update.tags() != null && !update.tags().isEmpty()) {
            fields.put("tags", update.tags());
        }
        if (update.status() != null && !update.status().isBlank()) {
            fields.put("status", update.status());
        }
        return fields;
    }

    private void pause() {
        if (itemDelayMillis <= 0) {
            return;
        }
        try {
            TimeUnit.MILLISECONDS.sleep(itemDelayMillis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(INTERRUPTED_MESSAGE, e);
        }
    }

    private void failOperation(UUID operationId, Exception cause) {
        try {
            operationStore.update(operationId, op -> {
                op.status = OperationStatus.FAILED;
                op.completedAt = clock.instant();
                op.errorsJson = appendError(op, errorText(cause));
            });
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to mark bulk operation %s failed: %s", operationId, e.getMessage());
        }
    }

    /**
     * Checks the payload against the action and fills in the default for actions that need none.
     */
    static BulkActionPayloadType resolvePayload(BulkAction action, BulkActionPayloadType payload) {
        switch (action) {
            case PUBLISH, UNPUBLISH -> {
                if (payload == null) {
                    return new BulkActionPayloadType.StatusChange(action == BulkAction.PUBLISH ? "publish" : "draft");
                }
                if (!(payload instanceof BulkActionPayloadType.StatusChange change) || change.status() == null
                        || change.status().isBlank()) {
                    throw new ValidationException(action + " requires a status_change payload with a status");
                }
                return payload;
            }
            case DELETE -> {
                if (payload == null) {
                    return new BulkActionPayloadType.Delete(false);
                }
                if (!(payload instanceof BulkActionPayloadType.Delete)) {
                    throw new ValidationException("DELETE requires a delete payload");
                }
                return payload;
            }
            case UPDATE_METADATA -> {
                if (!(payload instanceof BulkActionPayloadType.PublishMetadataUpdate update) || update.isEmpty()) {
                    throw new ValidationException(
                            "UPDATE_METADATA requires at least one of categories, tags or status");
                }
                return payload;
            }
            default -> throw new ValidationException("Unsupported bulk action: " + action);
        }
    }

    static List<Long> normalizeTargets(List<Long> targetIds) {
        if (targetIds == null || targetIds.isEmpty()) {
            throw new ValidationException("At least one post id is required");
        }
        LinkedHashSet<Long> unique = new LinkedHashSet<>();
        for (Long id : targetIds) {
            if (id == null || id <= 0) {
                throw new ValidationException("Post ids must be positive: " + id);
            }
            unique.add(id);
        }
        return List.copyOf(unique);
    }

    /**
     * Adds an operation-level error after the item errors already recorded on {@code operation}.
     */
    private String appendError(BulkOperation operation, String error) {
        List<BulkItemErrorType> errors = new ArrayList<>(readErrors(operation));
        errors.add(new BulkItemErrorType(null, error));
        return toJson(errors);
    }

    private List<BulkItemErrorType> readErrors(BulkOperation operation) {
        if (operation.errorsJson == null) {
            return Collections.emptyList();
        }
        try {
            return objectMapper.readValue(operation.errorsJson, ERRORS);
        } catch (JsonProcessingException e) {
            LOG.warnf("Unreadable error list on bulk operation %s: %s", operation.id, e.getMessage());
            return Collections.emptyList();
        }
    }

    private BulkOperationStatusType toStatus(BulkOperation operation) {
        List<BulkItemErrorType> errors = readErrors(operation);
        return new BulkOperationStatusType(operation.id, operation.action, operation.status, operation.totalItems,
                operation.processedItems, operation.successCount, operation.failureCount, errors,
                operation.createdAt, operation.startedAt, operation.completedAt);
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize bulk operation field", e);
        }
    }

    private void countItem(String result) {
        Counter.builder("automation.bulk.items").tag("result", result).register(meterRegistry).increment();
    }

    private static String errorText(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
