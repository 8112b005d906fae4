package villagecompute.wpautomation.data.stores;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

import villagecompute.wpautomation.data.models.ArticleJob;
import villagecompute.wpautomation.data.models.ArticleJob.JobStatus;

/**
 * Durable record of article jobs and their lifecycle.
 *
 * <p>
 * Every write runs in its own transaction and returns a detached copy, so callers never hold a managed entity across
 * remote calls. Status changes go through {@link #transition} which enforces {@link JobStatus#canTransitionTo}.
 */
public interface ArticleJobStore {

    /**
     * Persists a feed-sourced job unless one already exists for {@code (userId, rssFeedId, sourceUrl)}, whatever its
     * status.
     *
     * @return the saved job, or empty when the source item was already seen
     */
    Optional<ArticleJob> createIfAbsent(ArticleJob job);

    ArticleJob create(ArticleJob job);

    Optional<ArticleJob> findById(UUID id);

    Optional<ArticleJob> findForOwner(UUID userId, UUID id);

    /**
     * Oldest PENDING job by creation time.
     */
    Optional<ArticleJob> findOldestPending();

    /**
     * Applies a lifecycle transition and then {@code mutation} in one transaction.
     *
     * @throws villagecompute.wpautomation.exceptions.ResourceNotFoundException
     *             if the job no longer exists
     * @throws villagecompute.wpautomation.exceptions.InvalidStateTransitionException
     *             if the transition is not allowed
     */
    ArticleJob transition(UUID id, JobStatus target, Consumer<ArticleJob> mutation);

    List<ArticleJob> listForOwner(UUID userId, JobStatus status, int page, int size);

    Map<JobStatus, Long> countByStatus();

    boolean delete(UUID userId, UUID id);
}
