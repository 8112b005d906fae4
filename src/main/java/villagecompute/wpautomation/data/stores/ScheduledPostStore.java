package villagecompute.wpautomation.data.stores;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

import villagecompute.wpautomation.data.models.ScheduledPost;
import villagecompute.wpautomation.data.models.ScheduledPost.PostStatus;

/**
 * Persistence for scheduled posts.
 */
public interface ScheduledPostStore {

    ScheduledPost create(ScheduledPost post);

    Optional<ScheduledPost> findForOwner(UUID userId, UUID id);

    /**
     * Owner's posts, soonest first. {@code siteId} and {@code status} are optional filters.
     */
    List<ScheduledPost> listForOwner(UUID userId, UUID siteId, PostStatus status, int page, int size);

    /**
     * PENDING posts whose {@code scheduledFor} is at or before {@code now}, soonest first.
     */
    List<ScheduledPost> listDue(Instant now, int limit);

    /**
     * Applies {@code mutation} to the current row under a write lock. An exception thrown by the mutation leaves the
     * row unchanged.
     */
    ScheduledPost update(UUID id, Consumer<ScheduledPost> mutation);

    boolean delete(UUID userId, UUID id);
}
