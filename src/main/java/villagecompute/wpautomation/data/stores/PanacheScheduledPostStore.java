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
import jakarta.persistence.LockModeType;

import villagecompute.wpautomation.data.models.ScheduledPost;
import villagecompute.wpautomation.data.models.ScheduledPost.PostStatus;
import villagecompute.wpautomation.exceptions.ResourceNotFoundException;

/**
 * {@link ScheduledPostStore} backed by the {@code scheduled_posts} table.
 */
@ApplicationScoped
public class PanacheScheduledPostStore implements ScheduledPostStore {

    @Override
    public ScheduledPost create(ScheduledPost post) {
        QuarkusTransaction.requiringNew().run(post::persist);
        return post;
    }

    @Override
    public Optional<ScheduledPost> findForOwner(UUID userId, UUID id) {
        return QuarkusTransaction.requiringNew().call(() -> ScheduledPost.<ScheduledPost>findByIdOptional(id))
                .filter(post -> post.userId.equals(userId));
    }

    @Override
    public List<ScheduledPost> listForOwner(UUID userId, UUID siteId, PostStatus status, int page, int size) {
        StringBuilder query = new StringBuilder("userId = :userId");
        Parameters params = Parameters.with("userId", userId);
        if (siteId != null) {
            query.append(" AND siteId = :siteId");
            params = params.and("siteId", siteId);
        }
        if (status != null) {
            query.append(" AND status = :status");
            params = params.and("status", status);
        }
        Parameters bound = params;
        return QuarkusTransaction.requiringNew()
                .call(() -> ScheduledPost.<ScheduledPost>find(query.toString(), Sort.ascending("scheduledFor"), bound)
                        .page(Page.of(page, size)).list());
    }

    @Override
    public List<ScheduledPost> listDue(Instant now, int limit) {
        return QuarkusTransaction.requiringNew()
                .call(() -> ScheduledPost.<ScheduledPost>find("status = :status AND scheduledFor <= :now",
                        Sort.ascending("scheduledFor"), Parameters.with("status", PostStatus.PENDING).and("now", now))
                        .page(Page.ofSize(limit)).list());
    }

    @Override
    public ScheduledPost update(UUID id, Consumer<ScheduledPost> mutation) {
        return QuarkusTransaction.requiringNew().call(() -> {
            ScheduledPost post = ScheduledPost.<ScheduledPost>findByIdOptional(id, LockModeType.PESSIMISTIC_WRITE)
                    .orElseThrow(() -> new ResourceNotFoundException("Scheduled post not found: " + id));
            mutation.accept(post);
            post.updatedAt = Instant.now();
            post.persist();
            return post;
        });
    }

    @Override
    public boolean delete(UUID userId, UUID id) {
        return QuarkusTransaction.requiringNew()
                .call(() -> ScheduledPost.delete("id = :id AND userId = :userId",
                        Parameters.with("id", id).and("userId", userId)) > 0);
    }
}
