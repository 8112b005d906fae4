package villagecompute.wpautomation.data.stores;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.narayana.jta.QuarkusTransactionException;
import io.quarkus.panache.common.Page;
import io.quarkus.panache.common.Parameters;
import io.quarkus.panache.common.Sort;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.persistence.PersistenceException;

import org.jboss.logging.Logger;

import villagecompute.wpautomation.data.models.ArticleJob;
import villagecompute.wpautomation.data.models.ArticleJob.JobStatus;
import villagecompute.wpautomation.exceptions.ResourceNotFoundException;

/**
 * {@link ArticleJobStore} backed by the {@code automation_jobs} table.
 */
@ApplicationScoped
public class PanacheArticleJobStore implements ArticleJobStore {

    private static final Logger LOG = Logger.getLogger(PanacheArticleJobStore.class);

    @Override
    public Optional<ArticleJob> createIfAbsent(ArticleJob job) {
        try {
            return QuarkusTransaction.requiringNew().call(() -> {
                if (ArticleJob.findByFeedSource(job.userId, job.rssFeedId, job.sourceUrl).isPresent()) {
                    return Optional.<ArticleJob>empty();
                }
                job.persistAndFlush();
                LOG.infof("Created job %s for feed %s: %s", job.id, job.rssFeedId, job.sourceUrl);
                return Optional.of(job);
            });
        } catch (PersistenceException | QuarkusTransactionException e) {
            // Lost a race on uq_automation_jobs_feed_source
            boolean exists = QuarkusTransaction.requiringNew()
                    .call(() -> ArticleJob.findByFeedSource(job.userId, job.rssFeedId, job.sourceUrl).isPresent());
            if (exists) {
                LOG.debugf("Job for %s created concurrently, skipping", job.sourceUrl);
                return Optional.empty();
            }
            throw e;
        }
    }

    @Override
    public ArticleJob create(ArticleJob job) {
        QuarkusTransaction.requiringNew().run(() -> {
            job.persist();
            LOG.infof("Created %s job %s (status: %s)", job.sourceType, job.id, job.status);
        });
        return job;
    }

    @Override
    public Optional<ArticleJob> findById(UUID id) {
        return QuarkusTransaction.requiringNew().call(() -> ArticleJob.<ArticleJob>findByIdOptional(id));
    }

    @Override
    public Optional<ArticleJob> findForOwner(UUID userId, UUID id) {
        return findById(id).filter(job -> job.userId.equals(userId));
    }

    @Override
    public Optional<ArticleJob> findOldestPending() {
        return QuarkusTransaction.requiringNew().call(ArticleJob::findOldestPending);
    }

    @Override
    public ArticleJob transition(UUID id, JobStatus target, Consumer<ArticleJob> mutation) {
        return QuarkusTransaction.requiringNew().call(() -> {
            ArticleJob job = ArticleJob.<ArticleJob>findByIdOptional(id)
                    .orElseThrow(() -> new ResourceNotFoundException("Job not found: " + id));
            JobStatus from = job.status;
            job.applyTransition(target);
            if (mutation != null) {
                mutation.accept(job);
            }
            job.persist();
            LOG.debugf("Job %s: %s -> %s", id, from, target);
            return job;
        });
    }

    @Override
    public List<ArticleJob> listForOwner(UUID userId, JobStatus status, int page, int size) {
        return QuarkusTransaction.requiringNew().call(() -> {
            Sort sort = Sort.descending("createdAt");
            if (status == null) {
                return ArticleJob.<ArticleJob>find("userId = :userId", sort, Parameters.with("userId", userId))
                        .page(Page.of(page, size)).list();
            }
            return ArticleJob.<ArticleJob>find("userId = :userId AND status = :status", sort,
                    Parameters.with("userId", userId).and("status", status)).page(Page.of(page, size)).list();
        });
    }

    @Override
    public Map<JobStatus, Long> countByStatus() {
        return QuarkusTransaction.requiringNew().call(() -> {
            Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
            for (JobStatus status : JobStatus.values()) {
                counts.put(status, ArticleJob.count("status", status));
            }
            return counts;
        });
    }

    @Override
    public boolean delete(UUID userId, UUID id) {
        return QuarkusTransaction.requiringNew()
                .call(() -> ArticleJob.delete("id = :id AND userId = :userId",
                        Parameters.with("id", id).and("userId", userId)) > 0);
    }
}
