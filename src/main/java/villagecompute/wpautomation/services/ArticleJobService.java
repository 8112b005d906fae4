package villagecompute.wpautomation.services;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import villagecompute.wpautomation.api.types.FeedItemType;
import villagecompute.wpautomation.api.types.GenerationRequestType.RewriteStyle;
import villagecompute.wpautomation.api.types.QueueStatsType;
import villagecompute.wpautomation.data.models.ArticleJob;
import villagecompute.wpautomation.data.models.ArticleJob.JobStatus;
import villagecompute.wpautomation.data.models.AutomationSchedule;
import villagecompute.wpautomation.data.models.RssFeed;
import villagecompute.wpautomation.data.stores.ArticleJobStore;
import villagecompute.wpautomation.data.stores.SiteStore;
import villagecompute.wpautomation.exceptions.DuplicateResourceException;
import villagecompute.wpautomation.exceptions.FeedReadException;
import villagecompute.wpautomation.exceptions.InvalidStateTransitionException;
import villagecompute.wpautomation.exceptions.ResourceNotFoundException;
import villagecompute.wpautomation.exceptions.ValidationException;
import villagecompute.wpautomation.integration.feeds.FeedReader;
import villagecompute.wpautomation.jobs.ArticleJobWorker;

/**
 * User-initiated actions on article jobs.
 *
 * <p>
 * Every lookup is scoped to the owner; a job belonging to someone else is reported as not found.
 */
@ApplicationScoped
public class ArticleJobService {

    private static final Logger LOG = Logger.getLogger(ArticleJobService.class);

    public static final String CANCELLED_MESSAGE = "Cancelled by user";
    static final int MAX_PAGE_SIZE = 100;

    @Inject
    ArticleJobStore jobStore;

    @Inject
    SiteStore siteStore;

    @Inject
    ArticleJobWorker worker;

    @Inject
    FeedReader feedReader;

    /**
     * Enqueues a job that drafts an article about {@code topic}.
     *
     * @throws ValidationException
     *             if the topic is blank or the publish status is unknown
     * @throws ResourceNotFoundException
     *             if the site does not exist or belongs to another user
     */
    public ArticleJob createTopicJob(UUID userId, UUID siteId, String topic, boolean autoPublish,
            String publishStatus) {
        if (topic == null || topic.isBlank()) {
            throw new ValidationException("Topic is required");
        }
        String status = publishStatus == null || publishStatus.isBlank() ? AutomationSchedule.PUBLISH_STATUS_DRAFT
                : publishStatus;
        validatePublishStatus(status);
        requireOwnedSite(userId, siteId);

        ArticleJob job = jobStore.create(ArticleJob.forTopic(userId, siteId, topic.trim(), autoPublish, status));
        LOG.infof("User %s queued topic job %s: %s", userId, job.id, job.topic);
        worker.signal();
        return job;
    }

    /**
     * Enqueues a job that rewrites one item of the user's feed, looked up by its link.
     *
     * @param rewriteStyle
     *            how the item is rewritten; {@code null} means {@link RewriteStyle#REWRITE}
     * @throws ValidationException
     *             if the article URL is blank or the publish status is unknown
     * @throws ResourceNotFoundException
     *             if the site or feed is missing or foreign, or the feed has no such item
     * @throws DuplicateResourceException
     *             if a job already exists for this item
     * @throws FeedReadException
     *             if the feed cannot be read
     */
    public ArticleJob createFeedItemJob(UUID userId, UUID siteId, UUID rssFeedId, String articleUrl,
            RewriteStyle rewriteStyle, boolean autoPublish, String publishStatus) {
        if (articleUrl == null || articleUrl.isBlank()) {
            throw new ValidationException("Article URL is required");
        }
        String status = publishStatus == null || publishStatus.isBlank() ? AutomationSchedule.PUBLISH_STATUS_DRAFT
                : publishStatus;
        validatePublishStatus(status);
        requireOwnedSite(userId, siteId);
        RssFeed feed = siteStore.findFeed(rssFeedId).filter(f -> f.userId.equals(userId))
                .orElseThrow(() -> new ResourceNotFoundException("RSS feed not found: " + rssFeedId));

        String url = articleUrl.trim();
        FeedItemType item = feedReader.findItem(feed.url, url)
                .orElseThrow(() -> new ResourceNotFoundException("Article not found in RSS feed: " + url));
        RewriteStyle style = rewriteStyle != null ? rewriteStyle : RewriteStyle.REWRITE;

        ArticleJob job = jobStore.createIfAbsent(ArticleJob.forSelectedFeedItem(userId, siteId, feed.id, url,
                item.title(), style, autoPublish, status))
                .orElseThrow(() -> new DuplicateResourceException("A job already exists for article " + url));
        LOG.infof("User %s queued %s job %s for feed item %s", userId, style, job.id, url);
        worker.signal();
        return job;
    }

    /**
     * FAILED back to PENDING, clearing the error.
     *
     * @throws InvalidStateTransitionException
     *             if the job is not FAILED
     */
    public ArticleJob retry(UUID userId, UUID jobId) {
        ArticleJob job = requireOwnedJob(userId, jobId);
        if (job.status != JobStatus.FAILED) {
            throw new InvalidStateTransitionException("Only failed jobs can be retried (job is " + job.status + ")");
        }
        ArticleJob retried = jobStore.transition(jobId, JobStatus.PENDING, j -> j.errorMessage = null);
        LOG.infof("Job %s re-queued by user %s", jobId, userId);
        worker.signal();
        return retried;
    }

    /**
     * Fails a job that has not finished. A worker currently generating the job notices on its next transition.
     */
    public ArticleJob cancel(UUID userId, UUID jobId) {
        ArticleJob job = requireOwnedJob(userId, jobId);
        if (job.status == JobStatus.PUBLISHED || job.status == JobStatus.FAILED) {
            throw new InvalidStateTransitionException("Job " + jobId + " already finished as " + job.status);
        }
        ArticleJob cancelled = jobStore.transition(jobId, JobStatus.FAILED, j -> j.errorMessage = CANCELLED_MESSAGE);
        LOG.infof("Job %s cancelled by user %s", jobId, userId);
        return cancelled;
    }

    /**
     * Publishes a GENERATED job that was held back as a draft candidate.
     */
    public ArticleJob publishNow(UUID userId, UUID jobId, String status) {
        ArticleJob job = requireOwnedJob(userId, jobId);
        String publishStatus = status == null || status.isBlank() ? AutomationSchedule.PUBLISH_STATUS_DRAFT : status;
        validatePublishStatus(publishStatus);
        if (job.status != JobStatus.GENERATED) {
            throw new InvalidStateTransitionException("Only generated jobs can be published (job is " + job.status
                    + ")");
        }
        try {
            return worker.publish(job, ArticleJobWorker.storedArticle(job), publishStatus);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Publishing job %s failed: %s", jobId, e.getMessage());
            worker.markFailed(jobId, e);
            throw e;
        }
    }

    public void delete(UUID userId, UUID jobId) {
        ArticleJob job = requireOwnedJob(userId, jobId);
        if (job.status.isInFlight()) {
            throw new InvalidStateTransitionException("Job " + jobId + " is " + job.status + " and cannot be deleted");
        }
        jobStore.delete(userId, jobId);
        LOG.infof("Job %s deleted by user %s", jobId, userId);
    }

    public ArticleJob get(UUID userId, UUID jobId) {
        return requireOwnedJob(userId, jobId);
    }

    public List<ArticleJob> list(UUID userId, JobStatus status, int page, int size) {
        int pageSize = Math.max(1, Math.min(size, MAX_PAGE_SIZE));
        return jobStore.listForOwner(userId, status, Math.max(0, page), pageSize);
    }

    public QueueStatsType getQueueStats() {
        Map<JobStatus, Long> counts = jobStore.countByStatus();
        return new QueueStatsType(count(counts, JobStatus.PENDING), count(counts, JobStatus.GENERATING),
                count(counts, JobStatus.GENERATED), count(counts, JobStatus.PUBLISHING),
                count(counts, JobStatus.PUBLISHED), count(counts, JobStatus.FAILED), worker.isProcessing());
    }

    private ArticleJob requireOwnedJob(UUID userId, UUID jobId) {
        return jobStore.findForOwner(userId, jobId)
                .orElseThrow(() -> new ResourceNotFoundException("Job not found: " + jobId));
    }

    private void requireOwnedSite(UUID userId, UUID siteId) {
        siteStore.findSite(siteId).filter(site -> site.userId.equals(userId))
                .orElseThrow(() -> new ResourceNotFoundException("Site not found: " + siteId));
    }

    static void validatePublishStatus(String status) {
        if (!AutomationSchedule.PUBLISH_STATUS_DRAFT.equals(status)
                && !AutomationSchedule.PUBLISH_STATUS_PUBLISH.equals(status)) {
            throw new ValidationException("Publish status must be 'draft' or 'publish'");
        }
    }

    private static long count(Map<JobStatus, Long> counts, JobStatus status) {
        return counts.getOrDefault(status, 0L);
    }
}
