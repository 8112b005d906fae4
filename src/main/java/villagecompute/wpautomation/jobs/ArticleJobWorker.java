package villagecompute.wpautomation.jobs;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
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

import villagecompute.wpautomation.api.types.GeneratedArticleType;
import villagecompute.wpautomation.api.types.GenerationRequestType;
import villagecompute.wpautomation.api.types.ImageCandidateType;
import villagecompute.wpautomation.api.types.PublishResultType;
import villagecompute.wpautomation.data.models.ArticleJob;
import villagecompute.wpautomation.data.models.ArticleJob.JobStatus;
import villagecompute.wpautomation.data.models.ArticleJob.SourceType;
import villagecompute.wpautomation.data.models.AutomationSchedule;
import villagecompute.wpautomation.data.models.RssFeed;
import villagecompute.wpautomation.data.models.Site;
import villagecompute.wpautomation.data.stores.ArticleJobStore;
import villagecompute.wpautomation.data.stores.AutomationScheduleStore;
import villagecompute.wpautomation.data.stores.SiteStore;
import villagecompute.wpautomation.exceptions.FeedReadException;
import villagecompute.wpautomation.exceptions.ResourceNotFoundException;
import villagecompute.wpautomation.integration.feeds.FeedReader;
import villagecompute.wpautomation.observability.LoggingConfig;
import villagecompute.wpautomation.services.ArticleGenerationPipeline;
import villagecompute.wpautomation.services.WordPressPublishService;

/**
 * Drains the PENDING job queue one job at a time.
 *
 * <p>
 * <b>Wake-ups:</b> a dedicated daemon thread ({@value #THREAD_NAME}) blocks on a single-slot channel. {@link #signal()}
 * offers a token and is dropped when one is already queued, so any number of signals while the worker is busy collapse
 * into one more drain. Job creation, retries, the periodic poll and startup all signal.
 *
 * <p>
 * <b>Per job:</b>
 * <ol>
 * <li>PENDING to GENERATING</li>
 * <li>Run the {@link ArticleGenerationPipeline}, then GENERATING to GENERATED with the generated fields</li>
 * <li>Resolve the publish policy: topic jobs carry their own, feed jobs use their schedule as it is now</li>
 * <li>When auto-publish applies: GENERATED to PUBLISHING, publish, PUBLISHING to PUBLISHED</li>
 * </ol>
 * Any error moves the job to FAILED with its message. Failed jobs are not retried automatically.
 *
 * <p>
 * <b>Metrics:</b> {@code automation.jobs.processed{result}} and {@code automation.jobs.duration}.
 */
@ApplicationScoped
@Startup
public class ArticleJobWorker {

    private static final Logger LOG = Logger.getLogger(ArticleJobWorker.class);

    public static final String THREAD_NAME = "article-job-worker";
    public static final String UNKNOWN_ERROR = "Unknown error occurred";

    @Inject
    ArticleJobStore jobStore;

    @Inject
    AutomationScheduleStore scheduleStore;

    @Inject
    SiteStore siteStore;

    @Inject
    FeedReader feedReader;

    @Inject
    ArticleGenerationPipeline pipeline;

    @Inject
    WordPressPublishService publishService;

    @Inject
    Clock clock;

    @Inject
    MeterRegistry meterRegistry;

    @Inject
    Tracer tracer;

    @ConfigProperty(
            name = "automation.worker.enabled",
            defaultValue = "true")
    boolean enabled;

    private final BlockingQueue<Boolean> wakeups = new ArrayBlockingQueue<>(1);
    private final AtomicBoolean processing = new AtomicBoolean();
    private volatile boolean running;
    private Thread thread;

    /**
     * Publish decision for a generated job.
     */
    public record PublishPolicy(boolean autoPublish, String status) {
    }

    @PostConstruct
    void start() {
        if (!enabled) {
            LOG.info("Article job worker disabled (automation.worker.enabled=false)");
            return;
        }
        running = true;
        thread = new ThreadFactoryBuilder().setNameFormat(THREAD_NAME).setDaemon(true).build()
                .newThread(this::runLoop);
        thread.start();
        LOG.info("Article job worker started");
        signal();
    }

    @PreDestroy
    void stop() {
        running = false;
        if (thread != null) {
            thread.interrupt();
        }
    }

    /**
     * Requests a drain of the queue. Never blocks.
     */
    public void signal() {
        wakeups.offer(Boolean.TRUE);
    }

    public boolean isProcessing() {
        return processing.get();
    }

    /**
     * Processes jobs until none are PENDING.
     *
     * @return the number of jobs processed
     */
    public int drain() {
        int processed = 0;
        while (processNext()) {
            processed++;
        }
        return processed;
    }

    /**
     * Processes the oldest PENDING job. Returns {@code false} without doing anything when the queue is empty or another
     * caller is already processing.
     */
    public boolean processNext() {
        if (!processing.compareAndSet(false, true)) {
            LOG.debug("Worker already processing, skipping");
            return false;
        }
        try {
            Optional<ArticleJob> next = jobStore.findOldestPending();
            if (next.isEmpty()) {
                return false;
            }
            process(next.get());
            return true;
        } finally {
            processing.set(false);
        }
    }

    private void runLoop() {
        while (running) {
            try {
                wakeups.take();
                int processed = drain();
                if (processed > 0) {
                    LOG.infof("Worker drained %d job(s)", processed);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.info("Article job worker stopping");
                return;
            } catch (RuntimeException e) {
                LOG.errorf(e, "Article job worker loop error: %s", e.getMessage());
            }
        }
    }

    void process(ArticleJob job) {
        Span span = tracer.spanBuilder("article_job.process").setAttribute("job_id", job.id.toString())
                .setAttribute("source_type", job.sourceType.name()).startSpan();
        Timer.Sample sample = Timer.start(meterRegistry);
        String result = "failed";

        try (Scope scope = span.makeCurrent()) {
            LoggingConfig.enrichWithTraceContext();
            LoggingConfig.setJobId(job.id);
            LoggingConfig.setUserId(job.userId);
            LOG.infof("Processing job %s: %s", job.id, job.generationInput());

            jobStore.transition(job.id, JobStatus.GENERATING, null);
            GeneratedArticleType article = pipeline.generate(buildRequest(job));
            ArticleJob generated = jobStore.transition(job.id, JobStatus.GENERATED, j -> applyArticle(j, article));
            result = "generated";

            PublishPolicy policy = resolvePublishPolicy(generated);
            if (policy.autoPublish()) {
                publish(generated, article, policy.status());
                result = "published";
            }
            span.setAttribute("tokens_used", article.tokensUsed());
            span.setAttribute("degraded", article.degraded());
            LOG.infof("Job %s finished as %s", job.id, result);
        } catch (RuntimeException e) {
            result = "failed";
            LOG.errorf(e, "Job %s failed: %s", job.id, e.getMessage());
            markFailed(job.id, e);
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, errorMessage(e));
        } finally {
            sample.stop(Timer.builder("automation.jobs.duration").register(meterRegistry));
            Counter.builder("automation.jobs.processed").tag("result", result).register(meterRegistry).increment();
            span.end();
            LoggingConfig.clearMDC();
        }
    }

    /**
     * GENERATED to PUBLISHING, publish, PUBLISHING to PUBLISHED. Errors propagate; the caller decides how to fail the
     * job.
     */
    public ArticleJob publish(ArticleJob generated, GeneratedArticleType article, String status) {
        Site site = siteStore.findSite(generated.siteId)
                .orElseThrow(() -> new ResourceNotFoundException("Site not found: " + generated.siteId));
        jobStore.transition(generated.id, JobStatus.PUBLISHING, null);
        PublishResultType published = publishService.publish(site, article, status);
        return jobStore.transition(generated.id, JobStatus.PUBLISHED, j -> {
            j.wpPostId = published.postId();
            j.publishedAt = clock.instant();
            j.publishStatus = status;
        });
    }

    /**
     * Moves the job to FAILED, logging instead of throwing when that is no longer possible (job deleted or already
     * failed by a cancel).
     */
    public void markFailed(UUID jobId, Throwable error) {
        String message = errorMessage(error);
        try {
            jobStore.transition(jobId, JobStatus.FAILED, j -> j.errorMessage = message);
        } catch (RuntimeException e) {
            LOG.warnf("Could not mark job %s as failed: %s", jobId, e.getMessage());
        }
    }

    public PublishPolicy resolvePublishPolicy(ArticleJob job) {
        if (job.hasOwnPublishOptions()) {
            return new PublishPolicy(job.autoPublish, defaultStatus(job.publishStatus));
        }
        Optional<AutomationSchedule> schedule = job.scheduleId != null ? scheduleStore.findById(job.scheduleId)
                : Optional.empty();
        if (schedule.isEmpty() && job.rssFeedId != null) {
            schedule = scheduleStore.findActiveForFeed(job.userId, job.rssFeedId);
        }
        return schedule.map(s -> new PublishPolicy(s.autoPublish, defaultStatus(s.publishStatus)))
                .orElse(new PublishPolicy(false, AutomationSchedule.PUBLISH_STATUS_DRAFT));
    }

    /**
     * Rebuilds a publishable article from a stored GENERATED job.
     */
    public static GeneratedArticleType storedArticle(ArticleJob job) {
        ImageCandidateType featured = job.featuredImageUrl == null ? null
                : new ImageCandidateType(job.featuredImageUrl, job.featuredImageUrl, 0, 0, null, null,
                        job.generatedTitle, null, null);
        return new GeneratedArticleType(job.generatedTitle, job.generatedContent, null, job.generatedExcerpt,
                nullToEmpty(job.categories), nullToEmpty(job.tags), job.seoDescription, nullToEmpty(job.seoKeywords),
                featured, List.of(), job.tokensUsed, job.aiCost, job.aiModel, List.of());
    }

    private GenerationRequestType buildRequest(ArticleJob job) {
        String sourceBody = job.sourceType == SourceType.RSS ? fetchSourceBody(job) : null;
        return new GenerationRequestType(job.userId, job.generationInput(), job.sourceUrl, sourceBody,
                job.rewriteStyle);
    }

    private String fetchSourceBody(ArticleJob job) {
        if (job.rssFeedId == null || job.sourceUrl == null) {
            return null;
        }
        try {
            Optional<RssFeed> feed = siteStore.findFeed(job.rssFeedId);
            if (feed.isEmpty()) {
                return null;
            }
            return feedReader.findItem(feed.get().url, job.sourceUrl)
                    .map(item -> item.content() != null ? item.content() : item.description()).orElse(null);
        } catch (FeedReadException e) {
            LOG.warnf("Could not re-read source item %s, generating from title only: %s", job.sourceUrl,
                    e.getMessage());
            return null;
        }
    }

    private static void applyArticle(ArticleJob job, GeneratedArticleType article) {
        job.generatedTitle = article.title();
        job.generatedContent = article.content();
        job.generatedExcerpt = article.excerpt();
        job.categories = article.categories();
        job.tags = article.tags();
        job.seoDescription = article.seoDescription();
        job.seoKeywords = article.seoKeywords();
        job.featuredImageUrl = article.featuredImage() != null ? article.featuredImage().url() : null;
        job.degraded = article.degraded();
        job.aiModel = article.model();
        job.tokensUsed = article.tokensUsed();
        job.aiCost = article.cost();
        job.errorMessage = null;
    }

    private static String defaultStatus(String status) {
        return status == null || status.isBlank() ? AutomationSchedule.PUBLISH_STATUS_DRAFT : status;
    }

    private static String errorMessage(Throwable error) {
        String message = error != null ? error.getMessage() : null;
        return message == null || message.isBlank() ? UNKNOWN_ERROR : message;
    }

    private static <T> List<T> nullToEmpty(List<T> values) {
        return values == null ? List.of() : values;
    }
}
