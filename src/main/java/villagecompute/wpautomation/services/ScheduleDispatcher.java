package villagecompute.wpautomation.services;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import villagecompute.wpautomation.api.types.FeedItemType;
import villagecompute.wpautomation.api.types.FeedType;
import villagecompute.wpautomation.api.types.FiringResultType;
import villagecompute.wpautomation.data.models.ArticleJob;
import villagecompute.wpautomation.data.models.AutomationExecution;
import villagecompute.wpautomation.data.models.AutomationExecution.ExecutionStatus;
import villagecompute.wpautomation.data.models.AutomationSchedule;
import villagecompute.wpautomation.data.models.AutomationSchedule.ScheduleType;
import villagecompute.wpautomation.data.models.RssFeed;
import villagecompute.wpautomation.data.stores.ArticleJobStore;
import villagecompute.wpautomation.data.stores.AutomationScheduleStore;
import villagecompute.wpautomation.data.stores.SiteStore;
import villagecompute.wpautomation.exceptions.FeedReadException;
import villagecompute.wpautomation.exceptions.ResourceNotFoundException;
import villagecompute.wpautomation.integration.feeds.FeedReader;
import villagecompute.wpautomation.jobs.ArticleJobWorker;
import villagecompute.wpautomation.jobs.CronTriggers;
import villagecompute.wpautomation.jobs.ScheduleTrigger;
import villagecompute.wpautomation.observability.LoggingConfig;

/**
 * Performs one schedule firing: reads the schedule's feed and seeds the job queue with items not seen before.
 *
 * <p>
 * <b>Firing steps:</b>
 * <ol>
 * <li>Load the schedule; a missing or paused schedule, or one without a feed, is a no-op and is not counted as a
 * run</li>
 * <li>Read the feed and take the first {@code maxArticles} items (default 20) in feed order</li>
 * <li>For each item, create a PENDING job unless one already exists for {@code (owner, feed, link)} in any status</li>
 * <li>Record the run counters, last and next fire time, and an {@link AutomationExecution} history row</li>
 * <li>Wake the job worker when anything was enqueued</li>
 * </ol>
 *
 * <p>
 * Content is never generated here. A firing that enqueues nothing because every item was already seen is still a
 * successful run. An error creating one item's job is counted and the loop moves on; the run only counts as failed
 * when every new item failed. An outer error (feed unreachable, unparseable) counts as a failed run and is rethrown to
 * the caller.
 */
@ApplicationScoped
public class ScheduleDispatcher {

    private static final Logger LOG = Logger.getLogger(ScheduleDispatcher.class);

    @Inject
    AutomationScheduleStore scheduleStore;

    @Inject
    ArticleJobStore jobStore;

    @Inject
    SiteStore siteStore;

    @Inject
    FeedReader feedReader;

    @Inject
    ArticleJobWorker worker;

    @Inject
    Clock clock;

    @Inject
    MeterRegistry meterRegistry;

    @Inject
    Tracer tracer;

    /**
     * Fires the schedule once. A schedule that no longer exists, is paused or has no feed yields
     * {@link FiringResultType#skipped} without recording a run.
     *
     * @throws FeedReadException
     *             if the feed could not be read (the run is recorded as failed first)
     */
    public FiringResultType fire(UUID scheduleId) {
        Optional<AutomationSchedule> found = scheduleStore.findById(scheduleId);
        if (found.isEmpty() || !found.get().isActive) {
            LOG.infof("Schedule %s is missing or paused, nothing to do", scheduleId);
            return FiringResultType.skipped(scheduleId);
        }
        AutomationSchedule schedule = found.get();

        if (schedule.rssFeedId == null) {
            LOG.warnf("Schedule %s (%s) has no feed configured, nothing to do", schedule.id, schedule.name);
            return FiringResultType.skipped(scheduleId);
        }

        Span span = tracer.spanBuilder("schedule.fire").setAttribute("schedule_id", scheduleId.toString())
                .setAttribute("schedule_type", schedule.scheduleType.name()).startSpan();
        Instant startedAt = clock.instant();

        try (Scope scope = span.makeCurrent()) {
            LoggingConfig.enrichWithTraceContext();
            LoggingConfig.setScheduleId(scheduleId);
            LoggingConfig.setUserId(schedule.userId);

            FiringResultType result = seedJobs(schedule);
            recordRun(schedule, startedAt, result, null);

            span.setAttribute("items_found", result.itemsFound());
            span.setAttribute("jobs_created", result.jobsCreated());
            countFiring(result.success() ? "success" : "failure");
            Counter.builder("automation.schedule.jobs_created").register(meterRegistry)
                    .increment(result.jobsCreated());

            LOG.infof("Schedule %s fired: found=%d, created=%d, duplicates=%d, failed=%d", schedule.name,
                    result.itemsFound(), result.jobsCreated(), result.duplicatesSkipped(), result.itemsFailed());

            if (result.jobsCreated() > 0) {
                worker.signal();
            }
            return result;
        } catch (RuntimeException e) {
            LOG.errorf(e, "Schedule %s (%s) firing failed: %s", schedule.id, schedule.name, e.getMessage());
            recordRun(schedule, startedAt, new FiringResultType(scheduleId, 0, 0, 0, 0, false), e.getMessage());
            countFiring("error");
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, e.getMessage() != null ? e.getMessage() : e.getClass().getName());
            throw e;
        } finally {
            span.end();
            LoggingConfig.clearMDC();
        }
    }

    private FiringResultType seedJobs(AutomationSchedule schedule) {
        RssFeed feed = siteStore.findFeed(schedule.rssFeedId)
                .orElseThrow(() -> new ResourceNotFoundException("Feed not found: " + schedule.rssFeedId));

        FeedType feedData;
        try {
            feedData = feedReader.read(feed.url);
            siteStore.recordFeedFetch(feed.id, clock.instant(), null);
        } catch (FeedReadException e) {
            siteStore.recordFeedFetch(feed.id, clock.instant(), e.getMessage());
            throw e;
        }

        if (schedule.maxArticles != null && schedule.maxArticles > 0 && schedule.maxArticles <= 2) {
            LOG.warnf("Schedule %s has maxArticles=%d, only %d item(s) will be taken per run", schedule.name,
                    schedule.maxArticles, schedule.maxArticles);
        }
        List<FeedItemType> items = feedData.items();
        List<FeedItemType> batch = items.subList(0, Math.min(items.size(), schedule.effectiveMaxArticles()));

        int created = 0;
        int duplicates = 0;
        int failed = 0;
        for (FeedItemType item : batch) {
            if (item.link() == null) {
                LOG.debugf("Skipping feed item without link: %s", item.title());
                continue;
            }
            try {
                ArticleJob job = ArticleJob.forFeedItem(schedule.userId, schedule.siteId, schedule.rssFeedId,
                        schedule.id, item.link(), item.title());
                Optional<ArticleJob> saved = jobStore.createIfAbsent(job);
                if (saved.isPresent()) {
                    created++;
                } else {
                    duplicates++;
                    LOG.debugf("Item already has a job, skipping: %s", item.link());
                }
            } catch (RuntimeException e) {
                failed++;
                LOG.errorf(e, "Failed to create job for %s: %s", item.link(), e.getMessage());
            }
        }

        boolean success = created > 0 || failed == 0;
        return new FiringResultType(schedule.id, batch.size(), created, duplicates, failed, success);
    }

    private void recordRun(AutomationSchedule schedule, Instant startedAt, FiringResultType result,
            String errorMessage) {
        Instant completedAt = clock.instant();
        Instant nextRunAt = null;
        if (schedule.scheduleType != ScheduleType.ONCE) {
            nextRunAt = CronTriggers.nextFireTime(ScheduleTrigger.from(schedule), completedAt).orElse(null);
        }

        try {
            scheduleStore.recordRun(schedule.id, completedAt, result.success(), nextRunAt);
            if (schedule.scheduleType == ScheduleType.ONCE) {
                scheduleStore.update(schedule.id, s -> s.isActive = false);
            }

            AutomationExecution execution = new AutomationExecution();
            execution.scheduleId = schedule.id;
            execution.userId = schedule.userId;
            execution.startedAt = startedAt;
            execution.completedAt = completedAt;
            execution.status = result.success() ? ExecutionStatus.SUCCESS : ExecutionStatus.FAILED;
            execution.itemsFound = result.itemsFound();
            execution.jobsCreated = result.jobsCreated();
            execution.duplicatesSkipped = result.duplicatesSkipped();
            execution.itemsFailed = result.itemsFailed();
            execution.errorMessage = errorMessage;
            scheduleStore.recordExecution(execution);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to record run of schedule %s: %s", schedule.id, e.getMessage());
        }
    }

    private void countFiring(String result) {
        Counter.builder("automation.schedule.firings").tag("result", result).register(meterRegistry).increment();
    }
}
