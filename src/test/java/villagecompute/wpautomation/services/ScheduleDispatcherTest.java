package villagecompute.wpautomation.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.trace.TracerProvider;

import villagecompute.wpautomation.api.types.FeedItemType;
import villagecompute.wpautomation.api.types.FeedType;
import villagecompute.wpautomation.api.types.FiringResultType;
import villagecompute.wpautomation.data.models.ArticleJob;
import villagecompute.wpautomation.data.models.ArticleJob.JobStatus;
import villagecompute.wpautomation.data.models.ArticleJob.SourceType;
import villagecompute.wpautomation.data.models.AutomationExecution;
import villagecompute.wpautomation.data.models.AutomationExecution.ExecutionStatus;
import villagecompute.wpautomation.data.models.AutomationSchedule;
import villagecompute.wpautomation.data.models.AutomationSchedule.ScheduleType;
import villagecompute.wpautomation.data.models.RssFeed;
import villagecompute.wpautomation.data.models.Site;
import villagecompute.wpautomation.exceptions.FeedReadException;
import villagecompute.wpautomation.integration.feeds.FeedReader;
import villagecompute.wpautomation.jobs.ArticleJobWorker;
import villagecompute.wpautomation.testing.InMemoryArticleJobStore;
import villagecompute.wpautomation.testing.InMemoryAutomationScheduleStore;
import villagecompute.wpautomation.testing.InMemorySiteStore;
import villagecompute.wpautomation.testing.TestFixtures;

/**
 * Unit tests for {@link ScheduleDispatcher}: feed seeding, dedup, run accounting and error paths.
 */
class ScheduleDispatcherTest {

    private static final Instant NOW = Instant.parse("2025-01-06T10:15:00Z");
    private static final String FEED_URL = "https://news.example.com/feed.xml";

    private InMemoryAutomationScheduleStore scheduleStore;
    private InMemoryArticleJobStore jobStore;
    private InMemorySiteStore siteStore;
    private FeedReader feedReader;
    private ArticleJobWorker worker;
    private SimpleMeterRegistry meterRegistry;
    private ScheduleDispatcher dispatcher;

    private Site site;
    private RssFeed feed;
    private AutomationSchedule schedule;

    @BeforeEach
    void setUp() {
        scheduleStore = new InMemoryAutomationScheduleStore();
        jobStore = new InMemoryArticleJobStore();
        siteStore = new InMemorySiteStore();
        feedReader = mock(FeedReader.class);
        worker = mock(ArticleJobWorker.class);
        meterRegistry = new SimpleMeterRegistry();

        dispatcher = new ScheduleDispatcher();
        dispatcher.scheduleStore = scheduleStore;
        dispatcher.jobStore = jobStore;
        dispatcher.siteStore = siteStore;
        dispatcher.feedReader = feedReader;
        dispatcher.worker = worker;
        dispatcher.clock = Clock.fixed(NOW, ZoneOffset.UTC);
        dispatcher.meterRegistry = meterRegistry;
        dispatcher.tracer = TracerProvider.noop().get("test");

        UUID userId = UUID.randomUUID();
        site = siteStore.add(TestFixtures.site(userId));
        feed = siteStore.add(TestFixtures.feed(userId, FEED_URL));
        schedule = scheduleStore.create(TestFixtures.schedule(site, feed));
    }

    @Test
    void testFire_createsPendingJobsForNewItems() {
        when(feedReader.read(FEED_URL)).thenReturn(feedOf(3));

        FiringResultType result = dispatcher.fire(schedule.id);

        assertTrue(result.success());
        assertEquals(3, result.itemsFound());
        assertEquals(3, result.jobsCreated());
        assertEquals(0, result.duplicatesSkipped());

        List<ArticleJob> jobs = jobStore.all();
        assertEquals(3, jobs.size());
        ArticleJob job = jobs.get(0);
        assertEquals(JobStatus.PENDING, job.status);
        assertEquals(SourceType.RSS, job.sourceType);
        assertEquals(schedule.id, job.scheduleId);
        assertEquals(feed.id, job.rssFeedId);
        assertEquals(site.id, job.siteId);

        verify(worker).signal();
        assertEquals(3.0, meterRegistry.get("automation.schedule.jobs_created").counter().count());
        assertEquals(1.0,
                meterRegistry.get("automation.schedule.firings").tag("result", "success").counter().count());
    }

    @Test
    void testFire_recordsRunAndHistory() {
        when(feedReader.read(FEED_URL)).thenReturn(feedOf(2));

        dispatcher.fire(schedule.id);

        AutomationSchedule updated = scheduleStore.findById(schedule.id).orElseThrow();
        assertEquals(1, updated.totalRuns);
        assertEquals(1, updated.successfulRuns);
        assertEquals(NOW, updated.lastRunAt);
        assertEquals(NOW.truncatedTo(ChronoUnit.HOURS).plus(1, ChronoUnit.HOURS), updated.nextRunAt);

        List<AutomationExecution> history = scheduleStore.listExecutions(schedule.id, 0, 10);
        assertEquals(1, history.size());
        assertEquals(ExecutionStatus.SUCCESS, history.get(0).status);
        assertEquals(2, history.get(0).jobsCreated);

        assertEquals(NOW, feed.lastFetchedAt);
        assertNull(feed.lastError);
    }

    @Test
    void testFire_secondFiringSkipsItemsAlreadySeen() {
        when(feedReader.read(FEED_URL)).thenReturn(feedOf(2), feedOf(3));

        dispatcher.fire(schedule.id);
        FiringResultType second = dispatcher.fire(schedule.id);

        assertTrue(second.success());
        assertEquals(1, second.jobsCreated());
        assertEquals(2, second.duplicatesSkipped());
        assertEquals(3, jobStore.all().size());
        verify(worker, times(2)).signal();
    }

    @Test
    void testFire_duplicatesIgnoreJobStatus() {
        when(feedReader.read(FEED_URL)).thenReturn(feedOf(1));
        dispatcher.fire(schedule.id);
        ArticleJob job = jobStore.all().get(0);
        jobStore.transition(job.id, JobStatus.FAILED, j -> j.errorMessage = "boom");

        FiringResultType again = dispatcher.fire(schedule.id);

        assertEquals(0, again.jobsCreated());
        assertEquals(1, again.duplicatesSkipped());
        assertTrue(again.success(), "a run that only finds known items is still successful");
    }

    @Test
    void testFire_capsItemsAtMaxArticles() {
        schedule.maxArticles = 2;
        when(feedReader.read(FEED_URL)).thenReturn(feedOf(5));

        FiringResultType result = dispatcher.fire(schedule.id);

        assertEquals(2, result.itemsFound());
        assertEquals(2, result.jobsCreated());
        List<String> links = jobStore.all().stream().map(job -> job.sourceUrl).sorted().toList();
        assertEquals(List.of(link(0), link(1)), links, "items are taken in feed order");
    }

    @Test
    void testFire_skipsItemsWithoutLink() {
        List<FeedItemType> items = new ArrayList<>(feedOf(1).items());
        items.add(new FeedItemType("No link", null, null, null, null, null, List.of(), null));
        when(feedReader.read(FEED_URL)).thenReturn(new FeedType("News", null, null, null, null, items));

        FiringResultType result = dispatcher.fire(schedule.id);

        assertEquals(1, result.jobsCreated());
        assertEquals(1, jobStore.all().size());
    }

    @Test
    void testFire_emptyFeedIsSuccessfulRun() {
        when(feedReader.read(FEED_URL)).thenReturn(feedOf(0));

        FiringResultType result = dispatcher.fire(schedule.id);

        assertTrue(result.success());
        assertEquals(0, result.jobsCreated());
        assertEquals(1, scheduleStore.findById(schedule.id).orElseThrow().successfulRuns);
        verify(worker, never()).signal();
    }

    @Test
    void testFire_feedErrorCountsFailedRunAndPropagates() {
        when(feedReader.read(FEED_URL)).thenThrow(new FeedReadException("HTTP 503: " + FEED_URL));

        assertThrows(FeedReadException.class, () -> dispatcher.fire(schedule.id));

        AutomationSchedule updated = scheduleStore.findById(schedule.id).orElseThrow();
        assertEquals(1, updated.totalRuns);
        assertEquals(1, updated.failedRuns);
        AutomationExecution execution = scheduleStore.listExecutions(schedule.id, 0, 10).get(0);
        assertEquals(ExecutionStatus.FAILED, execution.status);
        assertTrue(execution.errorMessage.contains("HTTP 503"));
        assertEquals("HTTP 503: " + FEED_URL, feed.lastError);
        assertEquals(1.0, meterRegistry.get("automation.schedule.firings").tag("result", "error").counter().count());
    }

    @Test
    void testFire_pausedScheduleIsNoOp() {
        schedule.isActive = false;

        FiringResultType result = dispatcher.fire(schedule.id);

        assertEquals(0, result.itemsFound());
        assertEquals(0, scheduleStore.findById(schedule.id).orElseThrow().totalRuns);
        verify(feedReader, never()).read(anyString());
    }

    @Test
    void testFire_missingScheduleIsNoOp() {
        FiringResultType result = dispatcher.fire(UUID.randomUUID());

        assertTrue(result.success());
        assertEquals(0, result.jobsCreated());
        verify(feedReader, never()).read(anyString());
    }

    @Test
    void testFire_scheduleWithoutFeedIsNoOp() {
        AutomationSchedule feedless = scheduleStore.create(TestFixtures.schedule(site, null));

        FiringResultType result = dispatcher.fire(feedless.id);

        assertEquals(0, result.itemsFound());
        assertTrue(scheduleStore.listExecutions(feedless.id, 0, 10).isEmpty());
    }

    @Test
    void testFire_onceScheduleIsDeactivatedAfterRun() {
        schedule.scheduleType = ScheduleType.ONCE;
        schedule.cronExpression = null;
        schedule.scheduledFor = NOW.minusSeconds(60);
        when(feedReader.read(FEED_URL)).thenReturn(feedOf(1));

        dispatcher.fire(schedule.id);

        AutomationSchedule updated = scheduleStore.findById(schedule.id).orElseThrow();
        assertFalse(updated.isActive);
        assertNull(updated.nextRunAt);
        assertEquals(1, updated.totalRuns);
        assertNotNull(updated.lastRunAt);
    }

    private static FeedType feedOf(int count) {
        List<FeedItemType> items = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            items.add(new FeedItemType("Story " + i, link(i), NOW, "Summary " + i, "<p>Body " + i + "</p>", null,
                    List.of(), link(i)));
        }
        return new FeedType("News", "Daily news", "https://news.example.com", "en", NOW, items);
    }

    private static String link(int i) {
        return "https://news.example.com/story-" + i;
    }
}
