package villagecompute.wpautomation.jobs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.trace.TracerProvider;

import villagecompute.wpautomation.api.types.FeedItemType;
import villagecompute.wpautomation.api.types.GeneratedArticleType;
import villagecompute.wpautomation.api.types.GeneratedArticleType.Degradation;
import villagecompute.wpautomation.api.types.GenerationRequestType;
import villagecompute.wpautomation.api.types.GenerationRequestType.RewriteStyle;
import villagecompute.wpautomation.api.types.ImageCandidateType;
import villagecompute.wpautomation.api.types.PublishResultType;
import villagecompute.wpautomation.data.models.ArticleJob;
import villagecompute.wpautomation.data.models.ArticleJob.JobStatus;
import villagecompute.wpautomation.data.models.AutomationSchedule;
import villagecompute.wpautomation.data.models.RssFeed;
import villagecompute.wpautomation.data.models.Site;
import villagecompute.wpautomation.exceptions.FeedReadException;
import villagecompute.wpautomation.exceptions.RemoteServiceException;
import villagecompute.wpautomation.integration.feeds.FeedReader;
import villagecompute.wpautomation.services.ArticleGenerationPipeline;
import villagecompute.wpautomation.services.WordPressPublishService;
import villagecompute.wpautomation.testing.InMemoryArticleJobStore;
import villagecompute.wpautomation.testing.InMemoryAutomationScheduleStore;
import villagecompute.wpautomation.testing.InMemorySiteStore;
import villagecompute.wpautomation.testing.TestFixtures;

/**
 * Unit tests for {@link ArticleJobWorker}: the per-job lifecycle, publish policy and failure handling.
 */
class ArticleJobWorkerTest {

    private static final Instant NOW = Instant.parse("2025-01-06T10:15:00Z");
    private static final String FEED_URL = "https://news.example.com/feed.xml";
    private static final String ITEM_URL = "https://news.example.com/story-1";

    @Mock
    ArticleGenerationPipeline pipeline;

    @Mock
    WordPressPublishService publishService;

    @Mock
    FeedReader feedReader;

    private InMemoryArticleJobStore jobStore;
    private InMemoryAutomationScheduleStore scheduleStore;
    private InMemorySiteStore siteStore;
    private SimpleMeterRegistry meterRegistry;
    private ArticleJobWorker worker;

    private Site site;
    private RssFeed feed;
    private UUID userId;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        jobStore = new InMemoryArticleJobStore();
        scheduleStore = new InMemoryAutomationScheduleStore();
        siteStore = new InMemorySiteStore();
        meterRegistry = new SimpleMeterRegistry();

        worker = new ArticleJobWorker();
        worker.jobStore = jobStore;
        worker.scheduleStore = scheduleStore;
        worker.siteStore = siteStore;
        worker.feedReader = feedReader;
        worker.pipeline = pipeline;
        worker.publishService = publishService;
        worker.clock = Clock.fixed(NOW, ZoneOffset.UTC);
        worker.meterRegistry = meterRegistry;
        worker.tracer = TracerProvider.noop().get("test");

        userId = UUID.randomUUID();
        site = siteStore.add(TestFixtures.site(userId));
        feed = siteStore.add(TestFixtures.feed(userId, FEED_URL));
    }

    @Test
    void testProcessNext_topicJobStopsAtGeneratedWithoutAutoPublish() {
        ArticleJob job = jobStore.create(ArticleJob.forTopic(userId, site.id, "Edge computing", false, "draft"));
        when(pipeline.generate(any())).thenReturn(article(List.of()));

        assertTrue(worker.processNext());

        ArticleJob stored = jobStore.findById(job.id).orElseThrow();
        assertEquals(JobStatus.GENERATED, stored.status);
        assertEquals("Edge Computing Explained", stored.generatedTitle);
        assertEquals("<p>Body</p>", stored.generatedContent);
        assertEquals(List.of("Technology"), stored.categories);
        assertEquals("https://images.example.com/edge.jpg", stored.featuredImageUrl);
        assertEquals(1200, stored.tokensUsed);
        assertEquals("claude-3-5-sonnet-20241022", stored.aiModel);
        assertFalse(stored.degraded);
        verify(publishService, never()).publish(any(), any(), anyString());
        assertEquals(1.0, meterRegistry.get("automation.jobs.processed").tag("result", "generated").counter().count());
    }

    @Test
    void testProcessNext_topicJobAutoPublishes() {
        ArticleJob job = jobStore.create(ArticleJob.forTopic(userId, site.id, "Edge computing", true, "publish"));
        GeneratedArticleType article = article(List.of());
        when(pipeline.generate(any())).thenReturn(article);
        when(publishService.publish(site, article, "publish"))
                .thenReturn(new PublishResultType(321L, "https://blog.example.com/?p=321", 55L));

        worker.processNext();

        ArticleJob stored = jobStore.findById(job.id).orElseThrow();
        assertEquals(JobStatus.PUBLISHED, stored.status);
        assertEquals(321L, stored.wpPostId);
        assertEquals(NOW, stored.publishedAt);
        assertEquals("publish", stored.publishStatus);
        assertEquals(1.0, meterRegistry.get("automation.jobs.processed").tag("result", "published").counter().count());
    }

    @Test
    void testProcessNext_rssJobUsesSchedulePolicyAndSourceBody() {
        AutomationSchedule schedule = TestFixtures.schedule(site, feed);
        schedule.autoPublish = true;
        schedule.publishStatus = "draft";
        scheduleStore.create(schedule);
        ArticleJob job = jobStore.create(
                ArticleJob.forFeedItem(userId, site.id, feed.id, schedule.id, ITEM_URL, "Quantum networking"));
        when(feedReader.findItem(FEED_URL, ITEM_URL)).thenReturn(Optional.of(new FeedItemType("Quantum networking",
                ITEM_URL, NOW, "Summary", "<p>Original body</p>", null, List.of(), ITEM_URL)));
        GeneratedArticleType article = article(List.of());
        when(pipeline.generate(any())).thenReturn(article);
        when(publishService.publish(site, article, "draft")).thenReturn(new PublishResultType(9L, null, null));

        worker.processNext();

        ArgumentCaptor<GenerationRequestType> request = ArgumentCaptor.forClass(GenerationRequestType.class);
        verify(pipeline).generate(request.capture());
        assertEquals("Quantum networking", request.getValue().input());
        assertEquals(ITEM_URL, request.getValue().sourceUrl());
        assertEquals("<p>Original body</p>", request.getValue().sourceBody());

        ArticleJob stored = jobStore.findById(job.id).orElseThrow();
        assertEquals(JobStatus.PUBLISHED, stored.status);
        assertEquals("draft", stored.publishStatus);
    }

    @Test
    void testProcessNext_selectedFeedItemUsesItsRewriteStyleAndPublishOptions() {
        AutomationSchedule schedule = TestFixtures.schedule(site, feed);
        schedule.autoPublish = false;
        scheduleStore.create(schedule);
        ArticleJob job = jobStore.create(ArticleJob.forSelectedFeedItem(userId, site.id, feed.id, ITEM_URL,
                "Quantum networking", RewriteStyle.SUMMARY, true, "publish"));
        when(feedReader.findItem(FEED_URL, ITEM_URL)).thenReturn(Optional.of(new FeedItemType("Quantum networking",
                ITEM_URL, NOW, "Summary", "<p>Original body</p>", null, List.of(), ITEM_URL)));
        GeneratedArticleType article = article(List.of());
        when(pipeline.generate(any())).thenReturn(article);
        when(publishService.publish(site, article, "publish")).thenReturn(new PublishResultType(77L, null, null));

        worker.processNext();

        ArgumentCaptor<GenerationRequestType> request = ArgumentCaptor.forClass(GenerationRequestType.class);
        verify(pipeline).generate(request.capture());
        assertEquals(RewriteStyle.SUMMARY, request.getValue().rewriteStyle());
        assertEquals("<p>Original body</p>", request.getValue().sourceBody());

        ArticleJob stored = jobStore.findById(job.id).orElseThrow();
        assertEquals(JobStatus.PUBLISHED, stored.status, "the active schedule's policy does not apply");
        assertEquals(77L, stored.wpPostId);
    }

    @Test
    void testProcessNext_scheduleJobHasNoRewriteStyle() {
        jobStore.create(ArticleJob.forFeedItem(userId, site.id, feed.id, null, ITEM_URL, "Quantum networking"));
        when(feedReader.findItem(FEED_URL, ITEM_URL)).thenReturn(Optional.empty());
        when(pipeline.generate(any())).thenReturn(article(List.of()));

        worker.processNext();

        ArgumentCaptor<GenerationRequestType> request = ArgumentCaptor.forClass(GenerationRequestType.class);
        verify(pipeline).generate(request.capture());
        assertNull(request.getValue().rewriteStyle());
    }

    @Test
    void testProcessNext_singleFlightUnderConcurrentCalls() throws Exception {
        ArticleJob job = ArticleJob.forTopic(userId, site.id, "Edge computing", false, "draft");
        job.createdAt = NOW.minusSeconds(60);
        jobStore.create(job);
        jobStore.create(ArticleJob.forTopic(userId, site.id, "Second topic", false, "draft"));
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(pipeline.generate(any())).thenAnswer(invocation -> {
            started.countDown();
            assertTrue(release.await(5, TimeUnit.SECONDS));
            return article(List.of());
        });

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<Boolean> first = executor.submit(worker::processNext);
            assertTrue(started.await(5, TimeUnit.SECONDS), "first call never reached the pipeline");

            assertTrue(worker.isProcessing());
            assertFalse(worker.processNext(), "second call must not start while the first is in flight");

            release.countDown();
            assertTrue(first.get(5, TimeUnit.SECONDS));
        } finally {
            release.countDown();
            executor.shutdownNow();
        }

        verify(pipeline, times(1)).generate(any());
        assertEquals(JobStatus.GENERATED, jobStore.findById(job.id).orElseThrow().status);
        assertFalse(worker.isProcessing());
    }

    @Test
    void testProcessNext_sourceBodyIsBestEffort() {
        jobStore.create(ArticleJob.forFeedItem(userId, site.id, feed.id, null, ITEM_URL, "Quantum networking"));
        when(feedReader.findItem(FEED_URL, ITEM_URL)).thenThrow(new FeedReadException("HTTP 500: " + FEED_URL));
        when(pipeline.generate(any())).thenReturn(article(List.of()));

        worker.processNext();

        ArgumentCaptor<GenerationRequestType> request = ArgumentCaptor.forClass(GenerationRequestType.class);
        verify(pipeline).generate(request.capture());
        assertNull(request.getValue().sourceBody());
        assertEquals(JobStatus.GENERATED, jobStore.all().get(0).status);
    }

    @Test
    void testProcessNext_generationFailureMarksJobFailed() {
        ArticleJob job = jobStore.create(ArticleJob.forTopic(userId, site.id, "Edge computing", false, "draft"));
        when(pipeline.generate(any())).thenThrow(new RemoteServiceException("Text generation failed: overloaded"));

        worker.processNext();

        ArticleJob stored = jobStore.findById(job.id).orElseThrow();
        assertEquals(JobStatus.FAILED, stored.status);
        assertEquals("Text generation failed: overloaded", stored.errorMessage);
        assertEquals(1.0, meterRegistry.get("automation.jobs.processed").tag("result", "failed").counter().count());
        assertNotNull(meterRegistry.get("automation.jobs.duration").timer());
    }

    @Test
    void testProcessNext_errorWithoutMessageUsesUnknownError() {
        ArticleJob job = jobStore.create(ArticleJob.forTopic(userId, site.id, "Edge computing", false, "draft"));
        when(pipeline.generate(any())).thenThrow(new IllegalStateException());

        worker.processNext();

        assertEquals(ArticleJobWorker.UNKNOWN_ERROR, jobStore.findById(job.id).orElseThrow().errorMessage);
    }

    @Test
    void testProcessNext_publishFailureLeavesNoPostId() {
        ArticleJob job = jobStore.create(ArticleJob.forTopic(userId, site.id, "Edge computing", true, "publish"));
        when(pipeline.generate(any())).thenReturn(article(List.of()));
        when(publishService.publish(eq(site), any(), eq("publish")))
                .thenThrow(new RemoteServiceException("WordPress API error 500: oops", 500));

        worker.processNext();

        ArticleJob stored = jobStore.findById(job.id).orElseThrow();
        assertEquals(JobStatus.FAILED, stored.status);
        assertNull(stored.wpPostId);
        assertEquals("WordPress API error 500: oops", stored.errorMessage);
        assertEquals("Edge Computing Explained", stored.generatedTitle, "generated fields survive a failed publish");
    }

    @Test
    void testProcessNext_cancelDuringGenerationWins() {
        ArticleJob job = jobStore.create(ArticleJob.forTopic(userId, site.id, "Edge computing", false, "draft"));
        when(pipeline.generate(any())).thenAnswer(invocation -> {
            jobStore.transition(job.id, JobStatus.FAILED, j -> j.errorMessage = "Cancelled by user");
            return article(List.of());
        });

        worker.processNext();

        ArticleJob stored = jobStore.findById(job.id).orElseThrow();
        assertEquals(JobStatus.FAILED, stored.status);
        assertEquals("Cancelled by user", stored.errorMessage);
        assertNull(stored.generatedTitle);
    }

    @Test
    void testProcessNext_degradedArticleIsStillGenerated() {
        ArticleJob job = jobStore.create(ArticleJob.forTopic(userId, site.id, "Edge computing", false, "draft"));
        when(pipeline.generate(any())).thenReturn(article(List.of(Degradation.NO_IMAGES)));

        worker.processNext();

        ArticleJob stored = jobStore.findById(job.id).orElseThrow();
        assertEquals(JobStatus.GENERATED, stored.status);
        assertTrue(stored.degraded);
    }

    @Test
    void testDrain_processesOldestFirstUntilEmpty() {
        ArticleJob newer = ArticleJob.forTopic(userId, site.id, "Newer", false, "draft");
        newer.createdAt = NOW;
        ArticleJob older = ArticleJob.forTopic(userId, site.id, "Older", false, "draft");
        older.createdAt = NOW.minusSeconds(600);
        jobStore.create(newer);
        jobStore.create(older);
        when(pipeline.generate(any())).thenReturn(article(List.of()));

        assertEquals(2, worker.drain());

        ArgumentCaptor<GenerationRequestType> requests = ArgumentCaptor.forClass(GenerationRequestType.class);
        verify(pipeline, times(2)).generate(requests.capture());
        assertEquals(List.of("Older", "Newer"), requests.getAllValues().stream().map(GenerationRequestType::input)
                .toList());
        assertFalse(worker.processNext(), "queue should be empty");
        assertFalse(worker.isProcessing());
    }

    @Test
    void testResolvePublishPolicy_rssJobFallsBackToActiveScheduleForFeed() {
        AutomationSchedule active = TestFixtures.schedule(site, feed);
        active.autoPublish = true;
        active.publishStatus = "publish";
        scheduleStore.create(active);
        ArticleJob orphan = ArticleJob.forFeedItem(userId, site.id, feed.id, UUID.randomUUID(), ITEM_URL, "Story");

        ArticleJobWorker.PublishPolicy policy = worker.resolvePublishPolicy(orphan);

        assertTrue(policy.autoPublish());
        assertEquals("publish", policy.status());
    }

    @Test
    void testResolvePublishPolicy_rssJobWithoutScheduleStaysDraft() {
        ArticleJob orphan = ArticleJob.forFeedItem(userId, site.id, UUID.randomUUID(), null, ITEM_URL, "Story");

        ArticleJobWorker.PublishPolicy policy = worker.resolvePublishPolicy(orphan);

        assertFalse(policy.autoPublish());
        assertEquals("draft", policy.status());
    }

    @Test
    void testStoredArticle_rebuildsPublishableArticle() {
        ArticleJob job = ArticleJob.forTopic(userId, site.id, "Edge computing", false, "draft");
        job.generatedTitle = "Title";
        job.generatedContent = "<p>Body</p>";
        job.featuredImageUrl = "https://images.example.com/a.jpg";

        GeneratedArticleType article = ArticleJobWorker.storedArticle(job);

        assertEquals("Title", article.title());
        assertEquals("https://images.example.com/a.jpg", article.featuredImage().url());
        assertTrue(article.categories().isEmpty());
        assertTrue(article.tags().isEmpty());
    }

    private static GeneratedArticleType article(List<Degradation> degradations) {
        ImageCandidateType featured = new ImageCandidateType("https://images.example.com/edge.jpg",
                "https://images.example.com/edge-thumb.jpg", 1200, 800, "Ana Photographer", "Pexels License",
                "Server rack", null, "pexels");
        return new GeneratedArticleType("Edge Computing Explained", "<p>Body</p>", "Body", "A short excerpt.",
                List.of("Technology"), List.of("edge", "cloud"), "What edge computing means for you.",
                List.of("edge computing"), featured, List.of(), 1200, new BigDecimal("0.012000"),
                "claude-3-5-sonnet-20241022", degradations);
    }
}
