package villagecompute.wpautomation.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import villagecompute.wpautomation.api.types.PublishResultType;
import villagecompute.wpautomation.api.types.ScheduledPostRequestType;
import villagecompute.wpautomation.data.models.ScheduledPost;
import villagecompute.wpautomation.data.models.ScheduledPost.PostStatus;
import villagecompute.wpautomation.data.models.Site;
import villagecompute.wpautomation.exceptions.InvalidStateTransitionException;
import villagecompute.wpautomation.exceptions.RemoteServiceException;
import villagecompute.wpautomation.exceptions.ResourceNotFoundException;
import villagecompute.wpautomation.exceptions.ValidationException;
import villagecompute.wpautomation.testing.InMemoryScheduledPostStore;
import villagecompute.wpautomation.testing.InMemorySiteStore;
import villagecompute.wpautomation.testing.TestFixtures;

/**
 * Unit tests for {@link ScheduledPostService}. New York is on EDT (UTC-4) at {@link #NOW}.
 */
class ScheduledPostServiceTest {

    private static final Instant NOW = Instant.parse("2025-03-10T14:00:00Z");
    private static final String NEW_YORK = "America/New_York";

    @Mock
    WordPressPublishService publishService;

    private InMemoryScheduledPostStore postStore;
    private SimpleMeterRegistry meterRegistry;
    private ScheduledPostService service;
    private UUID userId;
    private Site site;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        postStore = new InMemoryScheduledPostStore();
        InMemorySiteStore siteStore = new InMemorySiteStore();
        meterRegistry = new SimpleMeterRegistry();

        service = new ScheduledPostService();
        service.postStore = postStore;
        service.siteStore = siteStore;
        service.publishService = publishService;
        service.clock = Clock.fixed(NOW, ZoneOffset.UTC);
        service.meterRegistry = meterRegistry;
        service.defaultTimezone = "UTC";
        service.batchSize = 100;

        userId = UUID.randomUUID();
        site = siteStore.add(TestFixtures.site(userId));
    }

    @Test
    void testSchedule_convertsLocalTimeFromItsTimezone() {
        ScheduledPost post = service.schedule(userId, request("Launch Day", LocalDateTime.of(2025, 3, 10, 9, 30),
                NEW_YORK));

        assertEquals(Instant.parse("2025-03-10T13:30:00Z"), post.scheduledFor);
        assertEquals(NEW_YORK, post.timezone);
        assertEquals(PostStatus.PENDING, post.status);
        assertEquals(0, post.attempts);
        assertEquals(List.of(4L), post.categoryIds);

        ScheduledPost utc = service.schedule(userId, request("Later", LocalDateTime.of(2025, 3, 10, 9, 30), null));
        assertEquals(Instant.parse("2025-03-10T09:30:00Z"), utc.scheduledFor, "no timezone means the default");
        assertEquals("UTC", utc.timezone);
    }

    @Test
    void testSchedule_rejectsBadInput() {
        LocalDateTime time = LocalDateTime.of(2025, 3, 11, 8, 0);
        assertThrows(ValidationException.class, () -> service.schedule(userId, request(" ", time, NEW_YORK)));
        assertThrows(ValidationException.class, () -> service.schedule(userId, request("Title", null, NEW_YORK)));
        assertThrows(ValidationException.class, () -> service.schedule(userId, request("Title", time, "Mars/Base")));
        assertThrows(ResourceNotFoundException.class,
                () -> service.schedule(UUID.randomUUID(), request("Title", time, NEW_YORK)));
        assertTrue(service.list(userId, null, null, 0, 20).isEmpty());
    }

    @Test
    void testPublishDue_publishesOnlyPostsWhoseTimeHasPassed() {
        ScheduledPost due = service.schedule(userId, request("Due", LocalDateTime.of(2025, 3, 10, 9, 30), NEW_YORK));
        ScheduledPost future = service.schedule(userId,
                request("Future", LocalDateTime.of(2025, 3, 10, 12, 0), NEW_YORK));
        when(publishService.publishScheduled(eq(site), any())).thenAnswer(invocation -> {
            ScheduledPost claimed = invocation.getArgument(1);
            assertEquals(PostStatus.PUBLISHING, claimed.status, "post is claimed before the remote call");
            return new PublishResultType(501L, "https://blog.example.com/?p=501", null);
        });

        assertEquals(1, service.publishDue());

        ScheduledPost published = postStore.findById(due.id).orElseThrow();
        assertEquals(PostStatus.PUBLISHED, published.status);
        assertEquals(501L, published.wpPostId);
        assertEquals(NOW, published.publishedAt);
        assertEquals(1, published.attempts);
        assertEquals(PostStatus.PENDING, postStore.findById(future.id).orElseThrow().status);
        verify(publishService, times(1)).publishScheduled(eq(site), any());
        assertEquals(1.0, meterRegistry.get("automation.scheduled_posts.published").tag("result", "published")
                .counter().count());

        assertEquals(0, service.publishDue(), "published posts are not sent again");
    }

    @Test
    void testPublishDue_failureIsRecordedAndNotRetriedUntilRescheduled() {
        ScheduledPost post = service.schedule(userId, request("Due", LocalDateTime.of(2025, 3, 10, 9, 0), NEW_YORK));
        when(publishService.publishScheduled(eq(site), any()))
                .thenThrow(new RemoteServiceException("WordPress API error 500: oops", 500));

        assertEquals(1, service.publishDue());

        ScheduledPost failed = postStore.findById(post.id).orElseThrow();
        assertEquals(PostStatus.FAILED, failed.status);
        assertEquals("WordPress API error 500: oops", failed.lastError);
        assertEquals(1, failed.attempts);
        assertNull(failed.wpPostId);
        assertEquals(0, service.publishDue());

        ScheduledPost rescheduled = service.reschedule(userId, post.id, LocalDateTime.of(2025, 3, 10, 9, 45), null);

        assertEquals(PostStatus.PENDING, rescheduled.status);
        assertEquals(0, rescheduled.attempts);
        assertNull(rescheduled.lastError);
        assertEquals(Instant.parse("2025-03-10T13:45:00Z"), rescheduled.scheduledFor, "keeps the post's timezone");
    }

    @Test
    void testUpdate_changesPendingPostAndReadsTimeInNewTimezone() {
        ScheduledPost post = service.schedule(userId,
                request("Original", LocalDateTime.of(2025, 3, 12, 9, 0), NEW_YORK));

        ScheduledPost updated = service.update(userId, post.id, new ScheduledPostRequestType(null, null,
                "<p>New body</p>", null, null, List.of(8L), null, LocalDateTime.of(2025, 3, 12, 9, 0),
                "Europe/London"));

        assertEquals("Original", updated.title, "null fields keep their value");
        assertEquals("<p>New body</p>", updated.content);
        assertEquals(List.of(4L), updated.categoryIds);
        assertEquals(List.of(8L), updated.tagIds);
        assertEquals("Europe/London", updated.timezone);
        assertEquals(Instant.parse("2025-03-12T09:00:00Z"), updated.scheduledFor);

        service.cancel(userId, post.id);
        assertThrows(InvalidStateTransitionException.class, () -> service.update(userId, post.id,
                new ScheduledPostRequestType(null, "Too late", null, null, null, null, null, null, null)));
        assertEquals("Original", postStore.findById(post.id).orElseThrow().title);
    }

    @Test
    void testPublishNow_ignoresTimeAndRejectsPublishedPost() {
        ScheduledPost post = service.schedule(userId,
                request("Next week", LocalDateTime.of(2025, 3, 17, 9, 0), NEW_YORK));
        when(publishService.publishScheduled(eq(site), any()))
                .thenReturn(new PublishResultType(777L, "https://blog.example.com/?p=777", null));

        ScheduledPost published = service.publishNow(userId, post.id);

        assertEquals(PostStatus.PUBLISHED, published.status);
        assertEquals(777L, published.wpPostId);
        InvalidStateTransitionException e = assertThrows(InvalidStateTransitionException.class,
                () -> service.publishNow(userId, post.id));
        assertEquals("Post is already published", e.getMessage());
        assertThrows(InvalidStateTransitionException.class,
                () -> service.reschedule(userId, post.id, LocalDateTime.of(2025, 3, 18, 9, 0), null));
        assertThrows(InvalidStateTransitionException.class, () -> service.cancel(userId, post.id));
        verify(publishService, times(1)).publishScheduled(any(), any());
    }

    @Test
    void testPublishNow_failureReturnsFailedPost() {
        ScheduledPost post = service.schedule(userId,
                request("Next week", LocalDateTime.of(2025, 3, 17, 9, 0), NEW_YORK));
        when(publishService.publishScheduled(eq(site), any())).thenThrow(new IllegalStateException());

        ScheduledPost failed = service.publishNow(userId, post.id);

        assertEquals(PostStatus.FAILED, failed.status);
        assertEquals(ScheduledPostService.UNKNOWN_ERROR, failed.lastError);
        assertEquals(1.0, meterRegistry.get("automation.scheduled_posts.published").tag("result", "failed")
                .counter().count());
    }

    @Test
    void testCancel_cancelledPostIsNeverDispatched() {
        ScheduledPost post = service.schedule(userId, request("Due", LocalDateTime.of(2025, 3, 10, 8, 0), NEW_YORK));

        assertEquals(PostStatus.CANCELLED, service.cancel(userId, post.id).status);
        assertEquals(0, service.publishDue());
        verify(publishService, never()).publishScheduled(any(), any());
    }

    @Test
    void testListAndDelete_areScopedToTheOwner() {
        ScheduledPost later = service.schedule(userId, request("Later", LocalDateTime.of(2025, 3, 20, 9, 0), null));
        ScheduledPost sooner = service.schedule(userId, request("Sooner", LocalDateTime.of(2025, 3, 15, 9, 0), null));
        service.cancel(userId, later.id);

        assertEquals(List.of(sooner.id, later.id),
                service.list(userId, site.id, null, 0, 20).stream().map(p -> p.id).toList());
        assertEquals(List.of(later.id),
                service.list(userId, null, PostStatus.CANCELLED, 0, 20).stream().map(p -> p.id).toList());
        assertTrue(service.list(UUID.randomUUID(), null, null, 0, 20).isEmpty());

        assertThrows(ResourceNotFoundException.class, () -> service.delete(UUID.randomUUID(), sooner.id));
        service.delete(userId, sooner.id);
        assertThrows(ResourceNotFoundException.class, () -> service.get(userId, sooner.id));
    }

    private ScheduledPostRequestType request(String title, LocalDateTime scheduledFor, String timezone) {
        return new ScheduledPostRequestType(site.id, title, "<p>Body</p>", "Excerpt", List.of(4L), List.of(),
                null, scheduledFor, timezone);
    }
}
