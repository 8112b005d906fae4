package villagecompute.wpautomation.integration.feeds;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import com.github.tomakehurst.wiremock.client.WireMock;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import villagecompute.wpautomation.api.types.FeedItemType;
import villagecompute.wpautomation.api.types.FeedType;
import villagecompute.wpautomation.api.types.FeedValidationType;
import villagecompute.wpautomation.exceptions.FeedReadException;
import villagecompute.wpautomation.testing.WireMockTestBase;

/**
 * Tests for {@link FeedReader}: RSS and Atom normalization plus fetch error handling.
 */
class FeedReaderTest extends WireMockTestBase {

    private FeedReader reader;

    @BeforeEach
    void setUp() {
        reader = new FeedReader();
    }

    @Test
    void testParseRss_normalizesItemsInDocumentOrder() {
        FeedType feed = reader.parse(resource("feeds/sample-rss.xml"));

        assertEquals("Example Tech News", feed.title());
        assertEquals("https://news.example.com", feed.link());
        assertEquals(3, feed.items().size());

        FeedItemType first = feed.items().get(0);
        assertEquals("Edge computing goes mainstream", first.title());
        assertEquals("https://news.example.com/edge-computing", first.link());
        assertEquals("news-1001", first.guid());
        assertEquals(Instant.parse("2025-01-06T09:30:00Z"), first.publishedAt());
        assertEquals("Edge computing moves processing closer to users.", first.description());
        assertTrue(first.content().contains("Full article body"), "content:encoded should win over description");
        assertEquals(List.of("Cloud", "Infrastructure"), first.categories());
    }

    @Test
    void testParseRss_linkFallsBackToPermalinkGuid() {
        FeedItemType second = reader.parse(resource("feeds/sample-rss.xml")).items().get(1);

        assertEquals("https://news.example.com/quantum-networking", second.link());
        assertEquals("Researchers link two quantum nodes across a city.", second.content());
    }

    @Test
    void testParseRss_missingTitleBecomesUntitled() {
        FeedItemType third = reader.parse(resource("feeds/sample-rss.xml")).items().get(2);

        assertEquals("Untitled", third.title());
        assertNull(third.publishedAt());
        assertEquals(third.link(), third.guid(), "guid falls back to the link");
    }

    @Test
    void testParseAtom_usesUpdatedDateAndHtmlContent() {
        FeedType feed = reader.parse(resource("feeds/sample-atom.xml"));

        assertEquals("Example Engineering Blog", feed.title());
        assertEquals(1, feed.items().size());

        FeedItemType entry = feed.items().get(0);
        assertEquals("Scaling our job queue", entry.title());
        assertEquals("https://eng.example.com/scaling-job-queue", entry.link());
        assertEquals(Instant.parse("2025-01-06T10:00:00Z"), entry.publishedAt());
        assertEquals("How we moved to a single worker per process.", entry.description());
        assertTrue(entry.content().contains("The long version of the story."));
    }

    @Test
    void testParse_notAFeedThrows() {
        InputStream html = new ByteArrayInputStream(
                "<html><body>Not a feed</body></html>".getBytes(StandardCharsets.UTF_8));

        assertThrows(FeedReadException.class, () -> reader.parse(html));
    }

    @Test
    void testStripHtml_capsDescriptionLength() {
        String longHtml = "<p>" + "word ".repeat(200) + "</p>";

        String stripped = FeedReader.stripHtml(longHtml);

        assertEquals(FeedReader.MAX_DESCRIPTION_LENGTH, stripped.length());
        assertFalse(stripped.contains("<p>"));
    }

    @Test
    void testRead_fetchesOverHttpWithUserAgent() {
        stubFeed("/feed.xml", "feeds/sample-rss.xml");

        FeedType feed = reader.read(baseUrl() + "/feed.xml");

        assertEquals(3, feed.items().size());
        wireMockServer.verify(WireMock.getRequestedFor(WireMock.urlPathEqualTo("/feed.xml"))
                .withHeader("User-Agent", WireMock.equalTo(FeedReader.USER_AGENT)));
    }

    @Test
    void testRead_httpErrorThrows() {
        wireMockServer.stubFor(WireMock.get(WireMock.urlPathEqualTo("/missing.xml"))
                .willReturn(WireMock.aResponse().withStatus(404)));

        FeedReadException e = assertThrows(FeedReadException.class, () -> reader.read(baseUrl() + "/missing.xml"));
        assertTrue(e.getMessage().contains("HTTP 404"));
    }

    @Test
    void testRead_emptyFeedHasNoItems() {
        stubFeed("/quiet.xml", "feeds/empty-rss.xml");

        assertTrue(reader.read(baseUrl() + "/quiet.xml").items().isEmpty());
    }

    @Test
    void testFindItem_matchesLinkOrGuid() {
        stubFeed("/feed.xml", "feeds/sample-rss.xml");

        Optional<FeedItemType> byLink = reader.findItem(baseUrl() + "/feed.xml",
                "https://news.example.com/edge-computing");
        Optional<FeedItemType> missing = reader.findItem(baseUrl() + "/feed.xml", "https://elsewhere.example.com");

        assertTrue(byLink.isPresent());
        assertEquals("Edge computing goes mainstream", byLink.get().title());
        assertTrue(missing.isEmpty());
    }

    @Test
    void testValidate_reportsInvalidWithoutThrowing() {
        wireMockServer.stubFor(WireMock.get(WireMock.urlPathEqualTo("/broken.xml"))
                .willReturn(WireMock.aResponse().withStatus(500)));
        stubFeed("/feed.xml", "feeds/sample-rss.xml");

        FeedValidationType invalid = reader.validate(baseUrl() + "/broken.xml");
        FeedValidationType valid = reader.validate(baseUrl() + "/feed.xml");

        assertFalse(invalid.valid());
        assertTrue(invalid.error().contains("500"));
        assertTrue(valid.valid());
        assertEquals("Example Tech News", valid.title());
        assertEquals(3, valid.itemCount());
    }

    private InputStream resource(String path) {
        return getClass().getClassLoader().getResourceAsStream(path);
    }
}
