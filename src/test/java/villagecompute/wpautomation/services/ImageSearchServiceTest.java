package villagecompute.wpautomation.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import villagecompute.wpautomation.api.types.ImageCandidateType;
import villagecompute.wpautomation.api.types.ImageSearchQueryType;
import villagecompute.wpautomation.exceptions.ConfigurationException;
import villagecompute.wpautomation.exceptions.RateLimitException;
import villagecompute.wpautomation.exceptions.RemoteServiceException;
import villagecompute.wpautomation.integration.images.ImageSearchProvider;

class ImageSearchServiceTest {

    private static final ImageSearchQueryType QUERY = ImageSearchQueryType.of("edge computing", 1, 5);

    private ImageSearchProvider pexels;
    private ImageSearchProvider openverse;
    private ImageSearchProvider serper;
    private ImageSearchService service;

    @BeforeEach
    void setUp() {
        pexels = provider("pexels", true);
        openverse = provider("openverse", true);
        serper = provider("serper", false);

        service = new ImageSearchService();
        service.providers = List.of(pexels, openverse, serper);
        service.urlFilters = Optional.empty();
    }

    @Test
    void testSearch_mergesEnabledProvidersInOrder() {
        when(pexels.search(QUERY)).thenReturn(List.of(image("https://images.pexels.com/1.jpg", "pexels")));
        when(openverse.search(QUERY)).thenReturn(List.of(image("https://live.staticflickr.com/2.jpg", "openverse"),
                image("https://upload.wikimedia.org/3.jpg", "openverse")));

        List<ImageCandidateType> results = service.search(QUERY);

        assertEquals(3, results.size());
        assertEquals("pexels", results.get(0).provider());
        assertEquals("openverse", results.get(2).provider());
        verify(serper, never()).search(any());
    }

    @Test
    void testSearch_failedProviderIsLeftOut() {
        when(pexels.search(QUERY)).thenThrow(new RateLimitException("pexels API rate limit exceeded"));
        when(openverse.search(QUERY)).thenReturn(List.of(image("https://live.staticflickr.com/2.jpg", "openverse")));

        List<ImageCandidateType> results = service.search(QUERY);

        assertEquals(1, results.size());
        assertEquals("openverse", results.get(0).provider());
    }

    @Test
    void testSearch_allProvidersFailing() {
        when(pexels.search(QUERY)).thenThrow(new RemoteServiceException("Invalid pexels API key", 401));
        when(openverse.search(QUERY)).thenThrow(new RemoteServiceException("openverse API error: HTTP 500", 500));

        RemoteServiceException error = assertThrows(RemoteServiceException.class, () -> service.search(QUERY));
        assertTrue(error.getMessage().startsWith("All image providers failed"));
    }

    @Test
    void testSearch_emptyResultsAreNotAFailure() {
        when(pexels.search(QUERY)).thenReturn(List.of());
        when(openverse.search(QUERY)).thenThrow(new RemoteServiceException("openverse API error: HTTP 500", 500));

        assertTrue(service.search(QUERY).isEmpty());
    }

    @Test
    void testSearch_noEnabledProvider() {
        service.providers = List.of(serper);

        assertThrows(ConfigurationException.class, () -> service.search(QUERY));
        assertFalse(service.hasEnabledProvider());
    }

    @Test
    void testSearch_urlFiltersAreCaseInsensitiveSubstrings() {
        service.urlFilters = Optional.of(List.of("Shutterstock", " ", "gettyimages.com"));
        when(pexels.search(QUERY)).thenReturn(List.of(image("https://images.pexels.com/1.jpg", "pexels"),
                image("https://media.GettyImages.com/2.jpg", "pexels")));
        when(openverse.search(QUERY)).thenReturn(List.of(image("https://www.shutterstock.com/3.jpg", "openverse"),
                image(null, "openverse")));

        List<ImageCandidateType> results = service.search(QUERY);

        assertEquals(List.of("https://images.pexels.com/1.jpg"),
                results.stream().map(ImageCandidateType::url).toList());
    }

    private static ImageSearchProvider provider(String name, boolean enabled) {
        ImageSearchProvider provider = mock(ImageSearchProvider.class);
        when(provider.name()).thenReturn(name);
        when(provider.isEnabled()).thenReturn(enabled);
        return provider;
    }

    private static ImageCandidateType image(String url, String provider) {
        return new ImageCandidateType(url, url, 1200, 800, "Jane Doe", "CC BY 2.0", "Servers", null, provider);
    }
}
