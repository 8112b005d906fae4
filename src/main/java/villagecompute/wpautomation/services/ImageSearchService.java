package villagecompute.wpautomation.services;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import villagecompute.wpautomation.api.types.ImageCandidateType;
import villagecompute.wpautomation.api.types.ImageSearchQueryType;
import villagecompute.wpautomation.exceptions.ConfigurationException;
import villagecompute.wpautomation.exceptions.RemoteServiceException;
import villagecompute.wpautomation.integration.images.ImageSearchProvider;

/**
 * Fans an image query out to every enabled provider in parallel and merges the results.
 *
 * <p>
 * A provider that fails is logged and left out; the search only fails when every enabled provider failed. Results whose
 * URL contains one of the configured {@code images.url-filters} patterns (case-insensitive) are dropped.
 */
@ApplicationScoped
public class ImageSearchService {

    private static final Logger LOG = Logger.getLogger(ImageSearchService.class);

    @Inject
    Instance<ImageSearchProvider> providerBeans;

    @ConfigProperty(
            name = "images.url-filters")
    Optional<List<String>> urlFilters;

    List<ImageSearchProvider> providers;

    @PostConstruct
    void init() {
        providers = providerBeans.stream().toList();
        LOG.infof("Image providers enabled: %s",
                providers.stream().filter(ImageSearchProvider::isEnabled).map(ImageSearchProvider::name).toList());
    }

    /**
     * @throws ConfigurationException
     *             if no provider is enabled
     * @throws RemoteServiceException
     *             if every enabled provider failed
     */
    public List<ImageCandidateType> search(ImageSearchQueryType query) {
        List<ImageSearchProvider> enabled = providers.stream().filter(ImageSearchProvider::isEnabled).toList();
        if (enabled.isEmpty()) {
            throw new ConfigurationException(
                    "No image providers configured. Add an API key for at least one provider.");
        }

        List<CompletableFuture<List<ImageCandidateType>>> futures = new ArrayList<>();
        for (ImageSearchProvider provider : enabled) {
            futures.add(CompletableFuture.supplyAsync(() -> provider.search(query)).handle((results, error) -> {
                if (error != null) {
                    Throwable cause = error instanceof CompletionException && error.getCause() != null
                            ? error.getCause()
                            : error;
                    LOG.warnf("Image search on %s failed for '%s': %s", provider.name(), query.query(),
                            cause.getMessage());
                    return null;
                }
                return results;
            }));
        }

        List<ImageCandidateType> merged = new ArrayList<>();
        int succeeded = 0;
        for (CompletableFuture<List<ImageCandidateType>> future : futures) {
            List<ImageCandidateType> results = future.join();
            if (results != null) {
                succeeded++;
                merged.addAll(results);
            }
        }
        if (succeeded == 0) {
            throw new RemoteServiceException("All image providers failed. Please check your API keys and try again.");
        }

        List<ImageCandidateType> filtered = applyUrlFilters(merged);
        LOG.debugf("Image search '%s': %d results from %d provider(s), %d filtered out", query.query(),
                merged.size(), succeeded, merged.size() - filtered.size());
        return filtered;
    }

    public boolean hasEnabledProvider() {
        return providers.stream().anyMatch(ImageSearchProvider::isEnabled);
    }

    List<ImageCandidateType> applyUrlFilters(List<ImageCandidateType> candidates) {
        List<String> patterns = urlFilters.orElse(List.of()).stream().filter(p -> p != null && !p.isBlank())
                .map(p -> p.trim().toLowerCase(Locale.ROOT)).toList();
        if (patterns.isEmpty()) {
            return candidates;
        }
        return candidates.stream().filter(candidate -> {
            if (candidate.url() == null) {
                return false;
            }
            String url = candidate.url().toLowerCase(Locale.ROOT);
            boolean blocked = patterns.stream().anyMatch(url::contains);
            if (blocked) {
                LOG.debugf("Filtered out image from %s: %s", candidate.provider(), candidate.url());
            }
            return !blocked;
        }).toList();
    }
}
