package villagecompute.wpautomation.services;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import villagecompute.wpautomation.api.types.ArticleContentType;
import villagecompute.wpautomation.api.types.ArticleMetadataType;
import villagecompute.wpautomation.api.types.GeneratedArticleType;
import villagecompute.wpautomation.api.types.GeneratedArticleType.Degradation;
import villagecompute.wpautomation.api.types.GenerationRequestType;
import villagecompute.wpautomation.api.types.ImageCandidateType;
import villagecompute.wpautomation.api.types.ImageSearchQueryType;
import villagecompute.wpautomation.exceptions.ConfigurationException;
import villagecompute.wpautomation.exceptions.RemoteServiceException;
import villagecompute.wpautomation.services.ArticleMetadataService.MetadataResult;
import villagecompute.wpautomation.services.ArticleMetadataService.PhraseResult;
import villagecompute.wpautomation.services.ImagePlacementService.ImageSelection;

/**
 * Turns one generation request into a finished article.
 *
 * <p>
 * <b>Stages:</b>
 * <ol>
 * <li>Content (research service or multi-step drafting)</li>
 * <li>Metadata: categories, tags, SEO description and keywords</li>
 * <li>Image search phrases</li>
 * <li>Image acquisition: the first {@value #MAX_IMAGE_PHRASES} phrases, {@value #IMAGES_PER_PHRASE} results each</li>
 * <li>Placement: markdown rendered to HTML with inline figures</li>
 * </ol>
 * The content stage fails the request on error. Metadata, phrases and images fall back and are recorded as
 * {@link Degradation}s on the result. Publishing is not part of the pipeline.
 */
@ApplicationScoped
public class ArticleGenerationPipeline {

    private static final Logger LOG = Logger.getLogger(ArticleGenerationPipeline.class);

    static final int MAX_IMAGE_PHRASES = 3;
    static final int IMAGES_PER_PHRASE = 5;

    @Inject
    ArticleContentService contentService;

    @Inject
    ArticleMetadataService metadataService;

    @Inject
    ImageSearchService imageSearchService;

    @Inject
    ImagePlacementService placementService;

    public GeneratedArticleType generate(GenerationRequestType request) {
        List<Degradation> degradations = new ArrayList<>();

        LOG.debugf("Step 1: generating content for \"%s\"", request.input());
        ArticleContentType content = contentService.generate(request);
        int tokens = content.tokensUsed();
        BigDecimal cost = content.cost() != null ? content.cost() : BigDecimal.ZERO;

        LOG.debugf("Step 2: generating metadata for \"%s\"", content.title());
        MetadataResult metadataResult = metadataService.generateMetadata(request.userId(), content.title(),
                content.markdown());
        if (metadataResult.fallback()) {
            degradations.add(Degradation.METADATA_FALLBACK);
        }
        tokens += metadataResult.tokensUsed();
        cost = cost.add(metadataResult.cost());
        ArticleMetadataType metadata = metadataResult.metadata();

        LOG.debugf("Step 3: generating image search phrases");
        PhraseResult phraseResult = metadataService.generateImagePhrases(request.userId(), content.title(),
                content.markdown());
        if (phraseResult.fallback()) {
            degradations.add(Degradation.IMAGE_PHRASE_FALLBACK);
        }
        tokens += phraseResult.tokensUsed();
        cost = cost.add(phraseResult.cost());

        LOG.debugf("Step 4: fetching images for %s", phraseResult.phrases());
        List<ImageCandidateType> candidates = fetchImages(phraseResult.phrases());
        if (candidates.isEmpty()) {
            LOG.warnf("No images found for \"%s\", article will be generated without images", content.title());
            degradations.add(Degradation.NO_IMAGES);
        }

        LOG.debugf("Step 5: placing %d candidate image(s)", candidates.size());
        ImageSelection selection = placementService.select(candidates);
        String html = placementService.insertInlineImages(placementService.renderMarkdown(content.markdown()),
                selection.inline());

        if (!degradations.isEmpty()) {
            LOG.infof("Article \"%s\" generated with degradations %s", content.title(), degradations);
        }
        return new GeneratedArticleType(content.title(), html, content.markdown(), content.excerpt(),
                metadata.categories(), metadata.tags(), metadata.seoDescription(), metadata.seoKeywords(),
                selection.featured(), selection.inline(), tokens, cost, content.model(), List.copyOf(degradations));
    }

    private List<ImageCandidateType> fetchImages(List<String> phrases) {
        List<ImageCandidateType> images = new ArrayList<>();
        for (String phrase : phrases.subList(0, Math.min(MAX_IMAGE_PHRASES, phrases.size()))) {
            try {
                images.addAll(imageSearchService.search(ImageSearchQueryType.of(phrase, 1, IMAGES_PER_PHRASE)));
            } catch (ConfigurationException e) {
                LOG.warnf("Image providers not configured, skipping image search: %s", e.getMessage());
                break;
            } catch (RemoteServiceException e) {
                LOG.warnf("Failed to fetch images for phrase \"%s\": %s", phrase, e.getMessage());
            }
        }
        return images;
    }
}
