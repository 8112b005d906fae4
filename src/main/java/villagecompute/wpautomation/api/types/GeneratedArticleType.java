package villagecompute.wpautomation.api.types;

import java.math.BigDecimal;
import java.util.List;

/**
 * A finished article ready for publishing.
 *
 * <p>
 * {@code content} is rendered HTML with the inline images already placed; {@code markdown} is the body as generated.
 * {@code degradations} lists every fallback path taken while building the article, and {@link #degraded()} is true
 * when it is non-empty.
 */
public record GeneratedArticleType(String title, String content, String markdown, String excerpt,
        List<String> categories, List<String> tags, String seoDescription, List<String> seoKeywords,
        ImageCandidateType featuredImage, List<ImageCandidateType> inlineImages, int tokensUsed, BigDecimal cost,
        String model, List<Degradation> degradations) {

    /**
     * Fallback paths the pipeline can take instead of failing the job.
     */
    public enum Degradation {
        METADATA_FALLBACK,
        IMAGE_PHRASE_FALLBACK,
        NO_IMAGES
    }

    public boolean degraded() {
        return degradations != null && !degradations.isEmpty();
    }
}
