package villagecompute.wpautomation.services;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import villagecompute.wpautomation.api.types.ArticleMetadataType;
import villagecompute.wpautomation.api.types.TextGenerationOptionsType;
import villagecompute.wpautomation.api.types.TextGenerationResultType;

/**
 * Derives taxonomy, SEO fields and image search phrases from a drafted article.
 *
 * <p>
 * Both derivations degrade on an unusable response: safe defaults are returned and the result is marked
 * {@code fallback}. A failed call (timeout, provider error, token limit) propagates and fails the job.
 */
@ApplicationScoped
public class ArticleMetadataService {

    private static final Logger LOG = Logger.getLogger(ArticleMetadataService.class);

    public static final List<String> FALLBACK_IMAGE_PHRASES = List.of("stock photo", "business", "technology");

    static final int PHRASE_CONTENT_PREVIEW = 2000;
    private static final int METADATA_CONTENT_PREVIEW = 4000;

    @Inject
    TextGenerationService textGeneration;

    @Inject
    ObjectMapper objectMapper;

    public record MetadataResult(ArticleMetadataType metadata, boolean fallback, int tokensUsed, BigDecimal cost) {
    }

    public record PhraseResult(List<String> phrases, boolean fallback, int tokensUsed, BigDecimal cost) {
    }

    public MetadataResult generateMetadata(UUID userId, String title, String content) {
        String system = """
                You are an SEO specialist for a WordPress blog. Analyze the article and respond with ONLY valid JSON \
                in this exact format (no markdown, no explanation):
                {
                  "categories": ["2-3 broad blog categories"],
                  "tags": ["5-8 specific tags"],
                  "seoDescription": "meta description of at most 160 characters",
                  "seoKeywords": ["3-5 focus keywords"]
                }""";
        String user = "Title: " + title + "\n\nContent:\n" + preview(content, METADATA_CONTENT_PREVIEW);

        TextGenerationResultType result = textGeneration.generate(userId,
                TextGenerationService.FEATURE_ARTICLE_METADATA, system, user, TextGenerationOptionsType.of(0.3, 500));

        try {
            ArticleMetadataType parsed = normalize(
                    objectMapper.readValue(stripCodeFences(result.content()), ArticleMetadataType.class));
            return new MetadataResult(parsed, false, result.tokensUsed(), result.cost());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            LOG.warnf("Failed to parse metadata JSON for \"%s\": %s", title, e.getMessage());
            LOG.debugf("Raw metadata response: %s", result.content());
            return new MetadataResult(ArticleMetadataType.fallback(title), true, result.tokensUsed(), result.cost());
        }
    }

    public PhraseResult generateImagePhrases(UUID userId, String title, String content) {
        String system = """
                You extract specific names, people, places and events from article content to build precise image \
                search terms. Generate 3-5 search terms of 2-10 words each that combine an actual name or event from \
                the article with what is happening (for example "Serena Williams tennis match" or "Times Square New \
                Year celebration"). Never generalize names into words like "celebrity" or "athlete". If the article \
                names nobody, describe its most specific scenes instead.
                Return ONLY a JSON array of strings.""";
        String preview = preview(content, PHRASE_CONTENT_PREVIEW);
        String user = "Title: " + (title != null ? title : "Untitled") + "\n\nContent:\n" + preview
                + (content != null && content.length() > PHRASE_CONTENT_PREVIEW ? "..." : "");

        TextGenerationResultType result = textGeneration.generate(userId, TextGenerationService.FEATURE_IMAGE_PHRASES,
                system, user, TextGenerationOptionsType.of(0.5, 300));

        List<String> phrases = parsePhrases(result.content());
        if (phrases.isEmpty()) {
            LOG.warnf("No usable image phrases for \"%s\", using generic phrases", title);
            return new PhraseResult(FALLBACK_IMAGE_PHRASES, true, result.tokensUsed(), result.cost());
        }
        return new PhraseResult(phrases, false, result.tokensUsed(), result.cost());
    }

    List<String> parsePhrases(String response) {
        JsonNode node;
        try {
            node = objectMapper.readTree(stripCodeFences(response));
        } catch (JsonProcessingException e) {
            LOG.debugf("Image phrase response is not JSON: %s", response);
            return List.of();
        }
        List<String> phrases = new ArrayList<>();
        if (node != null && node.isArray()) {
            for (JsonNode element : node) {
                if (element.isTextual() && !element.asText().isBlank()) {
                    phrases.add(element.asText().trim());
                }
            }
        }
        return phrases;
    }

    /**
     * Removes a surrounding Markdown code fence ({@code ```json ... ```}) from a model response.
     */
    static String stripCodeFences(String response) {
        if (response == null) {
            return "";
        }
        String cleaned = response.trim();
        cleaned = cleaned.replaceFirst("(?i)^```json\\s*", "");
        cleaned = cleaned.replaceFirst("^```\\s*", "");
        cleaned = cleaned.replaceFirst("\\s*```$", "");
        return cleaned.trim();
    }

    private static ArticleMetadataType normalize(ArticleMetadataType metadata) {
        if (metadata == null) {
            throw new IllegalArgumentException("Metadata response was null");
        }
        String description = metadata.seoDescription() != null ? metadata.seoDescription().trim() : "";
        if (description.length() > ArticleMetadataType.SEO_DESCRIPTION_MAX_LENGTH) {
            description = description.substring(0, ArticleMetadataType.SEO_DESCRIPTION_MAX_LENGTH);
        }
        return new ArticleMetadataType(clean(metadata.categories()), clean(metadata.tags()), description,
                clean(metadata.seoKeywords()));
    }

    private static List<String> clean(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream().filter(value -> value != null && !value.isBlank()).map(String::trim).toList();
    }

    private static String preview(String content, int length) {
        if (content == null) {
            return "";
        }
        return content.length() > length ? content.substring(0, length) : content;
    }
}
