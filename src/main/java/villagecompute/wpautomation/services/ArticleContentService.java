package villagecompute.wpautomation.services;

import java.math.BigDecimal;
import java.util.regex.Pattern;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import villagecompute.wpautomation.api.types.ArticleContentType;
import villagecompute.wpautomation.api.types.GenerationRequestType;
import villagecompute.wpautomation.api.types.GenerationRequestType.RewriteStyle;
import villagecompute.wpautomation.api.types.TextGenerationOptionsType;
import villagecompute.wpautomation.api.types.TextGenerationResultType;
import villagecompute.wpautomation.integration.research.ResearchApiClient;

/**
 * Produces the title, excerpt and markdown body of an article.
 *
 * <p>
 * When the research service is configured it writes the whole article in one call. Otherwise the body is drafted by
 * text generation (outline then draft, or a rewrite of the source body when a rewrite style is requested), followed by
 * a title call and an excerpt call.
 */
@ApplicationScoped
public class ArticleContentService {

    private static final Logger LOG = Logger.getLogger(ArticleContentService.class);

    static final int DRAFT_WORD_COUNT = 1500;
    static final int EXCERPT_WORD_COUNT = 150;
    static final int TITLE_CANDIDATES = 3;
    private static final int MAX_REFERENCE_LENGTH = 6000;

    private static final Pattern TITLE_PREFIX = Pattern.compile("^(Title:|#+|\\d+\\.)\\s*",
            Pattern.CASE_INSENSITIVE);

    @Inject
    TextGenerationService textGeneration;

    @Inject
    ResearchApiClient researchClient;

    public ArticleContentType generate(GenerationRequestType request) {
        if (researchClient.isConfigured()) {
            LOG.debugf("Generating content for \"%s\" through the research service", request.input());
            return researchClient.research(request.input());
        }

        Accumulator usage = new Accumulator();
        String markdown;
        if (request.rewriteStyle() != null && request.sourceBody() != null && !request.sourceBody().isBlank()) {
            TextGenerationResultType body = usage.add(rewrite(request));
            markdown = body.content();
            usage.model = body.model();
        } else {
            String outline = usage.add(outline(request)).content();
            TextGenerationResultType body = usage.add(draft(request, outline));
            markdown = body.content();
            usage.model = body.model();
        }

        String title = parseTitle(usage.add(titles(request, markdown)).content());
        if (title.isEmpty()) {
            title = request.input();
        }
        String excerpt = usage.add(excerpt(request, markdown)).content();

        LOG.debugf("Drafted \"%s\": tokens=%d, cost=%s", title, usage.tokens, usage.cost);
        return new ArticleContentType(title, excerpt, markdown, usage.tokens, usage.cost, usage.model);
    }

    private TextGenerationResultType outline(GenerationRequestType request) {
        String system = "Create a detailed article outline with an introduction, 4-6 main sections and a conclusion. "
                + "For each section, provide 2-3 key points to cover. Format as a hierarchical outline with clear "
                + "headings.";
        return textGeneration.generate(request.userId(), TextGenerationService.FEATURE_ARTICLE_OUTLINE, system,
                "Topic: " + request.input(), TextGenerationOptionsType.of(0.7, 500));
    }

    private TextGenerationResultType draft(GenerationRequestType request, String outline) {
        String system = "You are a professional content writer. Write a well-structured article of approximately "
                + DRAFT_WORD_COUNT + " words in Markdown that follows the provided outline. Include an engaging "
                + "introduction, detailed body sections with ## headings, and a strong conclusion. Return only the "
                + "article body without a title line or any meta-commentary.";
        StringBuilder user = new StringBuilder("Topic: ").append(request.input()).append("\n\nOutline:\n\n")
                .append(outline);
        if (request.sourceBody() != null && !request.sourceBody().isBlank()) {
            user.append("\n\nReference material (do not copy verbatim):\n\n").append(truncate(request.sourceBody()));
        }
        return textGeneration.generate(request.userId(), TextGenerationService.FEATURE_ARTICLE_CONTENT, system,
                user.toString(), TextGenerationOptionsType.of(0.8, (int) Math.ceil(DRAFT_WORD_COUNT * 1.5)));
    }

    private TextGenerationResultType rewrite(GenerationRequestType request) {
        String instructions = switch (request.rewriteStyle()) {
            case SUMMARY -> "Write a concise, well-structured summary article (300-500 words) that captures the key "
                    + "points and main ideas of the source.";
            case EXPAND -> "Write an expanded article (1000-1500 words) that builds on the source with additional "
                    + "context, background, analysis and examples.";
            case REWRITE -> "Rewrite the source as an original article of similar length with a fresh structure and "
                    + "wording, preserving every fact.";
        };
        String system = "You are a professional content writer. " + instructions
                + " Use Markdown with ## headings. Do not copy text verbatim. Return only the article body.";
        String user = "Title: " + request.input() + "\n\nSource:\n\n" + truncate(request.sourceBody());
        int maxTokens = request.rewriteStyle() == RewriteStyle.SUMMARY ? 1000 : 2500;
        return textGeneration.generate(request.userId(), TextGenerationService.FEATURE_ARTICLE_REWRITE, system, user,
                TextGenerationOptionsType.of(0.7, maxTokens));
    }

    private TextGenerationResultType titles(GenerationRequestType request, String markdown) {
        String system = "Generate " + TITLE_CANDIDATES + " engaging, SEO-optimized title suggestions. Return only the "
                + "titles, one per line, without numbering or explanations.";
        return textGeneration.generate(request.userId(), TextGenerationService.FEATURE_ARTICLE_TITLE, system,
                "Content:\n\n" + head(markdown, 1000), TextGenerationOptionsType.of(0.8, 200));
    }

    private TextGenerationResultType excerpt(GenerationRequestType request, String markdown) {
        String system = "Create a concise summary of at most " + EXCERPT_WORD_COUNT + " words that captures the main "
                + "points. Return only the summary without any explanations.";
        return textGeneration.generate(request.userId(), TextGenerationService.FEATURE_ARTICLE_EXCERPT, system,
                "Content:\n\n" + markdown,
                TextGenerationOptionsType.of(0.5, (int) Math.ceil(EXCERPT_WORD_COUNT * 1.5)));
    }

    /**
     * First non-blank line of a title-candidates response with list markers, "Title:" labels and wrapping quotes
     * removed.
     */
    static String parseTitle(String response) {
        if (response == null) {
            return "";
        }
        for (String line : response.split("\\R")) {
            String candidate = TITLE_PREFIX.matcher(line.trim()).replaceFirst("").trim();
            candidate = stripQuotes(candidate);
            if (!candidate.isEmpty()) {
                return candidate;
            }
        }
        return "";
    }

    private static String stripQuotes(String value) {
        String result = value;
        while (result.length() >= 2 && isQuote(result.charAt(0)) && isQuote(result.charAt(result.length() - 1))) {
            result = result.substring(1, result.length() - 1).trim();
        }
        return result;
    }

    private static boolean isQuote(char c) {
        return c == '"' || c == '\'' || c == '“' || c == '”';
    }

    private static String truncate(String text) {
        return head(text, MAX_REFERENCE_LENGTH);
    }

    private static String head(String text, int length) {
        return text.length() > length ? text.substring(0, length) : text;
    }

    private static final class Accumulator {
        private int tokens;
        private BigDecimal cost = BigDecimal.ZERO;
        private String model;

        private TextGenerationResultType add(TextGenerationResultType result) {
            tokens += result.tokensUsed();
            if (result.cost() != null) {
                cost = cost.add(result.cost());
            }
            return result;
        }
    }
}
