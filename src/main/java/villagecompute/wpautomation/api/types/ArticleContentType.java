package villagecompute.wpautomation.api.types;

import java.math.BigDecimal;

/**
 * Result of the content stage: a title, an excerpt and a markdown body, with accumulated accounting.
 */
public record ArticleContentType(String title, String excerpt, String markdown, int tokensUsed, BigDecimal cost,
        String model) {
}
