package villagecompute.wpautomation.api.types;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Taxonomy and SEO fields derived from a generated article.
 */
@JsonIgnoreProperties(
        ignoreUnknown = true)
public record ArticleMetadataType(List<String> categories, List<String> tags, String seoDescription,
        List<String> seoKeywords) {

    public static final String DEFAULT_CATEGORY = "Uncategorized";
    public static final int SEO_DESCRIPTION_MAX_LENGTH = 160;

    /**
     * Safe defaults used when the generated metadata cannot be parsed.
     */
    public static ArticleMetadataType fallback(String title) {
        String description = title == null ? "" : title;
        if (description.length() > SEO_DESCRIPTION_MAX_LENGTH) {
            description = description.substring(0, SEO_DESCRIPTION_MAX_LENGTH);
        }
        return new ArticleMetadataType(List.of(DEFAULT_CATEGORY), List.of(), description, List.of());
    }
}
