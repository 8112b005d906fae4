package villagecompute.wpautomation.api.types;

import java.util.UUID;

/**
 * Input to the generation pipeline for one job.
 *
 * @param userId
 *            owner, used for usage accounting
 * @param input
 *            topic text or source item title
 * @param sourceUrl
 *            source article URL for feed jobs, otherwise {@code null}
 * @param sourceBody
 *            source article body used as reference material, may be {@code null}
 * @param rewriteStyle
 *            rewrite applied to {@code sourceBody} instead of drafting from scratch, may be {@code null}
 */
public record GenerationRequestType(UUID userId, String input, String sourceUrl, String sourceBody,
        RewriteStyle rewriteStyle) {

    public enum RewriteStyle {
        SUMMARY,
        EXPAND,
        REWRITE
    }

    public static GenerationRequestType forTopic(UUID userId, String topic) {
        return new GenerationRequestType(userId, topic, null, null, null);
    }
}
