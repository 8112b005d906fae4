package villagecompute.wpautomation.api.types;

import java.math.BigDecimal;

/**
 * Output of one text-generation call with its accounting.
 *
 * @param content
 *            generated text
 * @param inputTokens
 *            prompt tokens billed
 * @param outputTokens
 *            completion tokens billed
 * @param cost
 *            estimated cost in US dollars
 * @param model
 *            model that served the request
 * @param provider
 *            provider name ("anthropic", "openai")
 */
public record TextGenerationResultType(String content, int inputTokens, int outputTokens, BigDecimal cost,
        String model, String provider) {

    public int tokensUsed() {
        return inputTokens + outputTokens;
    }
}
