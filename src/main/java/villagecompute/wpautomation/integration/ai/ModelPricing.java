package villagecompute.wpautomation.integration.ai;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Arrays;
import java.util.Optional;

/**
 * Per-1K-token prices (US dollars) of the models the engine knows about.
 *
 * <p>
 * Costs are estimates for usage reporting; models not listed here are recorded with zero cost.
 */
public enum ModelPricing {

    GPT_35_TURBO("gpt-3.5-turbo", "openai", "0.0005", "0.0015"),
    GPT_4_TURBO("gpt-4-turbo", "openai", "0.01", "0.03"),
    GPT_4O("gpt-4o", "openai", "0.005", "0.015"),
    GPT_4O_MINI("gpt-4o-mini", "openai", "0.00015", "0.0006"),
    CLAUDE_3_OPUS("claude-3-opus-20240229", "anthropic", "0.015", "0.075"),
    CLAUDE_3_SONNET("claude-3-sonnet-20240229", "anthropic", "0.003", "0.015"),
    CLAUDE_35_SONNET("claude-3-5-sonnet-20241022", "anthropic", "0.003", "0.015"),
    CLAUDE_3_HAIKU("claude-3-haiku-20240307", "anthropic", "0.00025", "0.00125");

    private static final BigDecimal THOUSAND = BigDecimal.valueOf(1000);

    private final String modelId;
    private final String provider;
    private final BigDecimal inputCostPer1k;
    private final BigDecimal outputCostPer1k;

    ModelPricing(String modelId, String provider, String inputCostPer1k, String outputCostPer1k) {
        this.modelId = modelId;
        this.provider = provider;
        this.inputCostPer1k = new BigDecimal(inputCostPer1k);
        this.outputCostPer1k = new BigDecimal(outputCostPer1k);
    }

    public String getModelId() {
        return modelId;
    }

    public String getProvider() {
        return provider;
    }

    public static Optional<ModelPricing> forModel(String modelId) {
        if (modelId == null) {
            return Optional.empty();
        }
        return Arrays.stream(values()).filter(pricing -> pricing.modelId.equals(modelId)).findFirst();
    }

    /**
     * Estimated cost of one call: {@code tokens / 1000 * rate}, input and output priced separately.
     */
    public static BigDecimal cost(String modelId, long inputTokens, long outputTokens) {
        return forModel(modelId).map(pricing -> pricing.cost(inputTokens, outputTokens)).orElse(BigDecimal.ZERO);
    }

    public BigDecimal cost(long inputTokens, long outputTokens) {
        BigDecimal input = BigDecimal.valueOf(inputTokens).multiply(inputCostPer1k);
        BigDecimal output = BigDecimal.valueOf(outputTokens).multiply(outputCostPer1k);
        return input.add(output).divide(THOUSAND, 6, RoundingMode.HALF_UP);
    }
}
