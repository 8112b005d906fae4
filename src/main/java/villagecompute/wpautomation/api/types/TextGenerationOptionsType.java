package villagecompute.wpautomation.api.types;

/**
 * Per-call overrides for text generation. {@code null} fields fall back to configuration.
 */
public record TextGenerationOptionsType(String model, Double temperature, Integer maxTokens) {

    public static TextGenerationOptionsType defaults() {
        return new TextGenerationOptionsType(null, null, null);
    }

    public static TextGenerationOptionsType of(double temperature, int maxTokens) {
        return new TextGenerationOptionsType(null, temperature, maxTokens);
    }
}
