/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */
package villagecompute.wpautomation.config;

import java.time.Duration;
import java.util.Optional;

import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;

import io.quarkus.runtime.Startup;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Text-generation configuration and {@link ChatModel} producer.
 *
 * <p>
 * One provider is active per process, selected by {@code ai.provider} ({@code anthropic} or {@code openai}). The model
 * configured here is the default; callers may override the model, temperature and token limit per request, and
 * individual features may pin a model through {@code ai.features.<feature>.model}.
 *
 * <p>
 * <b>Configuration Properties:</b>
 * <ul>
 * <li>{@code ai.provider} - anthropic | openai (default anthropic)</li>
 * <li>{@code ai.api-key} - provider API key (required; startup fails when blank)</li>
 * <li>{@code ai.base-url} - optional endpoint override</li>
 * <li>{@code ai.model.name} - default model</li>
 * <li>{@code ai.model.temperature}, {@code ai.model.max-tokens} - defaults when a request sets none</li>
 * <li>{@code ai.model.timeout-seconds} - per-request timeout</li>
 * <li>{@code ai.model.max-retries} - client-level retries (0 keeps failures visible to the job)</li>
 * </ul>
 */
@ApplicationScoped
@Startup
public class AiConfig {

    private static final Logger LOG = Logger.getLogger(AiConfig.class);

    public static final String PROVIDER_ANTHROPIC = "anthropic";
    public static final String PROVIDER_OPENAI = "openai";

    @ConfigProperty(
            name = "ai.provider",
            defaultValue = PROVIDER_ANTHROPIC)
    String provider;

    @ConfigProperty(
            name = "ai.api-key")
    Optional<String> apiKey;

    @ConfigProperty(
            name = "ai.base-url")
    Optional<String> baseUrl;

    @ConfigProperty(
            name = "ai.model.name",
            defaultValue = "claude-3-5-sonnet-20241022")
    String modelName;

    @ConfigProperty(
            name = "ai.model.temperature",
            defaultValue = "0.7")
    double temperature;

    @ConfigProperty(
            name = "ai.model.max-tokens",
            defaultValue = "4096")
    int maxTokens;

    @ConfigProperty(
            name = "ai.model.timeout-seconds",
            defaultValue = "60")
    int timeoutSeconds;

    @ConfigProperty(
            name = "ai.model.max-retries",
            defaultValue = "0")
    int maxRetries;

    /**
     * Fails startup when the provider is unknown or the key is missing.
     *
     * @throws AiConfigurationException
     *             if the configuration cannot produce a working model
     */
    @PostConstruct
    public void validateConfiguration() {
        if (!PROVIDER_ANTHROPIC.equals(provider) && !PROVIDER_OPENAI.equals(provider)) {
            throw new AiConfigurationException("Unsupported ai.provider '" + provider + "', expected "
                    + PROVIDER_ANTHROPIC + " or " + PROVIDER_OPENAI);
        }
        if (apiKey.isEmpty() || apiKey.get().isBlank()) {
            String errorMessage = "AI_API_KEY is not configured. Article generation requires a valid " + provider
                    + " API key. Set AI_API_KEY and restart the application.";
            LOG.fatal(errorMessage);
            throw new AiConfigurationException(errorMessage);
        }
        LOG.infof("Text generation configured: provider=%s, model=%s", provider, modelName);
    }

    @Produces
    @ApplicationScoped
    public ChatModel chatModel() {
        LOG.infof("Creating %s ChatModel: model=%s, temperature=%.2f, maxTokens=%d, timeout=%ds, maxRetries=%d",
                provider, modelName, temperature, maxTokens, timeoutSeconds, maxRetries);

        Duration timeout = Duration.ofSeconds(timeoutSeconds);
        String key = apiKey.orElse("");
        if (PROVIDER_OPENAI.equals(provider)) {
            OpenAiChatModel.OpenAiChatModelBuilder builder = OpenAiChatModel.builder().apiKey(key)
                    .modelName(modelName).temperature(temperature).maxTokens(maxTokens).timeout(timeout)
                    .maxRetries(maxRetries);
            baseUrl.filter(url -> !url.isBlank()).ifPresent(builder::baseUrl);
            return builder.build();
        }

        AnthropicChatModel.AnthropicChatModelBuilder builder = AnthropicChatModel.builder().apiKey(key)
                .modelName(modelName).temperature(temperature).maxTokens(maxTokens).timeout(timeout)
                .maxRetries(maxRetries).logRequests(false).logResponses(false);
        baseUrl.filter(url -> !url.isBlank()).ifPresent(builder::baseUrl);
        return builder.build();
    }

    public String getProvider() {
        return provider;
    }

    public String getModelName() {
        return modelName;
    }

    public double getTemperature() {
        return temperature;
    }

    public int getMaxTokens() {
        return maxTokens;
    }

    /**
     * Raised when text generation cannot be configured.
     */
    public static class AiConfigurationException extends RuntimeException {

        public AiConfigurationException(String message) {
            super(message);
        }

        public AiConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
