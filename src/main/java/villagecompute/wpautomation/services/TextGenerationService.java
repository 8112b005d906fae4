package villagecompute.wpautomation.services;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;

import io.smallrye.faulttolerance.api.CircuitBreakerName;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.faulttolerance.CircuitBreaker;
import org.eclipse.microprofile.faulttolerance.Timeout;
import org.jboss.logging.Logger;

import villagecompute.wpautomation.api.types.ChatMessageType;
import villagecompute.wpautomation.api.types.TextGenerationOptionsType;
import villagecompute.wpautomation.api.types.TextGenerationResultType;
import villagecompute.wpautomation.config.AiConfig;
import villagecompute.wpautomation.exceptions.ConfigurationException;
import villagecompute.wpautomation.exceptions.RemoteServiceException;
import villagecompute.wpautomation.exceptions.ValidationException;
import villagecompute.wpautomation.integration.ai.ModelPricing;

/**
 * Single entry point for chat-style text generation.
 *
 * <p>
 * Every call is attributed to a user and a feature key. The model is resolved per call: an explicit
 * {@link TextGenerationOptionsType#model()} wins, then {@code ai.features.<feature>.model}, then {@code ai.model.name}.
 * Usage (tokens and estimated cost) is recorded against the user's monthly row whether the call succeeds or fails, and
 * a user over {@code ai.monthly-token-limit} is refused before the provider is contacted.
 */
@ApplicationScoped
public class TextGenerationService {

    private static final Logger LOG = Logger.getLogger(TextGenerationService.class);

    public static final String FEATURE_ARTICLE_OUTLINE = "article-outline";
    public static final String FEATURE_ARTICLE_CONTENT = "article-content";
    public static final String FEATURE_ARTICLE_TITLE = "article-title";
    public static final String FEATURE_ARTICLE_EXCERPT = "article-excerpt";
    public static final String FEATURE_ARTICLE_REWRITE = "article-rewrite";
    public static final String FEATURE_ARTICLE_METADATA = "article-metadata";
    public static final String FEATURE_IMAGE_PHRASES = "image-phrases";

    @Inject
    ChatModel chatModel;

    @Inject
    AiConfig aiConfig;

    @Inject
    AiUsageTrackingService usageTrackingService;

    @Inject
    Config config;

    /**
     * Sends {@code messages} to the configured provider.
     *
     * @throws ConfigurationException
     *             if the user has exceeded the monthly token limit
     * @throws RemoteServiceException
     *             if the provider call fails or returns no text
     */
    @CircuitBreaker(
            requestVolumeThreshold = 5,
            failureRatio = 1.0,
            delay = 30000,
            successThreshold = 2,
            skipOn = {ConfigurationException.class, ValidationException.class})
    @CircuitBreakerName("text-generation")
    @Timeout(180000)
    public TextGenerationResultType generate(UUID userId, String feature, List<ChatMessageType> messages,
            TextGenerationOptionsType options) {
        if (messages == null || messages.isEmpty()) {
            throw new ValidationException("At least one message is required");
        }
        usageTrackingService.checkTokenLimit(userId);

        TextGenerationOptionsType effective = options != null ? options : TextGenerationOptionsType.defaults();
        String model = resolveModel(feature, effective);
        double temperature = effective.temperature() != null ? effective.temperature() : aiConfig.getTemperature();
        int maxTokens = effective.maxTokens() != null ? effective.maxTokens() : aiConfig.getMaxTokens();

        ChatRequest request = ChatRequest.builder().messages(toChatMessages(messages)).modelName(model)
                .temperature(temperature).maxOutputTokens(maxTokens).build();

        LOG.debugf("Text generation request: feature=%s, model=%s, messages=%d", feature, model, messages.size());
        ChatResponse response;
        try {
            response = chatModel.chat(request);
        } catch (RuntimeException e) {
            usageTrackingService.recordFailure(userId, feature, aiConfig.getProvider());
            LOG.errorf(e, "Text generation failed: feature=%s, model=%s", feature, model);
            throw new RemoteServiceException("Text generation failed: " + e.getMessage(), e);
        }

        String text = response.aiMessage() != null ? response.aiMessage().text() : null;
        if (text == null || text.isBlank()) {
            usageTrackingService.recordFailure(userId, feature, aiConfig.getProvider());
            throw new RemoteServiceException("No response from " + aiConfig.getProvider());
        }

        TokenUsage usage = response.tokenUsage();
        int inputTokens = usage != null && usage.inputTokenCount() != null ? usage.inputTokenCount() : 0;
        int outputTokens = usage != null && usage.outputTokenCount() != null ? usage.outputTokenCount() : 0;
        String servedBy = response.modelName() != null ? response.modelName() : model;
        BigDecimal cost = ModelPricing.cost(model, inputTokens, outputTokens);

        TextGenerationResultType result = new TextGenerationResultType(text.trim(), inputTokens, outputTokens, cost,
                servedBy, aiConfig.getProvider());
        usageTrackingService.recordSuccess(userId, feature, result);

        LOG.debugf("Text generation complete: feature=%s, model=%s, inputTokens=%d, outputTokens=%d, cost=%s",
                feature, servedBy, inputTokens, outputTokens, cost);
        return result;
    }

    /**
     * Convenience for a single system prompt plus a single user prompt.
     */
    public TextGenerationResultType generate(UUID userId, String feature, String systemPrompt, String userPrompt,
            TextGenerationOptionsType options) {
        List<ChatMessageType> messages = new ArrayList<>();
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            messages.add(ChatMessageType.system(systemPrompt));
        }
        messages.add(ChatMessageType.user(userPrompt));
        return generate(userId, feature, messages, options);
    }

    String resolveModel(String feature, TextGenerationOptionsType options) {
        if (options.model() != null && !options.model().isBlank()) {
            return options.model();
        }
        if (feature != null) {
            Optional<String> featureModel = config.getOptionalValue("ai.features." + feature + ".model",
                    String.class);
            if (featureModel.isPresent() && !featureModel.get().isBlank()) {
                return featureModel.get();
            }
        }
        return aiConfig.getModelName();
    }

    private static List<ChatMessage> toChatMessages(List<ChatMessageType> messages) {
        List<ChatMessage> converted = new ArrayList<>(messages.size());
        for (ChatMessageType message : messages) {
            switch (message.role()) {
                case SYSTEM -> converted.add(SystemMessage.from(message.content()));
                case ASSISTANT -> converted.add(AiMessage.from(message.content()));
                default -> converted.add(UserMessage.from(message.content()));
            }
        }
        return converted;
    }
}
