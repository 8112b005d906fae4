package villagecompute.wpautomation.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;

import org.eclipse.microprofile.config.Config;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import villagecompute.wpautomation.api.types.TextGenerationOptionsType;
import villagecompute.wpautomation.api.types.TextGenerationResultType;
import villagecompute.wpautomation.config.AiConfig;
import villagecompute.wpautomation.exceptions.ConfigurationException;
import villagecompute.wpautomation.exceptions.RemoteServiceException;
import villagecompute.wpautomation.exceptions.ValidationException;

/**
 * Unit tests for {@link TextGenerationService} with a mocked LangChain4j {@link ChatModel}.
 */
class TextGenerationServiceTest {

    private static final String FEATURE = TextGenerationService.FEATURE_ARTICLE_CONTENT;

    @Mock
    ChatModel chatModel;

    @Mock
    AiConfig aiConfig;

    @Mock
    AiUsageTrackingService usageTrackingService;

    @Mock
    Config config;

    private TextGenerationService service;
    private UUID userId;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        when(aiConfig.getProvider()).thenReturn(AiConfig.PROVIDER_OPENAI);
        when(aiConfig.getModelName()).thenReturn("gpt-4o");
        when(aiConfig.getTemperature()).thenReturn(0.7);
        when(aiConfig.getMaxTokens()).thenReturn(4000);
        when(config.getOptionalValue(any(), eq(String.class))).thenReturn(Optional.empty());

        service = new TextGenerationService();
        service.chatModel = chatModel;
        service.aiConfig = aiConfig;
        service.usageTrackingService = usageTrackingService;
        service.config = config;
        userId = UUID.randomUUID();
    }

    @Test
    void testGenerate_buildsRequestAndRecordsUsage() {
        when(chatModel.chat(any(ChatRequest.class))).thenReturn(response("  # Edge computing\n\nBody  ", 1000, 2000));

        TextGenerationResultType result = service.generate(userId, FEATURE, "You are a writer.", "Write about edge.",
                TextGenerationOptionsType.of(0.3, 800));

        assertEquals("# Edge computing\n\nBody", result.content());
        assertEquals(1000, result.inputTokens());
        assertEquals(2000, result.outputTokens());
        assertEquals(new BigDecimal("0.035000"), result.cost());
        assertEquals("gpt-4o", result.model());
        assertEquals(AiConfig.PROVIDER_OPENAI, result.provider());

        ArgumentCaptor<ChatRequest> request = ArgumentCaptor.forClass(ChatRequest.class);
        verify(chatModel).chat(request.capture());
        assertEquals("gpt-4o", request.getValue().modelName());
        assertEquals(0.3, request.getValue().temperature());
        assertEquals(800, request.getValue().maxOutputTokens());
        assertEquals(2, request.getValue().messages().size());
        assertInstanceOf(SystemMessage.class, request.getValue().messages().get(0));
        assertInstanceOf(UserMessage.class, request.getValue().messages().get(1));

        verify(usageTrackingService).checkTokenLimit(userId);
        verify(usageTrackingService).recordSuccess(userId, FEATURE, result);
    }

    @Test
    void testGenerate_defaultsComeFromConfig() {
        when(chatModel.chat(any(ChatRequest.class))).thenReturn(response("text", 10, 10));

        service.generate(userId, FEATURE, null, "prompt", null);

        ArgumentCaptor<ChatRequest> request = ArgumentCaptor.forClass(ChatRequest.class);
        verify(chatModel).chat(request.capture());
        assertEquals(0.7, request.getValue().temperature());
        assertEquals(4000, request.getValue().maxOutputTokens());
        assertEquals(1, request.getValue().messages().size(), "blank system prompt is omitted");
    }

    @Test
    void testResolveModel_optionThenFeatureThenDefault() {
        when(config.getOptionalValue("ai.features.image-phrases.model", String.class))
                .thenReturn(Optional.of("gpt-4o-mini"));

        assertEquals("claude-3-haiku-20240307", service.resolveModel(TextGenerationService.FEATURE_IMAGE_PHRASES,
                new TextGenerationOptionsType("claude-3-haiku-20240307", null, null)));
        assertEquals("gpt-4o-mini", service.resolveModel(TextGenerationService.FEATURE_IMAGE_PHRASES,
                TextGenerationOptionsType.defaults()));
        assertEquals("gpt-4o", service.resolveModel(FEATURE, TextGenerationOptionsType.defaults()));
    }

    @Test
    void testGenerate_providerErrorRecordsFailure() {
        when(chatModel.chat(any(ChatRequest.class))).thenThrow(new IllegalStateException("connection reset"));

        RemoteServiceException error = assertThrows(RemoteServiceException.class,
                () -> service.generate(userId, FEATURE, null, "prompt", null));

        assertEquals("Text generation failed: connection reset", error.getMessage());
        verify(usageTrackingService).recordFailure(userId, FEATURE, AiConfig.PROVIDER_OPENAI);
        verify(usageTrackingService, never()).recordSuccess(any(), any(), any());
    }

    @Test
    void testGenerate_blankResponseIsAnError() {
        when(chatModel.chat(any(ChatRequest.class))).thenReturn(response("   ", 5, 0));

        assertThrows(RemoteServiceException.class, () -> service.generate(userId, FEATURE, null, "prompt", null));
        verify(usageTrackingService).recordFailure(userId, FEATURE, AiConfig.PROVIDER_OPENAI);
    }

    @Test
    void testGenerate_tokenLimitStopsBeforeProvider() {
        doThrow(new ConfigurationException("Monthly token limit exceeded")).when(usageTrackingService)
                .checkTokenLimit(userId);

        assertThrows(ConfigurationException.class, () -> service.generate(userId, FEATURE, null, "prompt", null));
        verify(chatModel, never()).chat(any(ChatRequest.class));
    }

    @Test
    void testGenerate_requiresMessages() {
        assertThrows(ValidationException.class, () -> service.generate(userId, FEATURE, List.of(), null));
    }

    private static ChatResponse response(String text, int inputTokens, int outputTokens) {
        return ChatResponse.builder().aiMessage(AiMessage.from(text))
                .tokenUsage(new TokenUsage(inputTokens, outputTokens)).build();
    }
}
