package com.example.cvpipeline.service;

import com.example.cvpipeline.exception.ModelRateLimitedException;
import com.example.cvpipeline.exception.SchemaValidationException;
import com.example.cvpipeline.exception.TransientModelException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.metadata.ChatResponseMetadata;
import org.springframework.ai.chat.metadata.DefaultUsage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.retry.TransientAiException;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.RETURNS_DEEP_STUBS;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SpringAiTextGenerationClientTest {

    private ChatClient chatClient;
    private SpringAiTextGenerationClient client;

    @BeforeEach
    void setUp() {
        chatClient = mock(ChatClient.class, RETURNS_DEEP_STUBS);
        client = new SpringAiTextGenerationClient(chatClient, TokenUsageAccumulator.Channel.GRADING);
    }

    @AfterEach
    void tearDown() {
        TokenUsageAccumulator.clear();
    }

    @Test
    @DisplayName("Should return the content and record token usage on the run accumulator")
    void shouldReturnContentAndRecordUsage() {
        TokenUsageAccumulator usage = TokenUsageAccumulator.start();
        ChatResponse response = new ChatResponse(
                List.of(new Generation(new AssistantMessage("{\"ok\": true}"))),
                ChatResponseMetadata.builder().usage(new DefaultUsage(10, 5)).build());
        when(chatClient.prompt().system(anyString()).user(anyString()).call().chatResponse()).thenReturn(response);

        String content = client.generate("Grader", "system", "user");

        assertThat(content).isEqualTo("{\"ok\": true}");
        assertThat(usage.getGradingTokens()).isEqualTo(15);
        assertThat(usage.getGenerationTokens()).isZero();
    }

    @Test
    @DisplayName("Should map throttling to ModelRateLimitedException")
    void shouldMapThrottling() {
        when(chatClient.prompt().system(anyString()).user(anyString()).call().chatResponse())
                .thenThrow(new RuntimeException("HTTP 429 Too Many Requests"));

        assertThatThrownBy(() -> client.generate("Grader", "system", "user"))
                .isInstanceOf(ModelRateLimitedException.class);
    }

    @Test
    @DisplayName("Should map other transient provider errors to TransientModelException")
    void shouldMapTransientErrors() {
        when(chatClient.prompt().system(anyString()).user(anyString()).call().chatResponse())
                .thenThrow(new TransientAiException("upstream overloaded"));

        assertThatThrownBy(() -> client.generate("Grader", "system", "user"))
                .isInstanceOf(TransientModelException.class)
                .isNotInstanceOf(ModelRateLimitedException.class);
    }

    @Test
    @DisplayName("Should treat an empty answer as a schema violation")
    void shouldRejectEmptyAnswer() {
        ChatResponse response = new ChatResponse(List.of(new Generation(new AssistantMessage(""))));
        when(chatClient.prompt().system(anyString()).user(anyString()).call().chatResponse()).thenReturn(response);

        assertThatThrownBy(() -> client.generate("Grader", "system", "user"))
                .isInstanceOf(SchemaValidationException.class);
    }
}
