package com.example.cvpipeline.config;

import com.example.cvpipeline.service.SpringAiTextGenerationClient;
import com.example.cvpipeline.service.TextGenerationClient;
import com.example.cvpipeline.service.TokenUsageAccumulator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.ai.anthropic.AnthropicChatModel;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Model clients and executors.
 * <p>
 * - generationClient (OpenAI): bullets, header summary, revisions
 * - gradingClient (Anthropic): rubric grading, kept on a different model family than generation
 */
@Configuration
public class AiConfig {

    @Bean("generationClient")
    public TextGenerationClient generationClient(OpenAiChatModel openAiChatModel) {
        return new SpringAiTextGenerationClient(ChatClient.builder(openAiChatModel).build(),
                TokenUsageAccumulator.Channel.GENERATION);
    }

    @Bean("gradingClient")
    public TextGenerationClient gradingClient(AnthropicChatModel anthropicChatModel) {
        return new SpringAiTextGenerationClient(ChatClient.builder(anthropicChatModel).build(),
                TokenUsageAccumulator.Channel.GRADING);
    }

    /**
     * Bounded pool for per-role generation and validation.
     */
    @Bean(name = "roleWorkerExecutor", destroyMethod = "shutdown")
    public ExecutorService roleWorkerExecutor(CvPipelineProperties properties) {
        return Executors.newFixedThreadPool(properties.concurrency().roleWorkers(),
                new CustomizableThreadFactory("role-worker-"));
    }

    /**
     * Runs individual model calls so each one can be bounded by the call timeout.
     */
    @Bean(name = "llmCallExecutor", destroyMethod = "shutdown")
    public ExecutorService llmCallExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("llm-call-"));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }
}
