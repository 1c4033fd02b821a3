package com.example.cvpipeline.service;

import com.example.cvpipeline.exception.ModelRateLimitedException;
import com.example.cvpipeline.exception.SchemaValidationException;
import com.example.cvpipeline.exception.TransientModelException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.retry.TransientAiException;

import java.util.List;
import java.util.Locale;

/**
 * {@link TextGenerationClient} backed by a Spring AI {@link ChatClient}.
 * <p>
 * Maps provider throttling to {@link ModelRateLimitedException}, other transient provider
 * failures to {@link TransientModelException}, and records token usage on the run's
 * {@link TokenUsageAccumulator}.
 */
public class SpringAiTextGenerationClient implements TextGenerationClient {

    private static final Logger log = LoggerFactory.getLogger(SpringAiTextGenerationClient.class);

    private final ChatClient chatClient;
    private final TokenUsageAccumulator.Channel channel;

    public SpringAiTextGenerationClient(ChatClient chatClient, TokenUsageAccumulator.Channel channel) {
        this.chatClient = chatClient;
        this.channel = channel;
    }

    @Override
    public String generate(String agentName, String systemPrompt, String userPrompt) {
        ChatResponse chatResponse;
        try {
            chatResponse = chatClient.prompt()
                    .system(systemPrompt)
                    .user(userPrompt)
                    .call()
                    .chatResponse();
        } catch (RuntimeException e) {
            if (isRateLimited(e)) {
                throw new ModelRateLimitedException(agentName + ": provider rate limit hit", e);
            }
            if (e instanceof TransientAiException) {
                throw new TransientModelException(agentName + ": transient provider error", e);
            }
            throw e;
        }

        captureTokenUsage(chatResponse, agentName);

        String content = (chatResponse != null && chatResponse.getResult() != null)
                ? chatResponse.getResult().getOutput().getText()
                : null;
        if (content == null || content.isBlank()) {
            throw new SchemaValidationException(List.of("empty response"));
        }
        return content;
    }

    private void captureTokenUsage(ChatResponse chatResponse, String agentName) {
        if (chatResponse == null || chatResponse.getMetadata() == null) return;
        var usage = chatResponse.getMetadata().getUsage();
        if (usage == null || usage.getTotalTokens() == null) return;

        long total = usage.getTotalTokens().longValue();
        TokenUsageAccumulator acc = TokenUsageAccumulator.current();
        if (total == 0 || acc == null) return;

        acc.add(channel, total);
        log.debug("{}: +{} {} tokens (model={})", agentName, total, channel,
                chatResponse.getMetadata().getModel());
    }

    static boolean isRateLimited(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            String msg = t.getMessage();
            if (msg == null) continue;
            String lower = msg.toLowerCase(Locale.ROOT);
            if (lower.contains("429") || lower.contains("rate limit") || lower.contains("too many requests")) {
                return true;
            }
        }
        return false;
    }
}
