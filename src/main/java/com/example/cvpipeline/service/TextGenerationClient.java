package com.example.cvpipeline.service;

/**
 * Text-generation service used by the agents: structured prompt in, raw text out.
 * <p>
 * Implementations raise {@link com.example.cvpipeline.exception.ModelTimeoutException},
 * {@link com.example.cvpipeline.exception.ModelRateLimitedException} or
 * {@link com.example.cvpipeline.exception.SchemaValidationException} for the failures callers
 * are expected to recover from.
 */
public interface TextGenerationClient {

    String generate(String agentName, String systemPrompt, String userPrompt);
}
