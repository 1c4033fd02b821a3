package com.example.cvpipeline.controller;

import com.example.cvpipeline.model.CvGenerationResult;
import com.example.cvpipeline.model.JobContext;
import com.example.cvpipeline.orchestrator.CvPipelineOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST entry point: one request runs one pipeline.
 */
@RestController
@RequestMapping("/api/cv")
public class CvGenerationController {

    private static final Logger log = LoggerFactory.getLogger(CvGenerationController.class);

    private final CvPipelineOrchestrator orchestrator;

    public CvGenerationController(CvPipelineOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    /**
     * Generates a CV tailored to the posted job context.
     *
     * <p>Endpoint: POST /api/cv/generate
     * <p>Content-Type: application/json
     */
    @PostMapping(value = "/generate", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> generate(@RequestBody JobContext context) {
        if (context == null || context.title() == null || context.title().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Job title is required."));
        }
        log.info("Received CV request for '{}'", context.title());

        CvGenerationResult result = orchestrator.generate(context);
        return ResponseEntity.ok()
                .headers(responseHeaders(result))
                .body(result);
    }

    private static HttpHeaders responseHeaders(CvGenerationResult result) {
        HttpHeaders h = new HttpHeaders();
        h.set("X-Run-Status", result.status().name());
        h.set("X-Generation-Tokens", String.valueOf(result.tokenUsage().generationTokens()));
        h.set("X-Grading-Tokens", String.valueOf(result.tokenUsage().gradingTokens()));
        h.set("X-Pipeline-Total-Seconds", String.valueOf(result.timings().totalSeconds()));
        return h;
    }
}
