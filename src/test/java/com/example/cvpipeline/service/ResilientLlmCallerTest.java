package com.example.cvpipeline.service;

import com.example.cvpipeline.exception.ModelRateLimitedException;
import com.example.cvpipeline.support.ScriptedTextGenerationClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ResilientLlmCallerTest {

    record Answer(String value) {
    }

    private ExecutorService executor;
    private ResilientLlmCaller caller;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        caller = new ResilientLlmCaller(
                new RetryPolicy(3, Duration.ZERO, 2.0, Duration.ZERO, Duration.ofMillis(300)), executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("Should parse fenced JSON with single quotes and trailing commas")
    void shouldParseLenientJson() {
        ScriptedTextGenerationClient client = new ScriptedTextGenerationClient()
                .onSequence("Agent", "```json\n{'value': 'ok',}\n```");

        LlmResult<Answer> result = caller.call(client, "Agent", "system", "user", Answer.class, a -> List.of());

        assertThat(result.isOk()).isTrue();
        assertThat(result.payload().value()).isEqualTo("ok");
        assertThat(result.attempts()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should retry schema violations with the violations quoted back")
    void shouldRetrySchemaViolations() {
        ScriptedTextGenerationClient client = new ScriptedTextGenerationClient()
                .onSequence("Agent", "{\"value\": \"\"}", "{\"value\": \"fixed\"}");

        LlmResult<Answer> result = caller.call(client, "Agent", "system", "user", Answer.class,
                a -> a.value() == null || a.value().isBlank() ? List.of("value must not be blank") : List.of());

        assertThat(result.isOk()).isTrue();
        assertThat(result.payload().value()).isEqualTo("fixed");
        assertThat(result.attempts()).isEqualTo(2);
        assertThat(client.calls().get(0).userPrompt()).doesNotContain("YOUR PREVIOUS ANSWER WAS REJECTED");
        assertThat(client.calls().get(1).userPrompt())
                .contains("YOUR PREVIOUS ANSWER WAS REJECTED")
                .contains("value must not be blank");
    }

    @Test
    @DisplayName("Should give up with VALIDATION_ERROR when every answer is unparseable")
    void shouldReportValidationError() {
        ScriptedTextGenerationClient client = new ScriptedTextGenerationClient()
                .onSequence("Agent", "I am sorry, I cannot produce JSON today.");

        LlmResult<Answer> result = caller.call(client, "Agent", "system", "user", Answer.class, a -> List.of());

        assertThat(result.status()).isEqualTo(LlmResult.Status.VALIDATION_ERROR);
        assertThat(result.attempts()).isEqualTo(3);
        assertThat(client.calls().get(2).userPrompt()).contains("Output ONLY the raw JSON object");
    }

    @Test
    @DisplayName("Should retry throttling and report TRANSIENT_ERROR once attempts run out")
    void shouldReportTransientError() {
        ScriptedTextGenerationClient client = new ScriptedTextGenerationClient().on("Agent", prompt -> {
            throw new ModelRateLimitedException("Agent: provider rate limit hit", new RuntimeException("429"));
        });

        LlmResult<Answer> result = caller.call(client, "Agent", "system", "user", Answer.class, a -> List.of());

        assertThat(result.status()).isEqualTo(LlmResult.Status.TRANSIENT_ERROR);
        assertThat(result.attempts()).isEqualTo(3);
        assertThat(client.callsFor("Agent")).isEqualTo(3);
    }

    @Test
    @DisplayName("Should recover when a transient failure is followed by a valid answer")
    void shouldRecoverAfterTransientFailure() {
        int[] calls = {0};
        ScriptedTextGenerationClient client = new ScriptedTextGenerationClient().on("Agent", prompt -> {
            if (calls[0]++ == 0) {
                throw new ModelRateLimitedException("Agent: provider rate limit hit", null);
            }
            return "{\"value\": \"ok\"}";
        });

        LlmResult<Answer> result = caller.call(client, "Agent", "system", "user", Answer.class, a -> List.of());

        assertThat(result.isOk()).isTrue();
        assertThat(result.attempts()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should bound each call by the call timeout")
    void shouldTimeOutSlowCalls() {
        ScriptedTextGenerationClient client = new ScriptedTextGenerationClient().on("Agent", prompt -> {
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return "{\"value\": \"late\"}";
        });

        LlmResult<Answer> result = caller.call(client, "Agent", "system", "user", Answer.class, a -> List.of());

        assertThat(result.status()).isEqualTo(LlmResult.Status.TRANSIENT_ERROR);
        assertThat(result.error()).contains("no answer within");
    }

    @Test
    @DisplayName("Should fail at once on an error retrying cannot fix")
    void shouldNotRetryNonTransientErrors() {
        ScriptedTextGenerationClient client = new ScriptedTextGenerationClient().on("Agent", prompt -> {
            throw new IllegalArgumentException("unsupported model option");
        });

        LlmResult<Answer> result = caller.call(client, "Agent", "system", "user", Answer.class, a -> List.of());

        assertThat(result.status()).isEqualTo(LlmResult.Status.FAILED);
        assertThat(result.error()).contains("IllegalArgumentException").contains("unsupported model option");
        assertThat(result.attempts()).isEqualTo(1);
        assertThat(client.callsFor("Agent")).isEqualTo(1);
    }

    @Test
    @DisplayName("Should not start a call once the run deadline bound to the thread has passed")
    void shouldNotCallPastRunDeadline() {
        ScriptedTextGenerationClient client = new ScriptedTextGenerationClient()
                .onSequence("Agent", "{\"value\": \"ok\"}");
        Clock clock = Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC);
        RunDeadline.after(clock, Duration.ZERO).bind();
        try {
            LlmResult<Answer> result = caller.call(client, "Agent", "system", "user", Answer.class, a -> List.of());

            assertThat(result.status()).isEqualTo(LlmResult.Status.TRANSIENT_ERROR);
            assertThat(result.error()).isEqualTo("run deadline passed");
            assertThat(result.attempts()).isZero();
            assertThat(client.calls()).isEmpty();
        } finally {
            RunDeadline.unbind();
        }
    }

    @Test
    @DisplayName("Should cut a slow call short at the run deadline and not retry it")
    void shouldBoundSlowCallByRunDeadline() throws InterruptedException {
        CountDownLatch interrupted = new CountDownLatch(1);
        ScriptedTextGenerationClient client = new ScriptedTextGenerationClient().on("Agent", prompt -> {
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
                Thread.currentThread().interrupt();
            }
            return "{\"value\": \"late\"}";
        });
        ResilientLlmCaller patient = new ResilientLlmCaller(
                new RetryPolicy(3, Duration.ZERO, 2.0, Duration.ZERO, Duration.ofSeconds(30)), executor);
        RunDeadline.after(Clock.systemUTC(), Duration.ofMillis(200)).bind();
        try {
            long started = System.nanoTime();
            LlmResult<Answer> result = patient.call(client, "Agent", "system", "user", Answer.class, a -> List.of());
            Duration elapsed = Duration.ofNanos(System.nanoTime() - started);

            assertThat(result.status()).isEqualTo(LlmResult.Status.TRANSIENT_ERROR);
            assertThat(elapsed).isLessThan(Duration.ofSeconds(3));
            assertThat(client.callsFor("Agent")).isEqualTo(1);
            assertThat(interrupted.await(2, TimeUnit.SECONDS)).isTrue();
        } finally {
            RunDeadline.unbind();
        }
    }

    @Test
    @DisplayName("Should grow backoff by the multiplier up to the ceiling")
    void shouldComputeBackoff() {
        RetryPolicy policy = new RetryPolicy(5, Duration.ofSeconds(1), 2.0, Duration.ofSeconds(5), Duration.ofSeconds(60));

        assertThat(policy.backoffAfter(1)).isEqualTo(Duration.ofSeconds(1));
        assertThat(policy.backoffAfter(2)).isEqualTo(Duration.ofSeconds(2));
        assertThat(policy.backoffAfter(3)).isEqualTo(Duration.ofSeconds(4));
        assertThat(policy.backoffAfter(4)).isEqualTo(Duration.ofSeconds(5));
    }
}
