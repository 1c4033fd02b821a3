package com.example.cvpipeline.service;

import com.example.cvpipeline.config.CvPipelineProperties;
import com.example.cvpipeline.exception.ModelTimeoutException;
import com.example.cvpipeline.exception.SchemaValidationException;
import com.example.cvpipeline.exception.TransientModelException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Resilient model calls with lenient JSON parsing, schema checks and a {@link RetryPolicy}.
 * <p>
 * Solves common LLM response issues:
 * <ul>
 *   <li>Trailing commas ({@code [{"a":1},]})</li>
 *   <li>Java-style comments in JSON</li>
 *   <li>Single quotes instead of double quotes</li>
 *   <li>Unexpected fields (ignoreUnknown)</li>
 * </ul>
 * <p>
 * Schema violations are retried at once with progressively stricter formatting instructions that
 * quote the violations back to the model. Timeouts, throttling and other provider failures are
 * retried with exponential backoff. Any other failure ends the call at once. No attempt starts and
 * no backoff runs past the {@link RunDeadline} bound to the calling thread, and an interrupted
 * thread stops retrying. Callers never see an exception: the outcome is an {@link LlmResult}.
 */
@Component
public class ResilientLlmCaller {

    private static final Logger log = LoggerFactory.getLogger(ResilientLlmCaller.class);

    /** Lenient ObjectMapper that tolerates trailing commas, comments, and single quotes. */
    private static final ObjectMapper LENIENT_MAPPER = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
            .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
            .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
            .build()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final RetryPolicy policy;
    private final ExecutorService callExecutor;

    @Autowired
    public ResilientLlmCaller(CvPipelineProperties properties,
                              @Qualifier("llmCallExecutor") ExecutorService callExecutor) {
        this(RetryPolicy.from(properties.llm()), callExecutor);
    }

    public ResilientLlmCaller(RetryPolicy policy, ExecutorService callExecutor) {
        this.policy = policy;
        this.callExecutor = callExecutor;
    }

    /**
     * Calls the model and parses its answer into {@code type}.
     *
     * @param client       the text-generation client to use
     * @param agentName    agent name (for logging and token accounting)
     * @param systemPrompt the system prompt
     * @param userPrompt   the user prompt; format instructions are appended here
     * @param type         the target class for parsing
     * @param schemaCheck  returns the violations of a parsed answer, empty when it is acceptable
     * @param <T>          target type
     * @return OK with the payload, or the last failure once attempts are exhausted
     */
    public <T> LlmResult<T> call(TextGenerationClient client, String agentName, String systemPrompt,
                                 String userPrompt, Class<T> type, Function<T, List<String>> schemaCheck) {
        var converter = new BeanOutputConverter<>(type, LENIENT_MAPPER);
        String basePrompt = userPrompt + "\n\n" + converter.getFormat();

        List<String> lastViolations = List.of();
        String lastError = "no attempt made";
        boolean lastWasSchema = false;
        int attempt = 0;

        while (attempt < policy.maxAttempts()) {
            String stop = stopReason();
            if (stop != null) {
                log.warn("{}: {} after {} attempts", agentName, stop, attempt);
                return LlmResult.transientError(stop, attempt);
            }
            attempt++;
            String prompt = basePrompt + stricterInstructions(attempt, lastWasSchema ? lastViolations : List.of());
            try {
                String content = invokeWithTimeout(client, agentName, systemPrompt, prompt);
                T parsed = parse(converter, content);
                List<String> violations = schemaCheck.apply(parsed);
                if (!violations.isEmpty()) {
                    throw new SchemaValidationException(violations);
                }
                if (attempt > 1) {
                    log.info("{}: succeeded on attempt {}/{}", agentName, attempt, policy.maxAttempts());
                }
                return LlmResult.ok(parsed, attempt);
            } catch (SchemaValidationException e) {
                lastWasSchema = true;
                lastViolations = e.getViolations();
                lastError = e.getMessage();
                log.warn("{}: attempt {}/{} rejected ({})", agentName, attempt, policy.maxAttempts(),
                        truncate(lastError));
            } catch (TransientModelException e) {
                lastWasSchema = false;
                lastError = rootCauseMessage(e);
                if (attempt < policy.maxAttempts()) {
                    Duration delay = policy.backoffAfter(attempt);
                    if (!fitsBeforeDeadline(delay)) {
                        log.warn("{}: attempt {}/{} failed ({}), no time left for a retry",
                                agentName, attempt, policy.maxAttempts(), lastError);
                        break;
                    }
                    log.warn("{}: attempt {}/{} failed ({}), retrying in {}ms...",
                            agentName, attempt, policy.maxAttempts(), lastError, delay.toMillis());
                    if (!sleep(delay)) {
                        break;
                    }
                } else {
                    log.warn("{}: attempt {}/{} failed ({})", agentName, attempt, policy.maxAttempts(), lastError);
                }
            } catch (RuntimeException e) {
                lastError = e.getClass().getSimpleName() + ": " + rootCauseMessage(e);
                log.error("{}: attempt {}/{} failed with a non-retryable error ({})", agentName, attempt,
                        policy.maxAttempts(), lastError, e);
                return LlmResult.failed(lastError, attempt);
            }
        }

        log.error("{}: giving up after {} attempts: {}", agentName, attempt, truncate(lastError));
        return lastWasSchema
                ? LlmResult.validationError(lastError, attempt)
                : LlmResult.transientError(lastError, attempt);
    }

    /** Why no further attempt may start, or {@code null} when one may. */
    private static String stopReason() {
        if (Thread.currentThread().isInterrupted()) {
            return "interrupted";
        }
        if (RunDeadline.current().map(RunDeadline::expired).orElse(false)) {
            return "run deadline passed";
        }
        return null;
    }

    private static boolean fitsBeforeDeadline(Duration delay) {
        return RunDeadline.current().map(d -> d.remaining().compareTo(delay) > 0).orElse(true);
    }

    /** The per-call timeout, shortened to what is left of the run. */
    private Duration callTimeout() {
        Duration timeout = policy.callTimeout();
        return RunDeadline.current()
                .map(RunDeadline::remaining)
                .filter(left -> left.compareTo(timeout) < 0)
                .orElse(timeout);
    }

    private String invokeWithTimeout(TextGenerationClient client, String agentName,
                                     String systemPrompt, String prompt) {
        Supplier<String> task = TokenUsageAccumulator.propagate(
                () -> client.generate(agentName, systemPrompt, prompt));
        Future<String> future = callExecutor.submit(task::get);
        Duration timeout = callTimeout();
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ModelTimeoutException(agentName + ": no answer within " + timeout);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new TransientModelException(agentName + ": model call failed", cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new TransientModelException(agentName + ": interrupted while waiting for the model", e);
        }
    }

    private static <T> T parse(BeanOutputConverter<T> converter, String content) {
        T parsed;
        try {
            parsed = converter.convert(content);
        } catch (RuntimeException e) {
            throw new SchemaValidationException("unparseable JSON: " + rootCauseMessage(e), e);
        }
        if (parsed == null) {
            throw new SchemaValidationException(List.of("response parsed to null"));
        }
        return parsed;
    }

    static String stricterInstructions(int attempt, List<String> violations) {
        if (attempt == 1 || violations.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder("\n\nYOUR PREVIOUS ANSWER WAS REJECTED:\n");
        violations.forEach(v -> sb.append("- ").append(v).append('\n'));
        sb.append("Answer again with a single JSON object that satisfies the schema above.");
        if (attempt >= 3) {
            sb.append(" Output ONLY the raw JSON object: no prose, no markdown fences, no comments, "
                    + "no trailing commas.");
        }
        return sb.toString();
    }

    private static boolean sleep(Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return !Thread.currentThread().isInterrupted();
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static String rootCauseMessage(Throwable e) {
        Throwable cause = e;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        String msg = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return truncate(msg);
    }

    private static String truncate(String msg) {
        return msg != null && msg.length() > 150 ? msg.substring(0, 150) + "..." : msg;
    }
}
