package com.example.cvpipeline.service;

import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Per-run token-usage accumulator backed by an {@link InheritableThreadLocal}.
 *
 * <p>Usage pattern:
 * <pre>
 *   TokenUsageAccumulator usage = TokenUsageAccumulator.start();   // orchestrator, before the run
 *   try {
 *       ...
 *   } finally {
 *       TokenUsageAccumulator.clear();
 *   }
 * </pre>
 *
 * <p>Pooled worker threads outlive a single run, so tasks handed to an executor must be
 * wrapped with {@link #propagate(Supplier)} to count into the accumulator of the run that
 * submitted them.
 */
public final class TokenUsageAccumulator {

    /** Shared across child threads: {@code childValue} returns the parent instance. */
    private static final InheritableThreadLocal<TokenUsageAccumulator> CONTEXT =
            new InheritableThreadLocal<>() {
                @Override
                protected TokenUsageAccumulator childValue(TokenUsageAccumulator parent) {
                    return parent;
                }
            };

    private final AtomicLong generationTokens = new AtomicLong(0);
    private final AtomicLong gradingTokens = new AtomicLong(0);

    private TokenUsageAccumulator() {}

    // ── Lifecycle ────────────────────────────────────────────────────────────

    /**
     * Creates a fresh accumulator for the current thread and returns it.
     * Must be paired with a {@link #clear()} call (preferably in a {@code finally} block).
     */
    public static TokenUsageAccumulator start() {
        TokenUsageAccumulator acc = new TokenUsageAccumulator();
        CONTEXT.set(acc);
        return acc;
    }

    public static void clear() {
        CONTEXT.remove();
    }

    /**
     * Returns the accumulator bound to the current thread, or {@code null}
     * if {@link #start()} has not been called.
     */
    public static TokenUsageAccumulator current() {
        return CONTEXT.get();
    }

    // ── Propagation to pooled threads ────────────────────────────────────────

    public static <T> Supplier<T> propagate(Supplier<T> task) {
        TokenUsageAccumulator acc = current();
        return () -> {
            TokenUsageAccumulator previous = CONTEXT.get();
            CONTEXT.set(acc);
            try {
                return task.get();
            } finally {
                restore(previous);
            }
        };
    }

    private static void restore(TokenUsageAccumulator previous) {
        if (previous == null) {
            CONTEXT.remove();
        } else {
            CONTEXT.set(previous);
        }
    }

    // ── Accumulation ─────────────────────────────────────────────────────────

    public void add(Channel channel, long tokens) {
        if (channel == Channel.GRADING) {
            gradingTokens.addAndGet(tokens);
        } else {
            generationTokens.addAndGet(tokens);
        }
    }

    // ── Read ─────────────────────────────────────────────────────────────────

    public long getGenerationTokens() {
        return generationTokens.get();
    }

    public long getGradingTokens() {
        return gradingTokens.get();
    }

    /** Which model family a call was billed to. */
    public enum Channel {
        GENERATION,
        GRADING
    }
}
