package com.example.cvpipeline.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Wall-clock deadline of one run.
 * <p>
 * The orchestrator binds the deadline to its thread for the length of the run, and tasks handed to
 * the worker pool carry it along through {@link #propagate(Supplier)}, the same way
 * {@link TokenUsageAccumulator} does. {@link ResilientLlmCaller} reads the bound deadline so that
 * no model call, retry or backoff outlives the run.
 */
public final class RunDeadline {

    private static final ThreadLocal<RunDeadline> CONTEXT = new ThreadLocal<>();

    private final Clock clock;
    private final Instant expiresAt;

    private RunDeadline(Clock clock, Instant expiresAt) {
        this.clock = clock;
        this.expiresAt = expiresAt;
    }

    public static RunDeadline after(Clock clock, Duration timeout) {
        return new RunDeadline(clock, clock.instant().plus(timeout));
    }

    public boolean expired() {
        return !clock.instant().isBefore(expiresAt);
    }

    /** Time left, never negative. */
    public Duration remaining() {
        Duration left = Duration.between(clock.instant(), expiresAt);
        return left.isNegative() ? Duration.ZERO : left;
    }

    public Instant expiresAt() {
        return expiresAt;
    }

    // ── Thread binding ───────────────────────────────────────────────────────

    /** Binds this deadline to the current thread. Pair with {@link #unbind()}. */
    public RunDeadline bind() {
        CONTEXT.set(this);
        return this;
    }

    public static void unbind() {
        CONTEXT.remove();
    }

    public static Optional<RunDeadline> current() {
        return Optional.ofNullable(CONTEXT.get());
    }

    public static <T> Supplier<T> propagate(Supplier<T> task) {
        RunDeadline deadline = CONTEXT.get();
        return () -> {
            RunDeadline previous = CONTEXT.get();
            CONTEXT.set(deadline);
            try {
                return task.get();
            } finally {
                if (previous == null) {
                    CONTEXT.remove();
                } else {
                    CONTEXT.set(previous);
                }
            }
        };
    }
}
