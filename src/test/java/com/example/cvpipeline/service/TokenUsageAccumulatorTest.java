package com.example.cvpipeline.service;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;

class TokenUsageAccumulatorTest {

    @AfterEach
    void tearDown() {
        TokenUsageAccumulator.clear();
    }

    @Test
    @DisplayName("Should split tokens by channel")
    void shouldSplitByChannel() {
        TokenUsageAccumulator usage = TokenUsageAccumulator.start();

        usage.add(TokenUsageAccumulator.Channel.GENERATION, 120);
        usage.add(TokenUsageAccumulator.Channel.GRADING, 30);
        usage.add(TokenUsageAccumulator.Channel.GENERATION, 5);

        assertThat(usage.getGenerationTokens()).isEqualTo(125);
        assertThat(usage.getGradingTokens()).isEqualTo(30);
        assertThat(TokenUsageAccumulator.current()).isSameAs(usage);
    }

    @Test
    @DisplayName("Should count pooled work into the run that submitted it and restore the worker afterwards")
    void shouldPropagateToPooledThreads() throws Exception {
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            // warm the worker up before the run starts so it cannot inherit the accumulator
            pool.submit(() -> { }).get();
            TokenUsageAccumulator usage = TokenUsageAccumulator.start();

            Supplier<Boolean> task = TokenUsageAccumulator.propagate(() -> {
                TokenUsageAccumulator.current().add(TokenUsageAccumulator.Channel.GRADING, 42);
                return true;
            });
            CompletableFuture.supplyAsync(task, pool).get();
            TokenUsageAccumulator afterwards = CompletableFuture.supplyAsync(TokenUsageAccumulator::current, pool).get();

            assertThat(usage.getGradingTokens()).isEqualTo(42);
            assertThat(afterwards).isNull();
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("Should return null outside a run")
    void shouldBeAbsentOutsideRun() {
        assertThat(TokenUsageAccumulator.current()).isNull();
    }
}
