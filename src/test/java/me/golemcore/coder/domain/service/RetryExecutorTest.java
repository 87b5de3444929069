package me.golemcore.coder.domain.service;

import me.golemcore.coder.domain.model.ToolFailureKind;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RetryExecutorTest {

    private final List<Long> delays = new ArrayList<>();

    private final RetryExecutor executor = new RetryExecutor() {
        @Override
        protected void sleepBeforeRetry(long delayMs) {
            delays.add(delayMs);
        }
    };

    private static final RetryExecutor.RetryPolicy POLICY = new RetryExecutor.RetryPolicy(2, 100, 150, 2.0);

    @Test
    void retriesTransientFailuresWithBackoff() {
        AtomicInteger calls = new AtomicInteger();

        RetryExecutor.RetryOutcome<String> outcome = executor.execute(() -> calls.incrementAndGet() < 3
                ? CompletableFuture.failedFuture(new IllegalStateException("ECONNRESET by peer"))
                : CompletableFuture.completedFuture("ok"), 1_000, POLICY, "tool:file_read");

        assertTrue(outcome.success());
        assertEquals("ok", outcome.result());
        assertEquals(3, outcome.attempts());
        assertEquals(List.of(100L, 150L), delays);
    }

    @Test
    void permanentFailureStopsAfterFirstAttempt() {
        AtomicInteger calls = new AtomicInteger();

        RetryExecutor.RetryOutcome<String> outcome = executor.execute(() -> {
            calls.incrementAndGet();
            return CompletableFuture.failedFuture(new IllegalArgumentException("syntax error in file"));
        }, 1_000, POLICY, "tool:file_edit");

        assertFalse(outcome.success());
        assertEquals(1, calls.get());
        assertEquals("syntax error in file", outcome.errorMessage());
        assertTrue(delays.isEmpty());
    }

    @Test
    void attemptTimesOut() {
        RetryExecutor.RetryOutcome<String> outcome = executor.execute(CompletableFuture::new, 20,
                new RetryExecutor.RetryPolicy(0, 10, 10, 2.0), "tool:command_execute");

        assertFalse(outcome.success());
        ToolExecutionException error = assertInstanceOf(ToolExecutionException.class, outcome.error());
        assertEquals(ToolFailureKind.TIMEOUT, error.getFailureKind());
        assertTrue(outcome.errorMessage().contains("timed out after 20ms"));
    }

    @Test
    void policyDeniedIsNeverRetryable() {
        assertFalse(RetryExecutor.isRetryable(
                new ToolExecutionException("network timeout", ToolFailureKind.POLICY_DENIED)));
        assertTrue(RetryExecutor.isRetryable(new RuntimeException("wrapped", new RuntimeException("HTTP 503"))));
        assertFalse(RetryExecutor.isRetryable(new RuntimeException("file not found")));
    }

    @Test
    void delayIsCapped() {
        RetryExecutor.RetryPolicy policy = new RetryExecutor.RetryPolicy(5, 2_000, 10_000, 2.0);

        assertEquals(2_000, policy.delayForAttempt(0));
        assertEquals(8_000, policy.delayForAttempt(2));
        assertEquals(10_000, policy.delayForAttempt(4));
    }
}
