package me.golemcore.coder.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.coder.domain.model.ToolFailureKind;
import me.golemcore.coder.infrastructure.config.CoderProperties;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs an asynchronous operation with a per-attempt timeout and exponential
 * backoff between attempts.
 *
 * <p>
 * Only failures whose message or type mentions a transient condition
 * (connection reset, timeout, rate limit, gateway errors) are retried. Other
 * failures end the run on the first attempt. The executor never throws: the
 * outcome carries either the result or the last error.
 */
@Component
@Slf4j
public class RetryExecutor {

    private static final List<String> RETRYABLE_MARKERS = List.of(
            "econnreset", "etimedout", "enotfound", "econnrefused", "rate_limit", "timeout", "timed out",
            "network", "429", "502", "503", "504");

    public <T> RetryOutcome<T> execute(Supplier<CompletableFuture<T>> operation, long timeoutMs, RetryPolicy policy,
            String context) {
        long start = System.currentTimeMillis();
        Throwable lastError = null;
        for (int attempt = 0; attempt <= policy.maxRetries(); attempt++) {
            try {
                T result = awaitWithTimeout(operation.get(), timeoutMs, context);
                if (attempt > 0) {
                    log.info("[Retry] {}: success after {} attempts", context, attempt + 1);
                }
                return RetryOutcome.success(result, attempt + 1, System.currentTimeMillis() - start);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return RetryOutcome.failure(e, attempt + 1, System.currentTimeMillis() - start);
            } catch (RuntimeException e) {
                lastError = e;
                boolean retryable = isRetryable(e);
                log.warn("[Retry] {}: attempt {}/{} failed (retryable={}): {}",
                        context, attempt + 1, policy.maxRetries() + 1, retryable, e.getMessage());
                if (!retryable || attempt == policy.maxRetries()) {
                    break;
                }
                try {
                    sleepBeforeRetry(policy.delayForAttempt(attempt));
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return RetryOutcome.failure(ie, attempt + 1, System.currentTimeMillis() - start);
                }
            }
        }
        log.warn("[Retry] {}: giving up", context);
        return RetryOutcome.failure(lastError, policy.maxRetries() + 1, System.currentTimeMillis() - start);
    }

    public static boolean isRetryable(Throwable error) {
        if (error instanceof ToolExecutionException toolError
                && toolError.getFailureKind() == ToolFailureKind.POLICY_DENIED) {
            return false;
        }
        Throwable current = error;
        while (current != null) {
            String text = (current.getClass().getSimpleName() + " " + current.getMessage()).toLowerCase(Locale.ROOT);
            if (RETRYABLE_MARKERS.stream().anyMatch(text::contains)) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    protected void sleepBeforeRetry(long delayMs) throws InterruptedException {
        Thread.sleep(delayMs);
    }

    private static <T> T awaitWithTimeout(CompletableFuture<T> future, long timeoutMs, String context)
            throws InterruptedException {
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ToolExecutionException(context + " timed out after " + timeoutMs + "ms",
                    ToolFailureKind.TIMEOUT, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new ToolExecutionException(cause.getMessage(), ToolFailureKind.EXECUTION_FAILED, cause);
        }
    }

    /**
     * Attempts are {@code maxRetries + 1}. The delay before retry {@code n}
     * (zero based) is {@code initialDelayMs * multiplier^n}, capped.
     */
    public record RetryPolicy(int maxRetries, long initialDelayMs, long maxDelayMs, double backoffMultiplier) {

        public static RetryPolicy from(CoderProperties.ToolsProperties tools) {
            return new RetryPolicy(tools.getMaxRetries(), tools.getInitialRetryDelayMs(),
                    tools.getMaxRetryDelayMs(), tools.getBackoffMultiplier());
        }

        public long delayForAttempt(int attempt) {
            double delay = initialDelayMs * Math.pow(backoffMultiplier, attempt);
            return (long) Math.min(delay, maxDelayMs);
        }
    }

    public record RetryOutcome<T>(boolean success, T result, Throwable error, int attempts, long totalDurationMs) {

        static <T> RetryOutcome<T> success(T result, int attempts, long durationMs) {
            return new RetryOutcome<>(true, result, null, attempts, durationMs);
        }

        static <T> RetryOutcome<T> failure(Throwable error, int attempts, long durationMs) {
            return new RetryOutcome<>(false, null, error, attempts, durationMs);
        }

        public String errorMessage() {
            if (error == null) {
                return "Unknown error";
            }
            return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        }
    }
}
