package com.di.flightwarehouse.pipeline;

import com.di.flightwarehouse.exception.ErrorCategory;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Bounded retry with a fixed backoff, applied per stage.
 * <p>
 * Only structural failures are retried. An error categorized as {@link ErrorCategory#DATA_QUALITY}
 * ends the stage at once, since repeating the same checks on the same data cannot change the answer.
 */
@Slf4j
public class RetryPolicy {

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    /**
     * @param value    the task result, when it succeeded
     * @param attempts attempts made, 1-based
     * @param failure  the last error, or null on success
     */
    public record Outcome<T>(T value, int attempts, Throwable failure) {
        public boolean succeeded() {
            return failure == null;
        }
    }

    private final int maxRetries;
    private final Duration backoff;
    private final Sleeper sleeper;

    public RetryPolicy(int maxRetries, Duration backoff) {
        this(maxRetries, backoff, d -> Thread.sleep(d.toMillis()));
    }

    public RetryPolicy(int maxRetries, Duration backoff, Sleeper sleeper) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        this.maxRetries = maxRetries;
        this.backoff = backoff;
        this.sleeper = sleeper;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    /** Runs {@code task} until it succeeds, fails with a non-retryable error, or retries run out. Never throws. */
    public <T> Outcome<T> execute(String stage, Callable<T> task) {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return new Outcome<>(task.call(), attempt, null);
            } catch (Exception e) {
                ErrorCategory category = ErrorCategory.categorize(e);
                if (!category.isRetryable() || attempt > maxRetries) {
                    log.error("[RETRY] {} failed on attempt {}/{} [{}], giving up: {}",
                            stage, attempt, maxRetries + 1, category, e.getMessage());
                    return new Outcome<>(null, attempt, e);
                }
                log.warn("[RETRY] {} failed on attempt {}/{} [{}], retrying in {}: {}",
                        stage, attempt, maxRetries + 1, category, backoff, e.getMessage());
                try {
                    sleeper.sleep(backoff);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    e.addSuppressed(ie);
                    return new Outcome<>(null, attempt, e);
                }
            }
        }
    }
}
