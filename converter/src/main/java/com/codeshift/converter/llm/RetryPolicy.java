package com.codeshift.converter.llm;

import java.time.Duration;

/**
 * Exponential backoff for transient backend errors.
 *
 * @param maxRetries retries allowed after the first call (so at most maxRetries + 1 calls)
 * @param baseDelay  wait before the first retry
 * @param maxDelay   cap on any single wait
 */
public record RetryPolicy(int maxRetries, Duration baseDelay, Duration maxDelay) {

    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, got " + maxRetries);
        }
        if (baseDelay.isNegative() || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException(
                    "Need 0 <= baseDelay <= maxDelay, got %s / %s".formatted(baseDelay, maxDelay));
        }
    }

    public RetryPolicy withMaxRetries(int retries) {
        return new RetryPolicy(retries, baseDelay, maxDelay);
    }

    /**
     * Wait before retry number {@code retry} (1-based):
     * min(maxDelay, baseDelay × 2^(retry-1)).
     */
    public Duration delayBeforeRetry(int retry) {
        if (retry < 1) {
            throw new IllegalArgumentException("retry is 1-based, got " + retry);
        }
        int exponent = Math.min(retry - 1, 30);
        Duration delay = baseDelay.multipliedBy(1L << exponent);
        return delay.compareTo(maxDelay) > 0 ? maxDelay : delay;
    }
}
