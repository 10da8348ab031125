package com.creativeforge.orchestrator.retry;

import java.time.Duration;

/**
 * Outcome of {@link RetryPolicy#decide}: retry after {@code delay}, or give up.
 */
public record RetryDecision(boolean shouldRetry, Duration delay) {

    private static final RetryDecision GIVE_UP = new RetryDecision(false, Duration.ZERO);

    public static RetryDecision giveUp() {
        return GIVE_UP;
    }

    public static RetryDecision retryAfter(Duration delay) {
        return new RetryDecision(true, delay);
    }
}
