package com.creativeforge.orchestrator.retry;

import com.creativeforge.orchestrator.model.FailureKind;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * The single backoff rule shared by every stage and the safety check.
 *
 * Attempt k (1-based) that failed transiently is retried after
 * {@code base * 2^(k-1)} plus a jitter in {@code [0, jitterRatio * base * 2^(k-1))}.
 * With jitterRatio at most 1 the delay before attempt k+1 is never shorter
 * than the delay before attempt k.
 *
 * Stateless and thread-safe: the attempt count lives in the persisted job.
 */
public final class RetryPolicy {

    private final int            maxAttempts;
    private final Duration       baseDelay;
    private final double         jitterRatio;
    private final DoubleSupplier random;

    public RetryPolicy(int maxAttempts, Duration baseDelay, double jitterRatio) {
        this(maxAttempts, baseDelay, jitterRatio, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param random source of uniform values in [0,1); injectable for deterministic tests
     */
    public RetryPolicy(int maxAttempts, Duration baseDelay, double jitterRatio, DoubleSupplier random) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must be a non-negative duration");
        }
        if (jitterRatio < 0.0 || jitterRatio > 1.0) {
            throw new IllegalArgumentException("jitterRatio must be within [0,1], got " + jitterRatio);
        }
        this.maxAttempts = maxAttempts;
        this.baseDelay   = baseDelay;
        this.jitterRatio = jitterRatio;
        this.random      = Objects.requireNonNull(random);
    }

    /**
     * Decide what to do after {@code attempt} failed.
     *
     * @param attempt the 1-based number of the attempt that just failed
     */
    public RetryDecision decide(int attempt, FailureKind kind) {
        if (kind == FailureKind.PERMANENT || attempt >= maxAttempts) {
            return RetryDecision.giveUp();
        }
        long exponential = exponentialMillis(attempt);
        long jitter      = (long) (exponential * jitterRatio * random.getAsDouble());
        return RetryDecision.retryAfter(Duration.ofMillis(exponential + jitter));
    }

    /** Longest delay {@link #decide} can return after {@code attempt}, used for latency bounds. */
    public Duration maxDelay(int attempt) {
        if (attempt >= maxAttempts) return Duration.ZERO;
        long exponential = exponentialMillis(attempt);
        return Duration.ofMillis(exponential + (long) Math.ceil(exponential * jitterRatio));
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    private long exponentialMillis(int attempt) {
        int shift = Math.max(0, Math.min(attempt - 1, 30));
        return baseDelay.toMillis() << shift;
    }
}
