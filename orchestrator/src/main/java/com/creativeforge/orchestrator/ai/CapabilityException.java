package com.creativeforge.orchestrator.ai;

import com.creativeforge.orchestrator.model.FailureKind;

/**
 * Thrown when an external AI capability fails or is unreachable.
 *
 * Carries the retry classification so stage executors never need to
 * interpret transport details themselves.
 */
public class CapabilityException extends RuntimeException {

    private final FailureKind kind;

    public CapabilityException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public CapabilityException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static CapabilityException transientFailure(String message, Throwable cause) {
        return new CapabilityException(FailureKind.TRANSIENT, message, cause);
    }

    /** 408, 429 and 5xx are worth retrying; any other non-2xx status is not. */
    public static CapabilityException forStatus(int statusCode, String message) {
        boolean retryable = statusCode == 408 || statusCode == 429 || statusCode >= 500;
        return new CapabilityException(retryable ? FailureKind.TRANSIENT : FailureKind.PERMANENT, message);
    }

    public FailureKind kind() { return kind; }
}
