package com.creativeforge.orchestrator.model;

/**
 * Retry classification of a failed attempt.
 *
 * TRANSIENT failures (timeouts, 5xx, throttling, a malformed response) are
 * retried with backoff; PERMANENT ones (invalid input, low confidence) are not.
 */
public enum FailureKind {
    TRANSIENT,
    PERMANENT
}
