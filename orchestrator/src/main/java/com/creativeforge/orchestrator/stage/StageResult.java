package com.creativeforge.orchestrator.stage;

import com.creativeforge.orchestrator.model.FailureKind;
import com.creativeforge.orchestrator.model.FailureReason;

import java.time.Duration;

/**
 * Outcome of one stage attempt.
 *
 *   SUCCEEDED - {@code output} passed validation
 *   RETRY     - try again after {@code retryDelay}, adjusting with {@code retryHint}
 *   FAILED    - give up; the job fails with {@code failureReason}
 */
public record StageResult<O>(
        Status        status,
        O             output,
        FailureKind   failureKind,
        FailureReason failureReason,
        Duration      retryDelay,
        String        retryHint) {

    public enum Status { SUCCEEDED, RETRY, FAILED }

    public static <O> StageResult<O> succeeded(O output) {
        return new StageResult<>(Status.SUCCEEDED, output, null, null, Duration.ZERO, null);
    }

    public static <O> StageResult<O> retry(FailureKind kind, FailureReason reason, Duration delay, String hint) {
        return new StageResult<>(Status.RETRY, null, kind, reason, delay, hint);
    }

    public static <O> StageResult<O> failed(FailureKind kind, FailureReason reason) {
        return new StageResult<>(Status.FAILED, null, kind, reason, Duration.ZERO, null);
    }

    public boolean succeeded() {
        return status == Status.SUCCEEDED;
    }
}
