package com.creativeforge.orchestrator.stage;

import com.creativeforge.orchestrator.model.FailureKind;
import com.creativeforge.orchestrator.model.FailureReason;

/**
 * Output of an external call did not have the required shape.
 *
 * A TRANSIENT validation failure consumes an attempt and is retried like a
 * service error; {@code retryHint} tells the next attempt how to adjust.
 */
public class StageValidationException extends RuntimeException {

    private final FailureKind   kind;
    private final FailureReason reason;
    private final String        retryHint;

    public StageValidationException(FailureKind kind, FailureReason reason, String message) {
        this(kind, reason, null, message);
    }

    public StageValidationException(FailureKind kind, FailureReason reason, String retryHint, String message) {
        super(message);
        this.kind      = kind;
        this.reason    = reason;
        this.retryHint = retryHint;
    }

    public FailureKind   kind()      { return kind; }
    public FailureReason reason()    { return reason; }
    public String        retryHint() { return retryHint; }
}
