package com.creativeforge.orchestrator.model;

/**
 * States of the creative pipeline for a Job.
 *
 * Transitions (happy path):
 *   PENDING → ANALYZING → GENERATING_BACKGROUNDS → GENERATING_CAPTION
 *           → VALIDATING_SAFETY → COMPLETE
 *
 * The only backward edges are the regeneration edges out of VALIDATING_SAFETY.
 * Any non-terminal state can transition to FAILED (stage failure, safety
 * rejection or cancellation).
 */
public enum JobState {
    PENDING,
    ANALYZING,
    GENERATING_BACKGROUNDS,
    GENERATING_CAPTION,
    VALIDATING_SAFETY,
    COMPLETE,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETE || this == FAILED;
    }

    /** True once the job holds a concurrency slot (admitted and not yet finished). */
    public boolean isAdmitted() {
        return this != PENDING && !isTerminal();
    }

    public boolean canTransitionTo(JobState next) {
        if (isTerminal() || next == null) return false;
        if (next == FAILED) return true;
        return switch (this) {
            case PENDING                -> next == ANALYZING;
            case ANALYZING              -> next == GENERATING_BACKGROUNDS;
            case GENERATING_BACKGROUNDS -> next == GENERATING_CAPTION;
            case GENERATING_CAPTION     -> next == VALIDATING_SAFETY;
            case VALIDATING_SAFETY      -> next == COMPLETE
                                        || next == GENERATING_BACKGROUNDS
                                        || next == GENERATING_CAPTION;
            default                     -> false;
        };
    }
}
