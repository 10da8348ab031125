package com.creativeforge.orchestrator.model;

/**
 * Closed set of reasons a job can end in FAILED.
 *
 * Raw external-service error text never reaches job state; it is logged and
 * mapped to one of these values.
 */
public enum FailureReason {
    LOW_CONFIDENCE,                 // analysis confidence below the floor, needs a manual category
    INVALID_SOURCE_ASSET,           // analysis service rejected the input
    ANALYSIS_FAILED,
    INVALID_ANALYSIS,               // analysis output never passed validation
    BACKGROUND_GENERATION_FAILED,
    INSUFFICIENT_VARIATIONS,        // fewer than 3 distinct backgrounds after retries
    CAPTION_GENERATION_FAILED,
    CAPTION_LENGTH_OUT_OF_RANGE,
    SAFETY_CHECK_FAILED,            // moderation service unavailable after retries
    SAFETY_REJECTED,                // unsafe again after the single regeneration
    CANCELLED
}
