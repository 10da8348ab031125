package com.creativeforge.orchestrator.model;

import java.util.Locale;

/**
 * The three external-call stages of the pipeline, in execution order.
 *
 * Each stage owns the job state it runs in and the failure reason
 * recorded when its external service keeps failing.
 */
public enum PipelineStage {
    ANALYSIS              (JobState.ANALYZING,              FailureReason.ANALYSIS_FAILED),
    BACKGROUND_GENERATION (JobState.GENERATING_BACKGROUNDS, FailureReason.BACKGROUND_GENERATION_FAILED),
    CAPTION_GENERATION    (JobState.GENERATING_CAPTION,     FailureReason.CAPTION_GENERATION_FAILED);

    private final JobState      state;
    private final FailureReason serviceFailure;

    PipelineStage(JobState state, FailureReason serviceFailure) {
        this.state          = state;
        this.serviceFailure = serviceFailure;
    }

    public JobState      state()          { return state; }
    public FailureReason serviceFailure() { return serviceFailure; }

    /** Lower-case tag used for metrics and log fields. */
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
