package com.creativeforge.orchestrator.api.dto;

import com.creativeforge.orchestrator.model.Job;
import com.creativeforge.orchestrator.model.JobState;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Response body for POST /jobs and GET /jobs/{id}.
 *
 * Variations and caption are only returned once the job is COMPLETE;
 * intermediate outputs may still be replaced by a safety regeneration.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobResponse(
        UUID         id,
        String       state,
        String       language,
        String       sourceAssetRef,
        String       category,
        Double       confidence,
        boolean      needsManualCategory,
        List<String> variationRefs,
        String       caption,
        String       failureReason,
        boolean      cancelRequested,
        Instant      createdAt,
        Instant      updatedAt,
        Instant      completedAt
) {
    public static JobResponse from(Job job) {
        boolean complete = job.getState() == JobState.COMPLETE;
        return new JobResponse(
                job.getId(),
                job.getState().name(),
                job.getLanguage().code(),
                job.getSourceAssetRef(),
                job.getAnalysisCategory() == null ? null : job.getAnalysisCategory().name(),
                job.getAnalysisConfidence(),
                job.isNeedsManualCategory(),
                complete ? job.getVariationRefs() : null,
                complete ? job.getCaptionText() : null,
                job.getFailureReason() == null ? null : job.getFailureReason().name(),
                job.isCancelRequested(),
                job.getCreatedAt(),
                job.getUpdatedAt(),
                job.getCompletedAt()
        );
    }
}
