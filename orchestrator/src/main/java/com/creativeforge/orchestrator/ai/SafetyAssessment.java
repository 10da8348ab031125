package com.creativeforge.orchestrator.ai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Moderation result for one piece of generated content.
 *
 * @param flaggedCategories policy categories that triggered an unsafe verdict (empty when safe)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SafetyAssessment(boolean safe, String reason, List<String> flaggedCategories) {

    public SafetyAssessment {
        flaggedCategories = flaggedCategories == null ? List.of() : List.copyOf(flaggedCategories);
    }
}
