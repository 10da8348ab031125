package com.creativeforge.orchestrator.safety;

import com.creativeforge.orchestrator.model.PipelineStage;

/**
 * Result of moderating one stage's output.
 */
public record SafetyVerdict(PipelineStage stage, boolean safe, String reason) {

    public static SafetyVerdict safe(PipelineStage stage) {
        return new SafetyVerdict(stage, true, null);
    }

    public static SafetyVerdict unsafe(PipelineStage stage, String reason) {
        return new SafetyVerdict(stage, false, reason);
    }
}
