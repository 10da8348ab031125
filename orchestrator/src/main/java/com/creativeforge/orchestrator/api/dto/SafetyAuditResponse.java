package com.creativeforge.orchestrator.api.dto;

import com.creativeforge.orchestrator.model.SafetyAuditRecord;

import java.time.Instant;

/** One entry of GET /jobs/{id}/safety-audit. */
public record SafetyAuditResponse(
        String  stage,
        String  verdict,
        String  reason,
        int     regenerationRound,
        Instant checkedAt
) {
    public static SafetyAuditResponse from(SafetyAuditRecord record) {
        return new SafetyAuditResponse(
                record.getStage().tag(),
                record.getVerdict().name(),
                record.getReason(),
                record.getRegenerationRound(),
                record.getCheckedAt()
        );
    }
}
