package com.creativeforge.orchestrator.safety;

import com.creativeforge.orchestrator.model.SafetyAuditRecord;

/**
 * Append-only destination for safety verdicts.
 *
 * Implementations must not throw: losing an audit row is logged, it never
 * changes the outcome of a job.
 */
public interface SafetyAuditSink {

    void append(SafetyAuditRecord record);
}
