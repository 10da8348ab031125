package com.creativeforge.orchestrator.repository;

import com.creativeforge.orchestrator.model.SafetyAuditRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

/**
 * Append-only access to the safety_audit table.
 */
public interface SafetyAuditRepository extends JpaRepository<SafetyAuditRecord, UUID> {

    /** Full audit trail of one job, in check order. */
    List<SafetyAuditRecord> findByJobIdOrderByCheckedAtAsc(UUID jobId);
}
