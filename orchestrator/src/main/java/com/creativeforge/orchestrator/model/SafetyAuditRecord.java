package com.creativeforge.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One safety verdict, appended for every check regardless of how the job ends.
 *
 * Rows are never updated; downstream quality review reads them by job id.
 *
 * DB table: safety_audit  (created by Flyway V2 migration)
 */
@Entity
@Table(name = "safety_audit")
public class SafetyAuditRecord {

    public enum Verdict { SAFE, UNSAFE }

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "job_id", nullable = false, updatable = false)
    private UUID jobId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private PipelineStage stage;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private Verdict verdict;

    @Column(updatable = false)
    private String reason;

    // 0 for the first check of a stage's output, 1 after its regeneration.
    @Column(name = "regeneration_round", nullable = false, updatable = false)
    private int regenerationRound;

    @Column(name = "checked_at", nullable = false, updatable = false)
    private Instant checkedAt;

    protected SafetyAuditRecord() {}   // required by JPA

    public SafetyAuditRecord(UUID jobId, PipelineStage stage, Verdict verdict,
                             String reason, int regenerationRound, Instant checkedAt) {
        this.jobId             = jobId;
        this.stage             = stage;
        this.verdict           = verdict;
        this.reason            = reason;
        this.regenerationRound = regenerationRound;
        this.checkedAt         = checkedAt;
    }

    public UUID          getId()                { return id; }
    public UUID          getJobId()             { return jobId; }
    public PipelineStage getStage()             { return stage; }
    public Verdict       getVerdict()           { return verdict; }
    public String        getReason()            { return reason; }
    public int           getRegenerationRound() { return regenerationRound; }
    public Instant       getCheckedAt()         { return checkedAt; }
}
