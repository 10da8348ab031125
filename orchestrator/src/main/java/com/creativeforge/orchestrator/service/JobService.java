package com.creativeforge.orchestrator.service;

import com.creativeforge.orchestrator.gate.AdmissionTicket;
import com.creativeforge.orchestrator.gate.ConcurrencyGate;
import com.creativeforge.orchestrator.gate.ThrottledException;
import com.creativeforge.orchestrator.model.Job;
import com.creativeforge.orchestrator.model.OutputLanguage;
import com.creativeforge.orchestrator.model.SafetyAuditRecord;
import com.creativeforge.orchestrator.repository.SafetyAuditRepository;
import com.creativeforge.orchestrator.store.JobAlreadyExistsException;
import com.creativeforge.orchestrator.store.JobNotFoundException;
import com.creativeforge.orchestrator.store.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * Caller-facing job operations: submit, status, cancel.
 *
 * Submission order:
 *  1. Create the PENDING record (the id comes from the idempotency key when one is given)
 *  2. Ask the gate for a slot; on Throttled the record is deleted again
 *  3. If admitted straight away, hand the job to the dispatcher
 *
 * Creating before admitting means a job the gate admits from the queue
 * always exists in the store by the time it is started.
 */
@Service
public class JobService {

    private static final Logger log = LoggerFactory.getLogger(JobService.class);

    private final JobStore              store;
    private final ConcurrencyGate       gate;
    private final Orchestrator          orchestrator;
    private final StageDispatcher       dispatcher;
    private final SafetyAuditRepository auditRepo;
    private final Clock                 clock;

    public JobService(JobStore store,
                      ConcurrencyGate gate,
                      Orchestrator orchestrator,
                      StageDispatcher dispatcher,
                      SafetyAuditRepository auditRepo,
                      Clock clock) {
        this.store        = store;
        this.gate         = gate;
        this.orchestrator = orchestrator;
        this.dispatcher   = dispatcher;
        this.auditRepo    = auditRepo;
        this.clock        = clock;
    }

    // ------------------------------------------------------------------
    // Submission
    // ------------------------------------------------------------------

    /**
     * Submit a source image for processing.
     *
     * @param idempotencyKey optional; a repeat with the same owner and key returns the first job
     * @throws IllegalArgumentException for a blank owner or asset, or an unsupported language
     * @throws ThrottledException if the system-wide ceiling is reached; no job is created
     */
    public SubmitResult submit(String ownerId, String sourceAssetRef, String languageCode, String idempotencyKey) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new IllegalArgumentException("ownerId is required");
        }
        if (sourceAssetRef == null || sourceAssetRef.isBlank()) {
            throw new IllegalArgumentException("sourceAssetRef is required");
        }
        OutputLanguage language = OutputLanguage.fromCode(languageCode);
        String key = idempotencyKey == null || idempotencyKey.isBlank() ? null : idempotencyKey;

        UUID jobId = key == null ? UUID.randomUUID() : idempotentId(ownerId, key);
        Job job = new Job(jobId, ownerId, sourceAssetRef, language, key, clock.instant());
        try {
            store.create(job);
        } catch (JobAlreadyExistsException e) {
            // The record of a racing submission that was throttled may have been deleted already.
            Job existing = store.get(jobId).orElseThrow(() -> new ThrottledException(gate.globalCeiling()));
            log.info("Idempotent replay of job {} for owner '{}'", jobId, ownerId);
            return new SubmitResult(existing, false);
        }

        AdmissionTicket ticket;
        try {
            ticket = gate.admit(ownerId, jobId);
        } catch (ThrottledException e) {
            store.delete(jobId);
            throw e;
        }
        log.info("Job {} submitted by owner '{}' ({}, {})", jobId, ownerId, language.code(), ticket.status());
        if (ticket.isAdmitted()) {
            dispatcher.start(jobId);
        }
        return new SubmitResult(store.get(jobId).orElse(job), true);
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    /**
     * @throws JobNotFoundException if the job does not exist
     */
    public Job getStatus(UUID jobId) {
        return store.get(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    /** Every safety verdict recorded for the job, oldest first. */
    public List<SafetyAuditRecord> safetyAudit(UUID jobId) {
        return auditRepo.findByJobIdOrderByCheckedAtAsc(jobId);
    }

    public Duration latencyUpperBound() {
        return orchestrator.latencyUpperBound();
    }

    // ------------------------------------------------------------------
    // Cancellation
    // ------------------------------------------------------------------

    /**
     * Request cancellation. A no-op for a job that already finished.
     *
     * @return the job as stored after the request
     * @throws JobNotFoundException if the job does not exist
     */
    public Job cancel(UUID jobId) {
        Advance next = orchestrator.cancel(jobId);
        dispatcher.follow(jobId, next);
        return getStatus(jobId);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** Same owner and key always map to the same job id; different owners never collide. */
    static UUID idempotentId(String ownerId, String idempotencyKey) {
        String name = ownerId.length() + ":" + ownerId + ":" + idempotencyKey;
        return UUID.nameUUIDFromBytes(name.getBytes(StandardCharsets.UTF_8));
    }
}
