package com.creativeforge.orchestrator.service;

import com.creativeforge.orchestrator.ai.CapabilityException;
import com.creativeforge.orchestrator.gate.AdmissionTicket;
import com.creativeforge.orchestrator.gate.ConcurrencyGate;
import com.creativeforge.orchestrator.model.FailureReason;
import com.creativeforge.orchestrator.model.Job;
import com.creativeforge.orchestrator.model.JobState;
import com.creativeforge.orchestrator.model.PipelineStage;
import com.creativeforge.orchestrator.retry.RetryDecision;
import com.creativeforge.orchestrator.retry.RetryPolicy;
import com.creativeforge.orchestrator.safety.SafetyValidator;
import com.creativeforge.orchestrator.safety.SafetyVerdict;
import com.creativeforge.orchestrator.stage.AnalysisStage;
import com.creativeforge.orchestrator.stage.BackgroundGenerationStage;
import com.creativeforge.orchestrator.stage.CaptionGenerationStage;
import com.creativeforge.orchestrator.stage.StageExecutor;
import com.creativeforge.orchestrator.stage.StageResult;
import com.creativeforge.orchestrator.store.JobNotFoundException;
import com.creativeforge.orchestrator.store.JobStore;
import com.creativeforge.orchestrator.store.JobStore.CasResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * The job state machine.
 *
 * Every call re-reads the job from the JobStore, performs the one unit of
 * work its stored state calls for, and writes the result back with a
 * compare-and-swap keyed on the state and revision it read. Losing the CAS
 * means another execution already moved the job on; the result is dropped.
 * If the write that won was a cancellation request, the job is advanced once
 * more so the request is observed.
 *
 * <pre>
 * PENDING → ANALYZING → GENERATING_BACKGROUNDS → GENERATING_CAPTION → VALIDATING_SAFETY → COMPLETE
 *                                  ▲                     ▲                   │
 *                                  └─────── unsafe, first time only ─────────┘
 * </pre>
 *
 * A concurrency slot is released exactly when the job enters COMPLETE or FAILED.
 */
@Service
public class Orchestrator {

    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);

    private final JobStore                  store;
    private final ConcurrencyGate           gate;
    private final AnalysisStage             analysis;
    private final BackgroundGenerationStage backgrounds;
    private final CaptionGenerationStage    caption;
    private final SafetyValidator           safety;
    private final RetryPolicy               retryPolicy;
    private final Clock                     clock;

    public Orchestrator(JobStore store,
                        ConcurrencyGate gate,
                        AnalysisStage analysis,
                        BackgroundGenerationStage backgrounds,
                        CaptionGenerationStage caption,
                        SafetyValidator safety,
                        RetryPolicy retryPolicy,
                        Clock clock) {
        this.store       = store;
        this.gate        = gate;
        this.analysis    = analysis;
        this.backgrounds = backgrounds;
        this.caption     = caption;
        this.safety      = safety;
        this.retryPolicy = retryPolicy;
        this.clock       = clock;
    }

    // ------------------------------------------------------------------
    // Entry points (called by StageDispatcher and JobService)
    // ------------------------------------------------------------------

    /**
     * Move an admitted job out of PENDING.
     *
     * Nothing else advances a PENDING job, so a lost CAS (a concurrent cancel
     * request) is retried against the fresh record.
     */
    public Advance start(UUID jobId) {
        while (true) {
            Job job = store.get(jobId).orElse(null);
            if (job == null || job.getState() != JobState.PENDING) {
                return Advance.idle();
            }
            withMdc(job);
            try {
                Job next = job.snapshot();
                if (job.isCancelRequested()) {
                    next.fail(FailureReason.CANCELLED, clock.instant());
                    if (swap(job, next) == CasResult.APPLIED) {
                        log.info("Job {} cancelled before it started", jobId);
                        return released(job);
                    }
                    continue;
                }
                next.enterState(JobState.ANALYZING, clock.instant());
                if (swap(job, next) == CasResult.APPLIED) {
                    log.info("Job {} admitted, starting analysis", jobId);
                    return Advance.proceed();
                }
            } finally {
                MDC.clear();
            }
        }
    }

    /** Run the unit of work for the job's current state. */
    public Advance advance(UUID jobId) {
        Job job = store.get(jobId).orElse(null);
        if (job == null || !job.getState().isAdmitted()) {
            return Advance.idle();
        }
        withMdc(job);
        try {
            if (job.isCancelRequested()) {
                log.info("Job {} cancelled in {}", jobId, job.getState());
                return finish(job, FailureReason.CANCELLED);
            }
            return switch (job.getState()) {
                case ANALYZING              -> runStage(job, analysis,    JobState.GENERATING_BACKGROUNDS);
                case GENERATING_BACKGROUNDS -> runStage(job, backgrounds, JobState.GENERATING_CAPTION);
                case GENERATING_CAPTION     -> caption.isRequired(job)
                                               ? runStage(job, caption, JobState.VALIDATING_SAFETY)
                                               : keepCaption(job);
                case VALIDATING_SAFETY      -> validateSafety(job);
                default                     -> Advance.idle();
            };
        } finally {
            MDC.clear();
        }
    }

    /**
     * Request cancellation.
     *
     * A job still waiting at the gate is withdrawn and failed at once. A
     * running job only gets the sticky flag; it fails before its next unit.
     *
     * @return CONTINUE when the dispatcher should run the job to observe the flag
     * @throws JobNotFoundException if the job does not exist
     */
    public Advance cancel(UUID jobId) {
        while (true) {
            Job job = store.get(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
            if (job.getState().isTerminal()) {
                return Advance.idle();
            }
            Job next = job.snapshot();
            next.requestCancel(clock.instant());

            if (job.getState() == JobState.PENDING && gate.withdraw(job.getOwnerId(), jobId)) {
                next.fail(FailureReason.CANCELLED, clock.instant());
                if (swap(job, next) == CasResult.APPLIED) {
                    log.info("Job {} cancelled while queued", jobId);
                    return Advance.idle();
                }
                continue;
            }
            if (swap(job, next) == CasResult.APPLIED) {
                log.info("Cancellation requested for job {} in {}", jobId, job.getState());
                return job.getState() == JobState.PENDING ? Advance.idle() : Advance.proceed();
            }
        }
    }

    /**
     * Longest time an admitted job can take to reach a terminal state.
     *
     * Each stage contributes maxAttempts timeouts plus every backoff delay.
     * Background generation, caption generation and the safety check run at
     * most twice because of the single regeneration round; a safety attempt
     * makes two moderation calls. Time spent queued at the gate is not included.
     */
    public Duration latencyUpperBound() {
        Duration generation = stageBound(backgrounds.timeout())
                .plus(stageBound(caption.timeout()))
                .plus(stageBound(safety.timeout().multipliedBy(SafetyValidator.CHECKED_STAGES.size())));
        return stageBound(analysis.timeout()).plus(generation.multipliedBy(2));
    }

    // ------------------------------------------------------------------
    // Units of work
    // ------------------------------------------------------------------

    private <O> Advance runStage(Job job, StageExecutor<O> executor, JobState onSuccess) {
        StageResult<O> result = executor.run(job);
        Job next = job.snapshot();
        switch (result.status()) {
            case SUCCEEDED -> {
                executor.apply(next, result.output());
                next.enterState(onSuccess, clock.instant());
                return commit(job, next, Advance.proceed());
            }
            case RETRY -> {
                next.recordFailedAttempt(result.retryHint(), clock.instant());
                return commit(job, next, Advance.retryAfter(result.retryDelay()));
            }
            default -> {
                if (result.failureReason() == FailureReason.LOW_CONFIDENCE) {
                    next.flagNeedsManualCategory();
                }
                return finish(job, next, result.failureReason());
            }
        }
    }

    // Backgrounds were regenerated; the caption already passed safety and is kept.
    private Advance keepCaption(Job job) {
        Job next = job.snapshot();
        next.enterState(JobState.VALIDATING_SAFETY, clock.instant());
        log.debug("Job {} keeps its caption, moving to safety validation", job.getId());
        return commit(job, next, Advance.proceed());
    }

    private Advance validateSafety(Job job) {
        List<SafetyVerdict> flagged = new ArrayList<>();
        try {
            for (PipelineStage stage : SafetyValidator.CHECKED_STAGES) {
                SafetyVerdict verdict = safety.check(job, stage);
                if (!verdict.safe()) {
                    flagged.add(verdict);
                }
            }
        } catch (CapabilityException e) {
            int attempt = job.getStageAttempt() + 1;
            RetryDecision decision = retryPolicy.decide(attempt, e.kind());
            log.warn("Safety check failed for job {} (attempt {}, {}): {}",
                    job.getId(), attempt, e.kind(), e.getMessage());
            if (!decision.shouldRetry()) {
                return finish(job, FailureReason.SAFETY_CHECK_FAILED);
            }
            Job next = job.snapshot();
            next.recordFailedAttempt(null, clock.instant());
            return commit(job, next, Advance.retryAfter(decision.delay()));
        }

        if (flagged.isEmpty()) {
            Job next = job.snapshot();
            next.complete(clock.instant());
            log.info("Job {} complete", job.getId());
            return persistTerminal(job, next);
        }
        boolean alreadyRegenerated = flagged.stream()
                .anyMatch(v -> job.regenerationsOf(v.stage()) > 0);
        if (alreadyRegenerated) {
            log.warn("Job {} rejected: output still unsafe after regeneration", job.getId());
            return finish(job, FailureReason.SAFETY_REJECTED);
        }

        Job next = job.snapshot();
        flagged.forEach(v -> next.requestRegeneration(v.stage()));
        JobState restart = flagged.stream().anyMatch(v -> v.stage() == PipelineStage.BACKGROUND_GENERATION)
                ? JobState.GENERATING_BACKGROUNDS
                : JobState.GENERATING_CAPTION;
        next.enterState(restart, clock.instant());
        log.info("Job {} regenerating {} in strict mode", job.getId(),
                flagged.stream().map(v -> v.stage().tag()).toList());
        return commit(job, next, Advance.proceed());
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Advance finish(Job job, FailureReason reason) {
        return finish(job, job.snapshot(), reason);
    }

    private Advance finish(Job job, Job next, FailureReason reason) {
        next.fail(reason, clock.instant());
        log.info("Job {} failed in {}: {}", job.getId(), job.getState(), reason);
        return persistTerminal(job, next);
    }

    private Advance persistTerminal(Job job, Job next) {
        return swap(job, next) == CasResult.APPLIED ? released(job) : afterConflict(job);
    }

    // Only a CAS winner calls this, so a slot is released at most once per job.
    private Advance released(Job job) {
        List<UUID> admitted = gate.release(job.getOwnerId())
                .map(AdmissionTicket::jobId)
                .map(List::of)
                .orElse(List.of());
        return Advance.finished(admitted);
    }

    private Advance commit(Job job, Job next, Advance onApplied) {
        return swap(job, next) == CasResult.APPLIED ? onApplied : afterConflict(job);
    }

    /**
     * A lost CAS usually means another execution owns the job. The exception is
     * a cancel request that landed while this unit ran: nobody else will act on
     * it, so the job is advanced again to observe the flag.
     */
    private Advance afterConflict(Job job) {
        return store.get(job.getId())
                .filter(stored -> stored.isCancelRequested() && stored.getState().isAdmitted())
                .map(stored -> Advance.proceed())
                .orElseGet(Advance::idle);
    }

    private CasResult swap(Job current, Job next) {
        try {
            CasResult result = store.compareAndSwap(current.getId(), current.getState(), current.getRevision(), next);
            if (result == CasResult.CONFLICT) {
                log.debug("Job {} moved on from {} concurrently, dropping result", current.getId(), current.getState());
            }
            return result;
        } catch (JobNotFoundException e) {
            log.warn("Job {} disappeared while in {}", current.getId(), current.getState());
            return CasResult.CONFLICT;
        }
    }

    private Duration stageBound(Duration timeout) {
        Duration bound = timeout.multipliedBy(retryPolicy.maxAttempts());
        for (int attempt = 1; attempt < retryPolicy.maxAttempts(); attempt++) {
            bound = bound.plus(retryPolicy.maxDelay(attempt));
        }
        return bound;
    }

    private static void withMdc(Job job) {
        MDC.put("jobId",   job.getId().toString());
        MDC.put("ownerId", job.getOwnerId());
        MDC.put("state",   job.getState().name());
    }
}
