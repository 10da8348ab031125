package com.creativeforge.orchestrator.stage;

import com.creativeforge.orchestrator.ai.CapabilityException;
import com.creativeforge.orchestrator.model.FailureKind;
import com.creativeforge.orchestrator.model.FailureReason;
import com.creativeforge.orchestrator.model.Job;
import com.creativeforge.orchestrator.model.PipelineStage;
import com.creativeforge.orchestrator.retry.RetryDecision;
import com.creativeforge.orchestrator.retry.RetryPolicy;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;

/**
 * One pipeline stage: a single external call per attempt, with a timeout,
 * output validation and the shared retry rule.
 *
 * run() never throws for service, validation or unexpected call failures and never sleeps:
 * it returns a StageResult and the Orchestrator persists it (and schedules
 * the retry) before anything else happens. The attempt number comes from
 * the persisted job, so a retry picked up by another node continues the count.
 *
 * Every attempt is timed and counted:
 * <pre>
 *   creativeforge.stage.duration{stage}
 *   creativeforge.stage.attempts{stage, outcome="success|invalid|timeout|error"}
 * </pre>
 *
 * @param <O> validated output type
 */
public abstract class StageExecutor<O> {

    private static final Logger log = LoggerFactory.getLogger(StageExecutor.class);

    private final PipelineStage   stage;
    private final Duration        timeout;
    private final RetryPolicy     retryPolicy;
    private final ExecutorService callPool;
    private final MeterRegistry   meterRegistry;

    protected StageExecutor(PipelineStage stage, Duration timeout, RetryPolicy retryPolicy,
                            ExecutorService callPool, MeterRegistry meterRegistry) {
        this.stage         = stage;
        this.timeout       = timeout;
        this.retryPolicy   = retryPolicy;
        this.callPool      = callPool;
        this.meterRegistry = meterRegistry;
    }

    // ------------------------------------------------------------------
    // Stage-specific hooks
    // ------------------------------------------------------------------

    /** Project the job onto the capability's input and make the call. */
    protected abstract O invoke(Job job, int attempt);

    /**
     * Check the raw output and return the accepted form of it.
     *
     * @throws StageValidationException if the output has the wrong shape
     */
    protected abstract O validate(Job job, O raw);

    /** Write the validated output into a job snapshot. */
    public abstract void apply(Job target, O output);

    /** False when the job already holds an output this stage must not replace. */
    public boolean isRequired(Job job) {
        return true;
    }

    /** Failure reason for an external-service error the retry rule gave up on. */
    protected FailureReason serviceFailureReason(FailureKind kind) {
        return stage.serviceFailure();
    }

    // ------------------------------------------------------------------
    // Attempt
    // ------------------------------------------------------------------

    public final StageResult<O> run(Job job) {
        int attempt = job.getStageAttempt() + 1;
        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "success";
        try {
            O raw = TimeLimitedCall.call(callPool, timeout, () -> invoke(job, attempt));
            O accepted = validate(job, raw);
            log.info("Stage {} succeeded for job {} on attempt {}", stage, job.getId(), attempt);
            return StageResult.succeeded(accepted);
        } catch (StageValidationException e) {
            outcome = "invalid";
            log.warn("Stage {} output rejected for job {} (attempt {}): {}",
                    stage, job.getId(), attempt, e.getMessage());
            return afterFailure(job, attempt, e.kind(), e.reason(), e.retryHint());
        } catch (TimeoutException e) {
            outcome = "timeout";
            log.warn("Stage {} timed out after {} for job {} (attempt {})",
                    stage, timeout, job.getId(), attempt);
            return afterFailure(job, attempt, FailureKind.TRANSIENT,
                    serviceFailureReason(FailureKind.TRANSIENT), null);
        } catch (CapabilityException e) {
            outcome = "error";
            log.warn("Stage {} call failed for job {} (attempt {}, {}): {}",
                    stage, job.getId(), attempt, e.kind(), e.getMessage());
            return afterFailure(job, attempt, e.kind(), serviceFailureReason(e.kind()), null);
        } catch (RuntimeException e) {
            // A client bug or malformed reply; counted against the retry budget like an outage.
            outcome = "error";
            log.error("Stage {} call raised an unexpected error for job {} (attempt {})",
                    stage, job.getId(), attempt, e);
            return afterFailure(job, attempt, FailureKind.TRANSIENT,
                    serviceFailureReason(FailureKind.TRANSIENT), null);
        } finally {
            sample.stop(meterRegistry.timer("creativeforge.stage.duration", "stage", stage.tag()));
            meterRegistry.counter("creativeforge.stage.attempts",
                    "stage", stage.tag(), "outcome", outcome).increment();
        }
    }

    private StageResult<O> afterFailure(Job job, int attempt, FailureKind kind,
                                        FailureReason reason, String hint) {
        RetryDecision decision = retryPolicy.decide(attempt, kind);
        if (decision.shouldRetry()) {
            log.info("Stage {} for job {} will retry in {} ms (attempt {}/{})",
                    stage, job.getId(), decision.delay().toMillis(), attempt, retryPolicy.maxAttempts());
            return StageResult.retry(kind, reason, decision.delay(), hint);
        }
        log.error("Stage {} for job {} gave up after attempt {}: {}", stage, job.getId(), attempt, reason);
        return StageResult.failed(kind, reason);
    }

    public PipelineStage stage()   { return stage; }
    public Duration      timeout() { return timeout; }
}
