package com.creativeforge.orchestrator.safety;

import com.creativeforge.orchestrator.ai.CapabilityException;
import com.creativeforge.orchestrator.ai.ContentSafetyCapability;
import com.creativeforge.orchestrator.ai.SafetyAssessment;
import com.creativeforge.orchestrator.model.Job;
import com.creativeforge.orchestrator.model.PipelineStage;
import com.creativeforge.orchestrator.model.SafetyAuditRecord;
import com.creativeforge.orchestrator.stage.TimeLimitedCall;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;

/**
 * Moderates the generated backgrounds and caption of a job.
 *
 * Each stage's output is checked on its own so that only the flagged one is
 * regenerated. Every verdict is appended to the audit sink. Service errors
 * and timeouts surface as {@link CapabilityException}; the Orchestrator
 * applies the retry rule to them.
 */
public class SafetyValidator {

    private static final Logger log = LoggerFactory.getLogger(SafetyValidator.class);

    public static final List<PipelineStage> CHECKED_STAGES =
            List.of(PipelineStage.BACKGROUND_GENERATION, PipelineStage.CAPTION_GENERATION);

    private final ContentSafetyCapability moderation;
    private final SafetyAuditSink         auditSink;
    private final Duration                timeout;
    private final ExecutorService         callPool;
    private final MeterRegistry           meterRegistry;
    private final Clock                   clock;

    public SafetyValidator(ContentSafetyCapability moderation, SafetyAuditSink auditSink,
                           Duration timeout, ExecutorService callPool,
                           MeterRegistry meterRegistry, Clock clock) {
        this.moderation    = moderation;
        this.auditSink     = auditSink;
        this.timeout       = timeout;
        this.callPool      = callPool;
        this.meterRegistry = meterRegistry;
        this.clock         = clock;
    }

    /**
     * @throws CapabilityException if the moderation service fails or does not answer in time
     * @throws IllegalArgumentException for a stage whose output is not moderated
     */
    public SafetyVerdict check(Job job, PipelineStage stage) {
        if (!CHECKED_STAGES.contains(stage)) {
            throw new IllegalArgumentException("No moderated output for stage " + stage);
        }
        SafetyAssessment assessment;
        try {
            assessment = TimeLimitedCall.call(callPool, timeout, () -> moderate(job, stage));
        } catch (TimeoutException e) {
            throw CapabilityException.transientFailure(
                    "Safety check of " + stage.tag() + " timed out after " + timeout, e);
        } catch (CapabilityException e) {
            throw e;
        } catch (RuntimeException e) {
            throw CapabilityException.transientFailure(
                    "Safety check of " + stage.tag() + " failed unexpectedly: " + e, e);
        }
        if (assessment == null) {
            throw CapabilityException.transientFailure("Empty safety assessment for " + stage.tag(), null);
        }

        SafetyVerdict verdict = assessment.safe()
                ? SafetyVerdict.safe(stage)
                : SafetyVerdict.unsafe(stage, describe(assessment));
        auditSink.append(new SafetyAuditRecord(
                job.getId(), stage,
                verdict.safe() ? SafetyAuditRecord.Verdict.SAFE : SafetyAuditRecord.Verdict.UNSAFE,
                verdict.reason(), job.regenerationsOf(stage), clock.instant()));
        meterRegistry.counter("creativeforge.safety.verdicts",
                "stage", stage.tag(), "verdict", verdict.safe() ? "safe" : "unsafe").increment();

        if (!verdict.safe()) {
            log.warn("Job {} {} flagged unsafe (round {}): {}",
                    job.getId(), stage.tag(), job.regenerationsOf(stage), verdict.reason());
        }
        return verdict;
    }

    public Duration timeout() {
        return timeout;
    }

    private SafetyAssessment moderate(Job job, PipelineStage stage) {
        return switch (stage) {
            case BACKGROUND_GENERATION -> moderation.moderateImages(job.getVariationRefs());
            case CAPTION_GENERATION    -> moderation.moderateText(job.getCaptionText(), job.getLanguage().code());
            default -> throw new IllegalArgumentException("No moderated output for stage " + stage);
        };
    }

    private static String describe(SafetyAssessment assessment) {
        if (assessment.flaggedCategories().isEmpty()) {
            return assessment.reason() == null ? "unsafe" : assessment.reason();
        }
        String categories = String.join(",", assessment.flaggedCategories());
        return assessment.reason() == null ? categories : assessment.reason() + " [" + categories + "]";
    }
}
