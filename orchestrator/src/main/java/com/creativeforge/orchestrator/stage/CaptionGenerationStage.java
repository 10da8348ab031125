package com.creativeforge.orchestrator.stage;

import com.creativeforge.orchestrator.ai.CaptionGenerationCapability;
import com.creativeforge.orchestrator.ai.GenerationMode;
import com.creativeforge.orchestrator.model.FailureKind;
import com.creativeforge.orchestrator.model.FailureReason;
import com.creativeforge.orchestrator.model.Job;
import com.creativeforge.orchestrator.model.PipelineStage;
import com.creativeforge.orchestrator.retry.RetryPolicy;
import io.micrometer.core.instrument.MeterRegistry;

import java.time.Duration;
import java.util.concurrent.ExecutorService;

/**
 * Writes the caption in the job's language.
 *
 * Length is counted in Unicode code points after trimming. A caption outside
 * [minLength, maxLength] consumes an attempt and the next prompt asks for a
 * shorter or longer text.
 */
public class CaptionGenerationStage extends StageExecutor<String> {

    private final CaptionGenerationCapability writer;
    private final int                         minLength;
    private final int                         maxLength;

    public CaptionGenerationStage(CaptionGenerationCapability writer, int minLength, int maxLength,
                                  Duration timeout, RetryPolicy retryPolicy,
                                  ExecutorService callPool, MeterRegistry meterRegistry) {
        super(PipelineStage.CAPTION_GENERATION, timeout, retryPolicy, callPool, meterRegistry);
        if (minLength < 1 || maxLength < minLength) {
            throw new IllegalArgumentException("Invalid caption bounds [" + minLength + "," + maxLength + "]");
        }
        this.writer    = writer;
        this.minLength = minLength;
        this.maxLength = maxLength;
    }

    /** A caption that passed safety is kept while only the backgrounds are regenerated. */
    @Override
    public boolean isRequired(Job job) {
        return job.needsCaption();
    }

    @Override
    protected String invoke(Job job, int attempt) {
        GenerationMode mode = job.getCaptionRegenerations() > 0 ? GenerationMode.STRICT : GenerationMode.STANDARD;
        String prompt = CreativeBriefs.caption(job, mode, job.getRetryHint(), minLength, maxLength);
        return writer.generate(prompt, job.getLanguage());
    }

    @Override
    protected String validate(Job job, String raw) {
        String text = raw == null ? "" : raw.strip();
        int length = text.codePointCount(0, text.length());
        if (length < minLength) {
            throw new StageValidationException(FailureKind.TRANSIENT, FailureReason.CAPTION_LENGTH_OUT_OF_RANGE,
                    CreativeBriefs.HINT_LONGER, "caption has %d characters, minimum is %d".formatted(length, minLength));
        }
        if (length > maxLength) {
            throw new StageValidationException(FailureKind.TRANSIENT, FailureReason.CAPTION_LENGTH_OUT_OF_RANGE,
                    CreativeBriefs.HINT_SHORTER, "caption has %d characters, maximum is %d".formatted(length, maxLength));
        }
        return text;
    }

    @Override
    public void apply(Job target, String output) {
        target.applyCaption(output);
    }

    public int minLength() { return minLength; }
    public int maxLength() { return maxLength; }
}
