package com.creativeforge.orchestrator.stage;

import com.creativeforge.orchestrator.ai.BackgroundGenerationCapability;
import com.creativeforge.orchestrator.ai.GenerationMode;
import com.creativeforge.orchestrator.model.FailureKind;
import com.creativeforge.orchestrator.model.FailureReason;
import com.creativeforge.orchestrator.model.Job;
import com.creativeforge.orchestrator.model.PipelineStage;
import com.creativeforge.orchestrator.retry.RetryPolicy;
import io.micrometer.core.instrument.MeterRegistry;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutorService;

/**
 * Generates the background variations.
 *
 * Exactly {@value #VARIATIONS} distinct references are kept; blanks and
 * duplicates are dropped, extras beyond the first three are ignored.
 * Fewer than three is retried and, once retries run out, fails the job.
 */
public class BackgroundGenerationStage extends StageExecutor<List<String>> {

    public static final int VARIATIONS = 3;

    private final BackgroundGenerationCapability generator;

    public BackgroundGenerationStage(BackgroundGenerationCapability generator,
                                     Duration timeout, RetryPolicy retryPolicy,
                                     ExecutorService callPool, MeterRegistry meterRegistry) {
        super(PipelineStage.BACKGROUND_GENERATION, timeout, retryPolicy, callPool, meterRegistry);
        this.generator = generator;
    }

    @Override
    protected List<String> invoke(Job job, int attempt) {
        GenerationMode mode = job.getBackgroundRegenerations() > 0 ? GenerationMode.STRICT : GenerationMode.STANDARD;
        return generator.generate(CreativeBriefs.backgrounds(job, mode), VARIATIONS);
    }

    @Override
    protected List<String> validate(Job job, List<String> raw) {
        Set<String> distinct = new LinkedHashSet<>();
        if (raw != null) {
            raw.stream()
               .filter(Objects::nonNull)
               .map(String::strip)
               .filter(ref -> !ref.isEmpty())
               .forEach(distinct::add);
        }
        if (distinct.size() < VARIATIONS) {
            throw new StageValidationException(FailureKind.TRANSIENT, FailureReason.INSUFFICIENT_VARIATIONS,
                    "expected %d distinct variations, got %d".formatted(VARIATIONS, distinct.size()));
        }
        return distinct.stream().limit(VARIATIONS).toList();
    }

    @Override
    public void apply(Job target, List<String> output) {
        target.applyVariations(output);
    }
}
