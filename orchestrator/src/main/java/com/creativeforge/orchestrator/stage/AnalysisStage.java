package com.creativeforge.orchestrator.stage;

import com.creativeforge.orchestrator.ai.AnalysisReport;
import com.creativeforge.orchestrator.ai.ImageAnalysisCapability;
import com.creativeforge.orchestrator.model.FailureKind;
import com.creativeforge.orchestrator.model.FailureReason;
import com.creativeforge.orchestrator.model.Job;
import com.creativeforge.orchestrator.model.PipelineStage;
import com.creativeforge.orchestrator.model.ProductCategory;
import com.creativeforge.orchestrator.retry.RetryPolicy;
import io.micrometer.core.instrument.MeterRegistry;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;

/**
 * Classifies the source image.
 *
 * Output must name a known ProductCategory with a confidence in [0,1].
 * A confidence below the floor is a permanent failure: the seller has to
 * pick the category by hand, so retrying the same image is pointless.
 */
public class AnalysisStage extends StageExecutor<AnalysisReport> {

    private final ImageAnalysisCapability analysis;
    private final double                  confidenceFloor;

    public AnalysisStage(ImageAnalysisCapability analysis, double confidenceFloor,
                         Duration timeout, RetryPolicy retryPolicy,
                         ExecutorService callPool, MeterRegistry meterRegistry) {
        super(PipelineStage.ANALYSIS, timeout, retryPolicy, callPool, meterRegistry);
        this.analysis        = analysis;
        this.confidenceFloor = confidenceFloor;
    }

    @Override
    protected AnalysisReport invoke(Job job, int attempt) {
        return analysis.analyze(job.getSourceAssetRef());
    }

    @Override
    protected AnalysisReport validate(Job job, AnalysisReport raw) {
        if (raw == null) {
            throw invalid("empty analysis result");
        }
        ProductCategory category = ProductCategory.fromLabel(raw.category())
                .orElseThrow(() -> invalid("unknown category '" + raw.category() + "'"));
        Double confidence = raw.confidence();
        if (confidence == null || confidence.isNaN() || confidence < 0.0 || confidence > 1.0) {
            throw invalid("confidence out of range: " + confidence);
        }
        if (confidence < confidenceFloor) {
            throw new StageValidationException(FailureKind.PERMANENT, FailureReason.LOW_CONFIDENCE,
                    "confidence %.2f below floor %.2f, needs manual category".formatted(confidence, confidenceFloor));
        }
        Map<String, String> attributes = new LinkedHashMap<>();
        if (raw.attributes() != null) {
            raw.attributes().forEach((k, v) -> {
                if (k != null && v != null) attributes.put(k, v);
            });
        }
        return new AnalysisReport(category.name(), confidence, attributes);
    }

    @Override
    public void apply(Job target, AnalysisReport output) {
        target.applyAnalysis(ProductCategory.valueOf(output.category()), output.confidence(), output.attributes());
    }

    @Override
    protected FailureReason serviceFailureReason(FailureKind kind) {
        return kind == FailureKind.PERMANENT ? FailureReason.INVALID_SOURCE_ASSET : FailureReason.ANALYSIS_FAILED;
    }

    private static StageValidationException invalid(String message) {
        return new StageValidationException(FailureKind.TRANSIENT, FailureReason.INVALID_ANALYSIS, message);
    }
}
