package com.creativeforge.orchestrator.config;

import com.creativeforge.orchestrator.ai.BackgroundGenerationCapability;
import com.creativeforge.orchestrator.ai.CaptionGenerationCapability;
import com.creativeforge.orchestrator.ai.ContentSafetyCapability;
import com.creativeforge.orchestrator.ai.ImageAnalysisCapability;
import com.creativeforge.orchestrator.gate.AdmissionLedger;
import com.creativeforge.orchestrator.gate.ConcurrencyGate;
import com.creativeforge.orchestrator.gate.InMemoryAdmissionLedger;
import com.creativeforge.orchestrator.retry.RetryPolicy;
import com.creativeforge.orchestrator.safety.SafetyAuditSink;
import com.creativeforge.orchestrator.safety.SafetyValidator;
import com.creativeforge.orchestrator.stage.AnalysisStage;
import com.creativeforge.orchestrator.stage.BackgroundGenerationStage;
import com.creativeforge.orchestrator.stage.CaptionGenerationStage;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Wires the pipeline pieces that are plain classes rather than components:
 * the retry rule, the gate and the stage executors with their timeouts.
 */
@Configuration
@EnableConfigurationProperties(CreativeForgeProperties.class)
public class PipelineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RetryPolicy retryPolicy(CreativeForgeProperties props) {
        CreativeForgeProperties.Retry retry = props.retry();
        return new RetryPolicy(retry.maxAttempts(), retry.baseDelay(), retry.jitterRatio());
    }

    @Bean
    public AdmissionLedger admissionLedger() {
        return new InMemoryAdmissionLedger();
    }

    @Bean
    public ConcurrencyGate concurrencyGate(AdmissionLedger ledger, CreativeForgeProperties props, Clock clock) {
        return new ConcurrencyGate(ledger,
                props.admission().perOwnerLimit(),
                props.admission().globalCeiling(),
                clock);
    }

    @Bean
    public MeterBinder gateMetrics(ConcurrencyGate gate) {
        return registry -> Gauge.builder("creativeforge.gate.in_flight", gate, ConcurrencyGate::inFlight)
                .description("Jobs admitted or queued across all owners")
                .register(registry);
    }

    // External calls block here, never on a dispatcher worker, so a hung call only costs a pool thread.
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService stageCallPool(CreativeForgeProperties props) {
        return Executors.newFixedThreadPool(props.dispatcher().callPoolSize());
    }

    @Bean
    public AnalysisStage analysisStage(ImageAnalysisCapability capability, CreativeForgeProperties props,
                                       RetryPolicy retryPolicy, ExecutorService stageCallPool,
                                       MeterRegistry meterRegistry) {
        return new AnalysisStage(capability, props.analysis().confidenceFloor(),
                props.stages().analysisTimeout(), retryPolicy, stageCallPool, meterRegistry);
    }

    @Bean
    public BackgroundGenerationStage backgroundGenerationStage(BackgroundGenerationCapability capability,
                                                               CreativeForgeProperties props,
                                                               RetryPolicy retryPolicy,
                                                               ExecutorService stageCallPool,
                                                               MeterRegistry meterRegistry) {
        return new BackgroundGenerationStage(capability,
                props.stages().backgroundTimeout(), retryPolicy, stageCallPool, meterRegistry);
    }

    @Bean
    public CaptionGenerationStage captionGenerationStage(CaptionGenerationCapability capability,
                                                         CreativeForgeProperties props,
                                                         RetryPolicy retryPolicy,
                                                         ExecutorService stageCallPool,
                                                         MeterRegistry meterRegistry) {
        return new CaptionGenerationStage(capability,
                props.caption().minLength(), props.caption().maxLength(),
                props.stages().captionTimeout(), retryPolicy, stageCallPool, meterRegistry);
    }

    @Bean
    public SafetyValidator safetyValidator(ContentSafetyCapability capability, SafetyAuditSink auditSink,
                                           CreativeForgeProperties props, ExecutorService stageCallPool,
                                           MeterRegistry meterRegistry, Clock clock) {
        return new SafetyValidator(capability, auditSink, props.stages().safetyTimeout(),
                stageCallPool, meterRegistry, clock);
    }
}
