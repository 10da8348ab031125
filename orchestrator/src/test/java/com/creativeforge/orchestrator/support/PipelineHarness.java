package com.creativeforge.orchestrator.support;

import com.creativeforge.orchestrator.gate.ConcurrencyGate;
import com.creativeforge.orchestrator.gate.InMemoryAdmissionLedger;
import com.creativeforge.orchestrator.model.Job;
import com.creativeforge.orchestrator.model.OutputLanguage;
import com.creativeforge.orchestrator.retry.RetryPolicy;
import com.creativeforge.orchestrator.safety.SafetyAuditSink;
import com.creativeforge.orchestrator.safety.SafetyValidator;
import com.creativeforge.orchestrator.service.Advance;
import com.creativeforge.orchestrator.service.Orchestrator;
import com.creativeforge.orchestrator.stage.AnalysisStage;
import com.creativeforge.orchestrator.stage.BackgroundGenerationStage;
import com.creativeforge.orchestrator.stage.CaptionGenerationStage;
import com.creativeforge.orchestrator.store.InMemoryJobStore;
import com.creativeforge.orchestrator.model.SafetyAuditRecord;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * A complete pipeline wired with in-memory parts and scripted AI.
 *
 * {@link #drive(UUID)} runs the Advance loop synchronously on the calling
 * thread, ignoring retry delays, which is what the dispatcher does minus the timers.
 */
public class PipelineHarness implements AutoCloseable {

    public static final Duration STAGE_TIMEOUT = Duration.ofSeconds(2);

    public final ScriptedAi              ai       = new ScriptedAi();
    public final InMemoryJobStore        store    = new InMemoryJobStore();
    public final MutableClock            clock    = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
    public final SimpleMeterRegistry     meters   = new SimpleMeterRegistry();
    public final List<SafetyAuditRecord> audit    = new ArrayList<>();
    public final SafetyAuditSink         auditSink = audit::add;
    public final RetryPolicy             retry    = new RetryPolicy(3, Duration.ofMillis(100), 0.25, () -> 0.5);
    public final ConcurrencyGate         gate;
    public final Orchestrator            orchestrator;
    public final AnalysisStage           analysis;
    public final BackgroundGenerationStage backgrounds;
    public final CaptionGenerationStage  caption;
    public final SafetyValidator         safety;

    private final ExecutorService callPool = Executors.newCachedThreadPool();

    public PipelineHarness() {
        this(5, 200);
    }

    public PipelineHarness(int perOwnerLimit, int globalCeiling) {
        gate         = new ConcurrencyGate(new InMemoryAdmissionLedger(), perOwnerLimit, globalCeiling, clock);
        analysis     = new AnalysisStage(ai, 0.6, STAGE_TIMEOUT, retry, callPool, meters);
        backgrounds  = new BackgroundGenerationStage(ai, STAGE_TIMEOUT, retry, callPool, meters);
        caption      = new CaptionGenerationStage(ai, 50, 150, STAGE_TIMEOUT, retry, callPool, meters);
        safety       = new SafetyValidator(ai, auditSink, STAGE_TIMEOUT, callPool, meters, clock);
        orchestrator = new Orchestrator(store, gate, analysis, backgrounds, caption, safety, retry, clock);
    }

    /** Store a PENDING job and admit it at the gate. */
    public UUID submit(String ownerId, OutputLanguage language) {
        Job job = new Job(UUID.randomUUID(), ownerId, "s3://uploads/" + UUID.randomUUID() + ".jpg",
                language, null, clock.instant());
        store.create(job);
        gate.admit(ownerId, job.getId());
        return job.getId();
    }

    /** Start the job and advance it until nothing is left to do; returns the last Advance. */
    public Advance drive(UUID jobId) {
        return follow(jobId, orchestrator.start(jobId));
    }

    /** Keep advancing after {@code first} until the job goes idle. */
    public Advance follow(UUID jobId, Advance first) {
        Advance next = first;
        int guard = 0;
        while (next.kind() != Advance.Kind.IDLE) {
            if (++guard > 100) {
                throw new IllegalStateException("Job " + jobId + " did not settle");
            }
            next = orchestrator.advance(jobId);
        }
        return next;
    }

    public Job job(UUID jobId) {
        return store.get(jobId).orElseThrow();
    }

    @Override
    public void close() {
        callPool.shutdownNow();
    }
}
