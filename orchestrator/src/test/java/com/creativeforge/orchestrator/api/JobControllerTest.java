package com.creativeforge.orchestrator.api;

import com.creativeforge.orchestrator.gate.ThrottledException;
import com.creativeforge.orchestrator.model.*;
import com.creativeforge.orchestrator.service.JobService;
import com.creativeforge.orchestrator.service.SubmitResult;
import com.creativeforge.orchestrator.store.JobNotFoundException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Slice test for JobController.
 *
 * @WebMvcTest spins up only the web layer (no DB, no dispatcher, no AI clients).
 * JobService is replaced by a mock so we can control its behaviour precisely.
 */
@WebMvcTest(JobController.class)
class JobControllerTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    @Autowired MockMvc      mockMvc;
    @MockitoBean JobService jobService;

    // ------------------------------------------------------------------
    // POST /jobs
    // ------------------------------------------------------------------

    @Test
    void submit_newJob_returns201() throws Exception {
        Job job = fakeJob("seller-1");
        when(jobService.submit("seller-1", "s3://uploads/kurta.jpg", "hi", "kurta-1"))
                .thenReturn(new SubmitResult(job, true));

        mockMvc.perform(post("/jobs")
                        .header("X-Owner-Id", "seller-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"sourceAssetRef":"s3://uploads/kurta.jpg","language":"hi","idempotencyKey":"kurta-1"}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(job.getId().toString()))
                .andExpect(jsonPath("$.state").value("PENDING"))
                .andExpect(jsonPath("$.language").value("hi"));
    }

    @Test
    void submit_idempotentReplay_returns200() throws Exception {
        Job job = fakeJob("seller-1");
        when(jobService.submit(any(), any(), any(), any())).thenReturn(new SubmitResult(job, false));

        mockMvc.perform(post("/jobs")
                        .header("X-Owner-Id", "seller-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"sourceAssetRef":"s3://uploads/kurta.jpg","language":"hi","idempotencyKey":"kurta-1"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(job.getId().toString()));
    }

    @Test
    void submit_throttled_returns429WithRetryAfter() throws Exception {
        when(jobService.submit(any(), any(), any(), any())).thenThrow(new ThrottledException(200));

        mockMvc.perform(post("/jobs")
                        .header("X-Owner-Id", "seller-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"sourceAssetRef":"s3://uploads/kurta.jpg","language":"hi"}
                                """))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().exists("Retry-After"));
    }

    @Test
    void submit_unsupportedLanguage_returns400() throws Exception {
        when(jobService.submit(any(), any(), eq("xx"), any()))
                .thenThrow(new IllegalArgumentException("Unsupported language: xx"));

        mockMvc.perform(post("/jobs")
                        .header("X-Owner-Id", "seller-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"sourceAssetRef":"s3://uploads/kurta.jpg","language":"xx"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("Unsupported language: xx"));
    }

    @Test
    void submit_missingOwnerHeader_returns400() throws Exception {
        mockMvc.perform(post("/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"sourceAssetRef":"s3://uploads/kurta.jpg","language":"hi"}
                                """))
                .andExpect(status().isBadRequest());
    }

    // ------------------------------------------------------------------
    // GET /jobs/{id}
    // ------------------------------------------------------------------

    @Test
    void getJob_completeJob_returnsOutputs() throws Exception {
        Job job = completedJob("seller-1");
        when(jobService.getStatus(job.getId())).thenReturn(job);

        mockMvc.perform(get("/jobs/{id}", job.getId()).header("X-Owner-Id", "seller-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("COMPLETE"))
                .andExpect(jsonPath("$.variationRefs.length()").value(3))
                .andExpect(jsonPath("$.caption").isNotEmpty())
                .andExpect(jsonPath("$.category").value("APPAREL"));
    }

    @Test
    void getJob_runningJob_hidesIntermediateOutputs() throws Exception {
        Job job = fakeJob("seller-1");
        job.enterState(JobState.ANALYZING, T0);
        job.applyVariations(List.of("bg://1", "bg://2", "bg://3"));
        when(jobService.getStatus(job.getId())).thenReturn(job);

        mockMvc.perform(get("/jobs/{id}", job.getId()).header("X-Owner-Id", "seller-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.variationRefs").doesNotExist());
    }

    @Test
    void getJob_unknownId_returns404() throws Exception {
        UUID unknown = UUID.randomUUID();
        when(jobService.getStatus(unknown)).thenThrow(new JobNotFoundException(unknown));

        mockMvc.perform(get("/jobs/{id}", unknown).header("X-Owner-Id", "seller-1"))
                .andExpect(status().isNotFound());
    }

    @Test
    void getJob_otherOwner_returns404() throws Exception {
        Job job = fakeJob("seller-1");
        when(jobService.getStatus(job.getId())).thenReturn(job);

        mockMvc.perform(get("/jobs/{id}", job.getId()).header("X-Owner-Id", "seller-2"))
                .andExpect(status().isNotFound());
    }

    // ------------------------------------------------------------------
    // POST /jobs/{id}/cancel
    // ------------------------------------------------------------------

    @Test
    void cancel_ownJob_returns202() throws Exception {
        Job job = fakeJob("seller-1");
        Job cancelled = job.snapshot();
        cancelled.fail(FailureReason.CANCELLED, T0);
        when(jobService.getStatus(job.getId())).thenReturn(job);
        when(jobService.cancel(job.getId())).thenReturn(cancelled);

        mockMvc.perform(post("/jobs/{id}/cancel", job.getId()).header("X-Owner-Id", "seller-1"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.failureReason").value("CANCELLED"));
    }

    @Test
    void cancel_otherOwnersJob_returns404WithoutCancelling() throws Exception {
        Job job = fakeJob("seller-1");
        when(jobService.getStatus(job.getId())).thenReturn(job);

        mockMvc.perform(post("/jobs/{id}/cancel", job.getId()).header("X-Owner-Id", "seller-2"))
                .andExpect(status().isNotFound());
        verify(jobService, never()).cancel(any());
    }

    // ------------------------------------------------------------------
    // Audit and latency bound
    // ------------------------------------------------------------------

    @Test
    void safetyAudit_returnsVerdictsInOrder() throws Exception {
        Job job = fakeJob("seller-1");
        when(jobService.getStatus(job.getId())).thenReturn(job);
        when(jobService.safetyAudit(job.getId())).thenReturn(List.of(
                new SafetyAuditRecord(job.getId(), PipelineStage.CAPTION_GENERATION,
                        SafetyAuditRecord.Verdict.UNSAFE, "hate", 0, T0),
                new SafetyAuditRecord(job.getId(), PipelineStage.CAPTION_GENERATION,
                        SafetyAuditRecord.Verdict.SAFE, null, 1, T0.plusSeconds(30))));

        mockMvc.perform(get("/jobs/{id}/safety-audit", job.getId()).header("X-Owner-Id", "seller-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].verdict").value("UNSAFE"))
                .andExpect(jsonPath("$[0].stage").value("caption_generation"))
                .andExpect(jsonPath("$[1].regenerationRound").value(1));
    }

    @Test
    void latencyBound_returnsSeconds() throws Exception {
        when(jobService.latencyUpperBound()).thenReturn(Duration.ofMinutes(12));

        mockMvc.perform(get("/jobs/latency-bound"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.seconds").value(720));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static Job fakeJob(String ownerId) {
        return new Job(UUID.randomUUID(), ownerId, "s3://uploads/kurta.jpg", OutputLanguage.HINDI, null, T0);
    }

    private static Job completedJob(String ownerId) {
        Job job = fakeJob(ownerId);
        job.enterState(JobState.ANALYZING, T0);
        job.applyAnalysis(ProductCategory.APPAREL, 0.9, Map.of());
        job.enterState(JobState.GENERATING_BACKGROUNDS, T0);
        job.applyVariations(List.of("bg://1", "bg://2", "bg://3"));
        job.enterState(JobState.GENERATING_CAPTION, T0);
        job.applyCaption("Handwoven cotton kurta in sunrise orange, light and breathable for festive days.");
        job.enterState(JobState.VALIDATING_SAFETY, T0);
        job.complete(T0);
        return job;
    }
}
