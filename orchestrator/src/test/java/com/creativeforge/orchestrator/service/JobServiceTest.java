package com.creativeforge.orchestrator.service;

import com.creativeforge.orchestrator.gate.ThrottledException;
import com.creativeforge.orchestrator.model.FailureReason;
import com.creativeforge.orchestrator.model.Job;
import com.creativeforge.orchestrator.model.JobState;
import com.creativeforge.orchestrator.model.OutputLanguage;
import com.creativeforge.orchestrator.repository.SafetyAuditRepository;
import com.creativeforge.orchestrator.store.JobNotFoundException;
import com.creativeforge.orchestrator.support.PipelineHarness;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for JobService.
 *
 * The dispatcher is mocked so nothing runs in the background; the store,
 * gate and orchestrator are the real in-memory ones from the harness.
 */
@ExtendWith(MockitoExtension.class)
class JobServiceTest {

    @Mock StageDispatcher       dispatcher;
    @Mock SafetyAuditRepository auditRepo;

    PipelineHarness h;
    JobService      service;

    @BeforeEach
    void setUp() {
        h = new PipelineHarness(5, 10);
        service = new JobService(h.store, h.gate, h.orchestrator, dispatcher, auditRepo, h.clock);
    }

    @AfterEach
    void tearDown() {
        h.close();
    }

    // ------------------------------------------------------------------
    // submit()
    // ------------------------------------------------------------------

    @Test
    void submit_newJob_storesPendingJobAndStartsIt() {
        SubmitResult result = service.submit("seller-1", "s3://uploads/kurta.jpg", "hi", null);

        assertThat(result.created()).isTrue();
        Job job = h.job(result.job().getId());
        assertThat(job.getState()).isEqualTo(JobState.PENDING);
        assertThat(job.getLanguage()).isEqualTo(OutputLanguage.HINDI);
        verify(dispatcher).start(job.getId());
    }

    @Test
    void submit_sameIdempotencyKey_returnsSameJobWithoutSecondStart() {
        SubmitResult first  = service.submit("seller-1", "s3://uploads/kurta.jpg", "hi", "kurta-1");
        SubmitResult replay = service.submit("seller-1", "s3://uploads/kurta.jpg", "hi", "kurta-1");

        assertThat(replay.created()).isFalse();
        assertThat(replay.job().getId()).isEqualTo(first.job().getId());
        assertThat(h.store.findUnfinished()).hasSize(1);
        assertThat(h.gate.inFlight()).isEqualTo(1);
        verify(dispatcher, times(1)).start(any());
    }

    @Test
    void submit_sameKeyDifferentOwners_createsTwoJobs() {
        SubmitResult a = service.submit("seller-1", "s3://uploads/a.jpg", "en", "batch-7");
        SubmitResult b = service.submit("seller-2", "s3://uploads/b.jpg", "en", "batch-7");

        assertThat(a.job().getId()).isNotEqualTo(b.job().getId());
        assertThat(b.created()).isTrue();
    }

    @Test
    void submit_sevenJobsForOneOwner_admitsFiveAndQueuesTwoInOrder() {
        List<UUID> ids = new ArrayList<>();
        for (int i = 0; i < 7; i++) {
            ids.add(service.submit("seller-1", "s3://uploads/" + i + ".jpg", "en", null).job().getId());
        }

        ArgumentCaptor<UUID> started = ArgumentCaptor.forClass(UUID.class);
        verify(dispatcher, times(5)).start(started.capture());
        assertThat(started.getAllValues()).containsExactlyElementsOf(ids.subList(0, 5));
        assertThat(h.gate.usage("seller-1").active()).isEqualTo(5);
        assertThat(h.gate.usage("seller-1").queued()).isEqualTo(2);

        // The first finished job admits the sixth, not the seventh.
        Advance last = h.drive(ids.get(0));
        assertThat(last.admitted()).containsExactly(ids.get(5));
    }

    @Test
    void submit_anotherOwnerIsNotBlockedByFullOwner() {
        for (int i = 0; i < 6; i++) {
            service.submit("seller-1", "s3://uploads/" + i + ".jpg", "en", null);
        }

        SubmitResult other = service.submit("seller-2", "s3://uploads/x.jpg", "en", null);

        verify(dispatcher).start(other.job().getId());
    }

    @Test
    void submit_globalCeilingReached_throwsThrottledAndCreatesNoJob() {
        for (int i = 0; i < 10; i++) {
            service.submit("seller-" + i, "s3://uploads/" + i + ".jpg", "en", null);
        }

        assertThatThrownBy(() -> service.submit("seller-x", "s3://uploads/late.jpg", "en", "late-1"))
                .isInstanceOf(ThrottledException.class);

        assertThat(h.store.findUnfinished()).hasSize(10);
        assertThat(h.store.get(JobService.idempotentId("seller-x", "late-1"))).isEmpty();
    }

    @Test
    void submit_unsupportedLanguage_throwsIllegalArgument() {
        assertThatThrownBy(() -> service.submit("seller-1", "s3://uploads/a.jpg", "fr", null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("fr");
        assertThat(h.gate.inFlight()).isZero();
    }

    @Test
    void submit_blankOwner_throwsIllegalArgument() {
        assertThatThrownBy(() -> service.submit(" ", "s3://uploads/a.jpg", "en", null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ------------------------------------------------------------------
    // getStatus() / cancel()
    // ------------------------------------------------------------------

    @Test
    void getStatus_unknownJob_throwsNotFound() {
        assertThatThrownBy(() -> service.getStatus(UUID.randomUUID()))
                .isInstanceOf(JobNotFoundException.class);
    }

    @Test
    void cancel_queuedJob_returnsFailedCancelled() {
        for (int i = 0; i < 5; i++) {
            service.submit("seller-1", "s3://uploads/" + i + ".jpg", "en", null);
        }
        UUID queued = service.submit("seller-1", "s3://uploads/q.jpg", "en", null).job().getId();

        Job cancelled = service.cancel(queued);

        assertThat(cancelled.getState()).isEqualTo(JobState.FAILED);
        assertThat(cancelled.getFailureReason()).isEqualTo(FailureReason.CANCELLED);
        assertThat(h.gate.usage("seller-1").queued()).isZero();
        verify(dispatcher).follow(eq(queued), argThat(a -> a.kind() == Advance.Kind.IDLE));
    }

    @Test
    void cancel_runningJob_setsFlagAndAsksDispatcherToContinue() {
        UUID id = service.submit("seller-1", "s3://uploads/a.jpg", "en", null).job().getId();
        h.orchestrator.start(id);

        Job job = service.cancel(id);

        assertThat(job.isCancelRequested()).isTrue();
        assertThat(job.getState()).isEqualTo(JobState.ANALYZING);
        verify(dispatcher).follow(eq(id), argThat(a -> a.kind() == Advance.Kind.CONTINUE));
    }

    @Test
    void idempotentId_isStablePerOwnerAndKey() {
        assertThat(JobService.idempotentId("a", "k")).isEqualTo(JobService.idempotentId("a", "k"));
        assertThat(JobService.idempotentId("a", "bk")).isNotEqualTo(JobService.idempotentId("ab", "k"));
    }
}
