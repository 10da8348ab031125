package com.creativeforge.orchestrator.gate;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConcurrencyGateTest {

    ConcurrencyGate gate;

    @BeforeEach
    void setUp() {
        gate = new ConcurrencyGate(new InMemoryAdmissionLedger(), 5, 20,
                Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC));
    }

    // ------------------------------------------------------------------
    // admit()
    // ------------------------------------------------------------------

    @Test
    void admit_belowLimit_admitsImmediately() {
        AdmissionTicket ticket = gate.admit("seller-1", UUID.randomUUID());

        assertThat(ticket.isAdmitted()).isTrue();
        assertThat(gate.usage("seller-1")).isEqualTo(new OwnerUsage(1, 0));
    }

    @Test
    void admit_sevenForOneOwner_fiveAdmittedTwoQueued() {
        List<AdmissionTicket> tickets = new ArrayList<>();
        for (int i = 0; i < 7; i++) {
            tickets.add(gate.admit("seller-1", UUID.randomUUID()));
        }

        assertThat(tickets.subList(0, 5)).allMatch(AdmissionTicket::isAdmitted);
        assertThat(tickets.subList(5, 7)).noneMatch(AdmissionTicket::isAdmitted);
        assertThat(gate.usage("seller-1")).isEqualTo(new OwnerUsage(5, 2));
        assertThat(gate.inFlight()).isEqualTo(7);
    }

    @Test
    void admit_fullOwner_doesNotBlockOtherOwners() {
        for (int i = 0; i < 6; i++) {
            gate.admit("seller-1", UUID.randomUUID());
        }

        assertThat(gate.admit("seller-2", UUID.randomUUID()).isAdmitted()).isTrue();
    }

    @Test
    void admit_globalCeilingReached_throwsThrottled() {
        for (int i = 0; i < 20; i++) {
            gate.admit("seller-" + (i % 10), UUID.randomUUID());
        }

        assertThatThrownBy(() -> gate.admit("seller-new", UUID.randomUUID()))
                .isInstanceOf(ThrottledException.class)
                .hasMessageContaining("20");
        assertThat(gate.inFlight()).isEqualTo(20);
        assertThat(gate.usage("seller-new")).isEqualTo(new OwnerUsage(0, 0));
    }

    // ------------------------------------------------------------------
    // release() / withdraw()
    // ------------------------------------------------------------------

    @Test
    void release_admitsQueuedJobsInArrivalOrder() {
        for (int i = 0; i < 5; i++) {
            gate.admit("seller-1", UUID.randomUUID());
        }
        UUID sixth   = UUID.randomUUID();
        UUID seventh = UUID.randomUUID();
        gate.admit("seller-1", sixth);
        gate.admit("seller-1", seventh);

        Optional<AdmissionTicket> first  = gate.release("seller-1");
        Optional<AdmissionTicket> second = gate.release("seller-1");

        assertThat(first).map(AdmissionTicket::jobId).contains(sixth);
        assertThat(second).map(AdmissionTicket::jobId).contains(seventh);
        assertThat(first.get().isAdmitted()).isTrue();
        assertThat(gate.usage("seller-1")).isEqualTo(new OwnerUsage(5, 0));
        assertThat(gate.inFlight()).isEqualTo(5);
    }

    @Test
    void release_emptyQueue_freesSlot() {
        gate.admit("seller-1", UUID.randomUUID());

        assertThat(gate.release("seller-1")).isEmpty();
        assertThat(gate.usage("seller-1")).isEqualTo(new OwnerUsage(0, 0));
        assertThat(gate.inFlight()).isZero();
    }

    @Test
    void withdraw_queuedJob_removesItFromQueue() {
        for (int i = 0; i < 5; i++) {
            gate.admit("seller-1", UUID.randomUUID());
        }
        UUID queued = UUID.randomUUID();
        gate.admit("seller-1", queued);

        assertThat(gate.withdraw("seller-1", queued)).isTrue();
        assertThat(gate.withdraw("seller-1", queued)).isFalse();
        assertThat(gate.release("seller-1")).isEmpty();
        assertThat(gate.inFlight()).isEqualTo(4);
    }

    // ------------------------------------------------------------------
    // restore()
    // ------------------------------------------------------------------

    @Test
    void restore_countsActiveAndReadmitsQueuedWhileSlotsRemain() {
        List<UUID> active = List.of(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID());
        List<UUID> queued = List.of(UUID.randomUUID(), UUID.randomUUID());

        List<AdmissionTicket> admitted = gate.restore("seller-1", active, queued);

        assertThat(admitted).extracting(AdmissionTicket::jobId).containsExactly(queued.get(0));
        assertThat(gate.usage("seller-1")).isEqualTo(new OwnerUsage(5, 1));
        assertThat(gate.inFlight()).isEqualTo(6);
    }

    // ------------------------------------------------------------------
    // Concurrency
    // ------------------------------------------------------------------

    @Test
    void admit_concurrentCallers_neverExceedLimitOrCeiling() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch go = new CountDownLatch(1);
        AtomicInteger admitted = new AtomicInteger();
        AtomicInteger throttled = new AtomicInteger();
        for (int i = 0; i < 40; i++) {
            pool.submit(() -> {
                go.await();
                try {
                    if (gate.admit("seller-1", UUID.randomUUID()).isAdmitted()) admitted.incrementAndGet();
                } catch (ThrottledException e) {
                    throttled.incrementAndGet();
                }
                return null;
            });
        }
        go.countDown();
        pool.shutdown();
        assertThat(pool.awaitTermination(5, TimeUnit.SECONDS)).isTrue();

        assertThat(admitted.get()).isEqualTo(5);
        assertThat(throttled.get()).isEqualTo(20);
        assertThat(gate.usage("seller-1")).isEqualTo(new OwnerUsage(5, 15));
    }
}
