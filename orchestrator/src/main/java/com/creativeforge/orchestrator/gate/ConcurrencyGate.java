package com.creativeforge.orchestrator.gate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-owner admission control.
 *
 * Rules:
 *   - The global ceiling is checked first: once {@code globalCeiling} jobs are
 *     in flight (admitted or queued, all owners), admit() throws Throttled.
 *   - An owner runs at most {@code perOwnerLimit} jobs at once; further
 *     requests queue in arrival order and are admitted one per release().
 *   - Owners never wait on each other, only on the shared ceiling.
 */
public class ConcurrencyGate {

    private static final Logger log = LoggerFactory.getLogger(ConcurrencyGate.class);

    private final AdmissionLedger ledger;
    private final int             perOwnerLimit;
    private final int             globalCeiling;
    private final Clock           clock;
    private final AtomicLong      arrivals = new AtomicLong();

    public ConcurrencyGate(AdmissionLedger ledger, int perOwnerLimit, int globalCeiling, Clock clock) {
        if (perOwnerLimit < 1 || globalCeiling < 1) {
            throw new IllegalArgumentException("Gate limits must be positive");
        }
        this.ledger        = ledger;
        this.perOwnerLimit = perOwnerLimit;
        this.globalCeiling = globalCeiling;
        this.clock         = clock;
    }

    /**
     * Request a slot for {@code jobId}.
     *
     * @return an ADMITTED ticket if the owner is below its limit, otherwise a QUEUED one
     * @throws ThrottledException if the global ceiling is reached
     */
    public AdmissionTicket admit(String ownerId, UUID jobId) {
        if (!ledger.tryAcquireGlobal(globalCeiling)) {
            log.warn("Throttled job {} of owner '{}': {} jobs in flight", jobId, ownerId, globalCeiling);
            throw new ThrottledException(globalCeiling);
        }
        AdmissionTicket ticket = ledger.withOwner(ownerId, slots -> {
            // The sequence is taken under the owner's lock so queue order equals sequence order.
            AdmissionTicket arrival = new AdmissionTicket(jobId, ownerId, arrivals.incrementAndGet(),
                    AdmissionTicket.Status.QUEUED, clock.instant());
            if (slots.active() < perOwnerLimit && !slots.hasWaiting()) {
                slots.occupy();
                return arrival.admitted();
            }
            slots.enqueue(arrival);
            return arrival;
        });
        log.debug("Owner '{}' job {} {} (seq={})", ownerId, jobId, ticket.status(), ticket.sequence());
        return ticket;
    }

    /**
     * Free the slot of a job that reached COMPLETE or FAILED.
     *
     * @return the ticket admitted from the head of the owner's queue, if any
     */
    public Optional<AdmissionTicket> release(String ownerId) {
        Optional<AdmissionTicket> next = ledger.withOwner(ownerId, slots -> {
            if (!slots.vacate()) {
                log.warn("Release for owner '{}' without an active slot", ownerId);
            }
            AdmissionTicket head = slots.pollWaiting();
            if (head == null) {
                return Optional.<AdmissionTicket>empty();
            }
            slots.occupy();
            return Optional.of(head.admitted());
        });
        ledger.releaseGlobal();
        next.ifPresent(t -> log.info("Owner '{}' job {} admitted from queue (seq={})",
                ownerId, t.jobId(), t.sequence()));
        return next;
    }

    /**
     * Remove a job that is still waiting in its owner's queue.
     *
     * @return false if the job was not queued (already admitted or unknown)
     */
    public boolean withdraw(String ownerId, UUID jobId) {
        boolean removed = ledger.withOwner(ownerId, slots -> slots.removeWaiting(jobId));
        if (removed) {
            ledger.releaseGlobal();
        }
        return removed;
    }

    /**
     * Rebuild an owner's counters after a restart.
     *
     * Active jobs occupy slots even beyond the limit (they were admitted before
     * the restart); queued jobs are re-admitted in the given order while slots remain.
     *
     * @param queuedJobIds PENDING jobs, oldest first
     * @return jobs admitted straight away
     */
    public List<AdmissionTicket> restore(String ownerId, List<UUID> activeJobIds, List<UUID> queuedJobIds) {
        for (int i = 0; i < activeJobIds.size() + queuedJobIds.size(); i++) {
            forceAcquireGlobal();
        }
        return ledger.withOwner(ownerId, slots -> {
            activeJobIds.forEach(id -> slots.occupy());
            List<AdmissionTicket> admitted = new ArrayList<>();
            for (UUID jobId : queuedJobIds) {
                AdmissionTicket ticket = new AdmissionTicket(jobId, ownerId, arrivals.incrementAndGet(),
                        AdmissionTicket.Status.QUEUED, clock.instant());
                if (slots.active() < perOwnerLimit && !slots.hasWaiting()) {
                    slots.occupy();
                    admitted.add(ticket.admitted());
                } else {
                    slots.enqueue(ticket);
                }
            }
            return admitted;
        });
    }

    public OwnerUsage usage(String ownerId) {
        return ledger.withOwner(ownerId, slots -> new OwnerUsage(slots.active(), slots.waitingCount()));
    }

    public int inFlight() {
        return ledger.inFlight();
    }

    public int perOwnerLimit() {
        return perOwnerLimit;
    }

    public int globalCeiling() {
        return globalCeiling;
    }

    // Jobs that survived a restart are counted even if they exceed the ceiling.
    private void forceAcquireGlobal() {
        if (!ledger.tryAcquireGlobal(Integer.MAX_VALUE)) {
            throw new IllegalStateException("In-flight counter overflow");
        }
    }
}
