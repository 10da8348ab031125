package com.creativeforge.orchestrator.gate;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.UUID;

/**
 * Mutable admission state of one owner: active job count plus the FIFO of
 * waiting tickets. Only touched inside {@link AdmissionLedger#withOwner},
 * which serializes access per owner.
 */
public final class OwnerSlots {

    private int active;
    private final Deque<AdmissionTicket> waiting = new ArrayDeque<>();

    int active()                      { return active; }
    boolean hasWaiting()              { return !waiting.isEmpty(); }
    int waitingCount()                { return waiting.size(); }

    void occupy()                     { active++; }

    /** @return false if there was no active slot to free */
    boolean vacate() {
        if (active == 0) return false;
        active--;
        return true;
    }

    void enqueue(AdmissionTicket ticket) { waiting.addLast(ticket); }
    AdmissionTicket pollWaiting()        { return waiting.pollFirst(); }

    boolean removeWaiting(UUID jobId) {
        return waiting.removeIf(t -> t.jobId().equals(jobId));
    }

    boolean isIdle() {
        return active == 0 && waiting.isEmpty();
    }
}
