package com.creativeforge.orchestrator.gate;

import java.util.function.Function;

/**
 * Backing store of the concurrency gate's counters and queues.
 *
 * The in-memory implementation serves a single node and tests; a deployment
 * with several orchestrator nodes plugs in a coordinated implementation
 * without touching the gate's admission rules.
 */
public interface AdmissionLedger {

    /** Take one global in-flight slot unless {@code ceiling} slots are already taken. */
    boolean tryAcquireGlobal(int ceiling);

    void releaseGlobal();

    int inFlight();

    /**
     * Run {@code mutation} with exclusive access to the owner's slots.
     * Mutations of the same owner never overlap; different owners proceed independently.
     */
    <T> T withOwner(String ownerId, Function<OwnerSlots, T> mutation);
}
