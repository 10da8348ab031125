package com.creativeforge.orchestrator.gate;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Single-process ledger.
 *
 * Per-owner mutations run inside ConcurrentHashMap.compute, which holds the
 * entry lock for the duration of the mutation. Idle owners are dropped so
 * the map only holds owners with active or waiting jobs.
 */
public class InMemoryAdmissionLedger implements AdmissionLedger {

    private final Map<String, OwnerSlots> owners = new ConcurrentHashMap<>();
    private final AtomicInteger inFlight = new AtomicInteger();

    @Override
    public boolean tryAcquireGlobal(int ceiling) {
        while (true) {
            int current = inFlight.get();
            if (current >= ceiling) return false;
            if (inFlight.compareAndSet(current, current + 1)) return true;
        }
    }

    @Override
    public void releaseGlobal() {
        inFlight.updateAndGet(n -> Math.max(0, n - 1));
    }

    @Override
    public int inFlight() {
        return inFlight.get();
    }

    @Override
    public <T> T withOwner(String ownerId, Function<OwnerSlots, T> mutation) {
        AtomicReference<T> result = new AtomicReference<>();
        owners.compute(ownerId, (id, slots) -> {
            OwnerSlots current = slots != null ? slots : new OwnerSlots();
            result.set(mutation.apply(current));
            return current.isIdle() ? null : current;
        });
        return result.get();
    }
}
