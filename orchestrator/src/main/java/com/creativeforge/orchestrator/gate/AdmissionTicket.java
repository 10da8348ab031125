package com.creativeforge.orchestrator.gate;

import java.time.Instant;
import java.util.UUID;

/**
 * A caller's place at the gate, from arrival until admission or withdrawal.
 *
 * @param sequence gate-wide arrival order; lower sequences of the same owner are admitted first
 */
public record AdmissionTicket(
        UUID    jobId,
        String  ownerId,
        long    sequence,
        Status  status,
        Instant arrivedAt) {

    public enum Status { ADMITTED, QUEUED }

    public boolean isAdmitted() {
        return status == Status.ADMITTED;
    }

    AdmissionTicket admitted() {
        return new AdmissionTicket(jobId, ownerId, sequence, Status.ADMITTED, arrivedAt);
    }
}
