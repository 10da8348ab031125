package com.creativeforge.orchestrator.store;

import java.util.UUID;

/**
 * Thrown by {@link JobStore#create} when the id is already taken.
 * For idempotent submissions this is the signal that the request is a replay.
 */
public class JobAlreadyExistsException extends RuntimeException {

    private final UUID jobId;

    public JobAlreadyExistsException(UUID jobId) {
        super("Job already exists: " + jobId);
        this.jobId = jobId;
    }

    public JobAlreadyExistsException(UUID jobId, Throwable cause) {
        super("Job already exists: " + jobId, cause);
        this.jobId = jobId;
    }

    public UUID jobId() { return jobId; }
}
