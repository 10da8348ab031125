package com.creativeforge.orchestrator.store;

import java.util.UUID;

/**
 * Thrown when an operation addresses a job id the store does not hold.
 */
public class JobNotFoundException extends RuntimeException {

    private final UUID jobId;

    public JobNotFoundException(UUID jobId) {
        super("Job not found: " + jobId);
        this.jobId = jobId;
    }

    public UUID jobId() { return jobId; }
}
