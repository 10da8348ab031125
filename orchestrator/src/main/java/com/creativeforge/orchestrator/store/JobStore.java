package com.creativeforge.orchestrator.store;

import com.creativeforge.orchestrator.model.Job;
import com.creativeforge.orchestrator.model.JobState;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable persistence of job records.
 *
 * compareAndSwap is the only way an existing record changes: the write is
 * applied only if the stored state and revision still equal the ones the
 * caller read, and every applied write bumps the revision. A late or
 * duplicate stage execution therefore gets CONFLICT instead of overwriting
 * newer progress, even when the job has since re-entered the same state.
 *
 * Every method returns or stores detached copies; callers never share an
 * instance with the store.
 */
public interface JobStore {

    enum CasResult { APPLIED, CONFLICT }

    /**
     * @return the id of the stored job
     * @throws JobAlreadyExistsException if a job with the same id exists
     */
    UUID create(Job job);

    Optional<Job> get(UUID jobId);

    /**
     * Replace the stored job with {@code next} if its state is {@code expectedState}
     * and its revision is {@code expectedRevision}; the stored revision is then
     * incremented. A stored cancellation request is kept even when {@code next}
     * does not carry it.
     *
     * @throws JobNotFoundException if no job has this id
     */
    CasResult compareAndSwap(UUID jobId, JobState expectedState, long expectedRevision, Job next);

    /**
     * @throws JobNotFoundException if no job has this id
     */
    void delete(UUID jobId);

    /** Non-terminal jobs, oldest first. */
    List<Job> findUnfinished();
}
