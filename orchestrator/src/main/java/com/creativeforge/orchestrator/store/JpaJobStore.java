package com.creativeforge.orchestrator.store;

import com.creativeforge.orchestrator.model.Job;
import com.creativeforge.orchestrator.model.JobState;
import com.creativeforge.orchestrator.repository.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * PostgreSQL-backed JobStore (the default).
 *
 * Every method is @Transactional so that the row lock taken by
 * findByIdForUpdate is held across the compare and the UPDATE.
 * Entities leave this class as snapshots, never as managed instances.
 */
@Component
@ConditionalOnProperty(name = "creativeforge.job-store", havingValue = "jpa", matchIfMissing = true)
public class JpaJobStore implements JobStore {

    private static final Logger log = LoggerFactory.getLogger(JpaJobStore.class);

    private static final List<JobState> UNFINISHED = Arrays.stream(JobState.values())
            .filter(s -> !s.isTerminal())
            .toList();

    private final JobRepository jobRepo;

    public JpaJobStore(JobRepository jobRepo) {
        this.jobRepo = jobRepo;
    }

    @Override
    @Transactional
    public UUID create(Job job) {
        if (jobRepo.existsById(job.getId())) {
            throw new JobAlreadyExistsException(job.getId());
        }
        try {
            // isNew() is true for a fresh Job, so this is an INSERT; a racing
            // insert with the same id fails on the primary key at flush time.
            jobRepo.saveAndFlush(job.snapshot());
        } catch (DataIntegrityViolationException e) {
            throw new JobAlreadyExistsException(job.getId(), e);
        }
        return job.getId();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Job> get(UUID jobId) {
        return jobRepo.findById(jobId).map(Job::snapshot);
    }

    @Override
    @Transactional
    public CasResult compareAndSwap(UUID jobId, JobState expectedState, long expectedRevision, Job next) {
        Job stored = jobRepo.findByIdForUpdate(jobId)
                .orElseThrow(() -> new JobNotFoundException(jobId));
        if (stored.getState() != expectedState || stored.getRevision() != expectedRevision) {
            log.debug("CAS conflict on job {}: expected {}@{}, found {}@{}", jobId,
                    expectedState, expectedRevision, stored.getState(), stored.getRevision());
            return CasResult.CONFLICT;
        }
        stored.copyMutableFieldsFrom(next);
        stored.incrementRevision();
        jobRepo.save(stored);
        return CasResult.APPLIED;
    }

    @Override
    @Transactional
    public void delete(UUID jobId) {
        Job stored = jobRepo.findById(jobId)
                .orElseThrow(() -> new JobNotFoundException(jobId));
        jobRepo.delete(stored);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Job> findUnfinished() {
        return jobRepo.findByStateInOrderByCreatedAtAsc(UNFINISHED).stream()
                .map(Job::snapshot)
                .toList();
    }
}
