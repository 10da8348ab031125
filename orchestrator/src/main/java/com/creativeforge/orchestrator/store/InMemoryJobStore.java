package com.creativeforge.orchestrator.store;

import com.creativeforge.orchestrator.model.Job;
import com.creativeforge.orchestrator.model.JobState;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-local JobStore for tests and single-node development runs.
 *
 * ConcurrentHashMap.compute runs the compare and the swap under the bin lock,
 * so concurrent writers to the same job are serialized.
 */
@Component
@ConditionalOnProperty(name = "creativeforge.job-store", havingValue = "memory")
public class InMemoryJobStore implements JobStore {

    private final Map<UUID, Job> jobs = new ConcurrentHashMap<>();

    @Override
    public UUID create(Job job) {
        Job previous = jobs.putIfAbsent(job.getId(), job.snapshot());
        if (previous != null) {
            throw new JobAlreadyExistsException(job.getId());
        }
        return job.getId();
    }

    @Override
    public Optional<Job> get(UUID jobId) {
        return Optional.ofNullable(jobs.get(jobId)).map(Job::snapshot);
    }

    @Override
    public CasResult compareAndSwap(UUID jobId, JobState expectedState, long expectedRevision, Job next) {
        AtomicReference<CasResult> result = new AtomicReference<>(CasResult.CONFLICT);
        Job updated = jobs.computeIfPresent(jobId, (id, stored) -> {
            if (stored.getState() != expectedState || stored.getRevision() != expectedRevision) {
                return stored;
            }
            Job replacement = stored.snapshot();
            replacement.copyMutableFieldsFrom(next);
            replacement.incrementRevision();
            result.set(CasResult.APPLIED);
            return replacement;
        });
        if (updated == null) {
            throw new JobNotFoundException(jobId);
        }
        return result.get();
    }

    @Override
    public void delete(UUID jobId) {
        if (jobs.remove(jobId) == null) {
            throw new JobNotFoundException(jobId);
        }
    }

    @Override
    public List<Job> findUnfinished() {
        return jobs.values().stream()
                .filter(j -> !j.getState().isTerminal())
                .map(Job::snapshot)
                .sorted(Comparator.comparing(Job::getCreatedAt))
                .toList();
    }
}
