package com.creativeforge.orchestrator.repository;

import com.creativeforge.orchestrator.model.Job;
import com.creativeforge.orchestrator.model.JobState;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * CRUD + query operations for the jobs table.
 *
 * Spring Data JPA generates the implementation at startup -
 * we only declare the method signatures we need.
 */
public interface JobRepository extends JpaRepository<Job, UUID> {

    /**
     * Load a job and lock its row until the surrounding transaction ends.
     *
     * SELECT ... FOR UPDATE makes the compare-and-swap in JpaJobStore atomic:
     * a second writer blocks on the lock, then sees the state the first one
     * committed and reports a conflict instead of overwriting it.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT j FROM Job j WHERE j.id = :id")
    Optional<Job> findByIdForUpdate(@Param("id") UUID id);

    /** Jobs in any of the given states, oldest first (used by crash recovery). */
    List<Job> findByStateInOrderByCreatedAtAsc(Collection<JobState> states);
}
