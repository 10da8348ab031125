package com.creativeforge.orchestrator.service;

import com.creativeforge.orchestrator.config.CreativeForgeProperties;
import com.creativeforge.orchestrator.model.Job;
import com.creativeforge.orchestrator.store.JobStore;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Runs Orchestrator units on a fixed worker pool.
 *
 * Each unit returns an {@link Advance}: the next unit is submitted right
 * away, after a timer for retries, or not at all. Jobs the gate admitted
 * during the unit are started. No worker ever sleeps.
 *
 * A job has at most one unit running on this node at a time. Units from
 * other nodes are harmless: the JobStore CAS rejects the loser.
 *
 * Every minute a sweep re-dispatches admitted jobs whose record has not
 * changed for {@code creativeforge.dispatcher.stall-timeout}, which covers
 * units lost to a crash or an unexpected exception.
 */
@Component
@EnableScheduling
public class StageDispatcher {

    private static final Logger log = LoggerFactory.getLogger(StageDispatcher.class);

    private final ExecutorService          workers;
    private final ScheduledExecutorService timers = Executors.newSingleThreadScheduledExecutor();
    private final Set<UUID>                inFlight = ConcurrentHashMap.newKeySet();

    private final Orchestrator orchestrator;
    private final JobStore     store;
    private final Duration     stallTimeout;
    private final Clock        clock;

    public StageDispatcher(Orchestrator orchestrator, JobStore store,
                           CreativeForgeProperties props, Clock clock) {
        this.orchestrator = orchestrator;
        this.store        = store;
        this.stallTimeout = props.dispatcher().stallTimeout();
        this.clock        = clock;
        this.workers      = Executors.newFixedThreadPool(props.dispatcher().workers());
    }

    /** Start a job the gate has admitted. */
    public void start(UUID jobId) {
        submit(jobId, () -> orchestrator.start(jobId));
    }

    /** Run the next unit of an admitted job. */
    public void dispatch(UUID jobId) {
        submit(jobId, () -> orchestrator.advance(jobId));
    }

    /** Act on an Advance produced outside the worker pool (e.g. by a cancel request). */
    public void follow(UUID jobId, Advance next) {
        next.admitted().forEach(this::start);
        switch (next.kind()) {
            case CONTINUE    -> dispatch(jobId);
            case RETRY_LATER -> timers.schedule(() -> dispatch(jobId),
                                        next.delay().toMillis(), TimeUnit.MILLISECONDS);
            case IDLE        -> { }
        }
    }

    @Scheduled(fixedDelayString = "${creativeforge.dispatcher.sweep-interval:PT1M}")
    public void sweepStalled() {
        Instant cutoff = clock.instant().minus(stallTimeout);
        for (Job job : store.findUnfinished()) {
            if (job.getState().isAdmitted()
                    && job.getUpdatedAt().isBefore(cutoff)
                    && !inFlight.contains(job.getId())) {
                log.warn("Re-dispatching stalled job {} (state={}, last update={})",
                        job.getId(), job.getState(), job.getUpdatedAt());
                dispatch(job.getId());
            }
        }
    }

    public boolean isInFlight(UUID jobId) {
        return inFlight.contains(jobId);
    }

    @PreDestroy
    public void shutdown() {
        timers.shutdownNow();
        workers.shutdown();
    }

    private void submit(UUID jobId, Supplier<Advance> unit) {
        if (!inFlight.add(jobId)) {
            log.debug("Job {} already running on this node, skipping dispatch", jobId);
            return;
        }
        workers.execute(() -> {
            Advance next;
            try {
                next = unit.get();
            } catch (Exception e) {
                // The job keeps its stored state; the stall sweep picks it up again.
                log.error("Unhandled error while advancing job {}: {}", jobId, e.getMessage(), e);
                next = Advance.idle();
            } finally {
                inFlight.remove(jobId);
            }
            follow(jobId, next);
        });
    }
}
