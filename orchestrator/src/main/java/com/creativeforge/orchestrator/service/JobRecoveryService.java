package com.creativeforge.orchestrator.service;

import com.creativeforge.orchestrator.gate.AdmissionTicket;
import com.creativeforge.orchestrator.gate.ConcurrencyGate;
import com.creativeforge.orchestrator.model.Job;
import com.creativeforge.orchestrator.model.JobState;
import com.creativeforge.orchestrator.store.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Resumes unfinished jobs after a restart.
 *
 * The gate's counters live in memory, so they are rebuilt from the store:
 * jobs past PENDING hold a slot, PENDING jobs queue again in submission order.
 * Every admitted job is then dispatched; it resumes from its stored state.
 */
@Component
public class JobRecoveryService {

    private static final Logger log = LoggerFactory.getLogger(JobRecoveryService.class);

    private final JobStore        store;
    private final ConcurrencyGate gate;
    private final StageDispatcher dispatcher;

    public JobRecoveryService(JobStore store, ConcurrencyGate gate, StageDispatcher dispatcher) {
        this.store      = store;
        this.gate       = gate;
        this.dispatcher = dispatcher;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void recover() {
        Map<String, List<Job>> byOwner = new LinkedHashMap<>();
        for (Job job : store.findUnfinished()) {
            byOwner.computeIfAbsent(job.getOwnerId(), k -> new ArrayList<>()).add(job);
        }
        if (byOwner.isEmpty()) {
            return;
        }

        List<UUID> resume = new ArrayList<>();
        List<UUID> start  = new ArrayList<>();
        byOwner.forEach((ownerId, jobs) -> {
            List<UUID> active = jobs.stream().filter(j -> j.getState().isAdmitted()).map(Job::getId).toList();
            List<UUID> queued = jobs.stream().filter(j -> j.getState() == JobState.PENDING).map(Job::getId).toList();
            resume.addAll(active);
            gate.restore(ownerId, active, queued).stream().map(AdmissionTicket::jobId).forEach(start::add);
        });
        log.info("Recovered {} owners: resuming {} jobs, starting {} queued jobs",
                byOwner.size(), resume.size(), start.size());

        resume.forEach(dispatcher::dispatch);
        start.forEach(dispatcher::start);
    }
}
