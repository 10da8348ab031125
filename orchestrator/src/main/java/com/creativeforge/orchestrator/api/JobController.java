package com.creativeforge.orchestrator.api;

import com.creativeforge.orchestrator.api.dto.JobResponse;
import com.creativeforge.orchestrator.api.dto.SafetyAuditResponse;
import com.creativeforge.orchestrator.api.dto.SubmitJobRequest;
import com.creativeforge.orchestrator.model.Job;
import com.creativeforge.orchestrator.service.JobService;
import com.creativeforge.orchestrator.service.SubmitResult;
import com.creativeforge.orchestrator.store.JobNotFoundException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST API for job lifecycle.
 *
 * POST /jobs                     - submit a source image
 * GET  /jobs/{id}                - poll the current state of a job
 * POST /jobs/{id}/cancel         - request cancellation
 * GET  /jobs/{id}/safety-audit   - safety verdicts recorded for the job
 * GET  /jobs/latency-bound       - longest time an admitted job can take
 *
 * The caller is identified by the X-Owner-Id header, set by the gateway in
 * front of this service. A job owned by someone else answers 404.
 */
@RestController
@RequestMapping("/jobs")
public class JobController {

    static final String OWNER_HEADER = "X-Owner-Id";

    private final JobService jobService;

    public JobController(JobService jobService) {
        this.jobService = jobService;
    }

    /**
     * Submit a new job.
     *
     * Example:
     *   curl -X POST http://localhost:8080/jobs \
     *     -H "Content-Type: application/json" -H "X-Owner-Id: seller-42" \
     *     -d '{"sourceAssetRef":"s3://uploads/kurta.jpg","language":"hi","idempotencyKey":"kurta-1"}'
     *
     * HTTP 201 - new job created
     * HTTP 200 - idempotent replay, the original job is returned
     * HTTP 429 - global ceiling reached, nothing was created
     */
    @PostMapping
    public ResponseEntity<JobResponse> submit(@RequestHeader(OWNER_HEADER) String ownerId,
                                              @RequestBody SubmitJobRequest req) {
        SubmitResult result = jobService.submit(ownerId, req.sourceAssetRef(), req.language(), req.idempotencyKey());
        HttpStatus status = result.created() ? HttpStatus.CREATED : HttpStatus.OK;
        return ResponseEntity.status(status).body(JobResponse.from(result.job()));
    }

    @GetMapping("/{id}")
    public JobResponse getJob(@RequestHeader(OWNER_HEADER) String ownerId, @PathVariable UUID id) {
        return JobResponse.from(owned(ownerId, id));
    }

    /** HTTP 202 - cancellation is cooperative; poll GET /jobs/{id} for the outcome. */
    @PostMapping("/{id}/cancel")
    public ResponseEntity<JobResponse> cancel(@RequestHeader(OWNER_HEADER) String ownerId,
                                              @PathVariable UUID id) {
        owned(ownerId, id);
        Job job = jobService.cancel(id);
        return ResponseEntity.accepted().body(JobResponse.from(job));
    }

    @GetMapping("/{id}/safety-audit")
    public List<SafetyAuditResponse> safetyAudit(@RequestHeader(OWNER_HEADER) String ownerId,
                                                 @PathVariable UUID id) {
        owned(ownerId, id);
        return jobService.safetyAudit(id).stream()
                .map(SafetyAuditResponse::from)
                .toList();
    }

    @GetMapping("/latency-bound")
    public Map<String, Object> latencyBound() {
        return Map.of("seconds", jobService.latencyUpperBound().toSeconds());
    }

    private Job owned(String ownerId, UUID id) {
        Job job = jobService.getStatus(id);
        if (!job.getOwnerId().equals(ownerId)) {
            throw new JobNotFoundException(id);
        }
        return job;
    }
}
