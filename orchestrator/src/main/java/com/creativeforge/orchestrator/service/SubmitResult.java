package com.creativeforge.orchestrator.service;

import com.creativeforge.orchestrator.model.Job;

/**
 * @param created false when an idempotency key matched an earlier submission
 */
public record SubmitResult(Job job, boolean created) {}
