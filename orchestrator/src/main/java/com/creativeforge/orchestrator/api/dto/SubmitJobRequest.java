package com.creativeforge.orchestrator.api.dto;

/**
 * Request body for POST /jobs.
 *
 * Required: sourceAssetRef, language (ISO 639-1 code, e.g. "hi")
 * Optional: idempotencyKey - repeating a submission with the same key returns
 *   the original job instead of creating a second one.
 */
public record SubmitJobRequest(String sourceAssetRef, String language, String idempotencyKey) {}
