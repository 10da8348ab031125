package com.creativeforge.orchestrator.gate;

/**
 * Read-only view of one owner's gate usage.
 */
public record OwnerUsage(int active, int queued) {}
