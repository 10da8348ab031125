package com.creativeforge.orchestrator.ai;

/**
 * STRICT is used for the regeneration that follows an unsafe verdict.
 */
public enum GenerationMode {
    STANDARD,
    STRICT
}
