package com.creativeforge.orchestrator.ai;

import java.util.List;

/**
 * Produces background variations for the product shot.
 */
public interface BackgroundGenerationCapability {

    /**
     * @return references to the generated images; may contain fewer than {@code count}
     * @throws CapabilityException on service failure
     */
    List<String> generate(String prompt, int count);
}
