package com.creativeforge.orchestrator.ai;

import com.creativeforge.orchestrator.model.OutputLanguage;

/**
 * Writes the marketing caption in the requested language.
 */
public interface CaptionGenerationCapability {

    /**
     * @throws CapabilityException on service failure
     */
    String generate(String prompt, OutputLanguage language);
}
