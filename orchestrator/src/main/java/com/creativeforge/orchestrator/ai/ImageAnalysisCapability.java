package com.creativeforge.orchestrator.ai;

/**
 * Classifies the uploaded product image.
 */
public interface ImageAnalysisCapability {

    /**
     * @throws CapabilityException TRANSIENT for timeouts/5xx, PERMANENT for malformed input
     */
    AnalysisReport analyze(String sourceAssetRef);
}
