package com.creativeforge.orchestrator.ai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Map;

/**
 * Raw output of the image analysis service, before validation.
 *
 * @param category   free-form label; the analysis stage maps it to a ProductCategory
 * @param confidence expected within [0,1]
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AnalysisReport(String category, Double confidence, Map<String, String> attributes) {}
