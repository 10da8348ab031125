package com.creativeforge.orchestrator.ai;

import java.util.List;

/**
 * Content-policy moderation of generated output.
 */
public interface ContentSafetyCapability {

    SafetyAssessment moderateImages(List<String> assetRefs);

    SafetyAssessment moderateText(String text, String languageCode);
}
