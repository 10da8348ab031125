package com.creativeforge.orchestrator.claude;

import com.creativeforge.orchestrator.model.OutputLanguage;

/**
 * System prompt and reply cleanup for caption generation.
 */
public final class CaptionPrompts {

    private CaptionPrompts() {}

    public static String system(OutputLanguage language) {
        return """
                You are a copywriter for small online sellers. You write one short,
                upbeat marketing caption for a product photo.

                RULES:
                  - Write in %s (%s), using its native script.
                  - Output the caption only: no quotes, no hashtags list, no explanation.
                  - Never mention prices, discounts or competitors.
                """.formatted(language.displayName(), language.code());
    }

    /** Remove surrounding whitespace and a pair of wrapping quotes, if present. */
    public static String clean(String reply) {
        if (reply == null) return null;
        String text = reply.strip();
        if (text.length() >= 2) {
            char first = text.charAt(0);
            char last  = text.charAt(text.length() - 1);
            if ((first == '"' && last == '"') || (first == '“' && last == '”')) {
                text = text.substring(1, text.length() - 1).strip();
            }
        }
        return text;
    }
}
