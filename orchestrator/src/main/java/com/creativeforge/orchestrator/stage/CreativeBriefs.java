package com.creativeforge.orchestrator.stage;

import com.creativeforge.orchestrator.ai.GenerationMode;
import com.creativeforge.orchestrator.model.Job;

import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Prompt text for the generation stages, built from the analysis result.
 */
public final class CreativeBriefs {

    static final String HINT_SHORTER = "SHORTER";
    static final String HINT_LONGER  = "LONGER";

    private static final String STRICT_RULES = """
            Content policy (strict): no people, faces or body parts; no text, logos or
            watermarks; no alcohol, tobacco, weapons or religious symbols; neutral,
            brand-safe setting only.
            """;

    private CreativeBriefs() {}

    public static String backgrounds(Job job, GenerationMode mode) {
        StringBuilder sb = new StringBuilder();
        sb.append("Studio-quality background for a ")
          .append(categoryLabel(job))
          .append(" product photo. Keep the product untouched and centred; replace only the background.\n");
        appendAttributes(sb, job.getAnalysisAttributes());
        sb.append("Produce clearly different scenes for each variation.\n");
        if (mode == GenerationMode.STRICT) {
            sb.append(STRICT_RULES);
        }
        return sb.toString();
    }

    public static String caption(Job job, GenerationMode mode, String retryHint, int minLength, int maxLength) {
        StringBuilder sb = new StringBuilder();
        sb.append("Write a marketing caption for a ")
          .append(categoryLabel(job))
          .append(" product.\n");
        appendAttributes(sb, job.getAnalysisAttributes());
        sb.append("Length: between ").append(minLength).append(" and ").append(maxLength)
          .append(" characters.\n");
        if (HINT_SHORTER.equals(retryHint)) {
            sb.append("Your previous caption was too long. Keep it well under ")
              .append(maxLength).append(" characters.\n");
        } else if (HINT_LONGER.equals(retryHint)) {
            sb.append("Your previous caption was too short. Write at least ")
              .append(minLength).append(" characters.\n");
        }
        if (mode == GenerationMode.STRICT) {
            sb.append("Content policy (strict): no health or medical claims, no superlatives about ")
              .append("competitors, no slang, profanity or sensitive topics.\n");
        }
        return sb.toString();
    }

    private static String categoryLabel(Job job) {
        return job.getAnalysisCategory() == null
                ? "retail"
                : job.getAnalysisCategory().name().toLowerCase(Locale.ROOT).replace('_', ' ');
    }

    private static void appendAttributes(StringBuilder sb, Map<String, String> attributes) {
        if (attributes.isEmpty()) return;
        sb.append("Product details: ")
          .append(attributes.entrySet().stream()
                  .map(e -> e.getKey() + "=" + e.getValue())
                  .collect(Collectors.joining(", ")))
          .append('\n');
    }
}
