package com.creativeforge.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;

/**
 * Languages a caption can be generated in.
 *
 * Serialized as the ISO 639-1 code ("hi", "ta", ...).
 */
public enum OutputLanguage {
    ENGLISH  ("en", "English"),
    HINDI    ("hi", "Hindi"),
    BENGALI  ("bn", "Bengali"),
    TAMIL    ("ta", "Tamil"),
    TELUGU   ("te", "Telugu"),
    MARATHI  ("mr", "Marathi"),
    GUJARATI ("gu", "Gujarati"),
    KANNADA  ("kn", "Kannada"),
    MALAYALAM("ml", "Malayalam"),
    PUNJABI  ("pa", "Punjabi");

    private final String code;
    private final String displayName;

    OutputLanguage(String code, String displayName) {
        this.code        = code;
        this.displayName = displayName;
    }

    @JsonValue
    public String code()        { return code; }
    public String displayName() { return displayName; }

    /**
     * @throws IllegalArgumentException for an unsupported or blank code
     */
    @JsonCreator
    public static OutputLanguage fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Language code is required");
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(l -> l.code.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unsupported language: " + code));
    }
}
