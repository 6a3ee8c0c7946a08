package com.dcruver.organizer.nlp;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

/**
 * Classifier answer. Use {@link #sanitize()} before trusting any field.
 */
@Value
@Builder
@With
@Jacksonized
public class ClassificationResponse {
    public static final String UNKNOWN_CATEGORY = "Unknown";
    public static final double UNKNOWN_MAX_CONFIDENCE = 0.3;

    String category;
    String subject;
    String title;
    Double confidence;
    String reasoning;

    /**
     * Clamp confidence to [0, 1] and degrade a missing category to a
     * low-confidence "Unknown".
     */
    public ClassificationResponse sanitize() {
        double c = confidence == null || confidence.isNaN() ? 0.0 : confidence;
        c = Math.max(0.0, Math.min(1.0, c));

        String cat = category == null ? "" : category.trim();
        if (cat.isEmpty()) {
            cat = UNKNOWN_CATEGORY;
            c = Math.min(c, UNKNOWN_MAX_CONFIDENCE);
        }

        return ClassificationResponse.builder()
            .category(cat)
            .subject(blankToNull(subject))
            .title(blankToNull(title))
            .confidence(c)
            .reasoning(reasoning == null ? "" : reasoning.trim())
            .build();
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
