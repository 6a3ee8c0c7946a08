package com.dcruver.organizer.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Aggregate counters for a manifest.
 * The three confidence bands always add up to {@code totalItems}.
 */
@Value
@Builder
@Jacksonized
public class ManifestSummary {
    public static final double HIGH_CONFIDENCE = 0.8;
    public static final double MEDIUM_CONFIDENCE = 0.5;

    int totalItems;
    int projectRoots;
    int generated;
    int documents;
    int media;
    int archives;
    int code;
    int unknown;

    int highConfidence;    // >= 0.8
    int mediumConfidence;  // 0.5 - 0.8
    int lowConfidence;     // < 0.5

    public static ManifestSummary of(Iterable<ManifestEntry> entries) {
        int total = 0;
        int projectRoots = 0;
        int generated = 0;
        int documents = 0;
        int media = 0;
        int archives = 0;
        int code = 0;
        int unknown = 0;
        int high = 0;
        int medium = 0;
        int low = 0;

        for (ManifestEntry entry : entries) {
            total++;
            switch (entry.getKind()) {
                case PROJECT_ROOT -> projectRoots++;
                case GENERATED -> generated++;
                case DOCUMENT -> documents++;
                case MEDIA -> media++;
                case ARCHIVE -> archives++;
                case CODE -> code++;
                default -> unknown++;
            }

            if (entry.getConfidence() >= HIGH_CONFIDENCE) {
                high++;
            } else if (entry.getConfidence() >= MEDIUM_CONFIDENCE) {
                medium++;
            } else {
                low++;
            }
        }

        return ManifestSummary.builder()
            .totalItems(total)
            .projectRoots(projectRoots)
            .generated(generated)
            .documents(documents)
            .media(media)
            .archives(archives)
            .code(code)
            .unknown(unknown)
            .highConfidence(high)
            .mediumConfidence(medium)
            .lowConfidence(low)
            .build();
    }
}
