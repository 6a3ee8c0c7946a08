package com.dcruver.organizer.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * One classified item of a scanned tree: a file, a project root or a
 * generated folder.
 */
@Value
@Builder(toBuilder = true)
@With
@Jacksonized
public class ManifestEntry {
    public static final String DUPLICATE_SIGNAL_PREFIX = "Duplicate of ";

    // Identity
    String path;
    String relativePath;
    String name;
    String extension;
    long size;
    Instant modifiedAt;

    // Classification
    ItemKind kind;
    double confidence;
    List<String> signals;  // evidence trail, oldest first

    DocumentMetadata documentMetadata;

    // Project linkage
    ProjectRootDetection projectRoot;
    boolean insideProjectRoot;
    String parentProjectRoot;

    RecommendedHandling recommendedHandling;
    String suggestedCategory;
    List<String> suggestedTags;

    @JsonIgnore
    public boolean isKeep() {
        return recommendedHandling == RecommendedHandling.KEEP;
    }

    @JsonIgnore
    public boolean isDuplicate() {
        return signals != null && signals.stream().anyMatch(s -> s.startsWith(DUPLICATE_SIGNAL_PREFIX));
    }
}
