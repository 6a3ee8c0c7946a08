package com.dcruver.organizer.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Classified inventory of a scanned tree. Built once per scan, never modified.
 */
@Value
@Builder
@Jacksonized
public class Manifest {
    public static final int SCHEMA_VERSION = 1;

    @Builder.Default
    int schemaVersion = SCHEMA_VERSION;

    String id;
    String scanRoot;
    Instant createdAt;
    ScanOptions scanOptions;
    List<String> projectRootPaths;  // every detected root, ignored ones included
    List<ManifestEntry> entries;
    ManifestSummary summary;
}
