package com.dcruver.organizer.domain.planning;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

@Value
@Builder
@Jacksonized
public class Rollback {
    public static final int SCHEMA_VERSION = 1;

    @Builder.Default
    int schemaVersion = SCHEMA_VERSION;

    String planId;
    Instant createdAt;
    List<RollbackEntry> entries;
}
