package com.dcruver.organizer.domain.planning;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Undo record for one move: {@code from} is where the file is now,
 * {@code to} is where it came from.
 */
@Value
@Builder
@Jacksonized
public class RollbackEntry {
    String from;
    String to;
    String actionId;
    Instant timestamp;

    // Directories created by the move, parents first; removed on undo when empty
    @Builder.Default
    List<String> createdDirectories = List.of();
}
