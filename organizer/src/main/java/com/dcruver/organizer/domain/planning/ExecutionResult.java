package com.dcruver.organizer.domain.planning;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

@Value
@Builder
@Jacksonized
public class ExecutionResult {
    String actionId;
    ExecutionStatus status;
    String error;

    // Where the file actually went, when it differs from the planned destination
    String actualDestination;

    String message;
    Instant timestamp;
}
