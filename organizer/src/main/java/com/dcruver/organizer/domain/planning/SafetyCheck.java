package com.dcruver.organizer.domain.planning;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Outcome of validating a plan. Only project-root violations fail it;
 * low confidence is a warning.
 */
@Value
@Builder
@Jacksonized
public class SafetyCheck {
    boolean passed;
    List<String> errors;
    List<String> warnings;
    SafetyCounters checks;

    @Value
    @Builder
    @Jacksonized
    public static class SafetyCounters {
        int collisionsResolved;
        List<String> collisionDestinations;
        int lowConfidenceActions;
        int skippedItems;
        int projectRootViolations;
    }
}
