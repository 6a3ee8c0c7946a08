package com.dcruver.organizer.domain.planning;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Reviewable list of moves derived from one manifest.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Plan {
    public static final int SCHEMA_VERSION = 1;

    @Builder.Default
    int schemaVersion = SCHEMA_VERSION;

    String id;
    String manifestId;
    Instant createdAt;
    String destRoot;
    List<PlanAction> actions;
    SafetyCheck safetyCheck;
    PlanSummary summary;
    UserPreferences userPreferences;

    public Optional<PlanAction> findAction(String actionId) {
        return actions.stream().filter(a -> a.getId().equals(actionId)).findFirst();
    }
}
