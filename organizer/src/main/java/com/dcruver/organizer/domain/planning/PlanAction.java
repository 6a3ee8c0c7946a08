package com.dcruver.organizer.domain.planning;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * A single proposed move. Paths are absolute; the relative forms are for display.
 */
@Value
@Builder(toBuilder = true)
@With
@Jacksonized
public class PlanAction {
    String id;
    String from;
    String fromRelative;
    String to;
    String toRelative;
    ActionType actionType;
    String reason;
    double confidence;
    String category;
    List<String> tags;
    String projectRoot;

    /**
     * Set when the move would cross a project boundary. Such actions are always SKIP.
     */
    boolean movesInsideProjectRoot;

    boolean hasCollision;
    boolean approved;

    @JsonIgnore
    public boolean isSkip() {
        return actionType == ActionType.SKIP;
    }
}
