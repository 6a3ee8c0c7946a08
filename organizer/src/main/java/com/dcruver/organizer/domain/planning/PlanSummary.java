package com.dcruver.organizer.domain.planning;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@Value
@Builder
@Jacksonized
public class PlanSummary {
    public static final double HIGH_CONFIDENCE = 0.7;
    public static final double MEDIUM_CONFIDENCE = 0.4;

    int totalActions;
    int moves;
    int renames;
    int skips;
    Map<String, Integer> categoryCounts;
    int highConfidence;    // >= 0.7
    int mediumConfidence;  // 0.4 - 0.7
    int lowConfidence;     // < 0.4

    public static PlanSummary of(List<PlanAction> actions) {
        int moves = 0;
        int renames = 0;
        int skips = 0;
        int high = 0;
        int medium = 0;
        int low = 0;
        Map<String, Integer> categories = new TreeMap<>();

        for (PlanAction action : actions) {
            switch (action.getActionType()) {
                case MOVE, MOVE_RENAME -> moves++;
                case RENAME -> renames++;
                case SKIP -> skips++;
            }

            if (action.getConfidence() >= HIGH_CONFIDENCE) {
                high++;
            } else if (action.getConfidence() >= MEDIUM_CONFIDENCE) {
                medium++;
            } else {
                low++;
            }

            if (!action.isSkip() && action.getCategory() != null) {
                categories.merge(action.getCategory(), 1, Integer::sum);
            }
        }

        return PlanSummary.builder()
            .totalActions(actions.size())
            .moves(moves)
            .renames(renames)
            .skips(skips)
            .categoryCounts(categories)
            .highConfidence(high)
            .mediumConfidence(medium)
            .lowConfidence(low)
            .build();
    }
}
