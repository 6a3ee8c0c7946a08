package com.dcruver.organizer.domain.planning;

import lombok.Builder;
import lombok.Value;

import java.util.Set;
import java.util.function.BooleanSupplier;

/**
 * How to run a plan.
 */
@Value
@Builder
public class ExecuteOptions {
    boolean dryRun;

    /**
     * Actions to run. Null means every approved action.
     */
    Set<String> selectedActionIds;

    /**
     * Polled before each action; returning true stops the run.
     */
    @Builder.Default
    BooleanSupplier cancellation = () -> false;

    public static ExecuteOptions defaults() {
        return ExecuteOptions.builder().build();
    }
}
