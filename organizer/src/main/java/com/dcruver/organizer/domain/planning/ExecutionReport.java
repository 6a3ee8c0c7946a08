package com.dcruver.organizer.domain.planning;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one execution or undo run. The rollback only covers moves that
 * really happened.
 */
@Value
@Builder
@Jacksonized
public class ExecutionReport {
    public static final int SCHEMA_VERSION = 1;

    @Builder.Default
    int schemaVersion = SCHEMA_VERSION;

    String planId;
    Instant executedAt;
    boolean dryRun;
    boolean cancelled;
    List<ExecutionResult> results;
    ExecutionSummary summary;
    Rollback rollback;

    @Value
    @Builder
    @Jacksonized
    public static class ExecutionSummary {
        int total;
        int completed;
        int failed;
        int skipped;

        public static ExecutionSummary of(List<ExecutionResult> results) {
            int completed = 0;
            int failed = 0;
            int skipped = 0;
            for (ExecutionResult result : results) {
                switch (result.getStatus()) {
                    case COMPLETED -> completed++;
                    case FAILED -> failed++;
                    case SKIPPED -> skipped++;
                }
            }
            return ExecutionSummary.builder()
                .total(results.size())
                .completed(completed)
                .failed(failed)
                .skipped(skipped)
                .build();
        }
    }
}
