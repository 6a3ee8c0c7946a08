package com.dcruver.organizer.domain.planning;

import com.dcruver.organizer.domain.planning.ExecutionReport.ExecutionSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.*;
import java.time.Instant;
import java.util.*;

/**
 * Applies plan actions to the filesystem, one at a time and in plan order,
 * and replays rollbacks to undo them.
 * Never deletes a file and never replaces an existing one.
 */
@Component
@Slf4j
public class ActionExecutor {

    /**
     * Execute the selected actions of a plan.
     *
     * @throws PlanRejectedException if the plan would break a project boundary
     */
    public ExecutionReport execute(Plan plan, ExecuteOptions options) {
        rejectUnsafe(plan);

        Set<String> selected = selectActions(plan, options.getSelectedActionIds());
        log.info("Executing plan {}: {} of {} actions selected (dry run: {})",
            plan.getId(), selected.size(), plan.getActions().size(), options.isDryRun());

        List<ExecutionResult> results = new ArrayList<>();
        List<RollbackEntry> rollbackEntries = new ArrayList<>();
        Set<String> usedDestinations = new HashSet<>();
        boolean cancelled = false;

        for (PlanAction action : plan.getActions()) {
            if (action.isSkip()) {
                results.add(skipped(action.getId(), "Skipped: " + action.getReason()));
                continue;
            }
            if (!selected.contains(action.getId())) {
                results.add(skipped(action.getId(), options.getSelectedActionIds() == null
                    ? "Not approved" : "Not selected"));
                continue;
            }

            if (!cancelled && options.getCancellation().getAsBoolean()) {
                log.warn("Execution of plan {} cancelled", plan.getId());
                cancelled = true;
            }
            if (cancelled) {
                results.add(skipped(action.getId(), "Cancelled"));
                continue;
            }

            results.add(executeAction(action, options.isDryRun(), usedDestinations, rollbackEntries));
        }

        ExecutionSummary summary = ExecutionSummary.of(results);
        log.info("Plan {} done: {} completed, {} failed, {} skipped",
            plan.getId(), summary.getCompleted(), summary.getFailed(), summary.getSkipped());

        Instant now = Instant.now();
        return ExecutionReport.builder()
            .planId(plan.getId())
            .executedAt(now)
            .dryRun(options.isDryRun())
            .cancelled(cancelled)
            .results(List.copyOf(results))
            .summary(summary)
            .rollback(Rollback.builder()
                .planId(plan.getId())
                .createdAt(now)
                .entries(List.copyOf(rollbackEntries))
                .build())
            .build();
    }

    private ExecutionResult executeAction(PlanAction action, boolean dryRun, Set<String> usedDestinations,
                                          List<RollbackEntry> rollbackEntries) {
        Path source = Path.of(action.getFrom());
        Path planned = Path.of(action.getTo());

        if (!Files.exists(source, LinkOption.NOFOLLOW_LINKS)) {
            log.warn("Source no longer exists: {}", source);
            return failed(action.getId(), "Source does not exist: " + source);
        }

        List<Path> createdDirectories = new ArrayList<>();
        try {
            Path target = planned;
            if (usedDestinations.contains(target.toString()) || Files.exists(target, LinkOption.NOFOLLOW_LINKS)) {
                target = CollisionResolver.nextFreePath(planned, usedDestinations);
                log.info("Destination {} appeared since planning, using {}", planned, target);
            }
            usedDestinations.add(target.toString());

            if (dryRun) {
                return ExecutionResult.builder()
                    .actionId(action.getId())
                    .status(ExecutionStatus.COMPLETED)
                    .actualDestination(target.toString())
                    .message("Would move " + source + " -> " + target)
                    .timestamp(Instant.now())
                    .build();
            }

            createdDirectories = createParentDirectories(target);
            move(source, target);

            rollbackEntries.add(RollbackEntry.builder()
                .from(target.toString())
                .to(source.toString())
                .actionId(action.getId())
                .timestamp(Instant.now())
                .createdDirectories(createdDirectories.stream().map(Path::toString).toList())
                .build());

            log.debug("Moved {} -> {}", source, target);
            return ExecutionResult.builder()
                .actionId(action.getId())
                .status(ExecutionStatus.COMPLETED)
                .actualDestination(target.toString())
                .message(target.equals(planned) ? "Moved" : "Moved with suffix, destination was taken")
                .timestamp(Instant.now())
                .build();

        } catch (IOException | RuntimeException e) {
            log.error("Failed to move {} -> {}", source, planned, e);
            removeEmptyDirectories(createdDirectories);
            return failed(action.getId(), e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    public ExecutionReport undo(Rollback rollback) {
        return undo(rollback, false);
    }

    /**
     * Replay a rollback in reverse order. Each entry is restored only if its
     * current file still exists and its original location is free. The report's
     * rollback holds the entries that were not restored, in their original order.
     */
    public ExecutionReport undo(Rollback rollback, boolean dryRun) {
        List<RollbackEntry> entries = new ArrayList<>(rollback.getEntries());
        Collections.reverse(entries);
        log.info("Undoing plan {}: {} entries (dry run: {})", rollback.getPlanId(), entries.size(), dryRun);

        List<ExecutionResult> results = new ArrayList<>();
        Set<RollbackEntry> restored = Collections.newSetFromMap(new IdentityHashMap<>());
        for (RollbackEntry entry : entries) {
            ExecutionResult result = undoEntry(entry, dryRun);
            results.add(result);
            if (!dryRun && result.getStatus() == ExecutionStatus.COMPLETED) {
                restored.add(entry);
            }
        }
        List<RollbackEntry> remaining = rollback.getEntries().stream()
            .filter(entry -> !restored.contains(entry))
            .toList();

        ExecutionSummary summary = ExecutionSummary.of(results);
        log.info("Undo of plan {} done: {} restored, {} failed",
            rollback.getPlanId(), summary.getCompleted(), summary.getFailed());

        Instant now = Instant.now();
        return ExecutionReport.builder()
            .planId(rollback.getPlanId())
            .executedAt(now)
            .dryRun(dryRun)
            .results(List.copyOf(results))
            .summary(summary)
            .rollback(Rollback.builder()
                .planId(rollback.getPlanId())
                .createdAt(rollback.getCreatedAt() != null ? rollback.getCreatedAt() : now)
                .entries(remaining)
                .build())
            .build();
    }

    private ExecutionResult undoEntry(RollbackEntry entry, boolean dryRun) {
        Path current = Path.of(entry.getFrom());
        Path original = Path.of(entry.getTo());

        if (!Files.exists(current, LinkOption.NOFOLLOW_LINKS)) {
            log.warn("Cannot restore {}: {} is missing", original, current);
            return failed(entry.getActionId(), "Rollback source missing: " + current);
        }
        if (Files.exists(original, LinkOption.NOFOLLOW_LINKS)) {
            log.warn("Cannot restore {}: location is occupied", original);
            return failed(entry.getActionId(), "Original location is occupied: " + original);
        }

        if (dryRun) {
            return ExecutionResult.builder()
                .actionId(entry.getActionId())
                .status(ExecutionStatus.COMPLETED)
                .actualDestination(original.toString())
                .message("Would restore " + current + " -> " + original)
                .timestamp(Instant.now())
                .build();
        }

        try {
            if (original.getParent() != null) {
                Files.createDirectories(original.getParent());
            }
            move(current, original);
        } catch (IOException | RuntimeException e) {
            log.error("Failed to restore {} -> {}", current, original, e);
            return failed(entry.getActionId(), e.getClass().getSimpleName() + ": " + e.getMessage());
        }

        List<Path> created = entry.getCreatedDirectories() == null ? List.of()
            : entry.getCreatedDirectories().stream().map(Path::of).toList();
        removeEmptyDirectories(created);

        return ExecutionResult.builder()
            .actionId(entry.getActionId())
            .status(ExecutionStatus.COMPLETED)
            .actualDestination(original.toString())
            .message("Restored")
            .timestamp(Instant.now())
            .build();
    }

    private static void rejectUnsafe(Plan plan) {
        if (plan.getSafetyCheck() != null && !plan.getSafetyCheck().isPassed()) {
            throw new PlanRejectedException("Plan " + plan.getId() + " failed its safety check: "
                + plan.getSafetyCheck().getErrors());
        }
        for (PlanAction action : plan.getActions()) {
            if (!action.isSkip() && action.isMovesInsideProjectRoot()) {
                throw new PlanRejectedException("Action " + action.getId() + " crosses a project root boundary");
            }
        }
    }

    private static Set<String> selectActions(Plan plan, Set<String> selectedIds) {
        Set<String> selected = new HashSet<>();
        for (PlanAction action : plan.getActions()) {
            if (action.isSkip()) {
                continue;
            }
            boolean pick = selectedIds != null ? selectedIds.contains(action.getId()) : action.isApproved();
            if (pick) {
                selected.add(action.getId());
            }
        }
        return selected;
    }

    /**
     * Create the missing ancestors of {@code target}.
     *
     * @return the directories that had to be created, outermost first
     */
    private static List<Path> createParentDirectories(Path target) throws IOException {
        Path parent = target.getParent();
        if (parent == null) {
            return List.of();
        }
        Deque<Path> missing = new ArrayDeque<>();
        for (Path p = parent; p != null && !Files.exists(p); p = p.getParent()) {
            missing.push(p);
        }
        List<Path> created = new ArrayList<>(missing);
        Files.createDirectories(parent);
        return created;
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            // Different file stores: plain move, which refuses to replace
            log.debug("Atomic move not supported for {} -> {}, falling back", source, target);
            Files.move(source, target);
        }
    }

    /**
     * Delete the given directories, deepest first, as long as they are empty.
     */
    private static void removeEmptyDirectories(List<Path> directories) {
        List<Path> deepestFirst = new ArrayList<>(directories);
        deepestFirst.sort(Comparator.comparingInt(Path::getNameCount).reversed());
        for (Path dir : deepestFirst) {
            try {
                Files.deleteIfExists(dir);
            } catch (DirectoryNotEmptyException e) {
                log.debug("Keeping non-empty directory {}", dir);
            } catch (IOException e) {
                log.warn("Could not remove directory {}: {}", dir, e.getMessage());
            }
        }
    }

    private static ExecutionResult skipped(String actionId, String message) {
        return ExecutionResult.builder()
            .actionId(actionId)
            .status(ExecutionStatus.SKIPPED)
            .message(message)
            .timestamp(Instant.now())
            .build();
    }

    private static ExecutionResult failed(String actionId, String error) {
        return ExecutionResult.builder()
            .actionId(actionId)
            .status(ExecutionStatus.FAILED)
            .error(error)
            .message("Failed")
            .timestamp(Instant.now())
            .build();
    }
}
