package com.dcruver.organizer.app;

import com.dcruver.organizer.config.OrganizerProperties;
import com.dcruver.organizer.domain.Manifest;
import com.dcruver.organizer.domain.ManifestBuilder;
import com.dcruver.organizer.domain.ManifestEntry;
import com.dcruver.organizer.domain.ManifestSummary;
import com.dcruver.organizer.domain.ScanOptions;
import com.dcruver.organizer.domain.planning.*;
import com.dcruver.organizer.io.ArtifactStore;
import com.dcruver.organizer.reporting.ExecutionLogWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Spring Shell commands for the organizer pipeline: scan, plan, execute, undo.
 * Every stage writes its artifact to the artifacts directory so a later
 * command (or a later session) can pick up from there.
 */
@ShellComponent
@Slf4j
@RequiredArgsConstructor
public class OrganizerShellCommands {

    private final ManifestBuilder manifestBuilder;
    private final PlanBuilder planBuilder;
    private final ActionExecutor actionExecutor;
    private final ArtifactStore artifactStore;
    private final ExecutionLogWriter executionLogWriter;
    private final OrganizerProperties properties;

    // Ids from this session, used when a command is given none
    private String lastManifestId;
    private String lastPlanId;

    @ShellMethod(key = "scan", value = "Scan a directory and write a classified manifest")
    public String scan(
        @ShellOption(help = "Directory to scan") String path,
        @ShellOption(value = "--use-ai", help = "Ask the configured classifier about documents",
            defaultValue = "false") boolean useAi,
        @ShellOption(value = "--include-hidden", defaultValue = "false") boolean includeHidden,
        @ShellOption(value = "--max-depth", defaultValue = ShellOption.NULL) Integer maxDepth,
        @ShellOption(value = "--detect-duplicates", help = "Flag files whose content repeats another file",
            defaultValue = "false") boolean detectDuplicates) {
        try {
            ScanOptions options = properties.toScanOptions(path)
                .withUseClassifier(useAi || properties.getAi().isEnabled())
                .withIncludeHidden(includeHidden || properties.getScan().isIncludeHidden())
                .withDetectDuplicates(detectDuplicates || properties.getScan().isDetectDuplicates());
            if (maxDepth != null) {
                options = options.withMaxDepth(maxDepth);
            }

            Manifest manifest = manifestBuilder.build(options);
            Path file = artifactStore.saveManifest(manifest);
            lastManifestId = manifest.getId();

            ManifestSummary s = manifest.getSummary();
            StringBuilder sb = new StringBuilder();
            sb.append("Scan completed.\n\n");
            sb.append(String.format("Manifest: %s%n", manifest.getId()));
            sb.append(String.format("Saved to: %s%n%n", file));
            sb.append(String.format("- Total items: %d%n", s.getTotalItems()));
            sb.append(String.format("- Project roots: %d%n", s.getProjectRoots()));
            sb.append(String.format("- Generated folders: %d%n", s.getGenerated()));
            sb.append(String.format("- Documents: %d%n", s.getDocuments()));
            sb.append(String.format("- Media: %d%n", s.getMedia()));
            sb.append(String.format("- Archives: %d%n", s.getArchives()));
            sb.append(String.format("- Code: %d%n", s.getCode()));
            sb.append(String.format("- Unknown: %d%n", s.getUnknown()));
            if (options.isDetectDuplicates()) {
                long duplicates = manifest.getEntries().stream().filter(ManifestEntry::isDuplicate).count();
                sb.append(String.format("- Duplicates: %d%n", duplicates));
            }
            sb.append(String.format("- Confidence: %d high, %d medium, %d low%n",
                s.getHighConfidence(), s.getMediumConfidence(), s.getLowConfidence()));
            sb.append("\nRun 'plan --destination <dir>' to propose moves.\n");
            return sb.toString();
        } catch (Exception e) {
            log.error("Scan failed", e);
            return "Scan failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "plan", value = "Build a move plan from a manifest")
    public String plan(
        @ShellOption(value = "--destination", help = "Root folder to organize into") String destination,
        @ShellOption(value = "--manifest", defaultValue = ShellOption.NULL,
            help = "Manifest id (defaults to the last scan)") String manifestId) {
        try {
            String id = manifestId != null ? manifestId : lastManifestId;
            if (id == null) {
                return "No manifest. Run 'scan' first or pass --manifest.";
            }

            Manifest manifest = artifactStore.loadManifest(id);
            PlanResult result = planBuilder.build(manifest, Path.of(destination), properties.toUserPreferences());
            Plan plan = result.plan();
            artifactStore.savePlan(plan);
            artifactStore.saveRollback(result.rollback());
            lastPlanId = plan.getId();

            StringBuilder sb = new StringBuilder();
            sb.append(String.format("Plan %s created from manifest %s%n%n", plan.getId(), id));
            appendPlanSummary(sb, plan);
            if (!plan.getSafetyCheck().isPassed()) {
                sb.append("\nSAFETY CHECK FAILED - this plan cannot be executed:\n");
                plan.getSafetyCheck().getErrors().forEach(err -> sb.append("  ").append(err).append('\n'));
            } else {
                sb.append("\nRun 'execute --dry-run' to preview, 'execute' to apply approved actions.\n");
            }
            return sb.toString();
        } catch (Exception e) {
            log.error("Plan failed", e);
            return "Plan failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "execute", value = "Execute approved (or selected) actions of a plan")
    public String execute(
        @ShellOption(value = "--plan", defaultValue = ShellOption.NULL, help = "Plan id") String planId,
        @ShellOption(value = "--dry-run", defaultValue = "false") boolean dryRun,
        @ShellOption(value = "--actions", defaultValue = ShellOption.NULL,
            help = "Comma separated action ids; default is every approved action") String actionIds) {
        try {
            String id = planId != null ? planId : lastPlanId;
            if (id == null) {
                return "No plan. Run 'plan' first or pass --plan.";
            }

            Plan plan = artifactStore.loadPlan(id);
            ExecuteOptions options = ExecuteOptions.builder()
                .dryRun(dryRun)
                .selectedActionIds(parseIds(actionIds))
                .build();

            ExecutionReport report = actionExecutor.execute(plan, options);
            if (!dryRun) {
                artifactStore.saveExecutionReport(report);
                artifactStore.recordExecutedMoves(report.getRollback());
            }
            Path logFile = executionLogWriter.write(artifactStore.getDirectory(), plan, report);

            ExecutionReport.ExecutionSummary s = report.getSummary();
            return String.format("%s plan %s: %d completed, %d failed, %d skipped%nLog: %s%n",
                dryRun ? "Dry run of" : "Executed", id, s.getCompleted(), s.getFailed(), s.getSkipped(), logFile);
        } catch (PlanRejectedException e) {
            log.warn("Plan rejected: {}", e.getMessage());
            return "Execute refused: " + e.getMessage();
        } catch (Exception e) {
            log.error("Execute failed", e);
            return "Execute failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "undo", value = "Undo an executed plan using its rollback")
    public String undo(
        @ShellOption(value = "--plan", defaultValue = ShellOption.NULL, help = "Plan id") String planId,
        @ShellOption(value = "--dry-run", defaultValue = "false") boolean dryRun) {
        try {
            String id = planId != null ? planId : lastPlanId;
            if (id == null) {
                return "No plan. Pass --plan.";
            }

            Optional<Rollback> executed = artifactStore.findExecutedRollback(id);
            if (executed.isEmpty() || executed.get().getEntries().isEmpty()) {
                return "Nothing to undo for plan " + id + ".";
            }

            ExecutionReport report = actionExecutor.undo(executed.get(), dryRun);
            if (!dryRun) {
                artifactStore.saveUndoReport(report);
                // Entries that could not be restored stay undoable
                artifactStore.saveExecutedRollback(report.getRollback());
            }

            ExecutionReport.ExecutionSummary s = report.getSummary();
            StringBuilder sb = new StringBuilder();
            sb.append(String.format("%s plan %s: %d restored, %d failed%n",
                dryRun ? "Undo dry run of" : "Undid", id, s.getCompleted(), s.getFailed()));
            report.getResults().stream()
                .filter(r -> r.getStatus() == ExecutionStatus.FAILED)
                .forEach(r -> sb.append("  ").append(r.getError()).append('\n'));
            return sb.toString();
        } catch (Exception e) {
            log.error("Undo failed", e);
            return "Undo failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "show", value = "Show the actions of a plan")
    public String show(
        @ShellOption(value = "--plan", defaultValue = ShellOption.NULL, help = "Plan id") String planId,
        @ShellOption(value = "--limit", defaultValue = "50") int limit) {
        try {
            String id = planId != null ? planId : lastPlanId;
            if (id == null) {
                return "No plan. Pass --plan.";
            }

            Plan plan = artifactStore.loadPlan(id);
            StringBuilder sb = new StringBuilder();
            sb.append(String.format("Plan %s (destination %s)%n%n", plan.getId(), plan.getDestRoot()));
            appendPlanSummary(sb, plan);
            sb.append('\n');

            plan.getActions().stream().limit(limit).forEach(a -> sb.append(String.format(
                "%s %-11s %.2f %s -> %s%n      %s%n",
                a.isApproved() ? "[x]" : "[ ]",
                a.getActionType(),
                a.getConfidence(),
                a.getFromRelative(),
                a.isSkip() ? "(stays)" : a.getToRelative(),
                a.getReason())));
            if (plan.getActions().size() > limit) {
                sb.append(String.format("... %d more%n", plan.getActions().size() - limit));
            }
            return sb.toString();
        } catch (Exception e) {
            log.error("Show failed", e);
            return "Show failed: " + e.getMessage();
        }
    }

    private static void appendPlanSummary(StringBuilder sb, Plan plan) {
        PlanSummary s = plan.getSummary();
        SafetyCheck safety = plan.getSafetyCheck();
        sb.append(String.format("- Actions: %d (%d moves, %d renames, %d skips)%n",
            s.getTotalActions(), s.getMoves(), s.getRenames(), s.getSkips()));
        sb.append(String.format("- Approved: %d%n", plan.getActions().stream().filter(PlanAction::isApproved).count()));
        sb.append(String.format("- Confidence: %d high, %d medium, %d low%n",
            s.getHighConfidence(), s.getMediumConfidence(), s.getLowConfidence()));
        sb.append(String.format("- Collisions resolved: %d%n", safety.getChecks().getCollisionsResolved()));
        sb.append(String.format("- Low confidence warnings: %d%n", safety.getChecks().getLowConfidenceActions()));
        if (!s.getCategoryCounts().isEmpty()) {
            sb.append("- Categories: ").append(s.getCategoryCounts().entrySet().stream()
                .map(e -> e.getKey() + " " + e.getValue())
                .collect(Collectors.joining(", "))).append('\n');
        }
    }

    private static Set<String> parseIds(String ids) {
        if (ids == null || ids.isBlank()) {
            return null;
        }
        return Arrays.stream(ids.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .collect(Collectors.toSet());
    }
}
