package com.dcruver.organizer.domain.planning;

import com.dcruver.organizer.domain.*;
import com.dcruver.organizer.io.FileNames;
import com.dcruver.organizer.io.FilenameMetadataParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Instant;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a manifest into a reviewable {@link Plan} plus the rollback that would
 * undo it. Nothing here touches the filesystem except the collision probe.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PlanBuilder {

    static final String INBOX_FOLDER = "Inbox";
    static final double LOW_CONFIDENCE_WARNING = 0.5;

    private static final Pattern RESERVED_CHARS = Pattern.compile("[\\\\/:*?\"<>|\\p{Cntrl}]");
    private static final Pattern WORD_START = Pattern.compile("\\b(\\w)");
    private static final Pattern CAMEL_BREAK = Pattern.compile("[\\s_-]+(.)");

    private final CollisionResolver collisionResolver;

    public PlanResult build(Manifest manifest, Path destRoot, UserPreferences preferences) {
        Path root = destRoot.toAbsolutePath().normalize();
        String planId = UUID.randomUUID().toString();
        Instant createdAt = Instant.now();
        log.info("Building plan {} for manifest {} into {}", planId, manifest.getId(), root);

        List<Path> projectRoots = projectRoots(manifest);

        List<PlanAction> actions = new ArrayList<>();
        List<String> violations = new ArrayList<>();
        for (ManifestEntry entry : manifest.getEntries()) {
            actions.add(createAction(entry, root, preferences, projectRoots, violations));
        }

        actions = collisionResolver.resolve(actions, root);

        SafetyCheck safetyCheck = safetyCheck(actions, violations);
        if (!safetyCheck.isPassed()) {
            log.error("Plan {} failed its safety check: {}", planId, safetyCheck.getErrors());
        }

        Plan plan = Plan.builder()
            .id(planId)
            .manifestId(manifest.getId())
            .createdAt(createdAt)
            .destRoot(root.toString())
            .actions(List.copyOf(actions))
            .safetyCheck(safetyCheck)
            .summary(PlanSummary.of(actions))
            .userPreferences(preferences)
            .build();

        PlanSummary summary = plan.getSummary();
        log.info("Plan {} ready: {} actions ({} moves, {} renames, {} skips; confidence high={} medium={} low={})",
            planId, summary.getTotalActions(), summary.getMoves(), summary.getRenames(), summary.getSkips(),
            summary.getHighConfidence(), summary.getMediumConfidence(), summary.getLowConfidence());

        return new PlanResult(plan, rollbackFor(plan));
    }

    private PlanAction createAction(ManifestEntry entry, Path destRoot, UserPreferences preferences,
                                    List<Path> projectRoots, List<String> violations) {
        if (entry.isInsideProjectRoot()) {
            return skip(entry, "Inside project root: " + entry.getParentProjectRoot(), false);
        }
        if (entry.isKeep()) {
            return skip(entry, keepReason(entry), false);
        }

        Path from = Path.of(entry.getPath());
        Path to = destRoot.resolve(destinationFor(entry, preferences)).normalize();

        Optional<String> violation = checkProjectBoundaries(from, to, projectRoots);
        if (violation.isPresent()) {
            String reason = "Safety violation: " + violation.get();
            log.warn("{} ({})", reason, entry.getRelativePath());
            violations.add(reason);
            return skip(entry, reason, true);
        }

        ActionType type = ActionType.between(from, to);
        if (type == ActionType.SKIP) {
            return skip(entry, "Already in place", false).withConfidence(entry.getConfidence());
        }

        double confidence = entry.getConfidence();
        return PlanAction.builder()
            .id(UUID.randomUUID().toString())
            .from(from.toString())
            .fromRelative(entry.getRelativePath())
            .to(to.toString())
            .toRelative(relative(destRoot, to))
            .actionType(type)
            .reason(reasonFor(entry))
            .confidence(confidence)
            .category(entry.getSuggestedCategory())
            .tags(entry.getSuggestedTags() != null ? entry.getSuggestedTags() : List.of())
            .approved(confidence >= preferences.getConfidenceThresholds().autoApprove())
            .build();
    }

    /**
     * Destination relative to the destination root.
     */
    String destinationFor(ManifestEntry entry, UserPreferences preferences) {
        String name = entry.getName();
        String extension = entry.getExtension() != null ? entry.getExtension() : FileNames.extension(name);
        String base = name.substring(0, name.length() - extension.length());

        if (entry.getConfidence() < preferences.getConfidenceThresholds().requireReview()) {
            return INBOX_FOLDER + "/" + name;
        }

        DocumentMetadata metadata = entry.getDocumentMetadata();
        if (entry.getKind() == ItemKind.DOCUMENT && metadata != null && metadata.isUsable()) {
            String category = folderFor(entry.getSuggestedCategory(), FileCategory.defaultFolder(ItemKind.DOCUMENT),
                preferences);
            StringBuilder path = new StringBuilder(category).append('/');
            if (metadata.hasSubject() && !metadata.getSubject().trim().equalsIgnoreCase(category)) {
                path.append(sanitizeFolderName(metadata.getSubject(), category)).append('/');
            }
            String title = metadata.hasTitle() ? FilenameMetadataParser.cleanTitle(metadata.getTitle()) : "";
            if (title.isEmpty()) {
                title = base;
            }
            return path.append(applyNaming(title, preferences.getNaming())).append(extension).toString();
        }

        String fallbackFolder = switch (entry.getKind()) {
            case MEDIA, ARCHIVE, CODE -> FileCategory.defaultFolder(entry.getKind());
            default -> "Other";
        };
        String folder = folderFor(entry.getSuggestedCategory(), fallbackFolder, preferences);
        return folder + "/" + applyNaming(base, preferences.getNaming()) + extension;
    }

    /**
     * Applies case style and special-character stripping to a base name.
     * Falls back to the input when nothing would be left.
     */
    static String applyNaming(String base, UserPreferences.NamingPreference naming) {
        if (naming == null) {
            return base;
        }
        String result = base;
        if (naming.removeSpecialChars()) {
            result = result.replaceAll("[^\\w\\s-]", "");
        }
        switch (naming.style() != null ? naming.style() : UserPreferences.NamingStyle.ORIGINAL) {
            case LOWERCASE -> result = result.toLowerCase(Locale.ROOT);
            case TITLECASE -> result = replaceGroups(WORD_START, result);
            case CAMELCASE -> result = replaceGroups(CAMEL_BREAK, result.trim());
            default -> {
            }
        }
        result = result.trim();
        return result.isEmpty() ? base : result;
    }

    private static String replaceGroups(Pattern pattern, String input) {
        Matcher m = pattern.matcher(input);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            m.appendReplacement(sb, Matcher.quoteReplacement(m.group(1).toUpperCase(Locale.ROOT)));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    private static String folderFor(String category, String fallback, UserPreferences preferences) {
        String name = category != null && !category.isBlank() ? category.trim() : fallback;
        Map<String, String> overrides = preferences.getDefaultFolders();
        if (overrides != null && overrides.containsKey(name)) {
            name = overrides.get(name);
        }
        return sanitizeFolderName(name, fallback);
    }

    static String sanitizeFolderName(String name, String fallback) {
        String cleaned = RESERVED_CHARS.matcher(name == null ? "" : name).replaceAll(" ")
            .replaceAll("\\s+", " ")
            .trim()
            .replaceAll("^\\.+|\\.+$", "")
            .trim();
        return cleaned.isEmpty() ? fallback : cleaned;
    }

    /**
     * Moving out of a project (unless the source is the root itself) and moving
     * into one are both refused.
     */
    /**
     * Every root found by the scan, including roots under ignored paths that
     * have no entry of their own.
     */
    static List<Path> projectRoots(Manifest manifest) {
        Set<Path> roots = new LinkedHashSet<>();
        if (manifest.getProjectRootPaths() != null) {
            manifest.getProjectRootPaths().forEach(p -> roots.add(Path.of(p)));
        }
        manifest.getEntries().stream()
            .filter(e -> e.getKind() == ItemKind.PROJECT_ROOT)
            .forEach(e -> roots.add(Path.of(e.getPath())));
        return List.copyOf(roots);
    }

    static Optional<String> checkProjectBoundaries(Path from, Path to, List<Path> projectRoots) {
        for (Path root : projectRoots) {
            if (from.startsWith(root) && !from.equals(root)) {
                return Optional.of("source is inside project root " + root);
            }
            if (to.startsWith(root)) {
                return Optional.of("destination is inside project root " + root);
            }
        }
        return Optional.empty();
    }

    private static PlanAction skip(ManifestEntry entry, String reason, boolean violation) {
        return PlanAction.builder()
            .id(UUID.randomUUID().toString())
            .from(entry.getPath())
            .fromRelative(entry.getRelativePath())
            .to(entry.getPath())
            .toRelative(entry.getRelativePath())
            .actionType(ActionType.SKIP)
            .reason(reason)
            .confidence(1.0)
            .category(entry.getSuggestedCategory())
            .tags(entry.getSuggestedTags() != null ? entry.getSuggestedTags() : List.of())
            .projectRoot(entry.getKind() == ItemKind.PROJECT_ROOT ? entry.getPath() : entry.getParentProjectRoot())
            .movesInsideProjectRoot(violation)
            .approved(false)
            .build();
    }

    private static String keepReason(ManifestEntry entry) {
        return switch (entry.getKind()) {
            case PROJECT_ROOT -> "Project root kept as a unit"
                + (entry.getProjectRoot() != null && entry.getProjectRoot().getProjectType() != null
                ? " (" + entry.getProjectRoot().getProjectType().name().toLowerCase(Locale.ROOT) + ")" : "");
            case GENERATED -> "Generated folder kept in place";
            default -> "Recommended to keep in place";
        };
    }

    private static String reasonFor(ManifestEntry entry) {
        List<String> parts = new ArrayList<>();
        if (entry.isDuplicate()) {
            parts.add("Duplicate file detected");
        }
        if (entry.getSuggestedCategory() != null) {
            parts.add("Category: " + entry.getSuggestedCategory());
        }
        DocumentMetadata metadata = entry.getDocumentMetadata();
        if (metadata != null && metadata.hasTitle()) {
            parts.add("Title: " + metadata.getTitle());
        }
        if (metadata != null && metadata.hasSubject()) {
            parts.add("Subject: " + metadata.getSubject());
        }
        if (entry.getSignals() != null && !entry.getSignals().isEmpty()) {
            parts.add(entry.getSignals().get(0));
        }
        return String.join(" | ", parts);
    }

    private static SafetyCheck safetyCheck(List<PlanAction> actions, List<String> violations) {
        List<String> warnings = new ArrayList<>();
        List<String> collisionDestinations = new ArrayList<>();
        int lowConfidence = 0;
        int skipped = 0;

        for (PlanAction action : actions) {
            if (action.isSkip()) {
                skipped++;
            } else if (action.getConfidence() < LOW_CONFIDENCE_WARNING) {
                lowConfidence++;
                warnings.add(String.format("Low confidence (%.2f) for %s", action.getConfidence(),
                    action.getFromRelative()));
            }
            if (action.isHasCollision()) {
                collisionDestinations.add(action.getTo());
            }
        }

        return SafetyCheck.builder()
            .passed(violations.isEmpty())
            .errors(List.copyOf(violations))
            .warnings(List.copyOf(warnings))
            .checks(SafetyCheck.SafetyCounters.builder()
                .collisionsResolved(collisionDestinations.size())
                .collisionDestinations(List.copyOf(collisionDestinations))
                .lowConfidenceActions(lowConfidence)
                .skippedItems(skipped)
                .projectRootViolations(violations.size())
                .build())
            .build();
    }

    private static Rollback rollbackFor(Plan plan) {
        List<RollbackEntry> entries = plan.getActions().stream()
            .filter(a -> !a.isSkip())
            .map(a -> RollbackEntry.builder()
                .from(a.getTo())
                .to(a.getFrom())
                .actionId(a.getId())
                .timestamp(plan.getCreatedAt())
                .build())
            .toList();
        return Rollback.builder()
            .planId(plan.getId())
            .createdAt(plan.getCreatedAt())
            .entries(entries)
            .build();
    }

    private static String relative(Path root, Path path) {
        return root.relativize(path).toString().replace('\\', '/');
    }
}
