package com.dcruver.organizer.domain;

import com.dcruver.organizer.config.OrganizerProperties;
import com.dcruver.organizer.domain.DocumentMetadata.ExtractionMethod;
import com.dcruver.organizer.io.DocumentMetadataExtractor;
import com.dcruver.organizer.io.FileDigests;
import com.dcruver.organizer.io.FileNames;
import com.dcruver.organizer.io.FilenameMetadataParser;
import com.dcruver.organizer.nlp.ClassificationException;
import com.dcruver.organizer.nlp.ClassificationRequest;
import com.dcruver.organizer.nlp.ClassificationResponse;
import com.dcruver.organizer.nlp.Classifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.*;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Walks a directory tree and builds a classified {@link Manifest}.
 *
 * Pass one finds project roots. Pass two walks the tree again and emits one
 * entry per project root, generated folder and loose file. Documents may be
 * escalated to the {@link Classifier}; a failing classifier never aborts the
 * scan.
 */
@Component
@Slf4j
public class ManifestBuilder {

    static final double GROUP_THRESHOLD = 0.7;
    static final double TAXONOMY_OVERRIDE_THRESHOLD = 0.7;
    static final double UNKNOWN_CONFIDENCE = 0.3;
    static final double DOCUMENT_WITH_TITLE_CONFIDENCE = 0.6;
    static final double DOCUMENT_WITHOUT_TITLE_CONFIDENCE = 0.4;
    static final double GENERIC_NAME_PENALTY = 0.1;
    static final double DUPLICATE_CONFIDENCE = 0.6;

    static final String DUPLICATES_CATEGORY = "Duplicates";

    static final String CLASSIFIER_FALLBACK_SIGNAL = "AI classification failed, using fallback";

    private final ProjectRootDetector detector;
    private final FilenameMetadataParser filenameParser;
    private final List<DocumentMetadataExtractor> extractors;
    private final OrganizerProperties.Ai aiSettings;

    private Classifier classifier;

    public ManifestBuilder(ProjectRootDetector detector,
                           FilenameMetadataParser filenameParser,
                           List<DocumentMetadataExtractor> extractors,
                           OrganizerProperties properties) {
        this.detector = detector;
        this.filenameParser = filenameParser;
        this.extractors = List.copyOf(extractors);
        this.aiSettings = properties.getAi();
    }

    @Autowired(required = false)
    public void setClassifier(Classifier classifier) {
        this.classifier = classifier;
    }

    public Manifest build(ScanOptions options) {
        Path scanRoot = Path.of(options.getRootPath()).toAbsolutePath().normalize();
        if (!Files.isDirectory(scanRoot)) {
            throw new IllegalArgumentException("Scan root is not a directory: " + scanRoot);
        }

        log.info("Scanning {} (maxDepth={}, classifier={})", scanRoot, options.getMaxDepth(),
            options.isUseClassifier() && classifier != null);

        Map<Path, ProjectRootDetection> projectRoots = detector.findProjectRoots(scanRoot, options.getMaxDepth());
        Map<Path, Path> projectRootsByRealPath = realPaths(projectRoots.keySet());
        List<Pattern> ignorePatterns = compileIgnorePatterns(options.getIgnorePaths());

        List<ManifestEntry> entries = new ArrayList<>();

        ProjectRootDetection rootDetection = projectRoots.get(scanRoot);
        if (rootDetection != null) {
            log.info("Scan root is itself a project root, emitting a single entry");
            entries.add(projectRootEntry(scanRoot, scanRoot, rootDetection));
        } else {
            walk(scanRoot, options, projectRoots, projectRootsByRealPath, ignorePatterns, entries);
        }

        if (options.isDetectDuplicates()) {
            entries = markDuplicates(entries, options.getReviewThreshold());
        }
        if (options.isUseClassifier() && classifier != null) {
            entries = escalateToClassifier(entries, options.getReviewThreshold());
        }

        Manifest manifest = Manifest.builder()
            .id(UUID.randomUUID().toString())
            .scanRoot(scanRoot.toString())
            .createdAt(Instant.now())
            .scanOptions(options)
            .projectRootPaths(projectRoots.keySet().stream().map(Path::toString).sorted().toList())
            .entries(List.copyOf(entries))
            .summary(ManifestSummary.of(entries))
            .build();

        log.info("Manifest {} built with {} entries ({} project roots, {} documents)",
            manifest.getId(), entries.size(), manifest.getSummary().getProjectRoots(),
            manifest.getSummary().getDocuments());
        return manifest;
    }

    private void walk(Path scanRoot, ScanOptions options,
                      Map<Path, ProjectRootDetection> projectRoots,
                      Map<Path, Path> projectRootsByRealPath,
                      List<Pattern> ignorePatterns,
                      List<ManifestEntry> entries) {
        Set<Path> visited = new HashSet<>();
        Deque<PathAtDepth> stack = new ArrayDeque<>();
        visited.add(realPathOrSelf(scanRoot));
        pushChildren(scanRoot, 1, stack);

        while (!stack.isEmpty()) {
            PathAtDepth current = stack.pop();
            Path path = current.path();
            String name = path.getFileName().toString();
            String relative = relativize(scanRoot, path);

            if (!options.isIncludeHidden() && name.startsWith(".")) {
                continue;
            }
            if (isIgnored(relative, name, ignorePatterns)) {
                log.debug("Ignoring {}", relative);
                continue;
            }

            if (Files.isDirectory(path)) {
                ProjectRootDetection detection = projectRoots.get(path);
                if (detection == null && !detector.isGeneratedFolder(name)) {
                    // Pass one may have stopped short of this directory (depth, hidden parent)
                    ProjectRootDetection live = detector.detect(path);
                    detection = live.isProjectRoot() ? live : null;
                }

                if (detection != null) {
                    entries.add(projectRootEntry(scanRoot, path, detection));
                } else if (detector.isGeneratedFolder(name)) {
                    entries.add(generatedEntry(scanRoot, path));
                } else if (current.depth() < options.getMaxDepth() && visited.add(realPathOrSelf(path))) {
                    pushChildren(path, current.depth() + 1, stack);
                } else {
                    log.debug("Not descending into {}", relative);
                }
            } else if (Files.isRegularFile(path)) {
                Optional<Path> owningRoot = owningProjectRoot(path, projectRootsByRealPath);
                if (owningRoot.isPresent()) {
                    entries.add(insideProjectEntry(scanRoot, path, owningRoot.get()));
                } else {
                    entries.add(classifyFile(scanRoot, path, options));
                }
            }
        }
    }

    private static void pushChildren(Path dir, int depth, Deque<PathAtDepth> stack) {
        List<Path> children = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            for (Path child : stream) {
                children.add(child);
            }
        } catch (IOException | SecurityException e) {
            log.warn("Skipping unreadable directory {}: {}", dir, e.getMessage());
            return;
        }

        children.sort(Comparator.comparing((Path p) -> p.getFileName().toString()).reversed());
        for (Path child : children) {
            stack.push(new PathAtDepth(child, depth));
        }
    }

    ManifestEntry classifyFile(Path scanRoot, Path file, ScanOptions options) {
        String name = file.getFileName().toString();
        ManifestEntry.ManifestEntryBuilder builder = baseEntry(scanRoot, file);
        List<String> signals = new ArrayList<>();

        Optional<FileCategory> category = FileCategory.forExtension(FileNames.simpleExtension(name));
        if (category.isEmpty()) {
            signals.add("Unknown file type");
            return builder
                .kind(ItemKind.UNKNOWN)
                .confidence(UNKNOWN_CONFIDENCE)
                .signals(List.copyOf(signals))
                .recommendedHandling(RecommendedHandling.REVIEW)
                .suggestedTags(List.of())
                .build();
        }

        FileCategory fileCategory = category.get();
        signals.add("Extension match: " + fileCategory.getFolderName());

        if (fileCategory.getKind() != ItemKind.DOCUMENT) {
            double confidence = fileCategory.getBaseConfidence();
            return builder
                .kind(fileCategory.getKind())
                .confidence(confidence)
                .signals(List.copyOf(signals))
                .suggestedCategory(fileCategory.getFolderName())
                .suggestedTags(List.of(fileCategory.getFolderName().toLowerCase(Locale.ROOT)))
                .recommendedHandling(handlingFor(fileCategory.getKind(), confidence, options.getReviewThreshold()))
                .build();
        }

        return classifyDocument(builder, file, fileCategory, signals, options);
    }

    private ManifestEntry classifyDocument(ManifestEntry.ManifestEntryBuilder builder, Path file,
                                           FileCategory fileCategory, List<String> signals,
                                           ScanOptions options) {
        String name = file.getFileName().toString();

        DocumentMetadata metadata = DocumentMetadata.empty();
        if (options.isExtractDocumentMetadata()) {
            for (DocumentMetadataExtractor extractor : extractors) {
                if (extractor.supports(file)) {
                    metadata = extractor.extract(file);
                    if (metadata.hasTitle()) {
                        signals.add("Metadata title: " + metadata.getTitle());
                    }
                    break;
                }
            }
        }
        if (!metadata.hasTitle()) {
            metadata = metadata.mergeMissing(filenameParser.parse(name));
        }

        String category = fileCategory.getFolderName();
        double confidence = metadata.hasTitle() ? DOCUMENT_WITH_TITLE_CONFIDENCE : DOCUMENT_WITHOUT_TITLE_CONFIDENCE;

        Optional<TaxonomyRule> rule = matchTaxonomy(options.getTaxonomy(), name, metadata);
        if (rule.isPresent()) {
            category = rule.get().getCategory();
            confidence = rule.get().getConfidence();
            signals.add("Taxonomy rule: " + rule.get().getPattern());
        } else if (FilenameMetadataParser.isGenericName(name)) {
            confidence = Math.max(0.0, confidence - GENERIC_NAME_PENALTY);
            signals.add("Generic filename");
        }

        confidence = round(confidence);
        List<String> tags = new ArrayList<>();
        tags.add(fileCategory.getFolderName().toLowerCase(Locale.ROOT));
        if (metadata.getKeywords() != null) {
            tags.addAll(metadata.getKeywords());
        }

        return builder
            .kind(ItemKind.DOCUMENT)
            .confidence(confidence)
            .signals(List.copyOf(signals))
            .documentMetadata(metadata)
            .suggestedCategory(category)
            .suggestedTags(List.copyOf(tags))
            .recommendedHandling(handlingFor(ItemKind.DOCUMENT, confidence, options.getReviewThreshold()))
            .build();
    }

    /**
     * Run the classifier for every document not settled by a strong taxonomy
     * rule. Calls run on a bounded pool; results are applied in manifest order.
     */
    private List<ManifestEntry> escalateToClassifier(List<ManifestEntry> entries, double reviewThreshold) {
        List<Integer> candidates = new ArrayList<>();
        for (int i = 0; i < entries.size(); i++) {
            if (needsClassifier(entries.get(i))) {
                candidates.add(i);
            }
        }
        if (candidates.isEmpty()) {
            return entries;
        }

        int poolSize = Math.max(1, aiSettings.getConcurrency());
        log.info("Classifying {} documents with {} workers", candidates.size(), poolSize);

        List<ManifestEntry> result = new ArrayList<>(entries);
        ExecutorService pool = Executors.newFixedThreadPool(poolSize);
        try {
            Map<Integer, Future<ClassificationResponse>> futures = new LinkedHashMap<>();
            for (int index : candidates) {
                ClassificationRequest request = toRequest(entries.get(index));
                futures.put(index, pool.submit(() -> classifier.classify(request)));
            }

            Duration deadline = perEntryDeadline();
            for (Map.Entry<Integer, Future<ClassificationResponse>> f : futures.entrySet()) {
                ManifestEntry entry = entries.get(f.getKey());
                result.set(f.getKey(), awaitClassification(entry, f.getValue(), deadline, reviewThreshold));
            }
        } finally {
            pool.shutdownNow();
        }
        return result;
    }

    private ManifestEntry awaitClassification(ManifestEntry entry, Future<ClassificationResponse> future,
                                              Duration deadline, double reviewThreshold) {
        try {
            ClassificationResponse response = future.get(deadline.toMillis(), TimeUnit.MILLISECONDS);
            return applyClassification(entry, response.sanitize(), reviewThreshold);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof ClassificationException) {
                log.warn("Classification failed for {}: {}", entry.getRelativePath(), cause.getMessage());
            } else {
                log.error("Classifier error for {}", entry.getRelativePath(), cause);
            }
            return withFallbackSignal(entry);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Classification timed out for {}", entry.getRelativePath());
            return withFallbackSignal(entry);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return withFallbackSignal(entry);
        }
    }

    ManifestEntry applyClassification(ManifestEntry entry, ClassificationResponse response, double reviewThreshold) {
        List<String> signals = new ArrayList<>(entry.getSignals());
        signals.add("AI classification: " + response.getReasoning());

        DocumentMetadata metadata = entry.getDocumentMetadata() != null
            ? entry.getDocumentMetadata() : DocumentMetadata.empty();
        if (response.getSubject() != null) {
            metadata = metadata.withSubject(response.getSubject());
        }
        if (response.getTitle() != null && !metadata.hasTitle()) {
            metadata = metadata.withTitle(response.getTitle()).withExtractionMethod(ExtractionMethod.CLASSIFIER);
        }

        double confidence = response.getConfidence();
        return entry.toBuilder()
            .suggestedCategory(response.getCategory())
            .confidence(confidence)
            .signals(List.copyOf(signals))
            .documentMetadata(metadata)
            .recommendedHandling(handlingFor(entry.getKind(), confidence, reviewThreshold))
            .build();
    }

    private static ManifestEntry withFallbackSignal(ManifestEntry entry) {
        List<String> signals = new ArrayList<>(entry.getSignals());
        signals.add(CLASSIFIER_FALLBACK_SIGNAL);
        return entry.withSignals(List.copyOf(signals));
    }

    private static boolean needsClassifier(ManifestEntry entry) {
        if (entry.getKind() != ItemKind.DOCUMENT || entry.isInsideProjectRoot() || entry.isDuplicate()) {
            return false;
        }
        boolean strongTaxonomyMatch = entry.getSignals().stream().anyMatch(s -> s.startsWith("Taxonomy rule: "))
            && entry.getConfidence() >= TAXONOMY_OVERRIDE_THRESHOLD;
        return !strongTaxonomyMatch;
    }

    private static ClassificationRequest toRequest(ManifestEntry entry) {
        return ClassificationRequest.builder()
            .filename(entry.getName())
            .extension(entry.getExtension())
            .size(entry.getSize())
            .metadata(entry.getDocumentMetadata())
            .folderContext(FilenameMetadataParser.folderContext(entry.getRelativePath()))
            .build();
    }

    private Duration perEntryDeadline() {
        // Each attempt is bounded by the classifier timeout; allow every retry plus backoff
        Duration perAttempt = aiSettings.getTimeout().plus(aiSettings.getInitialBackoff().multipliedBy(4));
        return perAttempt.multipliedBy(aiSettings.getMaxRetries() + 2L);
    }

    private static Optional<TaxonomyRule> matchTaxonomy(List<TaxonomyRule> rules, String name,
                                                        DocumentMetadata metadata) {
        if (rules == null) {
            return Optional.empty();
        }
        for (TaxonomyRule rule : rules) {
            if (rule.matches(name) || rule.matches(metadata.getTitle()) || rule.matches(metadata.getSubject())) {
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }

    /**
     * Code always goes to review. Anything else is grouped only when its
     * confidence reaches both the grouping cutoff and the configured review
     * threshold.
     */
    static RecommendedHandling handlingFor(ItemKind kind, double confidence, double reviewThreshold) {
        if (kind == ItemKind.CODE || confidence < Math.max(GROUP_THRESHOLD, reviewThreshold)) {
            return RecommendedHandling.REVIEW;
        }
        return RecommendedHandling.GROUP;
    }

    /**
     * Flag loose files whose content repeats an earlier file of the manifest.
     * Only files sharing a size are hashed. The first file in manifest order
     * stays the original; later copies go to review under {@code Duplicates}.
     */
    List<ManifestEntry> markDuplicates(List<ManifestEntry> entries, double reviewThreshold) {
        Map<Long, List<Integer>> bySize = new LinkedHashMap<>();
        for (int i = 0; i < entries.size(); i++) {
            ManifestEntry entry = entries.get(i);
            if (isLooseFile(entry) && entry.getSize() > 0) {
                bySize.computeIfAbsent(entry.getSize(), size -> new ArrayList<>()).add(i);
            }
        }

        List<ManifestEntry> result = new ArrayList<>(entries);
        int duplicates = 0;
        for (List<Integer> sameSize : bySize.values()) {
            if (sameSize.size() < 2) {
                continue;
            }
            Map<String, ManifestEntry> firstByDigest = new HashMap<>();
            for (int index : sameSize) {
                ManifestEntry entry = entries.get(index);
                String digest;
                try {
                    digest = FileDigests.sha256(Path.of(entry.getPath()));
                } catch (IOException e) {
                    log.warn("Cannot hash {}, skipping duplicate check: {}", entry.getRelativePath(), e.getMessage());
                    continue;
                }
                ManifestEntry original = firstByDigest.putIfAbsent(digest, entry);
                if (original != null) {
                    result.set(index, asDuplicate(entry, original, reviewThreshold));
                    duplicates++;
                }
            }
        }
        if (duplicates > 0) {
            log.info("Found {} duplicate files", duplicates);
        }
        return result;
    }

    private static ManifestEntry asDuplicate(ManifestEntry entry, ManifestEntry original, double reviewThreshold) {
        List<String> signals = new ArrayList<>(entry.getSignals());
        signals.add(ManifestEntry.DUPLICATE_SIGNAL_PREFIX + original.getRelativePath());
        List<String> tags = new ArrayList<>(entry.getSuggestedTags() != null ? entry.getSuggestedTags() : List.of());
        tags.add("duplicate");
        return entry.toBuilder()
            .confidence(DUPLICATE_CONFIDENCE)
            .signals(List.copyOf(signals))
            .suggestedCategory(DUPLICATES_CATEGORY)
            .suggestedTags(List.copyOf(tags))
            .recommendedHandling(handlingFor(entry.getKind(), DUPLICATE_CONFIDENCE, reviewThreshold))
            .build();
    }

    private static boolean isLooseFile(ManifestEntry entry) {
        return !entry.isInsideProjectRoot()
            && entry.getKind() != ItemKind.PROJECT_ROOT
            && entry.getKind() != ItemKind.GENERATED;
    }

    private ManifestEntry projectRootEntry(Path scanRoot, Path dir, ProjectRootDetection detection) {
        List<String> signals = detection.getSignals().stream().map(s -> "Project signal: " + s).toList();
        List<String> tags = detection.getProjectType() != null
            ? List.of(detection.getProjectType().name().toLowerCase(Locale.ROOT))
            : List.of();
        return baseEntry(scanRoot, dir)
            .kind(ItemKind.PROJECT_ROOT)
            .confidence(detection.getConfidence())
            .signals(signals)
            .projectRoot(detection)
            .recommendedHandling(RecommendedHandling.KEEP)
            .suggestedCategory("Projects")
            .suggestedTags(tags)
            .build();
    }

    private ManifestEntry generatedEntry(Path scanRoot, Path dir) {
        return baseEntry(scanRoot, dir)
            .kind(ItemKind.GENERATED)
            .confidence(1.0)
            .signals(List.of("Generated folder: " + dir.getFileName()))
            .recommendedHandling(RecommendedHandling.KEEP)
            .suggestedTags(List.of())
            .build();
    }

    private ManifestEntry insideProjectEntry(Path scanRoot, Path file, Path projectRoot) {
        return baseEntry(scanRoot, file)
            .kind(FileCategory.forExtension(FileNames.simpleExtension(file.getFileName().toString()))
                .map(FileCategory::getKind).orElse(ItemKind.UNKNOWN))
            .confidence(1.0)
            .signals(List.of("Inside project root: " + projectRoot))
            .insideProjectRoot(true)
            .parentProjectRoot(projectRoot.toString())
            .recommendedHandling(RecommendedHandling.KEEP)
            .suggestedTags(List.of())
            .build();
    }

    private static ManifestEntry.ManifestEntryBuilder baseEntry(Path scanRoot, Path path) {
        String name = path.getFileName() != null ? path.getFileName().toString() : path.toString();
        long size = 0;
        Instant modified = null;
        try {
            BasicFileAttributes attrs = Files.readAttributes(path, BasicFileAttributes.class);
            size = attrs.isRegularFile() ? attrs.size() : 0;
            modified = attrs.lastModifiedTime().toInstant();
        } catch (IOException e) {
            log.debug("Cannot read attributes of {}: {}", path, e.getMessage());
        }
        return ManifestEntry.builder()
            .path(path.toString())
            .relativePath(relativize(scanRoot, path))
            .name(name)
            .extension(Files.isDirectory(path) ? "" : FileNames.extension(name))
            .size(size)
            .modifiedAt(modified);
    }

    /**
     * A file reached through a symlink may really live inside a project root.
     */
    private static Optional<Path> owningProjectRoot(Path file, Map<Path, Path> projectRootsByRealPath) {
        if (projectRootsByRealPath.isEmpty()) {
            return Optional.empty();
        }
        Path real;
        try {
            real = file.toRealPath();
        } catch (IOException e) {
            return Optional.empty();
        }
        for (Map.Entry<Path, Path> root : projectRootsByRealPath.entrySet()) {
            if (real.startsWith(root.getKey())) {
                return Optional.of(root.getValue());
            }
        }
        return Optional.empty();
    }

    private static Map<Path, Path> realPaths(Collection<Path> roots) {
        Map<Path, Path> byRealPath = new LinkedHashMap<>();
        for (Path root : roots) {
            byRealPath.put(realPathOrSelf(root), root);
        }
        return byRealPath;
    }

    private static Path realPathOrSelf(Path path) {
        try {
            return path.toRealPath();
        } catch (IOException e) {
            return path;
        }
    }

    static List<Pattern> compileIgnorePatterns(List<String> globs) {
        if (globs == null) {
            return List.of();
        }
        List<Pattern> patterns = new ArrayList<>();
        for (String glob : globs) {
            String regex = Arrays.stream(glob.split("\\*", -1))
                .map(Pattern::quote)
                .collect(Collectors.joining(".*"));
            patterns.add(Pattern.compile(regex));
        }
        return patterns;
    }

    /**
     * Patterns match the whole {@code /}-separated relative path. A pattern
     * without a slash also matches the bare name at any depth.
     */
    static boolean isIgnored(String relativePath, String name, List<Pattern> patterns) {
        for (Pattern pattern : patterns) {
            if (pattern.matcher(relativePath).matches()) {
                return true;
            }
            if (!pattern.pattern().contains("/") && pattern.matcher(name).matches()) {
                return true;
            }
        }
        return false;
    }

    private static String relativize(Path root, Path path) {
        String relative = root.relativize(path).toString();
        return relative.replace('\\', '/');
    }

    private static double round(double value) {
        return Math.round(value * 100) / 100.0;
    }

    private record PathAtDepth(Path path, int depth) {
    }
}
