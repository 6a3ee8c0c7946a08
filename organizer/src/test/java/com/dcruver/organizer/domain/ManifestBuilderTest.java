package com.dcruver.organizer.domain;

import com.dcruver.organizer.config.OrganizerProperties;
import com.dcruver.organizer.io.FilenameMetadataParser;
import com.dcruver.organizer.nlp.ClassificationException;
import com.dcruver.organizer.nlp.ClassificationRequest;
import com.dcruver.organizer.nlp.ClassificationResponse;
import com.dcruver.organizer.nlp.Classifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Tests for the two-pass scan and entry classification.
 */
class ManifestBuilderTest {

    private ManifestBuilder builder;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        builder = new ManifestBuilder(new ProjectRootDetector(), new FilenameMetadataParser(), List.of(),
            new OrganizerProperties());
    }

    private ScanOptions options() {
        return ScanOptions.builder()
            .rootPath(tempDir.toString())
            .build();
    }

    private static Optional<ManifestEntry> entry(Manifest manifest, String relativePath) {
        return manifest.getEntries().stream()
            .filter(e -> e.getRelativePath().equals(relativePath))
            .findFirst();
    }

    private static Path write(Path file) throws IOException {
        Files.createDirectories(file.getParent());
        return Files.writeString(file, "content");
    }

    @Test
    void testProjectRootIsOneEntryAndChildrenAreNotListed() throws IOException {
        Path app = Files.createDirectories(tempDir.resolve("app"));
        Files.createDirectory(app.resolve(".git"));
        write(app.resolve("package.json"));
        write(app.resolve("src/index.js"));
        write(app.resolve("README.md"));

        Manifest manifest = builder.build(options());

        ManifestEntry project = entry(manifest, "app").orElseThrow();
        assertEquals(ItemKind.PROJECT_ROOT, project.getKind());
        assertEquals(RecommendedHandling.KEEP, project.getRecommendedHandling());
        assertTrue(project.getConfidence() >= 0.9);
        assertTrue(project.getSignals().contains("Project signal: package.json"));
        assertEquals(List.of("node"), project.getSuggestedTags());

        assertTrue(manifest.getEntries().stream().noneMatch(e -> e.getRelativePath().startsWith("app/")));
        assertEquals(1, manifest.getSummary().getProjectRoots());
    }

    @Test
    void testScanRootThatIsAProjectGivesSingleEntry() throws IOException {
        write(tempDir.resolve("Cargo.toml"));
        write(tempDir.resolve("src/main.rs"));
        write(tempDir.resolve("notes.txt"));

        Manifest manifest = builder.build(options());

        assertEquals(1, manifest.getEntries().size());
        assertEquals(ItemKind.PROJECT_ROOT, manifest.getEntries().get(0).getKind());
    }

    @Test
    void testGeneratedFolderIsKeptWhole() throws IOException {
        write(tempDir.resolve("node_modules/lodash/index.js"));
        write(tempDir.resolve("__pycache__/mod.pyc"));

        Manifest manifest = builder.build(options());

        ManifestEntry generated = entry(manifest, "node_modules").orElseThrow();
        assertEquals(ItemKind.GENERATED, generated.getKind());
        assertEquals(RecommendedHandling.KEEP, generated.getRecommendedHandling());
        assertEquals(1.0, generated.getConfidence());
        assertTrue(entry(manifest, "__pycache__").isPresent());
        assertEquals(2, manifest.getEntries().size());
        assertEquals(2, manifest.getSummary().getGenerated());
    }

    @Test
    void testExtensionTable() throws IOException {
        write(tempDir.resolve("beach.jpg"));
        write(tempDir.resolve("backup.zip"));
        write(tempDir.resolve("loose/script.py"));
        write(tempDir.resolve("mystery.xyz"));

        Manifest manifest = builder.build(options());

        ManifestEntry photo = entry(manifest, "beach.jpg").orElseThrow();
        assertEquals(ItemKind.MEDIA, photo.getKind());
        assertEquals(0.8, photo.getConfidence());
        assertEquals("Images", photo.getSuggestedCategory());
        assertEquals(RecommendedHandling.GROUP, photo.getRecommendedHandling());
        assertTrue(photo.getSignals().contains("Extension match: Images"));

        ManifestEntry archive = entry(manifest, "backup.zip").orElseThrow();
        assertEquals(ItemKind.ARCHIVE, archive.getKind());
        assertEquals(0.9, archive.getConfidence());

        ManifestEntry code = entry(manifest, "loose/script.py").orElseThrow();
        assertEquals(ItemKind.CODE, code.getKind());
        assertEquals(RecommendedHandling.REVIEW, code.getRecommendedHandling());

        ManifestEntry unknown = entry(manifest, "mystery.xyz").orElseThrow();
        assertEquals(ItemKind.UNKNOWN, unknown.getKind());
        assertEquals(0.3, unknown.getConfidence());
        assertEquals(RecommendedHandling.REVIEW, unknown.getRecommendedHandling());
        assertTrue(unknown.getSignals().contains("Unknown file type"));
    }

    @Test
    void testDocumentUsesFilenameHeuristics() throws IOException {
        write(tempDir.resolve("Physics - Lecture Notes.txt"));

        Manifest manifest = builder.build(options());

        ManifestEntry doc = entry(manifest, "Physics - Lecture Notes.txt").orElseThrow();
        assertEquals(ItemKind.DOCUMENT, doc.getKind());
        assertEquals("Lecture Notes", doc.getDocumentMetadata().getTitle());
        assertEquals("Physics", doc.getDocumentMetadata().getSubject());
        assertEquals(0.6, doc.getConfidence(), 1e-9);
        assertEquals("Documents", doc.getSuggestedCategory());
        assertEquals(RecommendedHandling.REVIEW, doc.getRecommendedHandling());
    }

    @Test
    void testGenericFilenameLowersConfidence() throws IOException {
        write(tempDir.resolve("scan.pdf"));

        Manifest manifest = builder.build(options());

        ManifestEntry doc = entry(manifest, "scan.pdf").orElseThrow();
        assertEquals(0.5, doc.getConfidence(), 1e-9);
        assertTrue(doc.getSignals().contains("Generic filename"));
    }

    @Test
    void testTaxonomyRuleSetsCategory() throws IOException {
        write(tempDir.resolve("2023 taxes.pdf"));
        ScanOptions options = options().withTaxonomy(List.of(
            new TaxonomyRule("\\b(tax|taxes|irs)\\b", "Tax Documents", 0.95)));

        Manifest manifest = builder.build(options);

        ManifestEntry doc = entry(manifest, "2023 taxes.pdf").orElseThrow();
        assertEquals("Tax Documents", doc.getSuggestedCategory());
        assertEquals(0.95, doc.getConfidence(), 1e-9);
        assertEquals(RecommendedHandling.GROUP, doc.getRecommendedHandling());
        assertTrue(doc.getSignals().stream().anyMatch(s -> s.startsWith("Taxonomy rule: ")));
    }

    @Test
    void testReviewThresholdAboveGroupingCutoffSendsMatchToReview() throws IOException {
        write(tempDir.resolve("physics lecture.pdf"));
        ScanOptions options = options().withTaxonomy(List.of(
            new TaxonomyRule("\\bphysics\\b", "Physics Notes", 0.8)));

        ManifestEntry grouped = entry(builder.build(options), "physics lecture.pdf").orElseThrow();
        ManifestEntry strict = entry(builder.build(options.withReviewThreshold(0.9)), "physics lecture.pdf")
            .orElseThrow();

        assertEquals(RecommendedHandling.GROUP, grouped.getRecommendedHandling());
        assertEquals(RecommendedHandling.REVIEW, strict.getRecommendedHandling());
        assertEquals(0.8, strict.getConfidence(), 1e-9);
    }

    @Test
    void testDuplicateFilesAreFlagged() throws IOException {
        Files.createDirectories(tempDir.resolve("a"));
        Files.createDirectories(tempDir.resolve("b"));
        Files.writeString(tempDir.resolve("a/photo.jpg"), "same bytes");
        Files.writeString(tempDir.resolve("b/photo copy.jpg"), "same bytes");
        Files.writeString(tempDir.resolve("other.jpg"), "diff bytes");
        Files.writeString(tempDir.resolve("empty1.txt"), "");
        Files.writeString(tempDir.resolve("empty2.txt"), "");

        Manifest manifest = builder.build(options().withDetectDuplicates(true));

        ManifestEntry copy = entry(manifest, "b/photo copy.jpg").orElseThrow();
        assertTrue(copy.isDuplicate());
        assertEquals("Duplicates", copy.getSuggestedCategory());
        assertEquals(0.6, copy.getConfidence(), 1e-9);
        assertEquals(RecommendedHandling.REVIEW, copy.getRecommendedHandling());
        assertTrue(copy.getSignals().contains("Duplicate of a/photo.jpg"));
        assertTrue(copy.getSuggestedTags().contains("duplicate"));

        assertFalse(entry(manifest, "a/photo.jpg").orElseThrow().isDuplicate());
        assertFalse(entry(manifest, "other.jpg").orElseThrow().isDuplicate());
        assertFalse(entry(manifest, "empty2.txt").orElseThrow().isDuplicate());
    }

    @Test
    void testDuplicatesNotCheckedByDefault() throws IOException {
        Files.writeString(tempDir.resolve("one.jpg"), "same bytes");
        Files.writeString(tempDir.resolve("two.jpg"), "same bytes");

        Manifest manifest = builder.build(options());

        assertTrue(manifest.getEntries().stream().noneMatch(ManifestEntry::isDuplicate));
    }

    @Test
    void testIgnoredProjectRootIsStillRecorded() throws IOException {
        Path lib = Files.createDirectories(tempDir.resolve("old/lib"));
        Files.createDirectory(lib.resolve(".git"));
        write(lib.resolve("package.json"));
        write(tempDir.resolve("notes.txt"));

        Manifest manifest = builder.build(options().withIgnorePaths(List.of("old/*")));

        assertTrue(entry(manifest, "old/lib").isEmpty());
        assertEquals(List.of(lib.toAbsolutePath().normalize().toString()), manifest.getProjectRootPaths());
    }

    @Test
    void testHiddenFilesAreSkippedUnlessRequested() throws IOException {
        write(tempDir.resolve(".secret.txt"));
        write(tempDir.resolve("visible.txt"));

        assertTrue(entry(builder.build(options()), ".secret.txt").isEmpty());
        assertTrue(entry(builder.build(options().withIncludeHidden(true)), ".secret.txt").isPresent());
    }

    @Test
    void testIgnorePatterns() throws IOException {
        write(tempDir.resolve("draft.tmp"));
        write(tempDir.resolve("sub/other.tmp"));
        write(tempDir.resolve("cache/data.bin"));
        write(tempDir.resolve("keep.txt"));

        Manifest manifest = builder.build(options().withIgnorePaths(List.of("*.tmp", "cache/*")));

        assertTrue(entry(manifest, "draft.tmp").isEmpty());
        assertTrue(entry(manifest, "sub/other.tmp").isEmpty());
        assertTrue(entry(manifest, "cache/data.bin").isEmpty());
        assertTrue(entry(manifest, "keep.txt").isPresent());
    }

    @Test
    void testFileReachedThroughSymlinkIntoProjectIsKept() throws IOException {
        Path project = Files.createDirectories(tempDir.resolve("proj"));
        write(project.resolve("go.mod"));
        Path readme = write(project.resolve("readme.txt"));
        Files.createSymbolicLink(tempDir.resolve("shortcut.txt"), readme);

        Manifest manifest = builder.build(options());

        ManifestEntry link = entry(manifest, "shortcut.txt").orElseThrow();
        assertTrue(link.isInsideProjectRoot());
        assertEquals(RecommendedHandling.KEEP, link.getRecommendedHandling());
        assertEquals(1.0, link.getConfidence());
        assertEquals(project.toAbsolutePath().normalize().toString(), link.getParentProjectRoot());
    }

    @Test
    void testConfidenceBandsCoverEveryEntry() throws IOException {
        write(tempDir.resolve("a.jpg"));
        write(tempDir.resolve("b.zip"));
        write(tempDir.resolve("c.txt"));
        write(tempDir.resolve("untitled.pdf"));
        write(tempDir.resolve("d.unknownext"));
        write(tempDir.resolve("build/out.o"));

        ManifestSummary summary = builder.build(options()).getSummary();

        assertEquals(6, summary.getTotalItems());
        assertEquals(summary.getTotalItems(),
            summary.getHighConfidence() + summary.getMediumConfidence() + summary.getLowConfidence());
    }

    @Test
    void testClassifierFailureFallsBackToExtension() throws IOException {
        write(tempDir.resolve("lecture.pdf"));
        Classifier classifier = mock(Classifier.class);
        when(classifier.classify(any())).thenThrow(new ClassificationException("timed out"));
        builder.setClassifier(classifier);

        Manifest manifest = builder.build(options().withUseClassifier(true));

        ManifestEntry doc = entry(manifest, "lecture.pdf").orElseThrow();
        assertNotNull(doc.getSuggestedCategory());
        assertEquals("Documents", doc.getSuggestedCategory());
        assertTrue(doc.getSignals().contains(ManifestBuilder.CLASSIFIER_FALLBACK_SIGNAL));
        verify(classifier).classify(any());
    }

    @Test
    void testClassifierResultOverridesCategory() throws IOException {
        write(tempDir.resolve("Fall 2023/lecture3.pdf"));
        Classifier classifier = mock(Classifier.class);
        when(classifier.classify(any())).thenReturn(ClassificationResponse.builder()
            .category("School")
            .subject("Organic Chemistry")
            .title("Lecture 3")
            .confidence(1.7)
            .reasoning("Course material")
            .build());
        builder.setClassifier(classifier);

        Manifest manifest = builder.build(options().withUseClassifier(true));

        ManifestEntry doc = entry(manifest, "Fall 2023/lecture3.pdf").orElseThrow();
        assertEquals("School", doc.getSuggestedCategory());
        assertEquals(1.0, doc.getConfidence());
        assertEquals(RecommendedHandling.GROUP, doc.getRecommendedHandling());
        assertEquals("Organic Chemistry", doc.getDocumentMetadata().getSubject());
        assertTrue(doc.getSignals().contains("AI classification: Course material"));

        verify(classifier).classify(argThat((ClassificationRequest r) ->
            r.getFilename().equals("lecture3.pdf") && r.getFolderContext().equals("Fall 2023")));
    }

    @Test
    void testStrongTaxonomyMatchSkipsClassifier() throws IOException {
        write(tempDir.resolve("invoice-march.pdf"));
        Classifier classifier = mock(Classifier.class);
        builder.setClassifier(classifier);
        ScanOptions options = options()
            .withUseClassifier(true)
            .withTaxonomy(List.of(new TaxonomyRule("\\binvoice\\b", "Invoices & Receipts", 0.9)));

        Manifest manifest = builder.build(options);

        assertEquals("Invoices & Receipts", entry(manifest, "invoice-march.pdf").orElseThrow().getSuggestedCategory());
        verify(classifier, never()).classify(any());
    }

    @Test
    void testClassifierNotUsedWhenDisabled() throws IOException {
        write(tempDir.resolve("report.pdf"));
        Classifier classifier = mock(Classifier.class);
        builder.setClassifier(classifier);

        builder.build(options());

        verifyNoInteractions(classifier);
    }

    @Test
    void testScanRootMustBeADirectory() throws IOException {
        Path file = write(tempDir.resolve("file.txt"));

        assertThrows(IllegalArgumentException.class,
            () -> builder.build(ScanOptions.builder().rootPath(file.toString()).build()));
    }
}
