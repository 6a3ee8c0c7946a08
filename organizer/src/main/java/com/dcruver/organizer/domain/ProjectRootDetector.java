package com.dcruver.organizer.domain;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Detects software project roots and generated build-output folders.
 * A project root is treated as one unit: nothing below it is ever moved
 * on its own.
 */
@Component
@Slf4j
public class ProjectRootDetector {

    public static final List<String> PROJECT_ROOT_SIGNALS = List.of(
        // Version control
        ".git", ".svn", ".hg",
        // Node
        "package.json", "pnpm-lock.yaml", "yarn.lock", "package-lock.json", "tsconfig.json",
        "next.config.js", "next.config.mjs", "vite.config.js", "webpack.config.js",
        // Python
        "pyproject.toml", "requirements.txt", "Pipfile", "setup.py", "poetry.lock",
        // Rust
        "Cargo.toml", "Cargo.lock",
        // Go
        "go.mod", "go.sum",
        // Java
        "pom.xml", "build.gradle", "build.gradle.kts",
        // Ruby
        "Gemfile", "Gemfile.lock",
        // PHP
        "composer.json", "composer.lock"
    );

    // Matched by suffix, e.g. MyApp.sln
    public static final List<String> PROJECT_ROOT_SUFFIX_SIGNALS = List.of(".sln", ".csproj");

    public static final Set<String> GENERATED_FOLDERS = Set.of(
        "node_modules", ".next", "dist", "build", "target", "__pycache__",
        ".venv", "venv", ".pytest_cache", ".gradle", "out"
    );

    private static final Set<String> STRONG_SIGNALS = Set.of(
        ".git", "package.json", "Cargo.toml", "go.mod", "pom.xml", "pyproject.toml"
    );

    /**
     * Inspect the immediate children of a directory for project markers.
     * Unreadable directories are reported as "not a project root".
     */
    public ProjectRootDetection detect(Path dir) {
        List<String> names;
        try {
            names = childNames(dir);
        } catch (IOException | SecurityException e) {
            log.debug("Cannot read {}: {}", dir, e.getMessage());
            return ProjectRootDetection.none();
        }

        Set<String> nameSet = new HashSet<>(names);
        List<String> signals = new ArrayList<>();
        for (String signal : PROJECT_ROOT_SIGNALS) {
            if (nameSet.contains(signal)) {
                signals.add(signal);
            }
        }
        for (String suffix : PROJECT_ROOT_SUFFIX_SIGNALS) {
            if (names.stream().anyMatch(n -> n.endsWith(suffix) && n.length() > suffix.length())) {
                signals.add(suffix);
            }
        }

        if (signals.isEmpty()) {
            return ProjectRootDetection.none();
        }

        ProjectType type = inferProjectType(signals);
        return ProjectRootDetection.builder()
            .projectRoot(true)
            .signals(List.copyOf(signals))
            .projectType(type)
            .confidence(calculateConfidence(signals, type))
            .build();
    }

    /**
     * Walk the tree below {@code root} and collect every project root.
     * A detected root is never descended into, nor are generated folders or
     * hidden directories. Symlinked directories are followed at most once per
     * real path.
     *
     * @return detections keyed by absolute normalized path, in discovery order
     */
    public Map<Path, ProjectRootDetection> findProjectRoots(Path root, int maxDepth) {
        Map<Path, ProjectRootDetection> roots = new LinkedHashMap<>();
        Set<Path> visited = new HashSet<>();
        Deque<DirAtDepth> stack = new ArrayDeque<>();
        stack.push(new DirAtDepth(root.toAbsolutePath().normalize(), 0));

        while (!stack.isEmpty()) {
            DirAtDepth current = stack.pop();
            if (current.depth() > maxDepth) {
                continue;
            }

            Path realPath = realPathOrNull(current.dir());
            if (realPath == null || !visited.add(realPath)) {
                continue;
            }

            ProjectRootDetection detection = detect(current.dir());
            if (detection.isProjectRoot()) {
                log.debug("Project root {} ({}, {})", current.dir(), detection.getProjectType(),
                    detection.getConfidence());
                roots.put(current.dir(), detection);
                continue;
            }

            List<String> children;
            try {
                children = childNames(current.dir());
            } catch (IOException | SecurityException e) {
                log.warn("Skipping unreadable directory {}: {}", current.dir(), e.getMessage());
                continue;
            }

            // Push in reverse so the walk visits children alphabetically
            Collections.sort(children, Collections.reverseOrder());
            for (String name : children) {
                // Hidden folders, .git included, are never descended
                if (name.startsWith(".") || isGeneratedFolder(name)) {
                    continue;
                }
                Path child = current.dir().resolve(name);
                if (Files.isDirectory(child)) {
                    stack.push(new DirAtDepth(child, current.depth() + 1));
                }
            }
        }

        log.info("Found {} project roots under {}", roots.size(), root);
        return roots;
    }

    public boolean isGeneratedFolder(String dirName) {
        return GENERATED_FOLDERS.contains(dirName);
    }

    /**
     * One-line human readable summary of a detection.
     */
    public String describe(ProjectRootDetection detection) {
        if (detection == null || !detection.isProjectRoot()) {
            return "Not a project root";
        }
        String type = detection.getProjectType() != null
            ? detection.getProjectType().name().toLowerCase(Locale.ROOT)
            : "unknown";
        return String.format("%s project (%.0f%% confidence) - signals: %s",
            type, detection.getConfidence() * 100, String.join(", ", detection.getSignals()));
    }

    ProjectType inferProjectType(List<String> signals) {
        Set<String> s = new HashSet<>(signals);
        if (s.contains("package.json")) {
            return ProjectType.NODE;
        }
        if (s.contains("pyproject.toml") || s.contains("requirements.txt")
            || s.contains("Pipfile") || s.contains("setup.py")) {
            return ProjectType.PYTHON;
        }
        if (s.contains("Cargo.toml")) {
            return ProjectType.RUST;
        }
        if (s.contains("go.mod")) {
            return ProjectType.GO;
        }
        if (s.contains("pom.xml") || s.contains("build.gradle") || s.contains("build.gradle.kts")) {
            return ProjectType.JAVA;
        }
        if (s.contains(".sln") || s.contains(".csproj")) {
            return ProjectType.DOTNET;
        }
        if (s.contains("Gemfile")) {
            return ProjectType.RUBY;
        }
        if (s.contains("composer.json")) {
            return ProjectType.PHP;
        }
        return ProjectType.MIXED;
    }

    double calculateConfidence(List<String> signals, ProjectType type) {
        double confidence = Math.min(0.5 + signals.size() * 0.1, 1.0);

        if (signals.stream().anyMatch(STRONG_SIGNALS::contains)) {
            confidence = Math.min(confidence + 0.2, 1.0);
        }
        if (type != null && type != ProjectType.MIXED) {
            confidence = Math.min(confidence + 0.1, 1.0);
        }

        return Math.round(confidence * 100) / 100.0;
    }

    private static List<String> childNames(Path dir) throws IOException {
        List<String> names = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            for (Path child : stream) {
                names.add(child.getFileName().toString());
            }
        }
        return names;
    }

    private static Path realPathOrNull(Path dir) {
        try {
            return dir.toRealPath();
        } catch (IOException e) {
            log.debug("Cannot resolve real path of {}: {}", dir, e.getMessage());
            return null;
        }
    }

    private record DirAtDepth(Path dir, int depth) {
    }
}
