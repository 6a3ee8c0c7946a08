package com.dcruver.organizer.io;

import com.dcruver.organizer.config.OrganizerProperties;
import com.dcruver.organizer.domain.Manifest;
import com.dcruver.organizer.domain.planning.ExecutionReport;
import com.dcruver.organizer.domain.planning.Plan;
import com.dcruver.organizer.domain.planning.Rollback;
import com.dcruver.organizer.domain.planning.RollbackEntry;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Saves and loads pipeline artifacts as pretty-printed JSON files so any stage
 * can be resumed without re-running earlier ones. Execution and undo reports
 * get one file per run; the moves of all runs of a plan accumulate in its
 * executed rollback.
 */
@Component
@Slf4j
public class ArtifactStore {

    private final ObjectMapper objectMapper;

    @Getter
    private final Path directory;

    @Autowired
    public ArtifactStore(OrganizerProperties properties) {
        this(properties.artifactsPath());
    }

    public ArtifactStore(Path directory) {
        this.directory = directory;
        this.objectMapper = createObjectMapper();
    }

    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    public Path saveManifest(Manifest manifest) throws IOException {
        return write("manifest-" + manifest.getId() + ".json", manifest);
    }

    public Path savePlan(Plan plan) throws IOException {
        return write("plan-" + plan.getId() + ".json", plan);
    }

    /**
     * The rollback computed at plan time. Never replaced by an execution.
     */
    public Path saveRollback(Rollback rollback) throws IOException {
        return write("rollback-" + rollback.getPlanId() + ".json", rollback);
    }

    /**
     * Append the moves of one run to the executed rollback of its plan.
     * Entries of earlier runs are kept, so every completed move stays undoable
     * however often the plan is executed.
     */
    public Path recordExecutedMoves(Rollback run) throws IOException {
        List<RollbackEntry> entries = new ArrayList<>();
        Instant createdAt = run.getCreatedAt();
        Optional<Rollback> existing = findExecutedRollback(run.getPlanId());
        if (existing.isPresent()) {
            entries.addAll(existing.get().getEntries());
            createdAt = existing.get().getCreatedAt();
        }
        entries.addAll(run.getEntries());
        return saveExecutedRollback(Rollback.builder()
            .planId(run.getPlanId())
            .createdAt(createdAt)
            .entries(List.copyOf(entries))
            .build());
    }

    /**
     * Replace the executed rollback, e.g. with what is left after an undo.
     */
    public Path saveExecutedRollback(Rollback rollback) throws IOException {
        return write("executed-rollback-" + rollback.getPlanId() + ".json", rollback);
    }

    public Path saveExecutionReport(ExecutionReport report) throws IOException {
        return write("execution-" + report.getPlanId() + "-" + runStamp(report) + ".json", report);
    }

    public Path saveUndoReport(ExecutionReport report) throws IOException {
        return write("undo-" + report.getPlanId() + "-" + runStamp(report) + ".json", report);
    }

    public Manifest loadManifest(String manifestId) throws IOException {
        return read("manifest-" + manifestId + ".json", Manifest.class);
    }

    public Plan loadPlan(String planId) throws IOException {
        return read("plan-" + planId + ".json", Plan.class);
    }

    public Rollback loadRollback(String planId) throws IOException {
        return read("rollback-" + planId + ".json", Rollback.class);
    }

    public Optional<Rollback> findExecutedRollback(String planId) throws IOException {
        String filename = "executed-rollback-" + planId + ".json";
        if (!Files.exists(directory.resolve(filename))) {
            return Optional.empty();
        }
        return Optional.of(read(filename, Rollback.class));
    }

    /**
     * Every execution report of a plan, oldest first.
     */
    public List<ExecutionReport> loadExecutionReports(String planId) throws IOException {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        String prefix = "execution-" + planId + "-";
        List<ExecutionReport> reports = new ArrayList<>();
        try (Stream<Path> files = Files.list(directory)) {
            for (Path file : files.filter(f -> f.getFileName().toString().startsWith(prefix))
                .filter(f -> f.getFileName().toString().endsWith(".json"))
                .sorted()
                .toList()) {
                reports.add(objectMapper.readValue(file.toFile(), ExecutionReport.class));
            }
        }
        reports.sort(Comparator.comparing(ExecutionReport::getExecutedAt));
        return reports;
    }

    private static String runStamp(ExecutionReport report) {
        Instant at = report.getExecutedAt() != null ? report.getExecutedAt() : Instant.now();
        return String.format("%013d", at.toEpochMilli());
    }

    private Path write(String filename, Object artifact) throws IOException {
        Files.createDirectories(directory);
        Path file = directory.resolve(filename);
        Path tmp = directory.resolve(filename + ".tmp");
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), artifact);
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        log.info("Saved {}", file);
        return file;
    }

    private <T> T read(String filename, Class<T> type) throws IOException {
        Path file = directory.resolve(filename);
        if (!Files.exists(file)) {
            throw new NoSuchFileException(file.toString(), null, "No such artifact");
        }
        return objectMapper.readValue(file.toFile(), type);
    }
}
