package com.dcruver.organizer.reporting;

import com.dcruver.organizer.domain.planning.ExecutionReport;
import com.dcruver.organizer.domain.planning.ExecutionResult;
import com.dcruver.organizer.domain.planning.Plan;
import com.dcruver.organizer.domain.planning.PlanAction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Writes a plain-text log of an execution run next to the JSON artifacts.
 * Every run gets its own file; an existing log is never overwritten.
 */
@Component
@Slf4j
public class ExecutionLogWriter {

    private static final DateTimeFormatter TIMESTAMP_FORMAT =
        DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss-SSS").withZone(ZoneId.systemDefault());

    private static final int MAX_NAME_ATTEMPTS = 100;

    public Path write(Path directory, Plan plan, ExecutionReport report) throws IOException {
        Files.createDirectories(directory);
        String base = String.format("execution-log-%s-%s", report.getPlanId(),
            TIMESTAMP_FORMAT.format(report.getExecutedAt()));
        String text = render(plan, report);

        for (int attempt = 1; attempt <= MAX_NAME_ATTEMPTS; attempt++) {
            String filename = attempt == 1 ? base + ".txt" : base + " (" + attempt + ").txt";
            Path logFile = directory.resolve(filename);
            try {
                Files.writeString(logFile, text, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
                log.info("Wrote execution log: {}", logFile);
                return logFile;
            } catch (FileAlreadyExistsException e) {
                log.debug("Log {} exists, trying next name", logFile);
            }
        }
        throw new FileAlreadyExistsException(directory.resolve(base + ".txt").toString(), null,
            "No free log name after " + MAX_NAME_ATTEMPTS + " attempts");
    }

    String render(Plan plan, ExecutionReport report) {
        Map<String, PlanAction> actions = plan.getActions().stream()
            .collect(Collectors.toMap(PlanAction::getId, Function.identity(), (a, b) -> a));

        StringBuilder sb = new StringBuilder();
        sb.append("File Organizer Execution Log\n");
        sb.append("============================\n\n");
        sb.append(String.format("Plan:      %s%n", report.getPlanId()));
        sb.append(String.format("Executed:  %s%n", report.getExecutedAt()));
        sb.append(String.format("Dry run:   %s%n", report.isDryRun() ? "yes" : "no"));
        if (report.isCancelled()) {
            sb.append("Cancelled: yes\n");
        }
        sb.append('\n');

        ExecutionReport.ExecutionSummary summary = report.getSummary();
        sb.append("Summary\n-------\n");
        sb.append(String.format("Total:     %d%n", summary.getTotal()));
        sb.append(String.format("Completed: %d%n", summary.getCompleted()));
        sb.append(String.format("Failed:    %d%n", summary.getFailed()));
        sb.append(String.format("Skipped:   %d%n%n", summary.getSkipped()));

        sb.append("Actions\n-------\n");
        for (ExecutionResult result : report.getResults()) {
            PlanAction action = actions.get(result.getActionId());
            sb.append(String.format("[%s] %s%n", result.getStatus(), result.getActionId()));
            if (action != null) {
                sb.append("  From: ").append(action.getFrom()).append('\n');
                sb.append("  To:   ").append(result.getActualDestination() != null
                    ? result.getActualDestination() : action.getTo()).append('\n');
            }
            if (result.getMessage() != null) {
                sb.append("  ").append(result.getMessage()).append('\n');
            }
            if (result.getError() != null) {
                sb.append("  Error: ").append(result.getError()).append('\n');
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
