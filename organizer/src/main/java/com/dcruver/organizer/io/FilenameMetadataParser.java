package com.dcruver.organizer.io;

import com.dcruver.organizer.domain.DocumentMetadata;
import com.dcruver.organizer.domain.DocumentMetadata.ExtractionMethod;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Guesses document metadata from common file naming conventions:
 * <ul>
 *   <li>{@code 2023-04-01 Quarterly Report.pdf} - dated title</li>
 *   <li>{@code Physics - Lecture Notes.pdf} - subject and title</li>
 *   <li>{@code Dune (Frank Herbert).pdf} - title and author</li>
 * </ul>
 * Anything else becomes a title made from the bare name.
 */
@Component
public class FilenameMetadataParser {

    private static final Pattern DATED = Pattern.compile("^(\\d{4}-\\d{2}-\\d{2})\\s+(.+)$");
    private static final Pattern SUBJECT_TITLE = Pattern.compile("^([^-]+?)\\s+-\\s+(.+)$");
    private static final Pattern TITLE_AUTHOR = Pattern.compile("^(.+?)\\s*\\(([^)]+)\\)$");

    private static final Set<String> GENERIC_FOLDERS = Set.of("downloads", "documents", "files", "desktop", "home");

    public static final Set<String> GENERIC_NAMES = Set.of(
        "download", "file", "document", "untitled", "final", "new", "temp", "copy",
        "image", "photo", "video", "audio", "scan"
    );

    public DocumentMetadata parse(String filename) {
        String base = FileNames.baseName(filename);
        DocumentMetadata.DocumentMetadataBuilder builder = DocumentMetadata.builder()
            .keywords(List.of())
            .extractionMethod(ExtractionMethod.FILENAME);

        Matcher m = DATED.matcher(base);
        if (m.matches()) {
            return builder
                .title(m.group(2).trim())
                .creationDate(parseDate(m.group(1)))
                .build();
        }

        m = SUBJECT_TITLE.matcher(base);
        if (m.matches()) {
            return builder
                .subject(m.group(1).trim())
                .title(m.group(2).trim())
                .build();
        }

        m = TITLE_AUTHOR.matcher(base);
        if (m.matches()) {
            return builder
                .title(m.group(1).trim())
                .author(m.group(2).trim())
                .build();
        }

        String title = base.replaceAll("[_-]", " ").replaceAll("\\s+", " ").trim();
        return builder.title(title.isEmpty() ? null : title).build();
    }

    /**
     * Normalize a title for use as a file name: separators to spaces,
     * punctuation dropped, words capitalized.
     */
    public static String cleanTitle(String title) {
        if (title == null) {
            return "";
        }
        String cleaned = title
            .replaceAll("[_-]", " ")
            .replaceAll("[^\\p{L}\\p{N}\\s]", "")
            .replaceAll("\\s+", " ")
            .trim();
        return Arrays.stream(cleaned.split(" "))
            .filter(w -> !w.isEmpty())
            .map(w -> Character.toUpperCase(w.charAt(0)) + w.substring(1))
            .collect(Collectors.joining(" "));
    }

    /**
     * True when the bare name is something like "scan", "Untitled 3" or "download(1)".
     */
    public static boolean isGenericName(String filename) {
        String base = FileNames.baseName(filename).toLowerCase(Locale.ROOT)
            .replaceAll("[^a-z]", " ")
            .trim();
        if (base.isEmpty()) {
            return true;
        }
        return Arrays.stream(base.split("\\s+")).allMatch(GENERIC_NAMES::contains);
    }

    /**
     * The last few meaningful folder names above a file, e.g. "school / physics".
     */
    public static String folderContext(String relativePath) {
        if (relativePath == null) {
            return "";
        }
        List<String> parts = Arrays.asList(relativePath.split("/"));
        List<String> folders = parts.subList(Math.max(0, parts.size() - 4), Math.max(0, parts.size() - 1));
        return folders.stream()
            .filter(p -> !p.isEmpty())
            .filter(p -> !GENERIC_FOLDERS.contains(p.toLowerCase(Locale.ROOT)))
            .collect(Collectors.joining(" / "));
    }

    private static String parseDate(String isoDate) {
        try {
            return LocalDate.parse(isoDate).atStartOfDay(ZoneOffset.UTC).toInstant().toString();
        } catch (DateTimeParseException e) {
            return isoDate;
        }
    }
}
