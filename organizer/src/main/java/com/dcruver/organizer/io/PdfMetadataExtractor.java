package com.dcruver.organizer.io;

import com.dcruver.organizer.domain.DocumentMetadata;
import com.dcruver.organizer.domain.DocumentMetadata.ExtractionMethod;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Calendar;
import java.util.List;
import java.util.Locale;

/**
 * Reads the PDF info dictionary and the text of the first page.
 */
@Component
@Slf4j
public class PdfMetadataExtractor implements DocumentMetadataExtractor {

    static final int SNIPPET_LENGTH = 500;

    @Override
    public boolean supports(Path file) {
        return file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".pdf");
    }

    @Override
    public DocumentMetadata extract(Path file) {
        try (PDDocument doc = Loader.loadPDF(file.toFile())) {
            PDDocumentInformation info = doc.getDocumentInformation();

            String title = trimToNull(info.getTitle());
            DocumentMetadata.DocumentMetadataBuilder builder = DocumentMetadata.builder()
                .title(title)
                .author(trimToNull(info.getAuthor()))
                .subject(trimToNull(info.getSubject()))
                .keywords(splitKeywords(info.getKeywords()))
                .creationDate(formatDate(info.getCreationDate()))
                .pageCount(doc.getNumberOfPages())
                .extractionMethod(title != null ? ExtractionMethod.PDF : ExtractionMethod.NONE);

            if (doc.getNumberOfPages() > 0) {
                PDFTextStripper stripper = new PDFTextStripper();
                stripper.setStartPage(1);
                stripper.setEndPage(1);
                builder.firstPageSnippet(snippet(stripper.getText(doc)));
            }

            return builder.build();
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to read PDF metadata from {}: {}", file, e.getMessage());
            return DocumentMetadata.empty();
        }
    }

    private static List<String> splitKeywords(String keywords) {
        if (keywords == null || keywords.isBlank()) {
            return List.of();
        }
        return Arrays.stream(keywords.split("[,;]"))
            .map(String::trim)
            .filter(k -> !k.isEmpty())
            .toList();
    }

    private static String formatDate(Calendar calendar) {
        return calendar == null ? null : calendar.toInstant().toString();
    }

    private static String snippet(String text) {
        if (text == null) {
            return null;
        }
        String collapsed = text.replaceAll("\\s+", " ").trim();
        if (collapsed.isEmpty()) {
            return null;
        }
        return collapsed.length() > SNIPPET_LENGTH ? collapsed.substring(0, SNIPPET_LENGTH) : collapsed;
    }

    private static String trimToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
