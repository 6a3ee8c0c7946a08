package com.dcruver.organizer.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Best-effort metadata for a document. Every field may be absent.
 */
@Value
@Builder(toBuilder = true)
@With
@Jacksonized
public class DocumentMetadata {
    String title;
    String author;
    String subject;
    List<String> keywords;
    String creationDate;
    Integer pageCount;
    String firstPageSnippet;
    ExtractionMethod extractionMethod;

    public static DocumentMetadata empty() {
        return DocumentMetadata.builder()
            .keywords(List.of())
            .extractionMethod(ExtractionMethod.NONE)
            .build();
    }

    public boolean hasTitle() {
        return title != null && !title.isBlank();
    }

    public boolean hasSubject() {
        return subject != null && !subject.isBlank();
    }

    /**
     * Usable for building a destination: a title or a subject is known.
     */
    @JsonIgnore
    public boolean isUsable() {
        return hasTitle() || hasSubject();
    }

    /**
     * Fill fields missing here from {@code other}. Fields already present win.
     */
    public DocumentMetadata mergeMissing(DocumentMetadata other) {
        if (other == null) {
            return this;
        }
        return toBuilder()
            .title(hasTitle() ? title : other.getTitle())
            .author(author != null ? author : other.getAuthor())
            .subject(hasSubject() ? subject : other.getSubject())
            .keywords(keywords != null && !keywords.isEmpty() ? keywords : other.getKeywords())
            .creationDate(creationDate != null ? creationDate : other.getCreationDate())
            .pageCount(pageCount != null ? pageCount : other.getPageCount())
            .firstPageSnippet(firstPageSnippet != null ? firstPageSnippet : other.getFirstPageSnippet())
            .extractionMethod(hasTitle() || other.getExtractionMethod() == null
                ? extractionMethod : other.getExtractionMethod())
            .build();
    }

    public enum ExtractionMethod {
        PDF,
        FILENAME,
        CLASSIFIER,
        NONE
    }
}
