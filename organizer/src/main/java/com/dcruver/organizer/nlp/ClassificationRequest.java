package com.dcruver.organizer.nlp;

import com.dcruver.organizer.domain.DocumentMetadata;
import lombok.Builder;
import lombok.Value;

/**
 * What the classifier gets to see about one file.
 */
@Value
@Builder
public class ClassificationRequest {
    String filename;
    String extension;
    long size;
    DocumentMetadata metadata;   // optional
    String folderContext;        // optional, e.g. "school/fall-2023"
}
