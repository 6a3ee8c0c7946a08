package com.dcruver.organizer.io;

import com.dcruver.organizer.domain.DocumentMetadata;

import java.nio.file.Path;

/**
 * Best-effort document metadata reader. A missing field is never an error.
 */
public interface DocumentMetadataExtractor {

    boolean supports(Path file);

    /**
     * @return metadata, possibly empty; never null
     */
    DocumentMetadata extract(Path file);
}
