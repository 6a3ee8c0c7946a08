package com.dcruver.organizer.domain;

/**
 * Classification of a single manifest item.
 */
public enum ItemKind {
    /**
     * Root of a software project - moved, if ever, as one unit
     */
    PROJECT_ROOT,

    DOCUMENT,

    MEDIA,

    ARCHIVE,

    /**
     * Loose source file, not part of a detected project
     */
    CODE,

    /**
     * Build or dependency output folder
     */
    GENERATED,

    UNKNOWN
}
