package com.dcruver.organizer.domain;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Fixed extension table used for the first-pass classification of files.
 */
@Getter
@RequiredArgsConstructor
public enum FileCategory {
    IMAGES("Images", ItemKind.MEDIA, 0.8, Set.of("png", "jpg", "jpeg", "heic", "gif", "webp")),
    VIDEOS("Videos", ItemKind.MEDIA, 0.8, Set.of("mp4", "mov", "avi", "mkv")),
    AUDIO("Audio", ItemKind.MEDIA, 0.8, Set.of("mp3", "wav", "m4a", "flac")),
    ARCHIVES("Archives", ItemKind.ARCHIVE, 0.9, Set.of("zip", "rar", "7z", "tar", "gz", "tgz", "bz2", "xz")),
    INSTALLERS("Installers", ItemKind.ARCHIVE, 0.8, Set.of("dmg", "pkg", "msi", "exe")),
    CODE("Code", ItemKind.CODE, 0.7,
        Set.of("py", "js", "ts", "java", "cpp", "c", "h", "json", "html", "css", "ipynb")),
    DOCUMENTS("Documents", ItemKind.DOCUMENT, 0.6, Set.of("pdf", "doc", "docx", "txt", "md", "rtf", "odt")),
    SPREADSHEETS("Spreadsheets", ItemKind.DOCUMENT, 0.6, Set.of("xls", "xlsx", "csv", "ods")),
    PRESENTATIONS("Presentations", ItemKind.DOCUMENT, 0.6, Set.of("ppt", "pptx", "odp"));

    private final String folderName;
    private final ItemKind kind;
    private final double baseConfidence;
    private final Set<String> extensions;

    /**
     * @param extension with or without the leading dot, any case
     */
    public static Optional<FileCategory> forExtension(String extension) {
        if (extension == null || extension.isBlank()) {
            return Optional.empty();
        }
        String ext = extension.startsWith(".") ? extension.substring(1) : extension;
        ext = ext.toLowerCase(Locale.ROOT);
        for (FileCategory category : values()) {
            if (category.extensions.contains(ext)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }

    /**
     * Folder used for an item of the given kind when no category is known.
     */
    public static String defaultFolder(ItemKind kind) {
        return switch (kind) {
            case MEDIA -> "Media";
            case ARCHIVE -> ARCHIVES.folderName;
            case CODE -> CODE.folderName;
            case DOCUMENT -> DOCUMENTS.folderName;
            default -> "Other";
        };
    }
}
