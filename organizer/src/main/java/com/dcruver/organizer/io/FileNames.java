package com.dcruver.organizer.io;

import java.util.List;
import java.util.Locale;

/**
 * File name helpers shared by the scanner, planner and executor.
 */
public final class FileNames {

    // Multi-part extensions kept whole when a suffix is inserted
    private static final List<String> COMPOUND_EXTENSIONS = List.of(".tar.gz", ".tar.bz2", ".tar.xz");

    private FileNames() {
    }

    /**
     * Extension including the dot, e.g. ".pdf" or ".tar.gz"; empty for none.
     * A leading dot (".bashrc") is not an extension.
     */
    public static String extension(String filename) {
        String lower = filename.toLowerCase(Locale.ROOT);
        for (String compound : COMPOUND_EXTENSIONS) {
            if (lower.endsWith(compound) && lower.length() > compound.length()) {
                return filename.substring(filename.length() - compound.length());
            }
        }
        int dot = filename.lastIndexOf('.');
        if (dot <= 0 || dot == filename.length() - 1) {
            return "";
        }
        return filename.substring(dot);
    }

    /**
     * Last simple extension without the dot, lower case; used for category lookup.
     */
    public static String simpleExtension(String filename) {
        int dot = filename.lastIndexOf('.');
        if (dot <= 0 || dot == filename.length() - 1) {
            return "";
        }
        return filename.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    public static String baseName(String filename) {
        String ext = extension(filename);
        return filename.substring(0, filename.length() - ext.length());
    }

    /**
     * {@code withSuffix("photo.jpg", 2)} is {@code "photo (2).jpg"}.
     */
    public static String withSuffix(String filename, int n) {
        return baseName(filename) + " (" + n + ")" + extension(filename);
    }
}
