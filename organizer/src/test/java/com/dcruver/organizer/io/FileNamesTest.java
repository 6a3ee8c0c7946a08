package com.dcruver.organizer.io;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for file name helpers.
 */
class FileNamesTest {

    @Test
    void testExtension() {
        assertEquals(".pdf", FileNames.extension("report.pdf"));
        assertEquals(".tar.gz", FileNames.extension("backup.tar.gz"));
        assertEquals(".TAR.GZ", FileNames.extension("BACKUP.TAR.GZ"));
        assertEquals("", FileNames.extension(".bashrc"));
        assertEquals("", FileNames.extension("Makefile"));
        assertEquals("", FileNames.extension("trailing."));
    }

    @Test
    void testSimpleExtension() {
        assertEquals("gz", FileNames.simpleExtension("backup.tar.gz"));
        assertEquals("jpg", FileNames.simpleExtension("IMG_0001.JPG"));
        assertEquals("", FileNames.simpleExtension("README"));
    }

    @Test
    void testWithSuffix() {
        assertEquals("photo (2).jpg", FileNames.withSuffix("photo.jpg", 2));
        assertEquals("backup (3).tar.gz", FileNames.withSuffix("backup.tar.gz", 3));
        assertEquals("Makefile (2)", FileNames.withSuffix("Makefile", 2));
    }
}
