package com.dcruver.organizer.io;

import com.dcruver.organizer.domain.DocumentMetadata;
import com.dcruver.organizer.domain.DocumentMetadata.ExtractionMethod;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for PDF metadata extraction.
 */
class PdfMetadataExtractorTest {

    private PdfMetadataExtractor extractor;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        extractor = new PdfMetadataExtractor();
    }

    private Path writePdf(String name, String title, String subject, String text) throws IOException {
        Path file = tempDir.resolve(name);
        try (PDDocument doc = new PDDocument()) {
            PDPage page = new PDPage();
            doc.addPage(page);
            try (PDPageContentStream content = new PDPageContentStream(doc, page)) {
                content.beginText();
                content.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), 12);
                content.newLineAtOffset(72, 700);
                content.showText(text);
                content.endText();
            }
            PDDocumentInformation info = doc.getDocumentInformation();
            info.setTitle(title);
            info.setSubject(subject);
            info.setAuthor("A. Student");
            info.setKeywords("chemistry; reactions, labs");
            doc.save(file.toFile());
        }
        return file;
    }

    @Test
    void testSupportsPdfOnly() {
        assertTrue(extractor.supports(Path.of("notes.PDF")));
        assertFalse(extractor.supports(Path.of("notes.docx")));
    }

    @Test
    void testExtractsInfoAndFirstPage() throws IOException {
        Path pdf = writePdf("lab.pdf", "Lab Report 2", "Organic Chemistry", "Esterification yields");

        DocumentMetadata metadata = extractor.extract(pdf);

        assertEquals("Lab Report 2", metadata.getTitle());
        assertEquals("Organic Chemistry", metadata.getSubject());
        assertEquals("A. Student", metadata.getAuthor());
        assertEquals(List.of("chemistry", "reactions", "labs"), metadata.getKeywords());
        assertEquals(1, metadata.getPageCount());
        assertEquals(ExtractionMethod.PDF, metadata.getExtractionMethod());
        assertNotNull(metadata.getFirstPageSnippet());
        assertTrue(metadata.getFirstPageSnippet().contains("Esterification"));
    }

    @Test
    void testUntitledPdfHasNoTitle() throws IOException {
        Path pdf = writePdf("scan.pdf", null, null, "Some text");

        DocumentMetadata metadata = extractor.extract(pdf);

        assertNull(metadata.getTitle());
        assertEquals(ExtractionMethod.NONE, metadata.getExtractionMethod());
        assertFalse(metadata.isUsable());
    }

    @Test
    void testCorruptPdfYieldsEmptyMetadata() throws IOException {
        Path broken = Files.writeString(tempDir.resolve("broken.pdf"), "not really a pdf");

        DocumentMetadata metadata = extractor.extract(broken);

        assertEquals(ExtractionMethod.NONE, metadata.getExtractionMethod());
        assertNull(metadata.getTitle());
        assertTrue(metadata.getKeywords().isEmpty());
    }
}
