package ai.contextsync.io;

import static org.junit.jupiter.api.Assertions.*;

import ai.contextsync.api.ExtractionException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PdfBoxTextExtractorTest {
    @TempDir
    Path root;

    private final PdfBoxTextExtractor extractor = new PdfBoxTextExtractor();

    private Path writePdf(String name, String line) throws Exception {
        var path = root.resolve(name);
        try (var document = new PDDocument()) {
            var page = new PDPage();
            document.addPage(page);
            try (var stream = new PDPageContentStream(document, page)) {
                stream.beginText();
                stream.setFont(PDType1Font.HELVETICA, 12);
                stream.newLineAtOffset(72, 720);
                stream.showText(line);
                stream.endText();
            }
            document.save(path.toFile());
        }
        return path;
    }

    @Test
    void extractsTextLayer() throws Exception {
        var path = writePdf("hello.pdf", "Hello from the PDF");
        assertEquals("Hello from the PDF", extractor.extractText(path).strip());
    }

    @Test
    void corruptPdfFails() throws Exception {
        var path = root.resolve("broken.pdf");
        Files.writeString(path, "%PDF-1.4\nthis is not really a pdf");

        var e = assertThrows(ExtractionException.class, () -> extractor.extractText(path));
        assertTrue(e.getMessage().contains("broken.pdf"), e.getMessage());
    }

    @Test
    void missingFileFails() {
        assertThrows(ExtractionException.class, () -> extractor.extractText(root.resolve("absent.pdf")));
    }
}
