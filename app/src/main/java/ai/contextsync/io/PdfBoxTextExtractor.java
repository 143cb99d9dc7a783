package ai.contextsync.io;

import ai.contextsync.api.BinaryExtractor;
import ai.contextsync.api.ExtractionException;
import java.io.IOException;
import java.nio.file.Path;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.apache.pdfbox.text.PDFTextStripper;

/** Extracts the text layer of a PDF with Apache PDFBox. */
public final class PdfBoxTextExtractor implements BinaryExtractor {
    private static final Logger logger = LogManager.getLogger(PdfBoxTextExtractor.class);

    @Override
    public String extractText(Path absPath) throws ExtractionException {
        try (PDDocument document = PDDocument.load(absPath.toFile())) {
            var stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);
            var text = stripper.getText(document);
            logger.trace("Extracted {} chars from {} ({} pages)", text.length(), absPath, document.getNumberOfPages());
            return text;
        } catch (InvalidPasswordException e) {
            throw new ExtractionException("PDF " + absPath + " is password protected", e);
        } catch (IOException e) {
            throw new ExtractionException("Failed to extract text from PDF " + absPath + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            // PDFBox signals some malformed structures with unchecked exceptions
            throw new ExtractionException("Malformed PDF " + absPath + ": " + e, e);
        }
    }
}
