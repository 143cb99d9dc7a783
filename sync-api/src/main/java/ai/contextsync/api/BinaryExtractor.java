package ai.contextsync.api;

import java.nio.file.Path;
import org.jetbrains.annotations.Blocking;

/** Extracts a textual rendition of a binary document (PDF). */
public interface BinaryExtractor {
    @Blocking
    String extractText(Path absPath) throws ExtractionException;
}
