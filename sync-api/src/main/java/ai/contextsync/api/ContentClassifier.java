package ai.contextsync.api;

import java.io.IOException;
import java.nio.file.Path;

/** Decides which {@link FileCategory} a file belongs to. */
public interface ContentClassifier {
    FileTypeInfo classify(Path absPath) throws IOException;
}
