package ai.contextsync.exception;

import ai.contextsync.api.FileTypeInfo;
import java.nio.file.Path;

/** A file whose content category cannot be represented to the agent was added to context. */
public class UnsupportedFileCategoryException extends ContextSyncException {
    private final Path path;
    private final FileTypeInfo typeInfo;

    public UnsupportedFileCategoryException(Path path, FileTypeInfo typeInfo) {
        super("Cannot add %s to context: %s files are not supported in context (detected MIME type: %s)"
                .formatted(path, typeInfo.category(), typeInfo.mimeType()));
        this.path = path;
        this.typeInfo = typeInfo;
    }

    public Path path() {
        return path;
    }

    public FileTypeInfo typeInfo() {
        return typeInfo;
    }
}
