package ai.contextsync.api;

import java.util.Objects;

/** Result of classifying a file: its category and the detected MIME type. */
public record FileTypeInfo(FileCategory category, String mimeType) {
    public FileTypeInfo {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(mimeType, "mimeType");
    }

    public static FileTypeInfo text() {
        return new FileTypeInfo(FileCategory.TEXT, "text/plain");
    }

    public boolean isSupported() {
        return category != FileCategory.UNSUPPORTED;
    }
}
