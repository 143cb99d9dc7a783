package ai.contextsync.api;

/** Coarse content category used to decide how a file is synchronized. */
public enum FileCategory {
    TEXT,
    IMAGE,
    PDF,
    UNSUPPORTED;

    public boolean isText() {
        return this == TEXT;
    }
}
