package ai.contextsync.sync;

/** Per-file failures. None of them stop tracking; the file is reconciled again on the next pass. */
public enum SyncErrorKind {
    /** Both the editor buffer and the file on disk changed since the last sync. */
    CONFLICT,
    IO_ERROR,
    EXTRACTION_FAILED
}
