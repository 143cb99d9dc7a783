package ai.contextsync.api;

/** Subset of file metadata the sync engine cares about. {@code mtime} is in epoch millis. */
public record FileStat(long mtime) {}
