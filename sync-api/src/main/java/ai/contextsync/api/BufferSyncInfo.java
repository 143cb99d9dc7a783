package ai.contextsync.api;

/**
 * What the editor knew about a buffer the last time it was in sync with disk.
 *
 * @param bufferId editor handle for the buffer
 * @param lastMtime disk modification time (epoch millis) observed at the last sync
 * @param lastChangeCounter buffer change counter observed at the last sync
 */
public record BufferSyncInfo(long bufferId, long lastMtime, long lastChangeCounter) {}
