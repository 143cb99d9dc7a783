package ai.contextsync.api;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.jetbrains.annotations.Blocking;

/**
 * Access to live editor buffers. Implementations typically talk to an editor process, so every call may block
 * and may fail with an {@link IOException}.
 */
public interface BufferOracle {

    /** An oracle for headless use: no file is ever open in a buffer. */
    BufferOracle NONE = new BufferOracle() {
        @Override
        public Optional<BufferSyncInfo> syncInfo(Path absPath) {
            return Optional.empty();
        }

        @Override
        public long changeCounter(long bufferId) {
            throw new IllegalStateException("No buffers are available");
        }

        @Override
        public List<String> lines(long bufferId, int start, int end) {
            throw new IllegalStateException("No buffers are available");
        }

        @Override
        public void reloadFromDisk(long bufferId) {
            throw new IllegalStateException("No buffers are available");
        }
    };

    /** Returns sync information if the file is open in a buffer, empty otherwise. */
    @Blocking
    Optional<BufferSyncInfo> syncInfo(Path absPath) throws IOException;

    @Blocking
    long changeCounter(long bufferId) throws IOException;

    /**
     * Returns lines {@code [start, end)} of the buffer. An {@code end} of -1 means "through the last line".
     */
    @Blocking
    List<String> lines(long bufferId, int start, int end) throws IOException;

    /** Discards the buffer's in-memory content and re-reads the file from disk. */
    @Blocking
    void reloadFromDisk(long bufferId) throws IOException;
}
