package ai.contextsync.sync;

import ai.contextsync.api.BinaryExtractor;
import ai.contextsync.api.BufferOracle;
import ai.contextsync.api.BufferSyncInfo;
import ai.contextsync.api.DiskOracle;
import ai.contextsync.api.ExtractionException;
import ai.contextsync.api.FileCategory;
import ai.contextsync.diff.DiffEngine;
import ai.contextsync.registry.FileRegistry;
import ai.contextsync.registry.RemoteView;
import ai.contextsync.registry.TrackedFile;
import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.util.Base64;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Blocking;
import org.jetbrains.annotations.Nullable;

/**
 * Computes the update that brings the agent's view of a single tracked file up to date, and advances that view.
 *
 * <p>Text files open in an editor buffer are read from the buffer; everything else is read from disk. Binary files are
 * compared by modification time only. The view is only advanced when an update is returned, so a failed
 * reconciliation is simply retried on the next pass.
 */
public final class Reconciler {
    private static final Logger logger = LogManager.getLogger(Reconciler.class);

    private final FileRegistry registry;
    private final DiskOracle disk;
    private final BufferOracle buffers;
    private final BinaryExtractor extractor;
    private final DiffEngine diffEngine;

    public Reconciler(
            FileRegistry registry,
            DiskOracle disk,
            BufferOracle buffers,
            BinaryExtractor extractor,
            DiffEngine diffEngine) {
        this.registry = registry;
        this.disk = disk;
        this.buffers = buffers;
        this.extractor = extractor;
        this.diffEngine = diffEngine;
    }

    /**
     * Never throws for a file-scoped failure: anything that goes wrong with this file, including an unchecked
     * exception from an oracle, is reported as an {@link SyncOutcome.Error} and leaves the view where it was.
     */
    @Blocking
    public SyncOutcome reconcile(TrackedFile file) {
        try {
            if (!disk.exists(file.absPath())) {
                return deleted(file);
            }
            return file.category().isText() ? reconcileText(file) : reconcileBinary(file);
        } catch (RuntimeException e) {
            logger.error("Unexpected error reconciling {}", file.relPath(), e);
            return SyncOutcome.error(
                    SyncErrorKind.IO_ERROR,
                    "Unexpected error reconciling %s: %s".formatted(file.absPath(), describe(e)));
        }
    }

    private SyncOutcome reconcileText(TrackedFile file) {
        var absPath = file.absPath();

        Optional<BufferSyncInfo> syncInfo;
        try {
            syncInfo = buffers.syncInfo(absPath);
        } catch (IOException e) {
            return ioError(file, "querying the editor buffer", e);
        }

        String content;
        if (syncInfo.isPresent()) {
            var info = syncInfo.get();
            try {
                long diskMtime = disk.stat(absPath).mtime();
                long changeCounter = buffers.changeCounter(info.bufferId());

                boolean bufferChanged = changeCounter != info.lastChangeCounter();
                boolean diskChanged = info.lastMtime() < diskMtime;

                if (bufferChanged && diskChanged) {
                    logger.warn("Buffer {} and disk copy of {} both changed", info.bufferId(), file.relPath());
                    return SyncOutcome.error(
                            SyncErrorKind.CONFLICT,
                            "Both the buffer %d and the file on disk for %s have changed. Cannot determine which version to use."
                                    .formatted(info.bufferId(), absPath));
                }
                if (diskChanged) {
                    logger.trace("Reloading buffer {} for {} from disk", info.bufferId(), file.relPath());
                    buffers.reloadFromDisk(info.bufferId());
                }

                content = String.join("\n", buffers.lines(info.bufferId(), 0, -1));
            } catch (NoSuchFileException e) {
                return deleted(file);
            } catch (IOException e) {
                return ioError(file, "reading the editor buffer", e);
            }
        } else {
            try {
                content = disk.readText(absPath);
            } catch (NoSuchFileException e) {
                return deleted(file);
            } catch (IOException e) {
                return ioError(file, "reading", e);
            }
        }

        return advanceText(file, content);
    }

    private SyncOutcome advanceText(TrackedFile file, String content) {
        var label = file.relPath().toString();
        while (true) {
            var view = file.remoteView();
            @Nullable SyncOutcome outcome = view.fold(
                    none -> file.advance(view, new RemoteView.Text(content))
                            ? sendWhole(label, content)
                            : null,
                    previous -> diffAgainst(file, view, previous.content(), content),
                    binary -> {
                        throw new IllegalStateException("Text file " + file.absPath() + " has a binary remote view");
                    });
            if (outcome != null) {
                return outcome;
            }
            logger.debug("Remote view of {} changed while reconciling; recomputing", label);
        }
    }

    private static SyncOutcome sendWhole(String label, String content) {
        logger.trace("{}: first sight, sending whole file", label);
        return SyncOutcome.updated(new FileUpdate.WholeFile(content));
    }

    /** @return the outcome, or null if the view moved underneath us and the caller must retry */
    private @Nullable SyncOutcome diffAgainst(TrackedFile file, RemoteView view, String previous, String content) {
        if (previous.equals(content)) {
            return SyncOutcome.UNCHANGED;
        }
        var label = file.relPath().toString();
        var patch = diffEngine.diff(previous, content, label);
        if (patch.isEmpty()) {
            // only the trailing newline differs
            return SyncOutcome.UNCHANGED;
        }
        if (!file.advance(view, new RemoteView.Text(content))) {
            return null;
        }
        logger.trace("{}: diff {}", label, patch.summary());
        return SyncOutcome.updated(new FileUpdate.Diff(patch));
    }

    private SyncOutcome reconcileBinary(TrackedFile file) {
        var absPath = file.absPath();
        long mtime;
        try {
            mtime = disk.stat(absPath).mtime();
        } catch (NoSuchFileException e) {
            return deleted(file);
        } catch (IOException e) {
            return ioError(file, "checking file stats for", e);
        }

        @Nullable String content = null;
        while (true) {
            var view = file.remoteView();
            boolean seen = view.fold(
                    none -> false,
                    text -> {
                        throw new IllegalStateException("Binary file " + absPath + " has a text remote view");
                    },
                    binary -> binary.mtime() == mtime);
            if (seen) {
                return SyncOutcome.UNCHANGED;
            }

            if (content == null) {
                try {
                    content = loadBinaryContent(file);
                } catch (ExtractionException e) {
                    logger.warn("Failed to extract text from {}: {}", file.relPath(), describe(e));
                    return SyncOutcome.error(
                            SyncErrorKind.EXTRACTION_FAILED,
                            "Failed to extract text from %s: %s".formatted(absPath, describe(e)));
                } catch (NoSuchFileException e) {
                    return deleted(file);
                } catch (IOException e) {
                    return ioError(file, "reading", e);
                }
            }

            if (file.advance(view, new RemoteView.Binary(mtime))) {
                logger.trace("{}: sending {} content (mtime {})", file.relPath(), file.category(), mtime);
                return SyncOutcome.updated(new FileUpdate.WholeFile(content));
            }
            logger.debug("Remote view of {} changed while reconciling; recomputing", file.relPath());
        }
    }

    private String loadBinaryContent(TrackedFile file) throws IOException, ExtractionException {
        if (file.category() == FileCategory.PDF) {
            try {
                return extractor.extractText(file.absPath());
            } catch (RuntimeException e) {
                throw new ExtractionException("Extractor failed on " + file.absPath() + ": " + describe(e), e);
            }
        }
        return Base64.getEncoder().encodeToString(disk.readBytes(file.absPath()));
    }

    private SyncOutcome deleted(TrackedFile file) {
        logger.debug("{} no longer exists, removing it from context", file.relPath());
        registry.remove(file);
        return SyncOutcome.updated(new FileUpdate.Deleted());
    }

    private static SyncOutcome ioError(TrackedFile file, String action, IOException e) {
        logger.warn("I/O error {} {}: {}", action, file.relPath(), e.getMessage());
        return SyncOutcome.error(
                SyncErrorKind.IO_ERROR,
                "Error %s %s: %s".formatted(action, file.absPath(), describe(e)));
    }

    private static String describe(Throwable e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }
}
