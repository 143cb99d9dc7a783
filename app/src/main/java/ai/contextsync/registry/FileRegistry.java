package ai.contextsync.registry;

import ai.contextsync.api.FileTypeInfo;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Path-keyed set of tracked files.
 *
 * <p>Concurrent reconciliations of different paths are safe: each only touches its own entry. Two passes over the same
 * path must not overlap; {@link ai.contextsync.ContextSyncManager} serializes them.
 */
public final class FileRegistry {
    private static final Logger logger = LogManager.getLogger(FileRegistry.class);

    private final ConcurrentHashMap<Path, TrackedFile> files = new ConcurrentHashMap<>();

    /**
     * Register a file. Re-adding an already tracked path replaces its entry, which resets the remote view.
     *
     * @return the new entry
     */
    public TrackedFile add(Path absPath, Path relPath, FileTypeInfo typeInfo) {
        var file = new TrackedFile(absPath, relPath, typeInfo);
        var previous = files.put(file.absPath(), file);
        if (previous != null) {
            logger.debug("Re-registered {} ({}), previous view discarded", relPath, typeInfo.category());
        } else {
            logger.debug("Tracking {} ({})", relPath, typeInfo.category());
        }
        return file;
    }

    /** Register a file unless it is already tracked. */
    public TrackedFile addIfAbsent(Path absPath, Path relPath, FileTypeInfo typeInfo) {
        return files.computeIfAbsent(absPath.normalize(), p -> new TrackedFile(p, relPath, typeInfo));
    }

    /** @return the removed entry, or null if the path was not tracked */
    public @Nullable TrackedFile remove(Path absPath) {
        var removed = files.remove(absPath.normalize());
        if (removed != null) {
            logger.debug("Stopped tracking {}", removed.relPath());
        }
        return removed;
    }

    /**
     * Remove {@code file} only if it is still the registered entry for its path, so a stale task cannot drop a
     * newer registration.
     */
    public boolean remove(TrackedFile file) {
        boolean removed = files.remove(file.absPath(), file);
        if (removed) {
            logger.debug("Stopped tracking {}", file.relPath());
        }
        return removed;
    }

    public Optional<TrackedFile> get(Path absPath) {
        return Optional.ofNullable(files.get(absPath.normalize()));
    }

    public boolean contains(Path absPath) {
        return files.containsKey(absPath.normalize());
    }

    /** Snapshot of the tracked files, ordered by absolute path. */
    public List<TrackedFile> all() {
        return files.values().stream()
                .sorted(Comparator.comparing(TrackedFile::absPath))
                .toList();
    }

    public boolean isEmpty() {
        return files.isEmpty();
    }

    public int size() {
        return files.size();
    }

    /** Forget everything the agent has been shown; the next pass sends every file whole. */
    public void resetRemoteViews() {
        files.values().forEach(TrackedFile::clearView);
        logger.debug("Reset remote views of {} files", files.size());
    }
}
