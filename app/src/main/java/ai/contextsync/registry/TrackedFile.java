package ai.contextsync.registry;

import ai.contextsync.api.FileCategory;
import ai.contextsync.api.FileTypeInfo;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicReference;
import org.jetbrains.annotations.Nullable;

/**
 * A file the engine keeps the agent's view current for.
 *
 * <p>Path and type information are fixed at registration. The remote view is the only mutable state; it changes
 * through {@link #advance} (compare-and-set, used by reconciliation) or {@link #replaceView} (explicit updates such
 * as a tool reporting what it showed the agent).
 *
 * <p>Instances compare by identity, so a stale entry can be told apart from a later registration of the same path.
 */
public final class TrackedFile {
    private final Path absPath;
    private final Path relPath;
    private final FileTypeInfo typeInfo;
    private final AtomicReference<RemoteView> remoteView = new AtomicReference<>(RemoteView.NONE);

    TrackedFile(Path absPath, Path relPath, FileTypeInfo typeInfo) {
        if (!absPath.isAbsolute()) {
            throw new IllegalArgumentException("Path must be absolute, got " + absPath);
        }
        if (typeInfo.category() == FileCategory.UNSUPPORTED) {
            throw new IllegalArgumentException("Unsupported files cannot be tracked: " + absPath);
        }
        this.absPath = absPath.normalize();
        this.relPath = relPath.normalize();
        this.typeInfo = typeInfo;
    }

    public Path absPath() {
        return absPath;
    }

    public Path relPath() {
        return relPath;
    }

    public FileTypeInfo typeInfo() {
        return typeInfo;
    }

    public FileCategory category() {
        return typeInfo.category();
    }

    public RemoteView remoteView() {
        return remoteView.get();
    }

    /**
     * Move the view from {@code expected} to {@code next}, failing if another writer got there first.
     *
     * @return true if the view was {@code expected} (by identity) and is now {@code next}
     */
    public boolean advance(RemoteView expected, RemoteView next) {
        checkCompatible(next);
        return remoteView.compareAndSet(expected, next);
    }

    /** Unconditionally set the view. */
    public void replaceView(RemoteView next) {
        checkCompatible(next);
        remoteView.set(next);
    }

    void clearView() {
        remoteView.set(RemoteView.NONE);
    }

    private void checkCompatible(RemoteView next) {
        @Nullable String problem = next.fold(
                none -> null,
                text -> category().isText()
                        ? null
                        : "Cannot record a text view for %s file %s".formatted(category(), absPath),
                binary -> category().isText() ? "Cannot record a binary view for text file " + absPath : null);
        if (problem != null) {
            throw new IllegalStateException(problem);
        }
    }

    @Override
    public String toString() {
        return "TrackedFile[" + relPath + ", " + typeInfo.category() + ", " + remoteView.get() + "]";
    }
}
