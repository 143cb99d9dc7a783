package ai.contextsync.sync;

import ai.contextsync.api.FileTypeInfo;
import java.nio.file.Path;

/** One entry of a {@link SyncReport}. */
public record FileSyncResult(Path absPath, Path relPath, FileTypeInfo typeInfo, SyncOutcome outcome) {
    public boolean isUnchanged() {
        return outcome.fold(updated -> false, unchanged -> true, error -> false);
    }
}
