package ai.contextsync.api;

import java.io.IOException;
import java.nio.file.Path;
import org.jetbrains.annotations.Blocking;

/**
 * Filesystem access used by the sync engine. A missing file must surface as
 * {@link java.nio.file.NoSuchFileException} from the read and stat methods.
 */
public interface DiskOracle {
    @Blocking
    boolean exists(Path absPath);

    @Blocking
    FileStat stat(Path absPath) throws IOException;

    @Blocking
    String readText(Path absPath) throws IOException;

    @Blocking
    byte[] readBytes(Path absPath) throws IOException;
}
