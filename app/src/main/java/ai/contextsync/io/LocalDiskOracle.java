package ai.contextsync.io;

import ai.contextsync.api.DiskOracle;
import ai.contextsync.api.FileStat;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/** {@link DiskOracle} over the local filesystem. Text is decoded as UTF-8. */
public final class LocalDiskOracle implements DiskOracle {

    @Override
    public boolean exists(Path absPath) {
        return Files.exists(absPath);
    }

    @Override
    public FileStat stat(Path absPath) throws IOException {
        return new FileStat(Files.getLastModifiedTime(absPath).toMillis());
    }

    @Override
    public String readText(Path absPath) throws IOException {
        return Files.readString(absPath, StandardCharsets.UTF_8);
    }

    @Override
    public byte[] readBytes(Path absPath) throws IOException {
        return Files.readAllBytes(absPath);
    }
}
