package ai.contextsync;

import ai.contextsync.diff.DiffEngine;
import ai.contextsync.util.ContextSyncConfigPaths;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Engine configuration, read from {@code contextsync.properties}.
 *
 * @param autoContext glob patterns, relative to the working directory, whose matches are tracked at startup
 * @param diffContextLines number of unchanged lines around each hunk
 * @param reconcileParallelism worker threads used to reconcile files within one pass
 */
public record SyncSettings(List<String> autoContext, int diffContextLines, int reconcileParallelism) {
    private static final Logger logger = LogManager.getLogger(SyncSettings.class);

    public static final String AUTO_CONTEXT_KEY = "autoContext";
    public static final String DIFF_CONTEXT_LINES_KEY = "diff.contextLines";
    public static final String RECONCILE_PARALLELISM_KEY = "reconcile.parallelism";

    public static final int DEFAULT_RECONCILE_PARALLELISM = 4;

    public SyncSettings {
        autoContext = List.copyOf(autoContext);
        if (diffContextLines < 0) {
            throw new IllegalArgumentException("diffContextLines must be >= 0, got " + diffContextLines);
        }
        if (reconcileParallelism < 1) {
            throw new IllegalArgumentException("reconcileParallelism must be >= 1, got " + reconcileParallelism);
        }
    }

    public static SyncSettings defaults() {
        return new SyncSettings(List.of(), DiffEngine.DEFAULT_CONTEXT_LINES, DEFAULT_RECONCILE_PARALLELISM);
    }

    public SyncSettings withAutoContext(List<String> patterns) {
        return new SyncSettings(patterns, diffContextLines, reconcileParallelism);
    }

    /** Loads the global settings file, falling back to defaults if it does not exist or cannot be read. */
    public static SyncSettings load() {
        return load(ContextSyncConfigPaths.settingsFile());
    }

    public static SyncSettings load(Path file) {
        if (!Files.exists(file)) {
            logger.debug("No settings file at {}, using defaults", file);
            return defaults();
        }
        var props = new Properties();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            props.load(reader);
        } catch (IOException e) {
            logger.warn("Unable to read settings from {}: {}. Using defaults", file, e.getMessage());
            return defaults();
        }
        return fromProperties(props);
    }

    public static SyncSettings fromProperties(Properties props) {
        var patterns = Arrays.stream(props.getProperty(AUTO_CONTEXT_KEY, "").split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
        int contextLines = parseInt(props, DIFF_CONTEXT_LINES_KEY, DiffEngine.DEFAULT_CONTEXT_LINES, 0);
        int parallelism = parseInt(props, RECONCILE_PARALLELISM_KEY, DEFAULT_RECONCILE_PARALLELISM, 1);
        return new SyncSettings(patterns, contextLines, parallelism);
    }

    private static int parseInt(Properties props, String key, int defaultValue, int min) {
        var raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            int value = Integer.parseInt(raw.trim());
            if (value < min) {
                logger.warn("Setting {}={} is below the minimum {}; using default {}", key, raw, min, defaultValue);
                return defaultValue;
            }
            return value;
        } catch (NumberFormatException e) {
            logger.warn("Invalid integer for setting {}: '{}'; using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }
}
