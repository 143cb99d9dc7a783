package ai.contextsync.util;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.function.Function;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Locates {@value #SETTINGS_FILE_NAME}.
 *
 * <p>The directory is the first usable value of: the {@value #CONFIG_DIR_PROPERTY} system property, the
 * {@value #CONFIG_DIR_ENV} environment variable, then the per-user config location of the platform
 * ({@code %APPDATA%} on Windows, {@code ~/Library/Application Support} on macOS, {@code $XDG_CONFIG_HOME} or
 * {@code ~/.config} elsewhere) with a {@value #DIR_NAME} subdirectory.
 */
public final class ContextSyncConfigPaths {
    private static final Logger logger = LogManager.getLogger(ContextSyncConfigPaths.class);

    public static final String CONFIG_DIR_PROPERTY = "contextsync.config.dir";
    public static final String CONFIG_DIR_ENV = "CONTEXTSYNC_CONFIG_DIR";
    public static final String SETTINGS_FILE_NAME = "contextsync.properties";
    static final String DIR_NAME = "contextsync";

    private ContextSyncConfigPaths() {}

    public static Path settingsFile() {
        return settingsFile(
                System.getProperty(CONFIG_DIR_PROPERTY),
                System::getenv,
                System.getProperty("os.name", ""),
                Path.of(System.getProperty("user.home")));
    }

    static Path settingsFile(@Nullable String dirProperty, Function<String, String> env, String osName, Path home) {
        var dir = parsePath(CONFIG_DIR_PROPERTY, dirProperty);
        if (dir == null) {
            dir = parsePath(CONFIG_DIR_ENV, env.apply(CONFIG_DIR_ENV));
        }
        if (dir == null) {
            dir = platformDir(env, osName.toLowerCase(Locale.ROOT), home);
        }
        return dir.resolve(SETTINGS_FILE_NAME);
    }

    private static Path platformDir(Function<String, String> env, String os, Path home) {
        if (os.startsWith("windows")) {
            var appData = parsePath("APPDATA", env.apply("APPDATA"));
            return (appData != null ? appData : home.resolve("AppData").resolve("Roaming")).resolve(DIR_NAME);
        }
        if (os.startsWith("mac")) {
            return home.resolve("Library").resolve("Application Support").resolve(DIR_NAME);
        }
        var xdg = parsePath("XDG_CONFIG_HOME", env.apply("XDG_CONFIG_HOME"));
        return (xdg != null ? xdg : home.resolve(".config")).resolve(DIR_NAME);
    }

    private static @Nullable Path parsePath(String source, @Nullable String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Path.of(raw.trim());
        } catch (InvalidPathException e) {
            logger.warn("Ignoring invalid config directory from {}: '{}' ({})", source, raw, e.getMessage());
            return null;
        }
    }
}
