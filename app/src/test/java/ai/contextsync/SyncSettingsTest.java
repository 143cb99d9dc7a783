package ai.contextsync;

import static org.junit.jupiter.api.Assertions.*;

import ai.contextsync.diff.DiffEngine;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Properties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SyncSettingsTest {
    @TempDir
    Path dir;

    @Test
    void missingFileGivesDefaults() {
        var settings = SyncSettings.load(dir.resolve("contextsync.properties"));
        assertEquals(SyncSettings.defaults(), settings);
        assertEquals(List.of(), settings.autoContext());
        assertEquals(DiffEngine.DEFAULT_CONTEXT_LINES, settings.diffContextLines());
        assertEquals(SyncSettings.DEFAULT_RECONCILE_PARALLELISM, settings.reconcileParallelism());
    }

    @Test
    void readsAllKeys() throws Exception {
        var file = dir.resolve("contextsync.properties");
        Files.writeString(
                file,
                """
                # project defaults
                autoContext = README.md, docs/**/*.md ,,
                diff.contextLines=5
                reconcile.parallelism=8
                """);

        var settings = SyncSettings.load(file);

        assertEquals(List.of("README.md", "docs/**/*.md"), settings.autoContext());
        assertEquals(5, settings.diffContextLines());
        assertEquals(8, settings.reconcileParallelism());
    }

    @Test
    void invalidNumbersFallBackToDefaults() {
        var props = new Properties();
        props.setProperty(SyncSettings.DIFF_CONTEXT_LINES_KEY, "lots");
        props.setProperty(SyncSettings.RECONCILE_PARALLELISM_KEY, "0");

        var settings = SyncSettings.fromProperties(props);

        assertEquals(DiffEngine.DEFAULT_CONTEXT_LINES, settings.diffContextLines());
        assertEquals(SyncSettings.DEFAULT_RECONCILE_PARALLELISM, settings.reconcileParallelism());
    }

    @Test
    void constructorValidatesRanges() {
        assertThrows(IllegalArgumentException.class, () -> new SyncSettings(List.of(), -1, 1));
        assertThrows(IllegalArgumentException.class, () -> new SyncSettings(List.of(), 2, 0));
    }

    @Test
    void withAutoContextKeepsOtherSettings() {
        var settings = new SyncSettings(List.of(), 7, 3).withAutoContext(List.of("*.md"));
        assertEquals(new SyncSettings(List.of("*.md"), 7, 3), settings);
    }
}
