package ai.contextsync.sync;

import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/** Outcomes of one reconciliation pass, keyed and ordered by absolute path. */
public final class SyncReport {
    private static final SyncReport EMPTY = new SyncReport(List.of());

    private final SortedMap<Path, FileSyncResult> results;

    public SyncReport(Collection<FileSyncResult> results) {
        var map = new TreeMap<Path, FileSyncResult>();
        for (var r : results) {
            if (map.put(r.absPath(), r) != null) {
                throw new IllegalArgumentException("Duplicate result for " + r.absPath());
            }
        }
        this.results = Collections.unmodifiableSortedMap(map);
    }

    public static SyncReport empty() {
        return EMPTY;
    }

    /** Path to outcome, including files that did not change. */
    public Map<Path, SyncOutcome> outcomes() {
        var map = new TreeMap<Path, SyncOutcome>();
        results.forEach((path, r) -> map.put(path, r.outcome()));
        return Collections.unmodifiableMap(map);
    }

    /** Entries the agent needs to hear about: updates and errors, but not unchanged files. */
    public List<FileSyncResult> updates() {
        return results.values().stream().filter(r -> !r.isUnchanged()).toList();
    }

    public Optional<SyncOutcome> outcome(Path absPath) {
        return Optional.ofNullable(results.get(absPath.normalize())).map(FileSyncResult::outcome);
    }

    public boolean hasUpdates() {
        return results.values().stream().anyMatch(r -> !r.isUnchanged());
    }

    public boolean isEmpty() {
        return results.isEmpty();
    }

    public int size() {
        return results.size();
    }

    @Override
    public String toString() {
        return "SyncReport" + outcomes();
    }
}
