package ai.contextsync;

import ai.contextsync.api.BinaryExtractor;
import ai.contextsync.api.BufferOracle;
import ai.contextsync.api.ContentClassifier;
import ai.contextsync.api.DiskOracle;
import ai.contextsync.api.FileTypeInfo;
import ai.contextsync.context.ContentEditException;
import ai.contextsync.context.ContentEdits;
import ai.contextsync.context.ToolApplication;
import ai.contextsync.diff.DiffEngine;
import ai.contextsync.exception.ContextSyncException;
import ai.contextsync.exception.UnsupportedFileCategoryException;
import ai.contextsync.io.LocalDiskOracle;
import ai.contextsync.io.MimeContentClassifier;
import ai.contextsync.io.PdfBoxTextExtractor;
import ai.contextsync.registry.FileRegistry;
import ai.contextsync.registry.RemoteView;
import ai.contextsync.registry.TrackedFile;
import ai.contextsync.sync.FileSyncResult;
import ai.contextsync.sync.Reconciler;
import ai.contextsync.sync.SyncErrorKind;
import ai.contextsync.sync.SyncOutcome;
import ai.contextsync.sync.SyncReport;
import ai.contextsync.util.ExecutorServiceUtil;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Blocking;

/**
 * Keeps the agent's view of every file in context up to date.
 *
 * <p>Callers add files with {@link #track}, report tool activity with {@link #toolApplied}, and before each message to
 * the agent run {@link #syncAll()} to learn what changed. A pass reconciles all tracked files concurrently and returns
 * one outcome per file; per-file failures are reported in the result and never abort the pass.
 *
 * <p>Passes never overlap: a pass requested while another is running starts after it completes.
 */
public class ContextSyncManager implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(ContextSyncManager.class);

    private final Path cwd;
    private final FileRegistry registry = new FileRegistry();
    private final DiskOracle disk;
    private final ContentClassifier classifier;
    private final Reconciler reconciler;
    private final ExecutorService reconcileExecutor;

    private final Object passLock = new Object();
    // tail of the pass queue; guarded by passLock
    private CompletableFuture<SyncReport> lastPass = CompletableFuture.completedFuture(SyncReport.empty());

    public ContextSyncManager(
            Path cwd,
            SyncSettings settings,
            DiskOracle disk,
            BufferOracle buffers,
            ContentClassifier classifier,
            BinaryExtractor extractor) {
        this.cwd = cwd.toAbsolutePath().normalize();
        this.disk = disk;
        this.classifier = classifier;
        this.reconciler =
                new Reconciler(registry, disk, buffers, extractor, new DiffEngine(settings.diffContextLines()));
        this.reconcileExecutor =
                ExecutorServiceUtil.newFixedThreadExecutor(settings.reconcileParallelism(), "contextsync-reconcile");

        for (var candidate : new AutoContextLoader(this.cwd, classifier).load(settings.autoContext())) {
            registry.add(candidate.absPath(), candidate.relPath(), candidate.typeInfo());
        }
    }

    /**
     * Manager backed by the local filesystem, MIME sniffing and PDFBox, configured from the global settings file.
     */
    public static ContextSyncManager createDefault(Path cwd, BufferOracle buffers) {
        return new ContextSyncManager(
                cwd,
                SyncSettings.load(),
                new LocalDiskOracle(),
                buffers,
                new MimeContentClassifier(),
                new PdfBoxTextExtractor());
    }

    /**
     * Classify {@code path} and start tracking it.
     *
     * @throws UnsupportedFileCategoryException if the file cannot be represented to the agent
     * @throws UncheckedIOException if the file cannot be read for classification
     */
    public TrackedFile track(Path path) {
        var absPath = resolve(path);
        FileTypeInfo typeInfo;
        try {
            typeInfo = classifier.classify(absPath);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to detect file type for " + absPath, e);
        }
        return track(absPath, typeInfo);
    }

    /**
     * Start tracking {@code path} with an already known type. Tracking a path again resets what the agent is known to
     * have seen.
     *
     * @throws UnsupportedFileCategoryException if {@code typeInfo} is unsupported
     */
    public TrackedFile track(Path path, FileTypeInfo typeInfo) {
        var absPath = resolve(path);
        if (!typeInfo.isSupported()) {
            throw new UnsupportedFileCategoryException(cwd.relativize(absPath), typeInfo);
        }
        return registry.add(absPath, cwd.relativize(absPath), typeInfo);
    }

    public void untrack(Path path) {
        registry.remove(resolve(path));
    }

    public boolean isEmpty() {
        return registry.isEmpty();
    }

    public List<TrackedFile> trackedFiles() {
        return registry.all();
    }

    /** Forget everything the agent has been shown, e.g. when its conversation is cleared. */
    public void reset() {
        registry.resetRemoteViews();
    }

    /**
     * Record that a tool showed the agent a file or changed it on the agent's behalf. The file is tracked if it was not
     * already.
     *
     * @throws UnsupportedFileCategoryException if an untracked file of unsupported type is reported
     * @throws IllegalStateException if a text edit is reported for a non-text file
     * @throws ContextSyncException if an edit cannot be applied to the agent's current view
     */
    public void toolApplied(Path path, ToolApplication tool, FileTypeInfo typeInfo) {
        var absPath = resolve(path);
        if (!registry.contains(absPath) && !typeInfo.isSupported()) {
            throw new UnsupportedFileCategoryException(cwd.relativize(absPath), typeInfo);
        }
        var file = registry.addIfAbsent(absPath, cwd.relativize(absPath), typeInfo);

        while (true) {
            var view = file.remoteView();
            RemoteView next = tool.fold(
                    getFile -> new RemoteView.Text(getFile.content()),
                    binary -> new RemoteView.Binary(binary.mtime()),
                    insert -> editedView(
                            file,
                            view,
                            insert,
                            content -> ContentEdits.applyInsert(content, insert.insertAfter(), insert.content())),
                    replace -> editedView(
                            file,
                            view,
                            replace,
                            content -> ContentEdits.applyReplace(content, replace.find(), replace.replace())));
            if (file.advance(view, next)) {
                logger.trace("Applied {} to the agent's view of {}", tool.name(), file.relPath());
                return;
            }
        }
    }

    @FunctionalInterface
    private interface TextEdit {
        String apply(String content) throws ContentEditException;
    }

    private RemoteView editedView(TrackedFile file, RemoteView view, ToolApplication tool, TextEdit edit) {
        if (!file.category().isText()) {
            throw new IllegalStateException("Cannot perform %s operation on non-text file %s (file type: %s)"
                    .formatted(tool.name(), file.absPath(), file.category()));
        }

        return view.fold(
                // The agent edited a file it was never shown through context, so its view is whatever is on disk now.
                none -> {
                    try {
                        return new RemoteView.Text(disk.readText(file.absPath()));
                    } catch (IOException e) {
                        throw new ContextSyncException(
                                "Failed to read file %s to update agent's view: %s"
                                        .formatted(file.absPath(), e.getMessage()),
                                e);
                    }
                },
                text -> {
                    try {
                        return new RemoteView.Text(edit.apply(text.content()));
                    } catch (ContentEditException e) {
                        throw new ContextSyncException(
                                "Failed to update agent's view of %s: %s".formatted(file.absPath(), e.getMessage()),
                                e);
                    }
                },
                binary -> {
                    throw new IllegalStateException(
                            "Cannot perform %s operation on %s: agent view type is binary, expected text"
                                    .formatted(tool.name(), file.absPath()));
                });
    }

    /**
     * Start a reconciliation pass. If a pass is already running, the new one is queued behind it.
     *
     * @return the report of this pass; completes exceptionally only on an unexpected, non-file-scoped failure
     */
    public CompletableFuture<SyncReport> syncAllAsync() {
        synchronized (passLock) {
            var next = lastPass.handle((report, ex) -> null).thenCompose(ignored -> runPass());
            lastPass = next;
            return next;
        }
    }

    /** Run a reconciliation pass and wait for it. */
    @Blocking
    public SyncReport syncAll() {
        try {
            return syncAllAsync().join();
        } catch (CompletionException e) {
            var cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw new ContextSyncException("Reconciliation pass failed", cause == null ? e : cause);
        }
    }

    private CompletableFuture<SyncReport> runPass() {
        var files = registry.all();
        if (files.isEmpty()) {
            return CompletableFuture.completedFuture(SyncReport.empty());
        }

        logger.debug("Starting reconciliation pass over {} files", files.size());
        var futures = files.stream()
                .map(file -> CompletableFuture.supplyAsync(() -> reconciler.reconcile(file), reconcileExecutor)
                        .exceptionally(ex -> {
                            // reconcile() reports file-scoped failures itself; only an Error reaches this point
                            logger.error("Reconciliation task for {} failed", file.relPath(), ex);
                            return SyncOutcome.error(
                                    SyncErrorKind.IO_ERROR,
                                    "Unexpected error reconciling %s: %s".formatted(file.absPath(), ex));
                        })
                        .thenApply(outcome ->
                                new FileSyncResult(file.absPath(), file.relPath(), file.typeInfo(), outcome)))
                .toList();

        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .thenApply(ignored -> {
                    var report = new SyncReport(
                            futures.stream().map(CompletableFuture::join).toList());
                    logger.debug(
                            "Reconciliation pass finished: {} files, {} with updates or errors",
                            report.size(),
                            report.updates().size());
                    return report;
                });
    }

    private Path resolve(Path path) {
        return cwd.resolve(path).normalize();
    }

    @Override
    public void close() {
        reconcileExecutor.shutdown();
        try {
            if (!reconcileExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("Reconcile executor did not terminate in time; forcing shutdown");
                reconcileExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            reconcileExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
