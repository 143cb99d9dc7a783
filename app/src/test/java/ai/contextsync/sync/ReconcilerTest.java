package ai.contextsync.sync;

import static org.junit.jupiter.api.Assertions.*;

import ai.contextsync.api.BufferSyncInfo;
import ai.contextsync.api.FileCategory;
import ai.contextsync.api.FileTypeInfo;
import ai.contextsync.diff.DiffEngine;
import ai.contextsync.registry.FileRegistry;
import ai.contextsync.registry.RemoteView;
import ai.contextsync.registry.TrackedFile;
import ai.contextsync.testutil.FakeBufferOracle;
import ai.contextsync.testutil.FaultyDiskOracle;
import ai.contextsync.testutil.ScriptedBinaryExtractor;
import ai.contextsync.testutil.TestFiles;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ReconcilerTest {
    private static final FileTypeInfo PNG = new FileTypeInfo(FileCategory.IMAGE, "image/png");
    private static final FileTypeInfo PDF = new FileTypeInfo(FileCategory.PDF, "application/pdf");

    @TempDir
    Path root;

    private FileRegistry registry;
    private FaultyDiskOracle disk;
    private FakeBufferOracle buffers;
    private ScriptedBinaryExtractor extractor;
    private Reconciler reconciler;

    @BeforeEach
    void setUp() {
        registry = new FileRegistry();
        disk = new FaultyDiskOracle();
        buffers = new FakeBufferOracle();
        extractor = new ScriptedBinaryExtractor("pdf text", 1);
        reconciler = new Reconciler(registry, disk, buffers, extractor, new DiffEngine());
    }

    private TrackedFile track(Path path, FileTypeInfo typeInfo) {
        return registry.add(path, root.relativize(path), typeInfo);
    }

    private static FileUpdate updateOf(SyncOutcome outcome) {
        assertInstanceOf(SyncOutcome.Updated.class, outcome, () -> "expected an update but got " + outcome);
        return ((SyncOutcome.Updated) outcome).update();
    }

    private static SyncOutcome.Error errorOf(SyncOutcome outcome) {
        assertInstanceOf(SyncOutcome.Error.class, outcome, () -> "expected an error but got " + outcome);
        return (SyncOutcome.Error) outcome;
    }

    @Test
    void firstSightSendsWholeFileThenUnchanged() throws Exception {
        var path = TestFiles.write(root.resolve("a.txt"), "foo\n", 1_000);
        var file = track(path, FileTypeInfo.text());

        assertEquals(new FileUpdate.WholeFile("foo\n"), updateOf(reconciler.reconcile(file)));
        assertEquals(new RemoteView.Text("foo\n"), file.remoteView());

        var viewAfterFirst = file.remoteView();
        assertSame(SyncOutcome.UNCHANGED, reconciler.reconcile(file));
        assertSame(viewAfterFirst, file.remoteView());
    }

    @Test
    void changedDiskContentProducesDiffAgainstCurrentView() throws Exception {
        var path = TestFiles.write(root.resolve("a.txt"), "foo\n", 1_000);
        var file = track(path, FileTypeInfo.text());
        reconciler.reconcile(file);

        Files.writeString(path, "foo\nbar\n");
        var update = updateOf(reconciler.reconcile(file));

        var diff = assertInstanceOf(FileUpdate.Diff.class, update);
        assertEquals(1, diff.patch().added());
        assertEquals("foo\nbar\n", DiffEngine.apply(diff.patch(), "foo\n"));
        assertEquals(new RemoteView.Text("foo\nbar\n"), file.remoteView());
    }

    @Test
    void trailingNewlineOnlyChangeIsUnchangedAndLeavesView() throws Exception {
        var path = TestFiles.write(root.resolve("a.txt"), "foo\n", 1_000);
        var file = track(path, FileTypeInfo.text());
        reconciler.reconcile(file);

        Files.writeString(path, "foo");
        assertSame(SyncOutcome.UNCHANGED, reconciler.reconcile(file));
        assertEquals(new RemoteView.Text("foo\n"), file.remoteView());
    }

    @Test
    void missingFileIsDeletedAndUntracked() throws Exception {
        var path = TestFiles.write(root.resolve("a.txt"), "foo\n", 1_000);
        var file = track(path, FileTypeInfo.text());
        reconciler.reconcile(file);

        Files.delete(path);
        assertInstanceOf(FileUpdate.Deleted.class, updateOf(reconciler.reconcile(file)));
        assertFalse(registry.contains(path));
    }

    @Test
    void readErrorIsReportedAndFileStaysTracked() throws Exception {
        var path = TestFiles.write(root.resolve("a.txt"), "foo\n", 1_000);
        var file = track(path, FileTypeInfo.text());
        disk.makeUnreadable(path);

        var error = errorOf(reconciler.reconcile(file));
        assertEquals(SyncErrorKind.IO_ERROR, error.kind());
        assertTrue(error.message().contains(path.toString()), error.message());
        assertTrue(file.remoteView().isNone());
        assertTrue(registry.contains(path));

        disk.makeReadable(path);
        assertEquals(new FileUpdate.WholeFile("foo\n"), updateOf(reconciler.reconcile(file)));
    }

    @Test
    void openBufferIsPreferredOverDisk() throws Exception {
        var path = TestFiles.write(root.resolve("a.txt"), "on disk\n", 1_000);
        var file = track(path, FileTypeInfo.text());
        buffers.open(path, List.of("in buffer", "second line"), 1_000);

        assertEquals(new FileUpdate.WholeFile("in buffer\nsecond line"), updateOf(reconciler.reconcile(file)));
        assertEquals(0, buffers.buffer(path).reloads());
    }

    @Test
    void unsavedBufferEditsAreSent() throws Exception {
        var path = TestFiles.write(root.resolve("a.txt"), "one\ntwo\n", 1_000);
        var file = track(path, FileTypeInfo.text());
        buffers.open(path);
        reconciler.reconcile(file);

        buffers.edit(path, List.of("one", "two", "three"));
        var diff = assertInstanceOf(FileUpdate.Diff.class, updateOf(reconciler.reconcile(file)));
        assertEquals(1, diff.patch().added());
        assertEquals(new RemoteView.Text("one\ntwo\nthree"), file.remoteView());
    }

    @Test
    void diskChangeWithUntouchedBufferReloadsBuffer() throws Exception {
        var path = TestFiles.write(root.resolve("a.txt"), "old\n", 1_000);
        var file = track(path, FileTypeInfo.text());
        buffers.open(path);
        reconciler.reconcile(file);

        TestFiles.write(path, "new\n", 5_000);
        var update = updateOf(reconciler.reconcile(file));

        assertEquals(1, buffers.buffer(path).reloads());
        assertInstanceOf(FileUpdate.Diff.class, update);
        assertEquals(new RemoteView.Text("new"), file.remoteView());
    }

    @Test
    void bufferAndDiskBothChangedIsConflict() throws Exception {
        var path = TestFiles.write(root.resolve("a.txt"), "base\n", 1_000);
        var file = track(path, FileTypeInfo.text());
        buffers.open(path);
        reconciler.reconcile(file);
        var viewBefore = file.remoteView();

        buffers.edit(path, List.of("buffer edit"));
        TestFiles.write(path, "disk edit\n", 5_000);

        var error = errorOf(reconciler.reconcile(file));
        assertEquals(SyncErrorKind.CONFLICT, error.kind());
        assertSame(viewBefore, file.remoteView());
        assertTrue(registry.contains(path));
        assertEquals(0, buffers.buffer(path).reloads());

        // the user resolves it by saving the buffer
        buffers.save(path);
        var diff = assertInstanceOf(FileUpdate.Diff.class, updateOf(reconciler.reconcile(file)));
        assertEquals("buffer edit", DiffEngine.apply(diff.patch(), "base"));
    }

    @Test
    void imageIsBase64AndTrackedByMtime() throws Exception {
        var path = TestFiles.writeBytes(root.resolve("img.png"), TestFiles.PNG_HEADER, 1_000);
        var file = track(path, PNG);

        var whole = assertInstanceOf(FileUpdate.WholeFile.class, updateOf(reconciler.reconcile(file)));
        assertArrayEquals(TestFiles.PNG_HEADER, Base64.getDecoder().decode(whole.content()));
        assertEquals(new RemoteView.Binary(1_000), file.remoteView());

        assertSame(SyncOutcome.UNCHANGED, reconciler.reconcile(file));

        TestFiles.touch(path, 2_000);
        assertInstanceOf(FileUpdate.WholeFile.class, updateOf(reconciler.reconcile(file)));
        assertEquals(new RemoteView.Binary(2_000), file.remoteView());
    }

    @Test
    void pdfExtractionFailureLeavesViewAndIsRetried() throws Exception {
        var path = TestFiles.writeBytes(root.resolve("doc.pdf"), "%PDF-1.4\n".getBytes(), 1_000);
        var file = track(path, PDF);

        var error = errorOf(reconciler.reconcile(file));
        assertEquals(SyncErrorKind.EXTRACTION_FAILED, error.kind());
        assertTrue(file.remoteView().isNone());
        assertTrue(registry.contains(path));

        assertEquals(new FileUpdate.WholeFile("pdf text"), updateOf(reconciler.reconcile(file)));
        assertEquals(new RemoteView.Binary(1_000), file.remoteView());
        assertSame(SyncOutcome.UNCHANGED, reconciler.reconcile(file));
        assertEquals(2, extractor.calls());
    }

    @Test
    void uncheckedExtractorFailureIsReportedForThatFileOnly() throws Exception {
        var path = TestFiles.writeBytes(root.resolve("doc.pdf"), "%PDF-1.4\n".getBytes(), 1_000);
        var file = track(path, PDF);
        extractor.crashWith(new IllegalArgumentException("malformed xref"));

        var error = errorOf(reconciler.reconcile(file));
        assertEquals(SyncErrorKind.EXTRACTION_FAILED, error.kind());
        assertTrue(error.message().contains("malformed xref"), error.message());
        assertTrue(file.remoteView().isNone());
    }

    @Test
    void uncheckedBufferFailureBecomesError() throws Exception {
        var path = TestFiles.write(root.resolve("a.txt"), "foo\n", 1_000);
        var broken = new FakeBufferOracle() {
            @Override
            public Optional<BufferSyncInfo> syncInfo(Path absPath) {
                throw new IllegalStateException("editor went away");
            }
        };
        var withBrokenEditor = new Reconciler(registry, disk, broken, extractor, new DiffEngine());
        var file = track(path, FileTypeInfo.text());

        var error = errorOf(withBrokenEditor.reconcile(file));
        assertEquals(SyncErrorKind.IO_ERROR, error.kind());
        assertTrue(error.message().contains("editor went away"), error.message());
        assertTrue(file.remoteView().isNone());
        assertTrue(registry.contains(path));
    }

    @Test
    void binaryStatErrorIsIoError() throws Exception {
        var path = TestFiles.writeBytes(root.resolve("img.png"), TestFiles.PNG_HEADER, 1_000);
        var file = track(path, PNG);
        disk.makeUnreadable(path);

        assertEquals(SyncErrorKind.IO_ERROR, errorOf(reconciler.reconcile(file)).kind());
        assertTrue(file.remoteView().isNone());
    }
}
