package ai.contextsync.sync;

import ai.contextsync.diff.Patch;
import java.util.Objects;
import java.util.function.Function;

/** An update that brings the agent's view of one file up to date. */
public sealed interface FileUpdate permits FileUpdate.WholeFile, FileUpdate.Diff, FileUpdate.Deleted {

    <R> R fold(Function<WholeFile, R> onWholeFile, Function<Diff, R> onDiff, Function<Deleted, R> onDeleted);

    /**
     * Full content. For text and PDF files this is text; for images it is the Base64 encoding of the raw bytes.
     */
    record WholeFile(String content) implements FileUpdate {
        public WholeFile {
            Objects.requireNonNull(content, "content");
        }

        @Override
        public <R> R fold(
                Function<WholeFile, R> onWholeFile, Function<Diff, R> onDiff, Function<Deleted, R> onDeleted) {
            return onWholeFile.apply(this);
        }

        @Override
        public String toString() {
            return "WholeFile[" + content.length() + " chars]";
        }
    }

    record Diff(Patch patch) implements FileUpdate {
        public Diff {
            Objects.requireNonNull(patch, "patch");
        }

        @Override
        public <R> R fold(
                Function<WholeFile, R> onWholeFile, Function<Diff, R> onDiff, Function<Deleted, R> onDeleted) {
            return onDiff.apply(this);
        }
    }

    record Deleted() implements FileUpdate {
        @Override
        public <R> R fold(
                Function<WholeFile, R> onWholeFile, Function<Diff, R> onDiff, Function<Deleted, R> onDeleted) {
            return onDeleted.apply(this);
        }
    }
}
