package ai.contextsync.context;

import java.util.Objects;
import java.util.function.Function;

/** What a tool did to a file, from the point of view of what the agent now believes the file contains. */
public sealed interface ToolApplication
        permits ToolApplication.GetFile, ToolApplication.GetFileBinary, ToolApplication.Insert, ToolApplication.Replace {

    <R> R fold(
            Function<GetFile, R> onGetFile,
            Function<GetFileBinary, R> onGetFileBinary,
            Function<Insert, R> onInsert,
            Function<Replace, R> onReplace);

    /** Short name used in error messages. */
    String name();

    /** The agent was shown the full text content. */
    record GetFile(String content) implements ToolApplication {
        public GetFile {
            Objects.requireNonNull(content, "content");
        }

        @Override
        public <R> R fold(
                Function<GetFile, R> onGetFile,
                Function<GetFileBinary, R> onGetFileBinary,
                Function<Insert, R> onInsert,
                Function<Replace, R> onReplace) {
            return onGetFile.apply(this);
        }

        @Override
        public String name() {
            return "get-file";
        }
    }

    /** The agent was shown a binary file as it was at {@code mtime}. */
    record GetFileBinary(long mtime) implements ToolApplication {
        @Override
        public <R> R fold(
                Function<GetFile, R> onGetFile,
                Function<GetFileBinary, R> onGetFileBinary,
                Function<Insert, R> onInsert,
                Function<Replace, R> onReplace) {
            return onGetFileBinary.apply(this);
        }

        @Override
        public String name() {
            return "get-file-binary";
        }
    }

    /** The agent inserted {@code content} after the first occurrence of {@code insertAfter}. */
    record Insert(String insertAfter, String content) implements ToolApplication {
        public Insert {
            Objects.requireNonNull(insertAfter, "insertAfter");
            Objects.requireNonNull(content, "content");
        }

        @Override
        public <R> R fold(
                Function<GetFile, R> onGetFile,
                Function<GetFileBinary, R> onGetFileBinary,
                Function<Insert, R> onInsert,
                Function<Replace, R> onReplace) {
            return onInsert.apply(this);
        }

        @Override
        public String name() {
            return "insert";
        }
    }

    /** The agent replaced the first occurrence of {@code find} with {@code replace}. */
    record Replace(String find, String replace) implements ToolApplication {
        public Replace {
            Objects.requireNonNull(find, "find");
            Objects.requireNonNull(replace, "replace");
        }

        @Override
        public <R> R fold(
                Function<GetFile, R> onGetFile,
                Function<GetFileBinary, R> onGetFileBinary,
                Function<Insert, R> onInsert,
                Function<Replace, R> onReplace) {
            return onReplace.apply(this);
        }

        @Override
        public String name() {
            return "replace";
        }
    }
}
