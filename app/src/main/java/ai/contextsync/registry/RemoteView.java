package ai.contextsync.registry;

import java.util.Objects;
import java.util.function.Function;

/**
 * The last content (or, for binary files, the last modification time) delivered to the agent for a file.
 *
 * <p>{@link None} is an explicit value: a file whose view is {@code None} has never been shown to the agent.
 */
public sealed interface RemoteView permits RemoteView.None, RemoteView.Text, RemoteView.Binary {

    None NONE = new None();

    /**
     * Exhaustive case analysis. Adding a variant breaks every caller at compile time.
     */
    <R> R fold(Function<None, R> onNone, Function<Text, R> onText, Function<Binary, R> onBinary);

    default boolean isNone() {
        return fold(none -> true, text -> false, binary -> false);
    }

    record None() implements RemoteView {
        @Override
        public <R> R fold(Function<None, R> onNone, Function<Text, R> onText, Function<Binary, R> onBinary) {
            return onNone.apply(this);
        }
    }

    record Text(String content) implements RemoteView {
        public Text {
            Objects.requireNonNull(content, "content");
        }

        @Override
        public <R> R fold(Function<None, R> onNone, Function<Text, R> onText, Function<Binary, R> onBinary) {
            return onText.apply(this);
        }

        @Override
        public String toString() {
            return "Text[" + content.length() + " chars]";
        }
    }

    record Binary(long mtime) implements RemoteView {
        @Override
        public <R> R fold(Function<None, R> onNone, Function<Text, R> onText, Function<Binary, R> onBinary) {
            return onBinary.apply(this);
        }
    }
}
