package ai.contextsync.sync;

import java.util.Objects;
import java.util.function.Function;

/** Result of reconciling one file. */
public sealed interface SyncOutcome permits SyncOutcome.Updated, SyncOutcome.Unchanged, SyncOutcome.Error {

    Unchanged UNCHANGED = new Unchanged();

    <R> R fold(Function<Updated, R> onUpdated, Function<Unchanged, R> onUnchanged, Function<Error, R> onError);

    static Updated updated(FileUpdate update) {
        return new Updated(update);
    }

    static Error error(SyncErrorKind kind, String message) {
        return new Error(kind, message);
    }

    record Updated(FileUpdate update) implements SyncOutcome {
        public Updated {
            Objects.requireNonNull(update, "update");
        }

        @Override
        public <R> R fold(
                Function<Updated, R> onUpdated, Function<Unchanged, R> onUnchanged, Function<Error, R> onError) {
            return onUpdated.apply(this);
        }
    }

    record Unchanged() implements SyncOutcome {
        @Override
        public <R> R fold(
                Function<Updated, R> onUpdated, Function<Unchanged, R> onUnchanged, Function<Error, R> onError) {
            return onUnchanged.apply(this);
        }
    }

    record Error(SyncErrorKind kind, String message) implements SyncOutcome {
        public Error {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(message, "message");
        }

        @Override
        public <R> R fold(
                Function<Updated, R> onUpdated, Function<Unchanged, R> onUnchanged, Function<Error, R> onError) {
            return onError.apply(this);
        }
    }
}
