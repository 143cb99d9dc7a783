package ai.contextsync.exception;

/** Base class for unchecked failures raised by the sync engine to its caller. */
public class ContextSyncException extends RuntimeException {
    public ContextSyncException(String message) {
        super(message);
    }

    public ContextSyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
