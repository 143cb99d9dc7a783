package ai.contextsync.context;

/** An insert or replace could not be applied to the content it targets. */
public class ContentEditException extends Exception {
    public ContentEditException(String message) {
        super(message);
    }
}
