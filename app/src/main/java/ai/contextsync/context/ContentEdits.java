package ai.contextsync.context;

/** Text edits mirroring the agent's insert and replace tools. */
public final class ContentEdits {

    private ContentEdits() {}

    /**
     * Insert {@code text} right after the first occurrence of {@code insertAfter}. An empty anchor inserts at the start
     * of the content.
     */
    public static String applyInsert(String content, String insertAfter, String text) throws ContentEditException {
        if (insertAfter.isEmpty()) {
            return text + content;
        }
        int idx = content.indexOf(insertAfter);
        if (idx < 0) {
            throw new ContentEditException("Unable to find insert location \"" + abbreviate(insertAfter) + "\"");
        }
        int at = idx + insertAfter.length();
        return content.substring(0, at) + text + content.substring(at);
    }

    /**
     * Replace the first occurrence of {@code find} with {@code replace}. An empty {@code find} only matches empty
     * content.
     */
    public static String applyReplace(String content, String find, String replace) throws ContentEditException {
        if (find.isEmpty()) {
            if (content.isEmpty()) {
                return replace;
            }
            throw new ContentEditException("Cannot replace an empty string in non-empty content");
        }
        int idx = content.indexOf(find);
        if (idx < 0) {
            throw new ContentEditException("Unable to find text \"" + abbreviate(find) + "\"");
        }
        return content.substring(0, idx) + replace + content.substring(idx + find.length());
    }

    private static String abbreviate(String s) {
        return s.length() <= 80 ? s : s.substring(0, 77) + "...";
    }
}
