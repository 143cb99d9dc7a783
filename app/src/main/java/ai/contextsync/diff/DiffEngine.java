package ai.contextsync.diff;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.AbstractDelta;
import com.github.difflib.patch.ChangeDelta;
import com.github.difflib.patch.DeleteDelta;
import com.github.difflib.patch.InsertDelta;
import com.github.difflib.patch.PatchFailedException;
import java.util.Arrays;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Stateless unified-diff producer built on java-diff-utils.
 *
 * <p>Contents that differ only by a trailing newline produce an empty patch. When other lines differ as well, the
 * trailing newline is carried in the patch so that {@link #apply(Patch, String)} reproduces the current content
 * exactly.
 */
public final class DiffEngine {
    private static final Logger logger = LogManager.getLogger(DiffEngine.class);

    public static final int DEFAULT_CONTEXT_LINES = 2;

    private final int contextLines;

    public DiffEngine() {
        this(DEFAULT_CONTEXT_LINES);
    }

    public DiffEngine(int contextLines) {
        if (contextLines < 0) {
            throw new IllegalArgumentException("contextLines must be >= 0, got " + contextLines);
        }
        this.contextLines = contextLines;
    }

    /**
     * Compute the patch that turns {@code previous} into {@code current}.
     *
     * @param previous content the consumer has already seen
     * @param current latest content
     * @param label file label used in the {@code ---}/{@code +++} headers
     * @return the patch, or {@link Patch#EMPTY} if nothing but the trailing newline changed
     */
    public Patch diff(String previous, String current, String label) {
        if (stripTrailingNewline(previous).equals(stripTrailingNewline(current))) {
            return Patch.EMPTY;
        }

        var oldLines = toLines(previous);
        var newLines = toLines(current);
        com.github.difflib.patch.Patch<String> patch = DiffUtils.diff(oldLines, newLines);
        if (patch.getDeltas().isEmpty()) {
            return Patch.EMPTY;
        }

        int added = 0;
        int removed = 0;
        for (AbstractDelta<String> delta : patch.getDeltas()) {
            if (delta instanceof InsertDelta<String> id) {
                added += id.getTarget().size();
            } else if (delta instanceof DeleteDelta<String> dd) {
                removed += dd.getSource().size();
            } else if (delta instanceof ChangeDelta<String> cd) {
                added += cd.getTarget().size();
                removed += cd.getSource().size();
            }
        }

        var diffLines = UnifiedDiffUtils.generateUnifiedDiff(
                "previous/" + label, "current/" + label, oldLines, patch, contextLines);
        var text = String.join("\n", diffLines);

        logger.trace(
                "diff: {} | deltas={} added={} removed={} (oldLines={}, newLines={})",
                label,
                patch.getDeltas().size(),
                added,
                removed,
                oldLines.size(),
                newLines.size());
        return new Patch(text, added, removed);
    }

    /**
     * Reapply a patch produced by {@link #diff} to the content it was computed against.
     *
     * @throws IllegalArgumentException if the patch does not apply to {@code previous}
     */
    public static String apply(Patch patch, String previous) {
        if (patch.isEmpty()) {
            return previous;
        }
        var parsed = UnifiedDiffUtils.parseUnifiedDiff(toLines(patch.text()));
        try {
            return String.join("\n", parsed.applyTo(toLines(previous)));
        } catch (PatchFailedException e) {
            throw new IllegalArgumentException("Patch does not apply to the given content", e);
        }
    }

    private static String stripTrailingNewline(String content) {
        if (content.endsWith("\r\n")) {
            return content.substring(0, content.length() - 2);
        }
        if (content.endsWith("\n") || content.endsWith("\r")) {
            return content.substring(0, content.length() - 1);
        }
        return content;
    }

    // Splits on LF only: a CR stays part of its line, so CRLF and mixed endings survive a diff/apply cycle.
    // The trailing empty element is kept for the same reason.
    private static List<String> toLines(String content) {
        return Arrays.asList(content.split("\n", -1));
    }
}
