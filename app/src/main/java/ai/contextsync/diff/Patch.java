package ai.contextsync.diff;

/**
 * A unified diff between two snapshots of a file, plus line counts for display.
 *
 * <p>The counts are derived from the diff deltas and are not authoritative; consumers must apply {@link #text()}.
 */
public record Patch(String text, int added, int removed) {
    public static final Patch EMPTY = new Patch("", 0, 0);

    public boolean isEmpty() {
        return text.isEmpty();
    }

    /** Display form such as {@code [ +3 / -1 ]}. */
    public String summary() {
        return "[ +%d / -%d ]".formatted(added, removed);
    }

    @Override
    public String toString() {
        return text;
    }
}
