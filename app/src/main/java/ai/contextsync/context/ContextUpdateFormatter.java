package ai.contextsync.context;

import ai.contextsync.sync.FileSyncResult;
import ai.contextsync.sync.FileUpdate;
import ai.contextsync.sync.SyncOutcome;
import ai.contextsync.sync.SyncReport;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns a {@link SyncReport} into what the user sees (a one-line-per-file summary) and what the agent receives
 * (message content blocks). Unchanged files are omitted from both.
 */
public final class ContextUpdateFormatter {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String PREAMBLE =
            """
            These files are part of your context. This is the latest information about the content of each file.
            From now on, whenever any of these files are updated by the user, you will get a message letting you know.
            """;

    private ContextUpdateFormatter() {}

    /**
     * Summary for display, e.g. {@code - `src/a.txt` [ +2 / -1 ]}.
     *
     * @return the summary, or the empty string if nothing changed
     */
    public static String summarize(SyncReport report) {
        var updates = report.updates();
        if (updates.isEmpty()) {
            return "";
        }

        var sb = new StringBuilder("Context Updates:\n");
        for (var result : updates) {
            String line = result.outcome().fold(
                    updated -> "- `%s` %s".formatted(result.relPath(), changeIndicator(updated.update())),
                    unchanged -> "- `%s` [ unchanged ]".formatted(result.relPath()),
                    error -> "- `%s` [Error: %s]".formatted(result.absPath(), error.message()));
            sb.append(line).append('\n');
        }
        return sb.append('\n').toString();
    }

    static String changeIndicator(FileUpdate update) {
        return update.fold(
                whole -> "[ +%d ]".formatted(countNewlines(whole.content()) + 1),
                diff -> diff.patch().summary(),
                deleted -> "[ deleted ]");
    }

    /**
     * Content blocks for the agent: a single text block listing every changed file, followed by one image block per
     * updated image.
     */
    public static List<MessageContent> toMessageContent(SyncReport report) {
        var images = new ArrayList<MessageContent>();
        var textUpdates = new ArrayList<String>();

        for (var result : report.updates()) {
            var rel = result.relPath();
            String text = result.outcome().fold(
                    updated -> describeUpdate(result, updated.update(), images),
                    unchanged -> "- `%s`\nFile unchanged.".formatted(rel),
                    error -> "- `%s`\nError fetching update: %s".formatted(rel, error.message()));
            textUpdates.add(text);
        }

        var content = new ArrayList<MessageContent>();
        if (!textUpdates.isEmpty()) {
            content.add(new MessageContent.Text(PREAMBLE + String.join("\n", textUpdates)));
        }
        content.addAll(images);
        return List.copyOf(content);
    }

    private static String describeUpdate(FileSyncResult result, FileUpdate update, List<MessageContent> images) {
        var rel = result.relPath();
        return update.fold(
                whole -> switch (result.typeInfo().category()) {
                    case TEXT, PDF -> "- `%s`\n```\n%s\n```".formatted(rel, whole.content());
                    case IMAGE -> {
                        images.add(MessageContent.Image.base64(result.typeInfo().mimeType(), whole.content()));
                        yield "- `%s`\nImage file updated (see attached image).".formatted(rel);
                    }
                    case UNSUPPORTED -> "- `%s`\nFile content updated.".formatted(rel);
                },
                diff -> "- `%s`\n```diff\n%s\n```".formatted(rel, diff.patch().text()),
                deleted -> "- `%s`\nThis file has been deleted and removed from context.".formatted(rel));
    }

    /** Serializes content blocks to the JSON array shape used on the wire. */
    public static String toJson(List<MessageContent> content) {
        try {
            return MAPPER.writerFor(new TypeReference<List<MessageContent>>() {}).writeValueAsString(content);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static int countNewlines(String s) {
        int n = 0;
        for (int i = 0; i < s.length(); i++) {
            if (s.charAt(i) == '\n') n++;
        }
        return n;
    }
}
