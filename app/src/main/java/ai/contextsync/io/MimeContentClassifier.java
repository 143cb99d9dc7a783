package ai.contextsync.io;

import ai.contextsync.api.ContentClassifier;
import ai.contextsync.api.FileCategory;
import ai.contextsync.api.FileTypeInfo;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Classifies files by their leading bytes, then by extension, then by a NUL-byte heuristic.
 *
 * <p>Only the image formats the agent accepts (PNG, JPEG, GIF, WebP) count as {@link FileCategory#IMAGE}; other
 * binary content is {@link FileCategory#UNSUPPORTED}.
 */
public final class MimeContentClassifier implements ContentClassifier {
    private static final Logger logger = LogManager.getLogger(MimeContentClassifier.class);

    private static final int SNIFF_BYTES = 8192;

    private static final Map<String, String> TEXT_EXTENSIONS = Map.ofEntries(
            Map.entry("txt", "text/plain"),
            Map.entry("md", "text/markdown"),
            Map.entry("java", "text/x-java"),
            Map.entry("kt", "text/x-kotlin"),
            Map.entry("py", "text/x-python"),
            Map.entry("js", "text/javascript"),
            Map.entry("ts", "text/typescript"),
            Map.entry("json", "application/json"),
            Map.entry("xml", "application/xml"),
            Map.entry("yaml", "application/yaml"),
            Map.entry("yml", "application/yaml"),
            Map.entry("html", "text/html"),
            Map.entry("css", "text/css"),
            Map.entry("csv", "text/csv"),
            Map.entry("lua", "text/x-lua"),
            Map.entry("sh", "application/x-sh"),
            Map.entry("properties", "text/x-java-properties"));

    @Override
    public FileTypeInfo classify(Path absPath) throws IOException {
        byte[] head = readHead(absPath);

        var sniffed = sniff(head);
        if (sniffed != null) {
            logger.trace("Classified {} as {} by content", absPath, sniffed);
            return sniffed;
        }

        var ext = extension(absPath);
        var textMime = TEXT_EXTENSIONS.get(ext);
        if (textMime != null) {
            return new FileTypeInfo(FileCategory.TEXT, textMime);
        }

        var probed = Files.probeContentType(absPath);
        if (isBinary(head)) {
            return new FileTypeInfo(FileCategory.UNSUPPORTED, probed != null ? probed : "application/octet-stream");
        }
        return new FileTypeInfo(FileCategory.TEXT, probed != null && probed.startsWith("text/") ? probed : "text/plain");
    }

    private static byte[] readHead(Path absPath) throws IOException {
        try (InputStream in = Files.newInputStream(absPath)) {
            return in.readNBytes(SNIFF_BYTES);
        }
    }

    private static @Nullable FileTypeInfo sniff(byte[] head) {
        if (startsWith(head, new byte[] {(byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1A, '\n'})) {
            return new FileTypeInfo(FileCategory.IMAGE, "image/png");
        }
        if (startsWith(head, new byte[] {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF})) {
            return new FileTypeInfo(FileCategory.IMAGE, "image/jpeg");
        }
        if (startsWith(head, "GIF87a".getBytes(StandardCharsets.US_ASCII))
                || startsWith(head, "GIF89a".getBytes(StandardCharsets.US_ASCII))) {
            return new FileTypeInfo(FileCategory.IMAGE, "image/gif");
        }
        if (head.length >= 12
                && startsWith(head, "RIFF".getBytes(StandardCharsets.US_ASCII))
                && Arrays.equals(Arrays.copyOfRange(head, 8, 12), "WEBP".getBytes(StandardCharsets.US_ASCII))) {
            return new FileTypeInfo(FileCategory.IMAGE, "image/webp");
        }
        if (startsWith(head, "%PDF-".getBytes(StandardCharsets.US_ASCII))) {
            return new FileTypeInfo(FileCategory.PDF, "application/pdf");
        }
        return null;
    }

    /** Heuristic binary detection: presence of NUL within the first few KB. */
    static boolean isBinary(byte[] head) {
        for (byte b : head) {
            if (b == 0) return true;
        }
        return false;
    }

    private static boolean startsWith(byte[] data, byte[] prefix) {
        if (data.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (data[i] != prefix[i]) return false;
        }
        return true;
    }

    private static String extension(Path path) {
        var filename = path.getFileName().toString();
        int lastDot = filename.lastIndexOf('.');
        if (lastDot > 0 && lastDot < filename.length() - 1) {
            return filename.substring(lastDot + 1).toLowerCase(Locale.ROOT);
        }
        return "";
    }
}
