package ai.contextsync;

import ai.contextsync.api.ContentClassifier;
import ai.contextsync.api.FileTypeInfo;
import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Expands the configured auto-context glob patterns into files to track at startup.
 *
 * <p>Matching is case-insensitive and relative to the working directory. Directories, dot-files and anything under a
 * dot-directory are never matched, and dot-directories are not descended into. A pattern whose first segment is a
 * double star also matches top-level files. Symlinks are followed; files reachable through several patterns or links
 * are returned once. Directories that cannot be read are skipped. Unsupported files are skipped with a
 * warning rather than failing the whole load.
 */
public final class AutoContextLoader {
    private static final Logger logger = LogManager.getLogger(AutoContextLoader.class);

    public record Candidate(Path absPath, Path relPath, FileTypeInfo typeInfo) {}

    private final Path cwd;
    private final ContentClassifier classifier;

    public AutoContextLoader(Path cwd, ContentClassifier classifier) {
        this.cwd = cwd.toAbsolutePath().normalize();
        this.classifier = classifier;
    }

    public List<Candidate> load(List<String> globPatterns) {
        if (globPatterns.isEmpty()) {
            return List.of();
        }

        var matched = findFiles(globPatterns);
        var supported = new ArrayList<Candidate>();
        for (var absPath : matched) {
            var relPath = cwd.relativize(absPath);
            try {
                var typeInfo = classifier.classify(absPath);
                if (typeInfo.isSupported()) {
                    supported.add(new Candidate(absPath, relPath, typeInfo));
                } else {
                    logger.warn(
                            "Skipping {} from auto-context: {} files are not supported in context (detected MIME type: {})",
                            relPath,
                            typeInfo.category(),
                            typeInfo.mimeType());
                }
            } catch (IOException e) {
                logger.error(
                        "Failed to detect file type for {} during auto-context loading: {}", relPath, e.getMessage());
            }
        }
        logger.debug("Auto-context matched {} files, {} supported", matched.size(), supported.size());
        return supported;
    }

    List<Path> findFiles(List<String> globPatterns) {
        var matchers = new ArrayList<PathMatcher>();
        for (var pattern : globPatterns) {
            try {
                var glob = pattern.toLowerCase(Locale.ROOT);
                matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + glob));
                if (glob.startsWith("**/")) {
                    matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + glob.substring(3)));
                }
            } catch (IllegalArgumentException e) {
                logger.error("Error processing glob pattern \"{}\": {}", pattern, e.getMessage());
            }
        }
        if (matchers.isEmpty()) {
            return List.of();
        }

        var matched = new ArrayList<Path>();
        var options = EnumSet.of(FileVisitOption.FOLLOW_LINKS);
        try {
            Files.walkFileTree(cwd, options, Integer.MAX_VALUE, new SimpleFileVisitor<Path>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(cwd) && isHidden(dir.getFileName())) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (!attrs.isRegularFile() || isHidden(file.getFileName())) {
                        return FileVisitResult.CONTINUE;
                    }
                    var lowered = Path.of(cwd.relativize(file).toString().toLowerCase(Locale.ROOT));
                    if (matchers.stream().anyMatch(m -> m.matches(lowered))) {
                        matched.add(file.normalize());
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException e) {
                    logger.warn("Skipping {} during auto-context loading: {}", cwd.relativize(file), e.toString());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            logger.error("Error walking {} for auto-context: {}", cwd, e.getMessage());
        }

        Collections.sort(matched);
        // keyed by canonical path so symlinks and case-insensitive filesystems don't produce duplicates
        var unique = new LinkedHashMap<Path, Path>();
        for (var p : matched) {
            unique.putIfAbsent(canonical(p), p);
        }
        return List.copyOf(unique.values());
    }

    private static boolean isHidden(Path name) {
        return name.toString().startsWith(".");
    }

    private static Path canonical(Path p) {
        try {
            return p.toRealPath();
        } catch (IOException e) {
            return p.toAbsolutePath().normalize();
        }
    }
}
