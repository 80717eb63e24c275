package com.example.jozin;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Lists the files under a root and classifies each one as a scan candidate or a skip.
 *
 * <p>Checks run in a fixed order and stop at the first hit: exclude patterns, include patterns,
 * then the supported-extension check. Patterns are tried against the path relative to the root
 * and against the absolute path. Entries that cannot be read are logged and left out.
 */
public final class DirectoryWalker {
    public static final String EXCLUDED_BY_PATTERN = "excluded by pattern";
    public static final String NOT_INCLUDED_BY_PATTERN = "not included by pattern";
    public static final String UNSUPPORTED_EXTENSION = "unsupported extension";

    private static final Logger LOGGER = LoggerFactory.getLogger(DirectoryWalker.class);

    private final boolean followLinks;

    public DirectoryWalker(boolean followLinks) {
        this.followLinks = followLinks;
    }

    /**
     * Walks {@code root} (direct children only unless {@code recursive}) and returns its files in
     * listing order. Directories are never returned. A symbolic link given as the root is always
     * resolved; {@code followLinks} governs links found below it.
     */
    public List<WalkEntry> walk(Path start,
                                boolean recursive,
                                Optional<PatternMatcher> include,
                                Optional<PatternMatcher> exclude) throws ScanException {
        Path root = resolveRoot(start);
        List<WalkEntry> entries = new ArrayList<>();
        Set<FileVisitOption> options = followLinks
                ? EnumSet.of(FileVisitOption.FOLLOW_LINKS)
                : EnumSet.noneOf(FileVisitOption.class);
        int maxDepth = recursive ? Integer.MAX_VALUE : 1;

        try {
            Files.walkFileTree(root, options, maxDepth, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isDirectory()) {
                        // depth limit reached; subdirectories show up here when not recursing
                        return FileVisitResult.CONTINUE;
                    }
                    if (!attrs.isRegularFile()) {
                        LOGGER.debug("Skipping non-regular entry {}", file);
                        return FileVisitResult.CONTINUE;
                    }
                    entries.add(classify(root, file, include, exclude));
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    LOGGER.warn("Failed to access {}", file, exc);
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult postVisitDirectory(Path dir, IOException exc) {
                    if (exc != null) {
                        LOGGER.warn("Failed to list directory {}", dir, exc);
                    }
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException ex) {
            throw ScanException.io("Failed to walk " + root, ex);
        }
        return entries;
    }

    static Path resolveRoot(Path root) throws ScanException {
        if (!Files.isSymbolicLink(root)) {
            return root;
        }
        try {
            return root.toRealPath();
        } catch (IOException ex) {
            throw ScanException.io("Failed to resolve " + root, ex);
        }
    }

    private WalkEntry classify(Path root,
                               Path file,
                               Optional<PatternMatcher> include,
                               Optional<PatternMatcher> exclude) {
        Path relative = root.relativize(file);
        Path absolute = file.toAbsolutePath().normalize();
        if (exclude.isPresent() && matches(exclude.get(), relative, absolute)) {
            LOGGER.debug("{} excluded by pattern", file);
            return WalkEntry.skipped(file, EXCLUDED_BY_PATTERN);
        }
        if (include.isPresent() && !matches(include.get(), relative, absolute)) {
            LOGGER.debug("{} not included by pattern", file);
            return WalkEntry.skipped(file, NOT_INCLUDED_BY_PATTERN);
        }
        if (!ImageClassifier.isSupported(file)) {
            LOGGER.debug("{} has an unsupported extension", file);
            return WalkEntry.skipped(file, UNSUPPORTED_EXTENSION);
        }
        return WalkEntry.candidate(file);
    }

    private static boolean matches(PatternMatcher matcher, Path relative, Path absolute) {
        return matcher.matches(relative) || matcher.matches(absolute);
    }
}
