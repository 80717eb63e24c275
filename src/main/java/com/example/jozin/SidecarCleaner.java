package com.example.jozin;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

/**
 * Removes sidecars, backups, interrupted-write temporaries and cache directories. Originals are
 * never touched.
 */
public final class SidecarCleaner {
    private static final Logger LOGGER = LoggerFactory.getLogger(SidecarCleaner.class);

    public CleanupResult cleanup(ScanConfig config, ProgressListener listener) throws ScanException {
        return cleanup(config.path(), config.recursive(), config.cleanup(), config.dryRun(), listener);
    }

    /**
     * Cleans a single file or a directory. For a photo, its own generated siblings are removed;
     * for a generated file, that file. Deletion failures are counted and do not stop the run.
     */
    public CleanupResult cleanup(Path path,
                                 boolean recursive,
                                 CleanupOptions options,
                                 boolean dryRun,
                                 ProgressListener listener) throws ScanException {
        if (!Files.exists(path, LinkOption.NOFOLLOW_LINKS)) {
            throw ScanException.io("Path not found: " + path);
        }
        List<DeletedFile> targets;
        if (Files.isRegularFile(path, LinkOption.NOFOLLOW_LINKS)) {
            targets = targetsForFile(path, options);
        } else if (Files.isDirectory(path)) {
            targets = targetsInDirectory(DirectoryWalker.resolveRoot(path), recursive, options);
        } else {
            throw ScanException.validation("Path is neither a file nor a directory: " + path);
        }

        List<DeletedFile> deleted = new ArrayList<>(targets.size());
        int failed = 0;
        for (DeletedFile target : targets) {
            listener.onEvent(ProgressEvent.started(target.path()));
            try {
                if (!dryRun) {
                    delete(Path.of(target.path()), target.type());
                }
                deleted.add(target);
                listener.onEvent(ProgressEvent.succeeded(target.path(), target.sizeBytes()));
            } catch (IOException ex) {
                failed++;
                ScanException failure = ScanException.io("Failed to delete " + target.path(), ex);
                LOGGER.warn(failure.describe());
                listener.onEvent(ProgressEvent.failed(target.path(), failure.describe()));
            }
        }
        LOGGER.info("Cleanup of {} finished: {} removed{}, {} failed",
                path, deleted.size(), dryRun ? " (dry run)" : "", failed);
        return CleanupResult.of(deleted, failed);
    }

    private List<DeletedFile> targetsForFile(Path file, CleanupOptions options) throws ScanException {
        Optional<GeneratedFileType> type = GeneratedFileType.classify(file);
        if (type.isPresent()) {
            List<DeletedFile> targets = new ArrayList<>();
            if (options.includes(type.get())) {
                targets.add(new DeletedFile(file.toString(), type.get(), sizeOf(file)));
            }
            return targets;
        }
        if (!ImageClassifier.isSupported(file)) {
            throw ScanException.validation("Not an image or generated file: " + file);
        }
        List<Path> siblings = new ArrayList<>();
        siblings.add(SidecarPaths.sidecarFor(file));
        siblings.add(SidecarPaths.temporaryFor(file));
        for (int generation = 1; generation <= SidecarPaths.BACKUP_DEPTH; generation++) {
            siblings.add(SidecarPaths.backupFor(file, generation));
            siblings.add(SidecarPaths.stagedBackupFor(file, generation));
        }
        List<DeletedFile> targets = new ArrayList<>();
        for (Path sibling : siblings) {
            if (Files.isRegularFile(sibling, LinkOption.NOFOLLOW_LINKS)) {
                GeneratedFileType siblingType = GeneratedFileType.classify(sibling).orElseThrow();
                if (options.includes(siblingType)) {
                    targets.add(new DeletedFile(sibling.toString(), siblingType, sizeOf(sibling)));
                }
            }
        }
        return targets;
    }

    private List<DeletedFile> targetsInDirectory(Path root, boolean recursive, CleanupOptions options) throws ScanException {
        List<DeletedFile> targets = new ArrayList<>();
        int maxDepth = recursive ? Integer.MAX_VALUE : 1;
        try {
            Files.walkFileTree(root, EnumSet.noneOf(FileVisitOption.class), maxDepth, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(root) && isCacheDirectory(dir)) {
                        if (options.cache()) {
                            targets.add(new DeletedFile(dir.toString(), GeneratedFileType.CACHE, treeSize(dir)));
                        }
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isDirectory()) {
                        if (isCacheDirectory(file) && options.cache()) {
                            targets.add(new DeletedFile(file.toString(), GeneratedFileType.CACHE, treeSize(file)));
                        }
                        return FileVisitResult.CONTINUE;
                    }
                    if (attrs.isRegularFile()) {
                        GeneratedFileType.classify(file)
                                .filter(options::includes)
                                .ifPresent(type -> targets.add(new DeletedFile(file.toString(), type, attrs.size())));
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    LOGGER.warn("Failed to access {}", file, exc);
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException ex) {
            throw ScanException.io("Failed to walk " + root, ex);
        }
        return targets;
    }

    private static boolean isCacheDirectory(Path dir) {
        Path name = dir.getFileName();
        return name != null && GeneratedFileType.CACHE_DIRECTORY.equals(name.toString());
    }

    private static void delete(Path path, GeneratedFileType type) throws IOException {
        if (type != GeneratedFileType.CACHE) {
            Files.deleteIfExists(path);
            return;
        }
        Files.walkFileTree(path, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.delete(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                if (exc != null) {
                    throw exc;
                }
                Files.delete(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    private static long sizeOf(Path file) throws ScanException {
        try {
            return Files.size(file);
        } catch (IOException ex) {
            throw ScanException.io("Failed to read size of " + file, ex);
        }
    }

    private static long treeSize(Path dir) {
        long[] total = {0L};
        try {
            Files.walkFileTree(dir, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    total[0] += attrs.size();
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException ex) {
            LOGGER.warn("Failed to measure {}", dir, ex);
        }
        return total[0];
    }
}
