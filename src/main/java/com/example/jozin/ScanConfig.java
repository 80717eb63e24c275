package com.example.jozin;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Immutable settings for one scan or cleanup call.
 */
public record ScanConfig(
        Path path,
        boolean recursive,
        Optional<List<String>> include,
        Optional<List<String>> exclude,
        boolean dryRun,
        int threadCount,
        boolean followLinks,
        CleanupOptions cleanup
) {
    private static final int MAX_DEFAULT_THREADS = 8;

    public static ScanConfig defaults(Path path) {
        return new ScanConfig(path, false, Optional.empty(), Optional.empty(), false,
                defaultThreadCount(), false, CleanupOptions.all());
    }

    /**
     * Twice the processor count, capped at 8.
     */
    public static int defaultThreadCount() {
        return Math.min(Runtime.getRuntime().availableProcessors() * 2, MAX_DEFAULT_THREADS);
    }

    public ScanConfig withRecursive(boolean value) {
        return new ScanConfig(path, value, include, exclude, dryRun, threadCount, followLinks, cleanup);
    }

    public ScanConfig withInclude(List<String> patterns) {
        return new ScanConfig(path, recursive, Optional.of(List.copyOf(patterns)), exclude, dryRun, threadCount, followLinks, cleanup);
    }

    public ScanConfig withExclude(List<String> patterns) {
        return new ScanConfig(path, recursive, include, Optional.of(List.copyOf(patterns)), dryRun, threadCount, followLinks, cleanup);
    }

    public ScanConfig withDryRun(boolean value) {
        return new ScanConfig(path, recursive, include, exclude, value, threadCount, followLinks, cleanup);
    }

    public ScanConfig withThreadCount(int value) {
        return new ScanConfig(path, recursive, include, exclude, dryRun, value, followLinks, cleanup);
    }

    public ScanConfig withCleanup(CleanupOptions value) {
        return new ScanConfig(path, recursive, include, exclude, dryRun, threadCount, followLinks, value);
    }
}
