package com.example.jozin;

import java.util.List;

/**
 * Outcome of a cleanup call. In a dry run {@code deletedFiles} lists what would have been removed.
 */
public record CleanupResult(
        List<DeletedFile> deletedFiles,
        int totalFiles,
        long totalBytes,
        int failed
) {
    public static CleanupResult of(List<DeletedFile> deleted, int failed) {
        long bytes = 0L;
        for (DeletedFile file : deleted) {
            bytes += file.sizeBytes();
        }
        return new CleanupResult(List.copyOf(deleted), deleted.size(), bytes, failed);
    }
}
