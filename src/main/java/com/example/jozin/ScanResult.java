package com.example.jozin;

import java.util.List;

/**
 * Aggregate of one scan call. Counters are derived from the per-file outcomes, so
 * {@code totalFiles == successful + failed + skipped} always holds.
 */
public record ScanResult(
        List<ScannedFile> scannedFiles,
        int totalFiles,
        int successful,
        int failed,
        int skipped
) {
    public static ScanResult of(List<ScannedFile> files) {
        int successful = 0;
        int failed = 0;
        int skipped = 0;
        for (ScannedFile file : files) {
            switch (file.action()) {
                case WRITTEN:
                    successful++;
                    break;
                case FAILED:
                    failed++;
                    break;
                default:
                    skipped++;
            }
        }
        return new ScanResult(List.copyOf(files), files.size(), successful, failed, skipped);
    }
}
