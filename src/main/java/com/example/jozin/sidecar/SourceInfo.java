package com.example.jozin.sidecar;

import java.time.Instant;

/**
 * Facts about the original file, read from the filesystem at scan time.
 */
public record SourceInfo(
        String filePath,
        long fileSizeBytes,
        String fileHash,
        Instant fileModifiedAt
) {
}
