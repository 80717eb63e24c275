package com.example.jozin;

import java.nio.file.Path;

/**
 * A file found by {@link DirectoryWalker}: either a scan candidate or skipped with a reason.
 */
public record WalkEntry(
        Path path,
        String skipReason
) {
    public static WalkEntry candidate(Path path) {
        return new WalkEntry(path, null);
    }

    public static WalkEntry skipped(Path path, String reason) {
        return new WalkEntry(path, reason);
    }

    public boolean isCandidate() {
        return skipReason == null;
    }
}
