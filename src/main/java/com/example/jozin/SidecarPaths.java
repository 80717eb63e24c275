package com.example.jozin;

import java.nio.file.Path;

/**
 * Derives sidecar, backup and temporary file locations from the original file's path.
 */
public final class SidecarPaths {
    public static final String SIDECAR_SUFFIX = ".json";
    public static final String TEMPORARY_SUFFIX = ".tmp";
    public static final String BACKUP_SUFFIX = ".bak";
    public static final int BACKUP_DEPTH = 3;

    private SidecarPaths() {
    }

    public static Path sidecarFor(Path original) {
        return sibling(original, SIDECAR_SUFFIX);
    }

    public static Path temporaryFor(Path original) {
        return sibling(original, SIDECAR_SUFFIX + TEMPORARY_SUFFIX);
    }

    /**
     * Backup of the given generation, 1 being the most recent.
     */
    public static Path backupFor(Path original, int generation) {
        if (generation < 1 || generation > BACKUP_DEPTH) {
            throw new IllegalArgumentException("Backup generation out of range: " + generation);
        }
        return sibling(original, SIDECAR_SUFFIX + BACKUP_SUFFIX + generation);
    }

    static Path stagedBackupFor(Path original, int generation) {
        Path backup = backupFor(original, generation);
        return backup.resolveSibling(backup.getFileName() + TEMPORARY_SUFFIX);
    }

    private static Path sibling(Path original, String suffix) {
        Path fileName = original.getFileName();
        if (fileName == null) {
            throw new IllegalArgumentException("Path has no file name: " + original);
        }
        return original.resolveSibling(fileName + suffix);
    }
}
