package com.example.jozin;

/**
 * Which generated file types a cleanup removes.
 */
public record CleanupOptions(
        boolean sidecars,
        boolean backups,
        boolean temporaries,
        boolean cache
) {
    public static CleanupOptions all() {
        return new CleanupOptions(true, true, true, true);
    }

    public static CleanupOptions sidecarsOnly() {
        return new CleanupOptions(true, false, false, false);
    }

    public static CleanupOptions backupsOnly() {
        return new CleanupOptions(false, true, false, false);
    }

    public static CleanupOptions temporariesOnly() {
        return new CleanupOptions(false, false, true, false);
    }

    public static CleanupOptions cacheOnly() {
        return new CleanupOptions(false, false, false, true);
    }

    public boolean includes(GeneratedFileType type) {
        switch (type) {
            case SIDECAR:
                return sidecars;
            case BACKUP:
                return backups;
            case TEMPORARY:
                return temporaries;
            default:
                return cache;
        }
    }
}
