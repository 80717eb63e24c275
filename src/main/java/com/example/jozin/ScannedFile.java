package com.example.jozin;

/**
 * Outcome for one file in a scan.
 *
 * <p>{@code sidecarPath} is set only for {@link ScanAction#WRITTEN}, {@code error} only for
 * {@link ScanAction#FAILED} and {@code reason} only for {@link ScanAction#SKIPPED}. {@code hash}
 * and {@code sizeBytes} are set whenever the file was actually read.
 */
public record ScannedFile(
        String path,
        ScanAction action,
        String sidecarPath,
        String reason,
        String error,
        String hash,
        Long sizeBytes
) {
    public static final String DRY_RUN = "dry run";

    public static ScannedFile written(String path, String sidecarPath, String hash, long sizeBytes) {
        return new ScannedFile(path, ScanAction.WRITTEN, sidecarPath, null, null, hash, sizeBytes);
    }

    public static ScannedFile dryRun(String path, String hash, long sizeBytes) {
        return new ScannedFile(path, ScanAction.SKIPPED, null, DRY_RUN, null, hash, sizeBytes);
    }

    public static ScannedFile skipped(String path, String reason) {
        return new ScannedFile(path, ScanAction.SKIPPED, null, reason, null, null, null);
    }

    public static ScannedFile failed(String path, String error) {
        return new ScannedFile(path, ScanAction.FAILED, null, null, error, null, null);
    }
}
