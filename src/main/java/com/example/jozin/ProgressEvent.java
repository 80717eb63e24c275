package com.example.jozin;

/**
 * Per-file progress notification. Every {@link Type#STARTED} event for a path is followed by
 * exactly one {@link Type#COMPLETED} event for the same path.
 */
public record ProgressEvent(
        Type type,
        String path,
        boolean success,
        String error,
        Long sizeBytes
) {
    public enum Type {
        STARTED,
        COMPLETED
    }

    public static ProgressEvent started(String path) {
        return new ProgressEvent(Type.STARTED, path, false, null, null);
    }

    public static ProgressEvent succeeded(String path, long sizeBytes) {
        return new ProgressEvent(Type.COMPLETED, path, true, null, sizeBytes);
    }

    public static ProgressEvent failed(String path, String error) {
        return new ProgressEvent(Type.COMPLETED, path, false, error, null);
    }
}
