package com.example.jozin;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileSystemException;
import java.nio.file.NoSuchFileException;

public class ScanException extends Exception {
    private final ErrorKind kind;

    public ScanException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ScanException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static ScanException user(String message) {
        return new ScanException(ErrorKind.USER, message);
    }

    public static ScanException io(String message) {
        return new ScanException(ErrorKind.IO, message);
    }

    /**
     * Wraps a filesystem failure, appending a short reason derived from the exception type.
     */
    public static ScanException io(String context, IOException cause) {
        return new ScanException(ErrorKind.IO, context + ": " + reason(cause), cause);
    }

    public static ScanException validation(String message) {
        return new ScanException(ErrorKind.VALIDATION, message);
    }

    public static ScanException validation(String message, Throwable cause) {
        return new ScanException(ErrorKind.VALIDATION, message, cause);
    }

    public static ScanException internal(String message, Throwable cause) {
        return new ScanException(ErrorKind.INTERNAL, message, cause);
    }

    public ErrorKind kind() {
        return kind;
    }

    public int exitCode() {
        return kind.exitCode();
    }

    /**
     * Returns the message prefixed with the kind, e.g. {@code "I/O error: File not found: a.jpg"}.
     */
    public String describe() {
        return kind.displayName() + ": " + getMessage();
    }

    private static String reason(IOException cause) {
        if (cause instanceof NoSuchFileException) {
            return "no such file";
        }
        if (cause instanceof AccessDeniedException) {
            return "permission denied";
        }
        if (cause instanceof FileSystemException && ((FileSystemException) cause).getReason() != null) {
            return ((FileSystemException) cause).getReason();
        }
        return cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
    }
}
