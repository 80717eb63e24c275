package com.example.jozin;

/**
 * Failure categories surfaced by scan and cleanup calls, each tied to a process exit code.
 */
public enum ErrorKind {
    USER("user", "User error", 1),
    IO("io", "I/O error", 2),
    VALIDATION("validation", "Validation error", 3),
    INTERNAL("internal", "Internal error", 4);

    private final String label;
    private final String displayName;
    private final int exitCode;

    ErrorKind(String label, String displayName, int exitCode) {
        this.label = label;
        this.displayName = displayName;
        this.exitCode = exitCode;
    }

    public String label() {
        return label;
    }

    public String displayName() {
        return displayName;
    }

    public int exitCode() {
        return exitCode;
    }
}
