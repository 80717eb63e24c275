package com.example.jozin;

import java.time.Duration;
import java.time.Instant;

/**
 * Wraps an operation result with its start and finish times.
 */
public record OperationResponse<T>(
        Instant startedAt,
        Instant finishedAt,
        long durationMs,
        T data
) {
    public static <T> OperationResponse<T> of(T data, Instant startedAt, Instant finishedAt) {
        long durationMs = Math.max(0L, Duration.between(startedAt, finishedAt).toMillis());
        return new OperationResponse<>(startedAt, finishedAt, durationMs, data);
    }
}
