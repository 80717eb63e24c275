package com.example.jozin.sidecar;

public record ThumbnailInfo(
        String path,
        int size,
        String format
) {
}
