package com.example.jozin;

public record DeletedFile(
        String path,
        GeneratedFileType type,
        long sizeBytes
) {
}
