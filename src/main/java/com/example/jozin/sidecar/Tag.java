package com.example.jozin.sidecar;

public record Tag(
        String label,
        Double score,
        TagSource source
) {
}
