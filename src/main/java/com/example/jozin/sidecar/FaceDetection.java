package com.example.jozin.sidecar;

import java.util.List;

/**
 * A detected face. {@code bbox} is {@code [x, y, width, height]} normalized to 0..1.
 */
public record FaceDetection(
        List<Double> bbox,
        double score,
        String embeddingHash,
        String person
) {
}
