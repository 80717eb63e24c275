package com.example.jozin.sidecar;

/**
 * Image properties filled in by metadata readers. Every field is optional.
 */
public record ImageInfo(
        Integer width,
        Integer height,
        String format,
        Integer orientation,
        String datetimeOriginal,
        String cameraMake,
        String cameraModel,
        Double gpsLatitude,
        Double gpsLongitude
) {
}
