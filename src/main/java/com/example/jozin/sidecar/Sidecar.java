package com.example.jozin.sidecar;

import java.time.Instant;
import java.util.List;

/**
 * Versioned metadata record persisted as {@code <original>.json} beside one original file.
 *
 * <p>A scan writes a new record with {@code createdAt}, {@code updatedAt} and the signature's
 * creation time all equal. The face, tag and thumbnail lists start empty and are filled by
 * downstream modules.
 */
public record Sidecar(
        String schemaVersion,
        String producerVersion,
        Instant createdAt,
        Instant updatedAt,
        PipelineSignature pipelineSignature,
        SourceInfo source,
        ImageInfo image,
        List<FaceDetection> faces,
        List<Tag> tags,
        List<ThumbnailInfo> thumbnails
) {
    public Sidecar {
        faces = faces == null ? List.of() : List.copyOf(faces);
        tags = tags == null ? List.of() : List.copyOf(tags);
        thumbnails = thumbnails == null ? List.of() : List.copyOf(thumbnails);
    }

    /**
     * Builds the record for a fresh scan. Image metadata is left unset and the downstream lists empty.
     */
    public static Sidecar fromScan(SourceInfo source, PipelineSignature signature, Instant createdAt, Instant updatedAt) {
        return new Sidecar(
                signature.schemaVersion(),
                signature.producerVersion(),
                createdAt,
                updatedAt,
                signature,
                source,
                null,
                List.of(),
                List.of(),
                List.of()
        );
    }
}
