package com.example.jozin.sidecar;

import java.time.Instant;

/**
 * Describes which schema, hash algorithm and models produced a sidecar.
 */
public record PipelineSignature(
        String schemaVersion,
        String producerVersion,
        String hashAlgorithm,
        String faceModel,
        String tagModel,
        Instant createdAt
) {
    /**
     * Signature for the pipeline in this build; no face or tag model has run yet.
     */
    public static PipelineSignature current(Instant createdAt) {
        return new PipelineSignature(
                PipelineVersions.SCHEMA_VERSION,
                PipelineVersions.producerVersion(),
                PipelineVersions.HASH_ALGORITHM,
                null,
                null,
                createdAt
        );
    }

    /**
     * Two signatures are compatible when schema version and hash algorithm agree.
     * Producer and model identifiers may differ.
     */
    public boolean isCompatibleWith(PipelineSignature other) {
        return schemaVersion.equals(other.schemaVersion) && hashAlgorithm.equals(other.hashAlgorithm);
    }
}
