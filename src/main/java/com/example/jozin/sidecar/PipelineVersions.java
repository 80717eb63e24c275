package com.example.jozin.sidecar;

import com.example.jozin.ContentHasher;

/**
 * Identifiers stamped into every new pipeline signature.
 */
public final class PipelineVersions {
    public static final String SCHEMA_VERSION = "1.0.0";
    public static final String HASH_ALGORITHM = ContentHasher.ALGORITHM;
    private static final String FALLBACK_PRODUCER_VERSION = "0.1.0";

    private PipelineVersions() {
    }

    /**
     * Version of the running jar, or a fixed fallback when running from classes (tests, IDE).
     */
    public static String producerVersion() {
        String version = PipelineVersions.class.getPackage().getImplementationVersion();
        return version == null || version.isBlank() ? FALLBACK_PRODUCER_VERSION : version;
    }
}
