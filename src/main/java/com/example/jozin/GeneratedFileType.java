package com.example.jozin;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.file.Path;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Kinds of files this tool creates next to originals.
 */
public enum GeneratedFileType {
    @JsonProperty("sidecar")
    SIDECAR,
    @JsonProperty("backup")
    BACKUP,
    @JsonProperty("temporary")
    TEMPORARY,
    @JsonProperty("cache")
    CACHE;

    public static final String CACHE_DIRECTORY = ".jozin";

    // <image>.json, <image>.json.bakN, <image>.json.tmp, <image>.json.bakN.tmp
    private static final Pattern GENERATED_NAME = Pattern.compile("^(.+)\\.json(\\.bak[1-3])?(\\.tmp)?$");

    /**
     * Classifies a regular file by name. Only names derived from a supported image name count, so
     * unrelated {@code .json} files are left alone.
     */
    public static Optional<GeneratedFileType> classify(Path file) {
        Path fileName = file.getFileName();
        if (fileName == null) {
            return Optional.empty();
        }
        Matcher matcher = GENERATED_NAME.matcher(fileName.toString());
        if (!matcher.matches() || !ImageClassifier.isSupportedName(matcher.group(1))) {
            return Optional.empty();
        }
        if (matcher.group(3) != null) {
            return Optional.of(TEMPORARY);
        }
        return Optional.of(matcher.group(2) != null ? BACKUP : SIDECAR);
    }
}
