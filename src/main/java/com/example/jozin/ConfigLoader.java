package com.example.jozin;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads a JSON run configuration into a {@link ScanConfig}, applying defaults.
 */
public class ConfigLoader {
    private final ObjectMapper mapper;

    public ConfigLoader() {
        mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public ScanConfig load(Path path) throws ScanException {
        if (!Files.isRegularFile(path)) {
            throw ScanException.io("Config file not found: " + path);
        }
        RawConfig raw;
        try {
            raw = mapper.readValue(path.toFile(), RawConfig.class);
        } catch (JsonProcessingException ex) {
            throw ScanException.user("Invalid config " + path + ": " + ex.getOriginalMessage());
        } catch (IOException ex) {
            throw ScanException.io("Failed to read config " + path, ex);
        }

        if (raw.path == null || raw.path.isBlank()) {
            throw ScanException.user("Config must include a path to scan.");
        }
        int threadCount = ScanConfig.defaultThreadCount();
        if (raw.threadCount != null) {
            if (raw.threadCount <= 0) {
                throw ScanException.user("threadCount must be greater than 0");
            }
            threadCount = raw.threadCount;
        }

        return new ScanConfig(
                Path.of(raw.path),
                raw.recursive != null && raw.recursive,
                patterns("include", raw.include),
                patterns("exclude", raw.exclude),
                raw.dryRun != null && raw.dryRun,
                threadCount,
                raw.followLinks != null && raw.followLinks,
                cleanupOptions(raw.cleanup)
        );
    }

    private Optional<List<String>> patterns(String name, List<String> raw) throws ScanException {
        if (raw == null) {
            return Optional.empty();
        }
        List<String> patterns = new ArrayList<>();
        for (String pattern : raw) {
            if (pattern != null && !pattern.isBlank()) {
                patterns.add(pattern.trim());
            }
        }
        if (patterns.isEmpty()) {
            throw ScanException.user(name + " patterns cannot be empty");
        }
        return Optional.of(List.copyOf(patterns));
    }

    private CleanupOptions cleanupOptions(RawCleanup raw) {
        if (raw == null) {
            return CleanupOptions.all();
        }
        return new CleanupOptions(
                raw.sidecars == null || raw.sidecars,
                raw.backups == null || raw.backups,
                raw.temporaries == null || raw.temporaries,
                raw.cache == null || raw.cache
        );
    }

    private static class RawConfig {
        public String path;
        public Boolean recursive;
        public List<String> include;
        public List<String> exclude;
        public Boolean dryRun;
        public Integer threadCount;
        public Boolean followLinks;
        public RawCleanup cleanup;
    }

    private static class RawCleanup {
        public Boolean sidecars;
        public Boolean backups;
        public Boolean temporaries;
        public Boolean cache;
    }
}
