package com.example.jozin;

import com.example.jozin.sidecar.Sidecar;
import com.example.jozin.sidecar.SidecarJson;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Optional;

/**
 * Reads and writes sidecars next to their originals.
 *
 * <p>A write serializes the record into {@code <original>.json.tmp}, syncs it, rotates the backup
 * chain and then renames the temporary file over the sidecar. Readers of {@code <original>.json}
 * see either the previous record or the new one, never a partial file.
 */
public final class SidecarStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(SidecarStore.class);

    private final ObjectMapper mapper;

    public SidecarStore() {
        this(SidecarJson.newMapper());
    }

    public SidecarStore(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Returns the sidecar stored for the original file if one exists.
     */
    public Optional<Sidecar> load(Path original) throws ScanException {
        Path sidecarPath = SidecarPaths.sidecarFor(original);
        if (!Files.exists(sidecarPath)) {
            return Optional.empty();
        }
        byte[] content;
        try {
            content = Files.readAllBytes(sidecarPath);
        } catch (IOException ex) {
            throw ScanException.io("Failed to read sidecar " + sidecarPath, ex);
        }
        try {
            return Optional.of(mapper.readValue(content, Sidecar.class));
        } catch (JsonProcessingException ex) {
            throw ScanException.validation("Corrupt sidecar " + sidecarPath + ": " + ex.getOriginalMessage(), ex);
        } catch (IOException ex) {
            throw ScanException.io("Failed to parse sidecar " + sidecarPath, ex);
        }
    }

    /**
     * Persists the sidecar for the original file and returns the sidecar path.
     */
    public Path save(Path original, Sidecar sidecar) throws ScanException {
        Path target = SidecarPaths.sidecarFor(original);
        Path temporary = SidecarPaths.temporaryFor(original);
        byte[] json;
        try {
            json = mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(sidecar);
        } catch (JsonProcessingException ex) {
            throw ScanException.internal("Failed to serialize sidecar for " + original, ex);
        }

        try {
            writeDurably(temporary, json);
        } catch (IOException ex) {
            discard(temporary, ex);
            throw ScanException.io("Failed to write " + temporary, ex);
        }

        try {
            if (Files.exists(target, LinkOption.NOFOLLOW_LINKS)) {
                rotateBackups(original, target);
            }
            Files.move(temporary, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException ex) {
            throw ScanException.io("Failed to replace sidecar " + target, ex);
        }
        LOGGER.debug("Wrote sidecar {}", target);
        return target;
    }

    /**
     * Shifts {@code .bak2 -> .bak3} and {@code .bak1 -> .bak2}, then copies the current sidecar into
     * {@code .bak1}. The current sidecar stays in place until the final rename replaces it.
     */
    private void rotateBackups(Path original, Path current) throws IOException {
        for (int generation = SidecarPaths.BACKUP_DEPTH - 1; generation >= 1; generation--) {
            Path older = SidecarPaths.backupFor(original, generation);
            if (Files.exists(older, LinkOption.NOFOLLOW_LINKS)) {
                Files.move(older, SidecarPaths.backupFor(original, generation + 1),
                        StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            }
        }
        Path staged = SidecarPaths.stagedBackupFor(original, 1);
        writeDurably(staged, Files.readAllBytes(current));
        Files.move(staged, SidecarPaths.backupFor(original, 1),
                StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        LOGGER.debug("Rotated backups for {}", current);
    }

    private static void writeDurably(Path file, byte[] content) throws IOException {
        try (FileChannel channel = FileChannel.open(file,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.WRITE)) {
            ByteBuffer buffer = ByteBuffer.wrap(content);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }
    }

    private static void discard(Path temporary, IOException failure) {
        try {
            Files.deleteIfExists(temporary);
        } catch (IOException cleanupFailure) {
            failure.addSuppressed(cleanupFailure);
            LOGGER.warn("Could not remove interrupted write {}", temporary, cleanupFailure);
        }
    }
}
