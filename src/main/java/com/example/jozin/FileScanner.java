package com.example.jozin;

import com.example.jozin.sidecar.PipelineSignature;
import com.example.jozin.sidecar.Sidecar;
import com.example.jozin.sidecar.SourceInfo;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;

/**
 * Scans one file: reads its attributes, hashes its content and builds (and unless dry-running,
 * persists) its sidecar.
 */
public class FileScanner {
    private final ContentHasher hasher;
    private final SidecarStore store;

    public FileScanner() {
        this(new ContentHasher(), new SidecarStore());
    }

    public FileScanner(ContentHasher hasher, SidecarStore store) {
        this.hasher = hasher;
        this.store = store;
    }

    /**
     * Builds the sidecar for {@code path}, stamped with the current time. A dry run never touches
     * the filesystem beyond reading.
     *
     * @throws ScanException {@link ErrorKind#IO} if the file is missing or unreadable,
     *                       {@link ErrorKind#VALIDATION} if the path is not a regular file
     */
    public Sidecar scanFile(Path path, boolean dryRun) throws ScanException {
        if (!Files.exists(path)) {
            throw ScanException.io("File not found: " + path);
        }
        if (!Files.isRegularFile(path)) {
            throw ScanException.validation("Path is not a file: " + path);
        }

        BasicFileAttributes attributes;
        try {
            attributes = Files.readAttributes(path, BasicFileAttributes.class);
        } catch (IOException ex) {
            throw ScanException.io("Failed to read attributes of " + path, ex);
        }
        String hash = hasher.hash(path);

        Instant now = Instant.now();
        SourceInfo source = new SourceInfo(
                path.toString(),
                attributes.size(),
                hash,
                attributes.lastModifiedTime().toInstant()
        );
        Sidecar sidecar = Sidecar.fromScan(source, PipelineSignature.current(now), now, now);

        if (!dryRun) {
            store.save(path, sidecar);
        }
        return sidecar;
    }
}
