package com.example.jozin;

import com.example.jozin.sidecar.Sidecar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Entry point for scanning: a single photo or a directory tree.
 *
 * <p>Directory scans finish the walk before the first file is scanned, so sidecars written during
 * the run never become candidates. With more than one thread the per-file scans run on a fixed
 * pool; outcomes are still reported in walk order.
 */
public final class SidecarScanner {
    private static final Logger LOGGER = LoggerFactory.getLogger(SidecarScanner.class);

    private final FileScanner fileScanner;

    public SidecarScanner() {
        this(new FileScanner());
    }

    public SidecarScanner(FileScanner fileScanner) {
        this.fileScanner = fileScanner;
    }

    /**
     * Scans the configured path. Per-file failures end up in the result; only a missing path, an
     * unsupported single file, an invalid pattern or an internal error fail the call.
     */
    public ScanResult scan(ScanConfig config, ProgressListener listener) throws ScanException {
        Path path = config.path();
        if (!Files.exists(path)) {
            throw ScanException.io("Path not found: " + path);
        }
        if (Files.isRegularFile(path)) {
            if (!ImageClassifier.isSupported(path)) {
                throw ScanException.validation("Not an image file: " + path);
            }
            return ScanResult.of(List.of(scanOne(path, config.dryRun(), listener)));
        }
        if (Files.isDirectory(path)) {
            return scanDirectory(config, listener);
        }
        throw ScanException.validation("Path is neither a file nor a directory: " + path);
    }

    private ScanResult scanDirectory(ScanConfig config, ProgressListener listener) throws ScanException {
        Optional<PatternMatcher> include = compile(config.include());
        Optional<PatternMatcher> exclude = compile(config.exclude());

        LOGGER.info("Scanning {} (recursive={}, dryRun={}, threads={})",
                config.path(), config.recursive(), config.dryRun(), config.threadCount());
        DirectoryWalker walker = new DirectoryWalker(config.followLinks());
        List<WalkEntry> entries = walker.walk(config.path(), config.recursive(), include, exclude);

        List<ScannedFile> files = config.threadCount() > 1
                ? scanInParallel(entries, config, listener)
                : scanSequentially(entries, config, listener);
        ScanResult result = ScanResult.of(files);
        LOGGER.info("Scan of {} finished: {} files, {} written, {} failed, {} skipped",
                config.path(), result.totalFiles(), result.successful(), result.failed(), result.skipped());
        return result;
    }

    private List<ScannedFile> scanSequentially(List<WalkEntry> entries,
                                               ScanConfig config,
                                               ProgressListener listener) throws ScanException {
        List<ScannedFile> files = new ArrayList<>(entries.size());
        for (WalkEntry entry : entries) {
            files.add(entry.isCandidate()
                    ? scanOne(entry.path(), config.dryRun(), listener)
                    : ScannedFile.skipped(entry.path().toString(), entry.skipReason()));
        }
        return files;
    }

    private List<ScannedFile> scanInParallel(List<WalkEntry> entries,
                                             ScanConfig config,
                                             ProgressListener listener) throws ScanException {
        ExecutorService executor = Executors.newFixedThreadPool(config.threadCount());
        try {
            List<Future<ScannedFile>> futures = new ArrayList<>(entries.size());
            for (WalkEntry entry : entries) {
                if (entry.isCandidate()) {
                    futures.add(executor.submit(() -> scanOne(entry.path(), config.dryRun(), listener)));
                } else {
                    futures.add(CompletableFuture.completedFuture(
                            ScannedFile.skipped(entry.path().toString(), entry.skipReason())));
                }
            }
            List<ScannedFile> files = new ArrayList<>(futures.size());
            for (Future<ScannedFile> future : futures) {
                files.add(await(future));
            }
            return files;
        } finally {
            executor.shutdownNow();
        }
    }

    private static ScannedFile await(Future<ScannedFile> future) throws ScanException {
        try {
            return future.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw ScanException.internal("Scan interrupted", ex);
        } catch (ExecutionException ex) {
            if (ex.getCause() instanceof ScanException) {
                throw (ScanException) ex.getCause();
            }
            throw ScanException.internal("Unexpected failure while scanning", ex.getCause());
        }
    }

    /**
     * Scans one candidate, bracketing it with started/completed events. Failures other than
     * internal ones are recorded in the returned outcome.
     */
    private ScannedFile scanOne(Path file, boolean dryRun, ProgressListener listener) throws ScanException {
        String path = file.toString();
        listener.onEvent(ProgressEvent.started(path));
        try {
            Sidecar sidecar = fileScanner.scanFile(file, dryRun);
            String hash = sidecar.source().fileHash();
            long size = sidecar.source().fileSizeBytes();
            listener.onEvent(ProgressEvent.succeeded(path, size));
            return dryRun
                    ? ScannedFile.dryRun(path, hash, size)
                    : ScannedFile.written(path, SidecarPaths.sidecarFor(file).toString(), hash, size);
        } catch (ScanException ex) {
            listener.onEvent(ProgressEvent.failed(path, ex.describe()));
            if (ex.kind() == ErrorKind.INTERNAL) {
                throw ex;
            }
            LOGGER.warn("Failed to scan {}: {}", file, ex.describe());
            return ScannedFile.failed(path, ex.describe());
        }
    }

    private static Optional<PatternMatcher> compile(Optional<List<String>> patterns) throws ScanException {
        if (patterns.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(PatternMatcher.compile(patterns.get()));
    }
}
