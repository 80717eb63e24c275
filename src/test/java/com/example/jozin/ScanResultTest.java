package com.example.jozin;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ScanResultTest {
    @Test
    void countersAlwaysAddUpToTotal() {
        ScanResult result = ScanResult.of(List.of(
                ScannedFile.written("a.jpg", "a.jpg.json", "h1", 3L),
                ScannedFile.dryRun("b.jpg", "h2", 4L),
                ScannedFile.skipped("c.txt", DirectoryWalker.UNSUPPORTED_EXTENSION),
                ScannedFile.failed("d.jpg", "I/O error: boom")
        ));

        assertEquals(4, result.totalFiles());
        assertEquals(1, result.successful());
        assertEquals(1, result.failed());
        assertEquals(2, result.skipped());
        assertEquals(result.totalFiles(), result.successful() + result.failed() + result.skipped());
    }

    @Test
    void emptyResultHasZeroCounters() {
        ScanResult result = ScanResult.of(List.of());

        assertEquals(0, result.totalFiles());
        assertEquals(0, result.successful() + result.failed() + result.skipped());
    }
}
