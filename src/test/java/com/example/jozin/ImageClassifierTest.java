package com.example.jozin;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ImageClassifierTest {
    @Test
    void acceptsSupportedExtensionsInAnyCase() {
        for (String name : new String[] {"a.jpg", "a.JPG", "a.jpeg", "a.png", "a.heic", "a.heif", "a.raw",
                "a.cr2", "a.nef", "a.arw", "a.dng", "a.tiff", "a.tif", "a.WebP"}) {
            assertTrue(ImageClassifier.isSupported(Path.of("photos", name)), name);
        }
    }

    @Test
    void rejectsOtherExtensionsAndNamesWithoutOne() {
        for (String name : new String[] {"a.txt", "a.pdf", "a.mp4", "a.jpg.json", "a", "a.", ".jpg"}) {
            assertFalse(ImageClassifier.isSupported(Path.of(name)), name);
        }
    }
}
