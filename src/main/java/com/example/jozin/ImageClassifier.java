package com.example.jozin;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

/**
 * Decides by file extension alone whether a path is a supported photo. File content is never read.
 */
public final class ImageClassifier {
    static final Set<String> SUPPORTED_EXTENSIONS = Set.of(
            "jpg", "jpeg", "png", "heic", "heif",
            "raw", "cr2", "nef", "arw", "dng",
            "tiff", "tif", "webp"
    );

    private ImageClassifier() {
    }

    public static boolean isSupported(Path path) {
        Path fileName = path.getFileName();
        return fileName != null && isSupportedName(fileName.toString());
    }

    public static boolean isSupportedName(String fileName) {
        int dot = fileName.lastIndexOf('.');
        // ".jpg" alone is a hidden file without an extension
        if (dot <= 0 || dot == fileName.length() - 1) {
            return false;
        }
        return SUPPORTED_EXTENSIONS.contains(fileName.substring(dot + 1).toLowerCase(Locale.ROOT));
    }
}
