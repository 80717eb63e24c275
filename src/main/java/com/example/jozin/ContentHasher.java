package com.example.jozin;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Streams file content through SHA-256 and returns the digest as lowercase hex.
 */
public class ContentHasher {
    public static final String ALGORITHM = "sha256";
    private static final String DIGEST_NAME = "SHA-256";
    private static final int CHUNK_SIZE = 8192;

    public String hash(Path path) throws ScanException {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance(DIGEST_NAME);
        } catch (NoSuchAlgorithmException ex) {
            throw ScanException.internal(DIGEST_NAME + " not available", ex);
        }
        try (InputStream inputStream = Files.newInputStream(path)) {
            byte[] buffer = new byte[CHUNK_SIZE];
            int read;
            while ((read = inputStream.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
        } catch (IOException ex) {
            throw ScanException.io("Failed to hash " + path, ex);
        }
        byte[] hash = digest.digest();
        StringBuilder builder = new StringBuilder(hash.length * 2);
        for (byte b : hash) {
            builder.append(String.format("%02x", b));
        }
        return builder.toString();
    }
}
