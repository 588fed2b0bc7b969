package com.example.fssnapshot.scan;

import com.example.fssnapshot.model.Digest;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Streams a file through a 128-bit MD5 hash in chunks of at most 1 MiB.
 */
public final class DigestEngine {
    public static final String ALGORITHM = "MD5";
    static final int MAX_CHUNK_SIZE = 1 << 20;

    public Digest digest(Path path) throws IOException {
        return digest(path, Files.size(path));
    }

    public Digest digest(Path path, long size) throws IOException {
        MessageDigest digest = newMessageDigest();
        byte[] buffer = new byte[chunkSize(size)];
        try (InputStream inputStream = Files.newInputStream(path)) {
            int read;
            while ((read = inputStream.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
        }
        return Digest.of(digest.digest());
    }

    static int chunkSize(long size) {
        return (int) Math.max(1L, Math.min(size, MAX_CHUNK_SIZE));
    }

    private static MessageDigest newMessageDigest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(ALGORITHM + " not available", e);
        }
    }
}
