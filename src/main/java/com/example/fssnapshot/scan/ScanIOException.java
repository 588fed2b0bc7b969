package com.example.fssnapshot.scan;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Raised when the scan root itself cannot be enumerated.
 */
public class ScanIOException extends IOException {
    private final Path path;

    public ScanIOException(Path path, String message) {
        super(message + ": " + path);
        this.path = path;
    }

    public ScanIOException(Path path, String message, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }

    public Path path() {
        return path;
    }
}
