package com.example.fssnapshot.scan;

import java.time.Instant;
import java.util.List;

/**
 * A file or directory the scan had to skip, with the history of attempts made on it.
 */
public record ScanFailure(
        String path,
        boolean directory,
        int attempts,
        int maxAttempts,
        Instant lastAttemptTime,
        String lastError,
        List<RetryAttempt> retryAttempts
) {
    public ScanFailure {
        retryAttempts = List.copyOf(retryAttempts);
    }

    static ScanFailure single(String path, boolean directory, Instant at, String error) {
        return new ScanFailure(path, directory, 1, 1, at, error, List.of(new RetryAttempt(1, at, error)));
    }
}
