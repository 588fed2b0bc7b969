package com.example.fssnapshot.scan;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Running totals for one scan partition.
 */
public final class ScanStatistics {
    private final AtomicLong totalFiles = new AtomicLong();
    private final AtomicLong totalBytes = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();

    public void addFile(long size) {
        totalFiles.incrementAndGet();
        totalBytes.addAndGet(size);
    }

    public void addFailure() {
        failures.incrementAndGet();
    }

    public long totalFiles() {
        return totalFiles.get();
    }

    public long totalBytes() {
        return totalBytes.get();
    }

    public long failures() {
        return failures.get();
    }
}
