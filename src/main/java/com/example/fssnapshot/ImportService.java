package com.example.fssnapshot;

import com.example.fssnapshot.model.FileRecord;
import com.example.fssnapshot.model.ImportId;
import com.example.fssnapshot.scan.ScanIOException;
import com.example.fssnapshot.scan.Scanner;
import com.example.fssnapshot.store.StoreException;
import com.example.fssnapshot.store.VersionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Scans a spec's root directory into a new import.
 * <p>
 * The scan is split into one partition per category plus one for unmatched files. Each partition
 * is handled by a worker that opens its own store connection and inserts its records in a single
 * transaction.
 */
public class ImportService {
    private final Logger logger;

    public ImportService() {
        this(LoggerFactory.getLogger(ImportService.class));
    }

    public ImportService(Logger logger) {
        this.logger = logger;
    }

    public ImportSummary store(SnapshotConfig config) throws StoreException, ScanIOException, InterruptedException {
        Scanner scanner = config.newScanner();
        scanner.checkRoot();
        ImportId id;
        try (VersionStore store = config.openStore()) {
            id = store.createImport(config.name(), config.tags());
        }

        List<Worker> workers = new ArrayList<>();
        for (String category : scanner.categories()) {
            workers.add(new Worker(config, id, category, () -> scanner.scanCategory(category)));
        }
        workers.add(new Worker(config, id, "unmatched", scanner::scanUnmatched));

        int recordCount = config.multithread() && workers.size() > 1
                ? runConcurrently(workers)
                : runInOrder(workers);
        logger.info("Stored {} records of '{}' as import {} ({} scan failures)",
                recordCount, config.name(), id, scanner.failures().size());
        return new ImportSummary(id, config.name(), recordCount, scanner.failures());
    }

    private int runInOrder(List<Worker> workers) throws StoreException, ScanIOException {
        int total = 0;
        for (Worker worker : workers) {
            total += worker.run();
        }
        return total;
    }

    private int runConcurrently(List<Worker> workers)
            throws StoreException, ScanIOException, InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(workers.size());
        try {
            CompletionService<Integer> completion = new ExecutorCompletionService<>(executor);
            for (Worker worker : workers) {
                completion.submit(worker);
            }
            int total = 0;
            for (int done = 0; done < workers.size(); done++) {
                Future<Integer> finished = completion.take();
                try {
                    total += finished.get();
                } catch (ExecutionException ex) {
                    logger.error("Import worker failed, cancelling the remaining workers", ex.getCause());
                    throw unwrap(ex);
                }
            }
            return total;
        } finally {
            executor.shutdownNow();
        }
    }

    private static StoreException unwrap(ExecutionException ex) throws ScanIOException {
        Throwable cause = ex.getCause();
        if (cause instanceof StoreException storeException) {
            return storeException;
        }
        if (cause instanceof ScanIOException scanException) {
            throw scanException;
        }
        if (cause instanceof RuntimeException runtimeException) {
            throw runtimeException;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        throw new IllegalStateException("Import worker failed", cause);
    }

    @FunctionalInterface
    private interface Partition {
        Stream<FileRecord> open() throws ScanIOException;
    }

    private final class Worker implements Callable<Integer> {
        private final SnapshotConfig config;
        private final ImportId id;
        private final String partitionName;
        private final Partition partition;

        private Worker(SnapshotConfig config, ImportId id, String partitionName, Partition partition) {
            this.config = config;
            this.id = id;
            this.partitionName = partitionName;
            this.partition = partition;
        }

        @Override
        public Integer call() throws StoreException, ScanIOException {
            return run();
        }

        int run() throws StoreException, ScanIOException {
            // Collected before opening the store so the write lock is held only for the insert.
            List<FileRecord> records;
            try (Stream<FileRecord> stream = partition.open()) {
                records = stream.collect(Collectors.toList());
            }
            logger.debug("Partition '{}' produced {} records", partitionName, records.size());
            try (VersionStore store = config.openStore()) {
                return store.importFiles(id, records);
            }
        }
    }
}
