package com.example.fssnapshot;

import com.example.fssnapshot.model.FileRecord;
import com.example.fssnapshot.model.ImportRecord;
import com.example.fssnapshot.scan.ScanIOException;
import com.example.fssnapshot.store.VersionStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.example.fssnapshot.SnapshotFixtures.config;
import static com.example.fssnapshot.SnapshotFixtures.write;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class ImportServiceTest {
    @TempDir
    Path tempDir;

    @Test
    void storesEveryFileOnce() throws Exception {
        Path root = tempDir.resolve("root");
        write(root, "A/1.csv", "one");
        write(root, "B/2.csv", "two");
        write(root, "archive/A/3.csv", "three");
        write(root, "readme.txt", "hello");
        SnapshotConfig config = config(root, tempDir.resolve("store.sqlite"), true);

        ImportSummary summary = new ImportService().store(config);

        assertEquals(4, summary.recordCount());
        assertTrue(summary.failures().isEmpty());
        try (VersionStore store = config.openStore()) {
            ImportRecord imported = store.fetchImport(summary.id());
            assertEquals("deliveries", imported.name());
            assertEquals(Map.of("site", "north"), imported.tags());
            Map<String, FileRecord> records = store.fetchRecords(summary.id()).stream()
                    .collect(Collectors.toMap(FileRecord::fileName, record -> record));
            assertEquals(4, records.size());
            assertTrue(records.get("archive/A/3.csv").archived());
            assertEquals("A", records.get("A/1.csv").fileGroup());
            assertTrue(records.get("readme.txt").metadata().isEmpty());
        }
    }

    @Test
    void singleAndMultiThreadedRunsStoreTheSameRecords() throws Exception {
        Path root = tempDir.resolve("root");
        for (int i = 0; i < 20; i++) {
            write(root, "P" + (i % 3) + "/" + i + ".csv", "content " + i);
            write(root, "archive/P" + (i % 2) + "/" + i + ".csv", "archived " + i);
            write(root, "misc/" + i + ".dat", "misc " + (i % 5));
        }

        List<FileRecord> multi = storeAndFetch(config(root, tempDir.resolve("multi.sqlite"), true));
        List<FileRecord> single = storeAndFetch(config(root, tempDir.resolve("single.sqlite"), false));

        assertEquals(60, multi.size());
        assertEquals(single, multi);
    }

    @Test
    void brokenEntryIsReportedOnceAcrossPartitions() throws Exception {
        Path root = tempDir.resolve("root");
        write(root, "A/1.csv", "one");
        write(root, "readme.txt", "hello");
        assumeTrue(symlink(root.resolve("dangling"), root.resolve("gone")));
        SnapshotConfig config = config(root, tempDir.resolve("store.sqlite"), true, true);

        ImportSummary summary = new ImportService().store(config);

        assertEquals(2, summary.recordCount());
        assertEquals(1, summary.failures().size());
        assertEquals(root.resolve("dangling").toAbsolutePath().normalize().toString(),
                summary.failures().get(0).path());
    }

    @Test
    void missingRootFailsTheImport() {
        SnapshotConfig config = config(tempDir.resolve("missing"), tempDir.resolve("store.sqlite"), true);

        assertThrows(ScanIOException.class, () -> new ImportService().store(config));
    }

    private static boolean symlink(Path link, Path target) {
        try {
            Files.createSymbolicLink(link, target);
            return true;
        } catch (UnsupportedOperationException | java.io.IOException ex) {
            return false;
        }
    }

    private static List<FileRecord> storeAndFetch(SnapshotConfig config) throws Exception {
        ImportSummary summary = new ImportService().store(config);
        try (VersionStore store = config.openStore()) {
            return store.fetchRecords(summary.id());
        }
    }
}
