package com.example.fssnapshot.store;

import com.example.fssnapshot.diff.CompareState;
import com.example.fssnapshot.model.Digest;
import com.example.fssnapshot.model.FileRecord;
import com.example.fssnapshot.model.ImportId;
import com.example.fssnapshot.model.ImportRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SqliteVersionStoreTest {
    @TempDir
    Path tempDir;

    private SqliteVersionStore store;

    @BeforeEach
    void open() throws Exception {
        store = SqliteVersionStore.open(tempDir.resolve("db/test.sqlite"),
                SqliteVersionStore.DEFAULT_IMPORT_TABLE, SqliteVersionStore.DEFAULT_FILE_INFO_TABLE);
    }

    @AfterEach
    void close() throws Exception {
        store.close();
    }

    @Test
    void createsAndFetchesImport() throws Exception {
        ImportId id = store.createImport("deliveries", Map.of(" Site ", "north"));

        ImportRecord record = store.fetchImport(id);

        assertEquals(id, record.id());
        assertEquals("deliveries", record.name());
        assertEquals(Map.of("site", "north"), record.tags());
        assertNotNull(record.timestamp());
        assertTrue(store.fetchRecords(id).isEmpty());
    }

    @Test
    void storesRecordsAcrossSeveralCalls() throws Exception {
        ImportId id = store.createImport("deliveries", Map.of());
        FileRecord first = record("A", "1.csv", "aa", Map.of("protocol", "A"));
        FileRecord second = new FileRecord(Digest.EMPTY, "", "top.txt", 1.5, 2.25, 7L, true, null, "text/plain", Map.of());

        assertEquals(1, store.importFiles(id, List.of(first)));
        assertEquals(1, store.importFiles(id, List.of(second)));

        List<FileRecord> records = store.fetchRecords(id);
        assertEquals(List.of(first, second), records.stream()
                .sorted((a, b) -> a.baseName().compareTo(b.baseName()))
                .toList());
    }

    @Test
    void duplicatePathInOneImportFailsAtomically() throws Exception {
        ImportId id = store.createImport("deliveries", Map.of());
        FileRecord record = record("A", "1.csv", "aa", Map.of());

        StoreException error = assertThrows(StoreException.class,
                () -> store.importFiles(id, List.of(record("B", "2.csv", "bb", Map.of()), record, record)));

        assertEquals("importFiles", error.operation());
        assertNotNull(error.sql());
        assertTrue(store.fetchRecords(id).isEmpty());
    }

    @Test
    void latestImportIdPrefersLaterInsertOnTies() throws Exception {
        ImportId first = store.createImport("deliveries", Map.of());
        ImportId second = store.createImport("deliveries", Map.of());
        store.createImport("other", Map.of());

        assertEquals(second, store.fetchLatestImportId("deliveries").orElseThrow());
        assertTrue(store.fetchLatestImportId("missing").isEmpty());
        assertNotEquals(first, second);
    }

    @Test
    void unknownImportIsNotFound() {
        ImportId unknown = ImportId.random();

        ImportNotFoundException error = assertThrows(ImportNotFoundException.class, () -> store.fetchImport(unknown));
        assertEquals(unknown, error.importId());
        assertThrows(ImportNotFoundException.class, () -> store.fetchCompareLatest(unknown, true));
    }

    @Test
    void latestImportHasNoNewerVersion() throws Exception {
        store.createImport("deliveries", Map.of());
        ImportId latest = store.createImport("deliveries", Map.of());

        assertThrows(NoNewerVersionException.class, () -> store.fetchCompareLatest(latest, true));
    }

    @Test
    void comparesAgainstLatestImport() throws Exception {
        ImportId original = store.createImport("deliveries", Map.of());
        store.importFiles(original, List.of(record("A", "1.csv", "aa", Map.of())));
        ImportId latest = store.createImport("deliveries", Map.of());
        store.importFiles(latest, List.of(record("B", "1.csv", "aa", Map.of())));

        LatestComparison comparison = store.fetchCompareLatest(original, true);

        assertEquals(original, comparison.original().id());
        assertEquals(latest, comparison.latest().id());
        assertEquals(1, comparison.states().size());
        CompareState.Paired paired = assertInstanceOf(CompareState.Paired.class, comparison.states().get(0));
        assertEquals("A/1.csv", paired.original().fileName());
        assertEquals("B/1.csv", paired.next().fileName());
    }

    @Test
    void separateConnectionsShareTheDatabase() throws Exception {
        ImportId id = store.createImport("deliveries", Map.of());
        try (SqliteVersionStore other = SqliteVersionStore.open(tempDir.resolve("db/test.sqlite"),
                SqliteVersionStore.DEFAULT_IMPORT_TABLE, SqliteVersionStore.DEFAULT_FILE_INFO_TABLE)) {
            other.importFiles(id, List.of(record("A", "1.csv", "aa", Map.of())));
        }

        assertEquals(1, store.fetchRecords(id).size());
    }

    @Test
    void customTableNamesAreValidated() {
        assertThrows(IllegalArgumentException.class,
                () -> SqliteVersionStore.open(tempDir.resolve("x.sqlite"), "bad name", "file_info"));
    }

    private static FileRecord record(String dir, String base, String digestHex, Map<String, String> metadata) {
        return new FileRecord(Digest.fromHex(digestHex), dir, base, 10.0, 20.5, 3L, false, "group", null, metadata);
    }
}
