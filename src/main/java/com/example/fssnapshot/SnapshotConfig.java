package com.example.fssnapshot;

import com.example.fssnapshot.pattern.PathTemplate;
import com.example.fssnapshot.policy.ArchivedBy;
import com.example.fssnapshot.policy.CalcBy;
import com.example.fssnapshot.policy.FileTypePolicy;
import com.example.fssnapshot.scan.DigestEngine;
import com.example.fssnapshot.scan.FileRecordExtractor;
import com.example.fssnapshot.scan.Scanner;
import com.example.fssnapshot.store.SqliteVersionStore;
import com.example.fssnapshot.store.StoreException;
import com.example.fssnapshot.store.VersionStore;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Immutable settings of one named snapshot spec.
 */
public record SnapshotConfig(
        String specName,
        Path rootDir,
        String name,
        Map<String, List<PathTemplate>> matchPaths,
        Map<String, String> tags,
        boolean digest,
        boolean compareDigests,
        boolean multithread,
        boolean followLinks,
        int fileRetryAttempts,
        ArchivedBy archivedBy,
        CalcBy fileGroupBy,
        FileTypePolicy fileTypeBy,
        Path storeDbFile,
        String storeDbImportTable,
        String storeDbFileInfoTable
) {
    public SnapshotConfig {
        matchPaths = Collections.unmodifiableMap(new LinkedHashMap<>(matchPaths));
        tags = Collections.unmodifiableMap(new TreeMap<>(tags));
    }

    public Scanner newScanner() {
        FileRecordExtractor extractor = new FileRecordExtractor(
                new DigestEngine(), digest, archivedBy, fileGroupBy, fileTypeBy, followLinks);
        return new Scanner(rootDir, matchPaths, extractor, followLinks, fileRetryAttempts);
    }

    public VersionStore openStore() throws StoreException {
        return SqliteVersionStore.open(storeDbFile, storeDbImportTable, storeDbFileInfoTable);
    }
}
