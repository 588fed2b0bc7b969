package com.example.fssnapshot.store;

import com.example.fssnapshot.diff.CompareState;
import com.example.fssnapshot.model.FileRecord;
import com.example.fssnapshot.model.ImportId;
import com.example.fssnapshot.model.ImportRecord;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable home of imports and their file records. An instance is one connection and is not
 * shared between threads; concurrent workers each open their own.
 */
public interface VersionStore extends AutoCloseable {

    /**
     * Atomically creates an import with an empty record set.
     */
    ImportId createImport(String name, Map<String, String> tags) throws StoreException;

    /**
     * Atomically appends records to an import. May be called several times per import.
     *
     * @return the number of records inserted
     */
    int importFiles(ImportId id, Collection<FileRecord> records) throws StoreException;

    /**
     * @throws ImportNotFoundException if there is no such import
     */
    ImportRecord fetchImport(ImportId id) throws StoreException;

    /**
     * The import of the given lineage with the greatest timestamp; later insertion wins ties.
     */
    Optional<ImportId> fetchLatestImportId(String name) throws StoreException;

    List<FileRecord> fetchRecords(ImportId id) throws StoreException;

    List<CompareState> fetchCorrespondence(ImportId prevId, ImportId nextId, boolean compareDigests)
            throws StoreException;

    /**
     * Compares an import against the latest import sharing its name.
     *
     * @throws ImportNotFoundException  if {@code id} does not exist
     * @throws NoNewerVersionException if {@code id} is already the latest of its lineage
     */
    default LatestComparison fetchCompareLatest(ImportId id, boolean compareDigests) throws StoreException {
        ImportRecord original = fetchImport(id);
        ImportId latestId = fetchLatestImportId(original.name())
                .orElseThrow(() -> new ImportNotFoundException(id));
        if (latestId.equals(id)) {
            throw new NoNewerVersionException(id, original.name());
        }
        return new LatestComparison(original, fetchImport(latestId),
                fetchCorrespondence(id, latestId, compareDigests));
    }

    @Override
    void close() throws StoreException;
}
