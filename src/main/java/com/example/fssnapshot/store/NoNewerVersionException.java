package com.example.fssnapshot.store;

import com.example.fssnapshot.model.ImportId;

/**
 * Raised when an import is compared against its lineage but is itself the latest import.
 */
public class NoNewerVersionException extends StoreException {
    private final ImportId importId;
    private final String name;

    public NoNewerVersionException(ImportId importId, String name) {
        super("fetchCompareLatest", "import " + importId + " is already the latest of '" + name + "'");
        this.importId = importId;
        this.name = name;
    }

    public ImportId importId() {
        return importId;
    }

    public String name() {
        return name;
    }
}
