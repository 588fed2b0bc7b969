package com.example.fssnapshot.store;

import com.example.fssnapshot.model.ImportId;

public class ImportNotFoundException extends StoreException {
    private final ImportId importId;

    public ImportNotFoundException(ImportId importId) {
        super("fetchImport", "no import with id " + importId);
        this.importId = importId;
    }

    public ImportId importId() {
        return importId;
    }
}
