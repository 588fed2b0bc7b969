package com.example.fssnapshot;

import com.example.fssnapshot.model.ImportId;
import com.example.fssnapshot.scan.ScanFailure;

import java.util.List;

/**
 * Outcome of one {@code store} run.
 */
public record ImportSummary(ImportId id, String name, int recordCount, List<ScanFailure> failures) {
    public ImportSummary {
        failures = List.copyOf(failures);
    }
}
