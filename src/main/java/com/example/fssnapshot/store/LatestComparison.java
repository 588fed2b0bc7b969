package com.example.fssnapshot.store;

import com.example.fssnapshot.diff.CompareState;
import com.example.fssnapshot.model.ImportRecord;

import java.util.List;

/**
 * Correspondence between an import and the latest import of its lineage.
 */
public record LatestComparison(
        ImportRecord original,
        ImportRecord latest,
        List<CompareState> states
) {
    public LatestComparison {
        states = List.copyOf(states);
    }
}
