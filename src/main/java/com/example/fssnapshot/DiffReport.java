package com.example.fssnapshot;

import com.example.fssnapshot.diff.Action;
import com.example.fssnapshot.model.ImportId;

import java.time.Instant;
import java.util.List;

/**
 * The actions leading from an import to the latest import of its lineage.
 */
public record DiffReport(
        ImportId originalId,
        ImportId newId,
        Instant originalTimestamp,
        Instant newTimestamp,
        List<Action> actions
) {
    public DiffReport {
        actions = List.copyOf(actions);
    }
}
