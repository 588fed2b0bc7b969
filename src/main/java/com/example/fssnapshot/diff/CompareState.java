package com.example.fssnapshot.diff;

import com.example.fssnapshot.model.FileRecord;

/**
 * How a record of the previous import corresponds to the next import, or vice versa.
 */
public sealed interface CompareState {

    /**
     * A previous record with no counterpart left in the next import.
     */
    record PrevOnly(FileRecord original) implements CompareState {
    }

    /**
     * A next record with no counterpart in the previous import.
     */
    record NextOnly(FileRecord added) implements CompareState {
    }

    /**
     * A previous and a next record sharing content, path, or both. When {@code copy} is set the
     * next record duplicates content whose original is still accounted for elsewhere.
     */
    record Paired(FileRecord original, FileRecord next, boolean copy) implements CompareState {
    }
}
