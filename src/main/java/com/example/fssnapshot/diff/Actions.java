package com.example.fssnapshot.diff;

import com.example.fssnapshot.model.FileRecord;

/**
 * Replays actions onto records of the previous import.
 */
public final class Actions {
    private Actions() {
    }

    /**
     * Returns the record as it looks after {@code action}. Created, Removed and Copied do not
     * describe a change to an existing record and return it untouched.
     */
    public static FileRecord apply(FileRecord record, Action action) {
        if (action instanceof Action.Moved moved) {
            return record.withDirName(moved.newDirName(), moved.newMetadata());
        }
        if (action instanceof Action.Renamed renamed) {
            return record.withBaseName(renamed.newBaseName(), renamed.newMetadata());
        }
        if (action instanceof Action.Archived archived) {
            return record.withDirName(archived.newDirName(), archived.newMetadata()).withArchived(true);
        }
        if (action instanceof Action.Modified modified) {
            return record.withContent(modified.newModified(), modified.newSize(), modified.newDigest());
        }
        if (action instanceof Action.Created || action instanceof Action.Removed || action instanceof Action.Copied) {
            return record;
        }
        throw new IllegalStateException("Unknown action: " + action);
    }
}
