package com.example.fssnapshot.diff;

import com.example.fssnapshot.model.FileRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Turns the correspondence between two imports into the actions that lead from one to the other.
 */
public final class ReconciliationEngine {
    private final boolean compareDigests;

    public ReconciliationEngine(boolean compareDigests) {
        this.compareDigests = compareDigests;
    }

    public List<Action> diff(Collection<FileRecord> previous, Collection<FileRecord> next) {
        return diffAll(new CorrespondenceBuilder(compareDigests).build(previous, next));
    }

    public List<Action> diffAll(List<CompareState> states) {
        List<Action> actions = new ArrayList<>();
        for (CompareState state : states) {
            classify(state).ifPresent(actions::add);
        }
        return actions;
    }

    /**
     * Classifies one correspondence; empty means the file is unchanged.
     */
    public Optional<Action> classify(CompareState state) {
        if (state instanceof CompareState.PrevOnly prevOnly) {
            return Optional.of(new Action.Removed(prevOnly.original()));
        }
        if (state instanceof CompareState.NextOnly nextOnly) {
            return Optional.of(new Action.Created(nextOnly.added()));
        }
        if (state instanceof CompareState.Paired paired) {
            if (paired.copy()) {
                return Optional.of(new Action.Copied(paired.original(), paired.next()));
            }
            return compare(paired.original(), paired.next());
        }
        throw new IllegalStateException("Unknown compare state: " + state);
    }

    private Optional<Action> compare(FileRecord original, FileRecord next) {
        boolean sameContent = ContentKey.sameContent(original, next, compareDigests);
        boolean samePath = original.pathKey().equals(next.pathKey());

        if (sameContent && samePath) {
            return Optional.empty();
        }
        if (!sameContent && samePath) {
            return Optional.of(new Action.Modified(original, next.modified(), next.size(), next.digest()));
        }
        if (sameContent) {
            boolean sameDir = original.dirName().equals(next.dirName());
            if (sameDir) {
                return Optional.of(new Action.Renamed(original, next.baseName(), next.metadata()));
            }
            // Directory changed, with or without a new base name.
            if (next.archived()) {
                return Optional.of(new Action.Archived(original, next.dirName(), next.metadata()));
            }
            return Optional.of(new Action.Moved(original, next.dirName(), next.metadata()));
        }
        throw new IllegalStateException("Paired records share neither content nor path: "
                + original.fileName() + " -> " + next.fileName());
    }
}
