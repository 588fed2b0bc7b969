package com.example.fssnapshot.diff;

import com.example.fssnapshot.model.FileRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

import static com.example.fssnapshot.diff.DiffFixtures.file;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReconciliationEngineTest {
    private final ReconciliationEngine engine = new ReconciliationEngine(true);

    @Test
    void classifiesEveryKindOfChange() {
        FileRecord kept = file("A/keep.csv", "k");
        FileRecord edited = file("A/edit.csv", "old");
        FileRecord editedNext = file("A/edit.csv", "new");
        FileRecord moved = file("A/1.csv", "m");
        FileRecord movedNext = file("B/1.csv", "m");
        FileRecord renamed = file("A/r.csv", "r");
        FileRecord renamedNext = file("A/r2.csv", "r");
        FileRecord archived = file("A/z.csv", "z");
        FileRecord archivedNext = file("archive/A/z.csv", "z", true);
        FileRecord gone = file("A/gone.csv", "g");
        FileRecord added = file("C/new.csv", "n");
        FileRecord copy = file("D/keep.csv", "k");

        List<Action> actions = engine.diff(
                List.of(kept, edited, moved, renamed, archived, gone),
                List.of(kept, editedNext, movedNext, renamedNext, archivedNext, added, copy));

        assertEquals(List.of(
                new Action.Moved(moved, "B", movedNext.metadata()),
                new Action.Modified(edited, editedNext.modified(), editedNext.size(), editedNext.digest()),
                new Action.Removed(gone),
                new Action.Copied(kept, copy),
                new Action.Renamed(renamed, "r2.csv", renamedNext.metadata()),
                new Action.Archived(archived, "archive/A", archivedNext.metadata()),
                new Action.Created(added)
        ), actions);
    }

    @Test
    void unchangedFilesProduceNoAction() {
        FileRecord kept = file("A/keep.csv", "k");

        assertTrue(engine.diff(List.of(kept), List.of(kept)).isEmpty());
    }

    @Test
    void moveWithNewNameIsAMove() {
        FileRecord before = file("A/1.csv", "x");
        FileRecord after = file("B/2.csv", "x");

        assertEquals(Optional.of(new Action.Moved(before, "B", after.metadata())),
                engine.classify(new CompareState.Paired(before, after, false)));
    }

    @Test
    void pairSharingNothingIsRejected() {
        CompareState bogus = new CompareState.Paired(file("A/1.csv", "x"), file("B/2.csv", "y"), false);

        assertThrows(IllegalStateException.class, () -> engine.classify(bogus));
    }

    @ParameterizedTest
    @ValueSource(longs = {1L, 2L, 3L, 17L, 42L, 1234L, 99991L})
    void everyRecordIsAccountedForExactlyOnce(long seed) {
        Random random = new Random(seed);
        List<FileRecord> previous = randomImport(random, Map.of());
        Map<String, FileRecord> previousByPath = new HashMap<>();
        previous.forEach(record -> previousByPath.put(record.fileName(), record));
        List<FileRecord> next = randomImport(random, previousByPath);

        List<CompareState> states = new CorrespondenceBuilder(true).build(previous, next);
        Map<String, Integer> prevUses = new HashMap<>();
        Map<String, Integer> nextUses = new HashMap<>();
        for (CompareState state : states) {
            if (state instanceof CompareState.PrevOnly prevOnly) {
                prevUses.merge(prevOnly.original().fileName(), 1, Integer::sum);
            } else if (state instanceof CompareState.NextOnly nextOnly) {
                nextUses.merge(nextOnly.added().fileName(), 1, Integer::sum);
            } else if (state instanceof CompareState.Paired paired) {
                if (!paired.copy()) {
                    prevUses.merge(paired.original().fileName(), 1, Integer::sum);
                }
                nextUses.merge(paired.next().fileName(), 1, Integer::sum);
                // Classification must not hit the unreachable branch.
                engine.classify(state);
            }
        }

        for (FileRecord record : previous) {
            assertEquals(1, prevUses.getOrDefault(record.fileName(), 0), record.fileName());
        }
        for (FileRecord record : next) {
            assertEquals(1, nextUses.getOrDefault(record.fileName(), 0), record.fileName());
        }
        assertEquals(previous.size(), prevUses.size());
        assertEquals(next.size(), nextUses.size());
    }

    /**
     * Builds an import over a small namespace with few distinct contents, so that paths and
     * contents collide often. When {@code base} is given, some of its files are kept as they are.
     */
    private static List<FileRecord> randomImport(Random random, Map<String, FileRecord> base) {
        String[] dirs = {"", "A", "B", "A/x"};
        String[] names = {"1.csv", "2.csv", "3.csv", "4.csv"};
        Map<String, FileRecord> records = new LinkedHashMap<>();
        for (FileRecord record : base.values()) {
            if (random.nextInt(3) == 0) {
                records.put(record.fileName(), record);
            }
        }
        int count = random.nextInt(10);
        for (int i = 0; i < count; i++) {
            String dir = dirs[random.nextInt(dirs.length)];
            String path = dir.isEmpty() ? names[random.nextInt(names.length)] : dir + "/" + names[random.nextInt(names.length)];
            records.putIfAbsent(path, file(path, "c" + random.nextInt(4), random.nextBoolean()));
        }
        return new ArrayList<>(records.values());
    }
}
