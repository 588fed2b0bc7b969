package com.example.fssnapshot.diff;

import com.example.fssnapshot.model.FileRecord;
import com.example.fssnapshot.model.FileRecord.PathKey;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Joins the records of two imports by content key and path key.
 * <p>
 * A record may share its content with several records on the other side, so a plain join fans
 * out. The builder resolves this so that every previous record ends up in exactly one of
 * {@code PrevOnly} or a non-copy {@code Paired}, and every next record in exactly one
 * {@code NextOnly} or {@code Paired}:
 * <ol>
 *   <li>Records at the same path are paired (unchanged or modified).</li>
 *   <li>Content that survives unchanged at its old path marks every other next record with that
 *       content as a copy of the survivor.</li>
 *   <li>Remaining records with equal content are paired one to one as relocations, preferring the
 *       same base name, then the same directory, then path order. Extra next records become copies
 *       of the first previous record with that content; extra previous records are removed.</li>
 *   <li>Whatever is left is {@code PrevOnly} or {@code NextOnly}.</li>
 * </ol>
 * The result is ordered by the previous record's path (the added record's for {@code NextOnly}),
 * then by the next record's path.
 */
public final class CorrespondenceBuilder {
    private static final Comparator<FileRecord> BY_PATH = Comparator.comparing(FileRecord::pathKey);

    private final boolean compareDigests;

    public CorrespondenceBuilder(boolean compareDigests) {
        this.compareDigests = compareDigests;
    }

    public List<CompareState> build(Collection<FileRecord> previous, Collection<FileRecord> next) {
        List<FileRecord> prev = sortedUnique(previous, "previous");
        List<FileRecord> nxt = sortedUnique(next, "next");

        Map<PathKey, FileRecord> nextByPath = new LinkedHashMap<>();
        for (FileRecord record : nxt) {
            nextByPath.put(record.pathKey(), record);
        }

        Set<PathKey> consumedPrev = new HashSet<>();
        Set<PathKey> consumedNext = new HashSet<>();
        List<CompareState> states = new ArrayList<>();

        // Same path: unchanged or modified.
        Map<ContentKey, FileRecord> survivors = new LinkedHashMap<>();
        for (FileRecord original : prev) {
            FileRecord counterpart = nextByPath.get(original.pathKey());
            if (counterpart == null) {
                continue;
            }
            states.add(new CompareState.Paired(original, counterpart, false));
            consumedPrev.add(original.pathKey());
            consumedNext.add(counterpart.pathKey());
            if (ContentKey.sameContent(original, counterpart, compareDigests)) {
                contentKey(original).ifPresent(key -> survivors.putIfAbsent(key, original));
            }
        }

        // Content kept in place: other next records holding it are copies.
        for (FileRecord record : nxt) {
            if (consumedNext.contains(record.pathKey())) {
                continue;
            }
            Optional<FileRecord> survivor = contentKey(record).map(survivors::get);
            if (survivor.isPresent()) {
                states.add(new CompareState.Paired(survivor.get(), record, true));
                consumedNext.add(record.pathKey());
            }
        }

        // Relocations of content with no surviving copy.
        Map<ContentKey, List<FileRecord>> allPrevByContent = groupByContent(prev, Set.of());
        Map<ContentKey, List<FileRecord>> prevByContent = groupByContent(prev, consumedPrev);
        Map<ContentKey, List<FileRecord>> nextByContent = groupByContent(nxt, consumedNext);
        for (Map.Entry<ContentKey, List<FileRecord>> entry : nextByContent.entrySet()) {
            List<FileRecord> candidates = prevByContent.getOrDefault(entry.getKey(), List.of());
            List<FileRecord> records = entry.getValue();

            pairRelocations(candidates, records, FileRecord::baseName, consumedPrev, consumedNext, states);
            pairRelocations(candidates, records, FileRecord::dirName, consumedPrev, consumedNext, states);
            pairRelocations(candidates, records, record -> "", consumedPrev, consumedNext, states);

            List<FileRecord> sources = allPrevByContent.get(entry.getKey());
            for (FileRecord record : records) {
                if (sources != null && !consumedNext.contains(record.pathKey())) {
                    states.add(new CompareState.Paired(sources.get(0), record, true));
                    consumedNext.add(record.pathKey());
                }
            }
        }

        for (FileRecord original : prev) {
            if (!consumedPrev.contains(original.pathKey())) {
                states.add(new CompareState.PrevOnly(original));
            }
        }
        for (FileRecord record : nxt) {
            if (!consumedNext.contains(record.pathKey())) {
                states.add(new CompareState.NextOnly(record));
            }
        }

        states.sort(Comparator.comparing(CorrespondenceBuilder::primaryKey)
                .thenComparing(CorrespondenceBuilder::secondaryKey));
        return states;
    }

    /**
     * Pairs each unconsumed record with the first unconsumed candidate, in path order, that has the
     * same preference key. Runs in time linear in the group size.
     */
    private void pairRelocations(List<FileRecord> candidates,
                                 List<FileRecord> records,
                                 Function<FileRecord, String> preference,
                                 Set<PathKey> consumedPrev,
                                 Set<PathKey> consumedNext,
                                 List<CompareState> states) {
        Map<String, Deque<FileRecord>> available = new HashMap<>();
        for (FileRecord original : candidates) {
            if (!consumedPrev.contains(original.pathKey())) {
                available.computeIfAbsent(preference.apply(original), ignored -> new ArrayDeque<>()).addLast(original);
            }
        }
        for (FileRecord record : records) {
            if (consumedNext.contains(record.pathKey())) {
                continue;
            }
            Deque<FileRecord> matching = available.get(preference.apply(record));
            if (matching == null || matching.isEmpty()) {
                continue;
            }
            FileRecord original = matching.removeFirst();
            states.add(new CompareState.Paired(original, record, false));
            consumedPrev.add(original.pathKey());
            consumedNext.add(record.pathKey());
        }
    }

    private Map<ContentKey, List<FileRecord>> groupByContent(List<FileRecord> records, Set<PathKey> excluded) {
        Map<ContentKey, List<FileRecord>> grouped = new LinkedHashMap<>();
        for (FileRecord record : records) {
            if (excluded.contains(record.pathKey())) {
                continue;
            }
            contentKey(record).ifPresent(key -> grouped.computeIfAbsent(key, ignored -> new ArrayList<>()).add(record));
        }
        return grouped;
    }

    private Optional<ContentKey> contentKey(FileRecord record) {
        return ContentKey.of(record, compareDigests);
    }

    private static List<FileRecord> sortedUnique(Collection<FileRecord> records, String side) {
        List<FileRecord> sorted = new ArrayList<>(records);
        sorted.sort(BY_PATH);
        for (int i = 1; i < sorted.size(); i++) {
            if (sorted.get(i - 1).pathKey().equals(sorted.get(i).pathKey())) {
                throw new IllegalArgumentException("Duplicate path in " + side + " import: "
                        + sorted.get(i).fileName());
            }
        }
        return sorted;
    }

    private static PathKey primaryKey(CompareState state) {
        if (state instanceof CompareState.PrevOnly prevOnly) {
            return prevOnly.original().pathKey();
        }
        if (state instanceof CompareState.NextOnly nextOnly) {
            return nextOnly.added().pathKey();
        }
        if (state instanceof CompareState.Paired paired) {
            return paired.original().pathKey();
        }
        throw new IllegalStateException("Unknown compare state: " + state);
    }

    private static PathKey secondaryKey(CompareState state) {
        if (state instanceof CompareState.Paired paired) {
            return paired.next().pathKey();
        }
        return primaryKey(state);
    }
}
