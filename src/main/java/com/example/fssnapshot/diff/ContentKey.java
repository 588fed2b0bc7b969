package com.example.fssnapshot.diff;

import com.example.fssnapshot.model.Digest;
import com.example.fssnapshot.model.FileRecord;

import java.util.Optional;

/**
 * Identity of a record by content: its digest, or {@code (size, modified)} when digests are not compared.
 */
record ContentKey(Digest digest, long size, double modified) {

    /**
     * Empty when digests are compared but the record was never digested; such a record
     * can only correspond to another one by path.
     */
    static Optional<ContentKey> of(FileRecord record, boolean compareDigests) {
        if (compareDigests) {
            return record.digest().isEmpty()
                    ? Optional.empty()
                    : Optional.of(new ContentKey(record.digest(), 0L, 0d));
        }
        return Optional.of(new ContentKey(Digest.EMPTY, record.size(), record.modified()));
    }

    static boolean sameContent(FileRecord a, FileRecord b, boolean compareDigests) {
        if (compareDigests) {
            return a.digest().equals(b.digest());
        }
        return a.size() == b.size() && Double.compare(a.modified(), b.modified()) == 0;
    }
}
