package com.example.fssnapshot.model;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Metadata of one snapshot. Imports sharing a {@code name} form a lineage.
 */
public record ImportRecord(
        ImportId id,
        Instant timestamp,
        String name,
        Map<String, String> tags
) {
    public ImportRecord {
        tags = Collections.unmodifiableMap(new TreeMap<>(tags));
    }
}
