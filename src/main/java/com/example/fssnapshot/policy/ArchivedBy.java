package com.example.fssnapshot.policy;

import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Decides from extracted path metadata whether a file sits in an archive location.
 */
@FunctionalInterface
public interface ArchivedBy {
    boolean isArchived(Map<String, String> metadata);

    /**
     * Default policy: nothing is archived.
     */
    ArchivedBy NEVER = metadata -> false;

    static ArchivedBy hasMetadata(String key, Set<String> values) {
        return new HasMetadata(key, values);
    }

    /**
     * Archived when {@code metadata[key]} equals one of {@code values}, ignoring ASCII case.
     */
    record HasMetadata(String key, Set<String> values) implements ArchivedBy {
        public HasMetadata {
            if (key == null || key.isBlank()) {
                throw new IllegalArgumentException("has-metadata requires a key.");
            }
            if (values == null || values.isEmpty()) {
                throw new IllegalArgumentException("has-metadata requires at least one value.");
            }
            values = values.stream().map(HasMetadata::fold).collect(Collectors.toUnmodifiableSet());
        }

        @Override
        public boolean isArchived(Map<String, String> metadata) {
            String value = metadata.get(key);
            return value != null && values.contains(fold(value));
        }

        private static String fold(String value) {
            return value.trim().toLowerCase(Locale.ROOT);
        }
    }
}
