package com.example.fssnapshot.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * One file observed during a scan. {@code dirName} is relative to the scan root and
 * {@code /}-separated; it is empty for files directly under the root.
 */
@JsonIgnoreProperties(value = "fileName", allowGetters = true)
public record FileRecord(
        Digest digest,
        String dirName,
        String baseName,
        double created,
        double modified,
        long size,
        boolean archived,
        String fileGroup,
        String fileType,
        Map<String, String> metadata
) {
    public FileRecord {
        Objects.requireNonNull(baseName, "baseName");
        digest = digest == null ? Digest.EMPTY : digest;
        dirName = dirName == null ? "" : dirName;
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(metadata));
    }

    @JsonProperty("fileName")
    public String fileName() {
        return dirName.isEmpty() ? baseName : dirName + "/" + baseName;
    }

    public PathKey pathKey() {
        return new PathKey(dirName, baseName);
    }

    public FileRecord withDirName(String newDirName, Map<String, String> newMetadata) {
        return new FileRecord(digest, newDirName, baseName, created, modified, size, archived,
                fileGroup, fileType, newMetadata);
    }

    public FileRecord withBaseName(String newBaseName, Map<String, String> newMetadata) {
        return new FileRecord(digest, dirName, newBaseName, created, modified, size, archived,
                fileGroup, fileType, newMetadata);
    }

    public FileRecord withArchived(boolean newArchived) {
        return new FileRecord(digest, dirName, baseName, created, modified, size, newArchived,
                fileGroup, fileType, metadata);
    }

    public FileRecord withContent(double newModified, long newSize, Digest newDigest) {
        return new FileRecord(newDigest, dirName, baseName, created, newModified, newSize, archived,
                fileGroup, fileType, metadata);
    }

    /**
     * Identity of a record by location.
     */
    public record PathKey(String dirName, String baseName) implements Comparable<PathKey> {
        @Override
        public int compareTo(PathKey other) {
            int byDir = dirName.compareTo(other.dirName);
            return byDir != 0 ? byDir : baseName.compareTo(other.baseName);
        }
    }
}
