package com.example.fssnapshot.policy;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Derives the {@code fileType} label of a record, either from metadata or from the file content.
 */
@FunctionalInterface
public interface FileTypePolicy {
    Optional<String> fileType(Path file, Map<String, String> metadata);

    FileTypePolicy NONE = (file, metadata) -> Optional.empty();

    static FileTypePolicy fromMetadata(CalcBy calcBy) {
        return (file, metadata) -> calcBy.calculate(metadata);
    }

    static FileTypePolicy mediaType(MediaTypeDetector detector) {
        return (file, metadata) -> Optional.of(detector.detect(file));
    }
}
