package com.example.fssnapshot.scan;

import com.example.fssnapshot.model.Digest;
import com.example.fssnapshot.model.FileRecord;
import com.example.fssnapshot.policy.ArchivedBy;
import com.example.fssnapshot.policy.CalcBy;
import com.example.fssnapshot.policy.FileTypePolicy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.util.Map;

/**
 * Reads the attributes (and optionally the digest) of one file and applies the
 * archive, file-group and file-type policies to its extracted metadata.
 */
public class FileRecordExtractor {
    private final DigestEngine digestEngine;
    private final boolean digestEnabled;
    private final ArchivedBy archivedBy;
    private final CalcBy fileGroupBy;
    private final FileTypePolicy fileTypeBy;
    private final boolean followLinks;

    public FileRecordExtractor(DigestEngine digestEngine,
                               boolean digestEnabled,
                               ArchivedBy archivedBy,
                               CalcBy fileGroupBy,
                               FileTypePolicy fileTypeBy,
                               boolean followLinks) {
        this.digestEngine = digestEngine;
        this.digestEnabled = digestEnabled;
        this.archivedBy = archivedBy;
        this.fileGroupBy = fileGroupBy;
        this.fileTypeBy = fileTypeBy;
        this.followLinks = followLinks;
    }

    /**
     * Builds the record of a file that matched a template.
     *
     * @param relativePath the {@code /}-separated path relative to the scan root
     */
    public FileRecord extract(Path path, String relativePath, Map<String, String> metadata) throws IOException {
        return build(path, relativePath, metadata, true);
    }

    /**
     * Builds the record of a file that no template accepted: empty metadata, never archived, no group.
     */
    public FileRecord extractUnmatched(Path path, String relativePath) throws IOException {
        return build(path, relativePath, Map.of(), false);
    }

    private FileRecord build(Path path, String relativePath, Map<String, String> metadata, boolean matched)
            throws IOException {
        LinkOption[] linkOptions = followLinks ? new LinkOption[0] : new LinkOption[]{LinkOption.NOFOLLOW_LINKS};
        BasicFileAttributes attributes = Files.readAttributes(path, BasicFileAttributes.class, linkOptions);
        long size = attributes.size();
        Digest digest = digestEnabled ? digestEngine.digest(path, size) : Digest.EMPTY;

        int slash = relativePath.lastIndexOf('/');
        String dirName = slash < 0 ? "" : relativePath.substring(0, slash);
        String baseName = relativePath.substring(slash + 1);

        return new FileRecord(
                digest,
                dirName,
                baseName,
                seconds(attributes.creationTime()),
                seconds(attributes.lastModifiedTime()),
                size,
                matched && archivedBy.isArchived(metadata),
                matched ? fileGroupBy.calculate(metadata).orElse(null) : null,
                fileTypeBy.fileType(path, metadata).orElse(null),
                metadata
        );
    }

    static double seconds(FileTime time) {
        var instant = time.toInstant();
        return instant.getEpochSecond() + instant.getNano() / 1_000_000_000d;
    }
}
