package com.example.fssnapshot;

import com.example.fssnapshot.pattern.PathTemplate;
import com.example.fssnapshot.pattern.PathTemplateCompiler;
import com.example.fssnapshot.policy.ArchivedBy;
import com.example.fssnapshot.policy.CalcBy;
import com.example.fssnapshot.policy.FileTypePolicy;
import com.example.fssnapshot.policy.MediaTypeDetector;
import com.example.fssnapshot.store.SqliteVersionStore;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.tika.Tika;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a JSON file holding one object per named snapshot spec.
 */
public class ConfigLoader {
    private static final int DEFAULT_FILE_RETRY_ATTEMPTS = 2;
    private static final String DEFAULT_STORE_DB_FILE = "output/fs-snapshot.sqlite";

    private final ObjectMapper mapper;

    public ConfigLoader() {
        mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public Map<String, SnapshotConfig> load(Path path) throws IOException {
        Map<String, RawConfig> raw = mapper.readValue(path.toFile(), new TypeReference<LinkedHashMap<String, RawConfig>>() {
        });
        if (raw == null || raw.isEmpty()) {
            throw new IllegalArgumentException("Config must include at least one spec.");
        }
        Map<String, SnapshotConfig> configs = new LinkedHashMap<>();
        for (Map.Entry<String, RawConfig> entry : raw.entrySet()) {
            configs.put(entry.getKey(), toConfig(entry.getKey(), entry.getValue()));
        }
        return configs;
    }

    public SnapshotConfig loadSpec(Path path, String specName) throws IOException {
        SnapshotConfig config = load(path).get(specName);
        if (config == null) {
            throw new IllegalArgumentException("Config has no spec named '" + specName + "'.");
        }
        return config;
    }

    private SnapshotConfig toConfig(String specName, RawConfig raw) {
        if (raw == null) {
            throw new IllegalArgumentException(specName + ": spec must be an object.");
        }
        if (raw.rootDir == null || raw.rootDir.isBlank()) {
            throw new IllegalArgumentException(specName + ": rootDir is required.");
        }
        boolean digest = raw.digest == null || raw.digest;
        boolean compareDigests = raw.compareDigests != null ? raw.compareDigests : digest;
        if (compareDigests && !digest) {
            throw new IllegalArgumentException(specName + ": compareDigests requires digest.");
        }
        int fileRetryAttempts = raw.fileRetryAttempts != null && raw.fileRetryAttempts > 0
                ? raw.fileRetryAttempts
                : DEFAULT_FILE_RETRY_ATTEMPTS;

        return new SnapshotConfig(
                specName,
                Path.of(raw.rootDir),
                optionalString(raw.name, specName),
                compileMatchPaths(specName, raw.matchPaths),
                raw.tags == null ? Map.of() : raw.tags,
                digest,
                compareDigests,
                raw.multithread == null || raw.multithread,
                raw.followLinks != null && raw.followLinks,
                fileRetryAttempts,
                archivedBy(specName, raw.archivedBy),
                fileGroupBy(specName, raw.fileGroupBy),
                fileTypeBy(specName, raw.fileTypeBy),
                Path.of(optionalString(raw.storeDbFile, DEFAULT_STORE_DB_FILE)),
                optionalString(raw.storeDbImportTable, SqliteVersionStore.DEFAULT_IMPORT_TABLE),
                optionalString(raw.storeDbFileInfoTable, SqliteVersionStore.DEFAULT_FILE_INFO_TABLE)
        );
    }

    private Map<String, List<PathTemplate>> compileMatchPaths(String specName, Map<String, List<String>> matchPaths) {
        Map<String, List<PathTemplate>> compiled = new LinkedHashMap<>();
        if (matchPaths == null) {
            return compiled;
        }
        for (Map.Entry<String, List<String>> entry : matchPaths.entrySet()) {
            if (entry.getValue() == null || entry.getValue().isEmpty()) {
                throw new IllegalArgumentException(specName + ": matchPaths." + entry.getKey() + " has no patterns.");
            }
            compiled.put(entry.getKey(), PathTemplateCompiler.compileAll(entry.getValue()));
        }
        return compiled;
    }

    private ArchivedBy archivedBy(String specName, RawPolicy raw) {
        if (raw == null) {
            return ArchivedBy.NEVER;
        }
        if (!"has-metadata".equals(raw.type)) {
            throw new IllegalArgumentException(specName + ": archivedBy.type must be 'has-metadata', got " + raw.type);
        }
        if (raw.key == null || raw.values == null || raw.values.isEmpty()) {
            throw new IllegalArgumentException(specName + ": archivedBy needs a key and at least one value.");
        }
        return ArchivedBy.hasMetadata(raw.key, new HashSet<>(raw.values));
    }

    private CalcBy fileGroupBy(String specName, RawPolicy raw) {
        if (raw == null) {
            return CalcBy.NONE;
        }
        return fromMetadata(specName, "fileGroupBy", raw);
    }

    private FileTypePolicy fileTypeBy(String specName, RawPolicy raw) {
        if (raw == null) {
            return FileTypePolicy.NONE;
        }
        if ("media-type".equals(raw.type)) {
            return FileTypePolicy.mediaType(new MediaTypeDetector(new Tika()));
        }
        return FileTypePolicy.fromMetadata(fromMetadata(specName, "fileTypeBy", raw));
    }

    private CalcBy fromMetadata(String specName, String key, RawPolicy raw) {
        if (!"from-metadata".equals(raw.type)) {
            throw new IllegalArgumentException(specName + ": " + key + ".type is not supported: " + raw.type);
        }
        if (raw.format == null || raw.format.isBlank()) {
            throw new IllegalArgumentException(specName + ": " + key + ".format is required.");
        }
        return CalcBy.fromMetadata(raw.format);
    }

    private String optionalString(String value, String fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return value;
    }

    private static class RawConfig {
        public String rootDir;
        public String name;
        public LinkedHashMap<String, List<String>> matchPaths;
        public Map<String, String> tags;
        public Boolean digest;
        public Boolean compareDigests;
        public Boolean multithread;
        public Boolean followLinks;
        public Integer fileRetryAttempts;
        public RawPolicy archivedBy;
        public RawPolicy fileGroupBy;
        public RawPolicy fileTypeBy;
        public String storeDbFile;
        public String storeDbImportTable;
        public String storeDbFileInfoTable;
    }

    private static class RawPolicy {
        public String type;
        public String key;
        public List<String> values = new ArrayList<>();
        public String format;
    }
}
