package com.example.fssnapshot;

import com.example.fssnapshot.pattern.PathTemplate;
import com.example.fssnapshot.pattern.PathTemplateCompiler;
import com.example.fssnapshot.policy.ArchivedBy;
import com.example.fssnapshot.policy.CalcBy;
import com.example.fssnapshot.policy.FileTypePolicy;
import com.example.fssnapshot.store.SqliteVersionStore;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

final class SnapshotFixtures {
    private SnapshotFixtures() {
    }

    static SnapshotConfig config(Path root, Path dbFile, boolean multithread) {
        return config(root, dbFile, multithread, false);
    }

    static SnapshotConfig config(Path root, Path dbFile, boolean multithread, boolean followLinks) {
        Map<String, List<String>> patterns = new LinkedHashMap<>();
        patterns.put("csv", List.of("{protocol}/{id}.csv"));
        patterns.put("archive", List.of("{status}/{protocol}/{id}.csv"));
        Map<String, List<PathTemplate>> compiled = new LinkedHashMap<>();
        patterns.forEach((category, list) -> compiled.put(category, PathTemplateCompiler.compileAll(list)));
        return new SnapshotConfig(
                "deliveries",
                root,
                "deliveries",
                compiled,
                Map.of("site", "north"),
                true,
                true,
                multithread,
                followLinks,
                2,
                ArchivedBy.hasMetadata("status", Set.of("archive")),
                CalcBy.fromMetadata("{protocol}"),
                FileTypePolicy.NONE,
                dbFile,
                SqliteVersionStore.DEFAULT_IMPORT_TABLE,
                SqliteVersionStore.DEFAULT_FILE_INFO_TABLE
        );
    }

    static Path write(Path root, String relative, String content) throws Exception {
        Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        return Files.writeString(file, content);
    }
}
