package com.example.fssnapshot;

import com.example.fssnapshot.diff.Action;
import com.example.fssnapshot.diff.ReconciliationEngine;
import com.example.fssnapshot.model.ImportId;
import com.example.fssnapshot.store.LatestComparison;
import com.example.fssnapshot.store.StoreException;
import com.example.fssnapshot.store.VersionStore;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.util.List;

/**
 * Diffs an import against the latest import of the same lineage and renders the result as JSON.
 */
public class DiffService {
    private final ObjectMapper mapper;
    private final Logger logger;

    public DiffService() {
        this(LoggerFactory.getLogger(DiffService.class));
    }

    public DiffService(Logger logger) {
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
        this.logger = logger;
    }

    /**
     * @throws com.example.fssnapshot.store.ImportNotFoundException  if {@code importId} is unknown
     * @throws com.example.fssnapshot.store.NoNewerVersionException if {@code importId} is the latest import
     */
    public DiffReport diff(SnapshotConfig config, ImportId importId) throws StoreException {
        LatestComparison comparison;
        try (VersionStore store = config.openStore()) {
            comparison = store.fetchCompareLatest(importId, config.compareDigests());
        }
        List<Action> actions = new ReconciliationEngine(config.compareDigests()).diffAll(comparison.states());
        logger.info("Import {} -> {}: {} actions over {} correspondences",
                comparison.original().id(), comparison.latest().id(), actions.size(), comparison.states().size());
        return new DiffReport(
                comparison.original().id(),
                comparison.latest().id(),
                comparison.original().timestamp(),
                comparison.latest().timestamp(),
                actions
        );
    }

    /**
     * Writes the report as pretty-printed JSON. The writer is left open for the caller to flush and close.
     */
    public void write(DiffReport report, Writer writer) throws IOException {
        mapper.writerWithDefaultPrettyPrinter().writeValue(writer, report);
    }
}
