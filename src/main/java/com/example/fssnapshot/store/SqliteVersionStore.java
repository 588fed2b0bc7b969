package com.example.fssnapshot.store;

import com.example.fssnapshot.diff.CompareState;
import com.example.fssnapshot.diff.CorrespondenceBuilder;
import com.example.fssnapshot.model.Digest;
import com.example.fssnapshot.model.FileRecord;
import com.example.fssnapshot.model.ImportId;
import com.example.fssnapshot.model.ImportRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * {@link VersionStore} on an SQLite database file. Every write runs in its own transaction, so an
 * import row and each batch of records become visible as a whole or not at all.
 */
public final class SqliteVersionStore implements VersionStore {
    public static final String DEFAULT_IMPORT_TABLE = "__import__";
    public static final String DEFAULT_FILE_INFO_TABLE = "file_info";

    private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z0-9_]+");
    private static final int BUSY_TIMEOUT_MILLIS = 30_000;
    private static final int BATCH_SIZE = 500;

    private final Connection connection;
    private final String importTable;
    private final String fileInfoTable;
    private final Logger logger;

    private SqliteVersionStore(Connection connection, String importTable, String fileInfoTable, Logger logger) {
        this.connection = connection;
        this.importTable = importTable;
        this.fileInfoTable = fileInfoTable;
        this.logger = logger;
    }

    public static SqliteVersionStore open(Path dbFile, String importTable, String fileInfoTable)
            throws StoreException {
        return open(dbFile, importTable, fileInfoTable, loggerFor(dbFile));
    }

    /**
     * Opens a connection and makes sure both tables and their indexes exist.
     */
    public static SqliteVersionStore open(Path dbFile, String importTable, String fileInfoTable, Logger logger)
            throws StoreException {
        checkTableName(importTable);
        checkTableName(fileInfoTable);
        Path absolute = dbFile.toAbsolutePath().normalize();
        try {
            if (absolute.getParent() != null) {
                Files.createDirectories(absolute.getParent());
            }
        } catch (IOException ex) {
            throw new StoreException("open", null, ex);
        }
        Connection connection;
        try {
            connection = DriverManager.getConnection("jdbc:sqlite:" + absolute);
        } catch (SQLException ex) {
            logger.error("Failed to open {}: {}", absolute, ex.getMessage());
            throw new StoreException("open", null, ex);
        }
        SqliteVersionStore store = new SqliteVersionStore(connection, importTable, fileInfoTable, logger);
        try {
            store.configure();
            store.initTables();
        } catch (StoreException ex) {
            store.closeQuietly();
            throw ex;
        }
        return store;
    }

    /**
     * SQL is traced on a logger named after the database file.
     */
    public static Logger loggerFor(Path dbFile) {
        String fileName = dbFile.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return LoggerFactory.getLogger("fs-snapshot.store." + (dot > 0 ? fileName.substring(0, dot) : fileName));
    }

    @Override
    public ImportId createImport(String name, Map<String, String> tags) throws StoreException {
        ImportId id = ImportId.random();
        long timestamp = Instant.now().getEpochSecond();
        String insert = "INSERT INTO " + literal(importTable) + " (`id`, `timestamp`, `name`, `tags`) VALUES (?, ?, ?, ?)";
        String delete = "DELETE FROM " + literal(fileInfoTable) + " WHERE `import_id` = ?";
        inTransaction("createImport", insert, () -> {
            try (PreparedStatement statement = prepare(insert)) {
                statement.setBytes(1, id.toBytes());
                statement.setLong(2, timestamp);
                statement.setString(3, name);
                statement.setString(4, TagCodec.serialize(TagCodec.normalizeKeys(tags)));
                statement.executeUpdate();
            }
            try (PreparedStatement statement = prepare(delete)) {
                statement.setBytes(1, id.toBytes());
                statement.executeUpdate();
            }
            return null;
        });
        logger.info("Created import {} for '{}'", id, name);
        return id;
    }

    @Override
    public int importFiles(ImportId id, Collection<FileRecord> records) throws StoreException {
        String sql = "INSERT INTO " + literal(fileInfoTable) + """
                 (`digest`, `dir_name`, `base_name`, `created`, `modified`, `size`,
                  `archived`, `file_group`, `file_type`, `tags`, `import_id`)
                 VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)""";
        int inserted = inTransaction("importFiles", sql, () -> {
            int count = 0;
            try (PreparedStatement statement = prepare(sql)) {
                for (FileRecord record : records) {
                    bind(statement, id, record);
                    statement.addBatch();
                    if (++count % BATCH_SIZE == 0) {
                        statement.executeBatch();
                    }
                }
                statement.executeBatch();
            }
            return count;
        });
        logger.info("Imported {} records into {}", inserted, id);
        return inserted;
    }

    @Override
    public ImportRecord fetchImport(ImportId id) throws StoreException {
        String sql = "SELECT `id`, `timestamp`, `name`, `tags` FROM " + literal(importTable) + " WHERE `id` = ?";
        Optional<ImportRecord> found = query("fetchImport", sql, statement -> {
            statement.setBytes(1, id.toBytes());
            try (ResultSet rows = statement.executeQuery()) {
                return rows.next() ? Optional.of(readImport(rows)) : Optional.<ImportRecord>empty();
            }
        });
        return found.orElseThrow(() -> new ImportNotFoundException(id));
    }

    @Override
    public Optional<ImportId> fetchLatestImportId(String name) throws StoreException {
        String sql = "SELECT `id` FROM " + literal(importTable)
                + " WHERE `name` = ? ORDER BY `timestamp` DESC, `rowid` DESC LIMIT 1";
        return query("fetchLatestImportId", sql, statement -> {
            statement.setString(1, name);
            try (ResultSet rows = statement.executeQuery()) {
                return rows.next() ? Optional.of(ImportId.fromBytes(rows.getBytes("id"))) : Optional.<ImportId>empty();
            }
        });
    }

    @Override
    public List<FileRecord> fetchRecords(ImportId id) throws StoreException {
        String sql = "SELECT * FROM " + literal(fileInfoTable)
                + " WHERE `import_id` = ? ORDER BY `dir_name`, `base_name`";
        return query("fetchRecords", sql, statement -> {
            statement.setBytes(1, id.toBytes());
            List<FileRecord> records = new ArrayList<>();
            try (ResultSet rows = statement.executeQuery()) {
                while (rows.next()) {
                    records.add(readRecord(rows));
                }
            }
            return records;
        });
    }

    @Override
    public List<CompareState> fetchCorrespondence(ImportId prevId, ImportId nextId, boolean compareDigests)
            throws StoreException {
        fetchImport(prevId);
        fetchImport(nextId);
        List<FileRecord> previous = fetchRecords(prevId);
        List<FileRecord> next = fetchRecords(nextId);
        logger.debug("Comparing {} records of {} with {} records of {}", previous.size(), prevId, next.size(), nextId);
        return new CorrespondenceBuilder(compareDigests).build(previous, next);
    }

    @Override
    public void close() throws StoreException {
        try {
            connection.close();
        } catch (SQLException ex) {
            throw new StoreException("close", null, ex);
        }
    }

    private void configure() throws StoreException {
        execute("configure", "PRAGMA foreign_keys = ON");
        execute("configure", "PRAGMA busy_timeout = " + BUSY_TIMEOUT_MILLIS);
        execute("configure", "PRAGMA journal_mode = WAL");
    }

    private void initTables() throws StoreException {
        String imports = literal(importTable);
        String files = literal(fileInfoTable);
        execute("initTables", "CREATE TABLE IF NOT EXISTS " + imports + """
                 ( `id` BLOB PRIMARY KEY
                 , `timestamp` INTEGER NOT NULL
                 , `name` TEXT NOT NULL
                 , `tags` TEXT
                 )""");
        execute("initTables", index(importTable, "timestamp"));
        execute("initTables", index(importTable, "name"));
        execute("initTables", "CREATE TABLE IF NOT EXISTS " + files + """
                 ( `digest` BLOB NULL
                 , `dir_name` TEXT NOT NULL
                 , `base_name` TEXT NOT NULL
                 , `created` REAL NOT NULL
                 , `modified` REAL NOT NULL
                 , `size` INTEGER NOT NULL
                 , `archived` INTEGER NOT NULL
                 , `file_group` TEXT NULL
                 , `file_type` TEXT NULL
                 , `tags` TEXT NULL
                 , `import_id` BLOB NOT NULL
                 , FOREIGN KEY(`import_id`) REFERENCES\s""" + imports + "(`id`)\n)");
        for (String column : List.of("digest", "dir_name", "base_name", "file_group", "file_type")) {
            execute("initTables", index(fileInfoTable, column));
        }
        execute("initTables", "CREATE UNIQUE INDEX IF NOT EXISTS " + literal(fileInfoTable + "_path")
                + " ON " + files + " (`import_id`, `dir_name`, `base_name`)");
    }

    private static String index(String table, String column) {
        return "CREATE INDEX IF NOT EXISTS " + literal(table + "_" + column)
                + " ON " + literal(table) + " (`" + column + "`)";
    }

    private void bind(PreparedStatement statement, ImportId id, FileRecord record) throws SQLException {
        statement.setBytes(1, record.digest().bytes());
        statement.setString(2, record.dirName());
        statement.setString(3, record.baseName());
        statement.setDouble(4, record.created());
        statement.setDouble(5, record.modified());
        statement.setLong(6, record.size());
        statement.setInt(7, record.archived() ? 1 : 0);
        setNullableString(statement, 8, record.fileGroup());
        setNullableString(statement, 9, record.fileType());
        statement.setString(10, TagCodec.serialize(record.metadata()));
        statement.setBytes(11, id.toBytes());
    }

    private static void setNullableString(PreparedStatement statement, int index, String value) throws SQLException {
        if (value == null) {
            statement.setNull(index, Types.VARCHAR);
        } else {
            statement.setString(index, value);
        }
    }

    private static ImportRecord readImport(ResultSet rows) throws SQLException {
        return new ImportRecord(
                ImportId.fromBytes(rows.getBytes("id")),
                Instant.ofEpochSecond(rows.getLong("timestamp")),
                rows.getString("name"),
                TagCodec.deserialize(rows.getString("tags"))
        );
    }

    private static FileRecord readRecord(ResultSet rows) throws SQLException {
        return new FileRecord(
                Digest.of(rows.getBytes("digest")),
                rows.getString("dir_name"),
                rows.getString("base_name"),
                rows.getDouble("created"),
                rows.getDouble("modified"),
                rows.getLong("size"),
                rows.getInt("archived") == 1,
                rows.getString("file_group"),
                rows.getString("file_type"),
                TagCodec.deserialize(rows.getString("tags"))
        );
    }

    private void execute(String operation, String sql) throws StoreException {
        logger.debug("{}", sql);
        try (Statement statement = connection.createStatement()) {
            statement.execute(sql);
        } catch (SQLException ex) {
            throw failure(operation, sql, ex);
        }
    }

    private PreparedStatement prepare(String sql) throws SQLException {
        logger.debug("{}", sql);
        return connection.prepareStatement(sql);
    }

    private <T> T query(String operation, String sql, SqlFunction<PreparedStatement, T> body) throws StoreException {
        try (PreparedStatement statement = prepare(sql)) {
            return body.apply(statement);
        } catch (SQLException ex) {
            throw failure(operation, sql, ex);
        }
    }

    private <T> T inTransaction(String operation, String sql, SqlWork<T> work) throws StoreException {
        try {
            connection.setAutoCommit(false);
            try {
                T result = work.run();
                connection.commit();
                return result;
            } catch (SQLException | RuntimeException ex) {
                connection.rollback();
                throw ex;
            } finally {
                connection.setAutoCommit(true);
            }
        } catch (SQLException ex) {
            throw failure(operation, sql, ex);
        }
    }

    private StoreException failure(String operation, String sql, SQLException ex) {
        logger.error("{}: {}", ex.getClass().getSimpleName(), ex.getMessage());
        return new StoreException(operation, sql, ex);
    }

    private void closeQuietly() {
        try {
            connection.close();
        } catch (SQLException ex) {
            logger.warn("Failed to close connection after setup failure", ex);
        }
    }

    private static void checkTableName(String table) {
        if (table == null || !TABLE_NAME.matcher(table).matches()) {
            throw new IllegalArgumentException("Invalid table name: " + table);
        }
    }

    private static String literal(String name) {
        return "`" + name + "`";
    }

    @FunctionalInterface
    private interface SqlFunction<A, R> {
        R apply(A argument) throws SQLException;
    }

    @FunctionalInterface
    private interface SqlWork<T> {
        T run() throws SQLException;
    }
}
