package com.nana.srs.util;

import com.nana.srs.repository.StorageUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * SchemaManager - guarantees the {@code students} table exists before any
 * repository operation runs.
 *
 * <p>{@link #ensureSchema()} is idempotent: the DDL uses
 * {@code CREATE TABLE IF NOT EXISTS}, so it can run on every startup without
 * touching existing rows. It is called once per process by the entry point.
 *
 * <p>The key column is declared {@code AUTOINCREMENT}. Plain
 * {@code INTEGER PRIMARY KEY} lets SQLite hand out the id of a deleted
 * highest row again; {@code AUTOINCREMENT} records the high-water mark in
 * {@code sqlite_sequence} so ids are never reused for the life of the file.
 */
public final class SchemaManager {

    private static final Logger log = LoggerFactory.getLogger(SchemaManager.class);

    /** Name of the one table the store uses. */
    public static final String TABLE_STUDENTS = "students";

    /** Columns the table must carry, in declaration order. */
    public static final List<String> REQUIRED_COLUMNS = List.of("id", "name", "grade", "email");

    private static final String DDL_STUDENTS = """
            CREATE TABLE IF NOT EXISTS students (
                id      INTEGER PRIMARY KEY AUTOINCREMENT,
                name    TEXT    NOT NULL,
                grade   TEXT    NOT NULL,
                email   TEXT    NOT NULL
            );
            """;

    private static final String PRAGMA_TABLE_INFO = "PRAGMA table_info(" + TABLE_STUDENTS + ");";

    private final DatabaseManager databaseManager;

    public SchemaManager(DatabaseManager databaseManager) {
        if (databaseManager == null) {
            throw new IllegalArgumentException("DatabaseManager must not be null.");
        }
        this.databaseManager = databaseManager;
    }

    /**
     * Creates the backing file's directory and the {@code students} table if
     * they are absent, then checks that an existing table has the expected
     * columns.
     *
     * @throws StorageUnavailableException if the directory or file cannot be
     *         created or opened, the DDL fails, or a pre-existing table lacks
     *         one of the required columns
     */
    public void ensureSchema() {
        Path dbPath = databaseManager.getDbPath();
        log.info("Ensuring schema for {}", dbPath);

        try {
            initializeDirectory(dbPath);
        } catch (IOException ex) {
            throw new StorageUnavailableException(
                    "Cannot create directory for database file: " + dbPath, ex);
        }

        try (Connection connection = databaseManager.openConnection();
             Statement st = connection.createStatement()) {

            st.execute(DDL_STUDENTS);
            verifyColumns(st);
            log.info("Schema ready: table '{}' present.", TABLE_STUDENTS);

        } catch (SQLException ex) {
            throw new StorageUnavailableException(
                    "Failed to initialize the database at: " + dbPath, ex);
        }
    }

    // -----------------------------------------------------------------------
    // PRIVATE HELPERS
    // -----------------------------------------------------------------------

    /**
     * SQLite creates a missing file but not a missing directory.
     */
    private void initializeDirectory(Path dbPath) throws IOException {
        Path dir = dbPath.getParent();
        if (dir != null && !Files.isDirectory(dir)) {
            Files.createDirectories(dir);
            log.info("Created database directory: {}", dir);
        }
    }

    /**
     * A {@code students} table left behind by some other program may have a
     * different shape. Reject it instead of failing later on every query.
     */
    private void verifyColumns(Statement st) throws SQLException {
        Set<String> present = new HashSet<>();
        try (ResultSet rs = st.executeQuery(PRAGMA_TABLE_INFO)) {
            while (rs.next()) {
                present.add(rs.getString("name").toLowerCase(Locale.ROOT));
            }
        }
        for (String column : REQUIRED_COLUMNS) {
            if (!present.contains(column)) {
                throw new StorageUnavailableException(
                        "Incompatible schema: table '" + TABLE_STUDENTS
                        + "' has no column '" + column + "' (found " + present + ").");
            }
        }
        log.debug("Table '{}' columns verified: {}", TABLE_STUDENTS, present);
    }
}
