package com.nana.srs.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * DatabaseManager - Infrastructure / Utility Layer
 *
 * <p>Owns the location of the SQLite file and hands out connections to it.
 *
 * <p>RESPONSIBILITIES:
 * <ul>
 *   <li>Hold the resolved absolute path of the backing file.</li>
 *   <li>Open a fresh {@link Connection} for each store operation.</li>
 *   <li>Apply the per-connection PRAGMAs (FK enforcement, busy timeout).</li>
 * </ul>
 *
 * <p>CONNECTION LIFECYCLE:
 * No connection is held between calls. Callers open one with
 * {@link #openConnection()} inside a try-with-resources block, run a single
 * statement in auto-commit mode and let the block close it. The file lock is
 * therefore released on every exit path, including failures.
 */
public final class DatabaseManager {

    private static final Logger log = LoggerFactory.getLogger(DatabaseManager.class);

    // -----------------------------------------------------------------------
    // CONSTANTS
    // -----------------------------------------------------------------------

    /** Prefix recognised by the xerial SQLite JDBC driver. */
    private static final String JDBC_PREFIX = "jdbc:sqlite:";

    /**
     * SQLite disables FK constraints by default and the setting is not stored
     * in the file, so it has to be set on every connection.
     */
    private static final String PRAGMA_FK = "PRAGMA foreign_keys=ON;";

    /** Default wait before SQLite gives up on a locked file with SQLITE_BUSY. */
    public static final int DEFAULT_BUSY_TIMEOUT_MS = 5000;

    // -----------------------------------------------------------------------
    // STATE
    // -----------------------------------------------------------------------

    /** Resolved absolute path to the SQLite database file. */
    private final Path dbPath;

    private final int busyTimeoutMs;

    /** Set after the first connection so driver details are logged only once. */
    private boolean driverInfoLogged;

    // -----------------------------------------------------------------------
    // CONSTRUCTORS
    // -----------------------------------------------------------------------

    public DatabaseManager(Path dbPath) {
        this(dbPath, DEFAULT_BUSY_TIMEOUT_MS);
    }

    /**
     * @param dbPath        location of the SQLite file; relative paths are
     *                      resolved against the working directory
     * @param busyTimeoutMs how long a statement waits on a locked file
     * @throws IllegalArgumentException if dbPath is null or the timeout is negative
     */
    public DatabaseManager(Path dbPath, int busyTimeoutMs) {
        if (dbPath == null) {
            throw new IllegalArgumentException("Database path must not be null.");
        }
        if (busyTimeoutMs < 0) {
            throw new IllegalArgumentException("Busy timeout must not be negative: " + busyTimeoutMs);
        }
        this.dbPath = dbPath.toAbsolutePath().normalize();
        this.busyTimeoutMs = busyTimeoutMs;
        log.info("Database path resolved to: {}", this.dbPath);
    }

    // -----------------------------------------------------------------------
    // PUBLIC API
    // -----------------------------------------------------------------------

    /** @return absolute path of the backing file */
    public Path getDbPath() {
        return dbPath;
    }

    /** @return the JDBC URL used for every connection */
    public String getJdbcUrl() {
        return JDBC_PREFIX + dbPath;
    }

    /**
     * Opens a new, configured connection to the backing file. SQLite creates
     * the file if it does not exist yet; its parent directory must exist.
     *
     * <p>The caller owns the returned connection and must close it.
     *
     * @return an open connection in auto-commit mode
     * @throws SQLException if the driver cannot open the file or a PRAGMA fails
     */
    public Connection openConnection() throws SQLException {
        Connection connection = DriverManager.getConnection(getJdbcUrl());
        try {
            configurePragmas(connection);
            logDriverInfoOnce(connection);
        } catch (SQLException ex) {
            closeQuietly(connection, ex);
            throw ex;
        }
        return connection;
    }

    // -----------------------------------------------------------------------
    // PRIVATE HELPERS
    // -----------------------------------------------------------------------

    private void configurePragmas(Connection connection) throws SQLException {
        try (Statement st = connection.createStatement()) {
            st.execute(PRAGMA_FK);
            st.execute("PRAGMA busy_timeout=" + busyTimeoutMs + ";");
        }
    }

    private void logDriverInfoOnce(Connection connection) throws SQLException {
        if (driverInfoLogged) {
            return;
        }
        DatabaseMetaData meta = connection.getMetaData();
        log.info("Connected to SQLite {} via driver {}",
                meta.getDatabaseProductVersion(),
                meta.getDriverVersion());
        driverInfoLogged = true;
    }

    /**
     * Closes a connection whose setup failed. A failure to close is attached
     * to the original exception rather than replacing it.
     */
    private static void closeQuietly(Connection connection, SQLException primary) {
        try {
            connection.close();
        } catch (SQLException closeEx) {
            primary.addSuppressed(closeEx);
        }
    }
}
