package com.elclab.components.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * DatabaseManager - Infrastructure / Utility Layer
 *
 * <p>Owns the single JDBC connection to the catalog's SQLite file.
 *
 * <p>RESPONSIBILITIES:
 * <ul>
 *   <li>Create the database file and parent directories if absent.</li>
 *   <li>Open and hold a single shared {@link Connection}.</li>
 *   <li>Apply the per-connection PRAGMAs (WAL, foreign keys, busy timeout).</li>
 *   <li>Execute the idempotent DDL for the three catalog tables.</li>
 *   <li>Run multi-statement work inside one transaction
 *       ({@link #inTransaction(SqlWork)}).</li>
 *   <li>Close the connection on {@link #shutdown()}.</li>
 * </ul>
 *
 * <p>The command line opens one instance at
 * {@link AppConfig#getDatabasePath()} (or the {@code --db} override).
 * Tests construct their own instance over a temporary file.
 *
 * <p>THREAD SAFETY:
 * The catalog is single-writer. SQLite serialises writes; the busy timeout
 * makes a competing writer wait instead of failing immediately.
 */
public final class DatabaseManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DatabaseManager.class);

    // -----------------------------------------------------------------------
    // CONSTANTS
    // -----------------------------------------------------------------------

    private static final String PRAGMA_WAL = "PRAGMA journal_mode=WAL;";

    /**
     * SQLite disables FK constraints by default; they must be enabled on
     * every connection for the link table's ON DELETE clauses to fire.
     */
    private static final String PRAGMA_FK = "PRAGMA foreign_keys=ON;";

    private static final String PRAGMA_BUSY = "PRAGMA busy_timeout=5000;";

    /** The single shared JDBC connection to the SQLite file. */
    private Connection connection;

    /** Resolved absolute path to the SQLite database file. */
    private final Path dbPath;

    // -----------------------------------------------------------------------
    // CONSTRUCTOR
    // -----------------------------------------------------------------------

    /**
     * Opens (creating if necessary) the catalog database at the given path,
     * configures PRAGMAs and runs the DDL.
     *
     * @param dbPath location of the SQLite file
     * @throws DatabaseInitException if anything in the startup sequence fails
     */
    public DatabaseManager(Path dbPath) {
        this.dbPath = dbPath.toAbsolutePath();
        log.info("Database path resolved to: {}", this.dbPath);

        try {
            initializeDirectory();
            openConnection();
            configurePragmas();
            initializeSchema();
        } catch (SQLException | IOException ex) {
            throw new DatabaseInitException(
                    "Failed to initialize the database at: " + this.dbPath, ex);
        }
    }

    /**
     * Returns the shared JDBC {@link Connection}, reopening it if it was
     * closed.
     *
     * @return the open, configured JDBC connection
     * @throws DatabaseInitException if the connection cannot be reopened
     */
    public Connection getConnection() {
        try {
            if (connection == null || connection.isClosed()) {
                log.warn("Connection was closed or null; attempting to reopen.");
                openConnection();
                configurePragmas();
            }
        } catch (SQLException ex) {
            throw new DatabaseInitException("Failed to reopen database connection.", ex);
        }
        return connection;
    }

    /** @return absolute path of the database file */
    public Path getDbPath() {
        return dbPath;
    }

    /**
     * Runs {@code work} inside a single transaction on the shared connection.
     *
     * <p>If a transaction is already open (auto-commit off) the work joins
     * it and the outer caller commits. Otherwise the work is committed on
     * success and rolled back on any exception, and auto-commit is restored
     * in every case.
     *
     * @param work the statements to run
     * @param <T>  result type
     * @return whatever {@code work} returns
     * @throws SQLException if the work or the commit fails
     */
    public <T> T inTransaction(SqlWork<T> work) throws SQLException {
        Connection c = getConnection();
        if (!c.getAutoCommit()) {
            return work.execute(c);
        }

        c.setAutoCommit(false);
        try {
            T result = work.execute(c);
            c.commit();
            return result;
        } catch (SQLException | RuntimeException ex) {
            try {
                c.rollback();
                log.debug("Transaction rolled back: {}", ex.getMessage());
            } catch (SQLException rollbackEx) {
                log.error("Rollback failed.", rollbackEx);
                ex.addSuppressed(rollbackEx);
            }
            throw ex;
        } finally {
            try {
                c.setAutoCommit(true);
            } catch (SQLException acEx) {
                log.error("Failed to re-enable auto-commit.", acEx);
            }
        }
    }

    /**
     * Checkpoints the WAL and closes the JDBC connection.
     */
    public void shutdown() {
        if (connection != null) {
            try {
                if (!connection.isClosed()) {
                    try (Statement st = connection.createStatement()) {
                        st.execute("PRAGMA wal_checkpoint(TRUNCATE);");
                    }
                    connection.close();
                    log.info("Database connection closed successfully.");
                }
            } catch (SQLException ex) {
                log.error("Error closing database connection during shutdown.", ex);
            }
        }
    }

    @Override
    public void close() {
        shutdown();
    }

    // -----------------------------------------------------------------------
    // PRIVATE INITIALIZATION METHODS
    // -----------------------------------------------------------------------

    private void initializeDirectory() throws IOException {
        Path dir = dbPath.getParent();
        if (dir != null && !Files.exists(dir)) {
            Files.createDirectories(dir);
            log.info("Created database directory: {}", dir);
        }
    }

    private void openConnection() throws SQLException {
        String url = "jdbc:sqlite:" + dbPath;
        connection = DriverManager.getConnection(url);

        DatabaseMetaData meta = connection.getMetaData();
        log.info("Connected to SQLite {} via driver {}",
                meta.getDatabaseProductVersion(),
                meta.getDriverVersion());
    }

    private void configurePragmas() throws SQLException {
        try (Statement st = connection.createStatement()) {
            st.execute(PRAGMA_WAL);
            st.execute(PRAGMA_FK);
            st.execute(PRAGMA_BUSY);
            log.debug("SQLite PRAGMAs configured: WAL mode, FK enforcement, busy timeout.");
        }
    }

    /**
     * Creates the catalog tables if they do not already exist.
     *
     * <p>TABLE DESIGN:
     * <ul>
     *   <li>{@code categories} - name is unique, compared without case.</li>
     *   <li>{@code components} - identifier is unique with the default
     *       BINARY collation, so "r10k" and "R10K" are different
     *       components. Price is stored as decimal TEXT to keep exact
     *       values such as 0.05. {@code category_id} is the denormalised
     *       current category.</li>
     *   <li>{@code component_category} - one row per (component, category)
     *       pair; both foreign keys cascade on delete.</li>
     * </ul>
     *
     * @throws SQLException if any DDL statement fails
     */
    private void initializeSchema() throws SQLException {
        log.info("Running schema initialization (CREATE TABLE IF NOT EXISTS)...");

        try (Statement st = connection.createStatement()) {

            st.execute("""
                CREATE TABLE IF NOT EXISTS categories (
                    id          INTEGER PRIMARY KEY AUTOINCREMENT,
                    name        TEXT    NOT NULL UNIQUE COLLATE NOCASE,
                    description TEXT,
                    created_at  TEXT    NOT NULL,
                    updated_at  TEXT    NOT NULL
                );
                """);

            st.execute("""
                CREATE TABLE IF NOT EXISTS components (
                    id          INTEGER PRIMARY KEY AUTOINCREMENT,
                    identifier  TEXT    NOT NULL UNIQUE,
                    description TEXT,
                    price       TEXT    NOT NULL DEFAULT '0'
                                        CHECK(CAST(price AS REAL) >= 0),
                    quantity    INTEGER NOT NULL DEFAULT 0,
                    category_id INTEGER REFERENCES categories(id) ON DELETE SET NULL,
                    created_at  TEXT    NOT NULL,
                    updated_at  TEXT    NOT NULL
                );
                """);

            st.execute("""
                CREATE TABLE IF NOT EXISTS component_category (
                    component_id INTEGER NOT NULL
                                 REFERENCES components(id) ON DELETE CASCADE,
                    category_id  INTEGER NOT NULL
                                 REFERENCES categories(id) ON DELETE CASCADE,
                    linked_at    TEXT    NOT NULL,
                    PRIMARY KEY (component_id, category_id)
                );
                """);

            st.execute("""
                CREATE INDEX IF NOT EXISTS idx_component_category_category
                    ON component_category(category_id);
                """);

            log.info("Schema initialization complete.");
        }
    }

    // -----------------------------------------------------------------------
    // NESTED TYPES
    // -----------------------------------------------------------------------

    /**
     * A unit of JDBC work executed by {@link #inTransaction(SqlWork)}.
     *
     * @param <T> result type
     */
    @FunctionalInterface
    public interface SqlWork<T> {
        T execute(Connection connection) throws SQLException;
    }

    /**
     * Unchecked exception thrown when the database cannot be opened or
     * initialised. The catalog cannot run without its database, so this
     * is fatal at startup.
     */
    public static final class DatabaseInitException extends RuntimeException {

        public DatabaseInitException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
