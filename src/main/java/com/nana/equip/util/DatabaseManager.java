package com.nana.equip.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * DatabaseManager: Infrastructure / Utility Layer
 *
 * <p>Owns the JDBC connection to the SQLite record store used by the import
 * engine:
 * <ul>
 *   <li>Resolves the JDBC URL (from {@link AppConfig} or a caller).</li>
 *   <li>Creates the parent directory of a file database if absent.</li>
 *   <li>Opens and holds a single shared {@link Connection}.</li>
 *   <li>Creates every table on first use and tracks the schema version.</li>
 *   <li>Closes the connection on {@link #shutdown()}.</li>
 * </ul>
 *
 * <p>Callers construct their own manager with {@link #DatabaseManager(String)}
 * or {@link #forFile(Path)} and close it with {@link #shutdown()}.
 *
 * <p>THREAD SAFETY:
 * SQLite serialises writers. WAL mode plus a busy timeout lets concurrent
 * readers proceed while an import writes. Imports against the same project
 * must still be serialised by the caller.
 */
public final class DatabaseManager {

    private static final Logger log = LoggerFactory.getLogger(DatabaseManager.class);

    // -----------------------------------------------------------------------
    // CONSTANTS
    // -----------------------------------------------------------------------

    private static final String URL_PREFIX = "jdbc:sqlite:";

    /** Schema version written to new databases and required of existing ones. */
    private static final int CURRENT_SCHEMA_VERSION = 1;

    private static final String PRAGMA_WAL  = "PRAGMA journal_mode=WAL;";
    private static final String PRAGMA_FK   = "PRAGMA foreign_keys=ON;";
    private static final String PRAGMA_BUSY = "PRAGMA busy_timeout=5000;";

    // -----------------------------------------------------------------------
    // INSTANCE STATE
    // -----------------------------------------------------------------------

    private Connection connection;

    private final String jdbcUrl;

    // -----------------------------------------------------------------------
    // CONSTRUCTION
    // -----------------------------------------------------------------------

    /**
     * Opens (creating if needed) the database at {@code jdbcUrl} and makes
     * sure the schema exists.
     *
     * @param jdbcUrl a {@code jdbc:sqlite:} URL
     * @throws DatabaseInitException if anything in the startup sequence fails
     */
    public DatabaseManager(String jdbcUrl) {
        if (jdbcUrl == null || !jdbcUrl.startsWith(URL_PREFIX)) {
            throw new IllegalArgumentException("Expected a jdbc:sqlite: URL but got: " + jdbcUrl);
        }
        this.jdbcUrl = jdbcUrl;
        log.info("Database URL resolved to: {}", jdbcUrl);

        try {
            initializeDirectory();
            openConnection();
            configurePragmas();
            initializeSchema();
            checkSchemaVersion();
        } catch (SQLException | IOException ex) {
            shutdown();
            throw new DatabaseInitException(
                    "Failed to initialize the database at: " + jdbcUrl, ex);
        }
    }

    /**
     * Convenience for file databases.
     *
     * @param dbFile path of the SQLite file
     * @return a manager for that file
     */
    public static DatabaseManager forFile(Path dbFile) {
        return new DatabaseManager(URL_PREFIX + dbFile.toAbsolutePath());
    }

    // -----------------------------------------------------------------------
    // PUBLIC API
    // -----------------------------------------------------------------------

    /**
     * Returns the shared JDBC connection, reopening it if it was closed.
     *
     * @return the open, configured connection
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

    /** @return the JDBC URL this manager was opened with */
    public String getJdbcUrl() {
        return jdbcUrl;
    }

    /**
     * Checkpoints the WAL and closes the connection. Errors are logged, not
     * thrown, since the caller is shutting down.
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

    // -----------------------------------------------------------------------
    // PRIVATE INITIALIZATION METHODS
    // -----------------------------------------------------------------------

    private void initializeDirectory() throws IOException {
        String location = jdbcUrl.substring(URL_PREFIX.length());
        if (location.isBlank() || location.startsWith(":memory:") || location.startsWith("file:")) {
            return;
        }
        Path dir = Paths.get(location).toAbsolutePath().getParent();
        if (dir != null && !Files.exists(dir)) {
            Files.createDirectories(dir);
            log.info("Created database directory: {}", dir);
        }
    }

    private void openConnection() throws SQLException {
        connection = DriverManager.getConnection(jdbcUrl);
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
     * Creates every table and index the import engine uses. All statements
     * are {@code IF NOT EXISTS}, so this runs on every start.
     *
     * <p>Timestamps are TEXT in {@code yyyy-MM-dd HH:mm:ss}; booleans are
     * INTEGER 0/1; ids are UUID strings generated by the repositories.
     */
    private void initializeSchema() throws SQLException {
        log.info("Running schema initialization (CREATE TABLE IF NOT EXISTS)...");

        try (Statement st = connection.createStatement()) {

            // ----------------------------------------------------------
            // Batch ledger
            // ----------------------------------------------------------
            st.execute("""
                CREATE TABLE IF NOT EXISTS equipment_import_batches (
                    id             TEXT    PRIMARY KEY,
                    project_id     TEXT    NOT NULL,
                    filename       TEXT    NOT NULL,
                    status         TEXT    NOT NULL DEFAULT 'pending'
                                           CHECK(status IN ('pending','processed','failed')),
                    total_rows     INTEGER NOT NULL DEFAULT 0 CHECK(total_rows >= 0),
                    processed_rows INTEGER NOT NULL DEFAULT 0 CHECK(processed_rows >= 0),
                    error_message  TEXT,
                    created_by     TEXT,
                    created_at     TEXT    NOT NULL,
                    completed_at   TEXT
                );
                """);
            st.execute("""
                CREATE INDEX IF NOT EXISTS idx_import_batches_project
                    ON equipment_import_batches(project_id);
                """);

            // ----------------------------------------------------------
            // Rooms and aliases
            // ----------------------------------------------------------
            st.execute("""
                CREATE TABLE IF NOT EXISTS project_rooms (
                    id              TEXT    PRIMARY KEY,
                    project_id      TEXT    NOT NULL,
                    name            TEXT    NOT NULL,
                    normalized_name TEXT    NOT NULL,
                    is_headend      INTEGER NOT NULL DEFAULT 0,
                    notes           TEXT,
                    created_by      TEXT,
                    created_at      TEXT    NOT NULL,
                    UNIQUE(project_id, normalized_name)
                );
                """);
            st.execute("""
                CREATE TABLE IF NOT EXISTS project_room_aliases (
                    id               TEXT PRIMARY KEY,
                    project_id       TEXT NOT NULL,
                    project_room_id  TEXT NOT NULL
                                          REFERENCES project_rooms(id) ON DELETE CASCADE,
                    alias            TEXT NOT NULL,
                    normalized_alias TEXT NOT NULL,
                    created_at       TEXT NOT NULL,
                    UNIQUE(project_id, normalized_alias)
                );
                """);

            // ----------------------------------------------------------
            // Project-independent catalog and suppliers
            // ----------------------------------------------------------
            st.execute("""
                CREATE TABLE IF NOT EXISTS global_parts (
                    id              TEXT PRIMARY KEY,
                    part_number     TEXT NOT NULL COLLATE NOCASE UNIQUE,
                    name            TEXT,
                    description     TEXT,
                    manufacturer    TEXT,
                    model           TEXT,
                    category        TEXT,
                    unit_of_measure TEXT DEFAULT 'ea',
                    created_at      TEXT NOT NULL,
                    updated_at      TEXT NOT NULL
                );
                """);
            st.execute("""
                CREATE TABLE IF NOT EXISTS suppliers (
                    id         TEXT    PRIMARY KEY,
                    name       TEXT    NOT NULL,
                    short_code TEXT    UNIQUE,
                    is_active  INTEGER NOT NULL DEFAULT 1,
                    created_at TEXT    NOT NULL
                );
                """);

            // ----------------------------------------------------------
            // Equipment instances
            // ----------------------------------------------------------
            st.execute("""
                CREATE TABLE IF NOT EXISTS project_equipment (
                    id                     TEXT    PRIMARY KEY,
                    project_id             TEXT    NOT NULL,
                    room_id                TEXT    REFERENCES project_rooms(id) ON DELETE SET NULL,
                    csv_batch_id           TEXT    REFERENCES equipment_import_batches(id) ON DELETE SET NULL,
                    global_part_id         TEXT    REFERENCES global_parts(id) ON DELETE SET NULL,
                    supplier_id            TEXT    REFERENCES suppliers(id) ON DELETE SET NULL,
                    name                   TEXT    NOT NULL,
                    description            TEXT,
                    manufacturer           TEXT,
                    model                  TEXT,
                    part_number            TEXT,
                    install_side           TEXT    NOT NULL DEFAULT 'room_end'
                                                   CHECK(install_side IN ('head_end','room_end')),
                    equipment_type         TEXT    NOT NULL DEFAULT 'part'
                                                   CHECK(equipment_type IN ('part','labor','service','fee')),
                    planned_quantity       REAL    NOT NULL DEFAULT 1,
                    unit_of_measure        TEXT    DEFAULT 'ea',
                    unit_cost              REAL    NOT NULL DEFAULT 0,
                    unit_price             REAL    NOT NULL DEFAULT 0,
                    supplier               TEXT,
                    notes                  TEXT,
                    is_active              INTEGER NOT NULL DEFAULT 1,
                    metadata               TEXT,
                    instance_number        INTEGER NOT NULL DEFAULT 1,
                    instance_name          TEXT,
                    parent_import_group    TEXT,
                    ordered_quantity       REAL    NOT NULL DEFAULT 0,
                    ordered_date           TEXT,
                    received_quantity      REAL    NOT NULL DEFAULT 0,
                    received_date          TEXT,
                    received_by            TEXT,
                    ordered_confirmed      INTEGER NOT NULL DEFAULT 0,
                    ordered_confirmed_at   TEXT,
                    ordered_confirmed_by   TEXT,
                    delivered_confirmed    INTEGER NOT NULL DEFAULT 0,
                    delivered_confirmed_at TEXT,
                    delivered_confirmed_by TEXT,
                    installed              INTEGER NOT NULL DEFAULT 0,
                    installed_at           TEXT,
                    installed_by           TEXT,
                    created_by             TEXT,
                    created_at             TEXT    NOT NULL,
                    updated_at             TEXT    NOT NULL
                );
                """);
            st.execute("""
                CREATE INDEX IF NOT EXISTS idx_project_equipment_project
                    ON project_equipment(project_id);
                """);
            st.execute("""
                CREATE INDEX IF NOT EXISTS idx_project_equipment_group
                    ON project_equipment(parent_import_group);
                """);

            st.execute("""
                CREATE TABLE IF NOT EXISTS project_equipment_inventory (
                    id                   TEXT    PRIMARY KEY,
                    project_equipment_id TEXT    NOT NULL
                                                 REFERENCES project_equipment(id) ON DELETE CASCADE,
                    warehouse            TEXT    NOT NULL,
                    quantity_on_hand     REAL    NOT NULL DEFAULT 0,
                    quantity_assigned    REAL    NOT NULL DEFAULT 0,
                    needs_order          INTEGER NOT NULL DEFAULT 0,
                    rma_required         INTEGER NOT NULL DEFAULT 0,
                    notes                TEXT,
                    created_at           TEXT    NOT NULL,
                    UNIQUE(project_equipment_id, warehouse)
                );
                """);
            st.execute("""
                CREATE TABLE IF NOT EXISTS project_equipment_instances (
                    id                   TEXT PRIMARY KEY,
                    project_equipment_id TEXT NOT NULL
                                              REFERENCES project_equipment(id) ON DELETE CASCADE,
                    identifier           TEXT,
                    status               TEXT DEFAULT 'planned',
                    serial_number        TEXT,
                    notes                TEXT,
                    created_at           TEXT NOT NULL
                );
                """);

            // ----------------------------------------------------------
            // Labor budget
            // ----------------------------------------------------------
            st.execute("""
                CREATE TABLE IF NOT EXISTS project_labor_budget (
                    id            TEXT PRIMARY KEY,
                    project_id    TEXT NOT NULL,
                    room_id       TEXT REFERENCES project_rooms(id) ON DELETE SET NULL,
                    labor_type    TEXT NOT NULL,
                    description   TEXT,
                    planned_hours REAL NOT NULL DEFAULT 0,
                    actual_hours  REAL NOT NULL DEFAULT 0,
                    hourly_rate   REAL NOT NULL DEFAULT 0,
                    supplier      TEXT,
                    supplier_id   TEXT REFERENCES suppliers(id) ON DELETE SET NULL,
                    csv_batch_id  TEXT REFERENCES equipment_import_batches(id) ON DELETE SET NULL,
                    notes         TEXT,
                    created_by    TEXT,
                    created_at    TEXT NOT NULL,
                    updated_at    TEXT NOT NULL
                );
                """);

            // ----------------------------------------------------------
            // Wire drop links (wire drops themselves live elsewhere)
            // ----------------------------------------------------------
            st.execute("""
                CREATE TABLE IF NOT EXISTS wire_drop_equipment_links (
                    id                   TEXT    PRIMARY KEY,
                    wire_drop_id         TEXT    NOT NULL,
                    project_equipment_id TEXT    NOT NULL
                                                 REFERENCES project_equipment(id) ON DELETE CASCADE,
                    link_side            TEXT    NOT NULL DEFAULT 'room_end'
                                                 CHECK(link_side IN ('room_end','head_end','both')),
                    sort_order           INTEGER NOT NULL DEFAULT 0,
                    quantity             REAL    NOT NULL DEFAULT 1,
                    notes                TEXT,
                    created_by           TEXT,
                    created_at           TEXT    NOT NULL,
                    UNIQUE(wire_drop_id, project_equipment_id, link_side)
                );
                """);
            st.execute("""
                CREATE INDEX IF NOT EXISTS idx_wire_drop_links_equipment
                    ON wire_drop_equipment_links(project_equipment_id);
                """);

            st.execute("""
                CREATE TABLE IF NOT EXISTS schema_version (
                    version     INTEGER NOT NULL
                );
                """);

            log.info("Schema initialization complete.");
        }
    }

    private void checkSchemaVersion() throws SQLException {
        int storedVersion = getStoredSchemaVersion();

        if (storedVersion == -1) {
            insertSchemaVersion(CURRENT_SCHEMA_VERSION);
            log.info("New database. Schema version set to {}.", CURRENT_SCHEMA_VERSION);
            return;
        }

        if (storedVersion != CURRENT_SCHEMA_VERSION) {
            throw new SQLException("Unsupported schema version " + storedVersion
                    + "; this build expects version " + CURRENT_SCHEMA_VERSION + ".");
        }
        log.debug("Schema is at version {}.", CURRENT_SCHEMA_VERSION);
    }

    private int getStoredSchemaVersion() throws SQLException {
        String sql = "SELECT version FROM schema_version LIMIT 1;";
        try (PreparedStatement ps = connection.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            if (rs.next()) {
                return rs.getInt("version");
            }
            return -1;
        }
    }

    private void insertSchemaVersion(int version) throws SQLException {
        String sql = "INSERT INTO schema_version (version) VALUES (?);";
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            ps.setInt(1, version);
            ps.executeUpdate();
        }
    }

    // -----------------------------------------------------------------------
    // INNER EXCEPTION CLASS
    // -----------------------------------------------------------------------

    /**
     * Unchecked exception thrown when the database cannot be opened or
     * initialised. The engine cannot do anything useful without its store.
     */
    public static final class DatabaseInitException extends RuntimeException {

        public DatabaseInitException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
