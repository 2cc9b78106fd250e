package com.nana.equip.repository;

import com.nana.equip.util.DatabaseManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.UUID;

/**
 * Shared plumbing for the SQLite repositories: connection access, id
 * generation, timestamp conversion and the transaction template.
 *
 * <p>TRANSACTIONS:
 * {@link #inTransaction(String, SqlWork)} disables auto-commit, runs the
 * work, commits, and on any {@link SQLException} rolls back and throws a
 * {@link RepositoryException}. Auto-commit is always re-enabled afterwards.
 * If the connection is already inside a transaction the work joins it and
 * the outer caller owns commit and rollback.
 */
public abstract class AbstractSqliteRepository {

    private static final Logger log = LoggerFactory.getLogger(AbstractSqliteRepository.class);

    /** Storage format for every timestamp column. */
    public static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final DatabaseManager databaseManager;

    protected AbstractSqliteRepository(DatabaseManager databaseManager) {
        this.databaseManager = databaseManager;
    }

    /**
     * Unit of JDBC work run by {@link #inTransaction(String, SqlWork)}.
     *
     * @param <T> the result type
     */
    @FunctionalInterface
    protected interface SqlWork<T> {
        T run(Connection connection) throws SQLException;
    }

    protected Connection conn() {
        return databaseManager.getConnection();
    }

    protected static String newId() {
        return UUID.randomUUID().toString();
    }

    // -----------------------------------------------------------------------
    // TRANSACTION TEMPLATE
    // -----------------------------------------------------------------------

    protected <T> T inTransaction(String description, SqlWork<T> work) {
        Connection connection = conn();
        boolean joined;
        try {
            joined = !connection.getAutoCommit();
        } catch (SQLException ex) {
            throw new RepositoryException("Could not inspect transaction state for " + description, ex);
        }

        if (joined) {
            try {
                return work.run(connection);
            } catch (SQLException ex) {
                throw new RepositoryException(description + " failed.", ex);
            }
        }

        try {
            connection.setAutoCommit(false);
            T result = work.run(connection);
            connection.commit();
            return result;
        } catch (SQLException ex) {
            log.error("{} failed; rolling back.", description, ex);
            try {
                connection.rollback();
                log.warn("{} rolled back.", description);
            } catch (SQLException rollbackEx) {
                log.error("Rollback also failed.", rollbackEx);
            }
            throw new RepositoryException(description + " failed.", ex);
        } finally {
            try {
                connection.setAutoCommit(true);
            } catch (SQLException acEx) {
                log.error("Failed to re-enable auto-commit after {}.", description, acEx);
            }
        }
    }

    // -----------------------------------------------------------------------
    // VALUE CONVERSION
    // -----------------------------------------------------------------------

    protected static String formatTimestamp(LocalDateTime dt) {
        return dt == null ? null : dt.format(TIMESTAMP_FORMAT);
    }

    /**
     * Parses a stored timestamp. A corrupt value is logged and read as null
     * rather than failing the whole query.
     */
    protected static LocalDateTime parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDateTime.parse(value, TIMESTAMP_FORMAT);
        } catch (DateTimeParseException ex) {
            log.warn("Failed to parse timestamp '{}'; reading as null.", value);
            return null;
        }
    }

    protected static String formatDate(LocalDate date) {
        return date == null ? null : date.toString();
    }

    protected static LocalDate parseDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(value.length() > 10 ? value.substring(0, 10) : value);
        } catch (DateTimeParseException ex) {
            log.warn("Failed to parse date '{}'; reading as null.", value);
            return null;
        }
    }

    protected static void setNullableString(PreparedStatement ps, int index, String value)
            throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.VARCHAR);
        } else {
            ps.setString(index, value);
        }
    }
}
