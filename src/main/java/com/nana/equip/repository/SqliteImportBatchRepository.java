package com.nana.equip.repository;

import com.nana.equip.domain.BatchStatus;
import com.nana.equip.domain.ImportBatch;
import com.nana.equip.util.DatabaseManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class SqliteImportBatchRepository extends AbstractSqliteRepository
        implements ImportBatchRepository {

    private static final Logger log = LoggerFactory.getLogger(SqliteImportBatchRepository.class);

    // -----------------------------------------------------------------------
    // SQL CONSTANTS
    // -----------------------------------------------------------------------

    private static final String SQL_INSERT = """
            INSERT INTO equipment_import_batches
                (id, project_id, filename, status, total_rows, processed_rows,
                 error_message, created_by, created_at, completed_at)
            VALUES (?, ?, ?, ?, ?, 0, NULL, ?, ?, NULL)
            """;

    private static final String SQL_MARK_PROCESSED = """
            UPDATE equipment_import_batches
            SET status = 'processed', processed_rows = ?, completed_at = ?
            WHERE id = ?
            """;

    private static final String SQL_MARK_FAILED = """
            UPDATE equipment_import_batches
            SET status = 'failed', error_message = ?
            WHERE id = ?
            """;

    private static final String SQL_SELECT = """
            SELECT id, project_id, filename, status, total_rows, processed_rows,
                   error_message, created_by, created_at, completed_at
            FROM equipment_import_batches
            """;

    public SqliteImportBatchRepository(DatabaseManager databaseManager) {
        super(databaseManager);
    }

    @Override
    public ImportBatch create(ImportBatch batch) {
        batch.setId(newId());
        batch.setStatus(BatchStatus.PENDING);
        batch.setProcessedRows(0);
        batch.setCreatedAt(LocalDateTime.now().withNano(0));

        try (PreparedStatement ps = conn().prepareStatement(SQL_INSERT)) {
            ps.setString(1, batch.getId());
            ps.setString(2, batch.getProjectId());
            ps.setString(3, batch.getFilename());
            ps.setString(4, BatchStatus.PENDING.getDbValue());
            ps.setInt(5, batch.getTotalRows());
            setNullableString(ps, 6, batch.getCreatedBy());
            ps.setString(7, formatTimestamp(batch.getCreatedAt()));
            ps.executeUpdate();
        } catch (SQLException ex) {
            throw new RepositoryException(
                    "Failed to create import batch for project '" + batch.getProjectId() + "'.", ex);
        }
        log.debug("Created import batch {}.", batch);
        return batch;
    }

    @Override
    public void markProcessed(String batchId, int processedRows) {
        try (PreparedStatement ps = conn().prepareStatement(SQL_MARK_PROCESSED)) {
            ps.setInt(1, processedRows);
            ps.setString(2, formatTimestamp(LocalDateTime.now()));
            ps.setString(3, batchId);
            if (ps.executeUpdate() == 0) {
                throw new RepositoryException("No import batch with id '" + batchId + "'.");
            }
        } catch (SQLException ex) {
            throw new RepositoryException("Failed to mark batch '" + batchId + "' processed.", ex);
        }
    }

    @Override
    public void markFailed(String batchId, String errorMessage) {
        try (PreparedStatement ps = conn().prepareStatement(SQL_MARK_FAILED)) {
            setNullableString(ps, 1, errorMessage);
            ps.setString(2, batchId);
            ps.executeUpdate();
        } catch (SQLException ex) {
            throw new RepositoryException("Failed to mark batch '" + batchId + "' failed.", ex);
        }
    }

    @Override
    public Optional<ImportBatch> findById(String batchId) {
        try (PreparedStatement ps = conn().prepareStatement(SQL_SELECT + " WHERE id = ?")) {
            ps.setString(1, batchId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
            }
        } catch (SQLException ex) {
            throw new RepositoryException("Failed to load import batch '" + batchId + "'.", ex);
        }
    }

    @Override
    public List<ImportBatch> findByProject(String projectId) {
        List<ImportBatch> batches = new ArrayList<>();
        try (PreparedStatement ps = conn().prepareStatement(
                SQL_SELECT + " WHERE project_id = ? ORDER BY created_at DESC")) {
            ps.setString(1, projectId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    batches.add(mapRow(rs));
                }
            }
        } catch (SQLException ex) {
            throw new RepositoryException("Failed to list import batches for '" + projectId + "'.", ex);
        }
        return batches;
    }

    private ImportBatch mapRow(ResultSet rs) throws SQLException {
        ImportBatch batch = new ImportBatch();
        batch.setId(rs.getString("id"));
        batch.setProjectId(rs.getString("project_id"));
        batch.setFilename(rs.getString("filename"));
        batch.setStatus(BatchStatus.fromString(rs.getString("status")));
        batch.setTotalRows(rs.getInt("total_rows"));
        batch.setProcessedRows(rs.getInt("processed_rows"));
        batch.setErrorMessage(rs.getString("error_message"));
        batch.setCreatedBy(rs.getString("created_by"));
        batch.setCreatedAt(parseTimestamp(rs.getString("created_at")));
        batch.setCompletedAt(parseTimestamp(rs.getString("completed_at")));
        return batch;
    }
}
