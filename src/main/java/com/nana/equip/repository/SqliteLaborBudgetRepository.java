package com.nana.equip.repository;

import com.nana.equip.domain.LaborBudgetLine;
import com.nana.equip.util.DatabaseManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

public class SqliteLaborBudgetRepository extends AbstractSqliteRepository
        implements LaborBudgetRepository {

    private static final Logger log = LoggerFactory.getLogger(SqliteLaborBudgetRepository.class);

    // -----------------------------------------------------------------------
    // SQL CONSTANTS
    // -----------------------------------------------------------------------

    private static final String SQL_FIND_BY_PROJECT = """
            SELECT id, project_id, room_id, labor_type, description, planned_hours,
                   actual_hours, hourly_rate, supplier, supplier_id, csv_batch_id,
                   notes, created_by
            FROM project_labor_budget
            WHERE project_id = ?
            ORDER BY created_at ASC, labor_type ASC
            """;

    private static final String SQL_INSERT = """
            INSERT INTO project_labor_budget
                (id, project_id, room_id, labor_type, description, planned_hours,
                 actual_hours, hourly_rate, supplier, supplier_id, csv_batch_id,
                 notes, created_by, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

    private static final String SQL_UPDATE = """
            UPDATE project_labor_budget SET
                room_id = ?, labor_type = ?, description = ?, planned_hours = ?,
                actual_hours = ?, hourly_rate = ?, supplier = ?, supplier_id = ?,
                csv_batch_id = ?, notes = ?, updated_at = ?
            WHERE id = ?
            """;

    private static final String SQL_DELETE_IMPORTED = """
            DELETE FROM project_labor_budget
            WHERE project_id = ? AND csv_batch_id IS NOT NULL
            """;

    private static final String SQL_ASSIGN_SUPPLIER = """
            UPDATE project_labor_budget SET supplier_id = ?, updated_at = ?
            WHERE project_id = ? AND supplier = ?
            """;

    public SqliteLaborBudgetRepository(DatabaseManager databaseManager) {
        super(databaseManager);
    }

    @Override
    public List<LaborBudgetLine> findByProject(String projectId) {
        List<LaborBudgetLine> lines = new ArrayList<>();
        try (PreparedStatement ps = conn().prepareStatement(SQL_FIND_BY_PROJECT)) {
            ps.setString(1, projectId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    lines.add(mapRow(rs));
                }
            }
        } catch (SQLException ex) {
            throw new RepositoryException("Failed to load labor budget for '" + projectId + "'.", ex);
        }
        return lines;
    }

    @Override
    public void insertAll(List<LaborBudgetLine> lines) {
        if (lines.isEmpty()) {
            return;
        }
        String now = formatTimestamp(LocalDateTime.now());
        inTransaction("Labor budget batch insert", connection -> {
            try (PreparedStatement ps = connection.prepareStatement(SQL_INSERT)) {
                for (LaborBudgetLine line : lines) {
                    line.setId(newId());
                    ps.setString(1, line.getId());
                    ps.setString(2, line.getProjectId());
                    setNullableString(ps, 3, line.getRoomId());
                    ps.setString(4, line.getLaborType());
                    setNullableString(ps, 5, line.getDescription());
                    ps.setDouble(6, line.getPlannedHours());
                    ps.setDouble(7, line.getActualHours());
                    ps.setDouble(8, line.getHourlyRate());
                    setNullableString(ps, 9, line.getSupplier());
                    setNullableString(ps, 10, line.getSupplierId());
                    setNullableString(ps, 11, line.getCsvBatchId());
                    setNullableString(ps, 12, line.getNotes());
                    setNullableString(ps, 13, line.getCreatedBy());
                    ps.setString(14, now);
                    ps.setString(15, now);
                    ps.addBatch();
                }
                ps.executeBatch();
            }
            return null;
        });
        log.info("Inserted {} labor budget line(s).", lines.size());
    }

    @Override
    public void updateAll(List<LaborBudgetLine> lines) {
        if (lines.isEmpty()) {
            return;
        }
        String now = formatTimestamp(LocalDateTime.now());
        inTransaction("Labor budget batch update", connection -> {
            try (PreparedStatement ps = connection.prepareStatement(SQL_UPDATE)) {
                for (LaborBudgetLine line : lines) {
                    setNullableString(ps, 1, line.getRoomId());
                    ps.setString(2, line.getLaborType());
                    setNullableString(ps, 3, line.getDescription());
                    ps.setDouble(4, line.getPlannedHours());
                    ps.setDouble(5, line.getActualHours());
                    ps.setDouble(6, line.getHourlyRate());
                    setNullableString(ps, 7, line.getSupplier());
                    setNullableString(ps, 8, line.getSupplierId());
                    setNullableString(ps, 9, line.getCsvBatchId());
                    setNullableString(ps, 10, line.getNotes());
                    ps.setString(11, now);
                    ps.setString(12, line.getId());
                    if (ps.executeUpdate() == 0) {
                        throw new SQLException("Labor line '" + line.getId() + "' no longer exists.");
                    }
                }
            }
            return null;
        });
        log.info("Updated {} labor budget line(s).", lines.size());
    }

    @Override
    public int deleteImportedForProject(String projectId) {
        try (PreparedStatement ps = conn().prepareStatement(SQL_DELETE_IMPORTED)) {
            ps.setString(1, projectId);
            int deleted = ps.executeUpdate();
            log.info("Deleted {} imported labor line(s) for project {}.", deleted, projectId);
            return deleted;
        } catch (SQLException ex) {
            throw new RepositoryException("Failed to delete imported labor for '" + projectId + "'.", ex);
        }
    }

    @Override
    public int assignSupplier(String projectId, String supplierName,
                              String batchId, String supplierId) {
        String sql = batchId == null
                ? SQL_ASSIGN_SUPPLIER
                : SQL_ASSIGN_SUPPLIER.strip() + " AND csv_batch_id = ?";
        try (PreparedStatement ps = conn().prepareStatement(sql)) {
            ps.setString(1, supplierId);
            ps.setString(2, formatTimestamp(LocalDateTime.now()));
            ps.setString(3, projectId);
            ps.setString(4, supplierName);
            if (batchId != null) {
                ps.setString(5, batchId);
            }
            return ps.executeUpdate();
        } catch (SQLException ex) {
            throw new RepositoryException("Failed to assign supplier to labor lines.", ex);
        }
    }

    private LaborBudgetLine mapRow(ResultSet rs) throws SQLException {
        LaborBudgetLine line = new LaborBudgetLine();
        line.setId(rs.getString("id"));
        line.setProjectId(rs.getString("project_id"));
        line.setRoomId(rs.getString("room_id"));
        line.setLaborType(rs.getString("labor_type"));
        line.setDescription(rs.getString("description"));
        line.setPlannedHours(rs.getDouble("planned_hours"));
        line.setActualHours(rs.getDouble("actual_hours"));
        line.setHourlyRate(rs.getDouble("hourly_rate"));
        line.setSupplier(rs.getString("supplier"));
        line.setSupplierId(rs.getString("supplier_id"));
        line.setCsvBatchId(rs.getString("csv_batch_id"));
        line.setNotes(rs.getString("notes"));
        line.setCreatedBy(rs.getString("created_by"));
        return line;
    }
}
