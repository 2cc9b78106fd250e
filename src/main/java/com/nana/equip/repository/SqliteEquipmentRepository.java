package com.nana.equip.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nana.equip.domain.EquipmentType;
import com.nana.equip.domain.InstallSide;
import com.nana.equip.domain.ProjectEquipment;
import com.nana.equip.util.DatabaseManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * SqliteEquipmentRepository: JDBC implementation of {@link EquipmentRepository}.
 *
 * <p>The free-form metadata bag is stored as JSON text in the
 * {@code metadata} column and read back into an insertion-ordered map.
 * Booleans are stored as 0/1, dates as ISO {@code yyyy-MM-dd}, timestamps
 * in {@link #TIMESTAMP_FORMAT}.
 */
public class SqliteEquipmentRepository extends AbstractSqliteRepository
        implements EquipmentRepository {

    private static final Logger log = LoggerFactory.getLogger(SqliteEquipmentRepository.class);

    private static final ObjectMapper JSON = new ObjectMapper();

    private static final TypeReference<LinkedHashMap<String, Object>> METADATA_TYPE =
            new TypeReference<>() { };

    // -----------------------------------------------------------------------
    // SQL CONSTANTS
    // -----------------------------------------------------------------------

    private static final String COLUMNS = """
            project_id, room_id, csv_batch_id, global_part_id, supplier_id,
            name, description, manufacturer, model, part_number,
            install_side, equipment_type, planned_quantity, unit_of_measure,
            unit_cost, unit_price, supplier, notes, is_active, metadata,
            instance_number, instance_name, parent_import_group,
            ordered_quantity, ordered_date, received_quantity, received_date, received_by,
            ordered_confirmed, ordered_confirmed_at, ordered_confirmed_by,
            delivered_confirmed, delivered_confirmed_at, delivered_confirmed_by,
            installed, installed_at, installed_by,
            created_by, created_at, updated_at
            """;

    private static final int COLUMN_COUNT = 40;

    private static final String SQL_INSERT =
            "INSERT INTO project_equipment (id, " + COLUMNS + ") VALUES (?"
            + ", ?".repeat(COLUMN_COUNT) + ")";

    private static final String SQL_UPDATE = """
            UPDATE project_equipment SET
                project_id = ?, room_id = ?, csv_batch_id = ?, global_part_id = ?, supplier_id = ?,
                name = ?, description = ?, manufacturer = ?, model = ?, part_number = ?,
                install_side = ?, equipment_type = ?, planned_quantity = ?, unit_of_measure = ?,
                unit_cost = ?, unit_price = ?, supplier = ?, notes = ?, is_active = ?, metadata = ?,
                instance_number = ?, instance_name = ?, parent_import_group = ?,
                ordered_quantity = ?, ordered_date = ?, received_quantity = ?, received_date = ?,
                received_by = ?,
                ordered_confirmed = ?, ordered_confirmed_at = ?, ordered_confirmed_by = ?,
                delivered_confirmed = ?, delivered_confirmed_at = ?, delivered_confirmed_by = ?,
                installed = ?, installed_at = ?, installed_by = ?,
                created_by = ?, created_at = ?, updated_at = ?
            WHERE id = ?
            """;

    private static final String SQL_SELECT =
            "SELECT id, " + COLUMNS + " FROM project_equipment ";

    private static final String SQL_DELETE_INSTANCES = """
            DELETE FROM project_equipment_instances
            WHERE project_equipment_id IN (SELECT id FROM project_equipment WHERE project_id = ?)
            """;

    private static final String SQL_DELETE_INVENTORY = """
            DELETE FROM project_equipment_inventory
            WHERE project_equipment_id IN (SELECT id FROM project_equipment WHERE project_id = ?)
            """;

    private static final String SQL_DELETE_LINKS = """
            DELETE FROM wire_drop_equipment_links
            WHERE project_equipment_id IN (SELECT id FROM project_equipment WHERE project_id = ?)
            """;

    private static final String SQL_DELETE_EQUIPMENT =
            "DELETE FROM project_equipment WHERE project_id = ?";

    private static final String SQL_INSERT_INVENTORY = """
            INSERT INTO project_equipment_inventory
                (id, project_equipment_id, warehouse, quantity_on_hand, quantity_assigned,
                 needs_order, rma_required, notes, created_at)
            VALUES (?, ?, ?, 0, 0, 0, 0, NULL, ?)
            ON CONFLICT(project_equipment_id, warehouse) DO NOTHING
            """;

    private static final String SQL_COUNT_INVENTORY =
            "SELECT COUNT(*) FROM project_equipment_inventory WHERE project_equipment_id = ?";

    private static final String SQL_ASSIGN_GLOBAL_PART = """
            UPDATE project_equipment SET global_part_id = ?, updated_at = ?
            WHERE project_id = ? AND lower(trim(part_number)) = lower(trim(?))
            """;

    private static final String SQL_ASSIGN_SUPPLIER = """
            UPDATE project_equipment SET supplier_id = ?, updated_at = ?
            WHERE project_id = ? AND supplier = ?
            """;

    private static final String AND_BATCH = " AND csv_batch_id = ?";

    public SqliteEquipmentRepository(DatabaseManager databaseManager) {
        super(databaseManager);
    }

    // -----------------------------------------------------------------------
    // READ
    // -----------------------------------------------------------------------

    @Override
    public List<ProjectEquipment> findByProject(String projectId) {
        List<ProjectEquipment> result = new ArrayList<>();
        try (PreparedStatement ps = conn().prepareStatement(SQL_SELECT
                + "WHERE project_id = ? ORDER BY instance_number ASC, created_at ASC, id ASC")) {
            ps.setString(1, projectId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(mapRow(rs));
                }
            }
        } catch (SQLException ex) {
            throw new RepositoryException("Failed to load equipment for project '" + projectId + "'.", ex);
        }
        log.debug("findByProject({}) returned {} equipment rows.", projectId, result.size());
        return result;
    }

    @Override
    public Optional<ProjectEquipment> findById(String equipmentId) {
        try (PreparedStatement ps = conn().prepareStatement(SQL_SELECT + "WHERE id = ?")) {
            ps.setString(1, equipmentId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
            }
        } catch (SQLException ex) {
            throw new RepositoryException("Failed to load equipment '" + equipmentId + "'.", ex);
        }
    }

    // -----------------------------------------------------------------------
    // WRITE
    // -----------------------------------------------------------------------

    @Override
    public void insertAll(List<ProjectEquipment> equipment) {
        if (equipment.isEmpty()) {
            return;
        }
        LocalDateTime now = LocalDateTime.now().withNano(0);
        inTransaction("Equipment batch insert", connection -> {
            try (PreparedStatement ps = connection.prepareStatement(SQL_INSERT)) {
                for (ProjectEquipment item : equipment) {
                    item.setId(newId());
                    if (item.getCreatedAt() == null) {
                        item.setCreatedAt(now);
                    }
                    item.setUpdatedAt(now);
                    ps.setString(1, item.getId());
                    bindColumns(ps, item, 2);
                    ps.addBatch();
                }
                ps.executeBatch();
            }
            return null;
        });
        log.info("Inserted {} equipment row(s).", equipment.size());
    }

    @Override
    public void updateAll(List<ProjectEquipment> equipment) {
        if (equipment.isEmpty()) {
            return;
        }
        LocalDateTime now = LocalDateTime.now().withNano(0);
        inTransaction("Equipment batch update", connection -> {
            try (PreparedStatement ps = connection.prepareStatement(SQL_UPDATE)) {
                for (ProjectEquipment item : equipment) {
                    item.setUpdatedAt(now);
                    int next = bindColumns(ps, item, 1);
                    ps.setString(next, item.getId());
                    if (ps.executeUpdate() == 0) {
                        throw new SQLException("Equipment row '" + item.getId() + "' no longer exists.");
                    }
                }
            }
            return null;
        });
        log.info("Updated {} equipment row(s).", equipment.size());
    }

    @Override
    public int deleteAllForProject(String projectId) {
        int deleted = inTransaction("Equipment delete for project " + projectId, connection -> {
            for (String sql : List.of(SQL_DELETE_INSTANCES, SQL_DELETE_INVENTORY, SQL_DELETE_LINKS)) {
                try (PreparedStatement ps = connection.prepareStatement(sql)) {
                    ps.setString(1, projectId);
                    ps.executeUpdate();
                }
            }
            try (PreparedStatement ps = connection.prepareStatement(SQL_DELETE_EQUIPMENT)) {
                ps.setString(1, projectId);
                return ps.executeUpdate();
            }
        });
        log.info("Deleted {} equipment row(s) for project {}.", deleted, projectId);
        return deleted;
    }

    @Override
    public void insertInventory(List<ProjectEquipment> equipment, String warehouse) {
        if (equipment.isEmpty()) {
            return;
        }
        String now = formatTimestamp(LocalDateTime.now());
        inTransaction("Inventory batch insert", connection -> {
            try (PreparedStatement ps = connection.prepareStatement(SQL_INSERT_INVENTORY)) {
                for (ProjectEquipment item : equipment) {
                    ps.setString(1, newId());
                    ps.setString(2, item.getId());
                    ps.setString(3, warehouse);
                    ps.setString(4, now);
                    ps.addBatch();
                }
                ps.executeBatch();
            }
            return null;
        });
        log.debug("Created inventory rows in warehouse '{}' for {} equipment row(s).",
                warehouse, equipment.size());
    }

    @Override
    public int countInventory(String equipmentId) {
        try (PreparedStatement ps = conn().prepareStatement(SQL_COUNT_INVENTORY)) {
            ps.setString(1, equipmentId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException ex) {
            throw new RepositoryException("Failed to count inventory for '" + equipmentId + "'.", ex);
        }
    }

    @Override
    public int assignGlobalPart(String projectId, String partNumber,
                                String batchId, String globalPartId) {
        return assign(SQL_ASSIGN_GLOBAL_PART, globalPartId, projectId, partNumber, batchId,
                "global part for part number '" + partNumber + "'");
    }

    @Override
    public int assignSupplier(String projectId, String supplierName,
                              String batchId, String supplierId) {
        return assign(SQL_ASSIGN_SUPPLIER, supplierId, projectId, supplierName, batchId,
                "supplier for '" + supplierName + "'");
    }

    private int assign(String baseSql, String value, String projectId,
                       String match, String batchId, String description) {
        String sql = batchId == null ? baseSql : baseSql.strip() + AND_BATCH;
        try (PreparedStatement ps = conn().prepareStatement(sql)) {
            ps.setString(1, value);
            ps.setString(2, formatTimestamp(LocalDateTime.now()));
            ps.setString(3, projectId);
            ps.setString(4, match);
            if (batchId != null) {
                ps.setString(5, batchId);
            }
            return ps.executeUpdate();
        } catch (SQLException ex) {
            throw new RepositoryException("Failed to assign " + description + ".", ex);
        }
    }

    // -----------------------------------------------------------------------
    // ROW MAPPING
    // -----------------------------------------------------------------------

    /**
     * Binds the {@link #COLUMNS} values of {@code e} starting at {@code start}.
     *
     * @return the next free parameter index
     */
    private int bindColumns(PreparedStatement ps, ProjectEquipment e, int start)
            throws SQLException {
        int i = start;
        ps.setString(i++, e.getProjectId());
        setNullableString(ps, i++, e.getRoomId());
        setNullableString(ps, i++, e.getCsvBatchId());
        setNullableString(ps, i++, e.getGlobalPartId());
        setNullableString(ps, i++, e.getSupplierId());
        ps.setString(i++, e.getName());
        setNullableString(ps, i++, e.getDescription());
        setNullableString(ps, i++, e.getManufacturer());
        setNullableString(ps, i++, e.getModel());
        setNullableString(ps, i++, e.getPartNumber());
        ps.setString(i++, (e.getInstallSide() == null ? InstallSide.ROOM_END : e.getInstallSide()).getDbValue());
        ps.setString(i++, (e.getEquipmentType() == null ? EquipmentType.PART : e.getEquipmentType()).getDbValue());
        ps.setDouble(i++, e.getPlannedQuantity());
        setNullableString(ps, i++, e.getUnitOfMeasure());
        ps.setDouble(i++, e.getUnitCost());
        ps.setDouble(i++, e.getUnitPrice());
        setNullableString(ps, i++, e.getSupplier());
        setNullableString(ps, i++, e.getNotes());
        ps.setInt(i++, e.isActive() ? 1 : 0);
        setNullableString(ps, i++, writeMetadata(e.getMetadata()));
        ps.setInt(i++, e.getInstanceNumber());
        setNullableString(ps, i++, e.getInstanceName());
        setNullableString(ps, i++, e.getParentImportGroup());
        ps.setDouble(i++, e.getOrderedQuantity());
        setNullableString(ps, i++, formatDate(e.getOrderedDate()));
        ps.setDouble(i++, e.getReceivedQuantity());
        setNullableString(ps, i++, formatDate(e.getReceivedDate()));
        setNullableString(ps, i++, e.getReceivedBy());
        ps.setInt(i++, e.isOrderedConfirmed() ? 1 : 0);
        setNullableString(ps, i++, formatTimestamp(e.getOrderedConfirmedAt()));
        setNullableString(ps, i++, e.getOrderedConfirmedBy());
        ps.setInt(i++, e.isDeliveredConfirmed() ? 1 : 0);
        setNullableString(ps, i++, formatTimestamp(e.getDeliveredConfirmedAt()));
        setNullableString(ps, i++, e.getDeliveredConfirmedBy());
        ps.setInt(i++, e.isInstalled() ? 1 : 0);
        setNullableString(ps, i++, formatTimestamp(e.getInstalledAt()));
        setNullableString(ps, i++, e.getInstalledBy());
        setNullableString(ps, i++, e.getCreatedBy());
        ps.setString(i++, formatTimestamp(e.getCreatedAt() == null ? LocalDateTime.now() : e.getCreatedAt()));
        ps.setString(i++, formatTimestamp(e.getUpdatedAt() == null ? LocalDateTime.now() : e.getUpdatedAt()));
        return i;
    }

    private ProjectEquipment mapRow(ResultSet rs) throws SQLException {
        ProjectEquipment e = new ProjectEquipment();
        e.setId(rs.getString("id"));
        e.setProjectId(rs.getString("project_id"));
        e.setRoomId(rs.getString("room_id"));
        e.setCsvBatchId(rs.getString("csv_batch_id"));
        e.setGlobalPartId(rs.getString("global_part_id"));
        e.setSupplierId(rs.getString("supplier_id"));
        e.setName(rs.getString("name"));
        e.setDescription(rs.getString("description"));
        e.setManufacturer(rs.getString("manufacturer"));
        e.setModel(rs.getString("model"));
        e.setPartNumber(rs.getString("part_number"));
        e.setInstallSide(InstallSide.fromString(rs.getString("install_side")));
        e.setEquipmentType(EquipmentType.fromString(rs.getString("equipment_type")));
        e.setPlannedQuantity(rs.getDouble("planned_quantity"));
        e.setUnitOfMeasure(rs.getString("unit_of_measure"));
        e.setUnitCost(rs.getDouble("unit_cost"));
        e.setUnitPrice(rs.getDouble("unit_price"));
        e.setSupplier(rs.getString("supplier"));
        e.setNotes(rs.getString("notes"));
        e.setActive(rs.getInt("is_active") == 1);
        e.setMetadata(readMetadata(rs.getString("metadata")));
        e.setInstanceNumber(rs.getInt("instance_number"));
        e.setInstanceName(rs.getString("instance_name"));
        e.setParentImportGroup(rs.getString("parent_import_group"));
        e.setOrderedQuantity(rs.getDouble("ordered_quantity"));
        e.setOrderedDate(parseDate(rs.getString("ordered_date")));
        e.setReceivedQuantity(rs.getDouble("received_quantity"));
        e.setReceivedDate(parseDate(rs.getString("received_date")));
        e.setReceivedBy(rs.getString("received_by"));
        e.setOrderedConfirmed(rs.getInt("ordered_confirmed") == 1);
        e.setOrderedConfirmedAt(parseTimestamp(rs.getString("ordered_confirmed_at")));
        e.setOrderedConfirmedBy(rs.getString("ordered_confirmed_by"));
        e.setDeliveredConfirmed(rs.getInt("delivered_confirmed") == 1);
        e.setDeliveredConfirmedAt(parseTimestamp(rs.getString("delivered_confirmed_at")));
        e.setDeliveredConfirmedBy(rs.getString("delivered_confirmed_by"));
        e.setInstalled(rs.getInt("installed") == 1);
        e.setInstalledAt(parseTimestamp(rs.getString("installed_at")));
        e.setInstalledBy(rs.getString("installed_by"));
        e.setCreatedBy(rs.getString("created_by"));
        e.setCreatedAt(parseTimestamp(rs.getString("created_at")));
        e.setUpdatedAt(parseTimestamp(rs.getString("updated_at")));
        return e;
    }

    private static String writeMetadata(Map<String, Object> metadata) throws SQLException {
        if (metadata == null || metadata.isEmpty()) {
            return null;
        }
        try {
            return JSON.writeValueAsString(metadata);
        } catch (JsonProcessingException ex) {
            throw new SQLException("Equipment metadata is not serialisable as JSON.", ex);
        }
    }

    private static Map<String, Object> readMetadata(String json) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            return JSON.readValue(json, METADATA_TYPE);
        } catch (JsonProcessingException ex) {
            log.warn("Unreadable equipment metadata '{}'; reading as empty.", json);
            return new LinkedHashMap<>();
        }
    }
}
