package com.nana.equip.repository;

import com.nana.equip.domain.InstallSide;
import com.nana.equip.domain.LinkSnapshot;
import com.nana.equip.domain.WireDropLink;
import com.nana.equip.util.DatabaseManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

public class SqliteWireDropLinkRepository extends AbstractSqliteRepository
        implements WireDropLinkRepository {

    private static final Logger log = LoggerFactory.getLogger(SqliteWireDropLinkRepository.class);

    // -----------------------------------------------------------------------
    // SQL CONSTANTS
    // -----------------------------------------------------------------------

    private static final String LINK_COLUMNS = """
            l.id, l.wire_drop_id, l.project_equipment_id, l.link_side, l.sort_order,
            l.quantity, l.notes, l.created_by, l.created_at
            """;

    private static final String SQL_CAPTURE = "SELECT " + LINK_COLUMNS + """
            , e.name AS eq_name, e.part_number AS eq_part_number, e.room_id AS eq_room_id,
              e.install_side AS eq_install_side, e.instance_number AS eq_instance_number
            FROM wire_drop_equipment_links l
            JOIN project_equipment e ON e.id = l.project_equipment_id
            WHERE e.project_id = ?
            ORDER BY l.wire_drop_id ASC, l.link_side ASC, l.sort_order ASC
            """;

    private static final String SQL_FIND_BY_PROJECT = "SELECT " + LINK_COLUMNS + """
            FROM wire_drop_equipment_links l
            JOIN project_equipment e ON e.id = l.project_equipment_id
            WHERE e.project_id = ?
            ORDER BY l.wire_drop_id ASC, l.sort_order ASC
            """;

    private static final String SQL_FIND_BY_EQUIPMENT = "SELECT " + LINK_COLUMNS + """
            FROM wire_drop_equipment_links l
            WHERE l.project_equipment_id = ?
            ORDER BY l.wire_drop_id ASC, l.sort_order ASC
            """;

    private static final String SQL_INSERT = """
            INSERT INTO wire_drop_equipment_links
                (id, wire_drop_id, project_equipment_id, link_side, sort_order,
                 quantity, notes, created_by, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

    public SqliteWireDropLinkRepository(DatabaseManager databaseManager) {
        super(databaseManager);
    }

    @Override
    public List<LinkSnapshot> captureForProject(String projectId) {
        List<LinkSnapshot> snapshots = new ArrayList<>();
        try (PreparedStatement ps = conn().prepareStatement(SQL_CAPTURE)) {
            ps.setString(1, projectId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    WireDropLink link = mapLink(rs);
                    snapshots.add(new LinkSnapshot(
                            link,
                            link.getEquipmentId(),
                            rs.getString("eq_name"),
                            rs.getString("eq_part_number"),
                            rs.getString("eq_room_id"),
                            InstallSide.fromString(rs.getString("eq_install_side")),
                            rs.getInt("eq_instance_number")));
                }
            }
        } catch (SQLException ex) {
            throw new RepositoryException("Failed to capture wire drop links for '" + projectId + "'.", ex);
        }
        log.debug("Captured {} wire drop link(s) for project {}.", snapshots.size(), projectId);
        return snapshots;
    }

    @Override
    public List<WireDropLink> findByProject(String projectId) {
        return query(SQL_FIND_BY_PROJECT, projectId);
    }

    @Override
    public List<WireDropLink> findByEquipment(String equipmentId) {
        return query(SQL_FIND_BY_EQUIPMENT, equipmentId);
    }

    @Override
    public void insertAll(List<WireDropLink> links) {
        if (links.isEmpty()) {
            return;
        }
        LocalDateTime now = LocalDateTime.now().withNano(0);
        inTransaction("Wire drop link batch insert", connection -> {
            try (PreparedStatement ps = connection.prepareStatement(SQL_INSERT)) {
                for (WireDropLink link : links) {
                    link.setId(newId());
                    link.setCreatedAt(now);
                    ps.setString(1, link.getId());
                    ps.setString(2, link.getWireDropId());
                    ps.setString(3, link.getEquipmentId());
                    ps.setString(4, link.getLinkSide() == null
                            ? InstallSide.ROOM_END.getDbValue() : link.getLinkSide());
                    ps.setInt(5, link.getSortOrder());
                    ps.setDouble(6, link.getQuantity());
                    setNullableString(ps, 7, link.getNotes());
                    setNullableString(ps, 8, link.getCreatedBy());
                    ps.setString(9, formatTimestamp(now));
                    ps.addBatch();
                }
                ps.executeBatch();
            }
            return null;
        });
        log.info("Inserted {} wire drop link(s).", links.size());
    }

    private List<WireDropLink> query(String sql, String parameter) {
        List<WireDropLink> links = new ArrayList<>();
        try (PreparedStatement ps = conn().prepareStatement(sql)) {
            ps.setString(1, parameter);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    links.add(mapLink(rs));
                }
            }
        } catch (SQLException ex) {
            throw new RepositoryException("Failed to load wire drop links for '" + parameter + "'.", ex);
        }
        return links;
    }

    private WireDropLink mapLink(ResultSet rs) throws SQLException {
        WireDropLink link = new WireDropLink(
                rs.getString("wire_drop_id"), rs.getString("project_equipment_id"));
        link.setId(rs.getString("id"));
        link.setLinkSide(rs.getString("link_side"));
        link.setSortOrder(rs.getInt("sort_order"));
        link.setQuantity(rs.getDouble("quantity"));
        link.setNotes(rs.getString("notes"));
        link.setCreatedBy(rs.getString("created_by"));
        link.setCreatedAt(parseTimestamp(rs.getString("created_at")));
        return link;
    }
}
