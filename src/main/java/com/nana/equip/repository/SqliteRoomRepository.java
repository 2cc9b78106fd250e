package com.nana.equip.repository;

import com.nana.equip.domain.ProjectRoom;
import com.nana.equip.domain.RoomAlias;
import com.nana.equip.util.DatabaseManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

public class SqliteRoomRepository extends AbstractSqliteRepository implements RoomRepository {

    private static final Logger log = LoggerFactory.getLogger(SqliteRoomRepository.class);

    // -----------------------------------------------------------------------
    // SQL CONSTANTS
    // -----------------------------------------------------------------------

    private static final String SQL_FIND_BY_PROJECT = """
            SELECT id, project_id, name, is_headend, notes, created_by
            FROM project_rooms
            WHERE project_id = ?
            ORDER BY created_at ASC, name ASC
            """;

    private static final String SQL_INSERT = """
            INSERT INTO project_rooms
                (id, project_id, name, normalized_name, is_headend, notes, created_by, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            """;

    private static final String SQL_FIND_ALIASES = """
            SELECT id, project_id, project_room_id, alias, normalized_alias
            FROM project_room_aliases
            WHERE project_id = ?
            ORDER BY normalized_alias ASC
            """;

    private static final String SQL_UPSERT_ALIAS = """
            INSERT INTO project_room_aliases
                (id, project_id, project_room_id, alias, normalized_alias, created_at)
            VALUES (?, ?, ?, ?, ?, ?)
            ON CONFLICT(project_id, normalized_alias) DO UPDATE SET
                project_room_id = excluded.project_room_id,
                alias           = excluded.alias
            """;

    public SqliteRoomRepository(DatabaseManager databaseManager) {
        super(databaseManager);
    }

    // -----------------------------------------------------------------------
    // ROOMS
    // -----------------------------------------------------------------------

    @Override
    public List<ProjectRoom> findByProject(String projectId) {
        List<ProjectRoom> rooms = new ArrayList<>();
        try (PreparedStatement ps = conn().prepareStatement(SQL_FIND_BY_PROJECT)) {
            ps.setString(1, projectId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    rooms.add(mapRoom(rs));
                }
            }
        } catch (SQLException ex) {
            throw new RepositoryException("Failed to load rooms for project '" + projectId + "'.", ex);
        }
        log.debug("findByProject({}) returned {} rooms.", projectId, rooms.size());
        return rooms;
    }

    @Override
    public List<ProjectRoom> insertAll(List<ProjectRoom> rooms) {
        if (rooms.isEmpty()) {
            return rooms;
        }
        String now = formatTimestamp(LocalDateTime.now());
        return inTransaction("Room batch insert", connection -> {
            try (PreparedStatement ps = connection.prepareStatement(SQL_INSERT)) {
                for (ProjectRoom room : rooms) {
                    room.setId(newId());
                    ps.setString(1, room.getId());
                    ps.setString(2, room.getProjectId());
                    ps.setString(3, room.getName());
                    ps.setString(4, room.getNormalizedName());
                    ps.setInt(5, room.isHeadend() ? 1 : 0);
                    setNullableString(ps, 6, room.getNotes());
                    setNullableString(ps, 7, room.getCreatedBy());
                    ps.setString(8, now);
                    ps.addBatch();
                }
                ps.executeBatch();
            }
            log.info("Inserted {} new room(s).", rooms.size());
            return rooms;
        });
    }

    // -----------------------------------------------------------------------
    // ALIASES
    // -----------------------------------------------------------------------

    @Override
    public List<RoomAlias> findAliases(String projectId) {
        List<RoomAlias> aliases = new ArrayList<>();
        try (PreparedStatement ps = conn().prepareStatement(SQL_FIND_ALIASES)) {
            ps.setString(1, projectId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    RoomAlias alias = new RoomAlias(
                            rs.getString("project_id"),
                            rs.getString("project_room_id"),
                            rs.getString("alias"),
                            rs.getString("normalized_alias"));
                    alias.setId(rs.getString("id"));
                    aliases.add(alias);
                }
            }
        } catch (SQLException ex) {
            throw new RepositoryException("Failed to load room aliases for '" + projectId + "'.", ex);
        }
        return aliases;
    }

    @Override
    public void upsertAliases(List<RoomAlias> aliases) {
        if (aliases.isEmpty()) {
            return;
        }
        String now = formatTimestamp(LocalDateTime.now());
        inTransaction("Room alias upsert", connection -> {
            try (PreparedStatement ps = connection.prepareStatement(SQL_UPSERT_ALIAS)) {
                for (RoomAlias alias : aliases) {
                    if (alias.getId() == null) {
                        alias.setId(newId());
                    }
                    ps.setString(1, alias.getId());
                    ps.setString(2, alias.getProjectId());
                    ps.setString(3, alias.getRoomId());
                    ps.setString(4, alias.getAlias());
                    ps.setString(5, alias.getNormalizedAlias());
                    ps.setString(6, now);
                    ps.addBatch();
                }
                ps.executeBatch();
            }
            return null;
        });
        log.debug("Upserted {} room alias(es).", aliases.size());
    }

    private ProjectRoom mapRoom(ResultSet rs) throws SQLException {
        ProjectRoom room = new ProjectRoom();
        room.setId(rs.getString("id"));
        room.setProjectId(rs.getString("project_id"));
        room.setName(rs.getString("name"));
        room.setHeadend(rs.getInt("is_headend") == 1);
        room.setNotes(rs.getString("notes"));
        room.setCreatedBy(rs.getString("created_by"));
        return room;
    }
}
