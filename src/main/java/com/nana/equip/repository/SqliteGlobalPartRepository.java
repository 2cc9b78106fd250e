package com.nana.equip.repository;

import com.nana.equip.domain.GlobalPart;
import com.nana.equip.util.DatabaseManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDateTime;
import java.util.Optional;

public class SqliteGlobalPartRepository extends AbstractSqliteRepository
        implements GlobalPartRepository {

    private static final Logger log = LoggerFactory.getLogger(SqliteGlobalPartRepository.class);

    private static final String SQL_UPSERT = """
            INSERT INTO global_parts
                (id, part_number, name, description, manufacturer, model,
                 category, unit_of_measure, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT(part_number) DO UPDATE SET
                name            = COALESCE(excluded.name, global_parts.name),
                description     = COALESCE(excluded.description, global_parts.description),
                manufacturer    = COALESCE(excluded.manufacturer, global_parts.manufacturer),
                model           = COALESCE(excluded.model, global_parts.model),
                category        = COALESCE(excluded.category, global_parts.category),
                unit_of_measure = COALESCE(excluded.unit_of_measure, global_parts.unit_of_measure),
                updated_at      = excluded.updated_at
            """;

    private static final String SQL_FIND_BY_PART_NUMBER = """
            SELECT id, part_number, name, description, manufacturer, model,
                   category, unit_of_measure
            FROM global_parts
            WHERE part_number = ?
            """;

    public SqliteGlobalPartRepository(DatabaseManager databaseManager) {
        super(databaseManager);
    }

    @Override
    public String upsertByPartNumber(GlobalPart part) {
        String partNumber = part.getPartNumber() == null ? "" : part.getPartNumber().trim();
        if (partNumber.isEmpty()) {
            throw new RepositoryException("A part number is required to upsert a global part.");
        }
        String now = formatTimestamp(LocalDateTime.now());

        return inTransaction("Global part upsert '" + partNumber + "'", connection -> {
            try (PreparedStatement ps = connection.prepareStatement(SQL_UPSERT)) {
                ps.setString(1, newId());
                ps.setString(2, partNumber);
                setNullableString(ps, 3, part.getName());
                setNullableString(ps, 4, part.getDescription());
                setNullableString(ps, 5, part.getManufacturer());
                setNullableString(ps, 6, part.getModel());
                setNullableString(ps, 7, part.getCategory());
                setNullableString(ps, 8, part.getUnitOfMeasure());
                ps.setString(9, now);
                ps.setString(10, now);
                ps.executeUpdate();
            }
            try (PreparedStatement ps = connection.prepareStatement(SQL_FIND_BY_PART_NUMBER)) {
                ps.setString(1, partNumber);
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) {
                        throw new SQLException("Global part '" + partNumber + "' vanished after upsert.");
                    }
                    String id = rs.getString("id");
                    part.setId(id);
                    log.debug("Global part '{}' resolved to {}.", partNumber, id);
                    return id;
                }
            }
        });
    }

    @Override
    public Optional<GlobalPart> findByPartNumber(String partNumber) {
        if (partNumber == null || partNumber.isBlank()) {
            return Optional.empty();
        }
        try (PreparedStatement ps = conn().prepareStatement(SQL_FIND_BY_PART_NUMBER)) {
            ps.setString(1, partNumber.trim());
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                GlobalPart part = new GlobalPart();
                part.setId(rs.getString("id"));
                part.setPartNumber(rs.getString("part_number"));
                part.setName(rs.getString("name"));
                part.setDescription(rs.getString("description"));
                part.setManufacturer(rs.getString("manufacturer"));
                part.setModel(rs.getString("model"));
                part.setCategory(rs.getString("category"));
                part.setUnitOfMeasure(rs.getString("unit_of_measure"));
                return Optional.of(part);
            }
        } catch (SQLException ex) {
            throw new RepositoryException("Failed to look up global part '" + partNumber + "'.", ex);
        }
    }
}
