package com.nana.equip.repository;

import com.nana.equip.domain.Supplier;
import com.nana.equip.domain.SupplierMatch;
import com.nana.equip.util.DatabaseManager;
import org.apache.commons.text.similarity.JaroWinklerSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * SqliteSupplierDirectory: supplier lookup backed by the {@code suppliers} table.
 *
 * <p>Matching order:
 * <ol>
 *   <li>Exact name, ignoring case and surrounding whitespace: confidence 1.0.</li>
 *   <li>Best Jaro-Winkler similarity over active suppliers, accepted when it
 *       reaches the threshold.</li>
 *   <li>Otherwise a new active supplier is created with a short code built
 *       from the name (word initials, or the first five characters of a single
 *       word), suffixed with a counter if the code is taken.</li>
 * </ol>
 */
public class SqliteSupplierDirectory extends AbstractSqliteRepository implements SupplierMatcher {

    private static final Logger log = LoggerFactory.getLogger(SqliteSupplierDirectory.class);

    private static final String SQL_FIND_ACTIVE = """
            SELECT id, name, short_code, is_active
            FROM suppliers
            WHERE is_active = 1
            ORDER BY name ASC
            """;

    private static final String SQL_CODE_EXISTS =
            "SELECT 1 FROM suppliers WHERE short_code = ?";

    private static final String SQL_INSERT = """
            INSERT INTO suppliers (id, name, short_code, is_active, created_at)
            VALUES (?, ?, ?, 1, ?)
            """;

    private final JaroWinklerSimilarity similarity = new JaroWinklerSimilarity();

    public SqliteSupplierDirectory(DatabaseManager databaseManager) {
        super(databaseManager);
    }

    @Override
    public SupplierMatch matchOrCreate(String supplierName, double threshold) {
        String name = supplierName == null ? "" : supplierName.trim();
        if (name.isEmpty()) {
            throw new RepositoryException("A supplier name is required.");
        }
        String lower = name.toLowerCase(Locale.ROOT);

        Supplier best = null;
        double bestScore = 0;
        for (Supplier candidate : findActive()) {
            String candidateName = candidate.getName().trim().toLowerCase(Locale.ROOT);
            if (candidateName.equals(lower)) {
                return new SupplierMatch(candidate.getId(), candidate.getName(), 1.0, false);
            }
            double score = similarity.apply(lower, candidateName);
            if (score > bestScore) {
                bestScore = score;
                best = candidate;
            }
        }

        if (best != null && bestScore >= threshold) {
            log.debug("Supplier '{}' fuzzy-matched '{}' ({}).",
                    name, best.getName(), String.format("%.2f", bestScore));
            return new SupplierMatch(best.getId(), best.getName(), bestScore, false);
        }

        Supplier created = create(name);
        log.info("Created supplier '{}' with code {}.", created.getName(), created.getShortCode());
        return new SupplierMatch(created.getId(), created.getName(), 1.0, true);
    }

    public List<Supplier> findActive() {
        List<Supplier> suppliers = new ArrayList<>();
        try (PreparedStatement ps = conn().prepareStatement(SQL_FIND_ACTIVE);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                Supplier supplier = new Supplier(rs.getString("name"), rs.getString("short_code"));
                supplier.setId(rs.getString("id"));
                supplier.setActive(rs.getInt("is_active") == 1);
                suppliers.add(supplier);
            }
        } catch (SQLException ex) {
            throw new RepositoryException("Failed to load suppliers.", ex);
        }
        return suppliers;
    }

    /**
     * Word initials for multi-word names (up to five), otherwise the first
     * five letters or digits of the single word.
     */
    static String shortCodeFor(String name) {
        String[] words = name.trim().toUpperCase(Locale.ROOT).split("\\s+");
        StringBuilder code = new StringBuilder();
        if (words.length >= 2) {
            for (int i = 0; i < words.length && i < 5; i++) {
                code.append(words[i].charAt(0));
            }
        } else {
            String word = words[0].replaceAll("[^A-Z0-9]", "");
            code.append(word, 0, Math.min(5, word.length()));
        }
        return code.length() == 0 ? "SUP" : code.toString();
    }

    private Supplier create(String name) {
        Supplier supplier = new Supplier(name, null);
        supplier.setId(newId());
        return inTransaction("Supplier create '" + name + "'", connection -> {
            String base = shortCodeFor(name);
            String code = base;
            for (int n = 2; codeExists(connection, code); n++) {
                code = base + n;
            }
            supplier.setShortCode(code);
            try (PreparedStatement ps = connection.prepareStatement(SQL_INSERT)) {
                ps.setString(1, supplier.getId());
                ps.setString(2, name);
                ps.setString(3, code);
                ps.setString(4, formatTimestamp(LocalDateTime.now()));
                ps.executeUpdate();
            }
            return supplier;
        });
    }

    private static boolean codeExists(Connection connection, String code) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(SQL_CODE_EXISTS)) {
            ps.setString(1, code);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }
}
