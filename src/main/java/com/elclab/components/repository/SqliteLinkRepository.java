package com.elclab.components.repository;

import com.elclab.components.domain.Category;
import com.elclab.components.domain.CategoryLink;
import com.elclab.components.domain.Component;
import com.elclab.components.util.DatabaseManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * SqliteLinkRepository - JDBC implementation of {@link LinkRepository}.
 *
 * <p>"Most recently linked" is decided by {@code linked_at} and, for links
 * made within the same second, by insertion order ({@code rowid}).
 */
public class SqliteLinkRepository implements LinkRepository {

    private static final Logger log = LoggerFactory.getLogger(SqliteLinkRepository.class);

    // -----------------------------------------------------------------------
    // SQL CONSTANTS
    // -----------------------------------------------------------------------

    private static final String SQL_INSERT_LINK = """
            INSERT OR IGNORE INTO component_category
                (component_id, category_id, linked_at)
            VALUES (?, ?, ?)
            """;

    private static final String SQL_SET_CURRENT = """
            UPDATE components
            SET category_id = ?,
                updated_at  = ?
            WHERE id = ?
              AND (category_id IS NULL OR category_id <> ?)
            """;

    private static final String SQL_DELETE_LINK = """
            DELETE FROM component_category
            WHERE component_id = ? AND category_id = ?
            """;

    private static final String SQL_RECOMPUTE_CURRENT = """
            UPDATE components
            SET category_id = (
                    SELECT l.category_id
                    FROM component_category l
                    WHERE l.component_id = components.id
                    ORDER BY l.linked_at DESC, l.rowid DESC
                    LIMIT 1),
                updated_at = ?
            WHERE id = ? AND category_id = ?
            """;

    private static final String SQL_FIND_LINK = """
            SELECT component_id, category_id, linked_at
            FROM component_category
            WHERE component_id = ? AND category_id = ?
            """;

    private static final String SQL_CATEGORIES_FOR = """
            SELECT cat.id, cat.name, cat.description, cat.created_at, cat.updated_at
            FROM component_category l
            JOIN categories cat ON cat.id = l.category_id
            WHERE l.component_id = ?
            ORDER BY l.linked_at DESC, l.rowid DESC
            """;

    private static final String SQL_COMPONENTS_FOR = """
            SELECT c.id, c.identifier, c.description, c.price, c.quantity,
                   c.category_id, cat.name AS category_name,
                   c.created_at, c.updated_at
            FROM component_category l
            JOIN components c ON c.id = l.component_id
            LEFT JOIN categories cat ON cat.id = c.category_id
            WHERE l.category_id = ?
            ORDER BY c.identifier ASC
            """;

    private final DatabaseManager database;

    public SqliteLinkRepository(DatabaseManager database) {
        if (database == null) {
            throw new IllegalArgumentException("DatabaseManager must not be null.");
        }
        this.database = database;
    }

    // -----------------------------------------------------------------------
    // WRITE
    // -----------------------------------------------------------------------

    @Override
    public boolean link(int componentId, int categoryId) {
        try {
            return database.inTransaction(c -> {
                String now = StoreTimestamps.format(StoreTimestamps.now());
                int inserted;
                try (PreparedStatement ps = c.prepareStatement(SQL_INSERT_LINK)) {
                    ps.setInt(1, componentId);
                    ps.setInt(2, categoryId);
                    ps.setString(3, now);
                    inserted = ps.executeUpdate();
                }
                if (inserted == 0) {
                    log.debug("link({}, {}): already linked.", componentId, categoryId);
                    return false;
                }
                try (PreparedStatement ps = c.prepareStatement(SQL_SET_CURRENT)) {
                    ps.setInt(1, categoryId);
                    ps.setString(2, now);
                    ps.setInt(3, componentId);
                    ps.setInt(4, categoryId);
                    ps.executeUpdate();
                }
                log.debug("link({}, {}): link created and made current.", componentId, categoryId);
                return true;
            });
        } catch (SQLException ex) {
            throw new RepositoryException(
                    "Failed to link component id=" + componentId
                            + " to category id=" + categoryId, ex);
        }
    }

    @Override
    public boolean unlink(int componentId, int categoryId) {
        try {
            return database.inTransaction(c -> {
                int deleted;
                try (PreparedStatement ps = c.prepareStatement(SQL_DELETE_LINK)) {
                    ps.setInt(1, componentId);
                    ps.setInt(2, categoryId);
                    deleted = ps.executeUpdate();
                }
                if (deleted == 0) {
                    return false;
                }
                try (PreparedStatement ps = c.prepareStatement(SQL_RECOMPUTE_CURRENT)) {
                    ps.setString(1, StoreTimestamps.format(StoreTimestamps.now()));
                    ps.setInt(2, componentId);
                    ps.setInt(3, categoryId);
                    ps.executeUpdate();
                }
                log.debug("unlink({}, {}): link removed.", componentId, categoryId);
                return true;
            });
        } catch (SQLException ex) {
            throw new RepositoryException(
                    "Failed to unlink component id=" + componentId
                            + " from category id=" + categoryId, ex);
        }
    }

    // -----------------------------------------------------------------------
    // READ
    // -----------------------------------------------------------------------

    @Override
    public Optional<CategoryLink> findLink(int componentId, int categoryId) {
        try (PreparedStatement ps = database.getConnection().prepareStatement(SQL_FIND_LINK)) {
            ps.setInt(1, componentId);
            ps.setInt(2, categoryId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(new CategoryLink(
                            rs.getInt("component_id"),
                            rs.getInt("category_id"),
                            StoreTimestamps.parse(rs.getString("linked_at"))));
                }
            }
        } catch (SQLException ex) {
            throw new RepositoryException("Failed to find link (" + componentId
                    + ", " + categoryId + ")", ex);
        }
        return Optional.empty();
    }

    @Override
    public List<Category> categoriesFor(int componentId) {
        List<Category> categories = new ArrayList<>();
        try (PreparedStatement ps = database.getConnection().prepareStatement(SQL_CATEGORIES_FOR)) {
            ps.setInt(1, componentId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    categories.add(SqliteCategoryRepository.mapRow(rs));
                }
            }
        } catch (SQLException ex) {
            throw new RepositoryException(
                    "Failed to list categories of component id=" + componentId, ex);
        }
        return categories;
    }

    @Override
    public List<Component> componentsFor(int categoryId) {
        List<Component> components = new ArrayList<>();
        try (PreparedStatement ps = database.getConnection().prepareStatement(SQL_COMPONENTS_FOR)) {
            ps.setInt(1, categoryId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    components.add(SqliteComponentRepository.mapRow(rs));
                }
            }
        } catch (SQLException ex) {
            throw new RepositoryException(
                    "Failed to list components of category id=" + categoryId, ex);
        }
        return components;
    }
}
