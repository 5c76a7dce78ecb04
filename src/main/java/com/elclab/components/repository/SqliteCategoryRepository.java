package com.elclab.components.repository;

import com.elclab.components.domain.Category;
import com.elclab.components.util.DatabaseManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * SqliteCategoryRepository - JDBC implementation of {@link CategoryRepository}.
 *
 * <p>Deleting a category is the one multi-statement operation here. The
 * link rows go first, then every component whose current category was
 * the deleted one is pointed at its most recently linked remaining
 * category (or none), and finally the category row itself is removed.
 * Doing the recompute before the category delete matters: the
 * {@code ON DELETE SET NULL} on {@code components.category_id} would
 * otherwise hide which components were affected.
 */
public class SqliteCategoryRepository implements CategoryRepository {

    private static final Logger log = LoggerFactory.getLogger(SqliteCategoryRepository.class);

    // -----------------------------------------------------------------------
    // SQL CONSTANTS
    // -----------------------------------------------------------------------

    private static final String SELECT_COLUMNS = """
            SELECT id, name, description, created_at, updated_at
            FROM categories
            """;

    private static final String SQL_FIND_BY_ID =
            SELECT_COLUMNS + "WHERE id = ?";

    private static final String SQL_FIND_BY_NAME =
            SELECT_COLUMNS + "WHERE name = ?";

    private static final String SQL_FIND_ALL =
            SELECT_COLUMNS + "ORDER BY name ASC";

    private static final String SQL_INSERT = """
            INSERT INTO categories (name, description, created_at, updated_at)
            VALUES (?, ?, ?, ?)
            """;

    private static final String SQL_UPDATE = """
            UPDATE categories
            SET name        = ?,
                description = ?,
                updated_at  = ?
            WHERE id = ?
            """;

    private static final String SQL_DELETE_LINKS =
            "DELETE FROM component_category WHERE category_id = ?";

    private static final String SQL_RECOMPUTE_AFFECTED = """
            UPDATE components
            SET category_id = (
                    SELECT l.category_id
                    FROM component_category l
                    WHERE l.component_id = components.id
                    ORDER BY l.linked_at DESC, l.rowid DESC
                    LIMIT 1),
                updated_at = ?
            WHERE category_id = ?
            """;

    private static final String SQL_DELETE =
            "DELETE FROM categories WHERE id = ?";

    private static final String SQL_COUNT_ALL =
            "SELECT COUNT(*) FROM categories";

    // -----------------------------------------------------------------------
    // CONSTRUCTORS
    // -----------------------------------------------------------------------

    private final DatabaseManager database;

    public SqliteCategoryRepository(DatabaseManager database) {
        if (database == null) {
            throw new IllegalArgumentException("DatabaseManager must not be null.");
        }
        this.database = database;
    }

    private Connection conn() {
        return database.getConnection();
    }

    static Category mapRow(ResultSet rs) throws SQLException {
        Category category = new Category();
        category.setId(rs.getInt("id"));
        category.setName(rs.getString("name"));
        category.setDescription(rs.getString("description"));
        category.setCreatedAt(StoreTimestamps.parse(rs.getString("created_at")));
        category.setUpdatedAt(StoreTimestamps.parse(rs.getString("updated_at")));
        return category;
    }

    // -----------------------------------------------------------------------
    // READ
    // -----------------------------------------------------------------------

    @Override
    public Optional<Category> findById(int id) {
        try (PreparedStatement ps = conn().prepareStatement(SQL_FIND_BY_ID)) {
            ps.setInt(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
        } catch (SQLException ex) {
            throw new RepositoryException("Failed to find category by id: " + id, ex);
        }
        return Optional.empty();
    }

    /**
     * {@inheritDoc}
     *
     * <p>The {@code name} column is declared {@code COLLATE NOCASE}, so a
     * plain equality is already case-insensitive.
     */
    @Override
    public Optional<Category> findByName(String name) {
        String safeName = name == null ? "" : name.trim();
        try (PreparedStatement ps = conn().prepareStatement(SQL_FIND_BY_NAME)) {
            ps.setString(1, safeName);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
        } catch (SQLException ex) {
            throw new RepositoryException("Failed to find category by name: " + safeName, ex);
        }
        return Optional.empty();
    }

    @Override
    public List<Category> findAll() {
        List<Category> categories = new ArrayList<>();
        try (PreparedStatement ps = conn().prepareStatement(SQL_FIND_ALL);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                categories.add(mapRow(rs));
            }
        } catch (SQLException ex) {
            throw new RepositoryException("Failed to retrieve all categories.", ex);
        }
        log.debug("findAll() returned {} categories.", categories.size());
        return categories;
    }

    @Override
    public int countAll() {
        try (PreparedStatement ps = conn().prepareStatement(SQL_COUNT_ALL);
             ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException ex) {
            throw new RepositoryException("Failed to count categories.", ex);
        }
    }

    // -----------------------------------------------------------------------
    // WRITE
    // -----------------------------------------------------------------------

    @Override
    public Category insert(Category category) {
        LocalDateTime now = StoreTimestamps.now();
        try (PreparedStatement ps = conn().prepareStatement(
                SQL_INSERT, Statement.RETURN_GENERATED_KEYS)) {
            ps.setString(1, category.getName());
            ps.setString(2, category.getDescription());
            ps.setString(3, StoreTimestamps.format(now));
            ps.setString(4, StoreTimestamps.format(now));
            ps.executeUpdate();

            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (keys.next()) {
                    category.setId(keys.getInt(1));
                }
            }
        } catch (SQLException ex) {
            throw new RepositoryException("Failed to insert category: " + category.getName(), ex);
        }
        category.setCreatedAt(now);
        category.setUpdatedAt(now);
        log.info("Category '{}' inserted with DB id={}.", category.getName(), category.getId());
        return category;
    }

    @Override
    public boolean update(Category category) {
        LocalDateTime now = StoreTimestamps.now();
        try (PreparedStatement ps = conn().prepareStatement(SQL_UPDATE)) {
            ps.setString(1, category.getName());
            ps.setString(2, category.getDescription());
            ps.setString(3, StoreTimestamps.format(now));
            ps.setInt(4, category.getId());
            boolean updated = ps.executeUpdate() > 0;
            if (updated) {
                category.setUpdatedAt(now);
            }
            return updated;
        } catch (SQLException ex) {
            throw new RepositoryException("Failed to update category id=" + category.getId(), ex);
        }
    }

    @Override
    public boolean delete(int id) {
        try {
            return database.inTransaction(c -> {
                int links;
                try (PreparedStatement ps = c.prepareStatement(SQL_DELETE_LINKS)) {
                    ps.setInt(1, id);
                    links = ps.executeUpdate();
                }
                int recomputed;
                try (PreparedStatement ps = c.prepareStatement(SQL_RECOMPUTE_AFFECTED)) {
                    ps.setString(1, StoreTimestamps.format(StoreTimestamps.now()));
                    ps.setInt(2, id);
                    recomputed = ps.executeUpdate();
                }
                boolean deleted;
                try (PreparedStatement ps = c.prepareStatement(SQL_DELETE)) {
                    ps.setInt(1, id);
                    deleted = ps.executeUpdate() > 0;
                }
                if (deleted) {
                    log.info("Category id={} deleted; {} link(s) removed, {} component(s) re-pointed.",
                            id, links, recomputed);
                }
                return deleted;
            });
        } catch (SQLException ex) {
            throw new RepositoryException("Failed to delete category id=" + id, ex);
        }
    }
}
