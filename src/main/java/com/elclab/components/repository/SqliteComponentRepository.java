package com.elclab.components.repository;

import com.elclab.components.domain.Component;
import com.elclab.components.domain.ComponentUpdate;
import com.elclab.components.util.DatabaseManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
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
 * SqliteComponentRepository - JDBC implementation of {@link ComponentRepository}.
 *
 * <p>RULES:
 * <ul>
 *   <li>All component SQL lives here as named constants.</li>
 *   <li>Prepared statements only; no SQL is built by concatenation.</li>
 *   <li>Every {@link SQLException} is wrapped in {@link RepositoryException}.</li>
 *   <li>No business rules: the repository persists what it is given.</li>
 * </ul>
 *
 * <p>PRICE STORAGE:
 * Prices are stored as the plain decimal string of the {@link BigDecimal}
 * ("0.05", "12.5") and read back with {@code new BigDecimal(text)}, so no
 * value ever passes through a binary floating point type.
 *
 * <p>Every SELECT joins {@code categories} so a loaded component carries
 * the display name of its current category.
 */
public class SqliteComponentRepository implements ComponentRepository {

    private static final Logger log = LoggerFactory.getLogger(SqliteComponentRepository.class);

    // -----------------------------------------------------------------------
    // SQL CONSTANTS
    // -----------------------------------------------------------------------

    private static final String SELECT_COLUMNS = """
            SELECT c.id, c.identifier, c.description, c.price, c.quantity,
                   c.category_id, cat.name AS category_name,
                   c.created_at, c.updated_at
            FROM components c
            LEFT JOIN categories cat ON cat.id = c.category_id
            """;

    private static final String SQL_FIND_BY_IDENTIFIER =
            SELECT_COLUMNS + "WHERE c.identifier = ?";

    private static final String SQL_FIND_BY_ID =
            SELECT_COLUMNS + "WHERE c.id = ?";

    private static final String SQL_FIND_ALL =
            SELECT_COLUMNS + "ORDER BY c.identifier ASC";

    private static final String SQL_SEARCH = SELECT_COLUMNS + """
            WHERE LOWER(c.identifier)                LIKE LOWER(?)
               OR LOWER(COALESCE(c.description, '')) LIKE LOWER(?)
               OR LOWER(COALESCE(cat.name, ''))      LIKE LOWER(?)
            ORDER BY c.identifier ASC
            """;

    private static final String SQL_INSERT = """
            INSERT INTO components
                (identifier, description, price, quantity, category_id,
                 created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """;

    private static final String SQL_UPDATE = """
            UPDATE components
            SET description = ?,
                price       = ?,
                quantity    = ?,
                updated_at  = ?
            WHERE identifier = ?
            """;

    private static final String SQL_ADJUST_QUANTITY = """
            UPDATE components
            SET quantity   = quantity + ?,
                updated_at = ?
            WHERE identifier = ?
            """;

    private static final String SQL_DELETE_LINKS = """
            DELETE FROM component_category
            WHERE component_id = (SELECT id FROM components WHERE identifier = ?)
            """;

    private static final String SQL_DELETE =
            "DELETE FROM components WHERE identifier = ?";

    private static final String SQL_COUNT_ALL =
            "SELECT COUNT(*) FROM components";

    // -----------------------------------------------------------------------
    // CONSTRUCTORS
    // -----------------------------------------------------------------------

    private final DatabaseManager database;

    /**
     * @param database connection owner; tests pass one over a temp file
     */
    public SqliteComponentRepository(DatabaseManager database) {
        if (database == null) {
            throw new IllegalArgumentException("DatabaseManager must not be null.");
        }
        this.database = database;
        log.debug("SqliteComponentRepository instantiated.");
    }

    // -----------------------------------------------------------------------
    // PRIVATE HELPERS
    // -----------------------------------------------------------------------

    private Connection conn() {
        return database.getConnection();
    }

    /**
     * Maps the current {@link ResultSet} row to a {@link Component}.
     * The cursor must already be positioned on the row.
     */
    static Component mapRow(ResultSet rs) throws SQLException {
        Component c = new Component();
        c.setId(rs.getInt("id"));
        c.setIdentifier(rs.getString("identifier"));
        c.setDescription(rs.getString("description"));
        c.setPrice(new BigDecimal(rs.getString("price")));
        c.setQuantity(rs.getInt("quantity"));
        int categoryId = rs.getInt("category_id");
        c.setCategoryId(rs.wasNull() ? null : categoryId);
        c.setCategoryName(rs.getString("category_name"));
        c.setCreatedAt(StoreTimestamps.parse(rs.getString("created_at")));
        c.setUpdatedAt(StoreTimestamps.parse(rs.getString("updated_at")));
        return c;
    }

    private Optional<Component> findOne(String sql, StatementBinder binder, String what) {
        try (PreparedStatement ps = conn().prepareStatement(sql)) {
            binder.bind(ps);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
        } catch (SQLException ex) {
            throw new RepositoryException("Failed to find component by " + what, ex);
        }
        return Optional.empty();
    }

    // -----------------------------------------------------------------------
    // READ
    // -----------------------------------------------------------------------

    @Override
    public Optional<Component> findByIdentifier(String identifier) {
        log.debug("Finding component by identifier='{}'.", identifier);
        return findOne(SQL_FIND_BY_IDENTIFIER,
                ps -> ps.setString(1, identifier),
                "identifier: " + identifier);
    }

    @Override
    public Optional<Component> findById(int id) {
        log.debug("Finding component by id={}.", id);
        return findOne(SQL_FIND_BY_ID, ps -> ps.setInt(1, id), "id: " + id);
    }

    @Override
    public List<Component> findAll() {
        List<Component> components = new ArrayList<>();

        try (PreparedStatement ps = conn().prepareStatement(SQL_FIND_ALL);
             ResultSet rs = ps.executeQuery()) {

            while (rs.next()) {
                components.add(mapRow(rs));
            }

        } catch (SQLException ex) {
            throw new RepositoryException("Failed to retrieve all components.", ex);
        }

        log.debug("findAll() returned {} components.", components.size());
        return components;
    }

    /**
     * {@inheritDoc}
     *
     * <p>The same "%keyword%" pattern is bound to each of the three LIKE
     * clauses.
     */
    @Override
    public List<Component> search(String keyword) {
        String safeKeyword = keyword == null ? "" : keyword.trim();
        String param = "%" + safeKeyword + "%";
        List<Component> results = new ArrayList<>();

        try (PreparedStatement ps = conn().prepareStatement(SQL_SEARCH)) {
            for (int i = 1; i <= 3; i++) {
                ps.setString(i, param);
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    results.add(mapRow(rs));
                }
            }
        } catch (SQLException ex) {
            throw new RepositoryException(
                    "Failed to search components with keyword: " + safeKeyword, ex);
        }

        log.debug("search('{}') returned {} results.", safeKeyword, results.size());
        return results;
    }

    @Override
    public int countAll() {
        try (PreparedStatement ps = conn().prepareStatement(SQL_COUNT_ALL);
             ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException ex) {
            throw new RepositoryException("Failed to count components.", ex);
        }
    }

    // -----------------------------------------------------------------------
    // WRITE
    // -----------------------------------------------------------------------

    @Override
    public Component insert(Component component) {
        log.debug("Inserting component: {}", component);

        LocalDateTime now = StoreTimestamps.now();

        try (PreparedStatement ps = conn().prepareStatement(
                SQL_INSERT, Statement.RETURN_GENERATED_KEYS)) {

            ps.setString(1, component.getIdentifier());
            ps.setString(2, component.getDescription());
            ps.setString(3, component.getPrice().toPlainString());
            ps.setInt(4, component.getQuantity());
            if (component.getCategoryId() == null) {
                ps.setNull(5, java.sql.Types.INTEGER);
            } else {
                ps.setInt(5, component.getCategoryId());
            }
            ps.setString(6, StoreTimestamps.format(now));
            ps.setString(7, StoreTimestamps.format(now));
            ps.executeUpdate();

            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (keys.next()) {
                    component.setId(keys.getInt(1));
                }
            }

        } catch (SQLException ex) {
            throw new RepositoryException(
                    "Failed to insert component: " + component.getIdentifier(), ex);
        }

        component.setCreatedAt(now);
        component.setUpdatedAt(now);
        log.info("Component '{}' inserted with DB id={}.",
                component.getIdentifier(), component.getId());
        return component;
    }

    /**
     * {@inheritDoc}
     *
     * <p>Read-modify-write inside one transaction: the stored row is
     * loaded, {@code update} is applied in memory and every editable
     * column is written back.
     */
    @Override
    public Optional<Component> update(String identifier, ComponentUpdate update) {
        log.debug("Updating component '{}' with {}.", identifier, update);
        try {
            return database.inTransaction(c -> {
                Optional<Component> existing = findByIdentifier(identifier);
                if (existing.isEmpty()) {
                    return Optional.<Component>empty();
                }
                Component component = existing.get();
                update.applyTo(component);
                LocalDateTime now = StoreTimestamps.now();

                try (PreparedStatement ps = c.prepareStatement(SQL_UPDATE)) {
                    ps.setString(1, component.getDescription());
                    ps.setString(2, component.getPrice().toPlainString());
                    ps.setInt(3, component.getQuantity());
                    ps.setString(4, StoreTimestamps.format(now));
                    ps.setString(5, identifier);
                    ps.executeUpdate();
                }
                component.setUpdatedAt(now);
                return Optional.of(component);
            });
        } catch (SQLException ex) {
            throw new RepositoryException("Failed to update component: " + identifier, ex);
        }
    }

    @Override
    public Optional<Component> adjustQuantity(String identifier, int delta) {
        log.debug("Adjusting quantity of '{}' by {}.", identifier, delta);
        int rows;
        try (PreparedStatement ps = conn().prepareStatement(SQL_ADJUST_QUANTITY)) {
            ps.setInt(1, delta);
            ps.setString(2, StoreTimestamps.format(StoreTimestamps.now()));
            ps.setString(3, identifier);
            rows = ps.executeUpdate();
        } catch (SQLException ex) {
            throw new RepositoryException(
                    "Failed to adjust quantity of component: " + identifier, ex);
        }
        return rows == 0 ? Optional.empty() : findByIdentifier(identifier);
    }

    /**
     * {@inheritDoc}
     *
     * <p>The link rows are deleted explicitly before the component even
     * though the foreign key also cascades; both statements share one
     * transaction.
     */
    @Override
    public boolean deleteByIdentifier(String identifier) {
        log.debug("Deleting component '{}'.", identifier);
        try {
            boolean deleted = database.inTransaction(c -> {
                try (PreparedStatement links = c.prepareStatement(SQL_DELETE_LINKS)) {
                    links.setString(1, identifier);
                    links.executeUpdate();
                }
                try (PreparedStatement ps = c.prepareStatement(SQL_DELETE)) {
                    ps.setString(1, identifier);
                    return ps.executeUpdate() > 0;
                }
            });
            if (deleted) {
                log.info("Component '{}' deleted.", identifier);
            }
            return deleted;
        } catch (SQLException ex) {
            throw new RepositoryException("Failed to delete component: " + identifier, ex);
        }
    }

    /** Binds parameters onto a prepared statement. */
    @FunctionalInterface
    interface StatementBinder {
        void bind(PreparedStatement ps) throws SQLException;
    }
}
