package com.elclab.components.repository;

import com.elclab.components.domain.Category;
import com.elclab.components.domain.Component;
import com.elclab.components.domain.ComponentUpdate;
import com.elclab.components.service.LinkManager;
import com.elclab.components.service.NotFoundException;
import com.elclab.components.util.DatabaseManager;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for the SQLite repositories over a throw-away database file.
 */
class SqliteRepositoryTest {

    @TempDir
    Path tempDir;

    private DatabaseManager database;
    private SqliteComponentRepository components;
    private SqliteCategoryRepository categories;
    private SqliteLinkRepository links;

    @BeforeEach
    void setUp() {
        database = new DatabaseManager(tempDir.resolve("catalog.db"));
        components = new SqliteComponentRepository(database);
        categories = new SqliteCategoryRepository(database);
        links = new SqliteLinkRepository(database);
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    private Component addComponent(String identifier, String price, String description) {
        return components.insert(new Component(identifier, description, new BigDecimal(price), 0));
    }

    private Category addCategory(String name) {
        return categories.insert(new Category(name, null));
    }

    private int countLinks() throws SQLException {
        try (Statement st = database.getConnection().createStatement();
             ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM component_category")) {
            rs.next();
            return rs.getInt(1);
        }
    }

    private Integer currentCategory(String identifier) {
        return components.findByIdentifier(identifier).orElseThrow().getCategoryId();
    }

    // ======================================================================
    // Components
    // ======================================================================

    @Nested
    @DisplayName("SqliteComponentRepository")
    class ComponentRepositoryTests {

        @Test
        @DisplayName("insert assigns an id and store timestamps")
        void insert_assignsIdAndTimestamps() {
            Component stored = addComponent("R10K", "0.05", "10k resistor");

            assertTrue(stored.getId() > 0);
            assertNotNull(stored.getCreatedAt());
            assertEquals(stored.getCreatedAt(), stored.getUpdatedAt());
        }

        @Test
        @DisplayName("prices round-trip with their exact decimal text")
        void price_exact() {
            addComponent("C1", "0.050", null);

            Component found = components.findByIdentifier("C1").orElseThrow();
            assertEquals(new BigDecimal("0.050"), found.getPrice());
            assertNull(found.getDescription());
            assertEquals(0, found.getQuantity());
        }

        @Test
        @DisplayName("identifiers are case-sensitive")
        void identifiers_caseSensitive() {
            addComponent("r10k", "0.05", null);
            addComponent("R10K", "0.06", null);

            assertEquals(2, components.countAll());
            assertEquals(new BigDecimal("0.06"),
                    components.findByIdentifier("R10K").orElseThrow().getPrice());
            assertTrue(components.findByIdentifier("R10k").isEmpty());
        }

        @Test
        @DisplayName("duplicate identifier insert is a store error")
        void insert_duplicate_throws() {
            addComponent("R1", "0.05", null);
            assertThrows(RepositoryException.class, () -> addComponent("R1", "0.10", null));
        }

        @Test
        @DisplayName("findAll orders by identifier")
        void findAll_ordered() {
            addComponent("T1", "1", null);
            addComponent("C1", "1", null);
            addComponent("R1", "1", null);

            List<String> ids = components.findAll().stream().map(Component::getIdentifier).toList();
            assertEquals(List.of("C1", "R1", "T1"), ids);
        }

        @Test
        @DisplayName("search matches identifier, description and category name")
        void search_matchesAllColumns() {
            Component r = addComponent("R10K", "0.05", "carbon resistor");
            addComponent("Q1", "0.30", "npn transistor");
            Category sensors = addCategory("Sensors");
            Component s = addComponent("TMP36", "1.20", null);
            links.link(s.getId(), sensors.getId());

            assertEquals(List.of(r), components.search("carbon"));
            assertEquals(List.of(r), components.search("r10"));
            assertEquals(List.of(s), components.search("sensor"));
            assertTrue(components.search("zzz").isEmpty());
        }

        @Test
        @DisplayName("update applies only the fields it carries")
        void update_partial() {
            addComponent("R10K", "0.05", null);

            Optional<Component> updated = components.update("R10K",
                    ComponentUpdate.descriptionOnly("10k ohm resistor"));

            assertTrue(updated.isPresent());
            assertEquals("10k ohm resistor", updated.get().getDescription());
            assertEquals(new BigDecimal("0.05"), updated.get().getPrice());
        }

        @Test
        @DisplayName("update can clear a description when the price rises")
        void update_priceAndNullDescription() {
            addComponent("R1", "0.05", "old");

            Component updated = components.update("R1",
                    ComponentUpdate.priceAndDescription(null, new BigDecimal("0.07"))).orElseThrow();

            assertNull(updated.getDescription());
            assertEquals(new BigDecimal("0.07"), updated.getPrice());
        }

        @Test
        @DisplayName("update of a missing identifier returns empty")
        void update_missing_empty() {
            assertTrue(components.update("NOPE", ComponentUpdate.descriptionOnly("x")).isEmpty());
        }

        @Test
        @DisplayName("adjustQuantity adds the delta and may go negative")
        void adjustQuantity() {
            addComponent("R1", "0.05", null);

            assertEquals(5, components.adjustQuantity("R1", 5).orElseThrow().getQuantity());
            assertEquals(-2, components.adjustQuantity("R1", -7).orElseThrow().getQuantity());
            assertTrue(components.adjustQuantity("NOPE", 1).isEmpty());
        }

        @Test
        @DisplayName("deleteByIdentifier removes the component and its links")
        void delete_cascadesLinks() throws SQLException {
            Component r = addComponent("R1", "0.05", null);
            Category cat = addCategory("RESISTOR");
            links.link(r.getId(), cat.getId());

            assertTrue(components.deleteByIdentifier("R1"));
            assertFalse(components.deleteByIdentifier("R1"));
            assertEquals(0, countLinks());
            assertTrue(categories.findById(cat.getId()).isPresent());
        }
    }

    // ======================================================================
    // Categories
    // ======================================================================

    @Nested
    @DisplayName("SqliteCategoryRepository")
    class CategoryRepositoryTests {

        @Test
        @DisplayName("findByName is case-insensitive and trims")
        void findByName_caseInsensitive() {
            Category cat = addCategory("Resistor");

            assertEquals(cat.getId(), categories.findByName("  RESISTOR ").orElseThrow().getId());
        }

        @Test
        @DisplayName("names differing only in case collide")
        void insert_caseDuplicate_throws() {
            addCategory("Diode");
            assertThrows(RepositoryException.class, () -> addCategory("DIODE"));
        }

        @Test
        @DisplayName("update renames a category")
        void update_renames() {
            Category cat = addCategory("Misc");
            cat.setName("Other");

            assertTrue(categories.update(cat));
            assertEquals("Other", categories.findById(cat.getId()).orElseThrow().getName());
        }

        @Test
        @DisplayName("delete leaves no links and no dangling current category")
        void delete_recomputesCurrent() throws SQLException {
            Component r = addComponent("R1", "0.05", null);
            Component c = addComponent("C1", "0.10", null);
            Category a = addCategory("A");
            Category b = addCategory("B");
            links.link(r.getId(), a.getId());
            links.link(r.getId(), b.getId());
            links.link(c.getId(), b.getId());

            assertTrue(categories.delete(b.getId()));

            assertEquals(a.getId(), currentCategory("R1"));
            assertNull(currentCategory("C1"));
            assertEquals(1, countLinks());
            assertTrue(categories.findById(b.getId()).isEmpty());
            assertFalse(categories.delete(b.getId()));
        }
    }

    // ======================================================================
    // Links
    // ======================================================================

    @Nested
    @DisplayName("SqliteLinkRepository")
    class LinkRepositoryTests {

        @Test
        @DisplayName("link sets the current category and is idempotent")
        void link_idempotent() throws SQLException {
            Component r = addComponent("R1", "0.05", null);
            Category cat = addCategory("RESISTOR");

            assertTrue(links.link(r.getId(), cat.getId()));
            assertFalse(links.link(r.getId(), cat.getId()));

            assertEquals(1, countLinks());
            assertEquals(cat.getId(), currentCategory("R1"));
            assertEquals("RESISTOR",
                    components.findByIdentifier("R1").orElseThrow().getCategoryName());
            assertTrue(links.findLink(r.getId(), cat.getId()).isPresent());
        }

        @Test
        @DisplayName("re-linking an existing, non-current category changes nothing")
        void link_existing_isNoOp() throws SQLException {
            Component r = addComponent("R1", "0.05", null);
            Category a = addCategory("A");
            Category b = addCategory("B");
            links.link(r.getId(), a.getId());
            links.link(r.getId(), b.getId());

            assertFalse(links.link(r.getId(), a.getId()));
            assertEquals(b.getId(), currentCategory("R1"));
            assertEquals(2, countLinks());
        }

        @Test
        @DisplayName("assignCategory on an existing link keeps the current category")
        void assignCategory_existing_keepsCurrent() throws NotFoundException {
            LinkManager manager = new LinkManager(components, categories, links);
            Component r = addComponent("R1", "0.05", null);
            Category a = addCategory("A");
            Category b = addCategory("B");

            assertTrue(manager.assignCategory(r.getId(), a.getId()));
            assertTrue(manager.assignCategory(r.getId(), b.getId()));
            assertFalse(manager.assignCategory(r.getId(), a.getId()));

            assertEquals(b.getId(), currentCategory("R1"));
            assertEquals(List.of("B", "A"),
                    manager.categoriesFor(r.getId()).stream().map(Category::getName).toList());
        }

        @Test
        @DisplayName("unlinking the current category falls back to the latest remaining link")
        void unlink_current_recomputes() {
            Component r = addComponent("R1", "0.05", null);
            Category a = addCategory("A");
            Category b = addCategory("B");
            links.link(r.getId(), a.getId());
            links.link(r.getId(), b.getId());

            assertTrue(links.unlink(r.getId(), b.getId()));
            assertEquals(a.getId(), currentCategory("R1"));

            assertTrue(links.unlink(r.getId(), a.getId()));
            assertNull(currentCategory("R1"));
            assertFalse(links.unlink(r.getId(), a.getId()));
        }

        @Test
        @DisplayName("unlinking a non-current category keeps the current one")
        void unlink_nonCurrent_keepsCurrent() {
            Component r = addComponent("R1", "0.05", null);
            Category a = addCategory("A");
            Category b = addCategory("B");
            links.link(r.getId(), a.getId());
            links.link(r.getId(), b.getId());

            links.unlink(r.getId(), a.getId());
            assertEquals(b.getId(), currentCategory("R1"));
        }

        @Test
        @DisplayName("categoriesFor lists most recent first, componentsFor by identifier")
        void queries_ordered() {
            Component r = addComponent("R1", "0.05", null);
            Component c = addComponent("C1", "0.05", null);
            Category a = addCategory("A");
            Category b = addCategory("B");
            links.link(r.getId(), a.getId());
            links.link(r.getId(), b.getId());
            links.link(c.getId(), a.getId());

            assertEquals(List.of("B", "A"),
                    links.categoriesFor(r.getId()).stream().map(Category::getName).toList());
            assertEquals(List.of("C1", "R1"),
                    links.componentsFor(a.getId()).stream().map(Component::getIdentifier).toList());
        }

        @Test
        @DisplayName("linking a missing category violates the foreign key")
        void link_missingCategory_throws() {
            Component r = addComponent("R1", "0.05", null);
            assertThrows(RepositoryException.class, () -> links.link(r.getId(), 999));
        }
    }
}
