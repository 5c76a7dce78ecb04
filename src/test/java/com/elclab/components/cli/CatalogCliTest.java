package com.elclab.components.cli;

import com.elclab.components.util.AppConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the command line end to end against a temporary database.
 */
class CatalogCliTest {

    @TempDir
    Path tempDir;

    private AppConfig config;
    private Path dbPath;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() throws IOException {
        config = configWith("");
        dbPath = tempDir.resolve("cli.db");
    }

    private AppConfig configWith(String extraLines) throws IOException {
        Path file = tempDir.resolve("catalog.properties");
        Files.writeString(file, AppConfig.KEY_DATABASE_PATH + "="
                + tempDir.resolve("default.db").toString().replace('\\', '/') + "\n" + extraLines);
        return new AppConfig(file);
    }

    private int run(String... args) {
        out = new StringWriter();
        err = new StringWriter();
        CommandLine cmd = CatalogCli.newCommandLine(new CatalogCli(config));
        cmd.setOut(new PrintWriter(out, true));
        cmd.setErr(new PrintWriter(err, true));
        String[] full = new String[args.length + 2];
        full[0] = "--db";
        full[1] = dbPath.toString();
        System.arraycopy(args, 0, full, 2, args.length);
        return cmd.execute(full);
    }

    private Path csv(String content) throws IOException {
        Path file = tempDir.resolve("parts.csv");
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    // ======================================================================
    // import
    // ======================================================================

    @Nested
    @DisplayName("import")
    class ImportCommandTests {

        @Test
        @DisplayName("prints the summary and skipped rows")
        void import_summary() throws IOException {
            Path file = csv("""
                    ITEM,PRICE,DESCRIPTION
                    R10K,0.05,10k ohm resistor
                    X9,N/A,mystery
                    """);

            assertEquals(0, run("import", file.toString(), "--no-report"));

            assertTrue(out.toString().contains("2 rows: 1 inserted, 0 overwritten, 0 unchanged, 1 skipped."));
            assertTrue(out.toString().contains("line 3 skipped: Price 'N/A' is not a number."));
            assertFalse(Files.exists(tempDir.resolve("parts_import_report.txt")));
        }

        @Test
        @DisplayName("auto-categorize links to seeded categories")
        void import_autoCategorize() throws IOException {
            Path file = csv("ITEM,PRICE,DESCRIPTION\nR10K,0.05,10k ohm resistor\n");

            assertEquals(0, run("import", file.toString(), "--auto-categorize"));
            assertTrue(out.toString().contains("1 new component(s) categorised."));

            assertEquals(0, run("components"));
            assertTrue(out.toString().contains("RESISTOR"));
        }

        @Test
        @DisplayName("import.write.report=false suppresses the report file")
        void import_reportDisabledByConfig() throws IOException {
            config = configWith(AppConfig.KEY_WRITE_IMPORT_REPORT + "=false\n");
            Path file = csv("ITEM,PRICE,DESCRIPTION\nR1,abc,\n");

            assertEquals(0, run("import", file.toString()));
            assertFalse(Files.exists(tempDir.resolve("parts_import_report.txt")));

            config = configWith("");
            assertEquals(0, run("import", file.toString()));
            assertTrue(Files.exists(tempDir.resolve("parts_import_report.txt")));
        }

        @Test
        @DisplayName("a missing file exits with the store/import code")
        void import_missingFile() {
            assertEquals(CatalogCommand.EXIT_STORE_ERROR,
                    run("import", tempDir.resolve("nope.csv").toString()));
            assertTrue(err.toString().startsWith("Import failed:"));
        }

        @Test
        @DisplayName("uses the configured database when --db is absent")
        void import_defaultDatabase() throws IOException {
            Path file = csv("ITEM,PRICE,DESCRIPTION\nR1,1,\n");
            StringWriter sw = new StringWriter();
            CommandLine cmd = CatalogCli.newCommandLine(new CatalogCli(config));
            cmd.setOut(new PrintWriter(sw, true));

            assertEquals(0, cmd.execute("import", file.toString()));
            assertTrue(Files.exists(tempDir.resolve("default.db")));
        }
    }

    // ======================================================================
    // components
    // ======================================================================

    @Nested
    @DisplayName("component commands")
    class ComponentCommandTests {

        @Test
        @DisplayName("add, list, stock and remove")
        void lifecycle() {
            assertEquals(0, run("add", "R1", "--price", "0.05", "-d", "resistor"));
            assertTrue(out.toString().startsWith("Added R1 (id "));

            assertEquals(0, run("stock", "R1", "-5"));
            assertTrue(out.toString().contains("R1 now has -5 in stock."));

            assertEquals(0, run("components", "--search", "resist"));
            assertTrue(out.toString().contains("R1"));

            assertEquals(0, run("remove", "R1"));
            assertTrue(out.toString().contains("Removed R1."));

            assertEquals(0, run("components"));
            assertTrue(out.toString().contains("No components."));
        }

        @Test
        @DisplayName("a duplicate identifier is a business error")
        void add_duplicate() {
            run("add", "R1", "--price", "0.05");

            assertEquals(CatalogCommand.EXIT_BUSINESS_ERROR, run("add", "R1", "--price", "0.07"));
            assertTrue(err.toString().contains("Identifier 'R1' is already in use."));
        }

        @Test
        @DisplayName("removing an unknown component is a business error")
        void remove_unknown() {
            assertEquals(CatalogCommand.EXIT_BUSINESS_ERROR, run("remove", "NOPE"));
            assertTrue(err.toString().startsWith("Error:"));
        }
    }

    // ======================================================================
    // categories and links
    // ======================================================================

    @Nested
    @DisplayName("category and link commands")
    class CategoryCommandTests {

        @Test
        @DisplayName("standard categories are seeded on first use")
        void categories_seeded() {
            assertEquals(0, run("categories"));
            assertTrue(out.toString().contains("RESISTOR"));
            assertTrue(out.toString().contains("OTHER COMPONENTS"));
        }

        @Test
        @DisplayName("duplicate category names differing in case are rejected")
        void categoryAdd_duplicate() {
            assertEquals(0, run("category-add", "Sensors"));
            assertEquals(CatalogCommand.EXIT_BUSINESS_ERROR, run("category-add", "sensors"));
        }

        @Test
        @DisplayName("link is idempotent and category removal clears the assignment")
        void link_unlink_remove() {
            run("add", "R1", "--price", "0.05");
            run("category-add", "Sensors");
            String created = out.toString();
            String categoryId = created.substring(created.indexOf("(id ") + 4, created.indexOf(")."));

            assertEquals(0, run("link", "R1", categoryId));
            assertTrue(out.toString().contains("R1 assigned to category " + categoryId + "."));
            assertEquals(0, run("link", "R1", categoryId));
            assertTrue(out.toString().contains("R1 was already in category " + categoryId + "."));

            assertEquals(0, run("members", categoryId));
            assertTrue(out.toString().contains("R1"));

            assertEquals(0, run("category-remove", categoryId));
            assertEquals(0, run("links", "R1"));
            assertTrue(out.toString().contains("No categories."));

            assertEquals(CatalogCommand.EXIT_BUSINESS_ERROR, run("unlink", "R1", categoryId));
        }
    }
}
