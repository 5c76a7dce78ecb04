package com.elclab.components.cli;

import com.elclab.components.util.CsvImporter;
import com.elclab.components.util.ImportException;
import com.elclab.components.util.ImportReport;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;

/**
 * Imports a component CSV file.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * component-catalog import parts.csv
 * component-catalog import parts.csv --auto-categorize --no-report
 * }</pre>
 */
@Command(
    name = "import",
    description = "Reconcile a CSV file (ITEM, PRICE, DESCRIPTION) into the catalog",
    mixinStandardHelpOptions = true
)
class ImportCommand extends CatalogCommand {

    @Parameters(index = "0", description = "CSV file to import")
    Path file;

    @Option(names = "--auto-categorize",
            description = "Link new components to their standard category")
    boolean autoCategorize;

    @Option(names = "--no-report",
            description = "Do not write <name>_import_report.txt for skipped rows")
    boolean noReport;

    @Override
    protected int execute(CatalogContext context) throws ImportException {
        CsvImporter importer = context.newImporter();
        if (autoCategorize) {
            importer.setAutoCategorize(true);
        }
        if (noReport) {
            importer.setWriteReportFile(false);
        }

        ImportReport report = importer.importFile(file);

        out().println(report.getSummary());
        if (report.getCategorisedCount() > 0) {
            out().printf("%d new component(s) categorised.%n", report.getCategorisedCount());
        }
        for (ImportReport.RowResult skipped : report.getSkippedRows()) {
            out().printf("  line %d skipped: %s%n", skipped.getLineNumber(), skipped.getMessage());
        }
        return EXIT_OK;
    }
}
