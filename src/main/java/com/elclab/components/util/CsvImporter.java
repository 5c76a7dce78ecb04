package com.elclab.components.util;

import com.elclab.components.domain.Category;
import com.elclab.components.domain.Component;
import com.elclab.components.domain.ReconcileOutcome;
import com.elclab.components.domain.StandardCategory;
import com.elclab.components.repository.RepositoryException;
import com.elclab.components.service.CategoryService;
import com.elclab.components.service.LinkManager;
import com.elclab.components.service.NotFoundException;
import com.elclab.components.service.ReconciliationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * CsvImporter - Import Driver
 *
 * <p>Reads a component CSV file through {@link CsvRecordParser}, hands
 * every valid record to the {@link ReconciliationEngine} in file order and
 * collects the outcomes into an {@link ImportReport}.
 *
 * <p>PROCESSING PIPELINE:
 * <ol>
 *   <li>Validate that the file exists and is readable.</li>
 *   <li>Open the parser; a bad header fails the import before any write.</li>
 *   <li>For each row: check for cancellation, record skipped rows,
 *       reconcile candidates.</li>
 *   <li>Optionally link newly inserted components to their standard
 *       category.</li>
 *   <li>Write a companion {@code <name>_import_report.txt} when rows were
 *       skipped.</li>
 * </ol>
 *
 * <p>FAILURE SEMANTICS:
 * Every reconciliation commits on its own. A store failure stops the batch
 * and raises {@link ImportException} carrying the partial report; rows
 * before it stay committed. Cancellation is checked before each row and
 * is not an error: the returned report is marked cancelled.
 */
public class CsvImporter {

    private static final Logger log = LoggerFactory.getLogger(CsvImporter.class);

    private static final String OPERATION = "CSV_IMPORT";

    private final ReconciliationEngine engine;
    private final CategoryService      categoryService;
    private final LinkManager          linkManager;

    private boolean autoCategorize;
    private boolean writeReportFile = true;

    // -----------------------------------------------------------------------
    // CONSTRUCTORS
    // -----------------------------------------------------------------------

    /**
     * Importer without auto-categorisation support.
     *
     * @param engine reconciliation engine; must not be null
     */
    public CsvImporter(ReconciliationEngine engine) {
        this(engine, null, null);
    }

    /**
     * @param engine          reconciliation engine; must not be null
     * @param categoryService used to resolve standard categories by name
     * @param linkManager     used to link newly inserted components
     */
    public CsvImporter(ReconciliationEngine engine,
                       CategoryService categoryService,
                       LinkManager linkManager) {
        if (engine == null) {
            throw new IllegalArgumentException("ReconciliationEngine must not be null.");
        }
        this.engine          = engine;
        this.categoryService = categoryService;
        this.linkManager     = linkManager;
    }

    /**
     * Enables linking each newly inserted component to the standard
     * category suggested by {@link StandardCategory#classify}. Categories
     * that do not exist in the store are left alone.
     *
     * @throws IllegalStateException if this importer was built without a
     *         category service and link manager
     */
    public void setAutoCategorize(boolean autoCategorize) {
        if (autoCategorize && (categoryService == null || linkManager == null)) {
            throw new IllegalStateException(
                    "Auto-categorisation needs a CategoryService and a LinkManager.");
        }
        this.autoCategorize = autoCategorize;
    }

    public boolean isAutoCategorize() {
        return autoCategorize;
    }

    /** @param writeReportFile whether to write the companion report for skipped rows */
    public void setWriteReportFile(boolean writeReportFile) {
        this.writeReportFile = writeReportFile;
    }

    // -----------------------------------------------------------------------
    // PUBLIC API
    // -----------------------------------------------------------------------

    /**
     * Imports the whole file.
     *
     * @param csvFilePath source CSV file
     * @return the import outcome
     * @throws ImportException if the file or header is unusable, or the
     *         store fails mid-batch
     */
    public ImportReport importFile(Path csvFilePath) throws ImportException {
        return importFile(csvFilePath, () -> false);
    }

    /**
     * Imports the file, stopping early once {@code cancelRequested} returns
     * true. The flag is polled before every row.
     *
     * @param csvFilePath     source CSV file
     * @param cancelRequested cancellation flag
     * @return the import outcome, marked cancelled if stopped early
     * @throws ImportException if the file or header is unusable, or the
     *         store fails mid-batch
     */
    public ImportReport importFile(Path csvFilePath, BooleanSupplier cancelRequested)
            throws ImportException {
        log.info("Starting CSV import: file='{}', autoCategorize={}.", csvFilePath, autoCategorize);
        AppLogger.setOperationContext(OPERATION);
        try {
            validateFile(csvFilePath);
            ImportReport report = processRows(csvFilePath, cancelRequested);
            return finaliseReport(csvFilePath, report);
        } finally {
            AppLogger.clearOperationContext();
        }
    }

    // -----------------------------------------------------------------------
    // PRIVATE - PIPELINE
    // -----------------------------------------------------------------------

    private void validateFile(Path path) throws ImportException {
        String problem = null;
        if (!Files.exists(path)) {
            problem = "File does not exist: " + path.toAbsolutePath();
        } else if (!Files.isRegularFile(path)) {
            problem = "Path is not a regular file: " + path;
        } else if (!Files.isReadable(path)) {
            problem = "File is not readable (check permissions): " + path;
        }
        if (problem != null) {
            AppLogger.logWarningEvent("CSV_IMPORT_REJECTED", problem);
            throw new ImportException(problem, ImportReport.empty(path), null);
        }
    }

    private ImportReport processRows(Path csvFilePath, BooleanSupplier cancelRequested)
            throws ImportException {
        ImportReport.Builder builder = new ImportReport.Builder(csvFilePath);
        CsvRecordParser parser = CsvRecordParser.forFile(csvFilePath);

        CsvRecordParser.RowIterator rows;
        try {
            rows = parser.iterator();
        } catch (CsvFormatException ex) {
            AppLogger.logWarningEvent("CSV_IMPORT_REJECTED", ex.getMessage());
            throw new ImportException(ex.getMessage(), builder.build(), ex);
        } catch (UncheckedIOException ex) {
            AppLogger.logErrorEvent("CSV_IMPORT_FAILED", "file=" + csvFilePath, ex);
            throw new ImportException("Cannot read " + csvFilePath + ": "
                    + ex.getCause().getMessage(), builder.build(), ex.getCause());
        }

        int lastLine = 0;
        try (rows) {
            while (rows.hasNext()) {
                if (cancelRequested.getAsBoolean()) {
                    log.info("Cancellation requested after line {}; stopping import.", lastLine);
                    builder.markCancelled();
                    break;
                }

                ParsedRow row = rows.next();
                lastLine = row.getLineNumber();

                if (row.isSkipped()) {
                    log.debug("Line {} skipped: {}", row.getLineNumber(), row.getSkipReason());
                    builder.addSkipped(row.getLineNumber(), row.getRawLine(), row.getSkipReason());
                    continue;
                }

                ReconciliationEngine.Result result = engine.reconcile(row.getCandidate());
                builder.addOutcome(row.getLineNumber(), row.getRawLine(),
                        row.getCandidate().getIdentifier(), result.getOutcome());

                if (autoCategorize && result.getOutcome() == ReconcileOutcome.INSERTED
                        && categorise(result.getComponent())) {
                    builder.addCategorised();
                }
            }
        } catch (RepositoryException ex) {
            String reason = "store failure at line " + lastLine + ": " + ex.getMessage();
            ImportReport partial = builder.markHalted(reason).build();
            AppLogger.logErrorEvent("CSV_IMPORT_HALTED",
                    "file=" + csvFilePath.getFileName() + ", " + partial, ex);
            throw new ImportException("Import of " + csvFilePath.getFileName()
                    + " halted by a " + reason, partial, ex);
        } catch (UncheckedIOException ex) {
            ImportReport partial = builder.markHalted("read failure: " + ex.getMessage()).build();
            AppLogger.logErrorEvent("CSV_IMPORT_HALTED",
                    "file=" + csvFilePath.getFileName() + ", " + partial, ex);
            throw new ImportException("Reading " + csvFilePath.getFileName()
                    + " failed after line " + lastLine, partial, ex.getCause());
        }

        return builder.build();
    }

    /**
     * Links a newly inserted component to the standard category suggested
     * by its identifier and description, when that category exists.
     *
     * @return true if a link was made
     */
    private boolean categorise(Component component) {
        StandardCategory suggested =
                StandardCategory.classify(component.getIdentifier(), component.getDescription());
        Optional<Category> category = categoryService.findByName(suggested.getDisplayName());
        if (category.isEmpty()) {
            log.debug("No '{}' category in the store; '{}' left uncategorised.",
                    suggested.getDisplayName(), component.getIdentifier());
            return false;
        }
        try {
            return linkManager.assignCategory(component.getId(), category.get().getId());
        } catch (NotFoundException ex) {
            log.warn("Could not categorise '{}': {}", component.getIdentifier(), ex.getMessage());
            return false;
        }
    }

    private ImportReport finaliseReport(Path sourceFile, ImportReport report) {
        if (report.isCancelled()) {
            AppLogger.logWarningEvent("CSV_IMPORT_CANCELLED", report.toString());
        } else if (report.getSkippedCount() > 0) {
            AppLogger.logWarningEvent("CSV_IMPORT_COMPLETE", report.toString());
        } else {
            AppLogger.logEvent("CSV_IMPORT_COMPLETE", report.toString());
        }
        log.info("Import complete: {}", report.getSummary());

        if (writeReportFile && report.getSkippedCount() > 0) {
            writeReportFile(report, sourceFile);
        }
        return report;
    }

    /**
     * Writes {@code <name>_import_report.txt} next to the source file. A
     * failure is logged and does not affect the import result.
     */
    private void writeReportFile(ImportReport report, Path sourceFile) {
        Path reportPath = reportPathFor(sourceFile);
        try {
            Files.writeString(reportPath, report.toReportText(),
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING);
            log.info("Import report written to: {}", reportPath);
        } catch (IOException ex) {
            log.error("Failed to write import report file {}.", reportPath, ex);
        }
    }

    /**
     * @param sourceFile the imported CSV
     * @return the companion report path ("parts.csv" gives "parts_import_report.txt")
     */
    static Path reportPathFor(Path sourceFile) {
        String originalName = sourceFile.getFileName().toString();
        String baseName = originalName.contains(".")
                ? originalName.substring(0, originalName.lastIndexOf('.'))
                : originalName;
        Path parent = sourceFile.toAbsolutePath().getParent();
        return parent.resolve(baseName + "_import_report.txt");
    }
}
