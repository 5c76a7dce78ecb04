package com.elclab.components.util;

import com.elclab.components.domain.ReconcileOutcome;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * ImportReport - Immutable Import Outcome Value Object
 *
 * <p>Summarises one CSV import: how many rows were inserted, overwritten,
 * left unchanged and skipped, plus one {@link RowResult} per data row in
 * file order. A report may be partial: the batch was cancelled
 * ({@link #isCancelled()}) or halted by a store failure
 * ({@link #isHalted()}). Rows recorded before either event were applied.
 *
 * <p>The report is accumulated row by row through a {@link Builder} and
 * then frozen. {@link #toReportText()} renders the plain-text document
 * written next to the source file when rows were skipped.
 */
public final class ImportReport {

    private static final DateTimeFormatter DISPLAY_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    // -----------------------------------------------------------------------
    // FIELDS
    // -----------------------------------------------------------------------

    private final Path          sourceFile;
    private final LocalDateTime importedAt;
    private final Map<ReconcileOutcome, Integer> counts;
    private final int           categorisedCount;
    private final boolean       cancelled;
    private final String        haltReason;
    private final List<RowResult> rowResults;

    private ImportReport(Builder builder) {
        this.sourceFile       = builder.sourceFile;
        this.importedAt       = builder.importedAt;
        this.counts           = Collections.unmodifiableMap(new EnumMap<>(builder.counts));
        this.categorisedCount = builder.categorisedCount;
        this.cancelled        = builder.cancelled;
        this.haltReason       = builder.haltReason;
        this.rowResults       = Collections.unmodifiableList(new ArrayList<>(builder.rowResults));
    }

    /**
     * Report for an import that failed before any row was read.
     *
     * @param sourceFile the file that could not be imported
     * @return a report with no rows
     */
    public static ImportReport empty(Path sourceFile) {
        return new Builder(sourceFile).build();
    }

    // -----------------------------------------------------------------------
    // ACCESSORS
    // -----------------------------------------------------------------------

    public Path getSourceFile()           { return sourceFile; }
    public LocalDateTime getImportedAt()  { return importedAt; }

    public int getInsertedCount()    { return count(ReconcileOutcome.INSERTED); }
    public int getOverwrittenCount() { return count(ReconcileOutcome.OVERWRITTEN); }
    public int getUnchangedCount()   { return count(ReconcileOutcome.UNCHANGED); }
    public int getSkippedCount()     { return count(ReconcileOutcome.SKIPPED); }

    /** @return number of newly inserted components linked to a standard category */
    public int getCategorisedCount() { return categorisedCount; }

    /** @return number of data rows processed, skipped rows included */
    public int getTotalRows() {
        return rowResults.size();
    }

    /** @return rows that caused a store write */
    public int getWriteCount() {
        return (int) rowResults.stream().filter(r -> r.getOutcome().isWrite()).count();
    }

    /** @return true if processing stopped because cancellation was requested */
    public boolean isCancelled()     { return cancelled; }

    /** @return true if processing stopped on a store failure */
    public boolean isHalted()        { return haltReason != null; }

    /** @return the store failure that halted the batch, or null */
    public String getHaltReason()    { return haltReason; }

    /** @return per-row results in file order */
    public List<RowResult> getRowResults() { return rowResults; }

    public List<RowResult> getSkippedRows() {
        return rowResults.stream()
                .filter(r -> r.getOutcome() == ReconcileOutcome.SKIPPED)
                .toList();
    }

    private int count(ReconcileOutcome outcome) {
        return counts.getOrDefault(outcome, 0);
    }

    /**
     * @return one-line summary (e.g., "12 rows: 5 inserted, 2 overwritten,
     *         4 unchanged, 1 skipped.")
     */
    public String getSummary() {
        if (getTotalRows() == 0 && !cancelled && !isHalted()) {
            return "No data rows found in the file.";
        }
        String summary = String.format("%d rows: %d inserted, %d overwritten, %d unchanged, %d skipped.",
                getTotalRows(), getInsertedCount(), getOverwrittenCount(),
                getUnchangedCount(), getSkippedCount());
        if (cancelled) {
            summary += " Import was cancelled.";
        }
        if (isHalted()) {
            summary += " Import halted: " + haltReason;
        }
        return summary;
    }

    // -----------------------------------------------------------------------
    // REPORT TEXT GENERATION
    // -----------------------------------------------------------------------

    /**
     * Renders the report as plain text.
     *
     * <pre>
     * ============================================================
     *  Component Catalog - Import Report
     * ============================================================
     *  Source File   : parts.csv
     *  Imported At   : 2025-01-15 14:32:00
     *  Total Rows    : 12
     *  Inserted      : 5
     *  Overwritten   : 2
     *  Unchanged     : 4
     *  Skipped       : 1
     * ------------------------------------------------------------
     *  SKIPPED ROWS:
     * ------------------------------------------------------------
     *  Line 7     | Price 'N/A' is not a number.
     *             | Raw: ,N/A,
     * ============================================================
     * </pre>
     *
     * @return the report as a multi-line string
     */
    public String toReportText() {
        StringBuilder sb = new StringBuilder();
        String line60  = "=".repeat(60);
        String line60d = "-".repeat(60);

        sb.append(line60).append("\n");
        sb.append(" Component Catalog - Import Report\n");
        sb.append(line60).append("\n");
        sb.append(String.format(" %-14s: %s%n", "Source File",
                sourceFile != null ? sourceFile.getFileName() : "Unknown"));
        sb.append(String.format(" %-14s: %s%n", "Imported At", importedAt.format(DISPLAY_FORMAT)));
        sb.append(String.format(" %-14s: %d%n", "Total Rows",  getTotalRows()));
        sb.append(String.format(" %-14s: %d%n", "Inserted",    getInsertedCount()));
        sb.append(String.format(" %-14s: %d%n", "Overwritten", getOverwrittenCount()));
        sb.append(String.format(" %-14s: %d%n", "Unchanged",   getUnchangedCount()));
        sb.append(String.format(" %-14s: %d%n", "Skipped",     getSkippedCount()));
        if (categorisedCount > 0) {
            sb.append(String.format(" %-14s: %d%n", "Categorised", categorisedCount));
        }
        if (cancelled) {
            sb.append(" Import was cancelled before the end of the file.\n");
        }
        if (isHalted()) {
            sb.append(" Import halted: ").append(haltReason).append("\n");
        }
        sb.append(line60d).append("\n");

        List<RowResult> skipped = getSkippedRows();
        if (skipped.isEmpty()) {
            sb.append(" No rows were skipped.\n");
        } else {
            sb.append(" SKIPPED ROWS:\n");
            sb.append(line60d).append("\n");
            for (RowResult rr : skipped) {
                sb.append(String.format(" Line %-5d | %s%n", rr.getLineNumber(), rr.getMessage()));
                if (rr.getRawLine() != null && !rr.getRawLine().isBlank()) {
                    String raw = rr.getRawLine();
                    if (raw.length() > 80) {
                        raw = raw.substring(0, 77) + "...";
                    }
                    sb.append(String.format("            | Raw: %s%n", raw));
                }
            }
        }

        sb.append(line60).append("\n");
        return sb.toString();
    }

    @Override
    public String toString() {
        return "ImportReport{inserted=" + getInsertedCount()
                + ", overwritten=" + getOverwrittenCount()
                + ", unchanged=" + getUnchangedCount()
                + ", skipped=" + getSkippedCount()
                + (cancelled ? ", cancelled" : "")
                + (isHalted() ? ", halted" : "")
                + "}";
    }

    // -----------------------------------------------------------------------
    // INNER CLASS: RowResult
    // -----------------------------------------------------------------------

    /**
     * Outcome of one data row: the 1-based line number in the source, the
     * raw line, the identifier (null when the row was skipped before one
     * could be read), the outcome tag and a human-readable message.
     */
    public static final class RowResult {

        private final int              lineNumber;
        private final String           rawLine;
        private final String           identifier;
        private final ReconcileOutcome outcome;
        private final String           message;

        public RowResult(int lineNumber, String rawLine, String identifier,
                         ReconcileOutcome outcome, String message) {
            this.lineNumber = lineNumber;
            this.rawLine    = rawLine;
            this.identifier = identifier;
            this.outcome    = outcome;
            this.message    = message == null ? "" : message;
        }

        public int getLineNumber()           { return lineNumber; }
        public String getRawLine()           { return rawLine; }
        public String getIdentifier()        { return identifier; }
        public ReconcileOutcome getOutcome() { return outcome; }
        public String getMessage()           { return message; }

        @Override
        public String toString() {
            return "RowResult{line=" + lineNumber
                    + ", outcome=" + outcome
                    + (identifier == null ? "" : ", identifier='" + identifier + "'")
                    + (message.isBlank() ? "" : ", message='" + message + "'")
                    + "}";
        }
    }

    // -----------------------------------------------------------------------
    // INNER CLASS: Builder
    // -----------------------------------------------------------------------

    /**
     * Mutable accumulator used by {@link CsvImporter} while rows are
     * processed.
     */
    public static final class Builder {

        private final Path          sourceFile;
        private final LocalDateTime importedAt;
        private final Map<ReconcileOutcome, Integer> counts = new EnumMap<>(ReconcileOutcome.class);
        private final List<RowResult> rowResults = new ArrayList<>();
        private int     categorisedCount;
        private boolean cancelled;
        private String  haltReason;

        public Builder(Path sourceFile) {
            this.sourceFile = sourceFile;
            this.importedAt = LocalDateTime.now();
        }

        /**
         * Records a reconciled row.
         *
         * @return this builder for chaining
         */
        public Builder addOutcome(int lineNumber, String rawLine,
                                  String identifier, ReconcileOutcome outcome) {
            rowResults.add(new RowResult(lineNumber, rawLine, identifier,
                    outcome, outcome.getDisplayName()));
            counts.merge(outcome, 1, Integer::sum);
            return this;
        }

        /**
         * Records a row the parser rejected.
         *
         * @return this builder for chaining
         */
        public Builder addSkipped(int lineNumber, String rawLine, String reason) {
            rowResults.add(new RowResult(lineNumber, rawLine, null,
                    ReconcileOutcome.SKIPPED, reason));
            counts.merge(ReconcileOutcome.SKIPPED, 1, Integer::sum);
            return this;
        }

        public Builder addCategorised() {
            categorisedCount++;
            return this;
        }

        public Builder markCancelled() {
            cancelled = true;
            return this;
        }

        /**
         * @param reason the store failure that stopped the batch
         * @return this builder for chaining
         */
        public Builder markHalted(String reason) {
            haltReason = reason == null ? "unknown store failure" : reason;
            return this;
        }

        public ImportReport build() {
            return new ImportReport(this);
        }
    }
}
