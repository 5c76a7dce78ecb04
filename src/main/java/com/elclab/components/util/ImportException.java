package com.elclab.components.util;

/**
 * Thrown when a CSV import cannot complete: the file is unreadable, its
 * header is unusable, or the store failed part-way through.
 *
 * <p>The attached {@link ImportReport} describes every row processed before
 * the failure. Those rows remain applied; there is no whole-batch rollback.
 */
public class ImportException extends Exception {

    private final ImportReport partialReport;

    public ImportException(String message, ImportReport partialReport, Throwable cause) {
        super(message, cause);
        this.partialReport = partialReport;
    }

    /** @return the rows processed before the failure; never null */
    public ImportReport getPartialReport() {
        return partialReport;
    }
}
