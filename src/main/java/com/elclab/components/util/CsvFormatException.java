package com.elclab.components.util;

/**
 * Thrown when a CSV source cannot be interpreted at all, for example when
 * the header row is missing or lacks a required column. Problems with
 * individual data rows never raise this; they become skipped rows.
 */
public class CsvFormatException extends RuntimeException {

    public CsvFormatException(String message) {
        super(message);
    }
}
