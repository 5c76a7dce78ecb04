package com.elclab.components.repository;

import com.elclab.components.domain.Component;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;

/**
 * Timestamp conversion shared by the SQLite repositories.
 * Timestamps are stored as TEXT in {@link Component#TIMESTAMP_FORMAT}.
 */
final class StoreTimestamps {

    private static final Logger log = LoggerFactory.getLogger(StoreTimestamps.class);

    private StoreTimestamps() {
    }

    /** @return the current time truncated to the stored precision */
    static LocalDateTime now() {
        return LocalDateTime.now().truncatedTo(ChronoUnit.SECONDS);
    }

    static String format(LocalDateTime dt) {
        return (dt == null ? now() : dt).format(Component.TIMESTAMP_FORMAT);
    }

    /**
     * Parses a stored timestamp, falling back to now() so a single corrupt
     * value does not fail a whole list load.
     */
    static LocalDateTime parse(String value) {
        if (value == null || value.isBlank()) {
            return now();
        }
        try {
            return LocalDateTime.parse(value, Component.TIMESTAMP_FORMAT);
        } catch (DateTimeParseException ex) {
            log.warn("Failed to parse timestamp '{}'; defaulting to now().", value);
            return now();
        }
    }
}
