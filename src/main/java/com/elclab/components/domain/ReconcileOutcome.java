package com.elclab.components.domain;

/**
 * ReconcileOutcome - per-row classification of an import.
 *
 * <p>{@link #INSERTED}, {@link #OVERWRITTEN} and {@link #UNCHANGED} are
 * produced by the reconciliation engine. {@link #SKIPPED} is produced by the
 * parser for rows that never reach the engine.
 */
public enum ReconcileOutcome {

    /** No record with the identifier existed; the candidate was inserted. */
    INSERTED("Inserted"),

    /** An existing record was updated from the candidate. */
    OVERWRITTEN("Overwritten"),

    /** An existing record won; the store was not touched. */
    UNCHANGED("Unchanged"),

    /** The row was malformed and was discarded before reconciliation. */
    SKIPPED("Skipped");

    private final String displayName;

    ReconcileOutcome(String displayName) {
        this.displayName = displayName;
    }

    /**
     * @return human-readable label (e.g., "Overwritten")
     */
    public String getDisplayName() {
        return displayName;
    }

    /**
     * Returns true if this outcome wrote to the store.
     *
     * @return true for INSERTED and OVERWRITTEN
     */
    public boolean isWrite() {
        return this == INSERTED || this == OVERWRITTEN;
    }

    @Override
    public String toString() {
        return name();
    }
}
