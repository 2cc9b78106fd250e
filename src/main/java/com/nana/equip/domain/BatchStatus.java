package com.nana.equip.domain;

/**
 * BatchStatus: lifecycle of an {@link ImportBatch} ledger row.
 *
 * <p>A batch starts {@code PENDING} and moves exactly once to either
 * {@code PROCESSED} or {@code FAILED}. The lower-case {@code dbValue} is what
 * the {@code equipment_import_batches.status} CHECK constraint accepts.
 */
public enum BatchStatus {

    /** Batch row created, pipeline still running (or aborted mid-way). */
    PENDING("pending"),

    /** Pipeline finished and counts were recorded. */
    PROCESSED("processed"),

    /** Pipeline aborted; see the batch error message. */
    FAILED("failed");

    private final String dbValue;

    BatchStatus(String dbValue) {
        this.dbValue = dbValue;
    }

    /** @return the value persisted in the status column */
    public String getDbValue() {
        return dbValue;
    }

    /**
     * Converts a stored status string back to the enum, ignoring case.
     * Unknown or blank values map to {@code PENDING} so a legacy row never
     * blocks a batch lookup.
     *
     * @param value stored status text
     * @return the matching status, or {@code PENDING}
     */
    public static BatchStatus fromString(String value) {
        if (value == null || value.isBlank()) {
            return PENDING;
        }
        for (BatchStatus s : values()) {
            if (s.dbValue.equalsIgnoreCase(value.trim())) {
                return s;
            }
        }
        return PENDING;
    }

    @Override
    public String toString() {
        return dbValue;
    }
}
