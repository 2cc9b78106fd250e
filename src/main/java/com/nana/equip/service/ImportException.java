package com.nana.equip.service;

/**
 * ImportException: checked exception for an import that had to stop.
 *
 * <p>Thrown for the conditions an operator must act on: a bad request, a
 * file that yields no rows or cannot be read, or a failed write to the
 * equipment or labor tables. Best-effort steps (aliases, catalog and
 * supplier sync, link restoration) never raise it; their failures are in
 * the {@link com.nana.equip.util.ImportReport}.
 */
public class ImportException extends Exception {

    /** Why the import stopped. */
    public enum Reason {
        /** Missing project id or file, or a file that is not a regular readable file. */
        INVALID_REQUEST,
        /** The file parsed to zero data rows. */
        EMPTY_FILE,
        /** The file could not be read or parsed. */
        READ_FAILURE,
        /** A write to the record store failed. */
        STORE_FAILURE
    }

    private final Reason reason;
    private final String batchId;

    public ImportException(Reason reason, String message) {
        this(reason, message, null, null);
    }

    public ImportException(Reason reason, String message, String batchId, Throwable cause) {
        super(message, cause);
        this.reason  = reason;
        this.batchId = batchId;
    }

    public Reason getReason() {
        return reason;
    }

    /** @return the batch recorded for the attempt, or null if none was created */
    public String getBatchId() {
        return batchId;
    }
}
