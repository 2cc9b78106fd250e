package com.nana.equip.service;

import com.nana.equip.util.ImportReport;

import java.nio.file.Path;

/**
 * Entry point of the equipment import pipeline:
 * format detection, row normalization, room resolution, record building,
 * link capture (Replace only), reconciliation, link restoration, catalog and
 * supplier sync, and the batch ledger update.
 *
 * <p>Imports against the same project must be serialized by the caller.
 */
public interface EquipmentImportService {

    /**
     * Imports one spreadsheet into a project.
     *
     * @param projectId the target project, not blank
     * @param file      a CSV or Excel file
     * @param options   mode, acting user and relink behaviour
     * @return counts, link restoration summary and best-effort failures
     * @throws ImportException if the request is invalid, the file is empty or
     *                         unreadable, or a core write fails
     */
    ImportReport importFile(String projectId, Path file, ImportOptions options) throws ImportException;

    /** Imports with {@link ImportOptions#defaults()}. */
    default ImportReport importFile(String projectId, Path file) throws ImportException {
        return importFile(projectId, file, ImportOptions.defaults());
    }
}
