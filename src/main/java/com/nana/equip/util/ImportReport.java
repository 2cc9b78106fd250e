package com.nana.equip.util;

import com.nana.equip.domain.ImportMode;
import com.nana.equip.service.ImportFormat;
import com.nana.equip.service.LinkRestorationResult;
import com.nana.equip.service.LinkRestorationResult.LinkFailure;
import com.nana.equip.service.SyncOutcome;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * ImportReport: immutable outcome of one equipment import.
 *
 * <p>Carries the counts the caller shows ({@code batchId}, equipment and
 * labor inserted/updated, rooms created), the link restoration summary of a
 * Replace import, and every best-effort failure (aliases, catalog, suppliers).
 * A Replace that restored only some wire drop links is still a successful
 * import; the unrestored links are listed here for manual relinking.
 *
 * <p>Built with {@link Builder} by the import service, then frozen.
 * {@link #toReportText()} renders a plain-text operator report.
 */
public final class ImportReport {

    private static final DateTimeFormatter DISPLAY_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    // -----------------------------------------------------------------------
    // FIELDS
    // -----------------------------------------------------------------------

    private final String                projectId;
    private final String                batchId;
    private final String                filename;
    private final LocalDateTime         importedAt;
    private final ImportFormat          format;
    private final ImportMode            mode;
    private final int                   totalRows;
    private final int                   skippedRows;
    private final int                   equipmentInserted;
    private final int                   equipmentUpdated;
    private final int                   equipmentDeleted;
    private final int                   laborInserted;
    private final int                   laborUpdated;
    private final int                   roomsCreated;
    private final int                   aliasesWritten;
    private final List<String>          aliasFailures;
    private final LinkRestorationResult linkRestoration;
    private final SyncOutcome           syncOutcome;

    private ImportReport(Builder b) {
        this.projectId         = b.projectId;
        this.batchId           = b.batchId;
        this.filename          = b.filename;
        this.importedAt        = b.importedAt != null ? b.importedAt : LocalDateTime.now();
        this.format            = b.format;
        this.mode              = b.mode;
        this.totalRows         = b.totalRows;
        this.skippedRows       = b.skippedRows;
        this.equipmentInserted = b.equipmentInserted;
        this.equipmentUpdated  = b.equipmentUpdated;
        this.equipmentDeleted  = b.equipmentDeleted;
        this.laborInserted     = b.laborInserted;
        this.laborUpdated      = b.laborUpdated;
        this.roomsCreated      = b.roomsCreated;
        this.aliasesWritten    = b.aliasesWritten;
        this.aliasFailures     = List.copyOf(b.aliasFailures);
        this.linkRestoration   = b.linkRestoration;
        this.syncOutcome       = b.syncOutcome != null ? b.syncOutcome : SyncOutcome.empty();
    }

    // -----------------------------------------------------------------------
    // ACCESSORS
    // -----------------------------------------------------------------------

    public String getProjectId()              { return projectId; }
    public String getBatchId()                { return batchId; }
    public String getFilename()               { return filename; }
    public LocalDateTime getImportedAt()      { return importedAt; }
    public ImportFormat getFormat()           { return format; }
    public ImportMode getMode()               { return mode; }
    public int getTotalRows()                 { return totalRows; }
    public int getSkippedRows()               { return skippedRows; }
    public int getEquipmentInserted()         { return equipmentInserted; }
    public int getEquipmentUpdated()          { return equipmentUpdated; }
    public int getEquipmentDeleted()          { return equipmentDeleted; }
    public int getLaborInserted()             { return laborInserted; }
    public int getLaborUpdated()              { return laborUpdated; }
    public int getRoomsCreated()              { return roomsCreated; }
    public int getAliasesWritten()            { return aliasesWritten; }
    public List<String> getAliasFailures()    { return aliasFailures; }
    public SyncOutcome getSyncOutcome()       { return syncOutcome; }

    /** @return the restoration summary; null unless the import ran in Replace mode */
    public LinkRestorationResult getLinkRestoration() { return linkRestoration; }

    /** @return equipment plus labor rows inserted or updated */
    public int getProcessedRows() {
        return equipmentInserted + equipmentUpdated + laborInserted + laborUpdated;
    }

    /**
     * @return true if any best-effort step failed or any wire drop link
     *         could not be restored
     */
    public boolean hasWarnings() {
        return !aliasFailures.isEmpty()
               || syncOutcome.hasFailures()
               || (linkRestoration != null && linkRestoration.getFailed() > 0);
    }

    public String getSummary() {
        String summary = String.format(
                "Equipment: %d inserted, %d updated. Labor: %d inserted, %d updated. Rooms created: %d.",
                equipmentInserted, equipmentUpdated, laborInserted, laborUpdated, roomsCreated);
        if (linkRestoration != null && linkRestoration.wasAttempted()) {
            summary += String.format(" Links restored: %d, failed: %d.",
                    linkRestoration.getRestored(), linkRestoration.getFailed());
        }
        return summary;
    }

    // -----------------------------------------------------------------------
    // REPORT TEXT GENERATION
    // -----------------------------------------------------------------------

    /**
     * Renders the report for operators:
     * <pre>
     * ============================================================
     *  Equipment Import Report
     * ============================================================
     *  Batch         : 6f1c...
     *  Source File   : proposal.csv
     *  ...
     * ------------------------------------------------------------
     *  UNRESTORED WIRE DROP LINKS:
     *  WD-12 | SPK-X / Speaker X | no longer in proposal
     * ============================================================
     * </pre>
     *
     * @return the multi-line report
     */
    public String toReportText() {
        StringBuilder sb = new StringBuilder();
        String line60  = "=".repeat(60);
        String line60d = "-".repeat(60);

        sb.append(line60).append("\n");
        sb.append(" Equipment Import Report\n");
        sb.append(line60).append("\n");
        sb.append(String.format(" %-18s: %s%n", "Batch", batchId));
        sb.append(String.format(" %-18s: %s%n", "Project", projectId));
        sb.append(String.format(" %-18s: %s%n", "Source File", filename != null ? filename : "Unknown"));
        sb.append(String.format(" %-18s: %s%n", "Imported At", importedAt.format(DISPLAY_FORMAT)));
        sb.append(String.format(" %-18s: %s%n", "Format", format));
        sb.append(String.format(" %-18s: %s%n", "Mode", mode));
        sb.append(String.format(" %-18s: %d%n", "Rows In File", totalRows));
        sb.append(String.format(" %-18s: %d%n", "Rows Skipped", skippedRows));
        sb.append(String.format(" %-18s: %d%n", "Equipment Inserted", equipmentInserted));
        sb.append(String.format(" %-18s: %d%n", "Equipment Updated", equipmentUpdated));
        sb.append(String.format(" %-18s: %d%n", "Labor Inserted", laborInserted));
        sb.append(String.format(" %-18s: %d%n", "Labor Updated", laborUpdated));
        sb.append(String.format(" %-18s: %d%n", "Rooms Created", roomsCreated));
        sb.append(line60d).append("\n");

        if (linkRestoration != null) {
            if (linkRestoration.wasAttempted()) {
                sb.append(String.format(" Wire drop links restored: %d, failed: %d%n",
                        linkRestoration.getRestored(), linkRestoration.getFailed()));
                if (linkRestoration.getFailed() > 0) {
                    sb.append(" UNRESTORED WIRE DROP LINKS:\n");
                    for (LinkFailure failure : linkRestoration.getFailures()) {
                        sb.append(String.format(" %s | %s / %s | %s%n",
                                failure.getWireDropId(),
                                failure.getOldPartNumber(),
                                failure.getOldName(),
                                failure.getReason()));
                    }
                }
            } else {
                sb.append(String.format(" Wire drop link restoration skipped; %d link(s) captured.%n",
                        linkRestoration.getPendingSnapshots().size()));
            }
            sb.append(line60d).append("\n");
        }

        List<String> warnings = new ArrayList<>();
        aliasFailures.forEach(f -> warnings.add("room alias: " + f));
        syncOutcome.getCatalogFailures().forEach(f -> warnings.add("catalog: " + f));
        syncOutcome.getSupplierFailures().forEach(f -> warnings.add("supplier: " + f));
        if (warnings.isEmpty()) {
            sb.append(" No sync warnings.\n");
        } else {
            sb.append(" SYNC WARNINGS:\n");
            warnings.forEach(w -> sb.append(" ").append(w).append("\n"));
        }

        sb.append(line60).append("\n");
        return sb.toString();
    }

    @Override
    public String toString() {
        return "ImportReport{batch=" + batchId
               + ", equipment=" + equipmentInserted + "/" + equipmentUpdated
               + ", labor=" + laborInserted + "/" + laborUpdated
               + ", rooms=" + roomsCreated
               + (linkRestoration != null ? ", links=" + linkRestoration : "") + "}";
    }

    // -----------------------------------------------------------------------
    // INNER CLASS: Builder
    // -----------------------------------------------------------------------

    public static final class Builder {

        private String                projectId;
        private String                batchId;
        private String                filename;
        private LocalDateTime         importedAt;
        private ImportFormat          format = ImportFormat.STANDARD;
        private ImportMode            mode   = ImportMode.REPLACE;
        private int                   totalRows;
        private int                   skippedRows;
        private int                   equipmentInserted;
        private int                   equipmentUpdated;
        private int                   equipmentDeleted;
        private int                   laborInserted;
        private int                   laborUpdated;
        private int                   roomsCreated;
        private int                   aliasesWritten;
        private final List<String>    aliasFailures = new ArrayList<>();
        private LinkRestorationResult linkRestoration;
        private SyncOutcome           syncOutcome;

        public Builder(String projectId, String batchId) {
            this.projectId = projectId;
            this.batchId   = batchId;
        }

        public Builder filename(String filename)          { this.filename = filename; return this; }
        public Builder importedAt(LocalDateTime at)       { this.importedAt = at; return this; }
        public Builder format(ImportFormat format)        { this.format = format; return this; }
        public Builder mode(ImportMode mode)              { this.mode = mode; return this; }
        public Builder totalRows(int rows)                { this.totalRows = rows; return this; }
        public Builder skippedRows(int rows)              { this.skippedRows = rows; return this; }
        public Builder equipmentInserted(int count)       { this.equipmentInserted = count; return this; }
        public Builder equipmentUpdated(int count)        { this.equipmentUpdated = count; return this; }
        public Builder equipmentDeleted(int count)        { this.equipmentDeleted = count; return this; }
        public Builder laborInserted(int count)           { this.laborInserted = count; return this; }
        public Builder laborUpdated(int count)            { this.laborUpdated = count; return this; }
        public Builder roomsCreated(int count)            { this.roomsCreated = count; return this; }
        public Builder aliasesWritten(int count)          { this.aliasesWritten = count; return this; }
        public Builder aliasFailures(List<String> f)      { this.aliasFailures.addAll(f); return this; }
        public Builder linkRestoration(LinkRestorationResult r) { this.linkRestoration = r; return this; }
        public Builder syncOutcome(SyncOutcome outcome)   { this.syncOutcome = outcome; return this; }

        public ImportReport build() {
            return new ImportReport(this);
        }
    }
}
