package com.nana.equip.domain;

import java.time.LocalDateTime;

/**
 * ImportBatch: one ledger row per import attempt.
 *
 * <p>Created before the pipeline writes anything else and updated exactly
 * once at the end. Once {@link #getCompletedAt()} is set the row is treated
 * as an immutable audit record.
 */
public class ImportBatch {

    private String        id;
    private String        projectId;
    private String        filename;
    private int           totalRows;
    private int           processedRows;
    private BatchStatus   status = BatchStatus.PENDING;
    private String        errorMessage;
    private String        createdBy;
    private LocalDateTime createdAt;
    private LocalDateTime completedAt;

    public ImportBatch() {
    }

    public ImportBatch(String projectId, String filename, int totalRows, String createdBy) {
        this.projectId = projectId;
        this.filename  = filename;
        this.totalRows = totalRows;
        this.createdBy = createdBy;
    }

    public String getId()                       { return id; }
    public void setId(String id)                { this.id = id; }

    public String getProjectId()                { return projectId; }
    public void setProjectId(String projectId)  { this.projectId = projectId; }

    public String getFilename()                 { return filename; }
    public void setFilename(String filename)    { this.filename = filename; }

    public int getTotalRows()                   { return totalRows; }
    public void setTotalRows(int totalRows)     { this.totalRows = totalRows; }

    public int getProcessedRows()               { return processedRows; }
    public void setProcessedRows(int rows)      { this.processedRows = rows; }

    public BatchStatus getStatus()              { return status; }
    public void setStatus(BatchStatus status)   { this.status = status; }

    public String getErrorMessage()             { return errorMessage; }
    public void setErrorMessage(String message) { this.errorMessage = message; }

    public String getCreatedBy()                { return createdBy; }
    public void setCreatedBy(String createdBy)  { this.createdBy = createdBy; }

    public LocalDateTime getCreatedAt()         { return createdAt; }
    public void setCreatedAt(LocalDateTime t)   { this.createdAt = t; }

    public LocalDateTime getCompletedAt()       { return completedAt; }
    public void setCompletedAt(LocalDateTime t) { this.completedAt = t; }

    /** @return true once the batch has reached a terminal status with a completion time */
    public boolean isCompleted() {
        return completedAt != null && status != BatchStatus.PENDING;
    }

    @Override
    public String toString() {
        return "ImportBatch{id='" + id + '\''
               + ", project='" + projectId + '\''
               + ", file='" + filename + '\''
               + ", total=" + totalRows
               + ", processed=" + processedRows
               + ", status=" + status + '}';
    }
}
