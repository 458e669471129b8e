package com.chambua.inventory.dto;

import java.time.Instant;

public class ImportRunSummaryDTO {
    private Long id;
    private String status;
    private String filename;
    private String encodingUsed;
    private Integer rowsProcessed;
    private Integer rowsCreated;
    private Integer rowsUpdated;
    private Integer rowsFailed;
    private String failureKind;
    private String message;
    private String createdBy;
    private Instant startedAt;
    private Instant finishedAt;

    public ImportRunSummaryDTO() {}

    public ImportRunSummaryDTO(Long id, String status, String filename, String encodingUsed, Integer rowsProcessed,
                               Integer rowsCreated, Integer rowsUpdated, Integer rowsFailed, String failureKind,
                               String message, String createdBy, Instant startedAt, Instant finishedAt) {
        this.id = id;
        this.status = status;
        this.filename = filename;
        this.encodingUsed = encodingUsed;
        this.rowsProcessed = rowsProcessed;
        this.rowsCreated = rowsCreated;
        this.rowsUpdated = rowsUpdated;
        this.rowsFailed = rowsFailed;
        this.failureKind = failureKind;
        this.message = message;
        this.createdBy = createdBy;
        this.startedAt = startedAt;
        this.finishedAt = finishedAt;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }
    public String getFilename() { return filename; }
    public void setFilename(String filename) { this.filename = filename; }
    public String getEncodingUsed() { return encodingUsed; }
    public void setEncodingUsed(String encodingUsed) { this.encodingUsed = encodingUsed; }
    public Integer getRowsProcessed() { return rowsProcessed; }
    public void setRowsProcessed(Integer rowsProcessed) { this.rowsProcessed = rowsProcessed; }
    public Integer getRowsCreated() { return rowsCreated; }
    public void setRowsCreated(Integer rowsCreated) { this.rowsCreated = rowsCreated; }
    public Integer getRowsUpdated() { return rowsUpdated; }
    public void setRowsUpdated(Integer rowsUpdated) { this.rowsUpdated = rowsUpdated; }
    public Integer getRowsFailed() { return rowsFailed; }
    public void setRowsFailed(Integer rowsFailed) { this.rowsFailed = rowsFailed; }
    public String getFailureKind() { return failureKind; }
    public void setFailureKind(String failureKind) { this.failureKind = failureKind; }
    public String getMessage() { return message; }
    public void setMessage(String message) { this.message = message; }
    public String getCreatedBy() { return createdBy; }
    public void setCreatedBy(String createdBy) { this.createdBy = createdBy; }
    public Instant getStartedAt() { return startedAt; }
    public void setStartedAt(Instant startedAt) { this.startedAt = startedAt; }
    public Instant getFinishedAt() { return finishedAt; }
    public void setFinishedAt(Instant finishedAt) { this.finishedAt = finishedAt; }
}
