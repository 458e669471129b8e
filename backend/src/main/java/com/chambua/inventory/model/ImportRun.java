package com.chambua.inventory.model;

import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(name = "import_run", indexes = {
        @Index(name = "idx_importrun_filehash", columnList = "file_hash")
})
public class ImportRun {

    public static final String STATUS_COMPLETED = "COMPLETED";
    public static final String STATUS_FAILED = "FAILED";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "file_hash", length = 128, nullable = false)
    private String fileHash;

    @Column(length = 255)
    private String filename;

    @Column(name = "encoding_used", length = 32)
    private String encodingUsed;

    @Column(name = "created_by", length = 50)
    private String createdBy;

    @Column(name = "rows_processed")
    private Integer rowsProcessed = 0;

    @Column(name = "rows_created")
    private Integer rowsCreated = 0;

    @Column(name = "rows_updated")
    private Integer rowsUpdated = 0;

    @Column(name = "rows_failed")
    private Integer rowsFailed = 0;

    @Column(name = "failure_kind", length = 32)
    private String failureKind; // null unless the whole submission was aborted

    @Column(length = 1000)
    private String message;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @Column(length = 32)
    private String status;

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public String getFileHash() { return fileHash; }
    public void setFileHash(String fileHash) { this.fileHash = fileHash; }
    public String getFilename() { return filename; }
    public void setFilename(String filename) { this.filename = filename; }
    public String getEncodingUsed() { return encodingUsed; }
    public void setEncodingUsed(String encodingUsed) { this.encodingUsed = encodingUsed; }
    public String getCreatedBy() { return createdBy; }
    public void setCreatedBy(String createdBy) { this.createdBy = createdBy; }
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
    public Instant getStartedAt() { return startedAt; }
    public void setStartedAt(Instant startedAt) { this.startedAt = startedAt; }
    public Instant getFinishedAt() { return finishedAt; }
    public void setFinishedAt(Instant finishedAt) { this.finishedAt = finishedAt; }
    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }
}
