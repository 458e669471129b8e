package com.chambua.inventory.dto;

import com.chambua.inventory.importing.ImportFailureKind;
import com.chambua.inventory.importing.RowError;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of one import submission. {@code failure} is null unless the whole submission was
 * aborted, in which case both counts are zero and {@code errors} still lists the row errors
 * found before the abort.
 */
public class ImportReportDTO {
    private boolean success;
    @JsonProperty("imported_count")
    private int importedCount;
    @JsonProperty("updated_count")
    private int updatedCount;
    @JsonProperty("total_processed")
    private int totalProcessed;
    private List<RowErrorDTO> errors = new ArrayList<>();
    @JsonProperty("encoding_used")
    private String encodingUsed;
    private String message;
    private ImportFailureKind failure;

    public static ImportReportDTO ok(int created, int updated, List<RowError> errors, String encoding, String message) {
        ImportReportDTO r = new ImportReportDTO();
        r.success = true;
        r.importedCount = created;
        r.updatedCount = updated;
        r.totalProcessed = created + updated;
        r.errors = toDtos(errors);
        r.encodingUsed = encoding;
        r.message = message;
        return r;
    }

    public static ImportReportDTO fail(ImportFailureKind failure, String message, List<RowError> errors, String encoding) {
        ImportReportDTO r = new ImportReportDTO();
        r.success = false;
        r.failure = failure;
        r.message = message;
        r.encodingUsed = encoding;
        r.errors = toDtos(errors);
        return r;
    }

    private static List<RowErrorDTO> toDtos(List<RowError> errors) {
        List<RowErrorDTO> out = new ArrayList<>();
        if (errors != null) errors.forEach(e -> out.add(RowErrorDTO.from(e)));
        return out;
    }

    public boolean isSuccess() { return success; }
    public int getImportedCount() { return importedCount; }
    public int getUpdatedCount() { return updatedCount; }
    public int getTotalProcessed() { return totalProcessed; }
    public List<RowErrorDTO> getErrors() { return errors; }
    public String getEncodingUsed() { return encodingUsed; }
    public String getMessage() { return message; }
    public ImportFailureKind getFailure() { return failure; }

    public void setSuccess(boolean success) { this.success = success; }
    public void setImportedCount(int importedCount) { this.importedCount = importedCount; }
    public void setUpdatedCount(int updatedCount) { this.updatedCount = updatedCount; }
    public void setTotalProcessed(int totalProcessed) { this.totalProcessed = totalProcessed; }
    public void setErrors(List<RowErrorDTO> errors) { this.errors = errors; }
    public void setEncodingUsed(String encodingUsed) { this.encodingUsed = encodingUsed; }
    public void setMessage(String message) { this.message = message; }
    public void setFailure(ImportFailureKind failure) { this.failure = failure; }
}
