package com.chambua.inventory.dto;

public class ImportErrorDTO {
    private Long id;
    private Integer rowNumber;
    private String columnName;
    private String errorType;
    private String errorMessage;

    public ImportErrorDTO() {}

    public ImportErrorDTO(Long id, Integer rowNumber, String columnName, String errorType, String errorMessage) {
        this.id = id;
        this.rowNumber = rowNumber;
        this.columnName = columnName;
        this.errorType = errorType;
        this.errorMessage = errorMessage;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public Integer getRowNumber() { return rowNumber; }
    public void setRowNumber(Integer rowNumber) { this.rowNumber = rowNumber; }
    public String getColumnName() { return columnName; }
    public void setColumnName(String columnName) { this.columnName = columnName; }
    public String getErrorType() { return errorType; }
    public void setErrorType(String errorType) { this.errorType = errorType; }
    public String getErrorMessage() { return errorMessage; }
    public void setErrorMessage(String errorMessage) { this.errorMessage = errorMessage; }
}
