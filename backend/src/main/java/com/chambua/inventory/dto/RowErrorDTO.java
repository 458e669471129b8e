package com.chambua.inventory.dto;

import com.chambua.inventory.importing.RowError;

public class RowErrorDTO {
    private int row;
    private String column;
    private String message;
    private String type;

    public RowErrorDTO() {}

    public RowErrorDTO(int row, String column, String message, String type) {
        this.row = row;
        this.column = column;
        this.message = message;
        this.type = type;
    }

    public static RowErrorDTO from(RowError e) {
        return new RowErrorDTO(e.row(), e.column(), e.message(), e.type().name());
    }

    public int getRow() { return row; }
    public void setRow(int row) { this.row = row; }
    public String getColumn() { return column; }
    public void setColumn(String column) { this.column = column; }
    public String getMessage() { return message; }
    public void setMessage(String message) { this.message = message; }
    public String getType() { return type; }
    public void setType(String type) { this.type = type; }
}
