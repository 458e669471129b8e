package com.chambua.inventory.importing;

/**
 * A rejected data row. {@code row} is the 1-based position among data rows, header excluded;
 * {@code column} names the offending column or check.
 */
public record RowError(int row, String column, String message, RowErrorType type) {

    public static RowError validation(int row, InventoryColumn column, String message) {
        return new RowError(row, column.header(), message, RowErrorType.ROW_VALIDATION);
    }

    public static RowError reference(int row, InventoryColumn column, String message) {
        return new RowError(row, column.header(), message, RowErrorType.REFERENCE_RESOLUTION);
    }
}
