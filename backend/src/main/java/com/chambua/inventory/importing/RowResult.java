package com.chambua.inventory.importing;

/** Outcome of one pipeline stage for one row: either a value or the error that rejected it. */
public record RowResult<T>(T value, RowError error) {

    public static <T> RowResult<T> ok(T value) {
        return new RowResult<>(value, null);
    }

    public static <T> RowResult<T> rejected(RowError error) {
        return new RowResult<>(null, error);
    }

    public boolean isOk() { return error == null; }
}
