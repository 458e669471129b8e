package com.chambua.inventory.importing;

import java.util.Objects;

/**
 * An optional column's value that remembers whether the column was in the file at all.
 * <ul>
 *   <li>absent: the column was not in the header, the stored value must be left alone</li>
 *   <li>present with a null value: the cell was blank, the stored value is cleared</li>
 *   <li>present with a value: the stored value is overwritten</li>
 * </ul>
 */
public final class FieldValue<T> {

    private static final FieldValue<?> ABSENT = new FieldValue<>(false, null);

    private final boolean present;
    private final T value;

    private FieldValue(boolean present, T value) {
        this.present = present;
        this.value = value;
    }

    @SuppressWarnings("unchecked")
    public static <T> FieldValue<T> absent() {
        return (FieldValue<T>) ABSENT;
    }

    public static <T> FieldValue<T> present(T value) {
        return new FieldValue<>(true, value);
    }

    public static <T> FieldValue<T> cleared() {
        return new FieldValue<>(true, null);
    }

    public boolean isPresent() { return present; }

    public boolean isCleared() { return present && value == null; }

    public boolean hasValue() { return value != null; }

    /** The value, or null when absent or cleared. */
    public T value() { return value; }

    public T orElse(T fallback) {
        return value != null ? value : fallback;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldValue)) return false;
        FieldValue<?> other = (FieldValue<?>) o;
        return present == other.present && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(present, value);
    }

    @Override
    public String toString() {
        if (!present) return "absent";
        return value == null ? "cleared" : "present(" + value + ")";
    }
}
