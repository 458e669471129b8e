package com.chambua.inventory.importing;

/**
 * A normalized row with its reference names replaced by entity ids. Each id keeps the
 * presence semantics of the source column: absent leaves the stored association alone,
 * cleared removes it.
 */
public record ResolvedRow(
        NormalizedRow row,
        FieldValue<Long> locationId,
        FieldValue<Long> categoryId,
        FieldValue<Long> supplierId
) {
    public String sku() { return row.sku(); }

    public int rowNumber() { return row.row(); }
}
