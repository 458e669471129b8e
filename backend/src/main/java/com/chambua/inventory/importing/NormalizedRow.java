package com.chambua.inventory.importing;

import java.math.BigDecimal;

/**
 * A data row after trimming and type coercion. Required fields are plain values; every
 * optional column keeps its presence flag for the update merge.
 */
public record NormalizedRow(
        int row,
        String sku,
        String name,
        BigDecimal sellingPrice,
        FieldValue<String> barcode,
        FieldValue<String> description,
        FieldValue<String> category,
        FieldValue<String> location,
        FieldValue<String> supplier,
        FieldValue<BigDecimal> stock,
        FieldValue<BigDecimal> minStock,
        FieldValue<BigDecimal> costPrice,
        FieldValue<String> unit
) {}
