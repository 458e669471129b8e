package com.chambua.inventory.importing;

import com.chambua.inventory.config.ImportSettings;
import com.chambua.inventory.util.NumberGrammar;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

import static com.chambua.inventory.importing.InventoryColumn.*;

/**
 * Converts one data row into a {@link NormalizedRow}, or rejects it with the first failing
 * check. Required fields are checked in column order SKU, Name, Selling Price.
 */
@Component
public class RowNormalizer {

    static final int MAX_SKU = 50;
    static final int MAX_BARCODE = 50;
    static final int MAX_NAME = 200;
    static final int MAX_UNIT = 20;

    // DECIMAL(10,2) prices, DECIMAL(10,3) quantities
    static final int PRICE_SCALE = 2;
    static final int PRICE_INTEGER_DIGITS = 8;
    static final int QUANTITY_SCALE = 3;
    static final int QUANTITY_INTEGER_DIGITS = 7;

    private final String defaultUnit;

    public RowNormalizer(ImportSettings settings) {
        this.defaultUnit = settings.getDefaultUnit();
    }

    public static boolean isBlank(List<String> cells) {
        for (String c : cells) {
            if (c != null && !c.trim().isEmpty()) return false;
        }
        return true;
    }

    public RowResult<NormalizedRow> normalize(int row, List<String> cells, ColumnLayout layout) {
        String sku = layout.cell(cells, SKU).orElse("");
        if (sku.isEmpty()) return missing(row, SKU);
        String name = layout.cell(cells, NAME).orElse("");
        if (name.isEmpty()) return missing(row, NAME);
        String priceRaw = layout.cell(cells, SELLING_PRICE).orElse("");
        if (priceRaw.isEmpty()) return missing(row, SELLING_PRICE);
        BigDecimal sellingPrice = NumberGrammar.parse(priceRaw)
                .filter(p -> p.signum() > 0 && fits(p, PRICE_INTEGER_DIGITS, PRICE_SCALE))
                .orElse(null);
        if (sellingPrice == null) return invalid(row, SELLING_PRICE, priceRaw);

        if (sku.length() > MAX_SKU) return tooLong(row, SKU, MAX_SKU);
        if (name.length() > MAX_NAME) return tooLong(row, NAME, MAX_NAME);

        FieldValue<String> barcode = text(layout.cell(cells, BARCODE));
        if (barcode.hasValue() && barcode.value().length() > MAX_BARCODE) return tooLong(row, BARCODE, MAX_BARCODE);

        FieldValue<String> stockRaw = layout.cell(cells, STOCK);
        FieldValue<BigDecimal> stock = number(stockRaw, true, QUANTITY_INTEGER_DIGITS, QUANTITY_SCALE);
        if (stock == null) return invalid(row, STOCK, stockRaw.value());

        FieldValue<String> minStockRaw = layout.cell(cells, MIN_STOCK);
        FieldValue<BigDecimal> minStock = number(minStockRaw, true, QUANTITY_INTEGER_DIGITS, QUANTITY_SCALE);
        if (minStock == null) return invalid(row, MIN_STOCK, minStockRaw.value());

        FieldValue<String> costRaw = layout.cell(cells, COST_PRICE);
        FieldValue<BigDecimal> costPrice = number(costRaw, false, PRICE_INTEGER_DIGITS, PRICE_SCALE);
        if (costPrice == null) return invalid(row, COST_PRICE, costRaw.value());

        FieldValue<String> unit = layout.cell(cells, UNIT);
        if (unit.isPresent() && unit.value().isEmpty()) {
            unit = FieldValue.present(defaultUnit);
        } else if (unit.hasValue() && unit.value().length() > MAX_UNIT) {
            return tooLong(row, UNIT, MAX_UNIT);
        }

        return RowResult.ok(new NormalizedRow(
                row,
                sku,
                name,
                sellingPrice,
                barcode,
                text(layout.cell(cells, DESCRIPTION)),
                text(layout.cell(cells, CATEGORY)),
                text(layout.cell(cells, LOCATION)),
                text(layout.cell(cells, SUPPLIER)),
                stock,
                minStock,
                costPrice,
                unit
        ));
    }

    // blank cell of a present column means "clear"
    private static FieldValue<String> text(FieldValue<String> cell) {
        if (cell.isPresent() && cell.value().isEmpty()) return FieldValue.cleared();
        return cell;
    }

    /** Null when the cell is present, non-blank and not a valid number for the column. */
    private static FieldValue<BigDecimal> number(FieldValue<String> cell, boolean allowNegative,
                                                 int integerDigits, int scale) {
        if (!cell.isPresent()) return FieldValue.absent();
        if (cell.value().isEmpty()) return FieldValue.cleared();
        BigDecimal parsed = NumberGrammar.parse(cell.value()).orElse(null);
        if (parsed == null || (!allowNegative && parsed.signum() < 0)) return null;
        if (!fits(parsed, integerDigits, scale)) return null;
        return FieldValue.present(parsed);
    }

    /** True when the value is storable without rounding in a column of the given shape. */
    static boolean fits(BigDecimal value, int integerDigits, int scale) {
        BigDecimal exact;
        try {
            exact = value.setScale(scale, RoundingMode.UNNECESSARY);
        } catch (ArithmeticException tooManyDecimals) {
            return false;
        }
        return exact.precision() - exact.scale() <= integerDigits;
    }

    private static RowResult<NormalizedRow> missing(int row, InventoryColumn column) {
        return RowResult.rejected(RowError.validation(row, column, "Missing or empty " + column.header()));
    }

    private static RowResult<NormalizedRow> invalid(int row, InventoryColumn column, String raw) {
        return RowResult.rejected(RowError.validation(row, column, "Invalid " + column.header() + " '" + raw + "'"));
    }

    private static RowResult<NormalizedRow> tooLong(int row, InventoryColumn column, int max) {
        return RowResult.rejected(RowError.validation(row, column, column.header() + " exceeds " + max + " characters"));
    }
}
