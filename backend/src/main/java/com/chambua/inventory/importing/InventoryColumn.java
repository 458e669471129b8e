package com.chambua.inventory.importing;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Recognized CSV columns, declared in the canonical export order.
 */
public enum InventoryColumn {
    SKU("SKU", true),
    BARCODE("Barcode", false),
    NAME("Name", true),
    DESCRIPTION("Description", false),
    CATEGORY("Category", false),
    LOCATION("Location", false),
    SUPPLIER("Supplier", false),
    STOCK("Stock", false),
    MIN_STOCK("Min Stock", false),
    COST_PRICE("Cost Price", false),
    SELLING_PRICE("Selling Price", true),
    UNIT("Unit", false);

    private final String header;
    private final boolean required;

    InventoryColumn(String header, boolean required) {
        this.header = header;
        this.required = required;
    }

    public String header() { return header; }

    public boolean isRequired() { return required; }

    public static List<String> canonicalHeaders() {
        return Arrays.stream(values()).map(InventoryColumn::header).toList();
    }

    public static Optional<InventoryColumn> fromHeader(String raw) {
        String key = normalize(raw);
        for (InventoryColumn c : values()) {
            if (normalize(c.header).equals(key)) return Optional.of(c);
        }
        return Optional.empty();
    }

    static String normalize(String raw) {
        if (raw == null) return "";
        return raw.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }
}
