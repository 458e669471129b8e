package com.chambua.inventory.importing;

import java.util.List;

/**
 * Decoded CSV content: the header row followed by data rows, plus the label of the
 * encoding that decoded it.
 */
public record DecodedTable(List<List<String>> rows, String encoding) {

    public DecodedTable {
        rows = rows.stream().map(List::copyOf).toList();
    }

    public boolean isEmpty() { return rows.isEmpty(); }

    public List<String> header() {
        return rows.isEmpty() ? List.of() : rows.get(0);
    }

    public List<List<String>> dataRows() {
        return rows.isEmpty() ? List.of() : rows.subList(1, rows.size());
    }
}
