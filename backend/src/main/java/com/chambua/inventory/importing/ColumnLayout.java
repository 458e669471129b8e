package com.chambua.inventory.importing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Position of each recognized column in the uploaded header. Built once per submission;
 * unrecognized headers are ignored.
 */
public final class ColumnLayout {

    private static final Logger log = LoggerFactory.getLogger(ColumnLayout.class);

    private final Map<InventoryColumn, Integer> positions;

    private ColumnLayout(Map<InventoryColumn, Integer> positions) {
        this.positions = Collections.unmodifiableMap(positions);
    }

    /**
     * @throws SchemaFailureException when the header is missing or lacks a required column
     */
    public static ColumnLayout fromHeader(List<String> header) {
        if (header == null || header.isEmpty() || header.stream().allMatch(h -> h == null || h.isBlank())) {
            throw new SchemaFailureException("File is empty or has no header row");
        }
        Map<InventoryColumn, Integer> positions = new EnumMap<>(InventoryColumn.class);
        for (int i = 0; i < header.size(); i++) {
            Optional<InventoryColumn> column = InventoryColumn.fromHeader(header.get(i));
            if (column.isEmpty()) continue;
            Integer previous = positions.putIfAbsent(column.get(), i);
            if (previous != null) {
                log.warn("Duplicate column '{}' at position {} ignored; using position {}", header.get(i), i, previous);
            }
        }
        List<String> missing = new ArrayList<>();
        for (InventoryColumn c : InventoryColumn.values()) {
            if (c.isRequired() && !positions.containsKey(c)) missing.add(c.header());
        }
        if (!missing.isEmpty()) {
            throw new SchemaFailureException(missing);
        }
        return new ColumnLayout(positions);
    }

    public boolean has(InventoryColumn column) {
        return positions.containsKey(column);
    }

    /**
     * Trimmed cell text, absent when the column is not in the header. A row shorter than the
     * header yields an empty (present) value.
     */
    public FieldValue<String> cell(List<String> row, InventoryColumn column) {
        Integer idx = positions.get(column);
        if (idx == null) return FieldValue.absent();
        String raw = idx < row.size() ? row.get(idx) : null;
        return FieldValue.present(raw == null ? "" : raw.trim());
    }
}
