package com.chambua.inventory.importing;

import java.util.List;

public class SchemaFailureException extends ImportAbortedException {

    private final List<String> missingColumns;

    public SchemaFailureException(List<String> missingColumns) {
        super("Missing required columns: " + String.join(", ", missingColumns));
        this.missingColumns = List.copyOf(missingColumns);
    }

    public SchemaFailureException(String message) {
        super(message);
        this.missingColumns = List.of();
    }

    public List<String> getMissingColumns() { return missingColumns; }

    @Override
    public ImportFailureKind kind() { return ImportFailureKind.SCHEMA; }
}
