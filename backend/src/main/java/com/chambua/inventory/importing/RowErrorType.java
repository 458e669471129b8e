package com.chambua.inventory.importing;

public enum RowErrorType {
    ROW_VALIDATION,
    REFERENCE_RESOLUTION
}
