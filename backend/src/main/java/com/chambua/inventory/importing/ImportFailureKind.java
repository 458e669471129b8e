package com.chambua.inventory.importing;

/** Reasons a whole submission is aborted, as opposed to a single row being rejected. */
public enum ImportFailureKind {
    DECODE,
    SCHEMA,
    LIMIT,
    COMMIT
}
