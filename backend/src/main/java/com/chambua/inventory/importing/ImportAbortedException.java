package com.chambua.inventory.importing;

/**
 * Base for top-level import failures. Thrown by a pipeline stage and converted into a
 * failed report by the import service; never used for per-row problems.
 */
public abstract class ImportAbortedException extends RuntimeException {

    protected ImportAbortedException(String message) {
        super(message);
    }

    protected ImportAbortedException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ImportFailureKind kind();
}
