package com.chambua.inventory.importing;

public class StoreCommitFailureException extends ImportAbortedException {

    public StoreCommitFailureException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ImportFailureKind kind() { return ImportFailureKind.COMMIT; }
}
