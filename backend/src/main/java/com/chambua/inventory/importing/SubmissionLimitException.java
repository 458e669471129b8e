package com.chambua.inventory.importing;

public class SubmissionLimitException extends ImportAbortedException {

    public SubmissionLimitException(String message) {
        super(message);
    }

    @Override
    public ImportFailureKind kind() { return ImportFailureKind.LIMIT; }
}
