package com.chambua.inventory.importing;

import java.util.List;

public class DecodeFailureException extends ImportAbortedException {

    private final List<String> attemptedEncodings;

    public DecodeFailureException(List<String> attemptedEncodings) {
        super("Could not decode file. Tried encodings: " + String.join(", ", attemptedEncodings));
        this.attemptedEncodings = List.copyOf(attemptedEncodings);
    }

    public DecodeFailureException(String encoding, Throwable cause) {
        super("File is not valid CSV (" + encoding + "): " + cause.getMessage(), cause);
        this.attemptedEncodings = List.of(encoding);
    }

    public List<String> getAttemptedEncodings() { return attemptedEncodings; }

    @Override
    public ImportFailureKind kind() { return ImportFailureKind.DECODE; }
}
