package com.chambua.inventory.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Caller-imposed ceilings for a single import submission, plus the unit written when a
 * row leaves Unit blank.
 */
@Component
public class ImportSettings {

    private final long maxFileBytes;
    private final int maxRows;
    private final String defaultUnit;

    public ImportSettings(@Value("${inventory.import.max-file-bytes:5242880}") long maxFileBytes,
                          @Value("${inventory.import.max-rows:10000}") int maxRows,
                          @Value("${inventory.import.default-unit:pcs}") String defaultUnit) {
        this.maxFileBytes = maxFileBytes;
        this.maxRows = maxRows;
        this.defaultUnit = defaultUnit;
    }

    public long getMaxFileBytes() { return maxFileBytes; }

    public int getMaxRows() { return maxRows; }

    public String getDefaultUnit() { return defaultUnit; }
}
