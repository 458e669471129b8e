package com.chambua.inventory.repository;

import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class InventorySchemaMigrationTest {

    private static String migration() throws IOException {
        ClassPathResource res = new ClassPathResource("db/migration/V1__inventory_schema.sql");
        try (InputStream is = res.getInputStream()) {
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    // SKU matching is exact-case, so the unique keys must not fold case or accents
    @Test
    void skuAndBarcodeUseBinaryCollation() throws IOException {
        String sql = migration();

        assertThat(sql).contains("sku VARCHAR(50) COLLATE utf8mb4_bin NOT NULL");
        assertThat(sql).contains("barcode VARCHAR(50) COLLATE utf8mb4_bin,");
    }

    @Test
    void numericColumnsMatchTheImportLimits() throws IOException {
        String sql = migration();

        assertThat(sql).contains("current_stock DECIMAL(10,3)", "min_stock_level DECIMAL(10,3)",
                "cost_price DECIMAL(10,2)", "selling_price DECIMAL(10,2)");
    }
}
