package com.chambua.inventory.service;

import com.chambua.inventory.auth.CallerContext;
import com.chambua.inventory.auth.Permission;
import com.chambua.inventory.importing.InventoryColumn;
import com.chambua.inventory.model.InventoryItem;
import com.chambua.inventory.repository.InventoryStore;
import com.chambua.inventory.util.NumberGrammar;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Writes inventory in the import column layout. Numbers use the plain form the importer
 * reads back, without thousands separators.
 */
@Service
public class InventoryExportService {

    private static final Logger log = LoggerFactory.getLogger(InventoryExportService.class);

    public static final String TEMPLATE_FILENAME = "inventory_template.csv";

    static final List<String> TEMPLATE_EXAMPLE = List.of(
            "SKU-001", "1234567890123", "Sample Product", "Sample description", "General",
            "Main Store", "Sample Supplier", "100", "10", "500", "1000", "pcs");

    public record ExportFile(byte[] content, String filename) {}

    private final InventoryStore store;

    public InventoryExportService(InventoryStore store) {
        this.store = store;
    }

    /**
     * Active items, ordered by SKU. Without an explicit location filter the caller's own
     * location scopes the export; a caller with no location sees every location.
     */
    public ExportFile export(CallerContext caller, Long locationId, Long categoryId) {
        caller.require(Permission.VIEW_REPORTS);
        Long scope = locationId != null ? locationId : caller.defaultLocationId();
        List<InventoryItem> items = store.findItemsForExport(scope, categoryId);
        byte[] content = write(items.stream().map(InventoryExportService::toRow).toList());
        log.info("Exported {} items for {} (location={}, category={})", items.size(), caller.username(), scope, categoryId);
        String filename = "inventory_export_" + LocalDate.now().format(DateTimeFormatter.BASIC_ISO_DATE) + ".csv";
        return new ExportFile(content, filename);
    }

    public ExportFile template() {
        return new ExportFile(write(List.of(TEMPLATE_EXAMPLE)), TEMPLATE_FILENAME);
    }

    static List<String> toRow(InventoryItem item) {
        return List.of(
                item.getSku(),
                nz(item.getBarcode()),
                item.getName(),
                nz(item.getDescription()),
                item.getCategory() != null ? nz(item.getCategory().getName()) : "",
                item.getLocation() != null ? nz(item.getLocation().getName()) : "",
                item.getSupplier() != null ? nz(item.getSupplier().getName()) : "",
                NumberGrammar.format(item.getCurrentStock()),
                NumberGrammar.format(item.getMinStockLevel()),
                NumberGrammar.format(item.getCostPrice()),
                NumberGrammar.format(item.getSellingPrice()),
                nz(item.getUnit()));
    }

    private static byte[] write(List<List<String>> rows) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(writer, CSVFormat.DEFAULT)) {
            printer.printRecord(InventoryColumn.canonicalHeaders());
            for (List<String> row : rows) {
                printer.printRecord(row);
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toByteArray();
    }

    private static String nz(String s) {
        return s == null ? "" : s;
    }
}
