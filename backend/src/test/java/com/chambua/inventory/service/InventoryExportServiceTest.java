package com.chambua.inventory.service;

import com.chambua.inventory.auth.CallerContext;
import com.chambua.inventory.auth.PermissionDeniedException;
import com.chambua.inventory.model.Category;
import com.chambua.inventory.model.InventoryItem;
import com.chambua.inventory.model.Location;
import com.chambua.inventory.model.UserRole;
import com.chambua.inventory.repository.InventoryStore;
import com.chambua.inventory.service.InventoryExportService.ExportFile;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class InventoryExportServiceTest {

    private static final String HEADER =
            "SKU,Barcode,Name,Description,Category,Location,Supplier,Stock,Min Stock,Cost Price,Selling Price,Unit";

    @Mock private InventoryStore store;

    private static InventoryItem item() {
        Location main = new Location("Main Store", "MS");
        InventoryItem item = new InventoryItem("TEA-1", "Tea, loose", new BigDecimal("1250.50"), main);
        item.setCategory(new Category("Beverages"));
        item.setCurrentStock(new BigDecimal("1200.000"));
        item.setCostPrice(new BigDecimal("900.00"));
        return item;
    }

    @Test
    void writesCanonicalColumnsWithPlainNumbers() {
        CallerContext viewer = new CallerContext("val", UserRole.VIEWER, null);
        given(store.findItemsForExport(null, null)).willReturn(List.of(item()));

        ExportFile file = new InventoryExportService(store).export(viewer, null, null);

        String[] lines = new String(file.content(), StandardCharsets.UTF_8).split("\r\n");
        assertThat(lines[0]).isEqualTo(HEADER);
        assertThat(lines[1]).isEqualTo("TEA-1,,\"Tea, loose\",,Beverages,Main Store,,1200,,900,1250.5,pcs");
        assertThat(file.filename()).matches("inventory_export_\\d{8}\\.csv");
    }

    @Test
    void defaultsScopeToCallerLocation() {
        CallerContext manager = new CallerContext("mary", UserRole.MANAGER, 3L);
        given(store.findItemsForExport(3L, 7L)).willReturn(List.of());

        new InventoryExportService(store).export(manager, null, 7L);

        verify(store).findItemsForExport(3L, 7L);
    }

    @Test
    void explicitLocationOverridesCallerLocation() {
        CallerContext manager = new CallerContext("mary", UserRole.MANAGER, 3L);
        given(store.findItemsForExport(5L, null)).willReturn(List.of());

        ExportFile file = new InventoryExportService(store).export(manager, 5L, null);

        assertThat(new String(file.content(), StandardCharsets.UTF_8)).isEqualTo(HEADER + "\r\n");
    }

    @Test
    void exportNeedsViewReports() {
        CallerContext clerk = new CallerContext("ian", UserRole.INVENTORY, 1L);

        assertThatThrownBy(() -> new InventoryExportService(store).export(clerk, null, null))
                .isInstanceOf(PermissionDeniedException.class)
                .hasMessageContaining("view_reports");
        verifyNoInteractions(store);
    }

    @Test
    void templateHasHeaderAndOneExampleRow() {
        ExportFile file = new InventoryExportService(store).template();

        String[] lines = new String(file.content(), StandardCharsets.UTF_8).split("\r\n");
        assertThat(lines).hasSize(2);
        assertThat(lines[0]).isEqualTo(HEADER);
        assertThat(lines[1]).isEqualTo(
                "SKU-001,1234567890123,Sample Product,Sample description,General,Main Store,Sample Supplier,100,10,500,1000,pcs");
        assertThat(file.filename()).isEqualTo("inventory_template.csv");
    }
}
