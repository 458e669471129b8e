package com.chambua.inventory.importing;

import com.chambua.inventory.model.Category;
import com.chambua.inventory.model.InventoryItem;
import com.chambua.inventory.model.Location;
import com.chambua.inventory.model.Supplier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class InventoryItemMergerTest {

    private final InventoryItemMerger merger = new InventoryItemMerger();

    private Location main;
    private Location branch;
    private Category beverages;
    private Supplier ketepa;
    private InventoryItemMerger.References refs;

    @BeforeEach
    void setup() {
        main = new Location("Main Store", "MS"); main.setId(1L);
        branch = new Location("Branch", "BR"); branch.setId(2L);
        beverages = new Category("Beverages"); beverages.setId(10L);
        ketepa = new Supplier("Ketepa"); ketepa.setId(20L);
        refs = new InventoryItemMerger.References() {
            @Override public Location location(Long id) { return id == 1L ? main : branch; }
            @Override public Category category(Long id) { return beverages; }
            @Override public Supplier supplier(Long id) { return ketepa; }
        };
    }

    private InventoryItem stored() {
        InventoryItem item = new InventoryItem("TEA-1", "Old name", new BigDecimal("90"), main);
        item.setBarcode("111");
        item.setDescription("Old description");
        item.setCategory(beverages);
        item.setSupplier(ketepa);
        item.setCurrentStock(new BigDecimal("40"));
        item.setMinStockLevel(new BigDecimal("5"));
        item.setCostPrice(new BigDecimal("60"));
        item.setUnit("box");
        return item;
    }

    private static NormalizedRow row(FieldValue<String> barcode, FieldValue<BigDecimal> stock, FieldValue<BigDecimal> cost,
                                     FieldValue<String> unit) {
        return new NormalizedRow(1, "TEA-1", "New name", new BigDecimal("120"),
                barcode, FieldValue.absent(), FieldValue.absent(), FieldValue.absent(), FieldValue.absent(),
                stock, FieldValue.absent(), cost, unit);
    }

    @Test
    void absentColumnsLeaveStoredValuesAlone() {
        InventoryItem item = stored();
        ResolvedRow resolved = new ResolvedRow(
                row(FieldValue.absent(), FieldValue.absent(), FieldValue.absent(), FieldValue.absent()),
                FieldValue.absent(), FieldValue.absent(), FieldValue.absent());

        merger.merge(item, resolved, refs);

        assertThat(item.getName()).isEqualTo("New name");
        assertThat(item.getSellingPrice()).isEqualByComparingTo("120");
        assertThat(item.getBarcode()).isEqualTo("111");
        assertThat(item.getDescription()).isEqualTo("Old description");
        assertThat(item.getCategory()).isSameAs(beverages);
        assertThat(item.getSupplier()).isSameAs(ketepa);
        assertThat(item.getLocation()).isSameAs(main);
        assertThat(item.getCurrentStock()).isEqualByComparingTo("40");
        assertThat(item.getCostPrice()).isEqualByComparingTo("60");
        assertThat(item.getUnit()).isEqualTo("box");
    }

    @Test
    void blankCellsClearStoredValues() {
        InventoryItem item = stored();
        ResolvedRow resolved = new ResolvedRow(
                row(FieldValue.cleared(), FieldValue.cleared(), FieldValue.cleared(), FieldValue.present("pcs")),
                FieldValue.absent(), FieldValue.cleared(), FieldValue.cleared());

        merger.merge(item, resolved, refs);

        assertThat(item.getBarcode()).isNull();
        assertThat(item.getCategory()).isNull();
        assertThat(item.getSupplier()).isNull();
        assertThat(item.getCurrentStock()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(item.getCostPrice()).isNull();
        assertThat(item.getUnit()).isEqualTo("pcs");
    }

    @Test
    void presentValuesOverwrite() {
        InventoryItem item = stored();
        ResolvedRow resolved = new ResolvedRow(
                row(FieldValue.present("222"), FieldValue.present(new BigDecimal("7")), FieldValue.present(new BigDecimal("65")),
                        FieldValue.present("kg")),
                FieldValue.present(2L), FieldValue.absent(), FieldValue.absent());

        merger.merge(item, resolved, refs);

        assertThat(item.getBarcode()).isEqualTo("222");
        assertThat(item.getCurrentStock()).isEqualByComparingTo("7");
        assertThat(item.getCostPrice()).isEqualByComparingTo("65");
        assertThat(item.getUnit()).isEqualTo("kg");
        assertThat(item.getLocation()).isSameAs(branch);
    }

    @Test
    void referenceNamingTheCurrentEntityKeepsIt() {
        Location twin = new Location("Main Store", "MS2"); twin.setId(3L);
        InventoryItem item = stored();
        item.setLocation(twin);
        NormalizedRow row = RowFixtures.withReferences(1, "TEA-1", FieldValue.present("main store"),
                FieldValue.present("Beverages"), FieldValue.absent());
        ResolvedRow resolved = new ResolvedRow(row, FieldValue.present(1L), FieldValue.present(10L), FieldValue.absent());

        merger.merge(item, resolved, refs);

        assertThat(item.getLocation()).isSameAs(twin);
        assertThat(item.getCategory()).isSameAs(beverages);
    }

    @Test
    void updateLeavesActiveFlagUntouched() {
        InventoryItem item = stored();
        item.setActive(false);

        merger.merge(item, RowFixtures.resolved(1, "TEA-1", null), refs);

        assertThat(item.isActive()).isFalse();
    }

    @Test
    void createUsesMutationLocationAndDefaults() {
        ItemMutation create = ItemMutation.create(RowFixtures.resolved(1, "NEW-1", null), 2L);

        InventoryItem item = merger.create(create, refs);

        assertThat(item.getSku()).isEqualTo("NEW-1");
        assertThat(item.getLocation()).isSameAs(branch);
        assertThat(item.getCurrentStock()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(item.getUnit()).isEqualTo(InventoryItem.DEFAULT_UNIT);
        assertThat(item.isActive()).isTrue();
    }
}
