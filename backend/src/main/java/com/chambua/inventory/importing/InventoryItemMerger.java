package com.chambua.inventory.importing;

import com.chambua.inventory.model.Category;
import com.chambua.inventory.model.InventoryItem;
import com.chambua.inventory.model.Location;
import com.chambua.inventory.model.Supplier;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Writes a reconciled row onto an entity. Name and selling price always overwrite. An optional
 * field overwrites when its column was in the file, with a blank cell clearing it (stock goes
 * back to zero); a column missing from the file leaves the stored value untouched. A reference
 * cell naming the entity the item already points at keeps that entity, so locations sharing a
 * name do not swap items.
 */
@Component
public class InventoryItemMerger {

    /** Entity lookup by id, typically lazy references from the persistence context. */
    public interface References {
        Location location(Long id);
        Category category(Long id);
        Supplier supplier(Long id);
    }

    public InventoryItem create(ItemMutation mutation, References refs) {
        NormalizedRow row = mutation.source().row();
        InventoryItem item = new InventoryItem(row.sku(), row.name(), row.sellingPrice(),
                refs.location(mutation.locationId()));
        applyOptional(item, mutation.source(), refs);
        return item;
    }

    public void merge(InventoryItem item, ResolvedRow resolved, References refs) {
        NormalizedRow row = resolved.row();
        item.setName(row.name());
        item.setSellingPrice(row.sellingPrice());
        if (resolved.locationId().hasValue()
                && !names(item.getLocation() == null ? null : item.getLocation().getName(), row.location())) {
            item.setLocation(refs.location(resolved.locationId().value()));
        }
        applyOptional(item, resolved, refs);
    }

    private static void applyOptional(InventoryItem item, ResolvedRow resolved, References refs) {
        NormalizedRow row = resolved.row();
        if (row.barcode().isPresent()) item.setBarcode(row.barcode().value());
        if (row.description().isPresent()) item.setDescription(row.description().value());
        if (resolved.categoryId().isPresent()
                && !names(item.getCategory() == null ? null : item.getCategory().getName(), row.category())) {
            item.setCategory(resolved.categoryId().hasValue() ? refs.category(resolved.categoryId().value()) : null);
        }
        if (resolved.supplierId().isPresent()
                && !names(item.getSupplier() == null ? null : item.getSupplier().getName(), row.supplier())) {
            item.setSupplier(resolved.supplierId().hasValue() ? refs.supplier(resolved.supplierId().value()) : null);
        }
        if (row.stock().isPresent()) item.setCurrentStock(row.stock().orElse(BigDecimal.ZERO));
        if (row.minStock().isPresent()) item.setMinStockLevel(row.minStock().value());
        if (row.costPrice().isPresent()) item.setCostPrice(row.costPrice().value());
        if (row.unit().hasValue()) item.setUnit(row.unit().value());
    }

    private static boolean names(String current, FieldValue<String> cell) {
        return current != null && cell.hasValue() && current.trim().equalsIgnoreCase(cell.value().trim());
    }
}
