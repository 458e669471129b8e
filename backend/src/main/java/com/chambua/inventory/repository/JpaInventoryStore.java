package com.chambua.inventory.repository;

import com.chambua.inventory.importing.CommitResult;
import com.chambua.inventory.importing.InventoryItemMerger;
import com.chambua.inventory.importing.ItemMutation;
import com.chambua.inventory.importing.MutationKind;
import com.chambua.inventory.importing.ReferenceSnapshot;
import com.chambua.inventory.model.Category;
import com.chambua.inventory.model.InventoryItem;
import com.chambua.inventory.model.Location;
import com.chambua.inventory.model.StockMovement;
import com.chambua.inventory.model.Supplier;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

@Repository
public class JpaInventoryStore implements InventoryStore {

    private final InventoryItemRepository itemRepository;
    private final LocationRepository locationRepository;
    private final CategoryRepository categoryRepository;
    private final SupplierRepository supplierRepository;
    private final StockMovementRepository stockMovementRepository;
    private final InventoryItemMerger merger;

    public JpaInventoryStore(InventoryItemRepository itemRepository,
                             LocationRepository locationRepository,
                             CategoryRepository categoryRepository,
                             SupplierRepository supplierRepository,
                             StockMovementRepository stockMovementRepository,
                             InventoryItemMerger merger) {
        this.itemRepository = itemRepository;
        this.locationRepository = locationRepository;
        this.categoryRepository = categoryRepository;
        this.supplierRepository = supplierRepository;
        this.stockMovementRepository = stockMovementRepository;
        this.merger = merger;
    }

    @Override
    @Transactional(readOnly = true)
    public ReferenceSnapshot loadReferenceSnapshot() {
        return ReferenceSnapshot.of(
                locationRepository.findAllByOrderByIdAsc(),
                categoryRepository.findAllByOrderByIdAsc(),
                supplierRepository.findAllByOrderByIdAsc());
    }

    @Override
    @Transactional(readOnly = true)
    public Set<String> loadExistingSkus() {
        return new HashSet<>(itemRepository.findAllSkus());
    }

    @Override
    @Transactional
    public CommitResult applyAtomically(List<ItemMutation> mutations, String actor) {
        if (mutations.isEmpty()) return CommitResult.none();

        Set<String> updateSkus = mutations.stream()
                .filter(m -> m.kind() == MutationKind.UPDATE)
                .map(ItemMutation::sku)
                .collect(Collectors.toSet());
        Map<String, InventoryItem> existing = itemRepository.findBySkuIn(updateSkus).stream()
                .collect(Collectors.toMap(InventoryItem::getSku, Function.identity()));

        InventoryItemMerger.References refs = new InventoryItemMerger.References() {
            @Override public Location location(Long id) { return locationRepository.getReferenceById(id); }
            @Override public Category category(Long id) { return categoryRepository.getReferenceById(id); }
            @Override public Supplier supplier(Long id) { return supplierRepository.getReferenceById(id); }
        };

        int created = 0, updated = 0;
        for (ItemMutation m : mutations) {
            if (m.kind() == MutationKind.CREATE) {
                InventoryItem item = itemRepository.saveAndFlush(merger.create(m, refs));
                if (item.getCurrentStock().signum() != 0) {
                    stockMovementRepository.save(StockMovement.importCount(item, BigDecimal.ZERO, item.getCurrentStock(), actor));
                }
                created++;
            } else {
                InventoryItem item = existing.get(m.sku());
                if (item == null) {
                    throw new EmptyResultDataAccessException("Item with SKU '" + m.sku() + "' no longer exists", 1);
                }
                BigDecimal before = item.getCurrentStock();
                merger.merge(item, m.source(), refs);
                itemRepository.saveAndFlush(item);
                if (before.compareTo(item.getCurrentStock()) != 0) {
                    stockMovementRepository.save(StockMovement.importCount(item, before, item.getCurrentStock(), actor));
                }
                updated++;
            }
        }
        stockMovementRepository.flush();
        return new CommitResult(created, updated);
    }

    @Override
    @Transactional(readOnly = true)
    public List<InventoryItem> findItemsForExport(Long locationId, Long categoryId) {
        return itemRepository.findActiveForExport(locationId, categoryId);
    }
}
