package com.chambua.inventory.repository;

import com.chambua.inventory.importing.CommitResult;
import com.chambua.inventory.importing.ItemMutation;
import com.chambua.inventory.importing.ReferenceSnapshot;
import com.chambua.inventory.model.InventoryItem;

import java.util.List;
import java.util.Set;

/**
 * The persistence operations an import or export needs. Snapshots are read once per
 * submission; {@link #applyAtomically} applies every mutation or none.
 */
public interface InventoryStore {

    ReferenceSnapshot loadReferenceSnapshot();

    /** SKUs of every stored item, active or not. */
    Set<String> loadExistingSkus();

    /**
     * Applies the mutations in order within one transaction.
     *
     * @throws org.springframework.dao.DataAccessException on any store-level failure, after
     *         which nothing has been applied
     */
    CommitResult applyAtomically(List<ItemMutation> mutations, String actor);

    /** Active items ordered by SKU, with location, category and supplier loaded. Null filters match all. */
    List<InventoryItem> findItemsForExport(Long locationId, Long categoryId);
}
