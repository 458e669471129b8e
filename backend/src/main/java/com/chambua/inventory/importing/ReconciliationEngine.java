package com.chambua.inventory.importing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Classifies resolved rows as creates or updates against the SKU snapshot. When a SKU occurs
 * more than once the last occurrence in file order is the only one applied; earlier ones are
 * dropped without an error.
 */
@Component
public class ReconciliationEngine {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationEngine.class);

    public ReconciliationPlan reconcile(List<ResolvedRow> rows, Set<String> existingSkus, Long defaultLocationId) {
        Map<String, Integer> lastIndex = new HashMap<>();
        for (int i = 0; i < rows.size(); i++) {
            lastIndex.put(rows.get(i).sku(), i);
        }

        List<ItemMutation> mutations = new ArrayList<>();
        List<RowError> rejections = new ArrayList<>();
        int superseded = 0;
        for (int i = 0; i < rows.size(); i++) {
            ResolvedRow r = rows.get(i);
            if (lastIndex.get(r.sku()) != i) {
                superseded++;
                log.debug("Row {} superseded by row {} for SKU {}", r.rowNumber(),
                        rows.get(lastIndex.get(r.sku())).rowNumber(), r.sku());
                continue;
            }
            if (existingSkus.contains(r.sku())) {
                mutations.add(ItemMutation.update(r));
                log.debug("Row {} updates SKU {}", r.rowNumber(), r.sku());
                continue;
            }
            Long locationId = r.locationId().orElse(defaultLocationId);
            if (locationId == null) {
                rejections.add(RowError.reference(r.rowNumber(), InventoryColumn.LOCATION,
                        "No location given and user has no default location"));
                continue;
            }
            mutations.add(ItemMutation.create(r, locationId));
            log.debug("Row {} creates SKU {}", r.rowNumber(), r.sku());
        }
        return new ReconciliationPlan(mutations, rejections, superseded);
    }
}
