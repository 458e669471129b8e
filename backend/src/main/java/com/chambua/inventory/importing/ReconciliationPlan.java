package com.chambua.inventory.importing;

import java.util.List;

/**
 * Output of reconciliation: the ordered mutation list handed to the committer and the rows
 * the reconciliation itself rejected. {@code superseded} counts rows replaced by a later row
 * with the same SKU.
 */
public record ReconciliationPlan(List<ItemMutation> mutations, List<RowError> rejections, int superseded) {

    public ReconciliationPlan {
        mutations = List.copyOf(mutations);
        rejections = List.copyOf(rejections);
    }

    public long createCount() {
        return mutations.stream().filter(m -> m.kind() == MutationKind.CREATE).count();
    }

    public long updateCount() {
        return mutations.stream().filter(m -> m.kind() == MutationKind.UPDATE).count();
    }
}
