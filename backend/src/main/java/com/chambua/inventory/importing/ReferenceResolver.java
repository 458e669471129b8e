package com.chambua.inventory.importing;

import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.function.Function;

import static com.chambua.inventory.importing.InventoryColumn.*;

/**
 * Maps location, category and supplier names to ids. A blank location falls back to the
 * caller's default location; blank category or supplier leaves the association unset.
 */
@Component
public class ReferenceResolver {

    public RowResult<ResolvedRow> resolve(NormalizedRow row, ReferenceSnapshot snapshot, Long defaultLocationId) {
        FieldValue<Long> locationId;
        FieldValue<String> location = row.location();
        if (location.hasValue()) {
            Optional<Long> id = snapshot.location(location.value());
            if (id.isEmpty()) return notFound(row, LOCATION, location.value());
            locationId = FieldValue.present(id.get());
        } else if (location.isCleared()) {
            if (defaultLocationId == null) {
                return RowResult.rejected(RowError.reference(row.row(), LOCATION,
                        "No location given and user has no default location"));
            }
            locationId = FieldValue.present(defaultLocationId);
        } else {
            // column not in file: creates fall back to the default during reconciliation
            locationId = FieldValue.absent();
        }

        FieldValue<Long> categoryId = optional(row.category(), snapshot::category);
        if (categoryId == null) return notFound(row, CATEGORY, row.category().value());

        FieldValue<Long> supplierId = optional(row.supplier(), snapshot::supplier);
        if (supplierId == null) return notFound(row, SUPPLIER, row.supplier().value());

        return RowResult.ok(new ResolvedRow(row, locationId, categoryId, supplierId));
    }

    /** Null when a name is given but matches nothing. */
    private static FieldValue<Long> optional(FieldValue<String> name, Function<String, Optional<Long>> lookup) {
        if (!name.hasValue()) return name.isPresent() ? FieldValue.cleared() : FieldValue.absent();
        return lookup.apply(name.value()).map(FieldValue::present).orElse(null);
    }

    private static RowResult<ResolvedRow> notFound(NormalizedRow row, InventoryColumn column, String name) {
        return RowResult.rejected(RowError.reference(row.row(), column,
                column.header() + " '" + name + "' not found"));
    }
}
