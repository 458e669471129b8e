package com.chambua.inventory.importing;

/**
 * One effective change to the store. For creates {@code locationId} is the location the new
 * item is placed in; for updates it is null and the row's own location field applies.
 */
public record ItemMutation(MutationKind kind, ResolvedRow source, Long locationId) {

    public static ItemMutation create(ResolvedRow source, Long locationId) {
        return new ItemMutation(MutationKind.CREATE, source, locationId);
    }

    public static ItemMutation update(ResolvedRow source) {
        return new ItemMutation(MutationKind.UPDATE, source, null);
    }

    public String sku() { return source.sku(); }
}
