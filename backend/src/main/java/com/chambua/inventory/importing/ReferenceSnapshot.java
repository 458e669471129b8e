package com.chambua.inventory.importing;

import com.chambua.inventory.model.Category;
import com.chambua.inventory.model.Location;
import com.chambua.inventory.model.Supplier;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Read-once view of the referenceable entities, keyed by lower-cased name. Taken at the
 * start of a submission so every row resolves against the same state. Inactive entities are
 * included so exported names always resolve back. When two entities share a name an active one
 * beats an inactive one, then the lowest id wins.
 */
public final class ReferenceSnapshot {

    private final Map<String, Long> locations;
    private final Map<String, Long> categories;
    private final Map<String, Long> suppliers;

    public ReferenceSnapshot(Map<String, Long> locations, Map<String, Long> categories, Map<String, Long> suppliers) {
        this.locations = Collections.unmodifiableMap(new HashMap<>(locations));
        this.categories = Collections.unmodifiableMap(new HashMap<>(categories));
        this.suppliers = Collections.unmodifiableMap(new HashMap<>(suppliers));
    }

    /** Entity lists must be ordered by id. */
    public static ReferenceSnapshot of(List<Location> locations, List<Category> categories, List<Supplier> suppliers) {
        return new ReferenceSnapshot(
                index(locations, Location::getName, Location::getId, Location::isActive),
                index(categories, Category::getName, Category::getId, Category::isActive),
                index(suppliers, Supplier::getName, Supplier::getId, Supplier::isActive));
    }

    public Optional<Long> location(String name) {
        return Optional.ofNullable(locations.get(key(name)));
    }

    public Optional<Long> category(String name) {
        return Optional.ofNullable(categories.get(key(name)));
    }

    public Optional<Long> supplier(String name) {
        return Optional.ofNullable(suppliers.get(key(name)));
    }

    private static <E> Map<String, Long> index(List<E> entities, Function<E, String> name, Function<E, Long> id,
                                               Predicate<E> active) {
        Map<String, Long> byName = new HashMap<>();
        for (E e : entities) {
            if (active.test(e)) put(byName, name.apply(e), id.apply(e));
        }
        for (E e : entities) {
            if (!active.test(e)) put(byName, name.apply(e), id.apply(e));
        }
        return byName;
    }

    private static void put(Map<String, Long> byName, String name, Long id) {
        if (name != null) byName.putIfAbsent(key(name), id);
    }

    private static String key(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }
}
