package com.chambua.inventory.importing;

import com.chambua.inventory.model.Category;
import com.chambua.inventory.model.Location;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ReferenceSnapshotTest {

    @Test
    void lowestIdWinsOnDuplicateNames() {
        Location first = new Location("Main Store", "MS1"); first.setId(3L);
        Location second = new Location("main store", "MS2"); second.setId(9L);
        Category cat = new Category(" Beverages "); cat.setId(4L);

        ReferenceSnapshot snapshot = ReferenceSnapshot.of(List.of(first, second), List.of(cat), List.of());

        assertThat(snapshot.location("MAIN STORE")).contains(3L);
        assertThat(snapshot.category("beverages")).contains(4L);
        assertThat(snapshot.supplier("anything")).isEmpty();
    }

    @Test
    void inactiveEntitiesResolveButActiveOnesWinTheirName() {
        Location closed = new Location("Main Store", "OLD"); closed.setId(1L); closed.setActive(false);
        Location open = new Location("Main Store", "MS"); open.setId(5L);
        Category retired = new Category("Old"); retired.setId(2L); retired.setActive(false);

        ReferenceSnapshot snapshot = ReferenceSnapshot.of(List.of(closed, open), List.of(retired), List.of());

        assertThat(snapshot.location("main store")).contains(5L);
        assertThat(snapshot.category("old")).contains(2L);
    }
}
