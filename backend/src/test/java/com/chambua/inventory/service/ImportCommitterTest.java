package com.chambua.inventory.service;

import com.chambua.inventory.importing.*;
import com.chambua.inventory.repository.InventoryStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.CannotCreateTransactionException;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class ImportCommitterTest {

    @Mock private InventoryStore store;

    private ReconciliationPlan plan() {
        return new ReconciliationPlan(List.of(
                ItemMutation.create(RowFixtures.resolved(1, "A", 1L), 1L),
                ItemMutation.update(RowFixtures.resolved(2, "B", null))
        ), List.of(), 0);
    }

    @Test
    void returnsStoreCounts() {
        given(store.applyAtomically(anyList(), eq("alice"))).willReturn(new CommitResult(1, 1));

        CommitResult result = new ImportCommitter(store).commit(plan(), "alice");

        assertThat(result).isEqualTo(new CommitResult(1, 1));
    }

    @Test
    void emptyPlanDoesNotTouchTheStore() {
        CommitResult result = new ImportCommitter(store).commit(new ReconciliationPlan(List.of(), List.of(), 0), "alice");

        assertThat(result).isEqualTo(CommitResult.none());
        verifyNoInteractions(store);
    }

    @Test
    void constraintViolationBecomesStoreCommitFailure() {
        given(store.applyAtomically(anyList(), any()))
                .willThrow(new DataIntegrityViolationException("Duplicate entry '111' for key 'uk_item_barcode'"));

        assertThatThrownBy(() -> new ImportCommitter(store).commit(plan(), "alice"))
                .isInstanceOf(StoreCommitFailureException.class)
                .hasMessageContaining("no changes were saved")
                .hasMessageContaining("uk_item_barcode")
                .satisfies(e -> assertThat(((ImportAbortedException) e).kind()).isEqualTo(ImportFailureKind.COMMIT));
    }

    @Test
    void connectivityLossBecomesStoreCommitFailure() {
        given(store.applyAtomically(anyList(), any()))
                .willThrow(new CannotCreateTransactionException("Connection refused"));

        assertThatThrownBy(() -> new ImportCommitter(store).commit(plan(), "alice"))
                .isInstanceOf(StoreCommitFailureException.class);
    }
}
