package com.chambua.inventory.service;

import com.chambua.inventory.importing.CommitResult;
import com.chambua.inventory.importing.ReconciliationPlan;
import com.chambua.inventory.importing.StoreCommitFailureException;
import com.chambua.inventory.repository.InventoryStore;
import jakarta.persistence.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

/**
 * Hands the reconciled mutation list to the store as a single unit. Any store-level failure
 * surfaces as a {@link StoreCommitFailureException}; by then the store has rolled back every
 * mutation of the submission.
 */
@Service
public class ImportCommitter {

    private static final Logger log = LoggerFactory.getLogger(ImportCommitter.class);

    private final InventoryStore store;

    public ImportCommitter(InventoryStore store) {
        this.store = store;
    }

    public CommitResult commit(ReconciliationPlan plan, String actor) {
        if (plan.mutations().isEmpty()) return CommitResult.none();
        try {
            CommitResult result = store.applyAtomically(plan.mutations(), actor);
            log.info("Committed {} creates and {} updates for {}", result.created(), result.updated(), actor);
            return result;
        } catch (DataAccessException | TransactionException | PersistenceException e) {
            Throwable cause = NestedExceptionUtils.getMostSpecificCause(e);
            log.error("Import commit of {} mutations failed; nothing was saved", plan.mutations().size(), e);
            throw new StoreCommitFailureException("Import failed, no changes were saved: " + cause.getMessage(), e);
        }
    }
}
