package com.chambua.inventory.importing;

public enum MutationKind {
    CREATE,
    UPDATE
}
