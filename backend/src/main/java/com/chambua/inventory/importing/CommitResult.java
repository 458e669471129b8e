package com.chambua.inventory.importing;

public record CommitResult(int created, int updated) {

    public static CommitResult none() {
        return new CommitResult(0, 0);
    }
}
