package com.opsdata.reconciliation.domain;

public enum UpsertResult {
    INSERTED,
    SKIPPED;

    public boolean isInsert() {
        return this == INSERTED;
    }
}
