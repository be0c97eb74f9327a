package com.opsdata.reconciliation.domain;

public enum FailureCode {
    ROW_VALIDATION,
    INTEGRITY_CONSTRAINT,
    STORAGE_ERROR,
    SOURCE_READ,
    PROCESSING_ERROR
}
