package com.opsdata.reconciliation.domain;

public enum RunStatus {
    RUNNING,
    SUCCEEDED,
    PARTIAL_SUCCESS,
    FAILED
}
