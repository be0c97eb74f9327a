package com.opsdata.reconciliation.domain;

public enum RunTrigger {
    MANUAL,
    SCHEDULED
}
