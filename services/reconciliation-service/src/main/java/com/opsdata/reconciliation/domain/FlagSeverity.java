package com.opsdata.reconciliation.domain;

public enum FlagSeverity {
    WARNING("Warning"),
    ERROR("Error"),
    CRITICAL("Critical");

    private final String label;

    FlagSeverity(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
