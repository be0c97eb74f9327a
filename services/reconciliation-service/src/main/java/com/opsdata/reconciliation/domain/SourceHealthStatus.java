package com.opsdata.reconciliation.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SourceHealthStatus {
    HEALTHY("Healthy"),
    STALE("Stale"),
    ERROR("Error");

    private final String label;

    SourceHealthStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
