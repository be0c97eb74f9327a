package com.opsdata.reconciliation.domain;

public enum SourceKind {
    PRODUCTION("Production Logs"),
    QUALITY("Quality Inspection"),
    SHIPPING("Shipping Logs");

    private final String sourceName;

    SourceKind(String sourceName) {
        this.sourceName = sourceName;
    }

    public String sourceName() {
        return sourceName;
    }
}
