package com.opsdata.reconciliation.domain;

public enum FlagType {
    PENDING_INSPECTION("PendingInspection", FlagSeverity.WARNING),
    ORPHANED_SHIPMENT("OrphanedShipment", FlagSeverity.CRITICAL),
    DATE_CONFLICT("DateConflict", FlagSeverity.ERROR);

    private final String label;
    private final FlagSeverity severity;

    FlagType(String label, FlagSeverity severity) {
        this.label = label;
        this.severity = severity;
    }

    public String label() {
        return label;
    }

    public FlagSeverity severity() {
        return severity;
    }
}
