package com.opsdata.reconciliation.domain;

public record ProductionRecord(
    String productionLineId,
    String shift,
    int unitsPlanned,
    int unitsActual,
    int downtimeMinutes,
    boolean lineIssue
) {
}
