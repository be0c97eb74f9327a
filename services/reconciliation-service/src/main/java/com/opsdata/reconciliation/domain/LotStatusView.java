package com.opsdata.reconciliation.domain;

import java.time.LocalDate;
import java.util.List;

public record LotStatusView(
    Long lotId,
    String lotCode,
    LocalDate productionDate,
    String status,
    boolean pendingInspection,
    boolean hasIntegrityIssue,
    boolean hasDateConflict,
    ProductionRecord production,
    QualityRecord quality,
    ShippingRecord shipping,
    List<FlagView> openFlags
) {
}
