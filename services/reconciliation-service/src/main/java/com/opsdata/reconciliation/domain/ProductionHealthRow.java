package com.opsdata.reconciliation.domain;

import java.math.BigDecimal;
import java.time.LocalDate;

public record ProductionHealthRow(
    String productionLineId,
    LocalDate weekStart,
    long totalLots,
    long totalUnits,
    long totalDowntimeMinutes,
    long lotsWithIssues,
    BigDecimal errorRatePercent
) {
}
