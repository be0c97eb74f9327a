package com.opsdata.reconciliation.domain;

import java.math.BigDecimal;
import java.time.LocalDate;

public record DefectTrendRow(
    String defectType,
    LocalDate weekStart,
    long affectedLots,
    long totalDefects,
    long failedInspections,
    BigDecimal failureRatePercent
) {
}
