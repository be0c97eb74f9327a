package com.opsdata.reconciliation.domain;

import java.time.LocalDate;

public record QualityRecord(
    LocalDate inspectionDate,
    boolean pass,
    String defectType,
    int defectCount,
    String inspectorId
) {
}
