package com.opsdata.reconciliation.domain;

import java.time.Instant;
import java.time.LocalDate;

public record FlagView(
    Long flagId,
    String lotCode,
    LocalDate productionDate,
    String flagType,
    String severity,
    String description,
    Instant detectedAt,
    boolean resolved,
    Instant resolvedAt
) {

    public static FlagView of(IntegrityFlagEntity flag, LotEntity lot) {
        return new FlagView(
            flag.getId(),
            lot.getLotCode(),
            lot.getProductionDate(),
            flag.getFlagType().label(),
            flag.getSeverity().label(),
            flag.getDescription(),
            flag.getDetectedAt(),
            flag.isResolved(),
            flag.getResolvedAt()
        );
    }
}
