package com.opsdata.reconciliation.domain;

import java.util.List;
import java.util.UUID;

public record ReconciliationReport(
    UUID runId,
    RunStatus status,
    List<IngestionResult> ingestion,
    List<ValidationResult> validation
) {
}
