package com.opsdata.reconciliation.controller;

import com.opsdata.reconciliation.domain.FailureCode;
import com.opsdata.reconciliation.domain.ReconciliationRunEntity;
import com.opsdata.reconciliation.domain.RunFailureEntity;
import com.opsdata.reconciliation.domain.RunStatus;
import com.opsdata.reconciliation.domain.RunTrigger;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record ReconciliationRunResponse(
    UUID runId,
    RunTrigger trigger,
    RunStatus status,
    Instant startedAt,
    Instant completedAt,
    int rowsRead,
    int rowsIngested,
    int rowsSkipped,
    int rowErrors,
    int flagsCreated,
    int flagsSkipped,
    int ruleErrors,
    String errorSummary,
    List<FailureItem> recentFailures
) {

    public static ReconciliationRunResponse from(ReconciliationRunEntity run, List<RunFailureEntity> failures) {
        return new ReconciliationRunResponse(
            run.getRunId(),
            run.getTrigger(),
            run.getStatus(),
            run.getStartedAt(),
            run.getCompletedAt(),
            run.getRowsRead(),
            run.getRowsIngested(),
            run.getRowsSkipped(),
            run.getRowErrors(),
            run.getFlagsCreated(),
            run.getFlagsSkipped(),
            run.getRuleErrors(),
            run.getErrorSummary(),
            failures.stream().map(FailureItem::from).toList()
        );
    }

    public record FailureItem(String scope, Integer rowNumber, FailureCode code, String reason, Instant createdAt) {

        static FailureItem from(RunFailureEntity entity) {
            return new FailureItem(
                entity.getScope(),
                entity.getRowNumber(),
                entity.getFailureCode(),
                entity.getFailureReason(),
                entity.getCreatedAt()
            );
        }
    }
}
