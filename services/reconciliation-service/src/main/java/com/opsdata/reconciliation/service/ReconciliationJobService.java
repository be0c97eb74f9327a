package com.opsdata.reconciliation.service;

import com.opsdata.reconciliation.client.SourceExport;
import com.opsdata.reconciliation.client.SourceRowReader;
import com.opsdata.reconciliation.config.ReconciliationProperties;
import com.opsdata.reconciliation.domain.FailureCode;
import com.opsdata.reconciliation.domain.IngestionResult;
import com.opsdata.reconciliation.domain.ReconciliationReport;
import com.opsdata.reconciliation.domain.ReconciliationRunEntity;
import com.opsdata.reconciliation.domain.RowError;
import com.opsdata.reconciliation.domain.RunFailureEntity;
import com.opsdata.reconciliation.domain.RunTrigger;
import com.opsdata.reconciliation.domain.SourceHealthStatus;
import com.opsdata.reconciliation.domain.SourceKind;
import com.opsdata.reconciliation.domain.ValidationResult;
import com.opsdata.reconciliation.exception.FailureClassifier;
import com.opsdata.reconciliation.exception.SourceReadException;
import com.opsdata.reconciliation.reconcile.SourceReconciler;
import com.opsdata.reconciliation.repository.ReconciliationRunRepository;
import com.opsdata.reconciliation.repository.RunFailureRepository;
import com.opsdata.reconciliation.validation.ValidationRuleEngine;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

@Service
public class ReconciliationJobService {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReconciliationJobService.class);

    private static final String INLINE_LOCATION = "inline";
    private static final String INLINE_FORMAT = "json";

    private final SourceRowReader sourceRowReader;
    private final Map<SourceKind, SourceReconciler<?>> reconcilers;
    private final ValidationRuleEngine validationRuleEngine;
    private final SourceHealthMonitor sourceHealthMonitor;
    private final ReconciliationRunRepository runRepository;
    private final RunFailureRepository runFailureRepository;
    private final ReconciliationProperties properties;

    public ReconciliationJobService(
        SourceRowReader sourceRowReader,
        List<SourceReconciler<?>> reconcilers,
        ValidationRuleEngine validationRuleEngine,
        SourceHealthMonitor sourceHealthMonitor,
        ReconciliationRunRepository runRepository,
        RunFailureRepository runFailureRepository,
        ReconciliationProperties properties
    ) {
        this.sourceRowReader = sourceRowReader;
        this.reconcilers = new EnumMap<>(SourceKind.class);
        for (SourceReconciler<?> reconciler : reconcilers) {
            this.reconcilers.put(reconciler.kind(), reconciler);
        }
        this.validationRuleEngine = validationRuleEngine;
        this.sourceHealthMonitor = sourceHealthMonitor;
        this.runRepository = runRepository;
        this.runFailureRepository = runFailureRepository;
        this.properties = properties;
    }

    public ReconciliationReport runFullRefresh(RunTrigger trigger) {
        return runFullRefresh(trigger, Map.of());
    }

    public ReconciliationReport runFullRefresh(RunTrigger trigger, Map<SourceKind, List<Map<String, Object>>> inlineRows) {
        ReconciliationRunEntity run = runRepository.save(ReconciliationRunEntity.startNew(trigger));
        LOGGER.info("Reconciliation run {} started ({})", run.getRunId(), trigger);
        FailureBudget budget = new FailureBudget(properties.getMaxRecordedFailures());
        try {
            List<IngestionResult> ingestion = new ArrayList<>();
            for (SourceKind kind : SourceKind.values()) {
                IngestionResult result = ingest(run.getRunId(), kind, inlineRows.get(kind), budget);
                run.record(result);
                for (RowError error : result.errors()) {
                    recordFailure(run.getRunId(), result.source(), error.rowNumber(), error.code(), error.message(), budget);
                }
                ingestion.add(result);
            }

            List<ValidationResult> validation = validationRuleEngine.runAll();
            for (ValidationResult result : validation) {
                run.record(result);
                for (String error : result.errors()) {
                    recordFailure(run.getRunId(), result.ruleName(), 0, FailureCode.PROCESSING_ERROR, error, budget);
                }
            }

            run.complete();
            runRepository.save(run);
            LOGGER.info("Reconciliation run {} finished {}: read={} ingested={} skipped={} rowErrors={} flagsCreated={} ruleErrors={}",
                run.getRunId(), run.getStatus(), run.getRowsRead(), run.getRowsIngested(), run.getRowsSkipped(),
                run.getRowErrors(), run.getFlagsCreated(), run.getRuleErrors());
            return new ReconciliationReport(run.getRunId(), run.getStatus(), ingestion, validation);
        } catch (RuntimeException fatal) {
            LOGGER.error("Reconciliation run {} failed", run.getRunId(), fatal);
            run.fail(FailureClassifier.truncate(fatal.getMessage()));
            runRepository.save(run);
            throw fatal;
        }
    }

    public List<ValidationResult> runValidation() {
        return validationRuleEngine.runAll();
    }

    public Optional<ReconciliationRunEntity> getRun(UUID runId) {
        return runRepository.findById(runId);
    }

    public List<RunFailureEntity> getRunFailures(UUID runId) {
        return runFailureRepository.findTop20ByRunIdOrderByCreatedAtDesc(runId);
    }

    private IngestionResult ingest(UUID runId, SourceKind kind, List<Map<String, Object>> inline, FailureBudget budget) {
        String location = inline != null ? INLINE_LOCATION : sourceRowReader.location(kind);
        String format = inline != null ? INLINE_FORMAT : sourceRowReader.format(kind);

        IngestionResult result;
        List<Map<String, Object>> rows;
        try {
            if (inline != null) {
                rows = inline;
            } else {
                SourceExport export = sourceRowReader.read(kind);
                rows = export.rows();
                location = export.location();
                format = export.format();
            }
        } catch (SourceReadException ex) {
            LOGGER.warn("Could not read {}: {}", kind.sourceName(), ex.getMessage());
            result = IngestionResult.unreadable(kind.sourceName(),
                new RowError(0, FailureCode.SOURCE_READ, FailureClassifier.describe(ex)));
            markSource(runId, kind, location, format, SourceHealthStatus.ERROR, budget);
            return result;
        }

        if (rows.isEmpty()) {
            LOGGER.warn("No rows to reconcile for {}", kind.sourceName());
        }
        result = reconcilers.get(kind).reconcileAll(rows);
        markSource(runId, kind, location, format,
            result.failedEntirely() ? SourceHealthStatus.ERROR : SourceHealthStatus.HEALTHY, budget);
        return result;
    }

    private void markSource(UUID runId, SourceKind kind, String location, String format, SourceHealthStatus status, FailureBudget budget) {
        try {
            sourceHealthMonitor.recordAttempt(kind, location, format, status);
        } catch (DataAccessException | TransactionException ex) {
            LOGGER.warn("Could not update metadata for {}: {}", kind.sourceName(), ex.getMessage());
            recordFailure(runId, kind.sourceName(), 0, FailureCode.STORAGE_ERROR, FailureClassifier.describe(ex), budget);
        }
    }

    private void recordFailure(UUID runId, String scope, int rowNumber, FailureCode code, String message, FailureBudget budget) {
        if (!budget.take()) {
            return;
        }
        try {
            runFailureRepository.save(RunFailureEntity.of(
                runId,
                scope,
                rowNumber > 0 ? rowNumber : null,
                code,
                FailureClassifier.truncate(message)
            ));
        } catch (DataAccessException | TransactionException ex) {
            LOGGER.warn("Could not record {} failure for {} in run {}: {}", code, scope, runId, ex.getMessage());
        }
    }

    private static final class FailureBudget {

        private int remaining;

        FailureBudget(int limit) {
            this.remaining = limit;
        }

        boolean take() {
            if (remaining <= 0) {
                return false;
            }
            remaining--;
            return true;
        }
    }
}
