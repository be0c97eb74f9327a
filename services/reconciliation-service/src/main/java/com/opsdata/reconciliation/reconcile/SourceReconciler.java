package com.opsdata.reconciliation.reconcile;

import com.opsdata.reconciliation.config.ReconciliationProperties;
import com.opsdata.reconciliation.domain.IngestionResult;
import com.opsdata.reconciliation.domain.LotEntity;
import com.opsdata.reconciliation.domain.LotKey;
import com.opsdata.reconciliation.domain.RowError;
import com.opsdata.reconciliation.domain.SourceKind;
import com.opsdata.reconciliation.domain.UpsertResult;
import com.opsdata.reconciliation.exception.FailureClassifier;
import com.opsdata.reconciliation.exception.RowValidationException;
import com.opsdata.reconciliation.normalize.SourceField;
import com.opsdata.reconciliation.normalize.SourceRow;
import com.opsdata.reconciliation.service.LotIdentityResolver;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.support.TransactionTemplate;

public abstract class SourceReconciler<R> {

    private static final Logger LOGGER = LoggerFactory.getLogger(SourceReconciler.class);

    private final LotIdentityResolver identityResolver;
    private final TransactionTemplate transactionTemplate;
    private final ReconciliationProperties properties;
    private final Clock clock;

    protected SourceReconciler(
        LotIdentityResolver identityResolver,
        TransactionTemplate transactionTemplate,
        ReconciliationProperties properties,
        Clock clock
    ) {
        this.identityResolver = identityResolver;
        this.transactionTemplate = transactionTemplate;
        this.properties = properties;
        this.clock = clock;
    }

    public abstract SourceKind kind();

    protected abstract SourceField lotDateField();

    protected abstract R toRecord(SourceRow row);

    protected abstract UpsertResult attach(LotEntity lot, R record, Instant sourceUpdatedAt);

    public IngestionResult reconcileAll(List<? extends Map<String, ?>> rows) {
        Instant sourceUpdatedAt = clock.instant();
        List<SourceRow> sourceRows = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            sourceRows.add(new SourceRow(i + 1, rows.get(i)));
        }

        List<RowOutcome> outcomes = properties.getRowParallelism() > 1 && sourceRows.size() > 1
            ? reconcileInParallel(sourceRows, sourceUpdatedAt)
            : sourceRows.stream().map(row -> reconcileRow(row, sourceUpdatedAt)).toList();

        int ingested = 0;
        int skipped = 0;
        List<RowError> errors = new ArrayList<>();
        for (RowOutcome outcome : outcomes) {
            if (outcome.error() != null) {
                errors.add(outcome.error());
            } else if (outcome.result().isInsert()) {
                ingested++;
            } else {
                skipped++;
            }
        }
        errors.sort(Comparator.comparingInt(RowError::rowNumber));

        IngestionResult result = new IngestionResult(kind().sourceName(), rows.size(), ingested, skipped, errors);
        LOGGER.info("{} reconciled: read={} ingested={} skipped={} errors={}",
            result.source(), result.rowsRead(), result.rowsIngested(), result.rowsSkipped(), errors.size());
        return result;
    }

    public UpsertResult reconcile(SourceRow row, Instant sourceUpdatedAt) {
        LotKey key = LotKey.of(row.value(SourceField.LOT_CODE), row.value(lotDateField()));
        R record = toRecord(row);
        return transactionTemplate.execute(status -> attach(identityResolver.resolve(key), record, sourceUpdatedAt));
    }

    protected static void requireNonNegative(int value, String field) {
        if (value < 0) {
            throw new RowValidationException(field + " must not be negative: " + value);
        }
    }

    private RowOutcome reconcileRow(SourceRow row, Instant sourceUpdatedAt) {
        try {
            return new RowOutcome(reconcile(row, sourceUpdatedAt), null);
        } catch (RuntimeException ex) {
            RowError error = new RowError(row.rowNumber(), FailureClassifier.classify(ex), FailureClassifier.describe(ex));
            LOGGER.warn("{} {} skipped: {} {}", kind().sourceName(), row, error.code(), error.message());
            return new RowOutcome(null, error);
        }
    }

    private List<RowOutcome> reconcileInParallel(List<SourceRow> rows, Instant sourceUpdatedAt) {
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(properties.getRowParallelism(), rows.size()));
        try {
            List<Future<RowOutcome>> futures = new ArrayList<>(rows.size());
            for (SourceRow row : rows) {
                futures.add(executor.submit(() -> reconcileRow(row, sourceUpdatedAt)));
            }
            List<RowOutcome> outcomes = new ArrayList<>(rows.size());
            for (int i = 0; i < futures.size(); i++) {
                outcomes.add(await(futures.get(i), rows.get(i)));
            }
            return outcomes;
        } finally {
            executor.shutdown();
        }
    }

    private RowOutcome await(Future<RowOutcome> future, SourceRow row) {
        try {
            return future.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return new RowOutcome(null, new RowError(row.rowNumber(), FailureClassifier.classify(ex), "interrupted"));
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            return new RowOutcome(null, new RowError(row.rowNumber(), FailureClassifier.classify(cause), FailureClassifier.describe(cause)));
        }
    }

    private record RowOutcome(UpsertResult result, RowError error) {
    }
}
