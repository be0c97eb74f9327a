package com.opsdata.reconciliation.reconcile;

import com.opsdata.reconciliation.config.ReconciliationProperties;
import com.opsdata.reconciliation.domain.LotEntity;
import com.opsdata.reconciliation.domain.ProductionRecord;
import com.opsdata.reconciliation.domain.ProductionRecordEntity;
import com.opsdata.reconciliation.domain.SourceKind;
import com.opsdata.reconciliation.domain.UpsertResult;
import com.opsdata.reconciliation.normalize.SourceField;
import com.opsdata.reconciliation.normalize.SourceRow;
import com.opsdata.reconciliation.repository.ProductionRecordRepository;
import com.opsdata.reconciliation.service.LotIdentityResolver;
import java.time.Clock;
import java.time.Instant;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

@Component
public class ProductionReconciler extends SourceReconciler<ProductionRecord> {

    private final ProductionRecordRepository productionRecordRepository;

    public ProductionReconciler(
        LotIdentityResolver identityResolver,
        TransactionTemplate unitTransactionTemplate,
        ReconciliationProperties properties,
        Clock clock,
        ProductionRecordRepository productionRecordRepository
    ) {
        super(identityResolver, unitTransactionTemplate, properties, clock);
        this.productionRecordRepository = productionRecordRepository;
    }

    @Override
    public SourceKind kind() {
        return SourceKind.PRODUCTION;
    }

    @Override
    protected SourceField lotDateField() {
        return SourceField.PRODUCTION_LOT_DATE;
    }

    @Override
    protected ProductionRecord toRecord(SourceRow row) {
        ProductionRecord record = new ProductionRecord(
            row.text(SourceField.PRODUCTION_LINE),
            row.text(SourceField.SHIFT),
            row.integer(SourceField.UNITS_PLANNED, 0),
            row.integer(SourceField.UNITS_ACTUAL, 0),
            row.integer(SourceField.DOWNTIME_MINUTES, 0),
            row.bool(SourceField.LINE_ISSUE, false)
        );
        requireNonNegative(record.unitsPlanned(), "Units planned");
        requireNonNegative(record.unitsActual(), "Units actual");
        requireNonNegative(record.downtimeMinutes(), "Downtime minutes");
        return record;
    }

    @Override
    protected UpsertResult attach(LotEntity lot, ProductionRecord record, Instant sourceUpdatedAt) {
        boolean duplicate = productionRecordRepository.findByLotIdOrderBySourceUpdatedAtDescIdDesc(lot.getId())
            .stream()
            .anyMatch(existing -> existing.matches(record));
        if (duplicate) {
            return UpsertResult.SKIPPED;
        }
        productionRecordRepository.save(ProductionRecordEntity.fromRecord(lot, record, sourceUpdatedAt));
        return UpsertResult.INSERTED;
    }
}
