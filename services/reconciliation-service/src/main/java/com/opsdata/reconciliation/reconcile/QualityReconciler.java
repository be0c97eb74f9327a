package com.opsdata.reconciliation.reconcile;

import com.opsdata.reconciliation.config.ReconciliationProperties;
import com.opsdata.reconciliation.domain.LotEntity;
import com.opsdata.reconciliation.domain.QualityInspectionRecordEntity;
import com.opsdata.reconciliation.domain.QualityRecord;
import com.opsdata.reconciliation.domain.SourceKind;
import com.opsdata.reconciliation.domain.UpsertResult;
import com.opsdata.reconciliation.exception.RowValidationException;
import com.opsdata.reconciliation.normalize.FieldNormalizer;
import com.opsdata.reconciliation.normalize.SourceField;
import com.opsdata.reconciliation.normalize.SourceRow;
import com.opsdata.reconciliation.repository.LotRepository;
import com.opsdata.reconciliation.repository.QualityInspectionRecordRepository;
import com.opsdata.reconciliation.service.LotIdentityResolver;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

@Component
public class QualityReconciler extends SourceReconciler<QualityRecord> {

    private static final String UNKNOWN_INSPECTOR = "UNKNOWN";

    private final QualityInspectionRecordRepository qualityRecordRepository;
    private final LotRepository lotRepository;

    public QualityReconciler(
        LotIdentityResolver identityResolver,
        TransactionTemplate unitTransactionTemplate,
        ReconciliationProperties properties,
        Clock clock,
        QualityInspectionRecordRepository qualityRecordRepository,
        LotRepository lotRepository
    ) {
        super(identityResolver, unitTransactionTemplate, properties, clock);
        this.qualityRecordRepository = qualityRecordRepository;
        this.lotRepository = lotRepository;
    }

    @Override
    public SourceKind kind() {
        return SourceKind.QUALITY;
    }

    @Override
    protected SourceField lotDateField() {
        return SourceField.QUALITY_LOT_DATE;
    }

    @Override
    protected QualityRecord toRecord(SourceRow row) {
        Object rawInspectionDate = row.value(SourceField.INSPECTION_DATE) != null
            ? row.value(SourceField.INSPECTION_DATE)
            : row.value(SourceField.QUALITY_LOT_DATE);
        LocalDate inspectionDate = FieldNormalizer.canonicalDate(rawInspectionDate)
            .orElseThrow(() -> new RowValidationException("Unparseable inspection date '" + rawInspectionDate + "'"));

        String defectType = row.text(SourceField.DEFECT_TYPE);
        QualityRecord record = new QualityRecord(
            inspectionDate,
            row.bool(SourceField.PASS, false),
            defectType.isEmpty() ? null : defectType,
            row.integer(SourceField.DEFECT_COUNT, 0),
            row.text(SourceField.INSPECTOR_ID, UNKNOWN_INSPECTOR)
        );
        requireNonNegative(record.defectCount(), "Defect count");
        return record;
    }

    @Override
    protected UpsertResult attach(LotEntity lot, QualityRecord record, Instant sourceUpdatedAt) {
        boolean duplicate = qualityRecordRepository.findByLotIdOrderByInspectionDateDescIdDesc(lot.getId())
            .stream()
            .anyMatch(existing -> existing.matches(record));
        if (duplicate) {
            return UpsertResult.SKIPPED;
        }
        qualityRecordRepository.save(QualityInspectionRecordEntity.fromRecord(lot, record, sourceUpdatedAt));
        lotRepository.updatePendingInspection(lot.getId(), false);
        return UpsertResult.INSERTED;
    }
}
