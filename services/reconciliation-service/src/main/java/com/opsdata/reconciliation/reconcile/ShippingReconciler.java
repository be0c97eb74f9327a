package com.opsdata.reconciliation.reconcile;

import com.opsdata.reconciliation.config.ReconciliationProperties;
import com.opsdata.reconciliation.domain.LotEntity;
import com.opsdata.reconciliation.domain.ShippingRecord;
import com.opsdata.reconciliation.domain.ShippingRecordEntity;
import com.opsdata.reconciliation.domain.SourceKind;
import com.opsdata.reconciliation.domain.UpsertResult;
import com.opsdata.reconciliation.exception.IntegrityConstraintException;
import com.opsdata.reconciliation.exception.RowValidationException;
import com.opsdata.reconciliation.normalize.FieldNormalizer;
import com.opsdata.reconciliation.normalize.SourceField;
import com.opsdata.reconciliation.normalize.SourceRow;
import com.opsdata.reconciliation.repository.ShippingRecordRepository;
import com.opsdata.reconciliation.service.LotIdentityResolver;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

@Component
public class ShippingReconciler extends SourceReconciler<ShippingRecord> {

    private static final String UNKNOWN_CARRIER = "UNKNOWN";
    private static final String DEFAULT_STATUS = "In Transit";

    private final ShippingRecordRepository shippingRecordRepository;

    public ShippingReconciler(
        LotIdentityResolver identityResolver,
        TransactionTemplate unitTransactionTemplate,
        ReconciliationProperties properties,
        Clock clock,
        ShippingRecordRepository shippingRecordRepository
    ) {
        super(identityResolver, unitTransactionTemplate, properties, clock);
        this.shippingRecordRepository = shippingRecordRepository;
    }

    @Override
    public SourceKind kind() {
        return SourceKind.SHIPPING;
    }

    @Override
    protected SourceField lotDateField() {
        return SourceField.SHIPPING_LOT_DATE;
    }

    @Override
    protected ShippingRecord toRecord(SourceRow row) {
        Object rawShipDate = row.value(SourceField.SHIP_DATE);
        LocalDate shipDate = FieldNormalizer.canonicalDate(rawShipDate)
            .orElseThrow(() -> new RowValidationException(rawShipDate == null
                ? "Missing ship date"
                : "Unparseable ship date '" + rawShipDate + "'"));

        ShippingRecord record = new ShippingRecord(
            shipDate,
            row.text(SourceField.DESTINATION),
            row.text(SourceField.CARRIER, UNKNOWN_CARRIER),
            row.integer(SourceField.QTY_SHIPPED, 0),
            row.text(SourceField.SHIPMENT_STATUS, DEFAULT_STATUS)
        );
        requireNonNegative(record.qtyShipped(), "Quantity shipped");
        return record;
    }

    @Override
    protected UpsertResult attach(LotEntity lot, ShippingRecord record, Instant sourceUpdatedAt) {
        Optional<ShippingRecordEntity> existing = shippingRecordRepository.findByLotId(lot.getId());
        if (existing.isPresent()) {
            if (existing.get().matches(record)) {
                return UpsertResult.SKIPPED;
            }
            throw new IntegrityConstraintException("Lot " + lot.getLotCode() + " (" + lot.getProductionDate()
                + ") already has a different shipping record");
        }
        shippingRecordRepository.saveAndFlush(ShippingRecordEntity.fromRecord(lot, record, sourceUpdatedAt));
        return UpsertResult.INSERTED;
    }
}
