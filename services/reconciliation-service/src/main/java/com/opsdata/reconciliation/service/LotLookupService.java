package com.opsdata.reconciliation.service;

import com.opsdata.reconciliation.domain.FlagView;
import com.opsdata.reconciliation.domain.LotEntity;
import com.opsdata.reconciliation.domain.LotKey;
import com.opsdata.reconciliation.domain.LotStatusView;
import com.opsdata.reconciliation.domain.ProductionRecord;
import com.opsdata.reconciliation.domain.ProductionRecordEntity;
import com.opsdata.reconciliation.domain.QualityInspectionRecordEntity;
import com.opsdata.reconciliation.domain.QualityRecord;
import com.opsdata.reconciliation.domain.ShippingRecord;
import com.opsdata.reconciliation.domain.ShippingRecordEntity;
import com.opsdata.reconciliation.exception.ResourceNotFoundException;
import com.opsdata.reconciliation.normalize.FieldNormalizer;
import com.opsdata.reconciliation.repository.IntegrityFlagRepository;
import com.opsdata.reconciliation.repository.LotRepository;
import com.opsdata.reconciliation.repository.ProductionRecordRepository;
import com.opsdata.reconciliation.repository.QualityInspectionRecordRepository;
import com.opsdata.reconciliation.repository.ShippingRecordRepository;
import java.time.LocalDate;
import java.util.List;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

@Service
public class LotLookupService {

    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT = 500;

    private final LotRepository lotRepository;
    private final ProductionRecordRepository productionRecordRepository;
    private final QualityInspectionRecordRepository qualityRecordRepository;
    private final ShippingRecordRepository shippingRecordRepository;
    private final IntegrityFlagRepository flagRepository;

    public LotLookupService(
        LotRepository lotRepository,
        ProductionRecordRepository productionRecordRepository,
        QualityInspectionRecordRepository qualityRecordRepository,
        ShippingRecordRepository shippingRecordRepository,
        IntegrityFlagRepository flagRepository
    ) {
        this.lotRepository = lotRepository;
        this.productionRecordRepository = productionRecordRepository;
        this.qualityRecordRepository = qualityRecordRepository;
        this.shippingRecordRepository = shippingRecordRepository;
        this.flagRepository = flagRepository;
    }

    public List<LotStatusView> lookup(String lotCode) {
        String cleaned = FieldNormalizer.cleanLotCode(lotCode);
        List<LotEntity> lots = cleaned.isEmpty() ? List.of() : lotRepository.findByLotCodeIgnoreCaseOrderByProductionDateDesc(cleaned);
        if (lots.isEmpty()) {
            throw new ResourceNotFoundException("Lot not found: " + lotCode);
        }
        return lots.stream().map(lot -> view(lot, true)).toList();
    }

    public LotStatusView lookup(String lotCode, LocalDate productionDate) {
        String cleaned = FieldNormalizer.cleanLotCode(lotCode);
        return lotRepository.findByLotCodeAndProductionDate(cleaned, productionDate)
            .map(lot -> view(lot, true))
            .orElseThrow(() -> new ResourceNotFoundException("Lot not found: " + new LotKey(cleaned, productionDate)));
    }

    public List<LotStatusView> integratedView(LocalDate from, LocalDate to, String productionLine, int limit) {
        int bounded = Math.max(1, Math.min(limit, MAX_LIMIT));
        String line = productionLine == null || productionLine.isBlank() ? null : productionLine.trim();
        return lotRepository.search(from, to, line, PageRequest.of(0, bounded)).stream()
            .map(lot -> view(lot, false))
            .toList();
    }

    private LotStatusView view(LotEntity lot, boolean withFlags) {
        ProductionRecord production = productionRecordRepository.findByLotIdOrderBySourceUpdatedAtDescIdDesc(lot.getId())
            .stream().findFirst().map(ProductionRecordEntity::toRecord).orElse(null);
        QualityRecord quality = qualityRecordRepository.findByLotIdOrderByInspectionDateDescIdDesc(lot.getId())
            .stream().findFirst().map(QualityInspectionRecordEntity::toRecord).orElse(null);
        ShippingRecord shipping = shippingRecordRepository.findByLotId(lot.getId())
            .map(ShippingRecordEntity::toRecord).orElse(null);
        List<FlagView> flags = withFlags
            ? flagRepository.findByLotIdAndResolvedFalseOrderByDetectedAtDesc(lot.getId()).stream()
                .map(flag -> FlagView.of(flag, lot))
                .toList()
            : List.of();

        return new LotStatusView(
            lot.getId(),
            lot.getLotCode(),
            lot.getProductionDate(),
            LotStatusDeriver.deriveStatus(lot, quality, shipping),
            lot.isPendingInspection(),
            lot.hasIntegrityIssue(),
            lot.hasDateConflict(),
            production,
            quality,
            shipping,
            flags
        );
    }
}
