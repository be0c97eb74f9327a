package com.opsdata.reconciliation;

import com.opsdata.reconciliation.domain.LotEntity;
import com.opsdata.reconciliation.repository.IntegrityFlagRepository;
import com.opsdata.reconciliation.repository.LotRepository;
import com.opsdata.reconciliation.repository.ProductionRecordRepository;
import com.opsdata.reconciliation.repository.QualityInspectionRecordRepository;
import com.opsdata.reconciliation.repository.ReconciliationRunRepository;
import com.opsdata.reconciliation.repository.RunFailureRepository;
import com.opsdata.reconciliation.repository.ShippingRecordRepository;
import com.opsdata.reconciliation.repository.SourceMetadataRepository;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;

public abstract class StoreTestSupport {

    @Autowired
    protected LotRepository lotRepository;

    @Autowired
    protected ProductionRecordRepository productionRecordRepository;

    @Autowired
    protected QualityInspectionRecordRepository qualityRecordRepository;

    @Autowired
    protected ShippingRecordRepository shippingRecordRepository;

    @Autowired
    protected IntegrityFlagRepository flagRepository;

    @Autowired
    protected SourceMetadataRepository sourceMetadataRepository;

    @Autowired
    protected ReconciliationRunRepository runRepository;

    @Autowired
    protected RunFailureRepository runFailureRepository;

    @BeforeEach
    void cleanStore() {
        flagRepository.deleteAllInBatch();
        shippingRecordRepository.deleteAllInBatch();
        qualityRecordRepository.deleteAllInBatch();
        productionRecordRepository.deleteAllInBatch();
        lotRepository.deleteAllInBatch();
        sourceMetadataRepository.deleteAllInBatch();
        runFailureRepository.deleteAllInBatch();
        runRepository.deleteAllInBatch();
    }

    protected static Map<String, Object> row(Object... keysAndValues) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            row.put((String) keysAndValues[i], keysAndValues[i + 1]);
        }
        return row;
    }

    protected LotEntity lot(String lotCode, String isoDate) {
        return lotRepository.findByLotCodeAndProductionDate(lotCode, LocalDate.parse(isoDate))
            .orElseThrow(() -> new AssertionError("no lot " + lotCode + " on " + isoDate));
    }
}
