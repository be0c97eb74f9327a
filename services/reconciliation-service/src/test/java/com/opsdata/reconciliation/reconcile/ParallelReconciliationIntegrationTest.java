package com.opsdata.reconciliation.reconcile;

import static org.assertj.core.api.Assertions.assertThat;

import com.opsdata.reconciliation.StoreTestSupport;
import com.opsdata.reconciliation.domain.FailureCode;
import com.opsdata.reconciliation.domain.IngestionResult;
import com.opsdata.reconciliation.domain.LotEntity;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest(properties = "reconciliation.row-parallelism=8")
@ActiveProfiles("test")
class ParallelReconciliationIntegrationTest extends StoreTestSupport {

    private static final int DUPLICATES = 16;

    @Autowired
    private QualityReconciler qualityReconciler;

    @Test
    @DisplayName("concurrent identical rows for a new lot create one lot and one record")
    void concurrentDuplicatesForNewLotCollapse() {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 0; i < DUPLICATES; i++) {
            rows.add(row("Lot ID", "LOT-77", "Date", "2026-04-01", "Pass", "Fail", "Defect Type", "Cosmetic", "Defects", 2));
        }
        rows.add(DUPLICATES / 2, row("Lot ID", "  ", "Date", "2026-04-01", "Pass", "Pass"));

        IngestionResult result = qualityReconciler.reconcileAll(rows);

        assertThat(result.rowsRead()).isEqualTo(DUPLICATES + 1);
        assertThat(result.rowsIngested()).isEqualTo(1);
        assertThat(result.rowsSkipped()).isEqualTo(DUPLICATES - 1);
        assertThat(result.errors()).singleElement()
            .satisfies(error -> {
                assertThat(error.rowNumber()).isEqualTo(DUPLICATES / 2 + 1);
                assertThat(error.code()).isEqualTo(FailureCode.ROW_VALIDATION);
            });

        assertThat(lotRepository.count()).isEqualTo(1);
        LotEntity lot = lot("LOT-77", "2026-04-01");
        assertThat(lot.isPendingInspection()).isFalse();
        assertThat(qualityRecordRepository.countByLotId(lot.getId())).isEqualTo(1);
        assertThat(qualityRecordRepository.count()).isEqualTo(1);
    }
}
