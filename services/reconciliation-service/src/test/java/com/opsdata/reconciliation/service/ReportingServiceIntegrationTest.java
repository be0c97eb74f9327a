package com.opsdata.reconciliation.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.groups.Tuple.tuple;

import com.opsdata.reconciliation.StoreTestSupport;
import com.opsdata.reconciliation.domain.DefectTrendRow;
import com.opsdata.reconciliation.domain.ProductionHealthRow;
import com.opsdata.reconciliation.reconcile.ProductionReconciler;
import com.opsdata.reconciliation.reconcile.QualityReconciler;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class ReportingServiceIntegrationTest extends StoreTestSupport {

    private static final LocalDate FROM = LocalDate.of(2026, 2, 1);
    private static final LocalDate TO = LocalDate.of(2026, 2, 28);

    @Autowired
    private ReportingService reportingService;

    @Autowired
    private ProductionReconciler productionReconciler;

    @Autowired
    private QualityReconciler qualityReconciler;

    @BeforeEach
    void seed() {
        // Week of Monday 2026-02-09: P1 has one issue in four lots, P2 one in two.
        productionReconciler.reconcileAll(List.of(
            row("Lot ID", "A1", "Line", "P1", "Actual", 100, "Downtime", 5, "Line Issue", "yes", "Date", "2026-02-09"),
            row("Lot ID", "A2", "Line", "P1", "Actual", 100, "Date", "2026-02-10"),
            row("Lot ID", "A3", "Line", "P1", "Actual", 100, "Date", "2026-02-11"),
            row("Lot ID", "A4", "Line", "P1", "Actual", 100, "Date", "2026-02-15"),
            row("Lot ID", "B1", "Line", "P2", "Actual", 50, "Downtime", 30, "Line Issue", "yes", "Date", "2026-02-12"),
            row("Lot ID", "B2", "Line", "P2", "Actual", 50, "Date", "2026-02-13"),
            row("Lot ID", "C1", "Line", "P1", "Actual", 70, "Date", "2026-02-16"),
            row("Lot ID", "Z1", "Line", "P1", "Line Issue", "yes", "Date", "2026-03-02")
        ));
        qualityReconciler.reconcileAll(List.of(
            row("Lot ID", "A1", "Production Date", "2026-02-09", "Inspection Date", "2026-02-10", "Pass", "no",
                "Defect Type", "Cosmetic", "Defects", 4),
            row("Lot ID", "A2", "Production Date", "2026-02-10", "Inspection Date", "2026-02-11", "Pass", "yes",
                "Defect Type", "Cosmetic", "Defects", 1),
            row("Lot ID", "A3", "Production Date", "2026-02-11", "Inspection Date", "2026-02-12", "Pass", "yes"),
            row("Lot ID", "C1", "Production Date", "2026-02-16", "Inspection Date", "2026-02-17", "Pass", "no",
                "Defect Type", "Functional", "Defects", 2)
        ));
    }

    @Test
    void productionHealthRanksLineWeeksByErrorRate() {
        List<ProductionHealthRow> rows = reportingService.productionHealth(FROM, TO, 10);

        assertThat(rows).extracting(ProductionHealthRow::productionLineId, ProductionHealthRow::weekStart)
            .containsExactly(
                tuple("P2", LocalDate.of(2026, 2, 9)),
                tuple("P1", LocalDate.of(2026, 2, 9)),
                tuple("P1", LocalDate.of(2026, 2, 16)));

        ProductionHealthRow p2 = rows.get(0);
        assertThat(p2.totalLots()).isEqualTo(2);
        assertThat(p2.totalUnits()).isEqualTo(100);
        assertThat(p2.totalDowntimeMinutes()).isEqualTo(30);
        assertThat(p2.lotsWithIssues()).isEqualTo(1);
        assertThat(p2.errorRatePercent()).isEqualByComparingTo("50.00");

        ProductionHealthRow p1 = rows.get(1);
        assertThat(p1.totalLots()).isEqualTo(4);
        assertThat(p1.totalUnits()).isEqualTo(400);
        assertThat(p1.errorRatePercent()).isEqualByComparingTo("25.00");
        assertThat(rows.get(2).errorRatePercent()).isEqualByComparingTo(BigDecimal.ZERO);
    }

    @Test
    void productionHealthKeepsTopN() {
        assertThat(reportingService.productionHealth(FROM, TO, 1))
            .singleElement()
            .extracting(ProductionHealthRow::productionLineId)
            .isEqualTo("P2");
    }

    @Test
    void defectTrendingGroupsByTypeAndInspectionWeek() {
        List<DefectTrendRow> rows = reportingService.defectTrending(FROM, TO);

        assertThat(rows).extracting(DefectTrendRow::defectType, DefectTrendRow::weekStart)
            .containsExactly(
                tuple("Functional", LocalDate.of(2026, 2, 16)),
                tuple("Cosmetic", LocalDate.of(2026, 2, 9)),
                tuple("Unspecified", LocalDate.of(2026, 2, 9)));

        DefectTrendRow cosmetic = rows.get(1);
        assertThat(cosmetic.affectedLots()).isEqualTo(2);
        assertThat(cosmetic.totalDefects()).isEqualTo(5);
        assertThat(cosmetic.failedInspections()).isEqualTo(1);
        assertThat(cosmetic.failureRatePercent()).isEqualByComparingTo("50.00");
        assertThat(rows.get(2).failedInspections()).isZero();
    }

    @Test
    void weekStartIsTheMonday() {
        assertThat(ReportingService.weekStart(LocalDate.of(2026, 2, 15))).isEqualTo(LocalDate.of(2026, 2, 9));
        assertThat(ReportingService.weekStart(LocalDate.of(2026, 2, 9))).isEqualTo(LocalDate.of(2026, 2, 9));
    }

    @Test
    void percentRoundsHalfUp() {
        assertThat(ReportingService.percent(1, 3)).isEqualByComparingTo("33.33");
        assertThat(ReportingService.percent(2, 3)).isEqualByComparingTo("66.67");
        assertThat(ReportingService.percent(0, 0)).isEqualByComparingTo("0.00");
    }
}
