package com.opsdata.reconciliation.service;

import com.opsdata.reconciliation.domain.DefectTrendRow;
import com.opsdata.reconciliation.domain.ProductionHealthRow;
import com.opsdata.reconciliation.domain.ProductionRecordEntity;
import com.opsdata.reconciliation.domain.QualityInspectionRecordEntity;
import com.opsdata.reconciliation.repository.ProductionRecordRepository;
import com.opsdata.reconciliation.repository.QualityInspectionRecordRepository;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Service;

@Service
public class ReportingService {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final String UNSPECIFIED = "Unspecified";

    private final ProductionRecordRepository productionRecordRepository;
    private final QualityInspectionRecordRepository qualityRecordRepository;

    public ReportingService(
        ProductionRecordRepository productionRecordRepository,
        QualityInspectionRecordRepository qualityRecordRepository
    ) {
        this.productionRecordRepository = productionRecordRepository;
        this.qualityRecordRepository = qualityRecordRepository;
    }

    public List<ProductionHealthRow> productionHealth(LocalDate from, LocalDate to, int topN) {
        Map<String, LineWeek> groups = new LinkedHashMap<>();
        for (ProductionRecordEntity record : productionRecordRepository.findWithLotProducedBetween(from, to)) {
            LocalDate week = weekStart(record.getLot().getProductionDate());
            String line = record.getProductionLineId().isEmpty() ? UNSPECIFIED : record.getProductionLineId();
            groups.computeIfAbsent(line + "|" + week, k -> new LineWeek(line, week)).add(record);
        }
        return groups.values().stream()
            .map(LineWeek::toRow)
            .sorted(Comparator.comparing(ProductionHealthRow::errorRatePercent).reversed()
                .thenComparing(ProductionHealthRow::weekStart, Comparator.reverseOrder())
                .thenComparing(ProductionHealthRow::productionLineId))
            .limit(Math.max(1, topN))
            .toList();
    }

    public List<DefectTrendRow> defectTrending(LocalDate from, LocalDate to) {
        Map<String, DefectWeek> groups = new LinkedHashMap<>();
        for (QualityInspectionRecordEntity record : qualityRecordRepository.findByInspectionDateBetween(from, to)) {
            LocalDate week = weekStart(record.getInspectionDate());
            String type = record.getDefectType() == null ? UNSPECIFIED : record.getDefectType();
            groups.computeIfAbsent(type + "|" + week, k -> new DefectWeek(type, week)).add(record);
        }
        return groups.values().stream()
            .map(DefectWeek::toRow)
            .sorted(Comparator.comparing(DefectTrendRow::weekStart).reversed()
                .thenComparing(Comparator.comparingLong(DefectTrendRow::totalDefects).reversed())
                .thenComparing(DefectTrendRow::defectType))
            .toList();
    }

    static LocalDate weekStart(LocalDate date) {
        return date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
    }

    static BigDecimal percent(long part, long whole) {
        if (whole == 0) {
            return BigDecimal.ZERO.setScale(2);
        }
        return BigDecimal.valueOf(part).multiply(HUNDRED).divide(BigDecimal.valueOf(whole), 2, RoundingMode.HALF_UP);
    }

    private static final class LineWeek {

        private final String line;
        private final LocalDate week;
        private final Set<Long> lots = new HashSet<>();
        private long units;
        private long downtime;
        private long issues;

        LineWeek(String line, LocalDate week) {
            this.line = line;
            this.week = week;
        }

        void add(ProductionRecordEntity record) {
            lots.add(record.getLot().getId());
            units += record.getUnitsActual();
            downtime += record.getDowntimeMinutes();
            if (record.hasLineIssue()) {
                issues++;
            }
        }

        ProductionHealthRow toRow() {
            return new ProductionHealthRow(line, week, lots.size(), units, downtime, issues, percent(issues, lots.size()));
        }
    }

    private static final class DefectWeek {

        private final String type;
        private final LocalDate week;
        private final Set<Long> lots = new HashSet<>();
        private final List<Boolean> outcomes = new ArrayList<>();
        private long defects;

        DefectWeek(String type, LocalDate week) {
            this.type = type;
            this.week = week;
        }

        void add(QualityInspectionRecordEntity record) {
            lots.add(record.getLot().getId());
            defects += record.getDefectCount();
            outcomes.add(record.isPass());
        }

        DefectTrendRow toRow() {
            long failed = outcomes.stream().filter(pass -> !pass).count();
            return new DefectTrendRow(type, week, lots.size(), defects, failed, percent(failed, outcomes.size()));
        }
    }
}
