package com.opsdata.reconciliation.controller;

import com.opsdata.reconciliation.domain.DefectTrendRow;
import com.opsdata.reconciliation.domain.ProductionHealthRow;
import com.opsdata.reconciliation.service.ReportingService;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/reports")
public class ReportsController {

    private static final int DEFAULT_WEEKS = 4;

    private final ReportingService reportingService;
    private final Clock clock;

    public ReportsController(ReportingService reportingService, Clock clock) {
        this.reportingService = reportingService;
        this.clock = clock;
    }

    @GetMapping("/production-health")
    public List<ProductionHealthRow> productionHealth(
        @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
        @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
        @RequestParam(defaultValue = "10") int topN
    ) {
        LocalDate end = to == null ? LocalDate.now(clock) : to;
        LocalDate start = from == null ? end.minusWeeks(DEFAULT_WEEKS) : from;
        requireOrdered(start, end);
        return reportingService.productionHealth(start, end, Math.max(1, Math.min(topN, 100)));
    }

    @GetMapping("/defect-trending")
    public List<DefectTrendRow> defectTrending(
        @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
        @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to
    ) {
        LocalDate end = to == null ? LocalDate.now(clock) : to;
        LocalDate start = from == null ? end.minusWeeks(DEFAULT_WEEKS) : from;
        requireOrdered(start, end);
        return reportingService.defectTrending(start, end);
    }

    private void requireOrdered(LocalDate from, LocalDate to) {
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("from must not be after to");
        }
    }
}
