package com.opsdata.reconciliation.controller;

import com.opsdata.reconciliation.domain.LotStatusView;
import com.opsdata.reconciliation.service.LotLookupService;
import java.time.LocalDate;
import java.util.List;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/lots")
public class LotController {

    private final LotLookupService lotLookupService;

    public LotController(LotLookupService lotLookupService) {
        this.lotLookupService = lotLookupService;
    }

    @GetMapping("/{lotCode}")
    public List<LotStatusView> lookup(
        @PathVariable String lotCode,
        @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date
    ) {
        if (date != null) {
            return List.of(lotLookupService.lookup(lotCode, date));
        }
        return lotLookupService.lookup(lotCode);
    }

    @GetMapping
    public List<LotStatusView> list(
        @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
        @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
        @RequestParam(required = false) String line,
        @RequestParam(defaultValue = "100") int limit
    ) {
        if (from != null && to != null && from.isAfter(to)) {
            throw new IllegalArgumentException("from must not be after to");
        }
        return lotLookupService.integratedView(from, to, line, limit);
    }
}
