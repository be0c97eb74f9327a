package com.opsdata.reconciliation.controller;

import com.opsdata.reconciliation.domain.FlagSummaryRow;
import com.opsdata.reconciliation.domain.FlagView;
import com.opsdata.reconciliation.service.IntegrityFlagService;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/integrity")
public class IntegrityController {

    private final IntegrityFlagService integrityFlagService;

    public IntegrityController(IntegrityFlagService integrityFlagService) {
        this.integrityFlagService = integrityFlagService;
    }

    @GetMapping("/flags")
    public List<FlagView> flags() {
        return integrityFlagService.listUnresolved();
    }

    @GetMapping("/summary")
    public List<FlagSummaryRow> summary() {
        return integrityFlagService.summary();
    }

    @PostMapping("/flags/{flagId}/resolve")
    public FlagView resolve(@PathVariable Long flagId) {
        return integrityFlagService.resolve(flagId);
    }
}
