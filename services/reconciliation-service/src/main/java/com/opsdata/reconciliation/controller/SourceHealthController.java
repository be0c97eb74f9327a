package com.opsdata.reconciliation.controller;

import com.opsdata.reconciliation.config.ReconciliationProperties;
import com.opsdata.reconciliation.domain.SourceHealth;
import com.opsdata.reconciliation.service.SourceHealthMonitor;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/sources")
public class SourceHealthController {

    private final SourceHealthMonitor sourceHealthMonitor;
    private final ReconciliationProperties properties;

    public SourceHealthController(SourceHealthMonitor sourceHealthMonitor, ReconciliationProperties properties) {
        this.sourceHealthMonitor = sourceHealthMonitor;
        this.properties = properties;
    }

    @GetMapping("/health")
    public List<SourceHealth> health(@RequestParam(required = false) Integer staleThresholdHours) {
        int threshold = staleThresholdHours == null ? properties.getStaleThresholdHours() : staleThresholdHours;
        if (threshold < 1) {
            throw new IllegalArgumentException("staleThresholdHours must be at least 1");
        }
        return sourceHealthMonitor.checkHealth(threshold);
    }
}
