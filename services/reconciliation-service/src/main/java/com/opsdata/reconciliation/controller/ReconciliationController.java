package com.opsdata.reconciliation.controller;

import com.opsdata.reconciliation.domain.ReconciliationReport;
import com.opsdata.reconciliation.domain.ReconciliationRunEntity;
import com.opsdata.reconciliation.domain.RunTrigger;
import com.opsdata.reconciliation.domain.ValidationResult;
import com.opsdata.reconciliation.exception.ResourceNotFoundException;
import com.opsdata.reconciliation.service.ReconciliationJobService;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ReconciliationController {

    private final ReconciliationJobService reconciliationJobService;

    public ReconciliationController(ReconciliationJobService reconciliationJobService) {
        this.reconciliationJobService = reconciliationJobService;
    }

    @PostMapping("/v1/reconciliation/run")
    public ResponseEntity<ReconciliationReport> run(@RequestBody(required = false) ReconciliationRunRequest request) {
        ReconciliationReport report = request == null
            ? reconciliationJobService.runFullRefresh(RunTrigger.MANUAL)
            : reconciliationJobService.runFullRefresh(RunTrigger.MANUAL, request.inlineRows());
        return ResponseEntity.accepted().body(report);
    }

    @GetMapping("/v1/reconciliation/runs/{runId}")
    public ReconciliationRunResponse getRun(@PathVariable UUID runId) {
        ReconciliationRunEntity run = reconciliationJobService.getRun(runId)
            .orElseThrow(() -> new ResourceNotFoundException("Run not found: " + runId));
        return ReconciliationRunResponse.from(run, reconciliationJobService.getRunFailures(runId));
    }

    @PostMapping("/v1/validation/run")
    public Map<String, List<ValidationResult>> validate() {
        return Map.of("results", reconciliationJobService.runValidation());
    }
}
