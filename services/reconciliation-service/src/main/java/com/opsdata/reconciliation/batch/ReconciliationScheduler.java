package com.opsdata.reconciliation.batch;

import com.opsdata.reconciliation.config.ReconciliationProperties;
import com.opsdata.reconciliation.domain.ReconciliationReport;
import com.opsdata.reconciliation.domain.RunTrigger;
import com.opsdata.reconciliation.service.ReconciliationJobService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class ReconciliationScheduler {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReconciliationScheduler.class);

    private final ReconciliationProperties properties;
    private final ReconciliationJobService reconciliationJobService;

    public ReconciliationScheduler(ReconciliationProperties properties, ReconciliationJobService reconciliationJobService) {
        this.properties = properties;
        this.reconciliationJobService = reconciliationJobService;
    }

    @Scheduled(
        fixedDelayString = "${reconciliation.scheduler-fixed-delay-ms:86400000}",
        initialDelayString = "${reconciliation.scheduler-fixed-delay-ms:86400000}"
    )
    public void runScheduledRefresh() {
        if (!properties.isSchedulerEnabled()) {
            return;
        }
        LOGGER.info("Running scheduled reconciliation");
        try {
            ReconciliationReport report = reconciliationJobService.runFullRefresh(RunTrigger.SCHEDULED);
            LOGGER.info("Scheduled reconciliation {} finished {}", report.runId(), report.status());
        } catch (RuntimeException ex) {
            LOGGER.error("Scheduled reconciliation failed: {}", ex.getMessage());
        }
    }
}
