package com.opsdata.reconciliation.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "reconciliation_runs")
public class ReconciliationRunEntity {

    @Id
    @Column(name = "run_id", nullable = false, updatable = false)
    private UUID runId;

    @Enumerated(EnumType.STRING)
    @Column(name = "run_trigger", nullable = false, length = 20)
    private RunTrigger trigger;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private RunStatus status;

    @Column(name = "rows_read", nullable = false)
    private int rowsRead;

    @Column(name = "rows_ingested", nullable = false)
    private int rowsIngested;

    @Column(name = "rows_skipped", nullable = false)
    private int rowsSkipped;

    @Column(name = "row_errors", nullable = false)
    private int rowErrors;

    @Column(name = "flags_created", nullable = false)
    private int flagsCreated;

    @Column(name = "flags_skipped", nullable = false)
    private int flagsSkipped;

    @Column(name = "rule_errors", nullable = false)
    private int ruleErrors;

    @Column(name = "error_summary", length = 400)
    private String errorSummary;

    public static ReconciliationRunEntity startNew(RunTrigger trigger) {
        ReconciliationRunEntity run = new ReconciliationRunEntity();
        run.runId = UUID.randomUUID();
        run.trigger = trigger;
        run.startedAt = Instant.now();
        run.status = RunStatus.RUNNING;
        return run;
    }

    public void record(IngestionResult result) {
        this.rowsRead += result.rowsRead();
        this.rowsIngested += result.rowsIngested();
        this.rowsSkipped += result.rowsSkipped();
        this.rowErrors += result.errors().size();
    }

    public void record(ValidationResult result) {
        this.flagsCreated += result.flagsCreated();
        this.flagsSkipped += result.flagsSkipped();
        this.ruleErrors += result.errors().size();
    }

    public void complete() {
        this.completedAt = Instant.now();
        this.status = rowErrors > 0 || ruleErrors > 0 ? RunStatus.PARTIAL_SUCCESS : RunStatus.SUCCEEDED;
    }

    public void fail(String errorSummary) {
        this.completedAt = Instant.now();
        this.status = RunStatus.FAILED;
        this.errorSummary = errorSummary;
    }

    public UUID getRunId() {
        return runId;
    }

    public RunTrigger getTrigger() {
        return trigger;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public RunStatus getStatus() {
        return status;
    }

    public int getRowsRead() {
        return rowsRead;
    }

    public int getRowsIngested() {
        return rowsIngested;
    }

    public int getRowsSkipped() {
        return rowsSkipped;
    }

    public int getRowErrors() {
        return rowErrors;
    }

    public int getFlagsCreated() {
        return flagsCreated;
    }

    public int getFlagsSkipped() {
        return flagsSkipped;
    }

    public int getRuleErrors() {
        return ruleErrors;
    }

    public String getErrorSummary() {
        return errorSummary;
    }
}
