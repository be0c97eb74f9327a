package com.opsdata.reconciliation.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "reconciliation_failures", indexes = @Index(name = "idx_failures_run_id", columnList = "run_id"))
public class RunFailureEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "run_id", nullable = false)
    private UUID runId;

    @Column(name = "scope", nullable = false, length = 50)
    private String scope;

    @Column(name = "source_row")
    private Integer rowNumber;

    @Enumerated(EnumType.STRING)
    @Column(name = "failure_code", nullable = false, length = 30)
    private FailureCode failureCode;

    @Column(name = "failure_reason", nullable = false, length = 400)
    private String failureReason;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    public static RunFailureEntity of(UUID runId, String scope, Integer rowNumber, FailureCode code, String reason) {
        RunFailureEntity entity = new RunFailureEntity();
        entity.id = UUID.randomUUID();
        entity.runId = runId;
        entity.scope = scope;
        entity.rowNumber = rowNumber;
        entity.failureCode = code;
        entity.failureReason = reason;
        entity.createdAt = Instant.now();
        return entity;
    }

    public UUID getId() {
        return id;
    }

    public UUID getRunId() {
        return runId;
    }

    public String getScope() {
        return scope;
    }

    public Integer getRowNumber() {
        return rowNumber;
    }

    public FailureCode getFailureCode() {
        return failureCode;
    }

    public String getFailureReason() {
        return failureReason;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
