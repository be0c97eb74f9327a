package com.opsdata.reconciliation.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.time.LocalDate;

@Entity
@Table(
    name = "lots",
    uniqueConstraints = @UniqueConstraint(name = "uk_lots_code_date", columnNames = {"lot_code", "production_date"}),
    indexes = {
        @Index(name = "idx_lots_lot_code", columnList = "lot_code"),
        @Index(name = "idx_lots_production_date", columnList = "production_date")
    }
)
public class LotEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "lot_code", nullable = false, updatable = false, length = 50)
    private String lotCode;

    @Column(name = "production_date", nullable = false, updatable = false)
    private LocalDate productionDate;

    @Column(name = "is_pending_inspection", nullable = false)
    private boolean pendingInspection = true;

    @Column(name = "has_data_integrity_issue", nullable = false)
    private boolean integrityIssue;

    @Column(name = "has_date_conflict", nullable = false)
    private boolean dateConflict;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected LotEntity() {
    }

    public Long getId() {
        return id;
    }

    public String getLotCode() {
        return lotCode;
    }

    public LocalDate getProductionDate() {
        return productionDate;
    }

    public boolean isPendingInspection() {
        return pendingInspection;
    }

    public boolean hasIntegrityIssue() {
        return integrityIssue;
    }

    public boolean hasDateConflict() {
        return dateConflict;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
