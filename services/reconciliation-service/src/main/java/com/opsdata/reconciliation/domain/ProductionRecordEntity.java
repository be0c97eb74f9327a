package com.opsdata.reconciliation.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Objects;

@Entity
@Table(name = "production_records", indexes = @Index(name = "idx_production_lot_id", columnList = "lot_id"))
public class ProductionRecordEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "lot_id", nullable = false)
    private LotEntity lot;

    @Column(name = "production_line_id", nullable = false, length = 20)
    private String productionLineId;

    @Column(name = "shift", nullable = false, length = 20)
    private String shift;

    @Column(name = "units_planned", nullable = false)
    private int unitsPlanned;

    @Column(name = "units_actual", nullable = false)
    private int unitsActual;

    @Column(name = "downtime_minutes", nullable = false)
    private int downtimeMinutes;

    @Column(name = "has_line_issue", nullable = false)
    private boolean lineIssue;

    @Column(name = "source_updated_at", nullable = false)
    private Instant sourceUpdatedAt;

    public static ProductionRecordEntity fromRecord(LotEntity lot, ProductionRecord record, Instant sourceUpdatedAt) {
        ProductionRecordEntity entity = new ProductionRecordEntity();
        entity.lot = lot;
        entity.productionLineId = record.productionLineId();
        entity.shift = record.shift();
        entity.unitsPlanned = record.unitsPlanned();
        entity.unitsActual = record.unitsActual();
        entity.downtimeMinutes = record.downtimeMinutes();
        entity.lineIssue = record.lineIssue();
        entity.sourceUpdatedAt = sourceUpdatedAt;
        return entity;
    }

    public boolean matches(ProductionRecord record) {
        return Objects.equals(productionLineId, record.productionLineId())
            && Objects.equals(shift, record.shift())
            && unitsPlanned == record.unitsPlanned()
            && unitsActual == record.unitsActual()
            && downtimeMinutes == record.downtimeMinutes()
            && lineIssue == record.lineIssue();
    }

    public ProductionRecord toRecord() {
        return new ProductionRecord(productionLineId, shift, unitsPlanned, unitsActual, downtimeMinutes, lineIssue);
    }

    public Long getId() {
        return id;
    }

    public LotEntity getLot() {
        return lot;
    }

    public String getProductionLineId() {
        return productionLineId;
    }

    public String getShift() {
        return shift;
    }

    public int getUnitsPlanned() {
        return unitsPlanned;
    }

    public int getUnitsActual() {
        return unitsActual;
    }

    public int getDowntimeMinutes() {
        return downtimeMinutes;
    }

    public boolean hasLineIssue() {
        return lineIssue;
    }

    public Instant getSourceUpdatedAt() {
        return sourceUpdatedAt;
    }
}
