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
import java.time.LocalDate;
import java.util.Objects;

@Entity
@Table(
    name = "quality_inspection_records",
    indexes = {
        @Index(name = "idx_quality_lot_id", columnList = "lot_id"),
        @Index(name = "idx_quality_inspection_date", columnList = "inspection_date")
    }
)
public class QualityInspectionRecordEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "lot_id", nullable = false)
    private LotEntity lot;

    @Column(name = "inspection_date", nullable = false)
    private LocalDate inspectionDate;

    @Column(name = "is_pass", nullable = false)
    private boolean pass;

    @Column(name = "defect_type", length = 50)
    private String defectType;

    @Column(name = "defect_count", nullable = false)
    private int defectCount;

    @Column(name = "inspector_id", nullable = false, length = 50)
    private String inspectorId;

    @Column(name = "source_updated_at", nullable = false)
    private Instant sourceUpdatedAt;

    public static QualityInspectionRecordEntity fromRecord(LotEntity lot, QualityRecord record, Instant sourceUpdatedAt) {
        QualityInspectionRecordEntity entity = new QualityInspectionRecordEntity();
        entity.lot = lot;
        entity.inspectionDate = record.inspectionDate();
        entity.pass = record.pass();
        entity.defectType = record.defectType();
        entity.defectCount = record.defectCount();
        entity.inspectorId = record.inspectorId();
        entity.sourceUpdatedAt = sourceUpdatedAt;
        return entity;
    }

    public boolean matches(QualityRecord record) {
        return Objects.equals(inspectionDate, record.inspectionDate())
            && pass == record.pass()
            && Objects.equals(defectType, record.defectType())
            && defectCount == record.defectCount()
            && Objects.equals(inspectorId, record.inspectorId());
    }

    public QualityRecord toRecord() {
        return new QualityRecord(inspectionDate, pass, defectType, defectCount, inspectorId);
    }

    public Long getId() {
        return id;
    }

    public LotEntity getLot() {
        return lot;
    }

    public LocalDate getInspectionDate() {
        return inspectionDate;
    }

    public boolean isPass() {
        return pass;
    }

    public String getDefectType() {
        return defectType;
    }

    public int getDefectCount() {
        return defectCount;
    }

    public String getInspectorId() {
        return inspectorId;
    }

    public Instant getSourceUpdatedAt() {
        return sourceUpdatedAt;
    }
}
