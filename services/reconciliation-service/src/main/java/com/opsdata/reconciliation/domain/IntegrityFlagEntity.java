package com.opsdata.reconciliation.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;

@Entity
@Table(
    name = "data_integrity_flags",
    uniqueConstraints = @UniqueConstraint(name = "uk_flags_open_key", columnNames = "open_key"),
    indexes = {
        @Index(name = "idx_flags_lot_id", columnList = "lot_id"),
        @Index(name = "idx_flags_resolved", columnList = "is_resolved")
    }
)
public class IntegrityFlagEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "lot_id", nullable = false)
    private LotEntity lot;

    @Enumerated(EnumType.STRING)
    @Column(name = "flag_type", nullable = false, length = 30)
    private FlagType flagType;

    @Enumerated(EnumType.STRING)
    @Column(name = "severity", nullable = false, length = 20)
    private FlagSeverity severity;

    @Column(name = "description", nullable = false, length = 500)
    private String description;

    @Column(name = "is_resolved", nullable = false)
    private boolean resolved;

    // lotId:TYPE while unresolved, null once resolved; the unique index allows one open flag per lot and type.
    @Column(name = "open_key", length = 64)
    private String openKey;

    @Column(name = "detected_at", nullable = false)
    private Instant detectedAt;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    protected IntegrityFlagEntity() {
    }

    public static String openKey(long lotId, FlagType type) {
        return lotId + ":" + type.name();
    }

    public void resolve(Instant at) {
        this.resolved = true;
        this.openKey = null;
        this.resolvedAt = at;
    }

    public Long getId() {
        return id;
    }

    public LotEntity getLot() {
        return lot;
    }

    public FlagType getFlagType() {
        return flagType;
    }

    public FlagSeverity getSeverity() {
        return severity;
    }

    public String getDescription() {
        return description;
    }

    public boolean isResolved() {
        return resolved;
    }

    public Instant getDetectedAt() {
        return detectedAt;
    }

    public Instant getResolvedAt() {
        return resolvedAt;
    }
}
