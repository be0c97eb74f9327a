package com.opsdata.reconciliation.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;

@Entity
@Table(
    name = "data_source_metadatas",
    uniqueConstraints = @UniqueConstraint(name = "uk_source_name", columnNames = "source_name")
)
public class SourceMetadataEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "source_name", nullable = false, updatable = false, length = 50)
    private String sourceName;

    @Column(name = "source_location", nullable = false, length = 255)
    private String sourceLocation;

    @Column(name = "file_format", nullable = false, length = 20)
    private String fileFormat;

    @Column(name = "last_updated", nullable = false)
    private Instant lastUpdated;

    @Enumerated(EnumType.STRING)
    @Column(name = "refresh_status", nullable = false, length = 20)
    private SourceHealthStatus refreshStatus;

    protected SourceMetadataEntity() {
    }

    public Long getId() {
        return id;
    }

    public String getSourceName() {
        return sourceName;
    }

    public String getSourceLocation() {
        return sourceLocation;
    }

    public String getFileFormat() {
        return fileFormat;
    }

    public Instant getLastUpdated() {
        return lastUpdated;
    }

    public SourceHealthStatus getRefreshStatus() {
        return refreshStatus;
    }
}
