package com.opsdata.reconciliation.service;

import com.opsdata.reconciliation.domain.SourceHealth;
import com.opsdata.reconciliation.domain.SourceHealthStatus;
import com.opsdata.reconciliation.domain.SourceKind;
import com.opsdata.reconciliation.domain.SourceMetadataEntity;
import com.opsdata.reconciliation.repository.SourceMetadataRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

@Service
public class SourceHealthMonitor {

    private static final Logger LOGGER = LoggerFactory.getLogger(SourceHealthMonitor.class);

    private final SourceMetadataRepository sourceMetadataRepository;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public SourceHealthMonitor(
        SourceMetadataRepository sourceMetadataRepository,
        TransactionTemplate unitTransactionTemplate,
        Clock clock
    ) {
        this.sourceMetadataRepository = sourceMetadataRepository;
        this.transactionTemplate = unitTransactionTemplate;
        this.clock = clock;
    }

    public void recordAttempt(SourceKind kind, String location, String format, SourceHealthStatus status) {
        Instant now = clock.instant();
        transactionTemplate.executeWithoutResult(tx -> {
            int inserted = sourceMetadataRepository.insertIfAbsent(kind.sourceName(), location, format, now, status.name());
            if (inserted == 0) {
                sourceMetadataRepository.updateBySourceName(kind.sourceName(), location, format, now, status);
            }
        });
        LOGGER.info("Source {} marked {}", kind.sourceName(), status.label());
    }

    public List<SourceHealth> checkHealth(int staleThresholdHours) {
        Duration threshold = Duration.ofHours(staleThresholdHours);
        Instant now = clock.instant();
        return sourceMetadataRepository.findAllByOrderBySourceNameAsc().stream()
            .map(metadata -> assess(metadata, threshold, now))
            .toList();
    }

    public static SourceHealth assess(SourceMetadataEntity metadata, Duration threshold, Instant now) {
        return assess(metadata.getSourceName(), metadata.getLastUpdated(), metadata.getRefreshStatus(),
            metadata.getSourceLocation(), metadata.getFileFormat(), threshold, now);
    }

    public static SourceHealth assess(
        String sourceName,
        Instant lastUpdated,
        SourceHealthStatus storedStatus,
        String sourceLocation,
        String fileFormat,
        Duration threshold,
        Instant now
    ) {
        Duration age = Duration.between(lastUpdated, now);
        SourceHealthStatus status = age.compareTo(threshold) > 0 ? SourceHealthStatus.STALE : storedStatus;
        return new SourceHealth(sourceName, lastUpdated, status, age.toMinutes(), sourceLocation, fileFormat);
    }
}
