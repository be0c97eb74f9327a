package com.opsdata.reconciliation.domain;

import java.time.Instant;

public record SourceHealth(
    String sourceName,
    Instant lastUpdated,
    SourceHealthStatus status,
    long minutesSinceUpdate,
    String sourceLocation,
    String fileFormat
) {
}
