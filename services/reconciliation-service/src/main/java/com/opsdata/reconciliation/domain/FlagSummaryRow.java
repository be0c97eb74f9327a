package com.opsdata.reconciliation.domain;

import java.time.Instant;

public record FlagSummaryRow(String flagType, String severity, long count, Instant latestDetected) {
}
