package com.opsdata.reconciliation.domain;

public record RowError(int rowNumber, FailureCode code, String message) {
}
