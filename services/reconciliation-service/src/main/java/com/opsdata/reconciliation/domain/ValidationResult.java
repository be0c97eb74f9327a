package com.opsdata.reconciliation.domain;

import java.util.List;

public record ValidationResult(
    String ruleName,
    int flagsCreated,
    int flagsSkipped,
    int lotsUpdated,
    List<String> errors
) {

    public ValidationResult {
        errors = List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
