package com.opsdata.reconciliation.domain;

import java.util.List;

public record IngestionResult(
    String source,
    int rowsRead,
    int rowsIngested,
    int rowsSkipped,
    List<RowError> errors
) {

    public IngestionResult {
        errors = List.copyOf(errors);
    }

    public static IngestionResult unreadable(String source, RowError error) {
        return new IngestionResult(source, 0, 0, 0, List.of(error));
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public boolean failedEntirely() {
        boolean readFailed = rowsRead == 0 && errors.stream().anyMatch(e -> e.code() == FailureCode.SOURCE_READ);
        return readFailed || (rowsRead > 0 && errors.size() >= rowsRead);
    }
}
