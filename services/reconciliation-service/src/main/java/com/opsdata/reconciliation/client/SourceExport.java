package com.opsdata.reconciliation.client;

import java.util.List;
import java.util.Map;

public record SourceExport(List<Map<String, Object>> rows, String location, String format) {

    public SourceExport {
        rows = List.copyOf(rows);
    }

    public static SourceExport empty(String location, String format) {
        return new SourceExport(List.of(), location, format);
    }
}
