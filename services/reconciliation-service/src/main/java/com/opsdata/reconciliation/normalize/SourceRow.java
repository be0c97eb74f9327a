package com.opsdata.reconciliation.normalize;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

public final class SourceRow {

    private final int rowNumber;
    private final Map<String, Object> raw;
    private final Map<String, Object> byHeaderKey;

    public SourceRow(int rowNumber, Map<String, ?> raw) {
        this.rowNumber = rowNumber;
        this.raw = Collections.unmodifiableMap(new LinkedHashMap<>(raw == null ? Map.of() : raw));
        this.byHeaderKey = new HashMap<>();
        this.raw.forEach((header, value) -> byHeaderKey.putIfAbsent(SourceField.headerKey(header), value));
    }

    public int rowNumber() {
        return rowNumber;
    }

    public Object value(SourceField field) {
        for (String alias : field.aliases()) {
            Object value = byHeaderKey.get(SourceField.headerKey(alias));
            if (value != null && !FieldNormalizer.text(value).isEmpty()) {
                return FieldNormalizer.trim(value);
            }
        }
        return null;
    }

    public String text(SourceField field) {
        return FieldNormalizer.text(value(field));
    }

    public String text(SourceField field, String fallback) {
        return FieldNormalizer.text(value(field), fallback);
    }

    public int integer(SourceField field, int defaultValue) {
        return FieldNormalizer.toInteger(value(field), defaultValue);
    }

    public boolean bool(SourceField field, boolean defaultValue) {
        return FieldNormalizer.toBoolean(value(field), defaultValue);
    }

    @Override
    public String toString() {
        return "row " + rowNumber + " " + raw;
    }
}
