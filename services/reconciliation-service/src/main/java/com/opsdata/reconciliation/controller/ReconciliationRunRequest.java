package com.opsdata.reconciliation.controller;

import com.opsdata.reconciliation.domain.SourceKind;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public record ReconciliationRunRequest(
    List<Map<String, Object>> production,
    List<Map<String, Object>> quality,
    List<Map<String, Object>> shipping
) {

    public Map<SourceKind, List<Map<String, Object>>> inlineRows() {
        Map<SourceKind, List<Map<String, Object>>> rows = new EnumMap<>(SourceKind.class);
        if (production != null) {
            rows.put(SourceKind.PRODUCTION, production);
        }
        if (quality != null) {
            rows.put(SourceKind.QUALITY, quality);
        }
        if (shipping != null) {
            rows.put(SourceKind.SHIPPING, shipping);
        }
        return rows;
    }
}
