package com.opsdata.reconciliation.normalize;

import java.util.List;
import java.util.Locale;

public enum SourceField {
    LOT_CODE("Lot ID", "LotCode", "Lot Code", "Lot"),
    PRODUCTION_LOT_DATE("Production Date", "Date"),
    QUALITY_LOT_DATE("Production Date", "Lot Date", "Inspection Date", "Date"),
    SHIPPING_LOT_DATE("Production Date", "Lot Date", "Ship Date", "Date"),

    PRODUCTION_LINE("Production Line", "Line", "Line ID"),
    SHIFT("Shift"),
    UNITS_PLANNED("Units Planned", "Planned"),
    UNITS_ACTUAL("Units Actual", "Actual"),
    DOWNTIME_MINUTES("Downtime Minutes", "Downtime"),
    LINE_ISSUE("Line Issue", "Has Issue"),

    INSPECTION_DATE("Inspection Date", "Date"),
    PASS("Is Pass", "Pass", "Result"),
    DEFECT_TYPE("Defect Type"),
    DEFECT_COUNT("Defect Count", "Defects"),
    INSPECTOR_ID("Inspector ID", "Inspector"),

    SHIP_DATE("Ship Date", "Date"),
    DESTINATION("Destination State", "Destination", "State"),
    CARRIER("Carrier"),
    QTY_SHIPPED("Qty Shipped", "Quantity Shipped", "Quantity"),
    SHIPMENT_STATUS("Shipment Status", "Status");

    private final List<String> aliases;

    SourceField(String... aliases) {
        this.aliases = List.of(aliases);
    }

    public List<String> aliases() {
        return aliases;
    }

    static String headerKey(String header) {
        return header == null ? "" : header.replaceAll("[\\s_\\-]", "").toLowerCase(Locale.ROOT);
    }
}
