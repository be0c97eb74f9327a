package com.opsdata.reconciliation.domain;

import java.time.LocalDate;

public record ShippingRecord(
    LocalDate shipDate,
    String destination,
    String carrier,
    int qtyShipped,
    String shipmentStatus
) {
}
