package com.opsdata.reconciliation.service;

import com.opsdata.reconciliation.domain.LotEntity;
import com.opsdata.reconciliation.domain.QualityRecord;
import com.opsdata.reconciliation.domain.ShippingRecord;

public final class LotStatusDeriver {

    public static final String DATA_CONFLICT = "DataConflict";
    public static final String FAILED_QUALITY = "FailedQuality";
    public static final String PASSED_QUALITY = "PassedQuality";
    public static final String PENDING_INSPECTION = "PendingInspection";
    public static final String IN_PRODUCTION = "InProduction";

    private LotStatusDeriver() {
    }

    public static String deriveStatus(LotEntity lot, QualityRecord latestQuality, ShippingRecord shipping) {
        return deriveStatus(lot.hasDateConflict(), lot.isPendingInspection(), latestQuality, shipping);
    }

    public static String deriveStatus(
        boolean hasDateConflict,
        boolean pendingInspection,
        QualityRecord latestQuality,
        ShippingRecord shipping
    ) {
        if (hasDateConflict) {
            return DATA_CONFLICT;
        }
        if (shipping != null) {
            return shipping.shipmentStatus();
        }
        if (latestQuality != null) {
            return latestQuality.pass() ? PASSED_QUALITY : FAILED_QUALITY;
        }
        if (pendingInspection) {
            return PENDING_INSPECTION;
        }
        return IN_PRODUCTION;
    }
}
