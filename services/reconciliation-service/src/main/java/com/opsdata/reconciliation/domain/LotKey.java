package com.opsdata.reconciliation.domain;

import com.opsdata.reconciliation.exception.RowValidationException;
import com.opsdata.reconciliation.normalize.FieldNormalizer;
import java.time.LocalDate;

public record LotKey(String lotCode, LocalDate productionDate) {

    public static LotKey of(Object rawCode, Object rawDate) {
        String lotCode = FieldNormalizer.cleanLotCode(rawCode);
        if (lotCode.isEmpty()) {
            throw new RowValidationException("Missing lot code");
        }
        LocalDate date = FieldNormalizer.canonicalDate(rawDate)
            .orElseThrow(() -> new RowValidationException(rawDate == null
                ? "Missing lot date for lot " + lotCode
                : "Unparseable lot date '" + rawDate + "' for lot " + lotCode));
        return new LotKey(lotCode, date);
    }

    @Override
    public String toString() {
        return lotCode + "@" + productionDate;
    }
}
