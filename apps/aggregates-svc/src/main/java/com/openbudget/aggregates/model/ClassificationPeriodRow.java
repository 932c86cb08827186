package com.openbudget.aggregates.model;

import java.math.BigDecimal;

/**
 * Raw amount for one (functional, economic, year) group, in nominal RON. Negative amounts are
 * valid corrections.
 */
public record ClassificationPeriodRow(
        String functionalCode,
        String functionalName,
        String economicCode,
        String economicName,
        int year,
        BigDecimal amount,
        long count
) {
    public static final String UNKNOWN_ECONOMIC_CODE = "00.00.00";
    public static final String UNKNOWN_ECONOMIC_NAME = "Unknown economic classification";

    public ClassificationPeriodRow {
        economicCode = economicCode == null ? UNKNOWN_ECONOMIC_CODE : economicCode;
        economicName = economicName == null ? UNKNOWN_ECONOMIC_NAME : economicName;
        amount = amount == null ? BigDecimal.ZERO : amount;
    }

    public ClassificationKey key() {
        return new ClassificationKey(functionalCode, economicCode);
    }
}
