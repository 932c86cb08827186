package com.openbudget.aggregates.model;

import java.math.BigDecimal;
import java.util.Comparator;

/**
 * Running total for one classification while rows are being folded in. Read-only once
 * aggregation has finished.
 */
public final class AggregatedClassification {

    /**
     * Normalized amount descending, then classification codes ascending.
     */
    public static final Comparator<AggregatedClassification> BY_AMOUNT_DESC = Comparator
            .comparing(AggregatedClassification::amount, Comparator.reverseOrder())
            .thenComparing(AggregatedClassification::key, ClassificationKey.ORDER);

    private final ClassificationKey key;
    private final String functionalName;
    private final String economicName;
    private BigDecimal amount;
    private long count;

    public AggregatedClassification(ClassificationKey key, String functionalName, String economicName, BigDecimal amount, long count) {
        this.key = key;
        this.functionalName = functionalName;
        this.economicName = economicName;
        this.amount = amount;
        this.count = count;
    }

    public static AggregatedClassification startFrom(ClassificationPeriodRow row, BigDecimal normalizedAmount) {
        return new AggregatedClassification(row.key(), row.functionalName(), row.economicName(), normalizedAmount, row.count());
    }

    public void add(BigDecimal normalizedAmount, long rowCount) {
        amount = amount.add(normalizedAmount);
        count += rowCount;
    }

    public ClassificationKey key() {
        return key;
    }

    public String functionalCode() {
        return key.functionalCode();
    }

    public String economicCode() {
        return key.economicCode();
    }

    public String functionalName() {
        return functionalName;
    }

    public String economicName() {
        return economicName;
    }

    public BigDecimal amount() {
        return amount;
    }

    public long count() {
        return count;
    }

    public AggregatedLineItem toLineItem() {
        return new AggregatedLineItem(key.functionalCode(), functionalName, key.economicCode(), economicName, amount.doubleValue(), count);
    }
}
