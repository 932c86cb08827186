package com.openbudget.aggregates.model;

public record AggregatedLineItem(
        String functionalCode,
        String functionalName,
        String economicCode,
        String economicName,
        double amount,
        long count
) {
}
