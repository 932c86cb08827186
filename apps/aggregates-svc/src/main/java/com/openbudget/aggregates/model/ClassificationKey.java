package com.openbudget.aggregates.model;

import java.util.Comparator;

public record ClassificationKey(String functionalCode, String economicCode) {

    public static final Comparator<ClassificationKey> ORDER = Comparator
            .comparing(ClassificationKey::functionalCode, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(ClassificationKey::economicCode, Comparator.nullsFirst(Comparator.naturalOrder()));
}
