package com.openbudget.aggregates.normalization;

/**
 * Source of frequency-matched normalization factors. Implementations may throw when the
 * underlying datasets cannot be read; callers convert that into a typed failure.
 */
public interface FactorProvider {

    FactorBundle generateFactors(Frequency frequency, int startYear, int endYear);
}
