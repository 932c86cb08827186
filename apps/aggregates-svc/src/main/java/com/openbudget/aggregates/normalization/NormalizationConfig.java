package com.openbudget.aggregates.normalization;

import java.util.Locale;

/**
 * Requested normalization: scaling mode, target currency and inflation adjustment.
 * {@link Mode#PERCENT_GDP} ignores both currency and inflation adjustment.
 */
public record NormalizationConfig(Mode mode, Currency currency, boolean inflationAdjusted) {

    public static final NormalizationConfig NONE = new NormalizationConfig(Mode.TOTAL, Currency.RON, false);

    public NormalizationConfig {
        mode = mode == null ? Mode.TOTAL : mode;
        currency = currency == null ? Currency.RON : currency;
    }

    public enum Mode {
        TOTAL,
        PER_CAPITA,
        PERCENT_GDP
    }

    public enum Currency {
        RON,
        EUR,
        USD;

        public static Currency fromValue(String value) {
            if (value == null || value.isBlank()) {
                return null;
            }
            try {
                return Currency.valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException ex) {
                throw new IllegalArgumentException("Unsupported currency: " + value);
            }
        }
    }

    /**
     * Whether any per-period factor has to be applied. When false no factor data is needed at all.
     */
    public boolean requiresTransform() {
        return inflationAdjusted || currency != Currency.RON || mode != Mode.TOTAL;
    }

    /**
     * Resolves request input, including the legacy {@code total_euro} and {@code per_capita_euro}
     * modes. An explicit currency overrides the legacy one; {@code percent_gdp} always resolves to RON.
     */
    public static NormalizationConfig resolve(String normalization, String currency, Boolean inflationAdjusted) {
        String requested = normalization == null ? "total" : normalization.trim().toLowerCase(Locale.ROOT);
        Mode mode;
        Currency legacyCurrency = Currency.RON;
        switch (requested) {
            case "", "total" -> mode = Mode.TOTAL;
            case "total_euro" -> {
                mode = Mode.TOTAL;
                legacyCurrency = Currency.EUR;
            }
            case "per_capita" -> mode = Mode.PER_CAPITA;
            case "per_capita_euro" -> {
                mode = Mode.PER_CAPITA;
                legacyCurrency = Currency.EUR;
            }
            case "percent_gdp" -> mode = Mode.PERCENT_GDP;
            default -> throw new IllegalArgumentException("Unsupported normalization: " + normalization);
        }
        Currency explicit = Currency.fromValue(currency);
        Currency resolved = mode == Mode.PERCENT_GDP ? Currency.RON : (explicit != null ? explicit : legacyCurrency);
        return new NormalizationConfig(mode, resolved, Boolean.TRUE.equals(inflationAdjusted));
    }
}
