package com.openbudget.aggregates.normalization;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

/**
 * Period label helpers. Labels are {@code YYYY}, {@code YYYY-QN} or {@code YYYY-MM};
 * they are only comparable through {@link #monthIndex}, {@link #quarterIndex} or the year itself,
 * never as strings.
 */
public final class PeriodLabels {

    private PeriodLabels() {
    }

    public static List<String> generate(int startYear, int endYear, Frequency frequency) {
        List<String> labels = new ArrayList<>();
        for (int year = startYear; year <= endYear; year++) {
            switch (frequency) {
                case MONTH -> {
                    for (int month = 1; month <= 12; month++) {
                        labels.add(monthLabel(year, month));
                    }
                }
                case QUARTER -> {
                    for (int quarter = 1; quarter <= 4; quarter++) {
                        labels.add(quarterLabel(year, quarter));
                    }
                }
                case YEAR -> labels.add(yearLabel(year));
            }
        }
        return labels;
    }

    public static String yearLabel(int year) {
        return String.valueOf(year);
    }

    public static String quarterLabel(int year, int quarter) {
        return year + "-Q" + quarter;
    }

    public static String monthLabel(int year, int month) {
        return String.format("%d-%02d", year, month);
    }

    public static OptionalInt extractYear(String label) {
        if (label == null || label.length() < 4) {
            return OptionalInt.empty();
        }
        for (int i = 0; i < 4; i++) {
            if (!Character.isDigit(label.charAt(i))) {
                return OptionalInt.empty();
            }
        }
        return OptionalInt.of(Integer.parseInt(label.substring(0, 4)));
    }

    /**
     * Chronological index {@code year * 12 + month} of a {@code YYYY-MM} label, empty for anything else.
     */
    public static OptionalInt monthIndex(String label) {
        if (label == null || label.length() != 7 || label.charAt(4) != '-') {
            return OptionalInt.empty();
        }
        OptionalInt year = extractYear(label);
        String monthPart = label.substring(5, 7);
        if (year.isEmpty() || !isDigits(monthPart)) {
            return OptionalInt.empty();
        }
        int month = Integer.parseInt(monthPart);
        if (month < 1 || month > 12) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(year.getAsInt() * 12 + month);
    }

    /**
     * Chronological index {@code year * 4 + quarter} of a {@code YYYY-QN} label, empty for anything else.
     */
    public static OptionalInt quarterIndex(String label) {
        if (label == null || label.length() != 7 || label.charAt(4) != '-' || label.charAt(5) != 'Q') {
            return OptionalInt.empty();
        }
        OptionalInt year = extractYear(label);
        char quarterChar = label.charAt(6);
        if (year.isEmpty() || !Character.isDigit(quarterChar)) {
            return OptionalInt.empty();
        }
        int quarter = quarterChar - '0';
        if (quarter < 1 || quarter > 4) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(year.getAsInt() * 4 + quarter);
    }

    /**
     * Year of a plain {@code YYYY} label, empty for monthly or quarterly labels.
     */
    public static OptionalInt yearIndex(String label) {
        if (label == null || label.length() != 4) {
            return OptionalInt.empty();
        }
        return extractYear(label);
    }

    private static boolean isDigits(String value) {
        for (int i = 0; i < value.length(); i++) {
            if (!Character.isDigit(value.charAt(i))) {
                return false;
            }
        }
        return !value.isEmpty();
    }
}
