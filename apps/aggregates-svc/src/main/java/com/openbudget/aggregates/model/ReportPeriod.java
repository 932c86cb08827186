package com.openbudget.aggregates.model;

import com.openbudget.aggregates.normalization.Frequency;
import com.openbudget.aggregates.normalization.PeriodLabels;
import java.util.List;
import java.util.OptionalInt;

/**
 * Reporting frequency plus the selected periods, either an inclusive interval or discrete dates.
 * Period bounds are labels ({@code 2023}, {@code 2023-Q2}, {@code 2023-05}); only their year is used
 * for row selection. A selection always resolves to a closed year range, so row selection and the
 * factor table cover the same years.
 */
public record ReportPeriod(Frequency type, Interval interval, List<String> dates) {

    public ReportPeriod {
        if (type == null) {
            throw new IllegalArgumentException("report period type must be provided");
        }
        dates = dates == null ? List.of() : List.copyOf(dates);
        if (interval != null) {
            if (PeriodLabels.extractYear(interval.start()).isEmpty() || PeriodLabels.extractYear(interval.end()).isEmpty()) {
                throw new IllegalArgumentException("report period interval needs a valid start and end label");
            }
        } else if (dates.stream().map(PeriodLabels::extractYear).noneMatch(OptionalInt::isPresent)) {
            throw new IllegalArgumentException("report period needs an interval or at least one valid date label");
        }
    }

    public record Interval(String start, String end) {
    }

    public record YearRange(int startYear, int endYear) {
    }

    public static ReportPeriod yearInterval(int startYear, int endYear) {
        return new ReportPeriod(Frequency.YEAR, new Interval(String.valueOf(startYear), String.valueOf(endYear)), List.of());
    }

    public YearRange yearRange() {
        if (interval != null) {
            return new YearRange(
                    PeriodLabels.extractYear(interval.start()).getAsInt(),
                    PeriodLabels.extractYear(interval.end()).getAsInt());
        }
        List<Integer> years = selectedYears();
        return new YearRange(
                years.stream().mapToInt(Integer::intValue).min().getAsInt(),
                years.stream().mapToInt(Integer::intValue).max().getAsInt());
    }

    /**
     * Whether a row of the given year falls inside the selection.
     */
    public boolean includesYear(int year) {
        if (interval != null) {
            YearRange range = yearRange();
            return year >= range.startYear() && year <= range.endYear();
        }
        return selectedYears().contains(year);
    }

    public List<Integer> selectedYears() {
        return dates.stream()
                .map(PeriodLabels::extractYear)
                .filter(OptionalInt::isPresent)
                .map(OptionalInt::getAsInt)
                .toList();
    }
}
