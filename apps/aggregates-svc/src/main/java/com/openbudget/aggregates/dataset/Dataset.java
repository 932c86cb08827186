package com.openbudget.aggregates.dataset;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record Dataset(String id, String frequency, String unit, List<Point> points) {

    public Dataset {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("dataset id must be provided");
        }
        points = points == null ? List.of() : List.copyOf(points);
    }

    public record Point(String x, BigDecimal y) {
    }

    /**
     * Points keyed by period label. Later duplicates win.
     */
    public Map<String, BigDecimal> toFactorMap() {
        Map<String, BigDecimal> map = new LinkedHashMap<>();
        for (Point point : points) {
            if (point.x() != null && point.y() != null) {
                map.put(point.x(), point.y());
            }
        }
        return map;
    }
}
