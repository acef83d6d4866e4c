package com.company.anomaly.detection;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

final class RobustStatistics {

    private RobustStatistics() {
    }

    static double median(Collection<Double> values) {
        if (values.isEmpty()) {
            throw new IllegalArgumentException("median of empty collection");
        }
        List<Double> sorted = new ArrayList<>(values);
        Collections.sort(sorted);
        int mid = sorted.size() / 2;
        if (sorted.size() % 2 == 1) {
            return sorted.get(mid);
        }
        return (sorted.get(mid - 1) + sorted.get(mid)) / 2.0;
    }

    /**
     * Median absolute deviation around the median
     */
    static double medianAbsoluteDeviation(Collection<Double> values, double median) {
        List<Double> deviations = new ArrayList<>(values.size());
        for (Double value : values) {
            deviations.add(Math.abs(value - median));
        }
        return median(deviations);
    }
}
