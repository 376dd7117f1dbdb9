package com.platform.hacontroller.telemetry;

import java.util.Arrays;

/**
 * How windowed cpu and memory samples are reduced to a single value.
 */
public enum AggregationStatistic {
    AVERAGE,
    P50,
    P90,
    P95,
    P99,
    MAX;

    /**
     * Reduce the values. Percentiles use the nearest-rank method.
     *
     * @throws IllegalArgumentException if values is empty
     */
    public double apply(double[] values) {
        if (values.length == 0) {
            throw new IllegalArgumentException("No values to aggregate");
        }
        return switch (this) {
            case AVERAGE -> Arrays.stream(values).average().orElse(0.0);
            case MAX -> Arrays.stream(values).max().orElse(0.0);
            case P50 -> percentile(values, 50);
            case P90 -> percentile(values, 90);
            case P95 -> percentile(values, 95);
            case P99 -> percentile(values, 99);
        };
    }

    private static double percentile(double[] values, int p) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int rank = (int) Math.ceil(p / 100.0 * sorted.length);
        return sorted[Math.max(rank, 1) - 1];
    }
}
