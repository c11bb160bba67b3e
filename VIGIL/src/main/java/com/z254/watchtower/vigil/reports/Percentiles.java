package com.z254.watchtower.vigil.reports;

import java.util.List;

/**
 * Order statistics over ascending-sorted samples.
 */
public final class Percentiles {

    private Percentiles() {}

    /**
     * Linear interpolation between closest ranks, rank = p × (n − 1).
     *
     * @param sorted ascending samples
     * @param p      quantile in [0, 1]
     * @return null for an empty sample
     */
    public static Double percentile(List<Double> sorted, double p) {
        if (sorted.isEmpty()) {
            return null;
        }
        if (p < 0 || p > 1) {
            throw new IllegalArgumentException("Quantile out of range: " + p);
        }
        double rank = p * (sorted.size() - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        double lowerValue = sorted.get(lower);
        if (lower == upper) {
            return lowerValue;
        }
        double upperValue = sorted.get(upper);
        return lowerValue + (upperValue - lowerValue) * (rank - lower);
    }

    public static Double mean(List<Double> values) {
        if (values.isEmpty()) {
            return null;
        }
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.size();
    }
}
