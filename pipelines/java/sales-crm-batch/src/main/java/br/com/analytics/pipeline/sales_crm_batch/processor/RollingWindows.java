package br.com.analytics.pipeline.sales_crm_batch.processor;

import java.util.ArrayList;
import java.util.List;

/**
 * Trailing window statistics over an ordered series. A window ending at position {@code i}
 * covers positions {@code i - size + 1 .. i}; positions with less history, or whose window
 * holds a null, yield null.
 */
public final class RollingWindows {

    private RollingWindows() {
    }

    public static List<Double> movingAverage(List<? extends Number> series, int size, int digits) {
        List<Double> weights = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            weights.add(1.0);
        }
        return weightedMovingAverage(series, weights, digits);
    }

    /**
     * Weighted trailing average {@code sum(w_i * v_i) / sum(w_i)}; the first weight applies to the
     * oldest value of each window.
     */
    public static List<Double> weightedMovingAverage(List<? extends Number> series, List<Double> weights, int digits) {
        int size = weights.size();
        if (size < 1) {
            throw new IllegalArgumentException("Window needs at least one weight");
        }
        double weightSum = 0.0;
        for (Double weight : weights) {
            weightSum += weight;
        }
        List<Double> averages = new ArrayList<>(series.size());
        for (int end = 0; end < series.size(); end++) {
            averages.add(end + 1 < size ? null : windowAverage(series, end - size + 1, weights, weightSum, digits));
        }
        return averages;
    }

    private static Double windowAverage(List<? extends Number> series, int start, List<Double> weights,
                                        double weightSum, int digits) {
        double total = 0.0;
        for (int offset = 0; offset < weights.size(); offset++) {
            Number value = series.get(start + offset);
            if (value == null) {
                return null;
            }
            total += weights.get(offset) * value.doubleValue();
        }
        return Decimals.round(total / weightSum, digits);
    }
}
