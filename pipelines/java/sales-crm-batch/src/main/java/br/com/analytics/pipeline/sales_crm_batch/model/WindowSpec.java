package br.com.analytics.pipeline.sales_crm_batch.model;

import org.jspecify.annotations.Nullable;

import java.util.List;

public record WindowSpec(
        int size,
        @Nullable List<Double> weights
) {

    public WindowSpec {
        if (size < 1) {
            throw new IllegalArgumentException("Window size must be at least 1: " + size);
        }
        weights = weights == null ? List.of() : List.copyOf(weights);
        if (!weights.isEmpty()) {
            if (weights.size() != size) {
                throw new IllegalArgumentException(
                        "Window of size " + size + " needs " + size + " weights, got " + weights.size());
            }
            if (weights.stream().mapToDouble(Double::doubleValue).sum() == 0.0) {
                throw new IllegalArgumentException("Weights of window " + size + " sum to zero");
            }
        }
    }

    public static WindowSpec unweighted(int size) {
        return new WindowSpec(size, List.of());
    }

    public boolean isWeighted() {
        return !weights.isEmpty();
    }
}
