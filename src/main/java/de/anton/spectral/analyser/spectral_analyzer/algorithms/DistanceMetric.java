package de.anton.spectral.analyser.spectral_analyzer.algorithms;

import java.util.function.ToDoubleBiFunction;

/**
 * Distance metrics offered for k-means clustering.
 */
public enum DistanceMetric {
    EUCLIDEAN("Euclidean", DistanceUtils::euclidean),
    SQUARED_EUCLIDEAN("Squared Euclidean", DistanceUtils::squaredEuclidean),
    MANHATTAN("Manhattan", DistanceUtils::manhattan),
    CHEBYSHEV("Chebyshev", DistanceUtils::chebyshev);

    private final String displayName;
    private final ToDoubleBiFunction<double[], double[]> function;

    DistanceMetric(String displayName, ToDoubleBiFunction<double[], double[]> function) {
        this.displayName = displayName;
        this.function = function;
    }

    public double distance(double[] a, double[] b) {
        return function.applyAsDouble(a, b);
    }

    @Override
    public String toString() {
        return displayName;
    }

    /** @return the metric with the given display name (case-insensitive), or null if unknown. */
    public static DistanceMetric fromDisplayName(String displayName) {
        if (displayName == null) {
            return null;
        }
        for (DistanceMetric metric : DistanceMetric.values()) {
            if (metric.displayName.equalsIgnoreCase(displayName.trim())) {
                return metric;
            }
        }
        return null;
    }
}
