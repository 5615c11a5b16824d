package de.anton.spectral.analyser.spectral_analyzer.algorithms;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Parameter estimation heuristics, like finding the knee of a monotonic curve
 * (e.g. the within-cluster cost over increasing cluster counts).
 */
public final class ParameterEstimationUtils {

    private static final Logger logger = LoggerFactory.getLogger(ParameterEstimationUtils.class);

    private ParameterEstimationUtils() { throw new IllegalStateException("Utility class"); }

    /**
     * Finds the index of the "knee" or "elbow" of a monotonic sequence.
     * Kneedle approach: after normalizing both axes to [0, 1], the knee is the point
     * furthest from the line joining the first and last points. Works for rising and falling curves.
     *
     * @return the knee index, or -1 if the list is too small or constant
     */
    public static int findKneePointIndex(List<Double> values) {
        if (values == null || values.size() < 3) {
            logger.warn("Cannot find knee point: List is null or too small (< 3 elements).");
            return -1;
        }
        int n = values.size();
        Double firstObj = values.get(0);
        Double lastObj = values.get(n - 1);
        if (firstObj == null || lastObj == null) {
            logger.warn("Cannot find knee point: List contains null values at start or end.");
            return -1;
        }
        double first = firstObj;
        double range = lastObj - first;
        if (Math.abs(range) < 1e-12) {
            logger.warn("Cannot find knee point: All values in the list are (almost) constant.");
            return -1;
        }

        double maxDistance = -1.0;
        int kneeIndex = -1;
        for (int i = 0; i < n; i++) {
            Double value = values.get(i);
            if (value == null) continue;
            double xNorm = (double) i / (n - 1);
            double yNorm = (value - first) / range;
            double distance = Math.abs(xNorm - yNorm); // Proportional to distance from y = x
            if (distance > maxDistance) {
                maxDistance = distance;
                kneeIndex = i;
            }
        }
        logger.debug("Knee point identified at index {} (normalized distance {}).", kneeIndex, maxDistance);
        return kneeIndex;
    }

    /** @return the value at the knee of the sequence, or -1.0 if no knee could be found. */
    public static double findKneePointValue(List<Double> values) {
        int index = findKneePointIndex(values);
        return index < 0 ? -1.0 : values.get(index);
    }
}
