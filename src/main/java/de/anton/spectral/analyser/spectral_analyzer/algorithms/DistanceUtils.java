package de.anton.spectral.analyser.spectral_analyzer.algorithms;

/**
 * Utility class for distances between spectra of equal length.
 * Any NaN channel makes the distance infinite.
 */
public final class DistanceUtils {

    private DistanceUtils() { throw new IllegalStateException("Utility class"); }

    public static double euclidean(double[] a, double[] b) {
        return Math.sqrt(squaredEuclidean(a, b));
    }

    public static double squaredEuclidean(double[] a, double[] b) {
        checkLengths(a, b);
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            double d = a[i] - b[i];
            sum += d * d;
        }
        return Double.isNaN(sum) ? Double.POSITIVE_INFINITY : sum;
    }

    /** City-block distance. */
    public static double manhattan(double[] a, double[] b) {
        checkLengths(a, b);
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            sum += Math.abs(a[i] - b[i]);
        }
        return Double.isNaN(sum) ? Double.POSITIVE_INFINITY : sum;
    }

    /** Largest per-channel difference. */
    public static double chebyshev(double[] a, double[] b) {
        checkLengths(a, b);
        double max = 0;
        for (int i = 0; i < a.length; i++) {
            double d = Math.abs(a[i] - b[i]);
            if (Double.isNaN(d)) return Double.POSITIVE_INFINITY;
            max = Math.max(max, d);
        }
        return max;
    }

    private static void checkLengths(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Vectors differ in length: " + a.length + " vs " + b.length);
        }
    }
}
