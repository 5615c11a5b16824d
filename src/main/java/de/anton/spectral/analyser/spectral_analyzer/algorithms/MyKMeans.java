package de.anton.spectral.analyser.spectral_analyzer.algorithms;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Objects;
import java.util.Random;

/**
 * Basic k-means implementation: k-means++ seeding followed by Lloyd iterations.
 * Seeding is driven by a fixed seed, so repeated runs on the same data agree.
 * Labels are reported 1-indexed.
 */
public class MyKMeans {

    private static final Logger logger = LoggerFactory.getLogger(MyKMeans.class);
    public static final int DEFAULT_MAX_ITERATIONS = 300;
    public static final long DEFAULT_SEED = 42L;

    private final double[][] points;
    private final int clusterCount;
    private final DistanceMetric metric;
    private final int maxIterations;
    private final long seed;

    private int[] assignments;
    private double[][] centroids;
    private double cost = Double.NaN;
    private int iterations;

    public MyKMeans(double[][] points, int clusterCount, DistanceMetric metric) {
        this(points, clusterCount, metric, DEFAULT_MAX_ITERATIONS, DEFAULT_SEED);
    }

    public MyKMeans(double[][] points, int clusterCount, DistanceMetric metric, int maxIterations, long seed) {
        this.points = Objects.requireNonNull(points, "Input points cannot be null.");
        if (clusterCount <= 0) throw new IllegalArgumentException("Cluster count must be positive.");
        if (clusterCount > points.length) {
            throw new IllegalArgumentException("Cluster count " + clusterCount + " exceeds point count " + points.length);
        }
        if (maxIterations <= 0) throw new IllegalArgumentException("Max iterations must be positive.");
        this.clusterCount = clusterCount;
        this.metric = Objects.requireNonNull(metric, "Distance metric cannot be null.");
        this.maxIterations = maxIterations;
        this.seed = seed;
    }

    /** Executes the clustering. */
    public void run() {
        int n = points.length;
        logger.debug("Starting MyKMeans: k={}, metric={}, points={}", clusterCount, metric, n);
        Random random = new Random(seed);
        centroids = seedCentroids(random);
        assignments = new int[n];
        Arrays.fill(assignments, -1);

        boolean changed = true;
        iterations = 0;
        while (changed && iterations < maxIterations) {
            iterations++;
            changed = assignPoints();
            updateCentroids();
        }
        cost = 0;
        for (int i = 0; i < n; i++) {
            cost += metric.distance(points[i], centroids[assignments[i]]);
        }
        logger.debug("MyKMeans finished after {} iterations, cost={}", iterations, cost);
    }

    private double[][] seedCentroids(Random random) {
        int n = points.length;
        double[][] seeds = new double[clusterCount][];
        seeds[0] = points[random.nextInt(n)].clone();
        double[] nearest = new double[n];
        Arrays.fill(nearest, Double.POSITIVE_INFINITY);
        for (int c = 1; c < clusterCount; c++) {
            double total = 0;
            for (int i = 0; i < n; i++) {
                double d = metric.distance(points[i], seeds[c - 1]);
                nearest[i] = Math.min(nearest[i], seedWeight(metric, d));
                total += nearest[i];
            }
            int chosen;
            if (total <= 0 || Double.isInfinite(total)) {
                chosen = random.nextInt(n); // All points coincide with seeds
            } else {
                double target = random.nextDouble() * total;
                chosen = n - 1;
                double cumulative = 0;
                for (int i = 0; i < n; i++) {
                    cumulative += nearest[i];
                    if (cumulative >= target) { chosen = i; break; }
                }
            }
            seeds[c] = points[chosen].clone();
        }
        return seeds;
    }

    /** k-means++ weight: the squared distance, which the squared Euclidean metric already returns. */
    static double seedWeight(DistanceMetric metric, double distance) {
        return metric == DistanceMetric.SQUARED_EUCLIDEAN ? distance : distance * distance;
    }

    private boolean assignPoints() {
        boolean changed = false;
        for (int i = 0; i < points.length; i++) {
            int best = 0;
            double bestDistance = Double.POSITIVE_INFINITY;
            for (int c = 0; c < clusterCount; c++) {
                double d = metric.distance(points[i], centroids[c]);
                if (d < bestDistance) {
                    bestDistance = d;
                    best = c;
                }
            }
            if (assignments[i] != best) {
                assignments[i] = best;
                changed = true;
            }
        }
        return changed;
    }

    private void updateCentroids() {
        int dims = points[0].length;
        double[][] sums = new double[clusterCount][dims];
        int[] counts = new int[clusterCount];
        for (int i = 0; i < points.length; i++) {
            int c = assignments[i];
            counts[c]++;
            for (int d = 0; d < dims; d++) sums[c][d] += points[i][d];
        }
        for (int c = 0; c < clusterCount; c++) {
            if (counts[c] == 0) {
                // Empty cluster: move it onto the point furthest from its own centroid
                int furthest = 0;
                double furthestDistance = -1;
                for (int i = 0; i < points.length; i++) {
                    double d = metric.distance(points[i], centroids[assignments[i]]);
                    if (d > furthestDistance) {
                        furthestDistance = d;
                        furthest = i;
                    }
                }
                logger.trace("Cluster {} became empty, reseeding at point {}.", c, furthest);
                centroids[c] = points[furthest].clone();
                continue;
            }
            for (int d = 0; d < dims; d++) sums[c][d] /= counts[c];
            centroids[c] = sums[c];
        }
    }

    private void checkRun() {
        if (assignments == null) throw new IllegalStateException("MyKMeans has not been run.");
    }

    /** @return cluster label per point, 1..k. */
    public int[] getLabels() {
        checkRun();
        int[] labels = new int[assignments.length];
        for (int i = 0; i < labels.length; i++) labels[i] = assignments[i] + 1;
        return labels;
    }

    /** @return sum of distances from each point to its centroid. */
    public double getCost() {
        checkRun();
        return cost;
    }

    public double[][] getCentroids() {
        checkRun();
        double[][] copy = new double[centroids.length][];
        for (int c = 0; c < centroids.length; c++) copy[c] = centroids[c].clone();
        return copy;
    }

    public int getIterations() { return iterations; }
    public int getClusterCount() { return clusterCount; }
}
