package de.anton.spectral.analyser.spectral_analyzer.service;

import de.anton.spectral.analyser.spectral_analyzer.algorithms.DistanceMetric;
import de.anton.spectral.analyser.spectral_analyzer.algorithms.MyKMeans;
import de.anton.spectral.analyser.spectral_analyzer.algorithms.ParameterEstimationUtils;
import de.anton.spectral.analyser.spectral_analyzer.algorithms.PartialLeastSquaresData;
import de.anton.spectral.analyser.spectral_analyzer.algorithms.PrincipalComponentsData;
import de.anton.spectral.analyser.spectral_analyzer.algorithms.VertexComponentsData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Service running the multivariate analyses on a spectra matrix: PCA, VCA, PLS and k-means.
 * Stateless; caching of the decompositions is left to the dataset.
 */
public class MultivariateAnalysisEngine {

    private static final Logger logger = LoggerFactory.getLogger(MultivariateAnalysisEngine.class);
    public static final int MAX_PREDICTED_CLUSTERS = 10;

    /**
     * Outcome of a k-means run, labels 1-indexed.
     */
    public static class ClusteringResult {
        public final int[] labels;
        public final int clusterCount;
        public final double cost;
        public final boolean predicted; // True if the cluster count was chosen from the cost curve

        private ClusteringResult(int[] labels, int clusterCount, double cost, boolean predicted) {
            this.labels = labels;
            this.clusterCount = clusterCount;
            this.cost = cost;
            this.predicted = predicted;
        }

        public double[] labelsAsValues() {
            double[] values = new double[labels.length];
            for (int i = 0; i < labels.length; i++) values[i] = labels[i];
            return values;
        }
    }

    public PrincipalComponentsData principalComponents(double[][] spectra) {
        return PrincipalComponentsData.apply(spectra);
    }

    public VertexComponentsData vertexComponents(double[][] spectra, int endmemberCount) {
        return VertexComponentsData.apply(spectra, endmemberCount);
    }

    public PartialLeastSquaresData partialLeastSquares(double[][] spectra, double[] wavelength, int components) {
        return PartialLeastSquaresData.apply(spectra, wavelength, components);
    }

    /**
     * Clusters the spectra.
     *
     * @param clusters number of clusters, or 0 to predict it from the knee of the cost curve
     */
    public ClusteringResult kMeans(double[][] spectra, int clusters, DistanceMetric metric) {
        Objects.requireNonNull(spectra, "Spectra cannot be null.");
        Objects.requireNonNull(metric, "Distance metric cannot be null.");
        if (clusters < 0 || clusters > spectra.length) {
            throw new IllegalArgumentException("Cluster count must be in [0, " + spectra.length + "], got " + clusters);
        }
        boolean predicted = clusters == 0;
        int k = predicted ? predictClusterCount(spectra, metric, MAX_PREDICTED_CLUSTERS) : clusters;
        logger.info("Running k-means with {} clusters ({}) using {} distance.", k, predicted ? "predicted" : "given", metric);
        MyKMeans kMeans = new MyKMeans(spectra, k, metric);
        kMeans.run();
        return new ClusteringResult(kMeans.getLabels(), k, kMeans.getCost(), predicted);
    }

    /**
     * Runs k-means for k = 1..maxClusters (bounded by the spectrum count) and returns the k at the knee
     * of the cost curve. Falls back to 1 if the curve has no knee.
     */
    public int predictClusterCount(double[][] spectra, DistanceMetric metric, int maxClusters) {
        int upper = Math.min(maxClusters, spectra.length);
        List<Double> costs = new ArrayList<>(upper);
        for (int k = 1; k <= upper; k++) {
            MyKMeans kMeans = new MyKMeans(spectra, k, metric);
            kMeans.run();
            costs.add(kMeans.getCost());
        }
        int kneeIndex = ParameterEstimationUtils.findKneePointIndex(costs);
        int predicted = kneeIndex < 0 ? 1 : kneeIndex + 1;
        logger.info("Predicted {} clusters from costs {}", predicted, costs);
        return predicted;
    }
}
