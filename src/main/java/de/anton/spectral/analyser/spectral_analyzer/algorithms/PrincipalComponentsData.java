package de.anton.spectral.analyser.spectral_analyzer.algorithms;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Principal component analysis of a spectra matrix via the economy SVD of the column-centred data.
 * Component signs are fixed so that the loading with the largest magnitude is positive.
 */
public class PrincipalComponentsData implements ComponentAnalysis {

    private static final Logger logger = LoggerFactory.getLogger(PrincipalComponentsData.class);

    private final double[][] scores;     // N x r
    private final double[][] loadings;   // M x r
    private final double[] eigenvalues;
    private final double[] explainedVariance;
    private final double[] mean;

    private PrincipalComponentsData(double[][] scores, double[][] loadings, double[] eigenvalues,
                                    double[] explainedVariance, double[] mean) {
        this.scores = scores;
        this.loadings = loadings;
        this.eigenvalues = eigenvalues;
        this.explainedVariance = explainedVariance;
        this.mean = mean;
    }

    /** Runs the decomposition. Requires at least two spectra. */
    public static PrincipalComponentsData apply(double[][] spectra) {
        Objects.requireNonNull(spectra, "Spectra cannot be null.");
        int n = spectra.length;
        if (n < 2) throw new IllegalArgumentException("PCA requires at least two spectra.");
        int m = spectra[0].length;
        logger.info("Calculating principal components of {} spectra x {} channels...", n, m);

        double[] mean = new double[m];
        for (double[] row : spectra) {
            for (int j = 0; j < m; j++) mean[j] += row[j];
        }
        for (int j = 0; j < m; j++) mean[j] /= n;
        double[][] centred = new double[n][m];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < m; j++) centred[i][j] = spectra[i][j] - mean[j];
        }

        SingularValueDecomposition svd = new SingularValueDecomposition(MatrixUtils.createRealMatrix(centred));
        double[] s = svd.getSingularValues();
        RealMatrix u = svd.getU();
        RealMatrix v = svd.getV();
        int r = s.length;

        double[][] scores = new double[n][r];
        double[][] loadings = new double[m][r];
        double[] eigenvalues = new double[r];
        double[] explained = new double[r];
        double total = 0;
        for (double value : s) total += value * value;

        for (int k = 0; k < r; k++) {
            int maxRow = 0;
            for (int j = 1; j < m; j++) {
                if (Math.abs(v.getEntry(j, k)) > Math.abs(v.getEntry(maxRow, k))) maxRow = j;
            }
            double sign = v.getEntry(maxRow, k) < 0 ? -1.0 : 1.0;
            for (int j = 0; j < m; j++) loadings[j][k] = sign * v.getEntry(j, k);
            for (int i = 0; i < n; i++) scores[i][k] = sign * u.getEntry(i, k) * s[k];
            eigenvalues[k] = s[k] * s[k] / (n - 1);
            explained[k] = total > 0 ? s[k] * s[k] / total : 0.0;
        }
        logger.info("PCA complete: {} components, first explains {}.", r, r > 0 ? explained[0] : 0.0);
        return new PrincipalComponentsData(scores, loadings, eigenvalues, explained, mean);
    }

    @Override
    public int componentCount() {
        return eigenvalues.length;
    }

    /** @return score column of the component, one value per spectrum. */
    @Override
    public double[] results(int component) {
        Objects.checkIndex(component, componentCount());
        double[] column = new double[scores.length];
        for (int i = 0; i < scores.length; i++) column[i] = scores[i][component];
        return column;
    }

    /** @return loading vector of the component, one value per channel. */
    public double[] loading(int component) {
        Objects.checkIndex(component, componentCount());
        double[] column = new double[loadings.length];
        for (int j = 0; j < loadings.length; j++) column[j] = loadings[j][component];
        return column;
    }

    public double[] getEigenvalues() { return eigenvalues.clone(); }
    public double[] getExplainedVariance() { return explainedVariance.clone(); }
    public double[] getMean() { return mean.clone(); }
}
