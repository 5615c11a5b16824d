package de.anton.spectral.analyser.spectral_analyzer.algorithms;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Objects;

/**
 * NIPALS partial least squares with the spectral channels as observations:
 * X is the transposed spectra matrix (channels x spectra, column-centred) and the response is the
 * centred wavelength axis. The X loadings hold one value per spectrum for every component, which
 * makes them directly mappable.
 */
public class PartialLeastSquaresData implements ComponentAnalysis {

    private static final Logger logger = LoggerFactory.getLogger(PartialLeastSquaresData.class);
    private static final double RELATIVE_TOLERANCE = 1e-12; // Relative to the initial X and y norms

    private final double[][] xLoadings;  // N x A
    private final double[][] xScores;    // M x A
    private final double[] yLoadings;    // A
    private final int requestedComponents;

    private PartialLeastSquaresData(double[][] xLoadings, double[][] xScores, double[] yLoadings, int requestedComponents) {
        this.xLoadings = xLoadings;
        this.xScores = xScores;
        this.yLoadings = yLoadings;
        this.requestedComponents = requestedComponents;
    }

    /**
     * Extracts up to {@code components} components. Extraction stops early once the residuals carry
     * no more covariance with the response, so fewer components may be computed.
     *
     * @param spectra    N x M spectra
     * @param wavelength length-M response surrogate
     */
    public static PartialLeastSquaresData apply(double[][] spectra, double[] wavelength, int components) {
        Objects.requireNonNull(spectra, "Spectra cannot be null.");
        Objects.requireNonNull(wavelength, "Wavelength cannot be null.");
        if (components < 1) throw new IllegalArgumentException("Component count must be positive.");
        int n = spectra.length;
        int m = wavelength.length;
        if (n == 0 || spectra[0].length != m) {
            throw new IllegalArgumentException("Spectra columns must match the wavelength length " + m);
        }
        logger.info("Calculating PLS with {} components on {} channels x {} spectra...", components, m, n);

        // X: M x N, centred per column (per spectrum)
        double[][] x = new double[m][n];
        for (int i = 0; i < n; i++) {
            double mean = 0;
            for (int j = 0; j < m; j++) mean += spectra[i][j];
            mean /= m;
            for (int j = 0; j < m; j++) x[j][i] = spectra[i][j] - mean;
        }
        double[] y = wavelength.clone();
        double yMean = 0;
        for (double v : y) yMean += v;
        yMean /= m;
        for (int j = 0; j < m; j++) y[j] -= yMean;

        double xNorm = 0;
        for (double[] row : x) {
            for (double v : row) xNorm += v * v;
        }
        xNorm = Math.sqrt(xNorm);
        double yNorm = 0;
        for (double v : y) yNorm += v * v;
        yNorm = Math.sqrt(yNorm);
        double covarianceTolerance = RELATIVE_TOLERANCE * xNorm * yNorm;
        double scoreTolerance = Math.pow(RELATIVE_TOLERANCE * xNorm, 2);

        int maxComponents = Math.min(components, Math.min(m, n));
        double[][] loadings = new double[n][maxComponents];
        double[][] scores = new double[m][maxComponents];
        double[] yLoad = new double[maxComponents];
        int extracted = 0;

        for (int a = 0; a < maxComponents; a++) {
            double[] w = new double[n];
            double wNorm = 0;
            for (int i = 0; i < n; i++) {
                double sum = 0;
                for (int j = 0; j < m; j++) sum += x[j][i] * y[j];
                w[i] = sum;
                wNorm += sum * sum;
            }
            wNorm = Math.sqrt(wNorm);
            if (wNorm <= covarianceTolerance) {
                logger.debug("PLS stopped after {} components: no remaining covariance with the response.", a);
                break;
            }
            for (int i = 0; i < n; i++) w[i] /= wNorm;

            double[] t = new double[m];
            double tt = 0;
            for (int j = 0; j < m; j++) {
                double sum = 0;
                for (int i = 0; i < n; i++) sum += x[j][i] * w[i];
                t[j] = sum;
                tt += sum * sum;
            }
            if (tt <= scoreTolerance) {
                logger.debug("PLS stopped after {} components: score vector vanished.", a);
                break;
            }

            double q = 0;
            for (int j = 0; j < m; j++) q += y[j] * t[j];
            q /= tt;
            for (int i = 0; i < n; i++) {
                double sum = 0;
                for (int j = 0; j < m; j++) sum += x[j][i] * t[j];
                loadings[i][a] = sum / tt;
            }
            for (int j = 0; j < m; j++) {
                scores[j][a] = t[j];
                for (int i = 0; i < n; i++) x[j][i] -= t[j] * loadings[i][a];
                y[j] -= t[j] * q;
            }
            yLoad[a] = q;
            extracted++;
        }

        logger.info("PLS complete: {} of {} requested components extracted.", extracted, components);
        return new PartialLeastSquaresData(trimColumns(loadings, extracted), trimColumns(scores, extracted),
                Arrays.copyOf(yLoad, extracted), components);
    }

    private static double[][] trimColumns(double[][] source, int columns) {
        double[][] result = new double[source.length][];
        for (int i = 0; i < source.length; i++) result[i] = Arrays.copyOf(source[i], columns);
        return result;
    }

    @Override
    public int componentCount() {
        return yLoadings.length;
    }

    /** @return X loading column of the component, one value per spectrum. */
    @Override
    public double[] results(int component) {
        Objects.checkIndex(component, componentCount());
        double[] column = new double[xLoadings.length];
        for (int i = 0; i < xLoadings.length; i++) column[i] = xLoadings[i][component];
        return column;
    }

    /** @return X score column of the component, one value per channel. */
    public double[] scores(int component) {
        Objects.checkIndex(component, componentCount());
        double[] column = new double[xScores.length];
        for (int j = 0; j < xScores.length; j++) column[j] = xScores[j][component];
        return column;
    }

    public double[] getYLoadings() { return yLoadings.clone(); }
    public int getRequestedComponents() { return requestedComponents; }
}
