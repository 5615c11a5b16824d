package de.anton.spectral.analyser.spectral_analyzer.algorithms;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.QRDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.util.CombinatoricsUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Savitzky-Golay smoothing and differentiation by local polynomial least squares.
 * Derivatives are taken with respect to the channel index (unit spacing).
 * The first and last half-window channels are evaluated on the polynomial fitted to the
 * first and last full window instead of being dropped.
 */
public class SavitzkyGolayFilter {

    private static final Logger logger = LoggerFactory.getLogger(SavitzkyGolayFilter.class);

    private final int derivativeOrder;
    private final int polynomialOrder;
    private final int windowSize;
    private final int halfWindow;
    private final double[][] fitOperator; // (P+1) x w pseudo-inverse of the window Vandermonde matrix

    /**
     * @param derivativeOrder 0 for smoothing, otherwise the derivative order
     * @param polynomialOrder degree of the local polynomial, at least the derivative order
     * @param windowSize      odd window length, greater than the polynomial order
     */
    public SavitzkyGolayFilter(int derivativeOrder, int polynomialOrder, int windowSize) {
        if (derivativeOrder < 0) throw new IllegalArgumentException("Derivative order must not be negative.");
        if (polynomialOrder < derivativeOrder) {
            throw new IllegalArgumentException("Polynomial order " + polynomialOrder
                    + " must be at least the derivative order " + derivativeOrder);
        }
        if (windowSize % 2 == 0 || windowSize <= polynomialOrder) {
            throw new IllegalArgumentException("Window size must be odd and greater than the polynomial order, got "
                    + windowSize);
        }
        this.derivativeOrder = derivativeOrder;
        this.polynomialOrder = polynomialOrder;
        this.windowSize = windowSize;
        this.halfWindow = (windowSize - 1) / 2;

        double[][] vandermonde = new double[windowSize][polynomialOrder + 1];
        for (int i = 0; i < windowSize; i++) {
            double t = i - halfWindow;
            for (int p = 0; p <= polynomialOrder; p++) {
                vandermonde[i][p] = Math.pow(t, p);
            }
        }
        RealMatrix pseudoInverse = new QRDecomposition(MatrixUtils.createRealMatrix(vandermonde))
                .getSolver().getInverse();
        this.fitOperator = pseudoInverse.getData();
        logger.debug("Savitzky-Golay filter created: derivative={}, polynomial={}, window={}",
                derivativeOrder, polynomialOrder, windowSize);
    }

    /** @return convolution weights applied at the centre of each window. */
    public double[] centreWeights() {
        return weightsAt(0.0);
    }

    /**
     * Weights that evaluate the derivative of the fitted polynomial at offset {@code t}
     * from the window centre.
     */
    double[] weightsAt(double t) {
        double[] weights = new double[windowSize];
        for (int p = derivativeOrder; p <= polynomialOrder; p++) {
            double factor = CombinatoricsUtils.factorialDouble(p) / CombinatoricsUtils.factorialDouble(p - derivativeOrder)
                    * Math.pow(t, p - derivativeOrder);
            if (factor == 0.0) continue;
            for (int i = 0; i < windowSize; i++) {
                weights[i] += factor * fitOperator[p][i];
            }
        }
        return weights;
    }

    /**
     * Filters a single spectrum.
     *
     * @throws IllegalArgumentException if the spectrum is shorter than the window
     */
    public double[] apply(double[] spectrum) {
        Objects.requireNonNull(spectrum, "Spectrum cannot be null.");
        int length = spectrum.length;
        if (length < windowSize) {
            throw new IllegalArgumentException("Spectrum length " + length + " is shorter than window " + windowSize);
        }
        double[] result = new double[length];
        double[] centre = centreWeights();
        for (int j = halfWindow; j < length - halfWindow; j++) {
            result[j] = convolve(spectrum, j - halfWindow, centre);
        }
        for (int j = 0; j < halfWindow; j++) {
            result[j] = convolve(spectrum, 0, weightsAt(j - halfWindow));
        }
        int lastStart = length - windowSize;
        for (int j = length - halfWindow; j < length; j++) {
            result[j] = convolve(spectrum, lastStart, weightsAt(j - lastStart - halfWindow));
        }
        return result;
    }

    /** Filters every row of the matrix. */
    public double[][] apply(double[][] spectra) {
        Objects.requireNonNull(spectra, "Spectra cannot be null.");
        double[][] result = new double[spectra.length][];
        for (int i = 0; i < spectra.length; i++) {
            result[i] = apply(spectra[i]);
        }
        return result;
    }

    private double convolve(double[] spectrum, int start, double[] weights) {
        double sum = 0;
        for (int k = 0; k < windowSize; k++) {
            sum += weights[k] * spectrum[start + k];
        }
        return sum;
    }

    public int getDerivativeOrder() { return derivativeOrder; }
    public int getPolynomialOrder() { return polynomialOrder; }
    public int getWindowSize() { return windowSize; }
}
