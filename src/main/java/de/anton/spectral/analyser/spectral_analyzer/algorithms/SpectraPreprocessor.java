package de.anton.spectral.analyser.spectral_analyzer.algorithms;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Objects;

/**
 * Stateless preprocessing transforms on a spectra matrix (rows = spectra, cols = channels).
 * Every method works on a deep copy and returns the transformed matrix; the input is never modified.
 * Argument validation beyond null checks is the caller's job, invalid shapes raise
 * {@link IllegalArgumentException}.
 */
public final class SpectraPreprocessor {

    private static final Logger logger = LoggerFactory.getLogger(SpectraPreprocessor.class);

    private SpectraPreprocessor() {
        throw new IllegalStateException("Utility class should not be instantiated.");
    }

    /**
     * Shifts the whole matrix by |min| if its global minimum is negative, then divides by the
     * (new) global maximum. The result lies in [0, 1]; applying it twice changes nothing.
     * An all-zero matrix is returned unchanged.
     */
    public static double[][] minMaxNormalize(double[][] spectra) {
        double[][] result = deepCopy(spectra);
        double min = Double.POSITIVE_INFINITY;
        for (double[] row : result) {
            for (double v : row) min = Math.min(min, v);
        }
        if (min < 0) {
            double shift = -min;
            for (double[] row : result) {
                for (int j = 0; j < row.length; j++) row[j] += shift;
            }
        }
        double max = Double.NEGATIVE_INFINITY;
        for (double[] row : result) {
            for (double v : row) max = Math.max(max, v);
        }
        if (max == 0) {
            logger.warn("Min-max normalization: global maximum is zero, spectra left unscaled.");
            return result;
        }
        for (double[] row : result) {
            for (int j = 0; j < row.length; j++) row[j] /= max;
        }
        logger.debug("Min-max normalization applied (shift={}, max={}).", min < 0 ? -min : 0.0, max);
        return result;
    }

    /** Divides every spectrum by its sum. Rows summing to zero are left unchanged. */
    public static double[][] unitAreaNormalize(double[][] spectra) {
        double[][] result = deepCopy(spectra);
        int skipped = 0;
        for (double[] row : result) {
            double sum = 0;
            for (double v : row) sum += v;
            if (sum == 0) {
                skipped++;
                continue;
            }
            for (int j = 0; j < row.length; j++) row[j] /= sum;
        }
        if (skipped > 0) {
            logger.warn("Unit-area normalization: {} spectra with zero area were left unchanged.", skipped);
        }
        return result;
    }

    /**
     * Standardizes each channel (column) to zero mean and unit sample standard deviation (n - 1).
     * Columns with zero variance, or with fewer than two rows, become 0.
     */
    public static double[][] zScoreNormalize(double[][] spectra) {
        double[][] result = deepCopy(spectra);
        int rows = result.length;
        if (rows == 0) return result;
        int cols = result[0].length;
        Mean mean = new Mean();
        StandardDeviation sd = new StandardDeviation(true);
        double[] column = new double[rows];
        int constantColumns = 0;
        for (int j = 0; j < cols; j++) {
            for (int i = 0; i < rows; i++) column[i] = result[i][j];
            double mu = mean.evaluate(column);
            boolean constant = true;
            for (int i = 1; i < rows && constant; i++) constant = column[i] == column[0];
            double sigma = constant ? 0.0 : sd.evaluate(column, mu);
            if (sigma == 0) {
                constantColumns++;
                for (int i = 0; i < rows; i++) result[i][j] = 0.0;
            } else {
                for (int i = 0; i < rows; i++) result[i][j] = (result[i][j] - mu) / sigma;
            }
        }
        logger.debug("Z-score normalization applied on {} channels ({} constant).", cols, constantColumns);
        return result;
    }

    /**
     * Subtracts the background spectrum from every row.
     *
     * @throws IllegalArgumentException if the background length differs from the channel count
     */
    public static double[][] subtractBackground(double[][] spectra, double[] background) {
        Objects.requireNonNull(background, "Background cannot be null.");
        double[][] result = deepCopy(spectra);
        if (result.length > 0 && background.length != result[0].length) {
            throw new IllegalArgumentException("Background length " + background.length
                    + " does not match channel count " + result[0].length);
        }
        for (double[] row : result) {
            for (int j = 0; j < row.length; j++) row[j] -= background[j];
        }
        return result;
    }

    /**
     * Replaces every interior channel by the median of the centred window.
     * The first and last (w - 1) / 2 channels pass through.
     */
    public static double[][] medianFilter(double[][] spectra, int windowSize) {
        checkWindow(spectra, windowSize);
        Median median = new Median();
        return slidingWindow(spectra, windowSize, median::evaluate);
    }

    /** Replaces every interior channel by the mean of the centred window; boundaries pass through. */
    public static double[][] linearMovingAverage(double[][] spectra, int windowSize) {
        checkWindow(spectra, windowSize);
        Mean mean = new Mean();
        return slidingWindow(spectra, windowSize, mean::evaluate);
    }

    /**
     * Estimates the baseline with a wide median window (the median is assumed to be baseline, not peak).
     * Boundary channels are copied from the spectra, so they are zero after subtraction.
     *
     * @return the baseline matrix, same shape as the input
     */
    public static double[][] medianBaseline(double[][] spectra, int windowSize) {
        return medianFilter(spectra, windowSize);
    }

    /** Element-wise {@code minuend - subtrahend}. */
    public static double[][] subtract(double[][] minuend, double[][] subtrahend) {
        double[][] result = deepCopy(minuend);
        for (int i = 0; i < result.length; i++) {
            for (int j = 0; j < result[i].length; j++) result[i][j] -= subtrahend[i][j];
        }
        return result;
    }

    /**
     * Reconstructs the spectra from their top {@code rank} singular values, U * S_k * V^T.
     * A rank equal to min(rows, cols) reproduces the input.
     *
     * @throws IllegalArgumentException if rank is outside [1, min(rows, cols)]
     */
    public static double[][] singularValueDenoise(double[][] spectra, int rank) {
        Objects.requireNonNull(spectra, "Spectra cannot be null.");
        RealMatrix matrix = MatrixUtils.createRealMatrix(spectra);
        int maxRank = Math.min(matrix.getRowDimension(), matrix.getColumnDimension());
        if (rank < 1 || rank > maxRank) {
            throw new IllegalArgumentException("Rank must be in [1, " + maxRank + "], got " + rank);
        }
        SingularValueDecomposition svd = new SingularValueDecomposition(matrix);
        double[] singularValues = svd.getSingularValues();
        double[] truncated = new double[singularValues.length];
        System.arraycopy(singularValues, 0, truncated, 0, Math.min(rank, singularValues.length));
        RealMatrix reconstruction = svd.getU()
                .multiply(MatrixUtils.createRealDiagonalMatrix(truncated))
                .multiply(svd.getVT());
        logger.debug("SVD denoise: kept {} of {} singular values (largest={}).",
                rank, singularValues.length, singularValues.length > 0 ? singularValues[0] : 0.0);
        return reconstruction.getData();
    }

    /**
     * Builds the crop keep-mask: true for every row whose (x, y) lies inside the closed rectangle.
     */
    public static boolean[] cropMask(double[] x, double[] y, double xMin, double xMax, double yMin, double yMax) {
        if (x.length != y.length) {
            throw new IllegalArgumentException("x and y must have equal length.");
        }
        boolean[] keep = new boolean[x.length];
        for (int i = 0; i < x.length; i++) {
            keep[i] = x[i] >= xMin && x[i] <= xMax && y[i] >= yMin && y[i] <= yMax;
        }
        return keep;
    }

    /** Compacts the rows flagged in the keep-mask into a new matrix, preserving order. */
    public static double[][] keepRows(double[][] rows, boolean[] keep) {
        double[][] result = new double[countKept(keep)][];
        int target = 0;
        for (int i = 0; i < rows.length; i++) {
            if (keep[i]) result[target++] = rows[i].clone();
        }
        return result;
    }

    /** Compacts the entries flagged in the keep-mask, preserving order. */
    public static double[] keepEntries(double[] values, boolean[] keep) {
        double[] result = new double[countKept(keep)];
        int target = 0;
        for (int i = 0; i < values.length; i++) {
            if (keep[i]) result[target++] = values[i];
        }
        return result;
    }

    public static double[][] deepCopy(double[][] source) {
        Objects.requireNonNull(source, "Spectra cannot be null.");
        double[][] copy = new double[source.length][];
        for (int i = 0; i < source.length; i++) {
            copy[i] = Arrays.copyOf(source[i], source[i].length);
        }
        return copy;
    }

    private static int countKept(boolean[] keep) {
        int count = 0;
        for (boolean k : keep) if (k) count++;
        return count;
    }

    private static void checkWindow(double[][] spectra, int windowSize) {
        Objects.requireNonNull(spectra, "Spectra cannot be null.");
        if (windowSize < 1 || windowSize % 2 == 0) {
            throw new IllegalArgumentException("Window size must be a positive odd number, got " + windowSize);
        }
        if (spectra.length > 0 && windowSize > spectra[0].length) {
            throw new IllegalArgumentException("Window size " + windowSize + " exceeds channel count " + spectra[0].length);
        }
    }

    @FunctionalInterface
    private interface WindowStatistic {
        double evaluate(double[] values, int begin, int length);
    }

    private static double[][] slidingWindow(double[][] spectra, int windowSize, WindowStatistic statistic) {
        double[][] result = deepCopy(spectra);
        int half = (windowSize - 1) / 2;
        for (int i = 0; i < spectra.length; i++) {
            double[] source = spectra[i];
            for (int j = half; j < source.length - half; j++) {
                result[i][j] = statistic.evaluate(source, j - half, windowSize);
            }
        }
        return result;
    }
}
