package de.anton.spectral.analyser.spectral_analyzer.algorithms;

import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Objects;
import java.util.Random;

/**
 * Vertex component analysis: extracts endmember spectra as the extreme pixels of the data simplex
 * and computes per-pixel abundances by least squares against them.
 * <p>
 * The data are projected onto a p-dimensional subspace whose choice depends on the estimated SNR
 * (projective projection for high SNR, centred projection plus a constant coordinate otherwise).
 * Endmembers are then picked iteratively along random directions orthogonal to those already found.
 */
public class VertexComponentsData implements ComponentAnalysis {

    private static final Logger logger = LoggerFactory.getLogger(VertexComponentsData.class);
    public static final long DEFAULT_SEED = 12345L;

    private final double[][] endmembers;    // p x M
    private final int[] pixelIndices;       // p
    private final double[][] abundances;    // N x p
    private final double snrEstimate;

    private VertexComponentsData(double[][] endmembers, int[] pixelIndices, double[][] abundances, double snrEstimate) {
        this.endmembers = endmembers;
        this.pixelIndices = pixelIndices;
        this.abundances = abundances;
        this.snrEstimate = snrEstimate;
    }

    public static VertexComponentsData apply(double[][] spectra, int endmemberCount) {
        return apply(spectra, endmemberCount, DEFAULT_SEED);
    }

    /**
     * @param spectra        N x M spectra matrix
     * @param endmemberCount number of endmembers p, 1 &lt;= p &lt;= min(N, M)
     * @param seed           seed of the random search directions
     */
    public static VertexComponentsData apply(double[][] spectra, int endmemberCount, long seed) {
        Objects.requireNonNull(spectra, "Spectra cannot be null.");
        int n = spectra.length;
        if (n == 0) throw new IllegalArgumentException("VCA requires at least one spectrum.");
        int bands = spectra[0].length;
        int p = endmemberCount;
        if (p < 1 || p > Math.min(n, bands)) {
            throw new IllegalArgumentException("Endmember count must be in [1, " + Math.min(n, bands) + "], got " + p);
        }
        logger.info("Calculating vertex components: {} endmembers from {} spectra x {} channels...", p, n, bands);

        // Observations as columns: L x N
        RealMatrix r = MatrixUtils.createRealMatrix(spectra).transpose();
        double[] rowMean = new double[bands];
        for (int l = 0; l < bands; l++) {
            double sum = 0;
            for (int j = 0; j < n; j++) sum += r.getEntry(l, j);
            rowMean[l] = sum / n;
        }
        RealMatrix centred = r.copy();
        for (int l = 0; l < bands; l++) {
            for (int j = 0; j < n; j++) centred.addToEntry(l, j, -rowMean[l]);
        }

        RealMatrix ud = leadingLeftVectors(centred.multiply(centred.transpose()).scalarMultiply(1.0 / n), p);
        RealMatrix xp = ud.transpose().multiply(centred);

        double powerY = frobeniusSquared(r) / n;
        double powerX = frobeniusSquared(xp) / n + dot(rowMean, rowMean);
        double snr = 10 * Math.log10((powerX - (double) p / bands * powerY) / (powerY - powerX));
        double snrThreshold = 15 + 10 * Math.log10(p);
        logger.debug("VCA SNR estimate {} dB (threshold {} dB).", snr, snrThreshold);

        RealMatrix projected;  // Rp, L x N
        RealMatrix y;          // p x N
        if (snr < snrThreshold) {
            int d = p - 1;
            projected = MatrixUtils.createRealMatrix(bands, n);
            y = MatrixUtils.createRealMatrix(p, n);
            if (d > 0) {
                RealMatrix udD = ud.getSubMatrix(0, bands - 1, 0, d - 1);
                RealMatrix x = xp.getSubMatrix(0, d - 1, 0, n - 1);
                projected = udD.multiply(x);
                double c = 0;
                for (int j = 0; j < n; j++) c = Math.max(c, x.getColumnVector(j).getNorm());
                y.setSubMatrix(x.getData(), 0, 0);
                for (int j = 0; j < n; j++) y.setEntry(p - 1, j, c);
            } else {
                for (int j = 0; j < n; j++) y.setEntry(0, j, 1.0);
            }
            for (int l = 0; l < bands; l++) {
                for (int j = 0; j < n; j++) projected.addToEntry(l, j, rowMean[l]);
            }
        } else {
            RealMatrix udFull = leadingLeftVectors(r.multiply(r.transpose()).scalarMultiply(1.0 / n), p);
            RealMatrix x = udFull.transpose().multiply(r);
            projected = udFull.multiply(x);
            double[] u = new double[p];
            for (int k = 0; k < p; k++) {
                double sum = 0;
                for (int j = 0; j < n; j++) sum += x.getEntry(k, j);
                u[k] = sum / n;
            }
            y = x.copy();
            for (int j = 0; j < n; j++) {
                double scale = x.getColumnVector(j).dotProduct(MatrixUtils.createRealVector(u));
                if (scale == 0) scale = Double.MIN_NORMAL;
                for (int k = 0; k < p; k++) y.setEntry(k, j, x.getEntry(k, j) / scale);
            }
        }

        Random random = new Random(seed);
        RealMatrix a = MatrixUtils.createRealMatrix(p, p);
        a.setEntry(p - 1, 0, 1.0);
        int[] indices = new int[p];
        for (int i = 0; i < p; i++) {
            double[] wData = new double[p];
            for (int k = 0; k < p; k++) wData[k] = random.nextDouble();
            RealVector w = MatrixUtils.createRealVector(wData);
            RealMatrix pinvA = new SingularValueDecomposition(a).getSolver().getInverse();
            RealVector f = w.subtract(a.operate(pinvA.operate(w)));
            double norm = f.getNorm();
            if (norm > 0) f = f.mapDivide(norm);
            RealVector v = y.preMultiply(f);
            int best = 0;
            for (int j = 1; j < n; j++) {
                if (Math.abs(v.getEntry(j)) > Math.abs(v.getEntry(best))) best = j;
            }
            indices[i] = best;
            a.setColumnVector(i, y.getColumnVector(best));
        }

        double[][] endmembers = new double[p][];
        RealMatrix ae = MatrixUtils.createRealMatrix(bands, p);
        for (int i = 0; i < p; i++) {
            RealVector column = projected.getColumnVector(indices[i]);
            ae.setColumnVector(i, column);
            endmembers[i] = column.toArray();
        }
        RealMatrix abundanceT = new SingularValueDecomposition(ae).getSolver().getInverse().multiply(r); // p x N
        double[][] abundances = abundanceT.transpose().getData();
        logger.info("VCA complete: endmember pixels {}.", Arrays.toString(indices));
        return new VertexComponentsData(endmembers, indices, abundances, snr);
    }

    private static RealMatrix leadingLeftVectors(RealMatrix symmetric, int count) {
        RealMatrix u = new SingularValueDecomposition(symmetric).getU();
        return u.getSubMatrix(0, u.getRowDimension() - 1, 0, count - 1);
    }

    private static double frobeniusSquared(RealMatrix matrix) {
        double norm = matrix.getFrobeniusNorm();
        return norm * norm;
    }

    private static double dot(double[] a, double[] b) {
        double sum = 0;
        for (int i = 0; i < a.length; i++) sum += a[i] * b[i];
        return sum;
    }

    @Override
    public int componentCount() {
        return endmembers.length;
    }

    /** @return abundance of the endmember in every spectrum. */
    @Override
    public double[] results(int component) {
        Objects.checkIndex(component, componentCount());
        double[] column = new double[abundances.length];
        for (int i = 0; i < abundances.length; i++) column[i] = abundances[i][component];
        return column;
    }

    /** @return endmember spectrum (projected data at the chosen pixel). */
    public double[] endmember(int component) {
        Objects.checkIndex(component, componentCount());
        return endmembers[component].clone();
    }

    public int[] getPixelIndices() { return pixelIndices.clone(); }
    public double getSnrEstimate() { return snrEstimate; }
}
