package de.anton.spectral.analyser.spectral_analyzer.model;

import java.util.Arrays;

/**
 * Optional per-row artefacts of a peak quantification kept with a {@link DerivedMap}:
 * the baseline abscissa and baseline curves of the (first) region, a second set for
 * band ratios, and half-maximum midpoint lines for FWHM maps.
 * Arrays are copied on the way in and on the way out.
 */
public final class MapDiagnostics {

    private final double[] baselineWavelength;
    private final double[][] baselines;
    private final double[] secondBaselineWavelength;
    private final double[][] secondBaselines;
    private final double[][] halfMaxLines; // [leftWavelength, leftValue, rightWavelength, rightValue] per row

    private MapDiagnostics(double[] baselineWavelength, double[][] baselines,
                           double[] secondBaselineWavelength, double[][] secondBaselines,
                           double[][] halfMaxLines) {
        this.baselineWavelength = copy(baselineWavelength);
        this.baselines = copy(baselines);
        this.secondBaselineWavelength = copy(secondBaselineWavelength);
        this.secondBaselines = copy(secondBaselines);
        this.halfMaxLines = copy(halfMaxLines);
    }

    public static MapDiagnostics ofBaselines(double[] baselineWavelength, double[][] baselines) {
        return new MapDiagnostics(baselineWavelength, baselines, null, null, null);
    }

    public static MapDiagnostics ofBandwidth(double[] baselineWavelength, double[][] baselines, double[][] halfMaxLines) {
        return new MapDiagnostics(baselineWavelength, baselines, null, null, halfMaxLines);
    }

    public static MapDiagnostics ofBandRatio(double[] firstWavelength, double[][] firstBaselines,
                                             double[] secondWavelength, double[][] secondBaselines) {
        return new MapDiagnostics(firstWavelength, firstBaselines, secondWavelength, secondBaselines, null);
    }

    public double[] getBaselineWavelength() { return copy(baselineWavelength); }
    public double[][] getBaselines() { return copy(baselines); }
    public double[] getSecondBaselineWavelength() { return copy(secondBaselineWavelength); }
    public double[][] getSecondBaselines() { return copy(secondBaselines); }
    public double[][] getHalfMaxLines() { return copy(halfMaxLines); }

    public boolean hasBaselines() { return baselines != null; }
    public boolean hasSecondBaselines() { return secondBaselines != null; }
    public boolean hasHalfMaxLines() { return halfMaxLines != null; }

    /** @return baseline curve of the given row, or null if none was kept. */
    public double[] baselineOf(int row) {
        return baselines != null && row >= 0 && row < baselines.length ? baselines[row].clone() : null;
    }

    /** @return midpoint line of the given row, or null if none was kept. */
    public double[] halfMaxLineOf(int row) {
        return halfMaxLines != null && row >= 0 && row < halfMaxLines.length ? halfMaxLines[row].clone() : null;
    }

    private static double[] copy(double[] source) {
        return source == null ? null : source.clone();
    }

    private static double[][] copy(double[][] source) {
        if (source == null) return null;
        double[][] target = new double[source.length][];
        for (int i = 0; i < source.length; i++) {
            target[i] = source[i] == null ? null : Arrays.copyOf(source[i], source[i].length);
        }
        return target;
    }
}
