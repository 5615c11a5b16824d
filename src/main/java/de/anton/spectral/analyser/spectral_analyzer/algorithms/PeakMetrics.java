package de.anton.spectral.analyser.spectral_analyzer.algorithms;

/**
 * Per-spectrum peak quantification over a channel region [min, max] (inclusive, indices).
 * Baselines are straight lines from the value at {@code min} to the value at {@code max},
 * interpolated over the channel index.
 */
public final class PeakMetrics {

    private PeakMetrics() { throw new IllegalStateException("Utility class"); }

    /**
     * Result of a FWHM measurement on one spectrum.
     *
     * @param width       |wavelength[right] - wavelength[left]|
     * @param leftIndex   channel of the left half-maximum crossing
     * @param rightIndex  channel of the right half-maximum crossing
     * @param halfMaximum the half-maximum level
     * @param baseline    baseline over the region
     */
    public record Bandwidth(double width, int leftIndex, int rightIndex, double halfMaximum, double[] baseline) {
    }

    /**
     * Maximum of the region. With {@code signed} set (z-scored data) the maximum absolute value is
     * also taken; if it differs from the plain maximum the peak is negative-going and its negated
     * magnitude is returned.
     */
    public static double intensity(double[] spectrum, int min, int max, boolean signed) {
        double peak = Double.NEGATIVE_INFINITY;
        double absPeak = Double.NEGATIVE_INFINITY;
        for (int j = min; j <= max; j++) {
            peak = Math.max(peak, spectrum[j]);
            absPeak = Math.max(absPeak, Math.abs(spectrum[j]));
        }
        if (signed && absPeak != peak) {
            return -absPeak;
        }
        return peak;
    }

    public static double[] linearBaseline(double[] spectrum, int min, int max) {
        double start = spectrum[min];
        double slope = max == min ? 0.0 : (spectrum[max] - start) / (max - min);
        double[] baseline = new double[max - min + 1];
        for (int j = 0; j < baseline.length; j++) {
            baseline[j] = j * slope + start;
        }
        return baseline;
    }

    /** Riemann sum of the region after subtracting the linear baseline. */
    public static double area(double[] spectrum, int min, int max, double[] baseline) {
        double sum = 0;
        for (int j = min; j <= max; j++) {
            sum += spectrum[j] - baseline[j - min];
        }
        return sum;
    }

    /**
     * Full width at half maximum of the highest peak in the region.
     * The half maximum sits halfway between the peak and the baseline under it. The edges are the first
     * channels below it scanning outward from the peak; each edge moves one channel further out if that
     * neighbour is closer to the half maximum. Scans stop at the ends of the spectrum.
     */
    public static Bandwidth bandwidth(double[] spectrum, double[] wavelength, int min, int max) {
        double[] baseline = linearBaseline(spectrum, min, max);
        int peakIndex = min;
        for (int j = min + 1; j <= max; j++) {
            if (spectrum[j] > spectrum[peakIndex]) peakIndex = j;
        }
        double peakBaseline = baseline[peakIndex - min];
        double halfMaximum = peakBaseline + (spectrum[peakIndex] - peakBaseline) / 2.0;

        int last = spectrum.length - 1;
        int left = 0;
        for (int j = peakIndex; j >= 0; j--) {
            if (spectrum[j] < halfMaximum) { left = j; break; }
        }
        int right = last;
        for (int j = peakIndex; j <= last; j++) {
            if (spectrum[j] < halfMaximum) { right = j; break; }
        }
        if (left > 0 && Math.abs(spectrum[left - 1] - halfMaximum) < Math.abs(spectrum[left] - halfMaximum)) {
            left--;
        }
        if (right < last && Math.abs(spectrum[right + 1] - halfMaximum) < Math.abs(spectrum[right] - halfMaximum)) {
            right++;
        }
        double width = Math.abs(wavelength[right] - wavelength[left]);
        return new Bandwidth(width, left, right, halfMaximum, baseline);
    }
}
