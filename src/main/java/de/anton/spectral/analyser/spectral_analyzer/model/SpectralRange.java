package de.anton.spectral.analyser.spectral_analyzer.model;

/**
 * Channel index bounds of a spectral region of interest, as found by
 * {@link SpectralDataset#findRange(double, double)}.
 *
 * @param minIndex    lower channel index (inclusive)
 * @param maxIndex    upper channel index (inclusive)
 * @param pointRegion true if no upper bound could be located and the region collapsed to a single channel
 */
public record SpectralRange(int minIndex, int maxIndex, boolean pointRegion) {

    public SpectralRange {
        if (minIndex < 0 || maxIndex < minIndex) {
            throw new IllegalArgumentException("Invalid channel range [" + minIndex + ", " + maxIndex + "]");
        }
    }

    /** @return number of channels covered by the region. */
    public int width() {
        return maxIndex - minIndex + 1;
    }
}
