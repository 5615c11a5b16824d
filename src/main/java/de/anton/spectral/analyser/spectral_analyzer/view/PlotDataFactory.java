package de.anton.spectral.analyser.spectral_analyzer.view;

import de.anton.spectral.analyser.spectral_analyzer.model.DerivedMap;
import de.anton.spectral.analyser.spectral_analyzer.model.MapDiagnostics;
import de.anton.spectral.analyser.spectral_analyzer.model.SpectralDataset;
import org.jfree.data.xy.DefaultXYZDataset;
import org.jfree.data.xy.XYSeries;
import org.jfree.data.xy.XYSeriesCollection;
import org.jfree.data.xy.XYZDataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Converts maps, spectra and map diagnostics into JFreeChart datasets for a presentation layer.
 * Nothing is rendered here.
 */
public final class PlotDataFactory {

    private static final Logger logger = LoggerFactory.getLogger(PlotDataFactory.class);

    private PlotDataFactory() { throw new IllegalStateException("Utility class"); }

    /** @return a single-series XYZ dataset (x, y, result) keyed by the map name. */
    public static XYZDataset mapDataset(DerivedMap map) {
        Objects.requireNonNull(map, "Map cannot be null.");
        DefaultXYZDataset dataset = new DefaultXYZDataset();
        dataset.addSeries(map.getName(), new double[][] { map.getX(), map.getY(), map.getResults() });
        logger.trace("Created XYZ dataset for map '{}' with {} points.", map.getName(), map.size());
        return dataset;
    }

    /**
     * Splits a crisp cluster map into one scatter series per cluster label, ordered by label.
     *
     * @throws IllegalArgumentException if the map does not hold crisp clusters
     */
    public static XYSeriesCollection clusterSeries(DerivedMap map) {
        Objects.requireNonNull(map, "Map cannot be null.");
        if (!map.isCrispClusters()) {
            throw new IllegalArgumentException("Map '" + map.getName() + "' does not hold cluster labels.");
        }
        double[] x = map.getX();
        double[] y = map.getY();
        double[] labels = map.getResults();
        Map<Integer, XYSeries> byLabel = new TreeMap<>();
        for (int i = 0; i < labels.length; i++) {
            int label = (int) labels[i];
            byLabel.computeIfAbsent(label, l -> new XYSeries("Cluster " + l, false, true)).add(x[i], y[i]);
        }
        XYSeriesCollection collection = new XYSeriesCollection();
        byLabel.values().forEach(collection::addSeries);
        return collection;
    }

    /** @return the spectrum at the given (clamped) row against the wavelength axis. */
    public static XYSeries spectrumSeries(SpectralDataset dataset, int row) {
        Objects.requireNonNull(dataset, "Dataset cannot be null.");
        double[] wavelength = dataset.getWavelength();
        double[] spectrum = dataset.pointSpectrum(row);
        XYSeries series = new XYSeries("Spectrum at (" + dataset.x(row) + ", " + dataset.y(row) + ")", false, true);
        for (int j = 0; j < wavelength.length; j++) {
            series.add(wavelength[j], spectrum[j]);
        }
        return series;
    }

    /**
     * Builds the overlays kept for one row of a peak map: the baseline(s) and, for FWHM maps,
     * the half-maximum midpoint line. Empty if the map has no diagnostics.
     */
    public static XYSeriesCollection diagnosticSeries(DerivedMap map, int row) {
        Objects.requireNonNull(map, "Map cannot be null.");
        XYSeriesCollection collection = new XYSeriesCollection();
        MapDiagnostics diagnostics = map.getDiagnostics();
        if (diagnostics == null) {
            return collection;
        }
        if (diagnostics.hasBaselines()) {
            collection.addSeries(lineSeries("Baseline", diagnostics.getBaselineWavelength(), diagnostics.getBaselines()[row]));
        }
        if (diagnostics.hasSecondBaselines()) {
            collection.addSeries(lineSeries("Second baseline", diagnostics.getSecondBaselineWavelength(),
                    diagnostics.getSecondBaselines()[row]));
        }
        if (diagnostics.hasHalfMaxLines()) {
            double[] line = diagnostics.halfMaxLineOf(row);
            XYSeries series = new XYSeries("Half maximum", false, true);
            series.add(line[0], line[1]);
            series.add(line[2], line[3]);
            collection.addSeries(series);
        }
        return collection;
    }

    private static XYSeries lineSeries(String key, double[] abscissa, double[] values) {
        XYSeries series = new XYSeries(key, false, true);
        for (int j = 0; j < abscissa.length; j++) {
            series.add(abscissa[j], values[j]);
        }
        return series;
    }
}
