package de.anton.spectral.analyser.spectral_analyzer.service;

import de.anton.spectral.analyser.spectral_analyzer.algorithms.PeakMetrics;
import de.anton.spectral.analyser.spectral_analyzer.model.IntegrationMethod;
import de.anton.spectral.analyser.spectral_analyzer.model.MapDiagnostics;
import de.anton.spectral.analyser.spectral_analyzer.model.OperationResult;
import de.anton.spectral.analyser.spectral_analyzer.model.PeakValueMethod;
import de.anton.spectral.analyser.spectral_analyzer.model.ResultKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Objects;

/**
 * Service extracting one scalar per spectrum from spectral regions: univariate
 * (Intensity, Area, Bandwidth) and band ratio (Intensity, Area) quantification.
 * Stateless; the caller supplies the current spectra and decides what to do with the result.
 */
public class PeakMappingEngine {

    private static final Logger logger = LoggerFactory.getLogger(PeakMappingEngine.class);

    /**
     * Values of a peak map, its type label and the optional diagnostics.
     */
    public static class PeakMapping {
        public final double[] results;
        public final String mapType;
        public final MapDiagnostics diagnostics; // null for intensity maps

        private PeakMapping(double[] results, String mapType, MapDiagnostics diagnostics) {
            this.results = results;
            this.mapType = mapType;
            this.diagnostics = diagnostics;
        }
    }

    /**
     * Computes a one-region univariate map.
     *
     * @return INVALID_ARGUMENT for a bad region, UNSUPPORTED_METHOD for Derivative or an unknown
     *         integration method, WARNING with the mapping for a single-channel region, SUCCESS otherwise
     */
    public OperationResult<PeakMapping> univariate(double[][] spectra, double[] wavelength, boolean zScoresApplied,
                                                   UnivariateConfiguration config) {
        Objects.requireNonNull(spectra, "Spectra cannot be null.");
        Objects.requireNonNull(config, "Configuration cannot be null.");
        int min = config.min();
        int max = config.max();
        String regionError = checkRegion(min, max, wavelength.length);
        if (regionError != null) {
            logger.warn("Univariate map '{}' rejected: {}", config.name(), regionError);
            return OperationResult.failure(ResultKind.INVALID_ARGUMENT, regionError);
        }
        int rows = spectra.length;
        double[] results = new double[rows];
        logger.debug("Univariate {} map over channels [{}, {}] for {} spectra.", config.valueMethod(), min, max, rows);

        switch (config.valueMethod()) {
            case INTENSITY: {
                for (int i = 0; i < rows; i++) {
                    results[i] = PeakMetrics.intensity(spectra[i], min, max, zScoresApplied);
                }
                return completed(new PeakMapping(results, "1-Region Univariate (Intensity)", null), min == max);
            }
            case AREA: {
                if (config.integrationMethod() != IntegrationMethod.RIEMANN_SUM) {
                    return unsupported("Integration method " + config.integrationMethod());
                }
                double[][] baselines = new double[rows][];
                for (int i = 0; i < rows; i++) {
                    baselines[i] = PeakMetrics.linearBaseline(spectra[i], min, max);
                    results[i] = PeakMetrics.area(spectra[i], min, max, baselines[i]);
                }
                MapDiagnostics diagnostics = MapDiagnostics.ofBaselines(abscissa(wavelength, min, max), baselines);
                return completed(new PeakMapping(results, "1-Region Univariate (Area)", diagnostics), min == max);
            }
            case BANDWIDTH: {
                double[][] baselines = new double[rows][];
                double[][] midLines = new double[rows][];
                for (int i = 0; i < rows; i++) {
                    PeakMetrics.Bandwidth bandwidth = PeakMetrics.bandwidth(spectra[i], wavelength, min, max);
                    results[i] = bandwidth.width();
                    baselines[i] = bandwidth.baseline();
                    midLines[i] = new double[] {
                            wavelength[bandwidth.leftIndex()], spectra[i][bandwidth.leftIndex()],
                            wavelength[bandwidth.rightIndex()], spectra[i][bandwidth.rightIndex()] };
                }
                MapDiagnostics diagnostics = MapDiagnostics.ofBandwidth(abscissa(wavelength, min, max), baselines, midLines);
                return completed(new PeakMapping(results, "1-Region Univariate (Bandwidth (FWHM))", diagnostics),
                        min == max);
            }
            default:
                return unsupported("Value method " + config.valueMethod());
        }
    }

    /**
     * Computes a two-region band ratio map, first region value divided by second region value.
     *
     * @return INVALID_ARGUMENT for a bad region, UNSUPPORTED_METHOD for Bandwidth, Derivative or an
     *         unknown integration method, WARNING with the mapping if either region is a single channel,
     *         SUCCESS otherwise
     */
    public OperationResult<PeakMapping> bandRatio(double[][] spectra, double[] wavelength, BandRatioConfiguration config) {
        Objects.requireNonNull(spectra, "Spectra cannot be null.");
        Objects.requireNonNull(config, "Configuration cannot be null.");
        String regionError = checkRegion(config.firstMin(), config.firstMax(), wavelength.length);
        if (regionError == null) {
            regionError = checkRegion(config.secondMin(), config.secondMax(), wavelength.length);
        }
        if (regionError != null) {
            logger.warn("Band ratio map '{}' rejected: {}", config.name(), regionError);
            return OperationResult.failure(ResultKind.INVALID_ARGUMENT, regionError);
        }
        int rows = spectra.length;
        double[] results = new double[rows];
        boolean singleChannel = config.firstMin() == config.firstMax() || config.secondMin() == config.secondMax();

        if (config.valueMethod() == PeakValueMethod.AREA) {
            if (config.integrationMethod() != IntegrationMethod.RIEMANN_SUM) {
                return unsupported("Integration method " + config.integrationMethod());
            }
            double[][] firstBaselines = new double[rows][];
            double[][] secondBaselines = new double[rows][];
            for (int i = 0; i < rows; i++) {
                firstBaselines[i] = PeakMetrics.linearBaseline(spectra[i], config.firstMin(), config.firstMax());
                secondBaselines[i] = PeakMetrics.linearBaseline(spectra[i], config.secondMin(), config.secondMax());
                double first = PeakMetrics.area(spectra[i], config.firstMin(), config.firstMax(), firstBaselines[i]);
                double second = PeakMetrics.area(spectra[i], config.secondMin(), config.secondMax(), secondBaselines[i]);
                results[i] = first / second;
            }
            MapDiagnostics diagnostics = MapDiagnostics.ofBandRatio(
                    abscissa(wavelength, config.firstMin(), config.firstMax()), firstBaselines,
                    abscissa(wavelength, config.secondMin(), config.secondMax()), secondBaselines);
            return completed(new PeakMapping(results, "2-Region Band Ratio Map (Area)", diagnostics), singleChannel);
        }
        if (config.valueMethod() == PeakValueMethod.INTENSITY) {
            for (int i = 0; i < rows; i++) {
                double first = PeakMetrics.intensity(spectra[i], config.firstMin(), config.firstMax(), false);
                double second = PeakMetrics.intensity(spectra[i], config.secondMin(), config.secondMax(), false);
                results[i] = first / second;
            }
            return completed(new PeakMapping(results, "2-Region Band Ratio Map (Intensity)", null), singleChannel);
        }
        return unsupported("Value method " + config.valueMethod() + " for band ratios");
    }

    /** @return an error message, or null if 0 &lt;= min &lt;= max &lt; channels. */
    static String checkRegion(int min, int max, int channels) {
        if (min < 0 || max >= channels || min > max) {
            return "Invalid region [" + min + ", " + max + "] for " + channels + " channels";
        }
        return null;
    }

    private static OperationResult<PeakMapping> completed(PeakMapping mapping, boolean singleChannel) {
        if (singleChannel) {
            logger.warn("{} computed over a single-channel region.", mapping.mapType);
            return OperationResult.warning(mapping, "Region is a single channel; "
                    + mapping.mapType + " was computed from one point.");
        }
        return OperationResult.success(mapping);
    }

    private static double[] abscissa(double[] wavelength, int min, int max) {
        return Arrays.copyOfRange(wavelength, min, max + 1);
    }

    private static <T> OperationResult<T> unsupported(String what) {
        logger.warn("{} is not supported for peak mapping.", what);
        return OperationResult.failure(ResultKind.UNSUPPORTED_METHOD, what + " is not supported.");
    }
}
