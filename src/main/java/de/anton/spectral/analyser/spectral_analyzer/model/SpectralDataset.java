package de.anton.spectral.analyser.spectral_analyzer.model;

import de.anton.spectral.analyser.spectral_analyzer.algorithms.ComponentAnalysis;
import de.anton.spectral.analyser.spectral_analyzer.algorithms.DistanceMetric;
import de.anton.spectral.analyser.spectral_analyzer.algorithms.PartialLeastSquaresData;
import de.anton.spectral.analyser.spectral_analyzer.algorithms.PrincipalComponentsData;
import de.anton.spectral.analyser.spectral_analyzer.algorithms.SavitzkyGolayFilter;
import de.anton.spectral.analyser.spectral_analyzer.algorithms.SpectraPreprocessor;
import de.anton.spectral.analyser.spectral_analyzer.algorithms.VertexComponentsData;
import de.anton.spectral.analyser.spectral_analyzer.service.BandRatioConfiguration;
import de.anton.spectral.analyser.spectral_analyzer.service.MultivariateAnalysisEngine;
import de.anton.spectral.analyser.spectral_analyzer.service.MultivariateAnalysisEngine.ClusteringResult;
import de.anton.spectral.analyser.spectral_analyzer.service.PeakMappingEngine;
import de.anton.spectral.analyser.spectral_analyzer.service.PeakMappingEngine.PeakMapping;
import de.anton.spectral.analyser.spectral_analyzer.service.UnivariateConfiguration;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.beans.PropertyChangeListener;
import java.beans.PropertyChangeSupport;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.function.UnaryOperator;

/**
 * A spectral imaging dataset: an N x M spectra matrix (one spectrum per spatial position),
 * the shared wavelength axis and the spatial coordinates of every spectrum.
 * <p>
 * Entry point for every preprocessing transform (applied in place, with a one-level undo snapshot)
 * and every mapping call (results are wrapped in a {@link DerivedMap} and appended to the
 * {@link MapRegistry}). All calls report through an {@link OperationResult}; an aborted call leaves
 * the spectra, the snapshot and the registry untouched.
 * <p>
 * Completed calls fire an {@link OperationRecord} as property {@value #PROPERTY_OPERATION_APPLIED}.
 * Not thread-safe: callers serialize all access.
 */
public class SpectralDataset {

    private static final Logger logger = LoggerFactory.getLogger(SpectralDataset.class);
    public static final String PROPERTY_OPERATION_APPLIED = "operationApplied";

    private final String name;
    private double[][] spectra;
    private double[] wavelength;
    private double[] x;
    private double[] y;
    private final boolean nonSpatial;
    private String xAxisDescription = "";
    private String yAxisDescription = "";

    private double[][] previousSpectra;
    private boolean previousZScoresApplied;
    private String lastOperation = "";
    private boolean zScoresApplied;
    private long spectraRevision;

    // Cached analyses, keyed on parameters plus spectra revision
    private final AnalysisCache<PrincipalComponentsData> principalComponentsCache = new AnalysisCache<>();
    private final AnalysisCache<VertexComponentsData> vertexComponentsCache = new AnalysisCache<>();
    private final AnalysisCache<PartialLeastSquaresData> partialLeastSquaresCache = new AnalysisCache<>();
    private final AnalysisCache<ClusteringResult> kMeansCache = new AnalysisCache<>();

    private final MapRegistry mapRegistry = new MapRegistry();
    private final PeakMappingEngine peakMappingEngine = new PeakMappingEngine();
    private final MultivariateAnalysisEngine multivariateEngine = new MultivariateAnalysisEngine();
    private final PropertyChangeSupport support = new PropertyChangeSupport(this);

    /**
     * Creates a spatial dataset. All arrays are copied.
     *
     * @throws IllegalArgumentException if the shapes are inconsistent or empty
     */
    public SpectralDataset(String name, double[][] spectra, double[] wavelength, double[] x, double[] y) {
        this(name, spectra, wavelength, x, y, false);
    }

    private SpectralDataset(String name, double[][] spectra, double[] wavelength, double[] x, double[] y,
                            boolean nonSpatial) {
        this.name = Objects.requireNonNull(name, "Dataset name cannot be null.");
        Objects.requireNonNull(spectra, "Spectra cannot be null.");
        Objects.requireNonNull(wavelength, "Wavelength cannot be null.");
        Objects.requireNonNull(x, "X coordinates cannot be null.");
        Objects.requireNonNull(y, "Y coordinates cannot be null.");
        if (spectra.length == 0 || wavelength.length == 0) {
            throw new IllegalArgumentException("Dataset requires at least one spectrum and one channel.");
        }
        if (x.length != spectra.length || y.length != spectra.length) {
            throw new IllegalArgumentException("Coordinate lengths (" + x.length + ", " + y.length
                    + ") must equal the spectrum count " + spectra.length);
        }
        for (int i = 0; i < spectra.length; i++) {
            if (spectra[i] == null || spectra[i].length != wavelength.length) {
                throw new IllegalArgumentException("Spectrum " + i + " does not have " + wavelength.length + " channels.");
            }
        }
        this.spectra = SpectraPreprocessor.deepCopy(spectra);
        this.wavelength = wavelength.clone();
        this.x = x.clone();
        this.y = y.clone();
        this.nonSpatial = nonSpatial;
        logger.info("Dataset '{}' created: {} spectra x {} channels{}.", name, spectra.length, wavelength.length,
                nonSpatial ? " (non-spatial)" : "");
    }

    /**
     * Creates a non-spatial copy holding only the given rows of the source, in the given order.
     * Mapping operations are not available on the result.
     */
    public static SpectralDataset subset(String name, SpectralDataset source, int[] rowIndices) {
        Objects.requireNonNull(source, "Source dataset cannot be null.");
        Objects.requireNonNull(rowIndices, "Row indices cannot be null.");
        double[][] rows = new double[rowIndices.length][];
        double[] subX = new double[rowIndices.length];
        double[] subY = new double[rowIndices.length];
        for (int k = 0; k < rowIndices.length; k++) {
            int i = rowIndices[k];
            if (i < 0 || i >= source.rowCount()) {
                throw new IllegalArgumentException("Row index " + i + " outside [0, " + source.rowCount() + ")");
            }
            rows[k] = source.spectra[i];
            subX[k] = source.x[i];
            subY[k] = source.y[i];
        }
        SpectralDataset subset = new SpectralDataset(name, rows, source.wavelength, subX, subY, true);
        subset.setAxisDescriptions(source.xAxisDescription, source.yAxisDescription);
        return subset;
    }

    public void addPropertyChangeListener(PropertyChangeListener pcl) { support.addPropertyChangeListener(pcl); }
    public void removePropertyChangeListener(PropertyChangeListener pcl) { support.removePropertyChangeListener(pcl); }

    public void setAxisDescriptions(String xAxisDescription, String yAxisDescription) {
        this.xAxisDescription = xAxisDescription != null ? xAxisDescription : "";
        this.yAxisDescription = yAxisDescription != null ? yAxisDescription : "";
    }

    // --- Transforms ---

    /**
     * Removes every spectrum whose (x, y) lies outside the closed rectangle.
     * The spectrum count changes, so the undo snapshot is discarded.
     */
    public OperationResult<Void> crop(double xMin, double xMax, double yMin, double yMax) {
        if (xMin > xMax || yMin > yMax) {
            return reject("Crop", ResultKind.INVALID_ARGUMENT, "Crop bounds are inverted.");
        }
        boolean[] keep = SpectraPreprocessor.cropMask(x, y, xMin, xMax, yMin, yMax);
        double[][] kept = SpectraPreprocessor.keepRows(spectra, keep);
        if (kept.length == 0) {
            return reject("Crop", ResultKind.INVALID_ARGUMENT, "Crop rectangle contains no spectra.");
        }
        int removed = spectra.length - kept.length;
        spectra = kept;
        x = SpectraPreprocessor.keepEntries(x, keep);
        y = SpectraPreprocessor.keepEntries(y, keep);
        previousSpectra = null;
        spectraRevision++;
        lastOperation = "Crop";
        logger.info("Dataset '{}': crop removed {} spectra, {} remain.", name, removed, spectra.length);
        fireOperation("Crop", params("x_min", xMin, "x_max", xMax, "y_min", yMin, "y_max", yMax));
        return OperationResult.success();
    }

    /** Shifts to non-negative values and scales the global maximum to 1. */
    public OperationResult<Void> minMaxNormalize() {
        return applyTransform("Min/max normalize", params(), SpectraPreprocessor::minMaxNormalize);
    }

    /** Divides every spectrum by its sum. */
    public OperationResult<Void> unitAreaNormalize() {
        return applyTransform("Unit area normalize", params(), SpectraPreprocessor::unitAreaNormalize);
    }

    /** Standardizes every channel in place and marks the spectra as z-scores. */
    public OperationResult<Void> zScoreNormalize() {
        OperationResult<Void> result = applyTransform("Z-score normalize", params(), SpectraPreprocessor::zScoreNormalize);
        zScoresApplied = true;
        return result;
    }

    /** @return the z-scored spectra; the dataset itself is not modified. */
    public double[][] zScoreNormCopy() {
        return SpectraPreprocessor.zScoreNormalize(spectra);
    }

    public OperationResult<Void> subtractBackground(double[] background) {
        Objects.requireNonNull(background, "Background cannot be null.");
        if (background.length != channelCount()) {
            return reject("Subtract background", ResultKind.DIMENSION_MISMATCH,
                    "Background has " + background.length + " channels, spectra have " + channelCount() + ".");
        }
        return applyTransform("Subtract background", params("background_channels", background.length),
                s -> SpectraPreprocessor.subtractBackground(s, background));
    }

    /**
     * Estimates a baseline with the named method and subtracts it from the spectra.
     *
     * @param method display name of a {@link BaselineMethod}
     */
    public OperationResult<Void> baseline(String method, int windowSize) {
        BaselineMethod baselineMethod = BaselineMethod.fromDisplayName(method);
        if (baselineMethod == null) {
            return reject("Baseline", ResultKind.UNSUPPORTED_METHOD, "Unknown baseline method '" + method + "'.");
        }
        String windowError = checkWindow(windowSize);
        if (windowError != null) {
            return reject("Baseline", ResultKind.INVALID_ARGUMENT, windowError);
        }
        return applyTransform("Baseline correction", params("method", baselineMethod, "window_size", windowSize),
                s -> SpectraPreprocessor.subtract(s, SpectraPreprocessor.medianBaseline(s, windowSize)));
    }

    public OperationResult<Void> medianFilter(int windowSize) {
        String windowError = checkWindow(windowSize);
        if (windowError != null) {
            return reject("Median filter", ResultKind.INVALID_ARGUMENT, windowError);
        }
        return applyTransform("Median filter", params("window_size", windowSize),
                s -> SpectraPreprocessor.medianFilter(s, windowSize));
    }

    public OperationResult<Void> linearMovingAverage(int windowSize) {
        String windowError = checkWindow(windowSize);
        if (windowError != null) {
            return reject("Moving average filter", ResultKind.INVALID_ARGUMENT, windowError);
        }
        return applyTransform("Moving average filter", params("window_size", windowSize),
                s -> SpectraPreprocessor.linearMovingAverage(s, windowSize));
    }

    /** Keeps the top {@code singularValues} singular values of the spectra matrix. */
    public OperationResult<Void> singularValueDenoise(int singularValues) {
        int maxRank = Math.min(rowCount(), channelCount());
        if (singularValues < 1 || singularValues > maxRank) {
            return reject("Truncated SVD denoise", ResultKind.INVALID_ARGUMENT,
                    "Singular value count must be in [1, " + maxRank + "], got " + singularValues + ".");
        }
        return applyTransform("Truncated SVD denoise", params("singular_values", singularValues),
                s -> SpectraPreprocessor.singularValueDenoise(s, singularValues));
    }

    /** Savitzky-Golay smoothing ({@code derivativeOrder} 0) or differentiation of every spectrum. */
    public OperationResult<Void> derivatize(int derivativeOrder, int polynomialOrder, int windowSize) {
        if (derivativeOrder < 0 || polynomialOrder < derivativeOrder
                || windowSize % 2 == 0 || windowSize <= polynomialOrder || windowSize > channelCount()) {
            return reject("Savitzky-Golay", ResultKind.INVALID_ARGUMENT,
                    "Invalid Savitzky-Golay parameters: derivative=" + derivativeOrder + ", polynomial="
                            + polynomialOrder + ", window=" + windowSize + ", channels=" + channelCount() + ".");
        }
        SavitzkyGolayFilter filter = new SavitzkyGolayFilter(derivativeOrder, polynomialOrder, windowSize);
        return applyTransform("Savitzky-Golay filtering",
                params("derivative_order", derivativeOrder, "polynomial_order", polynomialOrder, "window_size", windowSize),
                filter::apply);
    }

    /** Swaps the spectra with the snapshot taken before the last transform; calling it twice redoes. */
    public OperationResult<Void> undo() {
        if (previousSpectra == null) {
            return reject("Undo", ResultKind.NOTHING_TO_UNDO, "No previous spectra available.");
        }
        double[][] current = spectra;
        spectra = previousSpectra;
        previousSpectra = current;
        boolean currentZScores = zScoresApplied;
        zScoresApplied = previousZScoresApplied;
        previousZScoresApplied = currentZScores;
        spectraRevision++;
        lastOperation = "Undo";
        logger.info("Dataset '{}': undo applied.", name);
        fireOperation("Undo", params());
        return OperationResult.success();
    }

    private OperationResult<Void> applyTransform(String label, Map<String, Object> parameters,
                                                 UnaryOperator<double[][]> transform) {
        double[][] transformed = transform.apply(spectra);
        previousSpectra = spectra;
        previousZScoresApplied = zScoresApplied;
        spectra = transformed;
        spectraRevision++;
        lastOperation = label;
        logger.info("Dataset '{}': {} applied.", name, label);
        fireOperation(label, parameters);
        return OperationResult.success();
    }

    private String checkWindow(int windowSize) {
        if (windowSize < 1 || windowSize % 2 == 0 || windowSize > channelCount()) {
            return "Window size must be odd and in [1, " + channelCount() + "], got " + windowSize + ".";
        }
        return null;
    }

    // --- Mapping ---

    /**
     * One-region univariate map.
     *
     * @param valueMethod       display name of a {@link PeakValueMethod}
     * @param integrationMethod display name of an {@link IntegrationMethod} (Area only)
     */
    public OperationResult<DerivedMap> univariate(String name, int min, int max, String valueMethod,
                                                  String integrationMethod, int gradientIndex) {
        PeakValueMethod value = PeakValueMethod.fromDisplayName(valueMethod);
        if (value == null) {
            return reject("Univariate", ResultKind.UNSUPPORTED_METHOD, "Unknown value method '" + valueMethod + "'.");
        }
        IntegrationMethod integration = IntegrationMethod.fromDisplayName(integrationMethod);
        if (integration == null && value == PeakValueMethod.AREA) {
            return reject("Univariate", ResultKind.UNSUPPORTED_METHOD,
                    "Unknown integration method '" + integrationMethod + "'.");
        }
        return univariate(new UnivariateConfiguration(name, min, max, value, integration, gradientIndex));
    }

    public OperationResult<DerivedMap> univariate(UnivariateConfiguration config) {
        if (nonSpatial) return rejectNonSpatial("Univariate");
        OperationResult<PeakMapping> mapping = peakMappingEngine.univariate(spectra, wavelength, zScoresApplied, config);
        if (!mapping.isCompleted()) {
            return OperationResult.failure(mapping.getKind(), mapping.getMessage());
        }
        PeakMapping peaks = mapping.getValue().orElseThrow();
        DerivedMap map = newMap(config.name(), peaks.results, config.gradientIndex())
                .mapType(peaks.mapType)
                .diagnostics(peaks.diagnostics)
                .build();
        return registerMap(mapping, "Univariate", map, params("name", config.name(), "min", config.min(), "max", config.max(),
                "value_method", config.valueMethod(), "integration_method", config.integrationMethod(),
                "gradient_index", config.gradientIndex()));
    }

    /** Two-region band ratio map. Method names as for {@link #univariate(String, int, int, String, String, int)}. */
    public OperationResult<DerivedMap> bandRatio(String name, int firstMin, int firstMax, int secondMin, int secondMax,
                                                 String valueMethod, String integrationMethod, int gradientIndex) {
        PeakValueMethod value = PeakValueMethod.fromDisplayName(valueMethod);
        if (value == null) {
            return reject("Band ratio", ResultKind.UNSUPPORTED_METHOD, "Unknown value method '" + valueMethod + "'.");
        }
        IntegrationMethod integration = IntegrationMethod.fromDisplayName(integrationMethod);
        if (integration == null && value == PeakValueMethod.AREA) {
            return reject("Band ratio", ResultKind.UNSUPPORTED_METHOD,
                    "Unknown integration method '" + integrationMethod + "'.");
        }
        return bandRatio(new BandRatioConfiguration(name, firstMin, firstMax, secondMin, secondMax, value, integration,
                gradientIndex));
    }

    public OperationResult<DerivedMap> bandRatio(BandRatioConfiguration config) {
        if (nonSpatial) return rejectNonSpatial("Band ratio");
        OperationResult<PeakMapping> mapping = peakMappingEngine.bandRatio(spectra, wavelength, config);
        if (!mapping.isCompleted()) {
            return OperationResult.failure(mapping.getKind(), mapping.getMessage());
        }
        PeakMapping peaks = mapping.getValue().orElseThrow();
        DerivedMap map = newMap(config.name(), peaks.results, config.gradientIndex())
                .mapType(peaks.mapType)
                .diagnostics(peaks.diagnostics)
                .build();
        return registerMap(mapping, "Band ratio", map, params("name", config.name(),
                "first_min", config.firstMin(), "first_max", config.firstMax(),
                "second_min", config.secondMin(), "second_max", config.secondMax(),
                "value_method", config.valueMethod(), "integration_method", config.integrationMethod(),
                "gradient_index", config.gradientIndex()));
    }

    /**
     * Maps the scores of one principal component.
     *
     * @param component 1-based component number
     */
    public OperationResult<DerivedMap> principalComponents(int component, String name, int gradientIndex,
                                                           boolean recalculate) {
        return principalComponents(component, name, gradientIndex, recalculate, false);
    }

    /**
     * @param positiveScoresOnly if set, negative scores are mapped as 0
     */
    public OperationResult<DerivedMap> principalComponents(int component, String name, int gradientIndex,
                                                           boolean recalculate, boolean positiveScoresOnly) {
        if (nonSpatial) return rejectNonSpatial("Principal components");
        int available = Math.min(rowCount(), channelCount());
        if (rowCount() < 2 || component < 1 || component > available) {
            return reject("Principal components", ResultKind.INVALID_ARGUMENT,
                    "Component must be in [1, " + available + "], got " + component + ".");
        }
        PrincipalComponentsData pca = principalComponentsCache.getOrCompute(List.of(spectraRevision), recalculate,
                () -> multivariateEngine.principalComponents(spectra));
        double[] results = pca.results(component - 1);
        if (positiveScoresOnly) {
            for (int i = 0; i < results.length; i++) results[i] = Math.max(0.0, results[i]);
        }
        DerivedMap map = newMap(name, results, gradientIndex)
                .mapType("(Principal Component " + component + ")")
                .build();
        return registerMap("Principal components", map, params("component", component, "name", name,
                "gradient_index", gradientIndex, "recalculate", recalculate));
    }

    /**
     * Maps the abundance of one endmember.
     *
     * @param endmembers     number of endmembers to extract
     * @param imageComponent 1-based endmember number to map
     */
    public OperationResult<DerivedMap> vertexComponents(int endmembers, int imageComponent, String name,
                                                        int gradientIndex, boolean recalculate) {
        if (nonSpatial) return rejectNonSpatial("Vertex components");
        int maxEndmembers = Math.min(rowCount(), channelCount());
        if (endmembers < 1 || endmembers > maxEndmembers) {
            return reject("Vertex components", ResultKind.INVALID_ARGUMENT,
                    "Endmember count must be in [1, " + maxEndmembers + "], got " + endmembers + ".");
        }
        if (imageComponent < 1 || imageComponent > endmembers) {
            return reject("Vertex components", ResultKind.INVALID_ARGUMENT,
                    "Image component must be in [1, " + endmembers + "], got " + imageComponent + ".");
        }
        VertexComponentsData vca = vertexComponentsCache.getOrCompute(List.of(endmembers, spectraRevision), recalculate,
                () -> multivariateEngine.vertexComponents(spectra, endmembers));
        DerivedMap map = newMap(name, vca.results(imageComponent - 1), gradientIndex)
                .mapType("(Vertex Component " + imageComponent + ")")
                .build();
        return registerMap("Vertex components", map, params("endmembers", endmembers, "image_component", imageComponent,
                "name", name, "gradient_index", gradientIndex, "recalculate", recalculate));
    }

    /**
     * Maps one PLS X-loading column. A component beyond the ones computed is clamped to the highest
     * computed one; the map is still produced and the result is a WARNING.
     *
     * @param components     number of components to extract
     * @param imageComponent 1-based component number to map
     */
    public OperationResult<DerivedMap> partialLeastSquares(int components, int imageComponent, String name,
                                                           int gradientIndex, boolean recalculate) {
        if (nonSpatial) return rejectNonSpatial("Partial least squares");
        if (components < 1 || imageComponent < 1) {
            return reject("Partial least squares", ResultKind.INVALID_ARGUMENT,
                    "Component counts must be positive, got " + components + " and " + imageComponent + ".");
        }
        PartialLeastSquaresData pls = partialLeastSquaresCache.getOrCompute(List.of(components, spectraRevision),
                recalculate, () -> multivariateEngine.partialLeastSquares(spectra, wavelength, components));
        if (pls.componentCount() == 0) {
            partialLeastSquaresCache.clear();
            return reject("Partial least squares", ResultKind.INVALID_ARGUMENT,
                    "No PLS component could be extracted from the spectra.");
        }
        ComponentAnalysis.ComponentMap componentMap = pls.clampedResults(imageComponent - 1);
        int used = componentMap.component() + 1;
        DerivedMap map = newMap(name, componentMap.values(), gradientIndex)
                .mapType("Partial Least Squares Map number of components = " + pls.componentCount()
                        + ". Component number " + used)
                .build();
        OperationResult<DerivedMap> registered = registerMap("Partial least squares", map, params("components", components,
                "image_component", imageComponent, "name", name, "gradient_index", gradientIndex,
                "recalculate", recalculate));
        if (!componentMap.valid()) {
            String message = "Component " + imageComponent + " exceeds the " + pls.componentCount()
                    + " components calculated; mapped component " + used + " instead.";
            logger.warn("Dataset '{}': {}", this.name, message);
            return OperationResult.warning(map, message);
        }
        return registered;
    }

    /** K-means map with Euclidean distance. */
    public OperationResult<DerivedMap> kMeans(int clusters, String name) {
        return kMeans(clusters, DistanceMetric.EUCLIDEAN.toString(), name);
    }

    /**
     * Clusters the spectra and maps the 1-indexed cluster labels.
     *
     * @param clusters number of clusters, 0 to predict it
     * @param metric   display name of a {@link DistanceMetric}
     */
    public OperationResult<DerivedMap> kMeans(int clusters, String metric, String name) {
        if (nonSpatial) return rejectNonSpatial("K-means");
        DistanceMetric distanceMetric = DistanceMetric.fromDisplayName(metric);
        if (distanceMetric == null) {
            return reject("K-means", ResultKind.UNSUPPORTED_METHOD, "Unknown distance metric '" + metric + "'.");
        }
        if (clusters < 0 || clusters > rowCount()) {
            return reject("K-means", ResultKind.INVALID_ARGUMENT,
                    "Cluster count must be in [0, " + rowCount() + "], got " + clusters + ".");
        }
        ClusteringResult clustering = kMeansCache.getOrCompute(List.of(clusters, distanceMetric, spectraRevision), true,
                () -> multivariateEngine.kMeans(spectra, clusters, distanceMetric));
        DerivedMap map = newMap(name, clustering.labelsAsValues(), 0)
                .mapType("K-means clustering map. Number of clusters = " + clustering.clusterCount)
                .crispClusters(clustering.clusterCount)
                .build();
        return registerMap("K-means", map, params("clusters", clusters, "metric", distanceMetric, "name", name));
    }

    private DerivedMap.Builder newMap(String mapName, double[] results, int gradientIndex) {
        return DerivedMap.builder(mapName, results, x, y)
                .axisDescriptions(xAxisDescription, yAxisDescription)
                .gradientIndex(gradientIndex);
    }

    private OperationResult<DerivedMap> registerMap(String operation, DerivedMap map, Map<String, Object> parameters) {
        mapRegistry.add(map);
        logger.info("Dataset '{}': {} map '{}' created ({}).", name, operation, map.getName(), map.getMapType());
        fireOperation(operation, parameters);
        return OperationResult.success(map);
    }

    /** Registers the map and carries a warning of the computation over to the result. */
    private OperationResult<DerivedMap> registerMap(OperationResult<?> computation, String operation, DerivedMap map,
                                                    Map<String, Object> parameters) {
        OperationResult<DerivedMap> registered = registerMap(operation, map, parameters);
        if (computation.getKind() == ResultKind.WARNING) {
            return OperationResult.warning(map, computation.getMessage());
        }
        return registered;
    }

    private <T> OperationResult<T> rejectNonSpatial(String operation) {
        return reject(operation, ResultKind.NON_SPATIAL,
                "Dataset '" + name + "' is non-spatial; mapping functions are not available.");
    }

    private <T> OperationResult<T> reject(String operation, ResultKind kind, String message) {
        logger.warn("Dataset '{}': {} rejected ({}): {}", name, operation, kind, message);
        return OperationResult.failure(kind, message);
    }

    private void fireOperation(String operation, Map<String, Object> parameters) {
        support.firePropertyChange(PROPERTY_OPERATION_APPLIED, null,
                new OperationRecord(name, operation, parameters, Instant.now()));
    }

    private static Map<String, Object> params(Object... keyValues) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            parameters.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return parameters;
    }

    // --- Map registry ---

    public MapRegistry getMapRegistry() { return mapRegistry; }

    public Optional<DerivedMap> removeMapAt(int index) { return mapRegistry.removeAt(index); }

    public int removeMapsByName(String mapName) { return mapRegistry.removeByName(mapName); }

    public List<String> mapNames() { return mapRegistry.namesInOrder(); }

    public int mapsCreated() { return mapRegistry.countCreated(); }

    // --- Cached analyses ---

    public Optional<PrincipalComponentsData> getPrincipalComponentsData() {
        return Optional.ofNullable(principalComponentsCache.getResult());
    }

    public Optional<VertexComponentsData> getVertexComponentsData() {
        return Optional.ofNullable(vertexComponentsCache.getResult());
    }

    public Optional<PartialLeastSquaresData> getPartialLeastSquaresData() {
        return Optional.ofNullable(partialLeastSquaresCache.getResult());
    }

    public Optional<ClusteringResult> getKMeansResult() {
        return Optional.ofNullable(kMeansCache.getResult());
    }

    public boolean isPrincipalComponentsCalculated() { return principalComponentsCache.isCalculated(); }
    public boolean isVertexComponentsCalculated() { return vertexComponentsCache.isCalculated(); }
    public boolean isPartialLeastSquaresCalculated() { return partialLeastSquaresCache.isCalculated(); }
    public boolean isKMeansCalculated() { return kMeansCache.isCalculated(); }

    // --- Accessors ---

    public String getName() { return name; }
    public double[][] getSpectra() { return SpectraPreprocessor.deepCopy(spectra); }
    public double[][] getPreviousSpectra() { return previousSpectra == null ? null : SpectraPreprocessor.deepCopy(previousSpectra); }
    public double[] getWavelength() { return wavelength.clone(); }
    public double[] getX() { return x.clone(); }
    public double[] getY() { return y.clone(); }
    public String getXAxisDescription() { return xAxisDescription; }
    public String getYAxisDescription() { return yAxisDescription; }
    public String getLastOperation() { return lastOperation; }
    public boolean isZScoresApplied() { return zScoresApplied; }
    public boolean isNonSpatial() { return nonSpatial; }
    public boolean canUndo() { return previousSpectra != null; }
    public long getSpectraRevision() { return spectraRevision; }
    public int rowCount() { return spectra.length; }
    public int channelCount() { return wavelength.length; }

    /** @return spectrum of the given row; an index past the end yields the last spectrum. */
    public double[] pointSpectrum(int index) {
        return spectra[clampRow(index)].clone();
    }

    public double x(int index) { return x[clampRow(index)]; }

    public double y(int index) { return y[clampRow(index)]; }

    private int clampRow(int index) {
        return Math.max(0, Math.min(index, spectra.length - 1));
    }

    /**
     * Finds the channels closest to the given wavelengths. If {@code end} lies outside the wavelength axis,
     * the region collapses to the start channel and is flagged as a point region.
     */
    public SpectralRange findRange(double start, double end) {
        int startIndex = nearestChannel(start);
        double[] bounds = wavelengthRange();
        if (end < bounds[0] || end > bounds[1]) {
            logger.warn("Dataset '{}': upper wavelength limit {} not found, using point region at channel {}.",
                    name, end, startIndex);
            return new SpectralRange(startIndex, startIndex, true);
        }
        int endIndex = nearestChannel(end);
        return new SpectralRange(Math.min(startIndex, endIndex), Math.max(startIndex, endIndex), false);
    }

    private int nearestChannel(double value) {
        int best = 0;
        for (int j = 1; j < wavelength.length; j++) {
            if (Math.abs(wavelength[j] - value) < Math.abs(wavelength[best] - value)) best = j;
        }
        return best;
    }

    /**
     * @return one row holding the mean spectrum, plus a second row with the per-channel sample
     *         standard deviation if requested
     */
    public double[][] averageSpectrum(boolean withStdDev) {
        int n = spectra.length;
        int m = wavelength.length;
        double[] mean = new double[m];
        double[] stdDev = new double[m];
        double[] column = new double[n];
        Mean meanStat = new Mean();
        StandardDeviation sdStat = new StandardDeviation(true);
        for (int j = 0; j < m; j++) {
            for (int i = 0; i < n; i++) column[i] = spectra[i][j];
            mean[j] = meanStat.evaluate(column);
            if (withStdDev) stdDev[j] = n > 1 ? sdStat.evaluate(column, mean[j]) : 0.0;
        }
        return withStdDev ? new double[][] { mean, stdDev } : new double[][] { mean };
    }

    /** @return {min, max} of the wavelength axis. */
    public double[] wavelengthRange() { return minMax(wavelength); }

    /** @return {min, max} of the x coordinates. */
    public double[] keyRange() { return minMax(x); }

    /** @return {min, max} of the y coordinates. */
    public double[] valueRange() { return minMax(y); }

    /** @return {min, max} of the spectrum at the given (clamped) row. */
    public double[] pointSpectrumRange(int index) { return minMax(spectra[clampRow(index)]); }

    /** @return number of distinct x positions. */
    public int keySize() { return distinctCount(x); }

    /** @return number of distinct y positions. */
    public int valueSize() { return distinctCount(y); }

    private static double[] minMax(double[] values) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double v : values) {
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        return new double[] { min, max };
    }

    private static int distinctCount(double[] values) {
        TreeSet<Double> distinct = new TreeSet<>();
        for (double v : values) distinct.add(v);
        return distinct.size();
    }

    @Override
    public String toString() {
        return "SpectralDataset{name='" + name + "', spectra=" + spectra.length + "x" + wavelength.length
                + (nonSpatial ? ", non-spatial" : "") + ", maps=" + mapRegistry.size()
                + ", coordinates=" + Arrays.toString(keyRange()) + "/" + Arrays.toString(valueRange()) + '}';
    }
}
