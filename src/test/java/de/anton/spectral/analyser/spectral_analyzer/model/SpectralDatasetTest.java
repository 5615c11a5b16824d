package de.anton.spectral.analyser.spectral_analyzer.model;

import de.anton.spectral.analyser.spectral_analyzer.algorithms.PrincipalComponentsData;
import de.anton.spectral.analyser.spectral_analyzer.algorithms.VertexComponentsData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SpectralDatasetTest {

    private static final int COLS = 4;
    private static final int ROWS = 3;
    private static final int CHANNELS = 21;
    private static final double TOL = 1e-9;

    private SpectralDataset dataset;
    private double[][] original;

    /** 4 x 3 grid, every spectrum a Gaussian peak on a sloped background. */
    static SpectralDataset gridDataset(String name) {
        int n = COLS * ROWS;
        double[][] spectra = new double[n][CHANNELS];
        double[] wavelength = new double[CHANNELS];
        double[] x = new double[n];
        double[] y = new double[n];
        for (int j = 0; j < CHANNELS; j++) wavelength[j] = 1000.0 + 2.0 * j;
        for (int i = 0; i < n; i++) {
            x[i] = i / ROWS;
            y[i] = i % ROWS;
            double height = 1.0 + 0.5 * i;
            for (int j = 0; j < CHANNELS; j++) {
                spectra[i][j] = 0.05 * j + height * Math.exp(-(j - 10.0) * (j - 10.0) / 8.0) + 0.01 * ((i + j) % 3);
            }
        }
        SpectralDataset dataset = new SpectralDataset(name, spectra, wavelength, x, y);
        dataset.setAxisDescriptions("Raman shift (cm-1)", "Intensity (a.u.)");
        return dataset;
    }

    @BeforeEach
    void setUp() {
        dataset = gridDataset("grid");
        original = dataset.getSpectra();
    }

    private static void assertMatrixEquals(double[][] expected, double[][] actual, double tol) {
        assertEquals(expected.length, actual.length);
        for (int i = 0; i < expected.length; i++) {
            assertArrayEquals(expected[i], actual[i], tol, "row " + i);
        }
    }

    @Test
    void constructorRejectsInconsistentShapes() {
        assertThrows(IllegalArgumentException.class,
                () -> new SpectralDataset("bad", new double[2][3], new double[3], new double[2], new double[1]));
        assertThrows(IllegalArgumentException.class,
                () -> new SpectralDataset("bad", new double[2][3], new double[4], new double[2], new double[2]));
        assertThrows(NullPointerException.class,
                () -> new SpectralDataset("bad", null, new double[3], new double[2], new double[2]));
    }

    @Test
    void undoSwapsBackAndForth() {
        assertEquals(ResultKind.NOTHING_TO_UNDO, dataset.undo().getKind());
        assertTrue(dataset.minMaxNormalize().isCompleted());
        double[][] normalized = dataset.getSpectra();
        assertEquals("Min/max normalize", dataset.getLastOperation());

        assertEquals(ResultKind.SUCCESS, dataset.undo().getKind());
        assertMatrixEquals(original, dataset.getSpectra(), 0.0);
        assertEquals("Undo", dataset.getLastOperation());

        dataset.undo();
        assertMatrixEquals(normalized, dataset.getSpectra(), 0.0);
    }

    @Test
    void zScoreFlagFollowsUndo() {
        dataset.zScoreNormalize();
        assertTrue(dataset.isZScoresApplied());
        double[][] z = dataset.getSpectra();
        for (int j = 0; j < CHANNELS; j++) {
            double mean = 0;
            for (double[] row : z) mean += row[j];
            assertEquals(0.0, mean / z.length, TOL);
        }
        dataset.undo();
        assertFalse(dataset.isZScoresApplied());
        dataset.undo();
        assertTrue(dataset.isZScoresApplied());
    }

    @Test
    void zScoreCopyLeavesDatasetUntouched() {
        double[][] copy = dataset.zScoreNormCopy();
        assertNotNull(copy);
        assertMatrixEquals(original, dataset.getSpectra(), 0.0);
        assertFalse(dataset.isZScoresApplied());
        assertFalse(dataset.canUndo());
    }

    @Test
    void unitAreaNormalizeGivesUnitRowSums() {
        dataset.unitAreaNormalize();
        for (double[] row : dataset.getSpectra()) {
            double sum = 0;
            for (double v : row) sum += v;
            assertEquals(1.0, sum, TOL);
        }
    }

    @Test
    void cropRemovesAdjacentOutOfRangeRowsAndDropsSnapshot() {
        dataset.minMaxNormalize();
        assertTrue(dataset.canUndo());
        // x runs 0,0,0,1,1,1,2,2,2,3,3,3; keep x in [1, 2] and y in [0, 1]
        OperationResult<Void> result = dataset.crop(1, 2, 0, 1);
        assertEquals(ResultKind.SUCCESS, result.getKind());
        assertEquals(4, dataset.rowCount());
        assertArrayEquals(new double[] { 1, 1, 2, 2 }, dataset.getX(), 0.0);
        assertArrayEquals(new double[] { 0, 1, 0, 1 }, dataset.getY(), 0.0);
        assertFalse(dataset.canUndo());
        assertEquals(ResultKind.NOTHING_TO_UNDO, dataset.undo().getKind());
    }

    @Test
    void cropRejectsEmptyOrInvertedRectangles() {
        assertEquals(ResultKind.INVALID_ARGUMENT, dataset.crop(2, 1, 0, 1).getKind());
        assertEquals(ResultKind.INVALID_ARGUMENT, dataset.crop(10, 20, 10, 20).getKind());
        assertEquals(COLS * ROWS, dataset.rowCount());
    }

    @Test
    void backgroundOfWrongLengthIsRejectedWithoutMutation() {
        OperationResult<Void> result = dataset.subtractBackground(new double[CHANNELS + 1]);
        assertEquals(ResultKind.DIMENSION_MISMATCH, result.getKind());
        assertFalse(dataset.canUndo());
        assertMatrixEquals(original, dataset.getSpectra(), 0.0);

        double[] background = new double[CHANNELS];
        background[0] = 1.0;
        assertTrue(dataset.subtractBackground(background).isCompleted());
        assertEquals(original[0][0] - 1.0, dataset.getSpectra()[0][0], TOL);
    }

    @Test
    void unknownBaselineMethodIsUnsupported() {
        assertEquals(ResultKind.UNSUPPORTED_METHOD, dataset.baseline("Rolling Ball", 5).getKind());
        assertFalse(dataset.canUndo());
        assertEquals(ResultKind.INVALID_ARGUMENT, dataset.baseline("Median Filter", 4).getKind());
        assertEquals(ResultKind.SUCCESS, dataset.baseline("median filter", 5).getKind());
        double[] corrected = dataset.pointSpectrum(0);
        assertEquals(0.0, corrected[0], TOL);
        assertEquals(0.0, corrected[CHANNELS - 1], TOL);
    }

    @Test
    void filtersValidateWindow() {
        assertEquals(ResultKind.INVALID_ARGUMENT, dataset.medianFilter(2).getKind());
        assertEquals(ResultKind.INVALID_ARGUMENT, dataset.linearMovingAverage(CHANNELS + 2).getKind());
        assertEquals(ResultKind.SUCCESS, dataset.medianFilter(3).getKind());
        assertEquals(ResultKind.SUCCESS, dataset.linearMovingAverage(3).getKind());
    }

    @Test
    void fullRankSvdDenoiseReproducesSpectra() {
        assertEquals(ResultKind.SUCCESS, dataset.singularValueDenoise(COLS * ROWS).getKind());
        assertMatrixEquals(original, dataset.getSpectra(), 1e-9);
        assertEquals(ResultKind.INVALID_ARGUMENT, dataset.singularValueDenoise(0).getKind());
    }

    @Test
    void savitzkyGolaySmoothingKeepsPolynomialSpectra() {
        double[][] spectra = new double[2][15];
        double[] wavelength = new double[15];
        for (int j = 0; j < 15; j++) {
            wavelength[j] = 200.0 + 5.0 * j;
            spectra[0][j] = 0.5 * j * j - j + 3;
            spectra[1][j] = 2 * j;
        }
        SpectralDataset polynomial = new SpectralDataset("poly", spectra, wavelength,
                new double[] { 0, 1 }, new double[] { 0, 0 });
        assertEquals(ResultKind.SUCCESS, polynomial.derivatize(0, 2, 5).getKind());
        assertMatrixEquals(spectra, polynomial.getSpectra(), 1e-8);
        polynomial.undo();
        assertEquals(ResultKind.SUCCESS, polynomial.derivatize(1, 2, 5).getKind());
        double[] derivative = polynomial.pointSpectrum(0);
        for (int j = 0; j < 15; j++) assertEquals(j - 1.0, derivative[j], 1e-8);
        assertEquals(ResultKind.INVALID_ARGUMENT, polynomial.derivatize(3, 2, 5).getKind());
        assertEquals(ResultKind.INVALID_ARGUMENT, polynomial.derivatize(0, 2, 17).getKind());
    }

    @Test
    void mappingIsRejectedOnNonSpatialDatasets() {
        SpectralDataset subset = SpectralDataset.subset("subset", dataset, new int[] { 0, 2, 4 });
        assertTrue(subset.isNonSpatial());
        assertEquals(3, subset.rowCount());
        assertArrayEquals(dataset.pointSpectrum(2), subset.pointSpectrum(1), 0.0);

        assertEquals(ResultKind.NON_SPATIAL, subset.univariate("u", 5, 15, "Intensity", "", 0).getKind());
        assertEquals(ResultKind.NON_SPATIAL, subset.bandRatio("b", 1, 5, 8, 12, "Area", "Riemann Sum", 0).getKind());
        assertEquals(ResultKind.NON_SPATIAL, subset.principalComponents(1, "p", 0, false).getKind());
        assertEquals(ResultKind.NON_SPATIAL, subset.vertexComponents(2, 1, "v", 0, false).getKind());
        assertEquals(ResultKind.NON_SPATIAL, subset.partialLeastSquares(2, 1, "pls", 0, false).getKind());
        assertEquals(ResultKind.NON_SPATIAL, subset.kMeans(2, "k").getKind());
        assertEquals(0, subset.getMapRegistry().size());
        assertFalse(subset.isPrincipalComponentsCalculated());

        assertTrue(subset.minMaxNormalize().isCompleted());
    }

    @Test
    void univariateMapsAreRegisteredWithDiagnostics() {
        OperationResult<DerivedMap> area = dataset.univariate("area", 2, 18, "Area", "Riemann Sum", 3);
        assertEquals(ResultKind.SUCCESS, area.getKind());
        DerivedMap map = area.getValue().orElseThrow();
        assertEquals("1-Region Univariate (Area)", map.getMapType());
        assertEquals(COLS * ROWS, map.size());
        assertEquals(3, map.getGradientIndex());
        assertTrue(map.getDiagnostics().hasBaselines());
        assertEquals(17, map.getDiagnostics().baselineOf(0).length);
        assertEquals("Raman shift (cm-1)", map.getXDescription());

        OperationResult<DerivedMap> width = dataset.univariate("width", 2, 18, "Bandwidth", null, 0);
        assertTrue(width.getValue().orElseThrow().getDiagnostics().hasHalfMaxLines());

        assertEquals(ResultKind.UNSUPPORTED_METHOD, dataset.univariate("d", 2, 18, "Derivative", null, 0).getKind());
        assertEquals(ResultKind.UNSUPPORTED_METHOD, dataset.univariate("a", 2, 18, "Area", "Simpson", 0).getKind());
        assertEquals(ResultKind.INVALID_ARGUMENT, dataset.univariate("r", 18, 2, "Intensity", null, 0).getKind());
        assertEquals(ResultKind.INVALID_ARGUMENT, dataset.univariate("r", 0, CHANNELS, "Intensity", null, 0).getKind());

        assertEquals(2, dataset.getMapRegistry().size());
        assertEquals(2, dataset.mapsCreated());
    }

    @Test
    void intensityMapFollowsPeakHeight() {
        DerivedMap map = dataset.univariate("height", 5, 15, "Intensity", null, 0).getValue().orElseThrow();
        double[] results = map.getResults();
        for (int i = 1; i < results.length; i++) {
            assertTrue(results[i] > results[i - 1]);
        }
    }

    @Test
    void principalComponentsAreCachedUntilSpectraChange() {
        assertEquals(ResultKind.SUCCESS, dataset.principalComponents(1, "pc1", 0, false).getKind());
        PrincipalComponentsData first = dataset.getPrincipalComponentsData().orElseThrow();
        dataset.principalComponents(2, "pc2", 0, false);
        assertSame(first, dataset.getPrincipalComponentsData().orElseThrow());

        dataset.principalComponents(1, "pc1 again", 0, true);
        assertNotSame(first, dataset.getPrincipalComponentsData().orElseThrow());

        PrincipalComponentsData second = dataset.getPrincipalComponentsData().orElseThrow();
        dataset.minMaxNormalize();
        dataset.principalComponents(1, "after transform", 0, false);
        assertNotSame(second, dataset.getPrincipalComponentsData().orElseThrow());

        assertEquals(ResultKind.INVALID_ARGUMENT, dataset.principalComponents(0, "zero", 0, false).getKind());
        assertEquals("(Principal Component 2)", dataset.getMapRegistry().get(1).getMapType());
    }

    @Test
    void positiveScoresOnlyZeroesNegativeScores() {
        DerivedMap map = dataset.principalComponents(1, "pc1", 0, false, true).getValue().orElseThrow();
        for (double v : map.getResults()) assertTrue(v >= 0.0);
    }

    @Test
    void vertexComponentsRecomputeWhenEndmemberCountChanges() {
        dataset.vertexComponents(2, 1, "v1", 0, false);
        VertexComponentsData first = dataset.getVertexComponentsData().orElseThrow();
        dataset.vertexComponents(2, 2, "v2", 0, false);
        assertSame(first, dataset.getVertexComponentsData().orElseThrow());
        dataset.vertexComponents(3, 1, "v3", 0, false);
        assertNotSame(first, dataset.getVertexComponentsData().orElseThrow());
        assertEquals(3, dataset.getVertexComponentsData().orElseThrow().componentCount());

        assertEquals(ResultKind.INVALID_ARGUMENT, dataset.vertexComponents(2, 3, "bad", 0, false).getKind());
        assertEquals(ResultKind.INVALID_ARGUMENT, dataset.vertexComponents(0, 1, "bad", 0, false).getKind());
    }

    @Test
    void partialLeastSquaresClampsAndWarns() {
        OperationResult<DerivedMap> ok = dataset.partialLeastSquares(2, 1, "pls1", 0, false);
        assertEquals(ResultKind.SUCCESS, ok.getKind());
        int computed = dataset.getPartialLeastSquaresData().orElseThrow().componentCount();

        OperationResult<DerivedMap> clamped = dataset.partialLeastSquares(2, 5, "pls5", 0, false);
        assertEquals(ResultKind.WARNING, clamped.getKind());
        assertTrue(clamped.isCompleted());
        DerivedMap map = clamped.getValue().orElseThrow();
        assertTrue(map.getMapType().endsWith("Component number " + computed));
        assertArrayEquals(dataset.getPartialLeastSquaresData().orElseThrow().results(computed - 1), map.getResults(), 0.0);
        assertEquals(2, dataset.getMapRegistry().size());
    }

    @Test
    void kMeansLabelsAreOneIndexedAndCrisp() {
        OperationResult<DerivedMap> result = dataset.kMeans(3, "Manhattan", "clusters");
        assertEquals(ResultKind.SUCCESS, result.getKind());
        DerivedMap map = result.getValue().orElseThrow();
        assertTrue(map.isCrispClusters());
        assertEquals(3, map.getClusterCount());
        for (double label : map.getResults()) {
            assertTrue(label >= 1 && label <= 3);
            assertEquals(Math.rint(label), label, 0.0);
        }
        assertTrue(dataset.isKMeansCalculated());
        assertEquals("K-means clustering map. Number of clusters = 3", map.getMapType());

        assertEquals(ResultKind.UNSUPPORTED_METHOD, dataset.kMeans(3, "Cosine", "bad").getKind());
        assertEquals(ResultKind.INVALID_ARGUMENT, dataset.kMeans(COLS * ROWS + 1, "bad").getKind());
    }

    @Test
    void kMeansPredictsClusterCountWhenZero() {
        DerivedMap map = dataset.kMeans(0, "predicted").getValue().orElseThrow();
        assertTrue(map.getClusterCount() >= 1);
        assertTrue(dataset.getKMeansResult().orElseThrow().predicted);
    }

    @Test
    void mapsAreRemovedByNameOrIndex() {
        dataset.univariate("dup", 5, 15, "Intensity", null, 0);
        dataset.univariate("keep", 5, 15, "Intensity", null, 0);
        dataset.univariate("dup", 5, 15, "Area", "Riemann Sum", 0);
        assertEquals(List.of("dup", "keep", "dup"), dataset.mapNames());

        assertEquals(2, dataset.removeMapsByName("dup"));
        assertEquals(List.of("keep"), dataset.mapNames());
        assertTrue(dataset.removeMapAt(0).isPresent());
        assertFalse(dataset.removeMapAt(0).isPresent());
        assertEquals(3, dataset.mapsCreated());
    }

    @Test
    void operationsAreReportedToListeners() {
        OperationLog log = new OperationLog();
        dataset.addPropertyChangeListener(log);
        dataset.medianFilter(5);
        dataset.univariate("height", 5, 15, "Intensity", null, 0);
        dataset.subtractBackground(new double[1]); // rejected, not recorded

        assertEquals(2, log.size());
        assertEquals("Median filter", log.getRecords().get(0).operation());
        assertEquals(5, log.getRecords().get(0).parameters().get("window_size"));
        assertEquals("grid", log.getRecords().get(1).datasetName());
        String text = log.toText();
        assertTrue(text.contains("window_size == 5"));
        assertTrue(text.contains("name == height"));

        dataset.removePropertyChangeListener(log);
        dataset.minMaxNormalize();
        assertEquals(2, log.size());
    }

    @Test
    void indexAccessorsClampToLastRow() {
        int last = dataset.rowCount() - 1;
        assertArrayEquals(dataset.pointSpectrum(last), dataset.pointSpectrum(last + 50), 0.0);
        assertEquals(dataset.x(last), dataset.x(1000), 0.0);
        assertEquals(dataset.y(last), dataset.y(1000), 0.0);
    }

    @Test
    void findRangeLocatesNearestChannels() {
        SpectralRange range = dataset.findRange(1009.2, 1020.9);
        assertEquals(5, range.minIndex());
        assertEquals(10, range.maxIndex());
        assertFalse(range.pointRegion());

        SpectralRange point = dataset.findRange(1010.0, 2000.0);
        assertTrue(point.pointRegion());
        assertEquals(5, point.minIndex());
        assertEquals(1, point.width());
    }

    @Test
    void rangesAndGridSizes() {
        assertArrayEquals(new double[] { 1000.0, 1040.0 }, dataset.wavelengthRange(), 0.0);
        assertArrayEquals(new double[] { 0.0, 3.0 }, dataset.keyRange(), 0.0);
        assertArrayEquals(new double[] { 0.0, 2.0 }, dataset.valueRange(), 0.0);
        assertEquals(COLS, dataset.keySize());
        assertEquals(ROWS, dataset.valueSize());
        double[] spectrumRange = dataset.pointSpectrumRange(0);
        assertTrue(spectrumRange[1] > spectrumRange[0]);
    }

    @Test
    void averageSpectrumWithStandardDeviation() {
        double[][] average = dataset.averageSpectrum(true);
        assertEquals(2, average.length);
        double mean = 0;
        for (double[] row : original) mean += row[10];
        assertEquals(mean / original.length, average[0][10], TOL);
        assertTrue(average[1][10] > 0);
        assertEquals(1, dataset.averageSpectrum(false).length);
    }

    @Test
    void accessorsReturnCopies() {
        dataset.getSpectra()[0][0] = 1e6;
        dataset.getWavelength()[0] = -1;
        assertEquals(original[0][0], dataset.getSpectra()[0][0], 0.0);
        assertEquals(1000.0, dataset.getWavelength()[0], 0.0);
    }

    @Test
    void pointRegionFromFindRangeIsMappedWithWarning() {
        SpectralRange point = dataset.findRange(1010.0, 2000.0);
        OperationResult<DerivedMap> result = dataset.univariate("pt", point.minIndex(), point.maxIndex(), "Intensity", null, 0);
        assertEquals(ResultKind.WARNING, result.getKind());
        assertNotNull(result.getMessage());
        DerivedMap map = result.getValue().orElseThrow();
        for (int i = 0; i < dataset.rowCount(); i++) {
            assertEquals(dataset.pointSpectrum(i)[5], map.getResults()[i], 0.0);
        }
        assertEquals(1, dataset.getMapRegistry().size());
        assertEquals(1, dataset.mapsCreated());

        OperationResult<DerivedMap> ratio = dataset.bandRatio("pt ratio", 5, 5, 10, 12, "Area", "Riemann Sum", 0);
        assertEquals(ResultKind.WARNING, ratio.getKind());
        assertEquals(2, dataset.getMapRegistry().size());
    }

    @Test
    void tinyMagnitudeSpectraStillYieldPartialLeastSquares() {
        double[][] spectra = dataset.getSpectra();
        for (double[] row : spectra) {
            for (int j = 0; j < row.length; j++) row[j] *= 1e-9;
        }
        SpectralDataset tiny = new SpectralDataset("tiny", spectra, dataset.getWavelength(), dataset.getX(), dataset.getY());
        assertEquals(ResultKind.SUCCESS, dataset.partialLeastSquares(2, 1, "pls", 0, false).getKind());
        OperationResult<DerivedMap> result = tiny.partialLeastSquares(2, 1, "pls", 0, false);
        assertEquals(ResultKind.SUCCESS, result.getKind());
        assertEquals(dataset.getPartialLeastSquaresData().orElseThrow().componentCount(),
                tiny.getPartialLeastSquaresData().orElseThrow().componentCount());

        OperationResult<Void> unitArea = tiny.unitAreaNormalize();
        assertTrue(unitArea.isCompleted());
        double sum = 0;
        for (double v : tiny.pointSpectrum(0)) sum += v;
        assertEquals(1.0, sum, 1e-9);
    }
}
