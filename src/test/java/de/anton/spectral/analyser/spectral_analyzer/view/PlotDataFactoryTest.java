package de.anton.spectral.analyser.spectral_analyzer.view;

import de.anton.spectral.analyser.spectral_analyzer.model.DerivedMap;
import de.anton.spectral.analyser.spectral_analyzer.model.MapDiagnostics;
import de.anton.spectral.analyser.spectral_analyzer.model.SpectralDataset;
import org.jfree.data.xy.XYSeries;
import org.jfree.data.xy.XYSeriesCollection;
import org.jfree.data.xy.XYZDataset;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PlotDataFactoryTest {

    private static final double[] X = { 0, 1, 0, 1 };
    private static final double[] Y = { 0, 0, 1, 1 };

    @Test
    void mapDatasetHoldsOneSeries() {
        DerivedMap map = DerivedMap.builder("height", new double[] { 5, 6, 7, 8 }, X, Y).build();
        XYZDataset dataset = PlotDataFactory.mapDataset(map);
        assertEquals(1, dataset.getSeriesCount());
        assertEquals("height", dataset.getSeriesKey(0));
        assertEquals(4, dataset.getItemCount(0));
        assertEquals(7.0, dataset.getZValue(0, 2), 0.0);
        assertEquals(1.0, dataset.getYValue(0, 2), 0.0);
    }

    @Test
    void clusterMapSplitsIntoSeriesPerLabel() {
        DerivedMap map = DerivedMap.builder("k", new double[] { 2, 1, 2, 2 }, X, Y).crispClusters(2).build();
        XYSeriesCollection collection = PlotDataFactory.clusterSeries(map);
        assertEquals(2, collection.getSeriesCount());
        assertEquals("Cluster 1", collection.getSeriesKey(0));
        assertEquals(1, collection.getSeries(0).getItemCount());
        assertEquals(3, collection.getSeries(1).getItemCount());

        DerivedMap plain = DerivedMap.builder("p", new double[4], X, Y).build();
        assertThrows(IllegalArgumentException.class, () -> PlotDataFactory.clusterSeries(plain));
    }

    @Test
    void spectrumSeriesFollowsWavelengthAxis() {
        SpectralDataset dataset = new SpectralDataset("d", new double[][] { { 1, 2, 3 }, { 4, 5, 6 } },
                new double[] { 10, 20, 30 }, new double[] { 0, 1 }, new double[] { 0, 0 });
        XYSeries series = PlotDataFactory.spectrumSeries(dataset, 1);
        assertEquals(3, series.getItemCount());
        assertEquals(20.0, series.getX(1).doubleValue(), 0.0);
        assertEquals(5.0, series.getY(1).doubleValue(), 0.0);
    }

    @Test
    void diagnosticOverlaysForBandwidthMap() {
        MapDiagnostics diagnostics = MapDiagnostics.ofBandwidth(new double[] { 100, 110, 120 },
                new double[][] { { 0, 0.5, 1 }, { 1, 1, 1 } },
                new double[][] { { 100, 0.4, 120, 0.6 }, { 105, 2, 115, 2 } });
        DerivedMap map = DerivedMap.builder("fwhm", new double[] { 20, 10 }, new double[] { 0, 1 }, new double[] { 0, 0 })
                .diagnostics(diagnostics)
                .build();
        XYSeriesCollection overlays = PlotDataFactory.diagnosticSeries(map, 1);
        assertEquals(2, overlays.getSeriesCount());
        assertEquals("Baseline", overlays.getSeriesKey(0));
        assertEquals(3, overlays.getSeries(0).getItemCount());
        XYSeries halfMax = overlays.getSeries("Half maximum");
        assertEquals(105.0, halfMax.getX(0).doubleValue(), 0.0);
        assertEquals(115.0, halfMax.getX(1).doubleValue(), 0.0);

        DerivedMap bare = DerivedMap.builder("bare", new double[] { 1, 2 }, new double[] { 0, 1 }, new double[] { 0, 0 })
                .build();
        assertEquals(0, PlotDataFactory.diagnosticSeries(bare, 0).getSeriesCount());
    }
}
