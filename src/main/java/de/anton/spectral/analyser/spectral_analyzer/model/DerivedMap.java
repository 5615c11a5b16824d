package de.anton.spectral.analyser.spectral_analyzer.model;

import java.util.Objects;

/**
 * A named scalar image: one result value per spatial row of the source dataset,
 * together with the coordinates it is drawn on and presentation hints.
 * Instances are immutable; all arrays are copied.
 */
public class DerivedMap {

    private final String name;
    private final String mapType;
    private final double[] results;
    private final double[] x;
    private final double[] y;
    private final String xDescription;
    private final String yDescription;
    private final int gradientIndex;
    private final boolean crispClusters;
    private final int clusterCount;
    private final MapDiagnostics diagnostics;

    private DerivedMap(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "Map name cannot be null.");
        this.mapType = builder.mapType != null ? builder.mapType : "";
        this.results = Objects.requireNonNull(builder.results, "Results cannot be null.").clone();
        this.x = Objects.requireNonNull(builder.x, "X coordinates cannot be null.").clone();
        this.y = Objects.requireNonNull(builder.y, "Y coordinates cannot be null.").clone();
        if (results.length != x.length || results.length != y.length) {
            throw new IllegalArgumentException("Results, x and y must have equal length: "
                    + results.length + "/" + x.length + "/" + y.length);
        }
        this.xDescription = builder.xDescription;
        this.yDescription = builder.yDescription;
        this.gradientIndex = builder.gradientIndex;
        this.crispClusters = builder.crispClusters;
        this.clusterCount = builder.clusterCount;
        this.diagnostics = builder.diagnostics;
    }

    public static Builder builder(String name, double[] results, double[] x, double[] y) {
        return new Builder(name, results, x, y);
    }

    // --- Getters ---
    public String getName() { return name; }
    public String getMapType() { return mapType; }
    public double[] getResults() { return results.clone(); }
    public double[] getX() { return x.clone(); }
    public double[] getY() { return y.clone(); }
    public String getXDescription() { return xDescription; }
    public String getYDescription() { return yDescription; }
    public int getGradientIndex() { return gradientIndex; }
    public boolean isCrispClusters() { return crispClusters; }
    public int getClusterCount() { return clusterCount; }
    public MapDiagnostics getDiagnostics() { return diagnostics; }
    public int size() { return results.length; }
    public double resultAt(int row) { return results[row]; }

    @Override
    public String toString() {
        return "DerivedMap{name='" + name + "', type='" + mapType + "', size=" + results.length
                + (crispClusters ? ", clusters=" + clusterCount : "") + '}';
    }

    public static final class Builder {
        private final String name;
        private final double[] results;
        private final double[] x;
        private final double[] y;
        private String mapType;
        private String xDescription;
        private String yDescription;
        private int gradientIndex;
        private boolean crispClusters;
        private int clusterCount;
        private MapDiagnostics diagnostics;

        private Builder(String name, double[] results, double[] x, double[] y) {
            this.name = name;
            this.results = results;
            this.x = x;
            this.y = y;
        }

        public Builder mapType(String mapType) { this.mapType = mapType; return this; }
        public Builder axisDescriptions(String xDescription, String yDescription) {
            this.xDescription = xDescription;
            this.yDescription = yDescription;
            return this;
        }
        public Builder gradientIndex(int gradientIndex) { this.gradientIndex = gradientIndex; return this; }
        public Builder crispClusters(int clusterCount) {
            this.crispClusters = true;
            this.clusterCount = clusterCount;
            return this;
        }
        public Builder diagnostics(MapDiagnostics diagnostics) { this.diagnostics = diagnostics; return this; }

        public DerivedMap build() {
            return new DerivedMap(this);
        }
    }
}
