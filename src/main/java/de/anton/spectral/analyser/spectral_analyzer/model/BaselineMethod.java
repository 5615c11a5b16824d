package de.anton.spectral.analyser.spectral_analyzer.model;

/**
 * Baseline estimation methods understood by {@link SpectralDataset#baseline(String, int)}.
 */
public enum BaselineMethod {
    MEDIAN_FILTER("Median Filter"); // Wide median window, assumes the median is baseline rather than peak

    private final String displayName;

    BaselineMethod(String displayName) {
        this.displayName = displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }

    /** @return the method with the given display name (case-insensitive), or null if unknown. */
    public static BaselineMethod fromDisplayName(String displayName) {
        if (displayName == null) {
            return null;
        }
        for (BaselineMethod method : BaselineMethod.values()) {
            if (method.displayName.equalsIgnoreCase(displayName.trim())) {
                return method;
            }
        }
        return null;
    }
}
