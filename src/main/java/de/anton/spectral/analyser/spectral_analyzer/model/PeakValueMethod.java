package de.anton.spectral.analyser.spectral_analyzer.model;

/**
 * Enumeration of the peak quantification methods available for univariate
 * and band ratio maps.
 * Includes a display name matching the labels used in map type descriptions.
 */
public enum PeakValueMethod {
    INTENSITY("Intensity"),   // Local maximum within the region
    AREA("Area"),             // Baseline-corrected integral of the region
    BANDWIDTH("Bandwidth"),   // Full width at half maximum
    DERIVATIVE("Derivative"); // Declared for compatibility, not computed

    private final String displayName;

    PeakValueMethod(String displayName) {
        this.displayName = displayName;
    }

    /**
     * Returns the user-friendly display name of the method.
     * @return The display name string.
     */
    @Override
    public String toString() {
        return displayName;
    }

    /**
     * Finds a PeakValueMethod based on its display name (case-insensitive).
     *
     * @param displayName The display name to search for.
     * @return The corresponding method, or null if no match is found.
     */
    public static PeakValueMethod fromDisplayName(String displayName) {
        if (displayName == null) {
            return null;
        }
        for (PeakValueMethod method : PeakValueMethod.values()) {
            if (method.displayName.equalsIgnoreCase(displayName.trim())) {
                return method;
            }
        }
        return null;
    }
}
