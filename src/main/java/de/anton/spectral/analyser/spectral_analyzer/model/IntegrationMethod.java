package de.anton.spectral.analyser.spectral_analyzer.model;

/**
 * Integration methods usable with {@link PeakValueMethod#AREA}.
 */
public enum IntegrationMethod {
    RIEMANN_SUM("Riemann Sum");

    private final String displayName;

    IntegrationMethod(String displayName) {
        this.displayName = displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }

    /** @return the method with the given display name (case-insensitive), or null. */
    public static IntegrationMethod fromDisplayName(String displayName) {
        if (displayName == null) {
            return null;
        }
        for (IntegrationMethod method : IntegrationMethod.values()) {
            if (method.displayName.equalsIgnoreCase(displayName.trim())) {
                return method;
            }
        }
        return null;
    }
}
