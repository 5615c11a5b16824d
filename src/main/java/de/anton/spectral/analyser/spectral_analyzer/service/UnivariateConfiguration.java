package de.anton.spectral.analyser.spectral_analyzer.service;

import de.anton.spectral.analyser.spectral_analyzer.model.IntegrationMethod;
import de.anton.spectral.analyser.spectral_analyzer.model.PeakValueMethod;

import java.util.Objects;

/**
 * Immutable configuration of a one-region univariate map.
 * Region bounds are channel indices (inclusive).
 */
public record UnivariateConfiguration(
    String name,
    int min,
    int max,
    PeakValueMethod valueMethod,
    IntegrationMethod integrationMethod, // Used for AREA only
    int gradientIndex
) {
    public UnivariateConfiguration {
        Objects.requireNonNull(name, "Map name cannot be null.");
        Objects.requireNonNull(valueMethod, "Value method cannot be null.");
        if (integrationMethod == null) integrationMethod = IntegrationMethod.RIEMANN_SUM;
    }
}
