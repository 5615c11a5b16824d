package de.anton.spectral.analyser.spectral_analyzer.service;

import de.anton.spectral.analyser.spectral_analyzer.model.IntegrationMethod;
import de.anton.spectral.analyser.spectral_analyzer.model.PeakValueMethod;

import java.util.Objects;

/**
 * Immutable configuration of a two-region band ratio map (first region / second region).
 * Region bounds are channel indices (inclusive).
 */
public record BandRatioConfiguration(
    String name,
    int firstMin,
    int firstMax,
    int secondMin,
    int secondMax,
    PeakValueMethod valueMethod,
    IntegrationMethod integrationMethod,
    int gradientIndex
) {
    public BandRatioConfiguration {
        Objects.requireNonNull(name, "Map name cannot be null.");
        Objects.requireNonNull(valueMethod, "Value method cannot be null.");
        if (integrationMethod == null) integrationMethod = IntegrationMethod.RIEMANN_SUM;
    }
}
