package de.anton.spectral.analyser.spectral_analyzer.algorithms;

/**
 * A computed decomposition that yields one result vector (one value per spectrum) per component.
 */
public interface ComponentAnalysis {

    /**
     * Result vector of one component, with the component index actually used.
     *
     * @param values    one value per spectrum
     * @param component 0-based component index used
     * @param valid     false if the requested component was out of range and had to be clamped
     */
    record ComponentMap(double[] values, int component, boolean valid) {
    }

    /** @return number of components available. */
    int componentCount();

    /**
     * @param component 0-based component index
     * @return one value per spectrum
     * @throws IndexOutOfBoundsException if the component is not available
     */
    double[] results(int component);

    /**
     * Like {@link #results(int)}, but clamps an out-of-range component to the nearest available one
     * and flags the result as not valid.
     */
    default ComponentMap clampedResults(int component) {
        int count = componentCount();
        if (count == 0) {
            throw new IllegalStateException("No components have been computed.");
        }
        boolean valid = component >= 0 && component < count;
        int used = Math.max(0, Math.min(component, count - 1));
        return new ComponentMap(results(used), used, valid);
    }
}
