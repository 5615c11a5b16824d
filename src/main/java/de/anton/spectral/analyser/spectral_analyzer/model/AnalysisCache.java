package de.anton.spectral.analyser.spectral_analyzer.model;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Holds one lazily computed analysis result together with the key it was computed for.
 * The key combines the analysis parameters with the spectra revision, so a transform
 * applied after the computation invalidates the entry.
 *
 * @param <T> analysis result type
 */
public class AnalysisCache<T> {

    private T result;
    private boolean calculated;
    private Object key;

    /**
     * Returns the cached result, computing it first if {@code recalculate} is set,
     * nothing has been computed yet, or the key differs from the cached one.
     */
    public T getOrCompute(Object newKey, boolean recalculate, Supplier<T> computation) {
        if (needsComputation(newKey, recalculate)) {
            result = Objects.requireNonNull(computation.get(), "Analysis computation returned null.");
            key = newKey;
            calculated = true;
        }
        return result;
    }

    public boolean needsComputation(Object newKey, boolean recalculate) {
        return recalculate || !calculated || !Objects.equals(key, newKey);
    }

    public boolean isCalculated() { return calculated; }

    public T getResult() { return result; }

    public void clear() {
        result = null;
        key = null;
        calculated = false;
    }
}
