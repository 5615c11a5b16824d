package de.anton.spectral.analyser.spectral_analyzer.model;

/**
 * Outcome categories of dataset operations.
 * Everything except SUCCESS and WARNING means the operation was aborted
 * and the dataset and its maps were left unchanged.
 */
public enum ResultKind {
    SUCCESS,
    WARNING,             // Completed, but with a caveat the caller should surface
    NON_SPATIAL,         // Mapping requested on a dataset without spatial meaning
    DIMENSION_MISMATCH,  // Argument shape does not fit the spectra matrix
    INVALID_ARGUMENT,    // Parameter outside its valid range
    UNSUPPORTED_METHOD,  // Method name unknown or not implemented
    NOTHING_TO_UNDO;     // No snapshot available

    /** @return true if the operation ran to completion. */
    public boolean isCompleted() {
        return this == SUCCESS || this == WARNING;
    }
}
