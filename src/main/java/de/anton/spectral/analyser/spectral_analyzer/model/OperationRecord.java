package de.anton.spectral.analyser.spectral_analyzer.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Structured "operation applied, with parameters" event emitted by a
 * {@link SpectralDataset} for every transform and mapping call.
 * Parameters keep their insertion order.
 */
public record OperationRecord(String datasetName, String operation, Map<String, Object> parameters, Instant timestamp) {

    public OperationRecord {
        Objects.requireNonNull(operation, "Operation name cannot be null.");
        parameters = parameters == null || parameters.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        timestamp = timestamp != null ? timestamp : Instant.now();
    }

    /**
     * Renders the record in the plain-text log form:
     * the operation name on one line followed by one {@code key == value} line per parameter.
     */
    public String toLogText() {
        StringBuilder sb = new StringBuilder(operation).append(System.lineSeparator());
        parameters.forEach((key, value) -> sb.append(key).append(" == ").append(value).append(System.lineSeparator()));
        return sb.toString();
    }
}
