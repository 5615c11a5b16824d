package de.anton.spectral.analyser.spectral_analyzer.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.beans.PropertyChangeEvent;
import java.beans.PropertyChangeListener;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Listener collecting the {@link OperationRecord}s fired by datasets.
 * Register it via {@link SpectralDataset#addPropertyChangeListener(PropertyChangeListener)}.
 */
public class OperationLog implements PropertyChangeListener {

    private static final Logger logger = LoggerFactory.getLogger(OperationLog.class);

    private final List<OperationRecord> records = new ArrayList<>();

    @Override
    public void propertyChange(PropertyChangeEvent evt) {
        if (!SpectralDataset.PROPERTY_OPERATION_APPLIED.equals(evt.getPropertyName())) {
            return;
        }
        if (evt.getNewValue() instanceof OperationRecord record) {
            records.add(record);
            logger.trace("Recorded operation '{}' on '{}'.", record.operation(), record.datasetName());
        } else {
            logger.warn("Ignoring '{}' event without an operation record: {}", evt.getPropertyName(), evt.getNewValue());
        }
    }

    public List<OperationRecord> getRecords() { return Collections.unmodifiableList(records); }

    public int size() { return records.size(); }

    public void clear() { records.clear(); }

    /** Renders all records in order, each as produced by {@link OperationRecord#toLogText()}. */
    public String toText() {
        StringBuilder sb = new StringBuilder();
        for (OperationRecord record : records) {
            sb.append(record.toLogText());
        }
        return sb.toString();
    }
}
