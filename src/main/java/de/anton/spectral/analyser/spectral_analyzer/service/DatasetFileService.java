package de.anton.spectral.analyser.spectral_analyzer.service;

import de.anton.spectral.analyser.spectral_analyzer.model.DatasetExcelExporter;
import de.anton.spectral.analyser.spectral_analyzer.model.DatasetExcelReader;
import de.anton.spectral.analyser.spectral_analyzer.model.SpectralDataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.Objects;

/**
 * Service responsible for saving and loading dataset workbooks and exporting maps.
 */
public class DatasetFileService {

    private static final Logger logger = LoggerFactory.getLogger(DatasetFileService.class);
    private final DatasetExcelReader reader;
    private final DatasetExcelExporter exporter;

    public DatasetFileService() {
        this.reader = new DatasetExcelReader();
        this.exporter = new DatasetExcelExporter();
    }

    /**
     * Loads a dataset from the specified workbook.
     *
     * @throws IOException          if an error occurs during reading or parsing
     * @throws NullPointerException if the file is null
     */
    public SpectralDataset loadDataset(File file) throws IOException {
        Objects.requireNonNull(file, "Input file cannot be null.");
        logger.info("File Service: Attempting to load dataset from: {}", file.getAbsolutePath());
        try {
            SpectralDataset dataset = reader.readDataset(file);
            logger.info("File Service: Dataset '{}' loaded successfully from {}", dataset.getName(), file.getName());
            return dataset;
        } catch (IOException | RuntimeException e) {
            logger.error("File Service: Failed to load dataset from: {}", file.getAbsolutePath(), e);
            throw new IOException("Failed to read or process dataset file: " + e.getMessage(), e);
        }
    }

    public void saveDataset(SpectralDataset dataset, File file) throws IOException {
        Objects.requireNonNull(dataset, "Dataset cannot be null.");
        Objects.requireNonNull(file, "Output file cannot be null.");
        logger.info("File Service: Saving dataset '{}' to: {}", dataset.getName(), file.getAbsolutePath());
        try {
            exporter.exportDataset(dataset, file);
        } catch (IOException | RuntimeException e) {
            logger.error("File Service: Failed to save dataset to: {}", file.getAbsolutePath(), e);
            throw new IOException("Failed to write dataset file: " + e.getMessage(), e);
        }
    }

    public void exportMaps(SpectralDataset dataset, File file) throws IOException {
        Objects.requireNonNull(dataset, "Dataset cannot be null.");
        Objects.requireNonNull(file, "Output file cannot be null.");
        logger.info("File Service: Exporting {} maps of '{}' to: {}", dataset.getMapRegistry().size(),
                dataset.getName(), file.getAbsolutePath());
        try {
            exporter.exportMaps(dataset, file);
        } catch (IOException | RuntimeException e) {
            logger.error("File Service: Failed to export maps to: {}", file.getAbsolutePath(), e);
            throw new IOException("Failed to write map file: " + e.getMessage(), e);
        }
    }
}
