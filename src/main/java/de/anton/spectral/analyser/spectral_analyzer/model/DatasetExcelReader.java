package de.anton.spectral.analyser.spectral_analyzer.model;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads a dataset workbook in the layout written by {@link DatasetExcelExporter}.
 * Blank cells are read as NaN. The optional info sheet supplies name and axis descriptions;
 * without it the file name is used as dataset name.
 */
public class DatasetExcelReader {

    private static final Logger logger = LoggerFactory.getLogger(DatasetExcelReader.class);

    /**
     * @throws IOException if the file cannot be read, the dataset sheet is missing or its shape is inconsistent
     */
    public SpectralDataset readDataset(File file) throws IOException {
        Objects.requireNonNull(file, "Input file cannot be null.");
        logger.info("Starting to read dataset workbook: {}", file.getAbsolutePath());

        try (InputStream fis = new FileInputStream(file);
             Workbook workbook = WorkbookFactory.create(fis)) {

            Sheet sheet = workbook.getSheet(DatasetExcelExporter.DATASET_SHEET);
            if (sheet == null) {
                throw new IOException("Required sheet '" + DatasetExcelExporter.DATASET_SHEET + "' not found in the workbook.");
            }
            Row headerRow = sheet.getRow(0);
            if (headerRow == null || headerRow.getLastCellNum() < 3) {
                throw new IOException("Sheet '" + sheet.getSheetName() + "' has no wavelength header row.");
            }
            int channels = headerRow.getLastCellNum() - 2;
            double[] wavelength = new double[channels];
            for (int j = 0; j < channels; j++) {
                wavelength[j] = numericValue(headerRow.getCell(j + 2));
                if (Double.isNaN(wavelength[j])) {
                    throw new IOException("Wavelength header cell " + (j + 2) + " is not numeric.");
                }
            }

            List<double[]> rows = new ArrayList<>();
            List<Double> xs = new ArrayList<>();
            List<Double> ys = new ArrayList<>();
            for (int r = 1; r <= sheet.getLastRowNum(); r++) {
                Row row = sheet.getRow(r);
                if (row == null) {
                    logger.trace("Skipping empty row {}.", r);
                    continue;
                }
                xs.add(numericValue(row.getCell(0)));
                ys.add(numericValue(row.getCell(1)));
                double[] spectrum = new double[channels];
                for (int j = 0; j < channels; j++) {
                    spectrum[j] = numericValue(row.getCell(j + 2));
                }
                rows.add(spectrum);
            }
            if (rows.isEmpty()) {
                throw new IOException("Sheet '" + sheet.getSheetName() + "' contains no spectra.");
            }

            String name = file.getName();
            String xAxis = "";
            String yAxis = "";
            Sheet info = workbook.getSheet(DatasetExcelExporter.INFO_SHEET);
            if (info != null) {
                DataFormatter formatter = new DataFormatter();
                for (Row row : info) {
                    String key = formatter.formatCellValue(row.getCell(0)).trim();
                    String value = formatter.formatCellValue(row.getCell(1));
                    if (DatasetExcelExporter.INFO_NAME.equals(key) && !value.isBlank()) name = value;
                    else if (DatasetExcelExporter.INFO_X_AXIS.equals(key)) xAxis = value;
                    else if (DatasetExcelExporter.INFO_Y_AXIS.equals(key)) yAxis = value;
                }
            } else {
                logger.info("Optional sheet '{}' not found. Using file name as dataset name.", DatasetExcelExporter.INFO_SHEET);
            }

            SpectralDataset dataset = new SpectralDataset(name, rows.toArray(new double[0][]), wavelength,
                    toArray(xs), toArray(ys));
            dataset.setAxisDescriptions(xAxis, yAxis);
            logger.info("Finished reading dataset '{}' ({} spectra x {} channels) from {}",
                    name, rows.size(), channels, file.getAbsolutePath());
            return dataset;
        } catch (IOException ioe) {
            logger.error("IO error reading dataset workbook: {}", file.getAbsolutePath(), ioe);
            throw ioe;
        } catch (Exception e) {
            logger.error("Error processing dataset workbook: {}", file.getAbsolutePath(), e);
            throw new IOException("Error processing dataset workbook: " + e.getMessage(), e);
        }
    }

    private double numericValue(Cell cell) {
        if (cell == null || cell.getCellType() == CellType.BLANK) {
            return Double.NaN;
        }
        switch (cell.getCellType()) {
            case NUMERIC:
                return cell.getNumericCellValue();
            case STRING:
                try {
                    return Double.parseDouble(cell.getStringCellValue().trim().replace(',', '.'));
                } catch (NumberFormatException e) {
                    logger.trace("Cell {} holds non-numeric text '{}'. Returning NaN.", cell.getAddress(), cell.getStringCellValue());
                    return Double.NaN;
                }
            default:
                logger.warn("Unhandled cell type {} in cell {}. Returning NaN.", cell.getCellType(), cell.getAddress());
                return Double.NaN;
        }
    }

    private static double[] toArray(List<Double> values) {
        double[] array = new double[values.size()];
        for (int i = 0; i < array.length; i++) array[i] = values.get(i);
        return array;
    }
}
