package de.anton.spectral.analyser.spectral_analyzer.model;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.util.List;
import java.util.Objects;

/**
 * Writes datasets and their maps to Excel workbooks (.xlsx).
 * <p>
 * Dataset layout, sheet {@value #DATASET_SHEET}: row 0 holds {@code x, y} followed by the wavelength axis,
 * every further row holds {@code x_i, y_i} followed by spectrum i. Sheet {@value #INFO_SHEET} keeps the
 * name and axis descriptions. Non-finite values are written as blank cells.
 */
public class DatasetExcelExporter {

    private static final Logger logger = LoggerFactory.getLogger(DatasetExcelExporter.class);

    static final String DATASET_SHEET = "Dataset";
    static final String INFO_SHEET = "Info";
    static final String MAPS_SHEET = "Maps";
    static final String HEADER_X = "x";
    static final String HEADER_Y = "y";
    static final String INFO_NAME = "Name";
    static final String INFO_X_AXIS = "Spectral abscissa";
    static final String INFO_Y_AXIS = "Spectral ordinate";

    /** Exports the spectra, wavelength axis and coordinates of the dataset. */
    public void exportDataset(SpectralDataset dataset, File file) throws IOException {
        Objects.requireNonNull(dataset, "Dataset cannot be null.");
        Objects.requireNonNull(file, "Output file cannot be null.");
        logger.info("Starting dataset export of '{}' to: {}", dataset.getName(), file.getAbsolutePath());

        double[][] spectra = dataset.getSpectra();
        double[] wavelength = dataset.getWavelength();
        double[] x = dataset.getX();
        double[] y = dataset.getY();

        try (Workbook workbook = new XSSFWorkbook(); FileOutputStream fileOut = new FileOutputStream(file)) {
            Sheet sheet = workbook.createSheet(DATASET_SHEET);
            CellStyle headerStyle = headerStyle(workbook);
            Row headerRow = sheet.createRow(0);
            createHeaderCell(headerRow, 0, HEADER_X, headerStyle);
            createHeaderCell(headerRow, 1, HEADER_Y, headerStyle);
            for (int j = 0; j < wavelength.length; j++) {
                createNumericCell(headerRow, j + 2, wavelength[j]);
            }
            for (int i = 0; i < spectra.length; i++) {
                Row row = sheet.createRow(i + 1);
                createNumericCell(row, 0, x[i]);
                createNumericCell(row, 1, y[i]);
                for (int j = 0; j < spectra[i].length; j++) {
                    createNumericCell(row, j + 2, spectra[i][j]);
                }
            }

            Sheet info = workbook.createSheet(INFO_SHEET);
            createInfoRow(info, 0, INFO_NAME, dataset.getName());
            createInfoRow(info, 1, INFO_X_AXIS, dataset.getXAxisDescription());
            createInfoRow(info, 2, INFO_Y_AXIS, dataset.getYAxisDescription());

            logger.debug("Writing workbook with {} spectra x {} channels...", spectra.length, wavelength.length);
            workbook.write(fileOut);
            logger.info("Dataset export completed successfully to: {}", file.getAbsolutePath());
        } catch (IOException e) {
            logger.error("IOException during dataset export to {}", file.getAbsolutePath(), e);
            throw e;
        } catch (Exception e) {
            logger.error("Unexpected error during dataset export to {}", file.getAbsolutePath(), e);
            throw new IOException("Unexpected error during dataset export: " + e.getMessage(), e);
        }
    }

    /**
     * Exports every map of the dataset: columns {@code x, y} and one column per map, headed by the map name.
     * Maps whose length no longer matches the coordinates (e.g. created before a crop) are skipped.
     */
    public void exportMaps(SpectralDataset dataset, File file) throws IOException {
        Objects.requireNonNull(dataset, "Dataset cannot be null.");
        Objects.requireNonNull(file, "Output file cannot be null.");
        List<DerivedMap> maps = dataset.getMapRegistry().getMaps();
        if (maps.isEmpty()) {
            logger.warn("No maps to export for dataset '{}' to {}", dataset.getName(), file.getAbsolutePath());
        }
        logger.info("Starting map export of {} maps to: {}", maps.size(), file.getAbsolutePath());

        double[] x = dataset.getX();
        double[] y = dataset.getY();
        try (Workbook workbook = new XSSFWorkbook(); FileOutputStream fileOut = new FileOutputStream(file)) {
            Sheet sheet = workbook.createSheet(MAPS_SHEET);
            CellStyle headerStyle = headerStyle(workbook);
            Row headerRow = sheet.createRow(0);
            createHeaderCell(headerRow, 0, HEADER_X, headerStyle);
            createHeaderCell(headerRow, 1, HEADER_Y, headerStyle);
            for (int i = 0; i < x.length; i++) {
                Row row = sheet.createRow(i + 1);
                createNumericCell(row, 0, x[i]);
                createNumericCell(row, 1, y[i]);
            }
            int column = 2;
            for (DerivedMap map : maps) {
                if (map.size() != x.length) {
                    logger.warn("Skipping map '{}': {} values for {} spectra.", map.getName(), map.size(), x.length);
                    continue;
                }
                createHeaderCell(headerRow, column, map.getName(), headerStyle);
                for (int i = 0; i < x.length; i++) {
                    createNumericCell(sheet.getRow(i + 1), column, map.resultAt(i));
                }
                column++;
            }
            workbook.write(fileOut);
            logger.info("Map export completed successfully to: {}", file.getAbsolutePath());
        } catch (IOException e) {
            logger.error("IOException during map export to {}", file.getAbsolutePath(), e);
            throw e;
        } catch (Exception e) {
            logger.error("Unexpected error during map export to {}", file.getAbsolutePath(), e);
            throw new IOException("Unexpected error during map export: " + e.getMessage(), e);
        }
    }

    private CellStyle headerStyle(Workbook workbook) {
        Font headerFont = workbook.createFont();
        headerFont.setBold(true);
        CellStyle headerStyle = workbook.createCellStyle();
        headerStyle.setFont(headerFont);
        return headerStyle;
    }

    private void createHeaderCell(Row row, int colIndex, String text, CellStyle style) {
        Cell cell = row.createCell(colIndex);
        cell.setCellValue(text);
        cell.setCellStyle(style);
    }

    private void createInfoRow(Sheet sheet, int rowIndex, String key, String value) {
        Row row = sheet.createRow(rowIndex);
        row.createCell(0).setCellValue(key);
        row.createCell(1).setCellValue(value != null ? value : "");
    }

    private void createNumericCell(Row row, int colIndex, double value) {
        if (!Double.isNaN(value) && !Double.isInfinite(value)) {
            row.createCell(colIndex).setCellValue(value);
        } else {
            row.createCell(colIndex, CellType.BLANK);
        }
    }
}
