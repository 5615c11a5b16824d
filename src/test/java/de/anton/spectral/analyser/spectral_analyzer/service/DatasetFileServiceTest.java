package de.anton.spectral.analyser.spectral_analyzer.service;

import de.anton.spectral.analyser.spectral_analyzer.model.SpectralDataset;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class DatasetFileServiceTest {

    @TempDir
    Path tempDir;

    private final DatasetFileService service = new DatasetFileService();

    private static SpectralDataset sample() {
        double[][] spectra = {
                { 1.0, 2.0, 3.0, 2.0, 1.0 },
                { 0.5, Double.NaN, 4.0, 1.5, 0.5 },
                { 2.0, 2.5, 6.0, 2.5, 2.0 },
                { 1.0, 1.0, 1.0, 1.0, 1.0 }
        };
        SpectralDataset dataset = new SpectralDataset("Sample A", spectra, new double[] { 400, 410, 420, 430, 440 },
                new double[] { 0, 0, 1, 1 }, new double[] { 0, 1, 0, 1 });
        dataset.setAxisDescriptions("Wavelength (nm)", "Counts");
        return dataset;
    }

    @Test
    void savedDatasetLoadsBackUnchanged() throws IOException {
        SpectralDataset original = sample();
        File file = tempDir.resolve("sample.xlsx").toFile();
        service.saveDataset(original, file);

        SpectralDataset loaded = service.loadDataset(file);
        assertEquals("Sample A", loaded.getName());
        assertEquals("Wavelength (nm)", loaded.getXAxisDescription());
        assertEquals("Counts", loaded.getYAxisDescription());
        assertArrayEquals(original.getWavelength(), loaded.getWavelength(), 0.0);
        assertArrayEquals(original.getX(), loaded.getX(), 0.0);
        assertArrayEquals(original.getY(), loaded.getY(), 0.0);
        assertEquals(original.rowCount(), loaded.rowCount());
        for (int i = 0; i < original.rowCount(); i++) {
            assertArrayEquals(original.pointSpectrum(i), loaded.pointSpectrum(i), 0.0);
        }
        assertTrue(Double.isNaN(loaded.pointSpectrum(1)[1]));
        assertFalse(loaded.isNonSpatial());
    }

    @Test
    void workbookWithoutInfoSheetUsesFileName() throws IOException {
        File file = tempDir.resolve("plain.xlsx").toFile();
        try (Workbook workbook = new XSSFWorkbook(); OutputStream out = new FileOutputStream(file)) {
            Sheet sheet = workbook.createSheet("Dataset");
            Row header = sheet.createRow(0);
            header.createCell(0).setCellValue("x");
            header.createCell(1).setCellValue("y");
            header.createCell(2).setCellValue(500.0);
            header.createCell(3).setCellValue("510,5");
            Row row = sheet.createRow(1);
            row.createCell(0).setCellValue(3.0);
            row.createCell(1).setCellValue(4.0);
            row.createCell(2).setCellValue("7.25");
            row.createCell(3).setCellValue("n/a");
            workbook.write(out);
        }

        SpectralDataset loaded = service.loadDataset(file);
        assertEquals("plain.xlsx", loaded.getName());
        assertArrayEquals(new double[] { 500.0, 510.5 }, loaded.getWavelength(), 0.0);
        assertEquals(7.25, loaded.pointSpectrum(0)[0], 0.0);
        assertTrue(Double.isNaN(loaded.pointSpectrum(0)[1]));
        assertEquals(3.0, loaded.x(0), 0.0);
    }

    @Test
    void missingDatasetSheetIsAnIOException() throws IOException {
        File file = tempDir.resolve("other.xlsx").toFile();
        try (Workbook workbook = new XSSFWorkbook(); OutputStream out = new FileOutputStream(file)) {
            workbook.createSheet("Something else").createRow(0).createCell(0).setCellValue("x");
            workbook.write(out);
        }
        IOException e = assertThrows(IOException.class, () -> service.loadDataset(file));
        assertTrue(e.getMessage().contains("Dataset"));
        assertThrows(IOException.class, () -> service.loadDataset(tempDir.resolve("missing.xlsx").toFile()));
    }

    @Test
    void exportedMapsHaveOneColumnPerMap() throws IOException {
        SpectralDataset dataset = sample();
        dataset.univariate("peak height", 1, 3, "Intensity", null, 0);
        dataset.univariate("peak area", 0, 4, "Area", "Riemann Sum", 0);
        File file = tempDir.resolve("maps.xlsx").toFile();
        service.exportMaps(dataset, file);

        try (InputStream in = new FileInputStream(file); Workbook workbook = WorkbookFactory.create(in)) {
            Sheet sheet = workbook.getSheet("Maps");
            assertNotNull(sheet);
            Row header = sheet.getRow(0);
            assertEquals("x", header.getCell(0).getStringCellValue());
            assertEquals("y", header.getCell(1).getStringCellValue());
            assertEquals("peak height", header.getCell(2).getStringCellValue());
            assertEquals("peak area", header.getCell(3).getStringCellValue());
            assertEquals(4, sheet.getLastRowNum());
            assertEquals(6.0, sheet.getRow(3).getCell(2).getNumericCellValue(), 0.0);
            assertEquals(1.0, sheet.getRow(2).getCell(1).getNumericCellValue(), 0.0);
        }
    }
}
