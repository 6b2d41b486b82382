package housesim.io;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import housesim.ScenarioFactory;
import housesim.analysis.SweepParameter;
import housesim.analysis.SweepPoint;
import housesim.config.SimulationParams;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class SweepResultsExcelWriterTest {

    @TempDir
    Path dir;

    private final SimulationParams base = ScenarioFactory.defaultParams();

    @Test
    void twoAxesGetRawRowsAndFormulaGrid() throws Exception {
        double[] v1 = {4, 7};
        double[] v2 = {0, 2, 4};
        List<SweepPoint> points = new ArrayList<>();
        for (double a : v1) {
            for (double b : v2) {
                points.add(new SweepPoint(a, b, 1000 + a, 900 + b));
            }
        }
        Path out = dir.resolve("sweep.xlsx");

        SweepResultsExcelWriter.writeXlsx(out.toString(), base,
                SweepParameter.INVESTMENT_RETURN_RATE, v1,
                SweepParameter.HOME_APPRECIATION_RATE, v2, points);

        try (InputStream in = Files.newInputStream(out); Workbook wb = new XSSFWorkbook(in)) {
            Sheet raw = wb.getSheet("RAW");
            assertTrue(raw.getRow(0).getCell(0).getStringCellValue().startsWith("years=10;"));
            assertEquals("INVESTMENT_RETURN_RATE", raw.getRow(1).getCell(0).getStringCellValue());
            assertEquals("HOME_APPRECIATION_RATE", raw.getRow(1).getCell(1).getStringCellValue());
            assertEquals("Buy_Advantage", raw.getRow(1).getCell(4).getStringCellValue());
            assertEquals(7, raw.getLastRowNum());
            assertEquals(1004.0 - 900.0, raw.getRow(2).getCell(4).getNumericCellValue(), 1e-9);

            Sheet grid = wb.getSheet("GRID");
            assertEquals(2.0, grid.getRow(1).getCell(2).getNumericCellValue());
            assertEquals(7.0, grid.getRow(3).getCell(0).getNumericCellValue());
            assertEquals("AVERAGEIFS(RAW!$E:$E,RAW!$A:$A,$A3,RAW!$B:$B,B$2)",
                    grid.getRow(2).getCell(1).getCellFormula());
        }
    }

    @Test
    void oneAxisHasNoGrid() throws Exception {
        double[] v1 = {1500, 2500};
        List<SweepPoint> points = List.of(
                new SweepPoint(1500, Double.NaN, 10, 20),
                new SweepPoint(2500, Double.NaN, 30, 20));
        Path out = dir.resolve("sweep1.xlsx");

        SweepResultsExcelWriter.writeXlsx(out.toString(), base,
                SweepParameter.MONTHLY_RENT, v1, null, null, points);

        try (InputStream in = Files.newInputStream(out); Workbook wb = new XSSFWorkbook(in)) {
            assertNull(wb.getSheet("GRID"));
            Sheet raw = wb.getSheet("RAW");
            assertEquals("Buy_Advantage", raw.getRow(1).getCell(3).getStringCellValue());
            assertEquals(10.0, raw.getRow(3).getCell(3).getNumericCellValue(), 1e-9);
        }
    }

    @Test
    void pointCountMustMatchGrid() {
        double[] v1 = {1, 2};
        List<SweepPoint> points = List.of(new SweepPoint(1, Double.NaN, 0, 0));

        assertThrows(IllegalArgumentException.class, () -> SweepResultsExcelWriter.writeXlsx(
                dir.resolve("bad.xlsx").toString(), base, SweepParameter.INFLATION_RATE, v1, null, null, points));
    }

    @Test
    void columnLetters() {
        assertEquals("A", SweepResultsExcelWriter.colLetter(1));
        assertEquals("Z", SweepResultsExcelWriter.colLetter(26));
        assertEquals("AA", SweepResultsExcelWriter.colLetter(27));
        assertEquals("BA", SweepResultsExcelWriter.colLetter(53));
    }
}
