package housesim.io;

import housesim.analysis.SweepParameter;
import housesim.analysis.SweepPoint;
import housesim.config.SimulationParams;
import org.apache.poi.ss.usermodel.*;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.FileOutputStream;
import java.io.IOException;
import java.util.List;
import java.util.Locale;

/**
 * Результаты перерасчёта по сетке в xlsx.
 * Лист RAW: по строке на точку; для двух параметров дополнительно лист GRID
 * с таблицей преимущества покупки (формулы AVERAGEIFS по RAW).
 */
public final class SweepResultsExcelWriter {

    private SweepResultsExcelWriter() {}

    /**
     * @param p2 второй параметр или null для одномерного перебора
     */
    public static void writeXlsx(String path,
                                 SimulationParams baseParams,
                                 SweepParameter p1,
                                 double[] values1,
                                 SweepParameter p2,
                                 double[] values2,
                                 List<SweepPoint> points) throws IOException {

        boolean twoAxes = p2 != null;
        int expected = twoAxes ? values1.length * values2.length : values1.length;
        if (points.size() != expected) {
            throw new IllegalArgumentException("points.size != grid size: " + points.size() + " vs " + expected);
        }

        try (Workbook wb = new XSSFWorkbook()) {

            // ===== Styles =====
            DataFormat df = wb.createDataFormat();

            CellStyle passportStyle = wb.createCellStyle();
            passportStyle.setWrapText(false);
            passportStyle.setVerticalAlignment(VerticalAlignment.TOP);

            CellStyle headerStyle = wb.createCellStyle();
            headerStyle.setAlignment(HorizontalAlignment.CENTER);
            headerStyle.setVerticalAlignment(VerticalAlignment.CENTER);

            CellStyle centeredNumberStyle = wb.createCellStyle();
            centeredNumberStyle.setAlignment(HorizontalAlignment.CENTER);
            centeredNumberStyle.setVerticalAlignment(VerticalAlignment.CENTER);
            centeredNumberStyle.setDataFormat(df.getFormat("0.00"));

            // ===== RAW sheet =====
            Sheet raw = wb.createSheet("RAW");
            int r = 0;

            Row row0 = raw.createRow(r++);
            Cell passportCell = row0.createCell(0);
            passportCell.setCellValue(buildPassport(baseParams));
            passportCell.setCellStyle(passportStyle);
            raw.setColumnWidth(0, 14 * 256);

            Row hdr = raw.createRow(r++);
            int c = 0;
            c = writeHeader(hdr, c, p1.name(), headerStyle);
            if (twoAxes) {
                c = writeHeader(hdr, c, p2.name(), headerStyle);
            }
            c = writeHeader(hdr, c, "Buy_NW", headerStyle);
            c = writeHeader(hdr, c, "Rent_NW", headerStyle);
            c = writeHeader(hdr, c, "Buy_Advantage", headerStyle);

            for (SweepPoint pt : points) {
                Row rr = raw.createRow(r++);
                int cc = 0;
                writeNumber(rr, cc++, pt.value1(), centeredNumberStyle);
                if (twoAxes) {
                    writeNumber(rr, cc++, pt.value2(), centeredNumberStyle);
                }
                writeNumber(rr, cc++, pt.finalNetWorthBuy(), centeredNumberStyle);
                writeNumber(rr, cc++, pt.finalNetWorthRent(), centeredNumberStyle);
                writeNumber(rr, cc++, pt.buyAdvantage(), centeredNumberStyle);
            }

            for (int i = 1; i < c; i++) raw.setColumnWidth(i, 16 * 256);

            // ===== GRID (только для двух параметров) =====
            if (twoAxes) {
                Sheet grid = wb.createSheet("GRID");
                writeGridBlock(grid, p1.name() + " \\ " + p2.name() + ": Buy_Advantage", 0,
                        values1, values2,
                        "RAW!$E:$E",
                        "RAW!$A:$A",
                        "RAW!$B:$B",
                        centeredNumberStyle,
                        headerStyle);
                for (int i = 0; i <= values2.length; i++) grid.setColumnWidth(i, 14 * 256);
            }

            try (FileOutputStream out = new FileOutputStream(path)) {
                wb.write(out);
            }
        }
    }

    private static int writeHeader(Row hdr, int col, String text, CellStyle headerStyle) {
        Cell cell = hdr.createCell(col);
        cell.setCellValue(text);
        cell.setCellStyle(headerStyle);
        return col + 1;
    }

    private static void writeNumber(Row row, int col, double value, CellStyle numStyle) {
        Cell cell = row.createCell(col);
        cell.setCellValue(value);
        cell.setCellStyle(numStyle);
    }

    private static int writeGridBlock(Sheet sh,
                                      String title,
                                      int topRow,
                                      double[] param1,
                                      double[] param2,
                                      String valueRange,
                                      String critRangeP1,
                                      String critRangeP2,
                                      CellStyle numStyle,
                                      CellStyle headerStyle) {

        Row t = sh.createRow(topRow++);
        Cell titleCell = t.createCell(0);
        titleCell.setCellValue(title);
        titleCell.setCellStyle(headerStyle);

        // param2 по горизонтали
        Row hdr = sh.createRow(topRow++);
        Cell corner = hdr.createCell(0, CellType.STRING);
        corner.setCellValue("");
        corner.setCellStyle(headerStyle);

        for (int j = 0; j < param2.length; j++) {
            Cell cell = hdr.createCell(1 + j);
            cell.setCellValue(param2[j]);
            cell.setCellStyle(headerStyle);
        }

        // param1 по вертикали + формулы
        for (int i = 0; i < param1.length; i++) {
            Row r = sh.createRow(topRow + i);

            Cell p1 = r.createCell(0);
            p1.setCellValue(param1[i]);
            p1.setCellStyle(headerStyle);

            int rowExcel = (topRow + i) + 1;
            int hdrExcel = topRow;

            for (int j = 0; j < param2.length; j++) {
                String colParam2 = colLetter(1 + j + 1); // сетка начинается с B
                String f = "AVERAGEIFS(" + valueRange
                        + "," + critRangeP1 + ",$A" + rowExcel
                        + "," + critRangeP2 + "," + colParam2 + "$" + hdrExcel
                        + ")";

                Cell cell = r.createCell(1 + j);
                cell.setCellFormula(f);
                cell.setCellStyle(numStyle);
            }
        }

        return topRow + param1.length;
    }

    static String colLetter(int col1Based) {
        int col = col1Based;
        StringBuilder sb = new StringBuilder();
        while (col > 0) {
            int rem = (col - 1) % 26;
            sb.insert(0, (char) ('A' + rem));
            col = (col - 1) / 26;
        }
        return sb.toString();
    }

    static String buildPassport(SimulationParams p) {
        return String.format(Locale.ROOT,
                "years=%d; budget=%s; inv=%.2f; infl=%.2f; cgt=%.1f; price=%.0f; down=%.1f; appr=%.2f; m1=%.2f/%d; m2=%b; subsidized=%b; rent=%.0f",
                p.getYears(),
                p.getBudgetStrategy(),
                p.getInvestmentReturnRate(),
                p.getInflationRate(),
                p.getCapitalGainsTaxRate(),
                p.getHomePrice(),
                p.getDownPaymentPercent(),
                p.getHomeAppreciationRate(),
                p.getPrimaryMortgage().interestRate(),
                p.getPrimaryMortgage().termYears(),
                p.isUseSecondaryMortgage(),
                p.isUseSubsidizedLoan(),
                p.getMonthlyRent()
        );
    }
}
