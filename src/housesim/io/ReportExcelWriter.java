package housesim.io;

import housesim.config.SimulationParams;
import housesim.engine.MonthlyRecord;
import housesim.engine.SimulationResult;
import housesim.engine.SimulationSummary;
import housesim.engine.YearlyRecord;
import org.apache.poi.ss.usermodel.*;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.FileOutputStream;
import java.io.IOException;

/**
 * Отчёт по одному прогону в xlsx: Dashboard, Configuration, Yearly Data, Monthly Data.
 * Числа пишутся числами (для графиков), формат валютный.
 */
public final class ReportExcelWriter {

    public static final String DASHBOARD = "Dashboard";
    public static final String CONFIGURATION = "Configuration";
    public static final String YEARLY = "Yearly Data";
    public static final String MONTHLY = "Monthly Data";

    private static final String CURRENCY_FORMAT = "\"€\"#,##0.00";

    private ReportExcelWriter() {}

    public static void writeXlsx(String path, SimulationParams p, SimulationResult result) throws IOException {

        try (Workbook wb = new XSSFWorkbook()) {

            // ===== Styles =====
            DataFormat df = wb.createDataFormat();

            Font headerFont = wb.createFont();
            headerFont.setBold(true);
            headerFont.setColor(IndexedColors.WHITE.getIndex());

            CellStyle headerStyle = wb.createCellStyle();
            headerStyle.setFont(headerFont);
            headerStyle.setFillForegroundColor(IndexedColors.GREY_80_PERCENT.getIndex());
            headerStyle.setFillPattern(FillPatternType.SOLID_FOREGROUND);
            headerStyle.setAlignment(HorizontalAlignment.CENTER);

            Font titleFont = wb.createFont();
            titleFont.setBold(true);
            titleFont.setFontHeightInPoints((short) 16);
            CellStyle titleStyle = wb.createCellStyle();
            titleStyle.setFont(titleFont);

            CellStyle money = wb.createCellStyle();
            money.setDataFormat(df.getFormat(CURRENCY_FORMAT));

            CellStyle buyMoney = wb.createCellStyle();
            buyMoney.cloneStyleFrom(money);
            buyMoney.setFillForegroundColor(IndexedColors.PALE_BLUE.getIndex());
            buyMoney.setFillPattern(FillPatternType.SOLID_FOREGROUND);

            CellStyle rentMoney = wb.createCellStyle();
            rentMoney.cloneStyleFrom(money);
            rentMoney.setFillForegroundColor(IndexedColors.LIGHT_TURQUOISE.getIndex());
            rentMoney.setFillPattern(FillPatternType.SOLID_FOREGROUND);

            CellStyle intStyle = wb.createCellStyle();
            intStyle.setDataFormat(df.getFormat("0"));

            writeDashboard(wb.createSheet(DASHBOARD), result.summary(), titleStyle, headerStyle, buyMoney, rentMoney);
            writeConfiguration(wb.createSheet(CONFIGURATION), p, headerStyle, money);
            writeYearly(wb.createSheet(YEARLY), result, headerStyle, money, buyMoney, rentMoney, intStyle);
            writeMonthly(wb.createSheet(MONTHLY), result, headerStyle, money, intStyle);

            try (FileOutputStream out = new FileOutputStream(path)) {
                wb.write(out);
            }
        }
    }

    private static void writeDashboard(Sheet sh,
                                       SimulationSummary s,
                                       CellStyle titleStyle,
                                       CellStyle headerStyle,
                                       CellStyle buyMoney,
                                       CellStyle rentMoney) {

        Cell title = sh.createRow(0).createCell(0);
        title.setCellValue("Rent vs. Buy Simulation Results");
        title.setCellStyle(titleStyle);

        Row hdr = sh.createRow(2);
        writeText(hdr, 0, "Metric", headerStyle);
        writeText(hdr, 1, "Buying Scenario", headerStyle);
        writeText(hdr, 2, "Renting Scenario", headerStyle);

        dashboardRow(sh, 3, "Final Net Worth", s.finalNetWorthBuy(), s.finalNetWorthRent(), buyMoney, rentMoney);
        dashboardRow(sh, 4, "Total Outflow (Int/Rent)", s.totalInterestPaid(), s.totalRentPaid(), buyMoney, rentMoney);
        dashboardRow(sh, 5, "Total Principal / Initial", s.totalPrincipalPaid(), s.initialOutlay(), buyMoney, rentMoney);

        for (int i = 0; i < 3; i++) sh.setColumnWidth(i, 25 * 256);
    }

    private static void dashboardRow(Sheet sh, int rowIdx, String label,
                                     double buy, double rent,
                                     CellStyle buyMoney, CellStyle rentMoney) {
        Row row = sh.createRow(rowIdx);
        row.createCell(0).setCellValue(label);
        writeNumber(row, 1, buy, buyMoney);
        writeNumber(row, 2, rent, rentMoney);
    }

    private static void writeConfiguration(Sheet sh, SimulationParams p, CellStyle headerStyle, CellStyle money) {
        Row hdr = sh.createRow(0);
        writeText(hdr, 0, "Parameter", headerStyle);
        writeText(hdr, 1, "Value", headerStyle);

        int r = 1;
        r = param(sh, r, "Duration (Years)", p.getYears(), null);
        r = param(sh, r, "Inflation Rate (%)", p.getInflationRate(), null);
        r = param(sh, r, "Invest. Return Rate (%)", p.getInvestmentReturnRate(), null);
        r = param(sh, r, "Capital Gains Tax (%)", p.getCapitalGainsTaxRate(), null);
        r = param(sh, r, "Home Price", p.getHomePrice(), money);
        r = param(sh, r, "Down Payment (%)", p.getDownPaymentPercent(), null);
        r = param(sh, r, "Monthly Salary", p.getMonthlySalary(), money);
        r = flag(sh, r, "Salary Budget Strategy", p.isSalaryBased());
        r = param(sh, r, "Housing Allocation (%)", p.getHousingBudgetPercent(), null);
        r = param(sh, r, "Monthly Rent", p.getMonthlyRent(), money);
        r = param(sh, r, "Mortgage 1 Rate (%)", p.getPrimaryMortgage().interestRate(), null);
        r = param(sh, r, "Mortgage 1 Term", p.getPrimaryMortgage().termYears(), null);
        r = flag(sh, r, "Use Mortgage 2", p.isUseSecondaryMortgage());
        r = param(sh, r, "Mortgage 2 Amount", p.getSecondaryMortgage().amount(), money);
        r = flag(sh, r, "Use Subsidized Loan", p.isUseSubsidizedLoan());
        r = param(sh, r, "Subsidized Loan Amount", p.getSubsidizedLoanAmount(), money);
        r = flag(sh, r, "Use House Hacking", p.isRentOutPart());
        param(sh, r, "Rental Income", p.getRentOutIncome(), money);

        sh.setColumnWidth(0, 35 * 256);
        sh.setColumnWidth(1, 20 * 256);
    }

    private static int param(Sheet sh, int r, String key, double value, CellStyle style) {
        Row row = sh.createRow(r);
        row.createCell(0).setCellValue(key);
        Cell cell = row.createCell(1);
        cell.setCellValue(value);
        if (style != null) cell.setCellStyle(style);
        return r + 1;
    }

    private static int flag(Sheet sh, int r, String key, boolean value) {
        Row row = sh.createRow(r);
        row.createCell(0).setCellValue(key);
        row.createCell(1).setCellValue(value);
        return r + 1;
    }

    private static void writeYearly(Sheet sh, SimulationResult result,
                                    CellStyle headerStyle, CellStyle money,
                                    CellStyle buyMoney, CellStyle rentMoney, CellStyle intStyle) {
        String[] headers = {
                "Year", "Home Value", "Mortgage Bal", "Equity", "Buy Portfolio", "Rent Portfolio",
                "Buy Net Worth", "Rent Net Worth", "Interest Paid", "Principal Paid", "Rent Paid"
        };
        Row hdr = sh.createRow(0);
        for (int i = 0; i < headers.length; i++) {
            writeText(hdr, i, headers[i], headerStyle);
            sh.setColumnWidth(i, (i == 0 ? 10 : 16) * 256);
        }

        int r = 1;
        for (YearlyRecord y : result.yearlyData()) {
            Row row = sh.createRow(r++);
            int c = 0;
            writeNumber(row, c++, y.year(), intStyle);
            writeNumber(row, c++, y.homeValue(), money);
            writeNumber(row, c++, y.mortgageBalance(), money);
            writeNumber(row, c++, y.equity(), money);
            writeNumber(row, c++, y.buyScenarioPortfolio(), money);
            writeNumber(row, c++, y.rentScenarioPortfolio(), money);
            writeNumber(row, c++, y.buyTotalNetWorth(), buyMoney);
            writeNumber(row, c++, y.rentTotalNetWorth(), rentMoney);
            writeNumber(row, c++, y.yearlyInterestPaid(), money);
            writeNumber(row, c++, y.yearlyPrincipalPaid(), money);
            writeNumber(row, c, y.rentCost(), money);
        }
    }

    private static void writeMonthly(Sheet sh, SimulationResult result,
                                     CellStyle headerStyle, CellStyle money, CellStyle intStyle) {
        String[] headers = {"Month", "Interest Paid", "Principal Paid", "Balance"};
        Row hdr = sh.createRow(0);
        for (int i = 0; i < headers.length; i++) {
            writeText(hdr, i, headers[i], headerStyle);
            sh.setColumnWidth(i, (i == 0 ? 10 : 16) * 256);
        }

        int r = 1;
        for (MonthlyRecord m : result.monthlyData()) {
            Row row = sh.createRow(r++);
            writeNumber(row, 0, m.month(), intStyle);
            writeNumber(row, 1, m.interestPaid(), money);
            writeNumber(row, 2, m.principalPaid(), money);
            writeNumber(row, 3, m.balance(), money);
        }
    }

    private static void writeText(Row row, int col, String text, CellStyle style) {
        Cell cell = row.createCell(col);
        cell.setCellValue(text);
        cell.setCellStyle(style);
    }

    private static void writeNumber(Row row, int col, double value, CellStyle style) {
        Cell cell = row.createCell(col);
        cell.setCellValue(value);
        cell.setCellStyle(style);
    }
}
