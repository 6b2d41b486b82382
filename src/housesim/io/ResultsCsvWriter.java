package housesim.io;

import housesim.config.SimulationParams;
import housesim.engine.MonthlyRecord;
import housesim.engine.SimulationResult;
import housesim.engine.SimulationSummary;
import housesim.engine.YearlyRecord;

import java.io.BufferedWriter;
import java.io.FileWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Выгрузка результата в CSV: итоги, входные параметры, годовые и месячные ряды.
 */
public final class ResultsCsvWriter {

    private static final Locale US = Locale.US;

    private ResultsCsvWriter() {}

    public static void write(String path, SimulationParams p, SimulationResult result) throws IOException {

        try (BufferedWriter w = new BufferedWriter(new FileWriter(path, StandardCharsets.UTF_8, false))) {

            /* ---------- SUMMARY ---------- */
            SimulationSummary s = result.summary();
            line(w, "SIMULATION RESULTS SUMMARY");
            line(w, "Metric", "Value");
            line(w, "Final Buying Net Worth", f(s.finalNetWorthBuy()));
            line(w, "Final Renting Net Worth", f(s.finalNetWorthRent()));
            line(w, "Initial Cash Outlay", f(s.initialOutlay()));
            line(w, "Total Interest Paid", f(s.totalInterestPaid()));
            line(w, "Total Principal Paid", f(s.totalPrincipalPaid()));
            line(w, "Total Rent Paid", f(s.totalRentPaid()));
            w.newLine();

            /* ---------- INPUTS ---------- */
            line(w, "USER INPUTS PARAMETERS");
            line(w, "Parameter", "Value");
            line(w, "Duration (Years)", String.valueOf(p.getYears()));
            line(w, "Inflation Rate (%)", num(p.getInflationRate()));
            line(w, "Investment Return Rate (%)", num(p.getInvestmentReturnRate()));
            line(w, "Capital Gains Tax Rate (%)", num(p.getCapitalGainsTaxRate()));
            line(w, "Home Price", num(p.getHomePrice()));
            line(w, "Down Payment (%)", num(p.getDownPaymentPercent()));
            line(w, "Buying Closing Costs (%)", num(p.getClosingCostsPercent()));
            line(w, "Selling Closing Costs (%)", num(p.getSellingCostsPercent()));
            line(w, "Home Appreciation Rate (%)", num(p.getHomeAppreciationRate()));
            line(w, "Property Tax Rate (%)", num(p.getPropertyTaxRate()));
            line(w, "Maintenance Cost (%)", num(p.getMaintenanceCostYearly()));
            line(w, "Home Insurance (Yearly)", num(p.getHomeInsuranceYearly()));
            line(w, "Marginal Tax Rate (%)", num(p.getMarginalTaxRate()));
            line(w, "House Hacking (Rent Out Part)", String.valueOf(p.isRentOutPart()));
            line(w, "House Hacking Income (Monthly)", num(p.getRentOutIncome()));
            line(w, "Mortgage 1 Rate (%)", num(p.getPrimaryMortgage().interestRate()));
            line(w, "Mortgage 1 Term (Years)", String.valueOf(p.getPrimaryMortgage().termYears()));
            line(w, "Use Mortgage 2", String.valueOf(p.isUseSecondaryMortgage()));
            line(w, "Mortgage 2 Amount", num(p.getSecondaryMortgage().amount()));
            line(w, "Mortgage 2 Rate (%)", num(p.getSecondaryMortgage().interestRate()));
            line(w, "Mortgage 2 Term (Years)", String.valueOf(p.getSecondaryMortgage().termYears()));
            line(w, "Use Subsidized Loan", String.valueOf(p.isUseSubsidizedLoan()));
            line(w, "Subsidized Loan Amount", num(p.getSubsidizedLoanAmount()));
            line(w, "Subsidized Loan Term", String.valueOf(p.getSubsidizedLoanTermYears()));
            line(w, "Monthly Rent", num(p.getMonthlyRent()));
            line(w, "Renters Insurance (Monthly)", num(p.getRentInsuranceMonthly()));
            line(w, "Use Salary Budget Strategy", String.valueOf(p.isSalaryBased()));
            line(w, "Monthly Salary", num(p.getMonthlySalary()));
            line(w, "Salary Growth Rate (%)", num(p.getSalaryGrowthRate()));
            line(w, "Housing Allocation (%)", num(p.getHousingBudgetPercent()));
            line(w, "Allocation Annual Increase (%)", num(p.getHousingBudgetPercentAnnualIncrease()));
            line(w, "Pay Down Mortgage Early", String.valueOf(p.isPayDownMortgageEarly()));
            w.newLine();

            /* ---------- YEARLY ---------- */
            line(w, "YEARLY DATA (NET WORTH & EQUITY CHARTS)");
            line(w, "Year", "Home Value", "Mortgage Balance", "Equity",
                    "Buy Portfolio (Net)", "Rent Portfolio (Net)",
                    "Buy Net Worth", "Rent Net Worth",
                    "Interest Paid (Yearly)", "Principal Paid (Yearly)", "Rent Paid (Yearly)");
            for (YearlyRecord y : result.yearlyData()) {
                line(w, String.valueOf(y.year()),
                        f(y.homeValue()), f(y.mortgageBalance()), f(y.equity()),
                        f(y.buyScenarioPortfolio()), f(y.rentScenarioPortfolio()),
                        f(y.buyTotalNetWorth()), f(y.rentTotalNetWorth()),
                        f(y.yearlyInterestPaid()), f(y.yearlyPrincipalPaid()), f(y.rentCost()));
            }
            w.newLine();

            /* ---------- MONTHLY ---------- */
            line(w, "MONTHLY DATA (MORTGAGE SCHEDULE CHART)");
            line(w, "Month", "Interest Paid", "Principal Paid", "Total Mortgage Balance");
            for (MonthlyRecord m : result.monthlyData()) {
                line(w, String.valueOf(m.month()), f(m.interestPaid()), f(m.principalPaid()), f(m.balance()));
            }
        }
    }

    private static void line(BufferedWriter w, String... cells) throws IOException {
        for (int i = 0; i < cells.length; i++) {
            if (i > 0) w.write(',');
            w.write(csvCell(cells[i]));
        }
        w.newLine();
    }

    static String csvCell(String s) {
        if (s.indexOf(',') < 0 && s.indexOf('"') < 0 && s.indexOf('\n') < 0) return s;
        return "\"" + s.replace("\"", "\"\"") + "\"";
    }

    private static String f(double v) {
        if (!Double.isFinite(v)) return "";
        return String.format(US, "%.2f", v);
    }

    /** Входные значения без лишних нулей. */
    private static String num(double v) {
        if (v == Math.rint(v) && Math.abs(v) < 1e15) return String.valueOf((long) v);
        return String.valueOf(v);
    }
}
