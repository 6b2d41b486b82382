package housesim;

import housesim.config.BudgetStrategy;
import housesim.config.LoanTerms;
import housesim.config.SimulationParams;
import housesim.config.SimulationParamsBuilder;

public final class ScenarioFactory {

    private ScenarioFactory() {}

    public static SimulationParams defaultParams() {
        return defaultBuilder().build();
    }

    public static SimulationParamsBuilder defaultBuilder() {
        return new SimulationParamsBuilder()
                .setYears(10)
                .setInvestmentReturnRate(7.0)
                .setInflationRate(3.0)
                .setCapitalGainsTaxRate(30.0)

                .setBudgetStrategy(BudgetStrategy.AUTO_MATCH)
                .setMonthlySalary(5000)
                .setSalaryGrowthRate(3.0)
                .setHousingBudgetPercent(40)
                .setHousingBudgetPercentAnnualIncrease(0.0)
                .setPayDownMortgageEarly(false)

                .setHomePrice(500_000)
                .setDownPaymentPercent(20)
                .setClosingCostsPercent(3.0)
                .setSellingCostsPercent(6.0)
                .setHomeAppreciationRate(4.0)
                .setPropertyTaxRate(1.2)
                .setHomeInsuranceYearly(1200)
                .setMaintenanceCostYearly(1.0)
                .setMarginalTaxRate(25.0)

                .setRentOutPart(false)
                .setRentOutIncome(800)

                .setPrimaryMortgage(new LoanTerms(0, 6.5, 30))
                .setUseSecondaryMortgage(false)
                .setSecondaryMortgage(new LoanTerms(50_000, 8.0, 15))
                .setPmiMonthly(0)

                .setUseSubsidizedLoan(false)
                .setSubsidizedLoanAmount(60_000)
                .setSubsidizedLoanTermYears(20)

                .setMonthlyRent(2500)
                .setRentInsuranceMonthly(20);
    }
}
