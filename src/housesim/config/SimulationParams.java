package housesim.config;

import java.util.Objects;

/**
 * Параметры сравнения "покупка vs аренда" (immutable).
 * Все ставки задаются в процентах годовых, суммы в валюте.
 * Создаётся через {@link SimulationParamsBuilder}.
 */
public final class SimulationParams {

    // ---------- Общие ----------

    /** Горизонт моделирования, лет. */
    private final int years;

    /** Доходность инвестиций, % годовых. */
    private final double investmentReturnRate;

    /** Инфляция (аренда, страховки, доход от сдачи), % годовых. */
    private final double inflationRate;

    /** Налог на прирост капитала, %. */
    private final double capitalGainsTaxRate;

    // ---------- Бюджет ----------

    private final BudgetStrategy budgetStrategy;
    private final double monthlySalary;
    private final double salaryGrowthRate;

    /** Доля зарплаты на жильё и накопления, %. */
    private final double housingBudgetPercent;

    /** Ежегодное увеличение доли, п.п. (0 = без изменения). */
    private final double housingBudgetPercentAnnualIncrease;

    /** Направлять излишек на досрочное погашение вместо инвестирования. */
    private final boolean payDownMortgageEarly;

    // ---------- Покупка ----------

    private final double homePrice;
    private final double downPaymentPercent;
    private final double closingCostsPercent;
    private final double sellingCostsPercent;
    private final double homeAppreciationRate;
    private final double propertyTaxRate;
    private final double homeInsuranceYearly;

    /** Расходы на содержание, % стоимости жилья в год. */
    private final double maintenanceCostYearly;

    /** Предельная ставка подоходного налога (налоговый вычет и налог на доход от сдачи), %. */
    private final double marginalTaxRate;

    /** Сдача части жилья. */
    private final boolean rentOutPart;
    private final double rentOutIncome;

    // ---------- Кредиты ----------

    /** Основная ипотека: сумма всегда вычисляется как остаток. */
    private final LoanTerms primaryMortgage;

    private final boolean useSecondaryMortgage;
    private final LoanTerms secondaryMortgage;

    /** Страхование ипотеки, в месяц. */
    private final double pmiMonthly;

    /** Беспроцентный льготный кредит. */
    private final boolean useSubsidizedLoan;
    private final double subsidizedLoanAmount;
    private final int subsidizedLoanTermYears;

    // ---------- Аренда ----------

    private final double monthlyRent;
    private final double rentInsuranceMonthly;

    SimulationParams(SimulationParamsBuilder b) {
        this.years = b.getYears();
        this.investmentReturnRate = b.getInvestmentReturnRate();
        this.inflationRate = b.getInflationRate();
        this.capitalGainsTaxRate = b.getCapitalGainsTaxRate();

        this.budgetStrategy = Objects.requireNonNull(b.getBudgetStrategy(), "budgetStrategy");
        this.monthlySalary = b.getMonthlySalary();
        this.salaryGrowthRate = b.getSalaryGrowthRate();
        this.housingBudgetPercent = b.getHousingBudgetPercent();
        this.housingBudgetPercentAnnualIncrease = b.getHousingBudgetPercentAnnualIncrease();
        this.payDownMortgageEarly = b.isPayDownMortgageEarly();

        this.homePrice = b.getHomePrice();
        this.downPaymentPercent = b.getDownPaymentPercent();
        this.closingCostsPercent = b.getClosingCostsPercent();
        this.sellingCostsPercent = b.getSellingCostsPercent();
        this.homeAppreciationRate = b.getHomeAppreciationRate();
        this.propertyTaxRate = b.getPropertyTaxRate();
        this.homeInsuranceYearly = b.getHomeInsuranceYearly();
        this.maintenanceCostYearly = b.getMaintenanceCostYearly();
        this.marginalTaxRate = b.getMarginalTaxRate();

        this.rentOutPart = b.isRentOutPart();
        this.rentOutIncome = b.getRentOutIncome();

        this.primaryMortgage = Objects.requireNonNull(b.getPrimaryMortgage(), "primaryMortgage");
        this.useSecondaryMortgage = b.isUseSecondaryMortgage();
        this.secondaryMortgage = Objects.requireNonNull(b.getSecondaryMortgage(), "secondaryMortgage");
        this.pmiMonthly = b.getPmiMonthly();

        this.useSubsidizedLoan = b.isUseSubsidizedLoan();
        this.subsidizedLoanAmount = b.getSubsidizedLoanAmount();
        this.subsidizedLoanTermYears = b.getSubsidizedLoanTermYears();

        this.monthlyRent = b.getMonthlyRent();
        this.rentInsuranceMonthly = b.getRentInsuranceMonthly();
    }

    // --------- Производные величины ---------

    public double getDownPaymentAmount() {
        return homePrice * SimulationConstants.pct(downPaymentPercent);
    }

    public double getClosingCostsAmount() {
        return homePrice * SimulationConstants.pct(closingCostsPercent);
    }

    /** Первоначальные вложения: взнос + расходы на сделку. */
    public double getInitialOutlay() {
        return getDownPaymentAmount() + getClosingCostsAmount();
    }

    public boolean isSalaryBased() {
        return budgetStrategy == BudgetStrategy.SALARY_BASED;
    }

    // --------- Getters ---------

    public int getYears() {
        return years;
    }

    public double getInvestmentReturnRate() {
        return investmentReturnRate;
    }

    public double getInflationRate() {
        return inflationRate;
    }

    public double getCapitalGainsTaxRate() {
        return capitalGainsTaxRate;
    }

    public BudgetStrategy getBudgetStrategy() {
        return budgetStrategy;
    }

    public double getMonthlySalary() {
        return monthlySalary;
    }

    public double getSalaryGrowthRate() {
        return salaryGrowthRate;
    }

    public double getHousingBudgetPercent() {
        return housingBudgetPercent;
    }

    public double getHousingBudgetPercentAnnualIncrease() {
        return housingBudgetPercentAnnualIncrease;
    }

    public boolean isPayDownMortgageEarly() {
        return payDownMortgageEarly;
    }

    public double getHomePrice() {
        return homePrice;
    }

    public double getDownPaymentPercent() {
        return downPaymentPercent;
    }

    public double getClosingCostsPercent() {
        return closingCostsPercent;
    }

    public double getSellingCostsPercent() {
        return sellingCostsPercent;
    }

    public double getHomeAppreciationRate() {
        return homeAppreciationRate;
    }

    public double getPropertyTaxRate() {
        return propertyTaxRate;
    }

    public double getHomeInsuranceYearly() {
        return homeInsuranceYearly;
    }

    public double getMaintenanceCostYearly() {
        return maintenanceCostYearly;
    }

    public double getMarginalTaxRate() {
        return marginalTaxRate;
    }

    public boolean isRentOutPart() {
        return rentOutPart;
    }

    public double getRentOutIncome() {
        return rentOutIncome;
    }

    public LoanTerms getPrimaryMortgage() {
        return primaryMortgage;
    }

    public boolean isUseSecondaryMortgage() {
        return useSecondaryMortgage;
    }

    public LoanTerms getSecondaryMortgage() {
        return secondaryMortgage;
    }

    public double getPmiMonthly() {
        return pmiMonthly;
    }

    public boolean isUseSubsidizedLoan() {
        return useSubsidizedLoan;
    }

    public double getSubsidizedLoanAmount() {
        return subsidizedLoanAmount;
    }

    public int getSubsidizedLoanTermYears() {
        return subsidizedLoanTermYears;
    }

    public double getMonthlyRent() {
        return monthlyRent;
    }

    public double getRentInsuranceMonthly() {
        return rentInsuranceMonthly;
    }
}
