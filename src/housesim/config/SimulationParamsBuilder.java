package housesim.config;

/**
 * Builder для SimulationParams.
 */
public class SimulationParamsBuilder {

    private int years;
    private double investmentReturnRate;
    private double inflationRate;
    private double capitalGainsTaxRate;

    private BudgetStrategy budgetStrategy = BudgetStrategy.AUTO_MATCH;
    private double monthlySalary;
    private double salaryGrowthRate;
    private double housingBudgetPercent;
    private double housingBudgetPercentAnnualIncrease;
    private boolean payDownMortgageEarly;

    private double homePrice;
    private double downPaymentPercent;
    private double closingCostsPercent;
    private double sellingCostsPercent;
    private double homeAppreciationRate;
    private double propertyTaxRate;
    private double homeInsuranceYearly;
    private double maintenanceCostYearly;
    private double marginalTaxRate;

    private boolean rentOutPart;
    private double rentOutIncome;

    private LoanTerms primaryMortgage = new LoanTerms(0, 0, 0);
    private boolean useSecondaryMortgage;
    private LoanTerms secondaryMortgage = new LoanTerms(0, 0, 0);
    private double pmiMonthly;

    private boolean useSubsidizedLoan;
    private double subsidizedLoanAmount;
    private int subsidizedLoanTermYears;

    private double monthlyRent;
    private double rentInsuranceMonthly;

    public SimulationParamsBuilder() {
    }

    /**
     * Создать builder на основе уже существующих параметров.
     */
    public static SimulationParamsBuilder from(SimulationParams base) {
        SimulationParamsBuilder b = new SimulationParamsBuilder();
        b.years = base.getYears();
        b.investmentReturnRate = base.getInvestmentReturnRate();
        b.inflationRate = base.getInflationRate();
        b.capitalGainsTaxRate = base.getCapitalGainsTaxRate();

        b.budgetStrategy = base.getBudgetStrategy();
        b.monthlySalary = base.getMonthlySalary();
        b.salaryGrowthRate = base.getSalaryGrowthRate();
        b.housingBudgetPercent = base.getHousingBudgetPercent();
        b.housingBudgetPercentAnnualIncrease = base.getHousingBudgetPercentAnnualIncrease();
        b.payDownMortgageEarly = base.isPayDownMortgageEarly();

        b.homePrice = base.getHomePrice();
        b.downPaymentPercent = base.getDownPaymentPercent();
        b.closingCostsPercent = base.getClosingCostsPercent();
        b.sellingCostsPercent = base.getSellingCostsPercent();
        b.homeAppreciationRate = base.getHomeAppreciationRate();
        b.propertyTaxRate = base.getPropertyTaxRate();
        b.homeInsuranceYearly = base.getHomeInsuranceYearly();
        b.maintenanceCostYearly = base.getMaintenanceCostYearly();
        b.marginalTaxRate = base.getMarginalTaxRate();

        b.rentOutPart = base.isRentOutPart();
        b.rentOutIncome = base.getRentOutIncome();

        b.primaryMortgage = base.getPrimaryMortgage();
        b.useSecondaryMortgage = base.isUseSecondaryMortgage();
        b.secondaryMortgage = base.getSecondaryMortgage();
        b.pmiMonthly = base.getPmiMonthly();

        b.useSubsidizedLoan = base.isUseSubsidizedLoan();
        b.subsidizedLoanAmount = base.getSubsidizedLoanAmount();
        b.subsidizedLoanTermYears = base.getSubsidizedLoanTermYears();

        b.monthlyRent = base.getMonthlyRent();
        b.rentInsuranceMonthly = base.getRentInsuranceMonthly();
        return b;
    }

    public SimulationParams build() {
        return new SimulationParams(this);
    }

    // --------- геттеры/сеттеры ---------

    public int getYears() {
        return years;
    }

    public SimulationParamsBuilder setYears(int years) {
        this.years = years;
        return this;
    }

    public double getInvestmentReturnRate() {
        return investmentReturnRate;
    }

    public SimulationParamsBuilder setInvestmentReturnRate(double investmentReturnRate) {
        this.investmentReturnRate = investmentReturnRate;
        return this;
    }

    public double getInflationRate() {
        return inflationRate;
    }

    public SimulationParamsBuilder setInflationRate(double inflationRate) {
        this.inflationRate = inflationRate;
        return this;
    }

    public double getCapitalGainsTaxRate() {
        return capitalGainsTaxRate;
    }

    public SimulationParamsBuilder setCapitalGainsTaxRate(double capitalGainsTaxRate) {
        this.capitalGainsTaxRate = capitalGainsTaxRate;
        return this;
    }

    public BudgetStrategy getBudgetStrategy() {
        return budgetStrategy;
    }

    public SimulationParamsBuilder setBudgetStrategy(BudgetStrategy budgetStrategy) {
        this.budgetStrategy = budgetStrategy;
        return this;
    }

    public double getMonthlySalary() {
        return monthlySalary;
    }

    public SimulationParamsBuilder setMonthlySalary(double monthlySalary) {
        this.monthlySalary = monthlySalary;
        return this;
    }

    public double getSalaryGrowthRate() {
        return salaryGrowthRate;
    }

    public SimulationParamsBuilder setSalaryGrowthRate(double salaryGrowthRate) {
        this.salaryGrowthRate = salaryGrowthRate;
        return this;
    }

    public double getHousingBudgetPercent() {
        return housingBudgetPercent;
    }

    public SimulationParamsBuilder setHousingBudgetPercent(double housingBudgetPercent) {
        this.housingBudgetPercent = housingBudgetPercent;
        return this;
    }

    public double getHousingBudgetPercentAnnualIncrease() {
        return housingBudgetPercentAnnualIncrease;
    }

    public SimulationParamsBuilder setHousingBudgetPercentAnnualIncrease(double increase) {
        this.housingBudgetPercentAnnualIncrease = increase;
        return this;
    }

    public boolean isPayDownMortgageEarly() {
        return payDownMortgageEarly;
    }

    public SimulationParamsBuilder setPayDownMortgageEarly(boolean payDownMortgageEarly) {
        this.payDownMortgageEarly = payDownMortgageEarly;
        return this;
    }

    public double getHomePrice() {
        return homePrice;
    }

    public SimulationParamsBuilder setHomePrice(double homePrice) {
        this.homePrice = homePrice;
        return this;
    }

    public double getDownPaymentPercent() {
        return downPaymentPercent;
    }

    public SimulationParamsBuilder setDownPaymentPercent(double downPaymentPercent) {
        this.downPaymentPercent = downPaymentPercent;
        return this;
    }

    public double getClosingCostsPercent() {
        return closingCostsPercent;
    }

    public SimulationParamsBuilder setClosingCostsPercent(double closingCostsPercent) {
        this.closingCostsPercent = closingCostsPercent;
        return this;
    }

    public double getSellingCostsPercent() {
        return sellingCostsPercent;
    }

    public SimulationParamsBuilder setSellingCostsPercent(double sellingCostsPercent) {
        this.sellingCostsPercent = sellingCostsPercent;
        return this;
    }

    public double getHomeAppreciationRate() {
        return homeAppreciationRate;
    }

    public SimulationParamsBuilder setHomeAppreciationRate(double homeAppreciationRate) {
        this.homeAppreciationRate = homeAppreciationRate;
        return this;
    }

    public double getPropertyTaxRate() {
        return propertyTaxRate;
    }

    public SimulationParamsBuilder setPropertyTaxRate(double propertyTaxRate) {
        this.propertyTaxRate = propertyTaxRate;
        return this;
    }

    public double getHomeInsuranceYearly() {
        return homeInsuranceYearly;
    }

    public SimulationParamsBuilder setHomeInsuranceYearly(double homeInsuranceYearly) {
        this.homeInsuranceYearly = homeInsuranceYearly;
        return this;
    }

    public double getMaintenanceCostYearly() {
        return maintenanceCostYearly;
    }

    public SimulationParamsBuilder setMaintenanceCostYearly(double maintenanceCostYearly) {
        this.maintenanceCostYearly = maintenanceCostYearly;
        return this;
    }

    public double getMarginalTaxRate() {
        return marginalTaxRate;
    }

    public SimulationParamsBuilder setMarginalTaxRate(double marginalTaxRate) {
        this.marginalTaxRate = marginalTaxRate;
        return this;
    }

    public boolean isRentOutPart() {
        return rentOutPart;
    }

    public SimulationParamsBuilder setRentOutPart(boolean rentOutPart) {
        this.rentOutPart = rentOutPart;
        return this;
    }

    public double getRentOutIncome() {
        return rentOutIncome;
    }

    public SimulationParamsBuilder setRentOutIncome(double rentOutIncome) {
        this.rentOutIncome = rentOutIncome;
        return this;
    }

    public LoanTerms getPrimaryMortgage() {
        return primaryMortgage;
    }

    public SimulationParamsBuilder setPrimaryMortgage(LoanTerms primaryMortgage) {
        this.primaryMortgage = primaryMortgage;
        return this;
    }

    public boolean isUseSecondaryMortgage() {
        return useSecondaryMortgage;
    }

    public SimulationParamsBuilder setUseSecondaryMortgage(boolean useSecondaryMortgage) {
        this.useSecondaryMortgage = useSecondaryMortgage;
        return this;
    }

    public LoanTerms getSecondaryMortgage() {
        return secondaryMortgage;
    }

    public SimulationParamsBuilder setSecondaryMortgage(LoanTerms secondaryMortgage) {
        this.secondaryMortgage = secondaryMortgage;
        return this;
    }

    public double getPmiMonthly() {
        return pmiMonthly;
    }

    public SimulationParamsBuilder setPmiMonthly(double pmiMonthly) {
        this.pmiMonthly = pmiMonthly;
        return this;
    }

    public boolean isUseSubsidizedLoan() {
        return useSubsidizedLoan;
    }

    public SimulationParamsBuilder setUseSubsidizedLoan(boolean useSubsidizedLoan) {
        this.useSubsidizedLoan = useSubsidizedLoan;
        return this;
    }

    public double getSubsidizedLoanAmount() {
        return subsidizedLoanAmount;
    }

    public SimulationParamsBuilder setSubsidizedLoanAmount(double subsidizedLoanAmount) {
        this.subsidizedLoanAmount = subsidizedLoanAmount;
        return this;
    }

    public int getSubsidizedLoanTermYears() {
        return subsidizedLoanTermYears;
    }

    public SimulationParamsBuilder setSubsidizedLoanTermYears(int subsidizedLoanTermYears) {
        this.subsidizedLoanTermYears = subsidizedLoanTermYears;
        return this;
    }

    public double getMonthlyRent() {
        return monthlyRent;
    }

    public SimulationParamsBuilder setMonthlyRent(double monthlyRent) {
        this.monthlyRent = monthlyRent;
        return this;
    }

    public double getRentInsuranceMonthly() {
        return rentInsuranceMonthly;
    }

    public SimulationParamsBuilder setRentInsuranceMonthly(double rentInsuranceMonthly) {
        this.rentInsuranceMonthly = rentInsuranceMonthly;
        return this;
    }
}
