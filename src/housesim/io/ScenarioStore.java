package housesim.io;

import housesim.ScenarioFactory;
import housesim.config.BudgetStrategy;
import housesim.config.LoanTerms;
import housesim.config.SimulationParams;
import housesim.config.SimulationParamsBuilder;
import org.apache.commons.configuration2.PropertiesConfiguration;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.configuration2.io.FileHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Именованные наборы параметров: по одному .properties файлу на набор.
 * Отсутствующие ключи берутся из {@link ScenarioFactory#defaultParams()}.
 */
public final class ScenarioStore {

    private static final Logger log = LoggerFactory.getLogger(ScenarioStore.class);

    public static final String EXTENSION = ".properties";

    private static final Pattern NAME = Pattern.compile("[A-Za-z0-9_-]+");

    // ---------- ключи ----------
    static final String YEARS = "years";
    static final String INVESTMENT_RETURN_RATE = "investmentReturnRate";
    static final String INFLATION_RATE = "inflationRate";
    static final String CAPITAL_GAINS_TAX_RATE = "capitalGainsTaxRate";

    static final String BUDGET_STRATEGY = "budget.strategy";
    static final String MONTHLY_SALARY = "budget.monthlySalary";
    static final String SALARY_GROWTH_RATE = "budget.salaryGrowthRate";
    static final String HOUSING_BUDGET_PERCENT = "budget.housingPercent";
    static final String HOUSING_BUDGET_PERCENT_INCREASE = "budget.housingPercentAnnualIncrease";
    static final String PAY_DOWN_EARLY = "budget.payDownMortgageEarly";

    static final String HOME_PRICE = "home.price";
    static final String DOWN_PAYMENT_PERCENT = "home.downPaymentPercent";
    static final String CLOSING_COSTS_PERCENT = "home.closingCostsPercent";
    static final String SELLING_COSTS_PERCENT = "home.sellingCostsPercent";
    static final String APPRECIATION_RATE = "home.appreciationRate";
    static final String PROPERTY_TAX_RATE = "home.propertyTaxRate";
    static final String INSURANCE_YEARLY = "home.insuranceYearly";
    static final String MAINTENANCE_YEARLY = "home.maintenanceYearlyPercent";
    static final String MARGINAL_TAX_RATE = "home.marginalTaxRate";
    static final String RENT_OUT_PART = "home.rentOutPart";
    static final String RENT_OUT_INCOME = "home.rentOutIncome";

    static final String M1_RATE = "mortgage1.interestRate";
    static final String M1_TERM = "mortgage1.termYears";
    static final String M2_ENABLED = "mortgage2.enabled";
    static final String M2_AMOUNT = "mortgage2.amount";
    static final String M2_RATE = "mortgage2.interestRate";
    static final String M2_TERM = "mortgage2.termYears";
    static final String PMI_MONTHLY = "mortgage.pmiMonthly";

    static final String SUBSIDIZED_ENABLED = "subsidized.enabled";
    static final String SUBSIDIZED_AMOUNT = "subsidized.amount";
    static final String SUBSIDIZED_TERM = "subsidized.termYears";

    static final String MONTHLY_RENT = "rent.monthly";
    static final String RENT_INSURANCE = "rent.insuranceMonthly";

    private final Path directory;

    public ScenarioStore(Path directory) {
        this.directory = directory;
    }

    public Path save(String name, SimulationParams params) throws IOException {
        Files.createDirectories(directory);
        Path file = fileFor(name);
        writeFile(file, params);
        log.info("scenario '{}' saved to {}", name, file);
        return file;
    }

    public SimulationParams load(String name) throws IOException {
        Path file = fileFor(name);
        if (!Files.exists(file)) {
            throw new NoSuchFileException(file.toString(), null, "Набор параметров не найден: " + name);
        }
        return readFile(file);
    }

    public boolean delete(String name) throws IOException {
        return Files.deleteIfExists(fileFor(name));
    }

    /** Имена сохранённых наборов по алфавиту. */
    public List<String> list() throws IOException {
        List<String> names = new ArrayList<>();
        if (!Files.isDirectory(directory)) return names;
        try (Stream<Path> files = Files.list(directory)) {
            files.map(f -> f.getFileName().toString())
                    .filter(n -> n.endsWith(EXTENSION))
                    .map(n -> n.substring(0, n.length() - EXTENSION.length()))
                    .filter(n -> NAME.matcher(n).matches())
                    .sorted()
                    .forEach(names::add);
        }
        return names;
    }

    private Path fileFor(String name) {
        if (name == null || !NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Недопустимое имя набора: " + name);
        }
        return directory.resolve(name + EXTENSION);
    }

    // --------- файл <-> параметры ---------

    public static SimulationParams readFile(Path file) throws IOException {
        PropertiesConfiguration cfg = new PropertiesConfiguration();
        try {
            new FileHandler(cfg).load(file.toFile());
        } catch (ConfigurationException e) {
            throw new IOException("Не удалось прочитать " + file + ": " + e.getMessage(), e);
        }
        return fromConfiguration(cfg, ScenarioFactory.defaultParams());
    }

    public static void writeFile(Path file, SimulationParams params) throws IOException {
        PropertiesConfiguration cfg = toConfiguration(params);
        try {
            new FileHandler(cfg).save(file.toFile());
        } catch (ConfigurationException e) {
            throw new IOException("Не удалось записать " + file + ": " + e.getMessage(), e);
        }
    }

    static SimulationParams fromConfiguration(PropertiesConfiguration c, SimulationParams d) {
        String strategy = c.getString(BUDGET_STRATEGY, d.getBudgetStrategy().name());

        LoanTerms m1 = d.getPrimaryMortgage();
        LoanTerms m2 = d.getSecondaryMortgage();

        return new SimulationParamsBuilder()
                .setYears(c.getInt(YEARS, d.getYears()))
                .setInvestmentReturnRate(c.getDouble(INVESTMENT_RETURN_RATE, d.getInvestmentReturnRate()))
                .setInflationRate(c.getDouble(INFLATION_RATE, d.getInflationRate()))
                .setCapitalGainsTaxRate(c.getDouble(CAPITAL_GAINS_TAX_RATE, d.getCapitalGainsTaxRate()))

                .setBudgetStrategy(BudgetStrategy.valueOf(strategy.trim().toUpperCase(Locale.ROOT)))
                .setMonthlySalary(c.getDouble(MONTHLY_SALARY, d.getMonthlySalary()))
                .setSalaryGrowthRate(c.getDouble(SALARY_GROWTH_RATE, d.getSalaryGrowthRate()))
                .setHousingBudgetPercent(c.getDouble(HOUSING_BUDGET_PERCENT, d.getHousingBudgetPercent()))
                .setHousingBudgetPercentAnnualIncrease(
                        c.getDouble(HOUSING_BUDGET_PERCENT_INCREASE, d.getHousingBudgetPercentAnnualIncrease()))
                .setPayDownMortgageEarly(c.getBoolean(PAY_DOWN_EARLY, d.isPayDownMortgageEarly()))

                .setHomePrice(c.getDouble(HOME_PRICE, d.getHomePrice()))
                .setDownPaymentPercent(c.getDouble(DOWN_PAYMENT_PERCENT, d.getDownPaymentPercent()))
                .setClosingCostsPercent(c.getDouble(CLOSING_COSTS_PERCENT, d.getClosingCostsPercent()))
                .setSellingCostsPercent(c.getDouble(SELLING_COSTS_PERCENT, d.getSellingCostsPercent()))
                .setHomeAppreciationRate(c.getDouble(APPRECIATION_RATE, d.getHomeAppreciationRate()))
                .setPropertyTaxRate(c.getDouble(PROPERTY_TAX_RATE, d.getPropertyTaxRate()))
                .setHomeInsuranceYearly(c.getDouble(INSURANCE_YEARLY, d.getHomeInsuranceYearly()))
                .setMaintenanceCostYearly(c.getDouble(MAINTENANCE_YEARLY, d.getMaintenanceCostYearly()))
                .setMarginalTaxRate(c.getDouble(MARGINAL_TAX_RATE, d.getMarginalTaxRate()))
                .setRentOutPart(c.getBoolean(RENT_OUT_PART, d.isRentOutPart()))
                .setRentOutIncome(c.getDouble(RENT_OUT_INCOME, d.getRentOutIncome()))

                .setPrimaryMortgage(new LoanTerms(0,
                        c.getDouble(M1_RATE, m1.interestRate()),
                        c.getInt(M1_TERM, m1.termYears())))
                .setUseSecondaryMortgage(c.getBoolean(M2_ENABLED, d.isUseSecondaryMortgage()))
                .setSecondaryMortgage(new LoanTerms(
                        c.getDouble(M2_AMOUNT, m2.amount()),
                        c.getDouble(M2_RATE, m2.interestRate()),
                        c.getInt(M2_TERM, m2.termYears())))
                .setPmiMonthly(c.getDouble(PMI_MONTHLY, d.getPmiMonthly()))

                .setUseSubsidizedLoan(c.getBoolean(SUBSIDIZED_ENABLED, d.isUseSubsidizedLoan()))
                .setSubsidizedLoanAmount(c.getDouble(SUBSIDIZED_AMOUNT, d.getSubsidizedLoanAmount()))
                .setSubsidizedLoanTermYears(c.getInt(SUBSIDIZED_TERM, d.getSubsidizedLoanTermYears()))

                .setMonthlyRent(c.getDouble(MONTHLY_RENT, d.getMonthlyRent()))
                .setRentInsuranceMonthly(c.getDouble(RENT_INSURANCE, d.getRentInsuranceMonthly()))
                .build();
    }

    static PropertiesConfiguration toConfiguration(SimulationParams p) {
        PropertiesConfiguration c = new PropertiesConfiguration();
        c.setProperty(YEARS, p.getYears());
        c.setProperty(INVESTMENT_RETURN_RATE, p.getInvestmentReturnRate());
        c.setProperty(INFLATION_RATE, p.getInflationRate());
        c.setProperty(CAPITAL_GAINS_TAX_RATE, p.getCapitalGainsTaxRate());

        c.setProperty(BUDGET_STRATEGY, p.getBudgetStrategy().name());
        c.setProperty(MONTHLY_SALARY, p.getMonthlySalary());
        c.setProperty(SALARY_GROWTH_RATE, p.getSalaryGrowthRate());
        c.setProperty(HOUSING_BUDGET_PERCENT, p.getHousingBudgetPercent());
        c.setProperty(HOUSING_BUDGET_PERCENT_INCREASE, p.getHousingBudgetPercentAnnualIncrease());
        c.setProperty(PAY_DOWN_EARLY, p.isPayDownMortgageEarly());

        c.setProperty(HOME_PRICE, p.getHomePrice());
        c.setProperty(DOWN_PAYMENT_PERCENT, p.getDownPaymentPercent());
        c.setProperty(CLOSING_COSTS_PERCENT, p.getClosingCostsPercent());
        c.setProperty(SELLING_COSTS_PERCENT, p.getSellingCostsPercent());
        c.setProperty(APPRECIATION_RATE, p.getHomeAppreciationRate());
        c.setProperty(PROPERTY_TAX_RATE, p.getPropertyTaxRate());
        c.setProperty(INSURANCE_YEARLY, p.getHomeInsuranceYearly());
        c.setProperty(MAINTENANCE_YEARLY, p.getMaintenanceCostYearly());
        c.setProperty(MARGINAL_TAX_RATE, p.getMarginalTaxRate());
        c.setProperty(RENT_OUT_PART, p.isRentOutPart());
        c.setProperty(RENT_OUT_INCOME, p.getRentOutIncome());

        c.setProperty(M1_RATE, p.getPrimaryMortgage().interestRate());
        c.setProperty(M1_TERM, p.getPrimaryMortgage().termYears());
        c.setProperty(M2_ENABLED, p.isUseSecondaryMortgage());
        c.setProperty(M2_AMOUNT, p.getSecondaryMortgage().amount());
        c.setProperty(M2_RATE, p.getSecondaryMortgage().interestRate());
        c.setProperty(M2_TERM, p.getSecondaryMortgage().termYears());
        c.setProperty(PMI_MONTHLY, p.getPmiMonthly());

        c.setProperty(SUBSIDIZED_ENABLED, p.isUseSubsidizedLoan());
        c.setProperty(SUBSIDIZED_AMOUNT, p.getSubsidizedLoanAmount());
        c.setProperty(SUBSIDIZED_TERM, p.getSubsidizedLoanTermYears());

        c.setProperty(MONTHLY_RENT, p.getMonthlyRent());
        c.setProperty(RENT_INSURANCE, p.getRentInsuranceMonthly());
        return c;
    }
}
