package housesim.analysis;

import housesim.config.SimulationParams;
import housesim.config.SimulationParamsBuilder;

import java.util.function.ToDoubleFunction;

/**
 * Параметры, которые можно варьировать в перерасчётах и при поиске точки безубыточности.
 * Для каждого задано, как прочитать значение из параметров и как его подставить.
 */
public enum SweepParameter {

    // Рынок
    INVESTMENT_RETURN_RATE("Invest. Return Rate (%)",
            SimulationParams::getInvestmentReturnRate,
            SimulationParamsBuilder::setInvestmentReturnRate),
    INFLATION_RATE("Inflation Rate (%)",
            SimulationParams::getInflationRate,
            SimulationParamsBuilder::setInflationRate),
    HOME_APPRECIATION_RATE("Home Appreciation Rate (%)",
            SimulationParams::getHomeAppreciationRate,
            SimulationParamsBuilder::setHomeAppreciationRate),

    // Кредит
    PRIMARY_MORTGAGE_RATE("Mortgage 1 Rate (%)",
            p -> p.getPrimaryMortgage().interestRate(),
            (b, v) -> b.setPrimaryMortgage(b.getPrimaryMortgage().withInterestRate(v))),

    // Покупка / аренда
    HOME_PRICE("Home Price",
            SimulationParams::getHomePrice,
            SimulationParamsBuilder::setHomePrice),
    DOWN_PAYMENT_PERCENT("Down Payment (%)",
            SimulationParams::getDownPaymentPercent,
            SimulationParamsBuilder::setDownPaymentPercent),
    MONTHLY_RENT("Monthly Rent",
            SimulationParams::getMonthlyRent,
            SimulationParamsBuilder::setMonthlyRent),

    // Бюджет
    HOUSING_BUDGET_PERCENT("Housing Allocation (%)",
            SimulationParams::getHousingBudgetPercent,
            SimulationParamsBuilder::setHousingBudgetPercent),
    HORIZON_YEARS("Duration (Years)",
            SimulationParams::getYears,
            (b, v) -> b.setYears((int) Math.round(v)));

    private final String label;
    private final ToDoubleFunction<SimulationParams> reader;
    private final ParamApplier applier;

    SweepParameter(String label, ToDoubleFunction<SimulationParams> reader, ParamApplier applier) {
        this.label = label;
        this.reader = reader;
        this.applier = applier;
    }

    public String getLabel() {
        return label;
    }

    public double read(SimulationParams p) {
        return reader.applyAsDouble(p);
    }

    /**
     * Копия base с подставленным значением.
     */
    public SimulationParams apply(SimulationParams base, double value) {
        SimulationParamsBuilder b = SimulationParamsBuilder.from(base);
        applier.apply(b, value);
        return b.build();
    }
}
