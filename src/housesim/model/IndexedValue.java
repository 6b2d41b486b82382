package housesim.model;

import housesim.config.SimulationConstants;

/**
 * Величина, которая растёт каждый месяц с постоянным множителем,
 * полученным из годовой ставки (корень 12-й степени).
 */
public class IndexedValue {

    private final double monthlyMultiplier;
    private double value;

    public IndexedValue(double initialValue, double annualRatePercent) {
        this.value = initialValue;
        this.monthlyMultiplier = monthlyMultiplier(annualRatePercent);
    }

    public static double monthlyMultiplier(double annualRatePercent) {
        return Math.pow(1 + SimulationConstants.pct(annualRatePercent), 1.0 / SimulationConstants.MONTHS_PER_YEAR);
    }

    public double get() { return value; }
    public double getMonthlyMultiplier() { return monthlyMultiplier; }

    public void advanceMonth() {
        value *= monthlyMultiplier;
    }
}
