package housesim.config;

/**
 * Глобальные константы симуляции.
 */
public final class SimulationConstants {

    /** Остаток кредита ниже этого значения считается погашенным (в валюте). */
    public static final double BALANCE_EPSILON = 0.01;

    public static final int MONTHS_PER_YEAR = 12;

    /** Верхняя граница доли зарплаты на жильё, %. */
    public static final double MAX_HOUSING_BUDGET_PERCENT = 100.0;

    private SimulationConstants() {}

    /** Перевод процентов в доли. */
    public static double pct(double percent) {
        return percent / 100.0;
    }
}
