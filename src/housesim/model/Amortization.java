package housesim.model;

import housesim.config.SimulationConstants;

/**
 * Формула аннуитетного платежа.
 */
public final class Amortization {

    private Amortization() {}

    /**
     * Фиксированный ежемесячный платёж.
     * При нулевой ставке равные доли основного долга,
     * при неположительной сумме или сроке 0.
     *
     * @param principal         сумма кредита
     * @param annualRatePercent номинальная годовая ставка, %
     * @param years             срок, лет
     */
    public static double monthlyPayment(double principal, double annualRatePercent, int years) {
        if (principal <= 0 || years <= 0) return 0.0;
        int n = years * SimulationConstants.MONTHS_PER_YEAR;
        if (annualRatePercent == 0) return principal / n;
        double r = SimulationConstants.pct(annualRatePercent) / SimulationConstants.MONTHS_PER_YEAR;
        double growth = Math.pow(1 + r, n);
        return principal * r * growth / (growth - 1);
    }
}
