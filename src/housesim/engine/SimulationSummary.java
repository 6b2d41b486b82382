package housesim.engine;

/**
 * Итоги прогона.
 */
public record SimulationSummary(double finalNetWorthBuy,
                                double finalNetWorthRent,
                                double totalInterestPaid,
                                double totalRentPaid,
                                double totalPrincipalPaid,
                                double initialOutlay) {

    /** Преимущество покупки: buy − rent. */
    public double buyAdvantage() {
        return finalNetWorthBuy - finalNetWorthRent;
    }
}
