package housesim.analysis;

/**
 * Одна точка перерасчёта. Для одномерного перебора value2 = NaN.
 */
public record SweepPoint(double value1,
                         double value2,
                         double finalNetWorthBuy,
                         double finalNetWorthRent) {

    public double buyAdvantage() {
        return finalNetWorthBuy - finalNetWorthRent;
    }
}
