package housesim.engine;

/**
 * Годовой срез. Портфели указаны за вычетом условного налога на прирост.
 */
public record YearlyRecord(int year,
                           double homeValue,
                           double mortgageBalance,
                           double equity,
                           double buyScenarioCashFlow,
                           double buyScenarioPortfolio,
                           double buyTotalNetWorth,
                           double yearlyInterestPaid,
                           double yearlyPrincipalPaid,
                           double rentCost,
                           double rentScenarioPortfolio,
                           double rentTotalNetWorth) {
}
