package housesim.engine;

import java.util.List;

/**
 * Результат одного прогона симуляции.
 */
public record SimulationResult(List<MonthlyRecord> monthlyData,
                               List<YearlyRecord> yearlyData,
                               SimulationSummary summary) {

    public SimulationResult {
        monthlyData = List.copyOf(monthlyData);
        yearlyData = List.copyOf(yearlyData);
    }
}
