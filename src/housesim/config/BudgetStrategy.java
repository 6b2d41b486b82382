package housesim.config;

/**
 * Способ определения месячного бюджета на жильё.
 */
public enum BudgetStrategy {
    SALARY_BASED,  // фиксированная доля текущей зарплаты
    AUTO_MATCH     // бюджет = max(стоимость покупки, стоимость аренды)
}
