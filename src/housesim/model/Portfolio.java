package housesim.model;

import housesim.config.SimulationConstants;

/**
 * Инвестиционный портфель: рыночная стоимость с ежемесячной капитализацией
 * и сумма внесённых средств для расчёта налога на прирост.
 * Взнос может быть отрицательным (изъятие на покрытие дефицита).
 */
public class Portfolio {

    private double value;
    private double contributed;

    public Portfolio(double initialDeposit) {
        this.value = initialDeposit;
        this.contributed = initialDeposit;
    }

    public double getValue() { return value; }
    public double getContributed() { return contributed; }

    /**
     * 1 месяц: капитализация по ставке, затем взнос.
     */
    public void advanceMonth(double monthlyRate, double contribution) {
        value = value * (1 + monthlyRate) + contribution;
        contributed += contribution;
    }

    public double unrealizedGain() {
        return Math.max(0.0, value - contributed);
    }

    /**
     * Стоимость после условной продажи: налог берётся только с прироста,
     * убытки не зачитываются.
     */
    public double afterTaxValue(double capitalGainsTaxPercent) {
        if (value > contributed) {
            double gain = value - contributed;
            return value - gain * SimulationConstants.pct(capitalGainsTaxPercent);
        }
        return value;
    }
}
