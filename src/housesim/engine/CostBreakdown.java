package housesim.engine;

import housesim.config.SimulationConstants;
import housesim.config.SimulationParams;
import housesim.model.LoanPayment;

/**
 * Затраты одного месяца по обоим сценариям.
 *
 * @param debtService     фиксированные ежемесячные платежи по всем кредитам
 * @param propertyTax     налог на недвижимость
 * @param maintenance     содержание
 * @param homeInsurance   страховка жилья (индексируется инфляцией)
 * @param taxShield       налоговый вычет с процентов и налога на недвижимость
 * @param netRentalIncome доход от сдачи части жилья после налога
 * @param netBuyCost      чистая стоимость владения
 * @param totalRentCost   аренда + страховка арендатора
 */
public record CostBreakdown(double debtService,
                            double propertyTax,
                            double maintenance,
                            double homeInsurance,
                            double taxShield,
                            double netRentalIncome,
                            double netBuyCost,
                            double totalRentCost) {

    /**
     * @param month          номер месяца, с 1
     * @param homeValue      стоимость жилья на начало месяца
     * @param debtService    сумма аннуитетных платежей, рассчитанных при выдаче кредитов
     * @param primary        проценты/основной долг текущего месяца по основной ипотеке
     * @param secondary      то же по второй ипотеке
     * @param rentOutIncome  текущий валовый доход от сдачи (0 если не сдаётся)
     * @param rent           текущая аренда
     * @param rentInsurance  текущая страховка арендатора
     */
    public static CostBreakdown compute(SimulationParams p,
                                        int month,
                                        double homeValue,
                                        double debtService,
                                        LoanPayment primary,
                                        LoanPayment secondary,
                                        double rentOutIncome,
                                        double rent,
                                        double rentInsurance) {

        int mpy = SimulationConstants.MONTHS_PER_YEAR;
        double marginal = SimulationConstants.pct(p.getMarginalTaxRate());

        double propertyTax = homeValue * SimulationConstants.pct(p.getPropertyTaxRate()) / mpy;
        double maintenance = homeValue * SimulationConstants.pct(p.getMaintenanceCostYearly()) / mpy;
        double inflationFactor = Math.pow(1 + SimulationConstants.pct(p.getInflationRate()), (month - 1) / (double) mpy);
        double homeInsurance = p.getHomeInsuranceYearly() * inflationFactor / mpy;

        double taxShield = (primary.interest() + secondary.interest() + propertyTax) * marginal;

        double netRentalIncome = 0.0;
        if (p.isRentOutPart()) {
            netRentalIncome = rentOutIncome - rentOutIncome * marginal;
        }

        double gross = debtService + propertyTax + maintenance + homeInsurance + p.getPmiMonthly();
        double netBuyCost = gross - taxShield - netRentalIncome;

        return new CostBreakdown(
                debtService,
                propertyTax,
                maintenance,
                homeInsurance,
                taxShield,
                netRentalIncome,
                netBuyCost,
                rent + rentInsurance
        );
    }
}
