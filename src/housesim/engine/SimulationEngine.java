package housesim.engine;

import housesim.config.SimulationConstants;
import housesim.config.SimulationParams;
import housesim.model.IndexedValue;
import housesim.model.Loan;
import housesim.model.LoanKind;
import housesim.model.LoanPayment;
import housesim.model.LoanStack;
import housesim.model.Portfolio;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Помесячная модель "покупка с ипотекой vs аренда с инвестированием разницы".
 * <p>
 * Каждый месяц:
 * 1) обязательные платежи по кредитам;
 * 2) чистая стоимость владения и стоимость аренды;
 * 3) бюджет и распределение излишка (досрочное погашение / портфель);
 * 4) обновление остатков, портфелей и индексируемых величин,
 *    в конце года срез чистой стоимости с учётом налогов.
 * <p>
 * Всё состояние локально для вызова {@link #run}, одинаковые параметры дают одинаковый результат.
 */
public class SimulationEngine {

    private static final Logger log = LoggerFactory.getLogger(SimulationEngine.class);

    public SimulationResult run(SimulationParams p) {

        final int mpy = SimulationConstants.MONTHS_PER_YEAR;
        final int totalMonths = Math.max(0, p.getYears()) * mpy;
        final double initialOutlay = p.getInitialOutlay();

        // --- кредиты ---
        LoanStack loans = LoanStack.from(p);
        Loan primary = loans.getPrimary();
        Loan secondary = loans.getSecondary();
        Loan subsidized = loans.getSubsidized();

        log.debug("run: months={}, loans: subsidized={}, secondary={}, primary={}",
                totalMonths, subsidized.getPrincipal(), secondary.getPrincipal(), primary.getPrincipal());

        // --- индексируемые величины ---
        IndexedValue homeValue = new IndexedValue(p.getHomePrice(), p.getHomeAppreciationRate());
        IndexedValue rent = new IndexedValue(p.getMonthlyRent(), p.getInflationRate());
        IndexedValue rentInsurance = new IndexedValue(p.getRentInsuranceMonthly(), p.getInflationRate());
        IndexedValue rentOutIncome = new IndexedValue(p.isRentOutPart() ? p.getRentOutIncome() : 0.0, p.getInflationRate());
        IndexedValue salary = new IndexedValue(p.getMonthlySalary(), p.getSalaryGrowthRate());
        double housingPercent = p.getHousingBudgetPercent();

        // --- портфели ---
        // покупка стартует с нуля, аренда со взносом и расходами на сделку
        Portfolio buyPortfolio = new Portfolio(0.0);
        Portfolio rentPortfolio = new Portfolio(initialOutlay);
        final double monthlyInvestRate = SimulationConstants.pct(p.getInvestmentReturnRate()) / mpy;

        final boolean accelerate = p.isSalaryBased() && p.isPayDownMortgageEarly();
        // платежи фиксируются при выдаче и входят в затраты весь горизонт
        final double debtService = loans.totalMonthlyPayment();

        Totals totals = new Totals();
        List<MonthlyRecord> monthly = new ArrayList<>(totalMonths);
        List<YearlyRecord> yearly = new ArrayList<>(Math.max(0, p.getYears()));

        for (int m = 1; m <= totalMonths; m++) {

            // 1) обслуживание долга
            LoanPayment primaryDue = primary.mandatoryPayment();
            LoanPayment secondaryDue = secondary.mandatoryPayment();
            LoanPayment subsidizedDue = subsidized.mandatoryPayment();

            // 2) затраты (от стоимости жилья на начало месяца)
            CostBreakdown costs = CostBreakdown.compute(
                    p, m, homeValue.get(),
                    debtService,
                    primaryDue, secondaryDue,
                    rentOutIncome.get(), rent.get(), rentInsurance.get());

            // 3) бюджет и излишек
            double budget = p.isSalaryBased()
                    ? salary.get() * SimulationConstants.pct(housingPercent)
                    : Math.max(costs.netBuyCost(), costs.totalRentCost());

            double buySurplus = budget - costs.netBuyCost();
            List<AllocationTarget> targets = accelerate
                    ? accelerationTargets(loans, primaryDue, secondaryDue)
                    : List.of();
            SurplusAllocator.Allocation allocation = SurplusAllocator.allocate(buySurplus, targets);

            double rentSurplus = budget - costs.totalRentCost();

            // 4) обновление состояния
            double extraPrimary = allocation.extraFor(LoanKind.PRIMARY);
            double extraSecondary = allocation.extraFor(LoanKind.SECONDARY);
            double primaryPaid = primaryDue.principal() + extraPrimary;
            double secondaryPaid = secondaryDue.principal() + extraSecondary;

            primary.repay(primaryPaid);
            secondary.repay(secondaryPaid);
            subsidized.repay(subsidizedDue.principal());

            buyPortfolio.advanceMonth(monthlyInvestRate, allocation.getInvested());
            rentPortfolio.advanceMonth(monthlyInvestRate, rentSurplus);

            double monthInterest = primaryDue.interest() + secondaryDue.interest();
            double monthPrincipal = primaryPaid + secondaryPaid + subsidizedDue.principal();
            totals.addMonth(monthInterest, monthPrincipal, rent.get());

            monthly.add(new MonthlyRecord(
                    m,
                    monthInterest,
                    monthPrincipal,
                    loans.totalBalance(),
                    costs.netBuyCost(),
                    costs.totalRentCost(),
                    budget,
                    buySurplus,
                    extraSecondary,
                    extraPrimary,
                    allocation.getInvested()
            ));

            homeValue.advanceMonth();
            rent.advanceMonth();
            rentInsurance.advanceMonth();
            rentOutIncome.advanceMonth();
            salary.advanceMonth();

            if (m % mpy == 0) {
                if (p.getHousingBudgetPercentAnnualIncrease() != 0) {
                    housingPercent = Math.min(SimulationConstants.MAX_HOUSING_BUDGET_PERCENT,
                            housingPercent + p.getHousingBudgetPercentAnnualIncrease());
                }

                yearly.add(snapshot(p, m / mpy, homeValue.get(), loans, buyPortfolio, rentPortfolio,
                        costs, allocation.totalExtra(), totals));
                totals.resetYear();
            }
        }

        YearlyRecord last = yearly.isEmpty() ? null : yearly.get(yearly.size() - 1);
        SimulationSummary summary = new SimulationSummary(
                last == null ? 0.0 : last.buyTotalNetWorth(),
                last == null ? 0.0 : last.rentTotalNetWorth(),
                totals.interest,
                totals.rent,
                totals.principal,
                initialOutlay
        );

        return new SimulationResult(monthly, yearly, summary);
    }

    /**
     * Получатели досрочного погашения в порядке {@link SurplusAllocator#ACCELERATION_ORDER}.
     */
    private static List<AllocationTarget> accelerationTargets(LoanStack loans,
                                                              LoanPayment primaryDue,
                                                              LoanPayment secondaryDue) {
        List<AllocationTarget> targets = new ArrayList<>(SurplusAllocator.ACCELERATION_ORDER.size());
        for (LoanKind kind : SurplusAllocator.ACCELERATION_ORDER) {
            LoanPayment due = (kind == LoanKind.SECONDARY) ? secondaryDue : primaryDue;
            targets.add(new AllocationTarget(kind, loans.get(kind).extraCapacity(due.principal())));
        }
        return targets;
    }

    private static YearlyRecord snapshot(SimulationParams p,
                                         int year,
                                         double homeValue,
                                         LoanStack loans,
                                         Portfolio buyPortfolio,
                                         Portfolio rentPortfolio,
                                         CostBreakdown lastMonthCosts,
                                         double lastMonthExtraPrincipal,
                                         Totals totals) {

        double debt = loans.totalBalance();
        double sellingCosts = homeValue * SimulationConstants.pct(p.getSellingCostsPercent());

        double netBuyPortfolio = buyPortfolio.afterTaxValue(p.getCapitalGainsTaxRate());
        double netRentPortfolio = rentPortfolio.afterTaxValue(p.getCapitalGainsTaxRate());

        double buyNetWorth = (homeValue - debt - sellingCosts) + netBuyPortfolio;

        return new YearlyRecord(
                year,
                homeValue,
                debt,
                homeValue - debt,
                lastMonthCosts.netBuyCost() + lastMonthExtraPrincipal,
                netBuyPortfolio,
                buyNetWorth,
                totals.yearInterest,
                totals.yearPrincipal,
                lastMonthCosts.totalRentCost(),
                netRentPortfolio,
                netRentPortfolio
        );
    }
}
