package housesim.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import housesim.ScenarioFactory;
import org.junit.jupiter.api.Test;

final class SimulationParamsBuilderTest {

    @Test
    void derivedAmountsFollowPercentages() {
        SimulationParams p = ScenarioFactory.defaultParams();

        assertEquals(100_000.0, p.getDownPaymentAmount(), 1e-9);
        assertEquals(15_000.0, p.getClosingCostsAmount(), 1e-9);
        assertEquals(115_000.0, p.getInitialOutlay(), 1e-9);
        assertFalse(p.isSalaryBased());
    }

    @Test
    void fromCopiesEveryFieldAndLeavesBaseUntouched() {
        SimulationParams base = ScenarioFactory.defaultParams();
        SimulationParams changed = SimulationParamsBuilder.from(base)
                .setBudgetStrategy(BudgetStrategy.SALARY_BASED)
                .setMonthlyRent(1800)
                .build();

        assertTrue(changed.isSalaryBased());
        assertEquals(1800.0, changed.getMonthlyRent());
        assertEquals(2500.0, base.getMonthlyRent());

        assertEquals(base.getYears(), changed.getYears());
        assertEquals(base.getHomePrice(), changed.getHomePrice());
        assertEquals(base.getPrimaryMortgage(), changed.getPrimaryMortgage());
        assertEquals(base.getSecondaryMortgage(), changed.getSecondaryMortgage());
        assertEquals(base.getSubsidizedLoanAmount(), changed.getSubsidizedLoanAmount());
        assertEquals(base.getSubsidizedLoanTermYears(), changed.getSubsidizedLoanTermYears());
        assertEquals(base.getRentInsuranceMonthly(), changed.getRentInsuranceMonthly());
    }

    @Test
    void loanTermsWithersReplaceOneField() {
        LoanTerms t = new LoanTerms(50_000, 8.0, 15);

        assertEquals(new LoanTerms(50_000, 5.0, 15), t.withInterestRate(5.0));
        assertEquals(new LoanTerms(10_000, 8.0, 15), t.withAmount(10_000));
        assertEquals(new LoanTerms(50_000, 8.0, 20), t.withTermYears(20));
    }

    @Test
    void missingStrategyIsRejected() {
        SimulationParamsBuilder b = ScenarioFactory.defaultBuilder().setBudgetStrategy(null);
        assertThrows(NullPointerException.class, b::build);
    }
}
