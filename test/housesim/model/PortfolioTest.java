package housesim.model;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

final class PortfolioTest {

    @Test
    void compoundsThenAddsContribution() {
        Portfolio p = new Portfolio(1000);
        p.advanceMonth(0.01, 100);

        assertEquals(1110.0, p.getValue(), 1e-9);
        assertEquals(1100.0, p.getContributed(), 1e-9);
        assertEquals(10.0, p.unrealizedGain(), 1e-9);
    }

    @Test
    void taxesOnlyTheGain() {
        Portfolio p = new Portfolio(1000);
        p.advanceMonth(0.01, 100);

        assertEquals(1110.0 - 10.0 * 0.30, p.afterTaxValue(30), 1e-9);
    }

    @Test
    void lossIsNotTaxed() {
        Portfolio p = new Portfolio(1000);
        p.advanceMonth(-0.10, 0);

        assertEquals(900.0, p.afterTaxValue(30), 1e-9);
        assertEquals(0.0, p.unrealizedGain());
    }

    @Test
    void negativeContributionReducesPrincipal() {
        Portfolio p = new Portfolio(0);
        p.advanceMonth(0.01, -500);

        assertEquals(-500.0, p.getValue(), 1e-9);
        assertEquals(-500.0, p.getContributed(), 1e-9);
        assertEquals(-500.0, p.afterTaxValue(30), 1e-9);
    }
}
