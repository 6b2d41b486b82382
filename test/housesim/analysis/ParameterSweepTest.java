package housesim.analysis;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import housesim.ScenarioFactory;
import housesim.config.SimulationParams;
import housesim.engine.SimulationEngine;
import housesim.engine.SimulationSummary;
import java.util.List;
import org.junit.jupiter.api.Test;

final class ParameterSweepTest {

    private final SimulationEngine engine = new SimulationEngine();
    private final ParameterSweep sweep = new ParameterSweep(engine);
    private final SimulationParams base = ScenarioFactory.defaultBuilder().setYears(5).build();

    @Test
    void gridIncludesBothEnds() {
        assertArrayEquals(new double[]{2, 4, 6, 8, 10}, ParameterSweep.grid(2, 10, 5), 1e-12);
        assertArrayEquals(new double[]{3}, ParameterSweep.grid(3, 7, 1));
    }

    @Test
    void gridRejectsBadArguments() {
        assertThrows(IllegalArgumentException.class, () -> ParameterSweep.grid(0, 1, 0));
        assertThrows(IllegalArgumentException.class, () -> ParameterSweep.grid(5, 1, 3));
    }

    @Test
    void oneAxisMatchesIndividualRuns() {
        double[] values = {1500, 2500, 3500};
        List<SweepPoint> points = sweep.sweep1(base, SweepParameter.MONTHLY_RENT, values);

        assertEquals(3, points.size());
        for (int i = 0; i < values.length; i++) {
            SweepPoint pt = points.get(i);
            SimulationSummary s = engine.run(SweepParameter.MONTHLY_RENT.apply(base, values[i])).summary();
            assertEquals(values[i], pt.value1());
            assertTrue(Double.isNaN(pt.value2()));
            assertEquals(s.finalNetWorthBuy(), pt.finalNetWorthBuy());
            assertEquals(s.finalNetWorthRent(), pt.finalNetWorthRent());
        }
    }

    @Test
    void higherRentFavoursBuying() {
        List<SweepPoint> points = sweep.sweep1(base, SweepParameter.MONTHLY_RENT, new double[]{1500, 2500, 3500});

        assertTrue(points.get(0).buyAdvantage() < points.get(1).buyAdvantage());
        assertTrue(points.get(1).buyAdvantage() < points.get(2).buyAdvantage());
    }

    @Test
    void twoAxesAreRowMajor() {
        double[] rates = {4, 7};
        double[] appreciation = {0, 2, 4};
        List<SweepPoint> points = sweep.sweep2(base,
                SweepParameter.INVESTMENT_RETURN_RATE, rates,
                SweepParameter.HOME_APPRECIATION_RATE, appreciation);

        assertEquals(6, points.size());
        assertEquals(4.0, points.get(0).value1());
        assertEquals(0.0, points.get(0).value2());
        assertEquals(4.0, points.get(2).value1());
        assertEquals(4.0, points.get(2).value2());
        assertEquals(7.0, points.get(3).value1());
        assertEquals(0.0, points.get(3).value2());

        SimulationParams p = SweepParameter.HOME_APPRECIATION_RATE.apply(
                SweepParameter.INVESTMENT_RETURN_RATE.apply(base, 7), 2);
        assertEquals(engine.run(p).summary().buyAdvantage(), points.get(4).buyAdvantage());
    }

    @Test
    void sameParameterOnBothAxesIsRejected() {
        double[] v = {1, 2};
        assertThrows(IllegalArgumentException.class, () -> sweep.sweep2(base,
                SweepParameter.INFLATION_RATE, v, SweepParameter.INFLATION_RATE, v));
    }

    @Test
    void emptyValuesAreRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> sweep.sweep1(base, SweepParameter.HOME_PRICE, new double[0]));
    }

    @Test
    void applyReplacesOnlyTheSweptValue() {
        SimulationParams p = SweepParameter.PRIMARY_MORTGAGE_RATE.apply(base, 3.25);

        assertEquals(3.25, SweepParameter.PRIMARY_MORTGAGE_RATE.read(p));
        assertEquals(base.getPrimaryMortgage().termYears(), p.getPrimaryMortgage().termYears());
        assertEquals(6.5, base.getPrimaryMortgage().interestRate());

        assertEquals(12, SweepParameter.HORIZON_YEARS.apply(base, 11.6).getYears());
    }
}
