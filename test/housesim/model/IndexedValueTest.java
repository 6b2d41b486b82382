package housesim.model;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

final class IndexedValueTest {

    @Test
    void twelveMonthsCompoundToAnnualRate() {
        IndexedValue v = new IndexedValue(2500, 3.0);
        for (int m = 0; m < 12; m++) v.advanceMonth();

        assertEquals(2500 * 1.03, v.get(), 1e-9);
    }

    @Test
    void zeroRateKeepsValue() {
        IndexedValue v = new IndexedValue(100, 0.0);
        v.advanceMonth();

        assertEquals(1.0, v.getMonthlyMultiplier());
        assertEquals(100.0, v.get());
    }
}
