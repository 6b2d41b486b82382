package housesim.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;

import housesim.model.LoanKind;
import java.util.List;
import org.junit.jupiter.api.Test;

final class SurplusAllocatorTest {

    private static final List<AllocationTarget> TARGETS = List.of(
            new AllocationTarget(LoanKind.SECONDARY, 300),
            new AllocationTarget(LoanKind.PRIMARY, 1000));

    @Test
    void fillsTargetsInOrder() {
        SurplusAllocator.Allocation a = SurplusAllocator.allocate(500, TARGETS);

        assertEquals(300.0, a.extraFor(LoanKind.SECONDARY), 1e-12);
        assertEquals(200.0, a.extraFor(LoanKind.PRIMARY), 1e-12);
        assertEquals(0.0, a.getInvested(), 1e-12);
        assertEquals(500.0, a.totalExtra(), 1e-12);
    }

    @Test
    void remainderGoesToPortfolio() {
        SurplusAllocator.Allocation a = SurplusAllocator.allocate(2000, TARGETS);

        assertEquals(300.0, a.extraFor(LoanKind.SECONDARY), 1e-12);
        assertEquals(1000.0, a.extraFor(LoanKind.PRIMARY), 1e-12);
        assertEquals(700.0, a.getInvested(), 1e-12);
    }

    @Test
    void deficitIsWithdrawnFromPortfolio() {
        SurplusAllocator.Allocation a = SurplusAllocator.allocate(-250, TARGETS);

        assertEquals(0.0, a.totalExtra());
        assertEquals(-250.0, a.getInvested());
    }

    @Test
    void noTargetsMeansEverythingInvested() {
        SurplusAllocator.Allocation a = SurplusAllocator.allocate(400, List.of());

        assertEquals(0.0, a.extraFor(LoanKind.PRIMARY));
        assertEquals(400.0, a.getInvested());
    }

    @Test
    void paidOffLoanIsSkipped() {
        List<AllocationTarget> targets = List.of(
                new AllocationTarget(LoanKind.SECONDARY, 0),
                new AllocationTarget(LoanKind.PRIMARY, 1000));
        SurplusAllocator.Allocation a = SurplusAllocator.allocate(400, targets);

        assertEquals(0.0, a.extraFor(LoanKind.SECONDARY));
        assertEquals(400.0, a.extraFor(LoanKind.PRIMARY), 1e-12);
    }
}
