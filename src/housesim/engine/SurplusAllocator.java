package housesim.engine;

import housesim.model.LoanKind;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Распределение излишка бюджета на стороне покупки.
 * Положительный излишек идёт по очереди получателям (каждому не больше его ёмкости),
 * остаток в портфель. Отрицательный излишек целиком списывается с портфеля.
 */
public final class SurplusAllocator {

    /**
     * Порядок досрочного погашения: вторая ипотека (обычно дороже), затем основная.
     * Льготный кредит беспроцентный и досрочно не гасится.
     */
    public static final List<LoanKind> ACCELERATION_ORDER = List.of(LoanKind.SECONDARY, LoanKind.PRIMARY);

    private SurplusAllocator() {}

    public static Allocation allocate(double surplus, List<AllocationTarget> targets) {
        Map<LoanKind, Double> extra = new EnumMap<>(LoanKind.class);
        if (surplus <= 0) {
            return new Allocation(extra, surplus);
        }

        double remaining = surplus;
        for (AllocationTarget t : targets) {
            if (remaining <= 0) break;
            if (t.capacity() <= 0) continue;
            double payment = Math.min(t.capacity(), remaining);
            extra.merge(t.loan(), payment, Double::sum);
            remaining -= payment;
        }
        return new Allocation(extra, remaining);
    }

    /**
     * Итог распределения.
     */
    public static final class Allocation {

        private final Map<LoanKind, Double> extraPrincipal;
        private final double invested;

        Allocation(Map<LoanKind, Double> extraPrincipal, double invested) {
            this.extraPrincipal = extraPrincipal;
            this.invested = invested;
        }

        public double extraFor(LoanKind kind) {
            return extraPrincipal.getOrDefault(kind, 0.0);
        }

        public double totalExtra() {
            double sum = 0.0;
            for (double v : extraPrincipal.values()) sum += v;
            return sum;
        }

        /** Взнос в портфель (может быть отрицательным). */
        public double getInvested() {
            return invested;
        }
    }
}
