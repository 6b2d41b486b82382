package housesim.analysis;

import housesim.config.SimulationParams;
import housesim.engine.SimulationEngine;
import housesim.engine.SimulationResult;
import housesim.engine.YearlyRecord;
import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.analysis.solvers.BrentSolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.OptionalInt;

/**
 * Поиск значения параметра, при котором итоговая чистая стоимость
 * покупки и аренды совпадает.
 */
public final class BreakEvenSolver {

    private static final Logger log = LoggerFactory.getLogger(BreakEvenSolver.class);

    public static final double DEFAULT_ABSOLUTE_ACCURACY = 1e-6;
    public static final int DEFAULT_MAX_EVALUATIONS = 200;

    private final SimulationEngine engine;
    private final double absoluteAccuracy;
    private final int maxEvaluations;

    public BreakEvenSolver(SimulationEngine engine) {
        this(engine, DEFAULT_ABSOLUTE_ACCURACY, DEFAULT_MAX_EVALUATIONS);
    }

    public BreakEvenSolver(SimulationEngine engine, double absoluteAccuracy, int maxEvaluations) {
        this.engine = engine;
        this.absoluteAccuracy = absoluteAccuracy;
        this.maxEvaluations = maxEvaluations;
    }

    public BreakEven solve(SimulationParams base, SweepParameter param, double lo, double hi) {
        if (!(hi > lo)) {
            throw new IllegalArgumentException("hi <= lo for " + param + ": [" + lo + ", " + hi + "]");
        }

        UnivariateFunction advantage = x -> engine.run(param.apply(base, x)).summary().buyAdvantage();

        double fLo = advantage.value(lo);
        double fHi = advantage.value(hi);

        if (fLo == 0.0) return new BreakEven(param, true, lo, fLo, fHi, 0);
        if (fHi == 0.0) return new BreakEven(param, true, hi, fLo, fHi, 0);

        if (Math.signum(fLo) == Math.signum(fHi)) {
            log.info("break-even {}: no sign change on [{}, {}]", param, lo, hi);
            return BreakEven.notBracketed(param, fLo, fHi);
        }

        BrentSolver solver = new BrentSolver(absoluteAccuracy);
        double root = solver.solve(maxEvaluations, advantage, lo, hi);
        log.info("break-even {} = {} ({} evaluations)", param, root, solver.getEvaluations());
        return new BreakEven(param, true, root, fLo, fHi, solver.getEvaluations());
    }

    /**
     * Первый год, в котором чистая стоимость покупки не меньше аренды.
     */
    public static OptionalInt firstYearBuyAhead(SimulationResult result) {
        for (YearlyRecord y : result.yearlyData()) {
            if (y.buyTotalNetWorth() >= y.rentTotalNetWorth()) {
                return OptionalInt.of(y.year());
            }
        }
        return OptionalInt.empty();
    }
}
