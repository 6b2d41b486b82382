package housesim.analysis;

import housesim.config.SimulationParams;
import housesim.engine.SimulationEngine;
import housesim.engine.SimulationSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Перерасчёт по сетке значений одного или двух параметров.
 */
public final class ParameterSweep {

    private static final Logger log = LoggerFactory.getLogger(ParameterSweep.class);

    private final SimulationEngine engine;

    public ParameterSweep(SimulationEngine engine) {
        this.engine = engine;
    }

    public List<SweepPoint> sweep1(SimulationParams base, SweepParameter p, double[] values) {
        requireValues(p, values);
        List<SweepPoint> points = new ArrayList<>(values.length);
        for (double v : values) {
            SimulationSummary s = engine.run(p.apply(base, v)).summary();
            points.add(new SweepPoint(v, Double.NaN, s.finalNetWorthBuy(), s.finalNetWorthRent()));
        }
        log.info("sweep {}: {} points", p, points.size());
        return points;
    }

    /**
     * Точки идут построчно: для каждого значения p1 все значения p2.
     */
    public List<SweepPoint> sweep2(SimulationParams base,
                                   SweepParameter p1, double[] values1,
                                   SweepParameter p2, double[] values2) {
        requireValues(p1, values1);
        requireValues(p2, values2);
        if (p1 == p2) {
            throw new IllegalArgumentException("Одинаковые параметры по двум осям: " + p1);
        }

        List<SweepPoint> points = new ArrayList<>(values1.length * values2.length);
        for (double v1 : values1) {
            SimulationParams row = p1.apply(base, v1);
            for (double v2 : values2) {
                SimulationSummary s = engine.run(p2.apply(row, v2)).summary();
                points.add(new SweepPoint(v1, v2, s.finalNetWorthBuy(), s.finalNetWorthRent()));
            }
        }
        log.info("sweep {} x {}: {} points", p1, p2, points.size());
        return points;
    }

    /** Равномерная сетка из n точек от min до max включительно. */
    public static double[] grid(double min, double max, int n) {
        if (n < 1) throw new IllegalArgumentException("n < 1");
        if (max < min) throw new IllegalArgumentException("max < min");
        double[] out = new double[n];
        if (n == 1) {
            out[0] = min;
            return out;
        }
        double step = (max - min) / (n - 1);
        for (int i = 0; i < n; i++) {
            out[i] = min + i * step;
        }
        out[n - 1] = max;
        return out;
    }

    private static void requireValues(SweepParameter p, double[] values) {
        if (values == null || values.length == 0) {
            throw new IllegalArgumentException("Пустая сетка для " + p);
        }
    }
}
