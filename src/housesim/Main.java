package housesim;

import housesim.analysis.BreakEven;
import housesim.analysis.BreakEvenSolver;
import housesim.analysis.ParameterSweep;
import housesim.analysis.SweepParameter;
import housesim.analysis.SweepPoint;
import housesim.config.SimulationParams;
import housesim.engine.SimulationEngine;
import housesim.engine.SimulationResult;
import housesim.engine.SimulationSummary;
import housesim.io.ReportExcelWriter;
import housesim.io.ResultsCsvWriter;
import housesim.io.ScenarioStore;
import housesim.io.SweepResultsExcelWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import java.util.OptionalInt;

/**
 * Запуск: {@code Main [SINGLE|SWEEP_1|SWEEP_2|BREAK_EVEN] [params.properties|-] [outDir]}.
 * Без аргументов: SINGLE на параметрах по умолчанию, вывод в текущий каталог.
 */
public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public enum RunMode {SINGLE, SWEEP_1, SWEEP_2, BREAK_EVEN}

    // оси перебора
    static final SweepParameter SWEEP_PARAM_1 = SweepParameter.INVESTMENT_RETURN_RATE;
    static final SweepParameter SWEEP_PARAM_2 = SweepParameter.HOME_APPRECIATION_RATE;
    static final double[] PARAM_1 = ParameterSweep.grid(2.0, 10.0, 9);
    static final double[] PARAM_2 = ParameterSweep.grid(0.0, 6.0, 7);

    // отрезок поиска безубыточной аренды
    static final SweepParameter BREAK_EVEN_PARAM = SweepParameter.MONTHLY_RENT;
    static final double BREAK_EVEN_LO = 100.0;
    static final double BREAK_EVEN_HI = 20_000.0;

    public static void main(String[] args) {
        try {
            run(args);
        } catch (Exception e) {
            log.error("Ошибка: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    static void run(String[] args) throws Exception {

        RunMode mode = args.length > 0 ? RunMode.valueOf(args[0].toUpperCase(Locale.ROOT)) : RunMode.SINGLE;
        SimulationParams params = (args.length > 1 && !"-".equals(args[1]))
                ? ScenarioStore.readFile(Paths.get(args[1]))
                : ScenarioFactory.defaultParams();
        Path outDir = args.length > 2 ? Paths.get(args[2]) : Paths.get(".");
        Files.createDirectories(outDir);

        log.info("mode={}, years={}, out={}", mode, params.getYears(), outDir.toAbsolutePath());

        SimulationEngine engine = new SimulationEngine();

        switch (mode) {
            case SINGLE: {
                SimulationResult result = engine.run(params);
                printSummary(result);

                OptionalInt ahead = BreakEvenSolver.firstYearBuyAhead(result);
                System.out.println(ahead.isPresent()
                        ? "Buying pulls ahead in year " + ahead.getAsInt()
                        : "Buying never pulls ahead within the horizon");

                String xlsx = outDir.resolve("results.xlsx").toString();
                String csv = outDir.resolve("results.csv").toString();
                ReportExcelWriter.writeXlsx(xlsx, params, result);
                ResultsCsvWriter.write(csv, params, result);
                System.out.println("Saved: " + xlsx);
                System.out.println("Saved: " + csv);
                break;
            }
            case SWEEP_1: {
                ParameterSweep sweep = new ParameterSweep(engine);
                List<SweepPoint> points = sweep.sweep1(params, SWEEP_PARAM_1, PARAM_1);
                String xlsx = outDir.resolve("sweep.xlsx").toString();
                SweepResultsExcelWriter.writeXlsx(xlsx, params, SWEEP_PARAM_1, PARAM_1, null, null, points);
                System.out.println("Saved: " + xlsx);
                break;
            }
            case SWEEP_2: {
                ParameterSweep sweep = new ParameterSweep(engine);
                List<SweepPoint> points = sweep.sweep2(params, SWEEP_PARAM_1, PARAM_1, SWEEP_PARAM_2, PARAM_2);
                String xlsx = outDir.resolve("sweep.xlsx").toString();
                SweepResultsExcelWriter.writeXlsx(xlsx, params, SWEEP_PARAM_1, PARAM_1, SWEEP_PARAM_2, PARAM_2, points);
                System.out.println("Saved: " + xlsx);
                break;
            }
            case BREAK_EVEN: {
                BreakEven be = new BreakEvenSolver(engine).solve(params, BREAK_EVEN_PARAM, BREAK_EVEN_LO, BREAK_EVEN_HI);
                if (be.bracketed()) {
                    System.out.printf(Locale.US, "Break-even %s: %.2f%n", BREAK_EVEN_PARAM.getLabel(), be.value());
                } else {
                    System.out.printf(Locale.US, "No break-even %s in [%.0f, %.0f] (advantage %.2f .. %.2f)%n",
                            BREAK_EVEN_PARAM.getLabel(), BREAK_EVEN_LO, BREAK_EVEN_HI,
                            be.advantageAtLow(), be.advantageAtHigh());
                }
                break;
            }
            default:
                throw new IllegalStateException("Unknown mode: " + mode);
        }
    }

    private static void printSummary(SimulationResult result) {
        SimulationSummary s = result.summary();
        System.out.printf(Locale.US, "Final net worth: buy=%.2f rent=%.2f (%s)%n",
                s.finalNetWorthBuy(), s.finalNetWorthRent(),
                s.buyAdvantage() >= 0 ? "buying wins" : "renting wins");
        System.out.printf(Locale.US, "Interest=%.2f principal=%.2f rent=%.2f initial outlay=%.2f%n",
                s.totalInterestPaid(), s.totalPrincipalPaid(), s.totalRentPaid(), s.initialOutlay());
    }
}
