package housesim.io;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import housesim.ScenarioFactory;
import housesim.config.SimulationParams;
import housesim.engine.SimulationEngine;
import housesim.engine.SimulationResult;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class ResultsCsvWriterTest {

    @TempDir
    Path dir;

    @Test
    void writesAllFourSections() throws Exception {
        SimulationParams p = ScenarioFactory.defaultBuilder().setYears(3).build();
        SimulationResult r = new SimulationEngine().run(p);
        Path out = dir.resolve("results.csv");

        ResultsCsvWriter.write(out.toString(), p, r);
        List<String> lines = Files.readAllLines(out, StandardCharsets.UTF_8);

        assertEquals("SIMULATION RESULTS SUMMARY", lines.get(0));
        assertEquals("Metric,Value", lines.get(1));
        assertEquals(String.format(Locale.US, "Final Buying Net Worth,%.2f", r.summary().finalNetWorthBuy()),
                lines.get(2));
        assertTrue(lines.contains("Duration (Years),3"));
        assertTrue(lines.contains("Monthly Rent,2500"));
        assertTrue(lines.contains("Home Appreciation Rate (%),4"));

        int yearlyHeader = lines.indexOf("YEARLY DATA (NET WORTH & EQUITY CHARTS)");
        assertTrue(yearlyHeader > 0);
        assertTrue(lines.get(yearlyHeader + 2).startsWith("1,"));
        assertTrue(lines.get(yearlyHeader + 4).startsWith("3,"));
        assertEquals("", lines.get(yearlyHeader + 5));

        int monthlyHeader = lines.indexOf("MONTHLY DATA (MORTGAGE SCHEDULE CHART)");
        assertEquals(monthlyHeader + 2 + 36, lines.size());
        assertTrue(lines.get(lines.size() - 1).startsWith("36,"));
    }

    @Test
    void cellsWithSeparatorsAreQuoted() {
        assertEquals("plain", ResultsCsvWriter.csvCell("plain"));
        assertEquals("\"a,b\"", ResultsCsvWriter.csvCell("a,b"));
        assertEquals("\"say \"\"hi\"\"\"", ResultsCsvWriter.csvCell("say \"hi\""));
    }
}
