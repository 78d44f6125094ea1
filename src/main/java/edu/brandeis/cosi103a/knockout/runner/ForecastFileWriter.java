package edu.brandeis.cosi103a.knockout.runner;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import edu.brandeis.cosi103a.knockout.bracket.Bracket;
import edu.brandeis.cosi103a.knockout.simulation.AggregateResult;
import edu.brandeis.cosi103a.knockout.simulation.PlayerForecast;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Writes forecast.json and forecast.csv for a finished run.
 * Both files are written to a temporary name first and moved into place.
 */
public class ForecastFileWriter {

    public static final String JSON_FILE = "forecast.json";
    public static final String CSV_FILE = "forecast.csv";

    private final Path outputDir;
    private final ObjectMapper objectMapper;

    public ForecastFileWriter(Path outputDir) {
        this.outputDir = outputDir;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Writes forecast.json: run metadata, stage names, and one row per player.
     * Infinite odds are written as the string "Infinity".
     */
    public void writeJson(PredictionConfig config, long seed, AggregateResult result) throws IOException {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("name", config.name());
        document.put("config", Map.of(
            "trials", result.numTrials(),
            "seed", seed,
            "scalingFactor", config.scalingFactorOrDefault(),
            "rangePolicy", config.rangePolicyOrDefault().name(),
            "bestOf", result.bracket().bestOfSchedule()
        ));
        document.put("stages", stageLabels(result.bracket()));
        document.put("players", result.rows());
        writeAtomically(JSON_FILE, objectMapper.writeValueAsString(document));
    }

    /**
     * Writes forecast.csv: name, rating, a probability column per stage, then an odds
     * column per stage. Infinite odds are written as {@code inf}.
     */
    public void writeCsv(AggregateResult result) throws IOException {
        List<String> stages = stageLabels(result.bracket());
        StringBuilder csv = new StringBuilder("name,rating");
        for (String stage : stages) {
            csv.append(',').append(stage).append(" probability");
        }
        for (String stage : stages) {
            csv.append(',').append(stage).append(" odds");
        }
        csv.append('\n');

        for (PlayerForecast row : result.rows()) {
            csv.append(quote(row.name())).append(',').append(row.rating());
            for (double p : row.probabilities()) {
                csv.append(',').append(String.format(Locale.ROOT, "%.6f", p));
            }
            for (double odds : row.odds()) {
                csv.append(',').append(formatOdds(odds));
            }
            csv.append('\n');
        }
        writeAtomically(CSV_FILE, csv.toString());
    }

    static String formatOdds(double odds) {
        return Double.isInfinite(odds) ? "inf" : String.format(Locale.ROOT, "%.3f", odds);
    }

    private static List<String> stageLabels(Bracket bracket) {
        List<String> labels = new ArrayList<>();
        for (int round = 1; round <= bracket.numRounds(); round++) {
            labels.add(bracket.stageLabel(round));
        }
        return labels;
    }

    private static String quote(String value) {
        if (value.contains(",") || value.contains("\"")) {
            return '"' + value.replace("\"", "\"\"") + '"';
        }
        return value;
    }

    private void writeAtomically(String filename, String content) throws IOException {
        Files.createDirectories(outputDir);
        Path target = outputDir.resolve(filename);
        Path temp = outputDir.resolve(filename + ".tmp");
        Files.writeString(temp, content);
        Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    }
}
