package edu.brandeis.cosi103a.knockout.runner;

import edu.brandeis.cosi103a.knockout.bracket.Bracket;
import edu.brandeis.cosi103a.knockout.bracket.BracketBuilder;
import edu.brandeis.cosi103a.knockout.bracket.Round;
import edu.brandeis.cosi103a.knockout.model.FrameProbabilityModel;
import edu.brandeis.cosi103a.knockout.model.MatchProbabilityModel;
import edu.brandeis.cosi103a.knockout.model.RangePolicy;
import edu.brandeis.cosi103a.knockout.model.Scoreline;
import edu.brandeis.cosi103a.knockout.model.WarningPrinter;
import edu.brandeis.cosi103a.knockout.simulation.AggregateResult;
import edu.brandeis.cosi103a.knockout.simulation.Draw;
import edu.brandeis.cosi103a.knockout.simulation.MonteCarloAggregator;
import edu.brandeis.cosi103a.knockout.simulation.Player;
import edu.brandeis.cosi103a.knockout.simulation.PlayerForecast;
import edu.brandeis.cosi103a.knockout.simulation.SeededRandomFactory;
import edu.brandeis.cosi103a.knockout.simulation.TournamentSimulator;
import edu.brandeis.cosi103a.knockout.stats.WilsonInterval;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Locale;

/**
 * Main entry point for the knockout predictor CLI.
 *
 * <p>Invocation:
 * <pre>
 * java -jar knockout-predictor.jar worlds-2026.json \
 *   --trials 500000 --seed 42 --threads 8 \
 *   --output ./data
 * </pre>
 *
 * <p>The run file holds ratings, the first-round fixture list and the best-of schedule:
 * <pre>
 * {
 *   "name": "worlds-2026",
 *   "ratings": {"Alice": 0.61, "Bob": 0.55, ...},
 *   "fixture": [["Alice", "Bob"], ...],
 *   "bestOf": [19, 25, 25, 33, 35]
 * }
 * </pre>
 */
public class PredictionRunner {

    private static final int LEADERBOARD_SIZE = 16;

    public static void main(String[] args) {
        if (args.length < 1 || "--help".equals(args[0])) {
            printUsage();
            System.exit(args.length < 1 ? 1 : 0);
        }

        String[] remainingArgs = new String[args.length - 1];
        System.arraycopy(args, 1, remainingArgs, 0, args.length - 1);

        try {
            PredictionConfig config = parseArgs(PredictionConfigReader.read(Path.of(args[0])), remainingArgs);
            Path outputDir = parseOutputDir(remainingArgs).resolve(config.name());
            runPrediction(config, outputDir, System.out);
        } catch (Exception e) {
            System.err.println("Prediction failed: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    /**
     * Builds the bracket, simulates the configured number of tournaments and writes the
     * forecast files to {@code outputDir}.
     */
    static AggregateResult runPrediction(PredictionConfig config, Path outputDir, PrintStream out) throws Exception {
        long seed = config.seed() != null ? config.seed() : System.nanoTime();
        int trials = config.trialsOrDefault();

        Bracket bracket = BracketBuilder.buildBracket(config.numEntrants(), config.bestOf());
        if (!BracketBuilder.isStrictlyIncreasing(config.bestOf())) {
            System.err.println("Warning: best-of schedule " + config.bestOf() + " does not lengthen every round");
        }

        WarningPrinter warnings = new WarningPrinter();
        FrameProbabilityModel frameModel = new FrameProbabilityModel(
            config.scalingFactorOrDefault(), config.rangePolicyOrDefault(), warnings);
        TournamentSimulator simulator = new TournamentSimulator(frameModel);
        MonteCarloAggregator aggregator = config.parallelism() != null
            ? new MonteCarloAggregator(simulator, config.parallelism())
            : new MonteCarloAggregator(simulator);

        Draw draw = simulator.bind(bracket, config.ratings(), config.fixture());
        if (warnings.getWarningCount() > 0) {
            System.err.printf("Warning: %d pairings had frame probabilities outside [0, 1] (policy %s)%n",
                warnings.getWarningCount(), frameModel.getRangePolicy());
        }

        out.printf("Simulating %s: %d players, %d rounds, best-of %s%n",
            config.name(), bracket.numEntrants(), bracket.numRounds(), bracket.bestOfSchedule());
        printOpeningRound(draw, config, out);

        out.printf("Running %d trials on %d threads (seed %d)%n", trials, aggregator.getParallelism(), seed);
        long startNanos = System.nanoTime();
        AggregateResult result = aggregator.run(draw, trials, new SeededRandomFactory(seed));
        long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000;
        out.printf("Finished in %d ms%n", elapsedMs);

        printLeaderboard(result, out);

        ForecastFileWriter writer = new ForecastFileWriter(outputDir);
        writer.writeJson(config, seed, result);
        writer.writeCsv(result);
        out.printf("Forecast written to %s%n", outputDir);
        return result;
    }

    private static void printOpeningRound(Draw draw, PredictionConfig config, PrintStream out) {
        Round opening = draw.bracket().round(1);
        out.println();
        out.printf("Round 1 (best of %d):%n", opening.bestOf());
        for (int m = 0; m < opening.size(); m++) {
            Player player1 = draw.entrant(2 * m);
            Player player2 = draw.entrant(2 * m + 1);
            double matchProb = draw.matchWinProbability(2 * m, 2 * m + 1);
            double frameProb = FrameProbabilityModel.frameWinProb(
                player1.rating() - player2.rating(), config.scalingFactorOrDefault());
            // preview only, so always clamp
            String likeliest = MatchProbabilityModel
                .scorelineDistribution(Math.max(0.0, Math.min(1.0, frameProb)), opening.bestOf())
                .stream()
                .max(Comparator.comparingDouble(Scoreline::probability))
                .map(Scoreline::toString)
                .orElse("-");
            out.printf(Locale.ROOT, "  %-24s %5.1f%%  v  %5.1f%%  %-24s likeliest %s%n",
                player1.name(), matchProb * 100.0, (1.0 - matchProb) * 100.0, player2.name(), likeliest);
        }
        out.println();
    }

    private static void printLeaderboard(AggregateResult result, PrintStream out) {
        out.println();
        out.printf("%-24s %10s %-26s %10s%n", "Player", "Final", "Winner (95% interval)", "Odds");
        int shown = 0;
        for (PlayerForecast row : result.sortedByChampionProbability()) {
            if (shown++ == LEADERBOARD_SIZE) {
                break;
            }
            double finalProb = row.probabilities().size() > 1
                ? row.probabilities().get(row.probabilities().size() - 2)
                : 1.0;
            WilsonInterval interval = result.confidenceInterval(row.name(), result.numRounds());
            out.printf(Locale.ROOT, "%-24s %9.2f%% %-26s %10s%n",
                row.name(), finalProb * 100.0, interval.format(row.championProbability()),
                ForecastFileWriter.formatOdds(row.championOdds()));
        }
        out.println();
    }

    /**
     * Applies command-line overrides to a run file.
     *
     * @throws IllegalArgumentException on an unknown argument or a bad value
     */
    static PredictionConfig parseArgs(PredictionConfig config, String[] args) {
        for (int i = 0; i < args.length; i++) {
            if (i + 1 >= args.length) {
                throw new IllegalArgumentException("Missing value for " + args[i]);
            }
            switch (args[i]) {
                case "--name" -> config = config.withName(args[++i]);
                case "--trials" -> config = config.withTrials(Integer.parseInt(args[++i]));
                case "--seed" -> config = config.withSeed(Long.parseLong(args[++i]));
                case "--threads" -> config = config.withParallelism(Integer.parseInt(args[++i]));
                case "--scaling" -> config = config.withScalingFactor(Double.parseDouble(args[++i]));
                case "--range-policy" -> {
                    String policy = args[++i];
                    try {
                        config = config.withRangePolicy(RangePolicy.valueOf(policy.toUpperCase(Locale.ROOT)));
                    } catch (IllegalArgumentException e) {
                        throw new IllegalArgumentException("Unknown range policy: " + policy
                            + " (expected unclamped, clamp or reject)");
                    }
                }
                case "--output" -> i++; // consumed but stored separately
                default -> throw new IllegalArgumentException("Unknown argument: " + args[i]);
            }
        }

        if (config.name() == null || config.name().isBlank()) {
            throw new IllegalArgumentException("Missing run name: set \"name\" in the run file or pass --name");
        }
        return config;
    }

    static Path parseOutputDir(String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            if ("--output".equals(args[i])) {
                return Path.of(args[i + 1]);
            }
        }
        return Path.of("./data");
    }

    private static void printUsage() {
        System.err.println("Usage: java -jar knockout-predictor.jar <run-file.json> [options]");
        System.err.println();
        System.err.println("Arguments:");
        System.err.println("  <run-file.json>            Ratings, first-round fixtures and best-of schedule");
        System.err.println();
        System.err.println("Options:");
        System.err.println("  --name <name>              Run name (default: from the run file)");
        System.err.println("  --trials <n>               Number of simulated tournaments (default: 100000)");
        System.err.println("  --seed <n>                 Run seed for reproducible results (default: random)");
        System.err.println("  --threads <n>              Worker threads (default: up to 8)");
        System.err.println("  --scaling <k>              Frame model slope (default: 0.7)");
        System.err.println("  --range-policy <policy>    unclamped, clamp or reject (default: clamp)");
        System.err.println("  --output <dir>             Output directory (default: ./data)");
        System.err.println();
        System.err.println("Example:");
        System.err.println("  java -jar knockout-predictor.jar worlds-2026.json \\");
        System.err.println("    --trials 500000 --seed 42 --output ./data");
    }
}
